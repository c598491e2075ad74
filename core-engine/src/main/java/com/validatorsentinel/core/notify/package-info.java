/**
 * Notification delivery contract and severity-based fan-out.
 *
 * @since 1.0.0
 */
package com.validatorsentinel.core.notify;
