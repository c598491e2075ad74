/**
 * Reconstruction of daily availability from liveness transitions.
 *
 * @since 1.0.0
 */
package com.validatorsentinel.core.uptime;
