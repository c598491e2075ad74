/**
 * Batch sweep: the orchestrator that turns observations into a write set,
 * and the runner that applies it through the storage and notification
 * collaborators.
 *
 * @since 1.0.0
 */
package com.validatorsentinel.core.sweep;
