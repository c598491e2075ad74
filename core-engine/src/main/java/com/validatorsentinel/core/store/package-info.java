/**
 * Storage contract for the engine's durable records, the in-memory adapter
 * and the read-side history queries.
 *
 * <p>
 * The engine never calls a store itself; {@link com.validatorsentinel.core.sweep.SweepRunner}
 * applies a {@link com.validatorsentinel.core.model.SweepResult} through
 * {@link com.validatorsentinel.core.store.EventStore}.
 * </p>
 *
 * @since 1.0.0
 */
package com.validatorsentinel.core.store;
