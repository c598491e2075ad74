/**
 * Domain model classes for Validator Sentinel.
 *
 * <p>
 * This package contains the immutable facts produced by the engine and the
 * inputs it consumes:
 * </p>
 * <ul>
 * <li>{@link com.validatorsentinel.core.model.ValidatorObservation}: one
 * validator's state in one observation cycle</li>
 * <li>{@link com.validatorsentinel.core.model.EntityState}: last recorded
 * state, pre-fetched before a sweep</li>
 * <li>{@link com.validatorsentinel.core.model.AttributeSnapshot},
 * {@link com.validatorsentinel.core.model.ChangeEvent} and
 * {@link com.validatorsentinel.core.model.LivenessEvent}: durable
 * records</li>
 * <li>{@link com.validatorsentinel.core.model.SweepResult}: the write set of
 * a sweep</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.validatorsentinel.core.model;
