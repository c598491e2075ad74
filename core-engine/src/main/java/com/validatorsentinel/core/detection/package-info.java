/**
 * Change detection and classification.
 *
 * <p>
 * {@link com.validatorsentinel.core.detection.DeltaDetector} decides whether
 * an observed value is written at all;
 * {@link com.validatorsentinel.core.detection.ThresholdClassifier} assigns the
 * severity of a recorded change through the per-attribute
 * {@link com.validatorsentinel.core.detection.SeverityRule} implementations
 * created by {@link com.validatorsentinel.core.detection.SeverityRuleFactory}:
 * </p>
 * <ul>
 * <li>{@link com.validatorsentinel.core.detection.CommissionSeverityRule}:
 * fee commission</li>
 * <li>{@link com.validatorsentinel.core.detection.MevSeverityRule}: MEV
 * commission, including enable/disable transitions</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To track a new attribute, add it to {@code AttributeKind}, implement
 * {@code SeverityRule} and map it in {@code SeverityRuleFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.validatorsentinel.core.detection;
