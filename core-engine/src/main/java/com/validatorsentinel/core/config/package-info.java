/**
 * Configuration loading and validation for the classification thresholds.
 *
 * <p>
 * Thresholds are defined in YAML and loaded by
 * {@link com.validatorsentinel.core.config.ThresholdsLoader} into a
 * {@link com.validatorsentinel.core.config.ThresholdsConfig} instance.
 * Validation is performed automatically after parsing to ensure fail-fast
 * behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.validatorsentinel.core.config;
