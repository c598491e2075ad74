package com.validatorsentinel.core.detection;

import com.validatorsentinel.core.model.AttributeKind;
import com.validatorsentinel.core.model.Severity;

/**
 * Contract for the per-attribute classification rules.
 * <p>
 * Implementations are <strong>stateless</strong> and must be total: every
 * combination of inputs yields a severity, none throws. Values are already
 * range-checked by {@link ThresholdClassifier}; the value on a disabled side
 * is meaningless and must be ignored.
 * </p>
 */
public interface SeverityRule {

    /**
     * Classify a transition.
     *
     * @param from         previous value
     * @param to           new value
     * @param fromDisabled {@code true} if the attribute was disabled before
     * @param toDisabled   {@code true} if the attribute is disabled now
     * @return the severity, never {@code null}
     */
    Severity evaluate(int from, int to, boolean fromDisabled, boolean toDisabled);

    /**
     * @return the attribute this rule classifies
     */
    AttributeKind getKind();
}
