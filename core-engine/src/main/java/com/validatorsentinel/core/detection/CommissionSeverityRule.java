package com.validatorsentinel.core.detection;

import com.validatorsentinel.core.config.AttributeThresholds;
import com.validatorsentinel.core.model.AttributeKind;
import com.validatorsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Fee commission rule.
 *
 * <ul>
 * <li>{@code to >= rugLevel} reached by an increase → {@link Severity#RUG}</li>
 * <li>an increase of at least {@code cautionDelta} that stays below
 * {@code rugLevel} → {@link Severity#CAUTION}</li>
 * <li>anything else, decreases included → {@link Severity#INFO}</li>
 * </ul>
 *
 * <p>
 * Fee commission cannot be disabled; a disabled side is an anomaly and is
 * reported as INFO.
 * </p>
 *
 * @since 1.0.0
 */
public class CommissionSeverityRule implements SeverityRule {

    private static final Logger LOG = LoggerFactory.getLogger(CommissionSeverityRule.class);

    private final int rugLevel;
    private final int cautionDelta;

    /**
     * @param thresholds the commission thresholds
     * @throws NullPointerException if {@code thresholds} is {@code null}
     */
    public CommissionSeverityRule(AttributeThresholds thresholds) {
        Objects.requireNonNull(thresholds, "AttributeThresholds must not be null");
        this.rugLevel = thresholds.getRugLevel();
        this.cautionDelta = thresholds.getCautionDelta();
    }

    @Override
    public Severity evaluate(int from, int to, boolean fromDisabled, boolean toDisabled) {
        if (fromDisabled || toDisabled) {
            LOG.warn("Fee commission reported as disabled (fromDisabled={}, toDisabled={}) - treating as INFO",
                    fromDisabled, toDisabled);
            return Severity.INFO;
        }

        int delta = to - from;
        if (to >= rugLevel && delta > 0) {
            return Severity.RUG;
        }
        if (delta >= cautionDelta && to < rugLevel) {
            return Severity.CAUTION;
        }
        return Severity.INFO;
    }

    @Override
    public AttributeKind getKind() {
        return AttributeKind.COMMISSION;
    }
}
