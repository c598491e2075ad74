package com.validatorsentinel.core.detection;

import com.validatorsentinel.core.config.AttributeThresholds;
import com.validatorsentinel.core.model.AttributeKind;
import com.validatorsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * MEV commission rule.
 *
 * <h3>Disabled transitions</h3>
 * <ul>
 * <li>disabled → enabled: only the new value counts. At or above
 * {@code enableCautionLevel} is a {@link Severity#CAUTION}, never a rug,
 * because delegators were earning no MEV rewards before.</li>
 * <li>enabled → disabled: {@link Severity#INFO}. Delegators lose future MEV
 * rewards but the operator keeps none of them.</li>
 * <li>disabled → disabled: {@link Severity#INFO}.</li>
 * </ul>
 *
 * <h3>Both enabled</h3>
 * <p>
 * Same shape as the fee rule with a wider caution delta: an increase to
 * {@code rugLevel} or above is a rug, an increase of at least
 * {@code cautionDelta} points is a caution.
 * </p>
 *
 * @since 1.0.0
 */
public class MevSeverityRule implements SeverityRule {

    private static final Logger LOG = LoggerFactory.getLogger(MevSeverityRule.class);

    private final int rugLevel;
    private final int cautionDelta;
    private final int enableCautionLevel;

    /**
     * @param thresholds the MEV thresholds
     * @throws NullPointerException if {@code thresholds} is {@code null}
     */
    public MevSeverityRule(AttributeThresholds thresholds) {
        Objects.requireNonNull(thresholds, "AttributeThresholds must not be null");
        this.rugLevel = thresholds.getRugLevel();
        this.cautionDelta = thresholds.getCautionDelta();
        this.enableCautionLevel = thresholds.getEnableCautionLevel();
    }

    @Override
    public Severity evaluate(int from, int to, boolean fromDisabled, boolean toDisabled) {
        if (fromDisabled && toDisabled) {
            LOG.debug("MEV transition between two disabled states - treating as INFO");
            return Severity.INFO;
        }
        if (fromDisabled) {
            return to >= enableCautionLevel ? Severity.CAUTION : Severity.INFO;
        }
        if (toDisabled) {
            return Severity.INFO;
        }

        int delta = to - from;
        if (to >= rugLevel && delta > 0) {
            return Severity.RUG;
        }
        if (delta >= cautionDelta) {
            return Severity.CAUTION;
        }
        return Severity.INFO;
    }

    @Override
    public AttributeKind getKind() {
        return AttributeKind.MEV;
    }
}
