package com.validatorsentinel.core.detection;

import com.validatorsentinel.core.config.ThresholdsConfig;
import com.validatorsentinel.core.model.AttributeKind;
import com.validatorsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Assigns a {@link Severity} to a before/after value pair.
 *
 * <p>
 * This is a <strong>stateless</strong>, side-effect-free classifier that
 * dispatches to the {@link SeverityRule} of the attribute. It is total over
 * all inputs: a value outside the 0 to 100 commission domain, or a missing
 * attribute kind, is logged as an anomaly and classified as
 * {@link Severity#INFO} rather than thrown.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdClassifier.class);

    static final int MIN_VALUE = 0;
    static final int MAX_VALUE = 100;

    private final Map<AttributeKind, SeverityRule> rules;

    /**
     * @param config thresholds; must not be {@code null}
     */
    public ThresholdClassifier(ThresholdsConfig config) {
        this.rules = SeverityRuleFactory.createAll(Objects.requireNonNull(config, "ThresholdsConfig must not be null"));
    }

    /**
     * @return a classifier using the built-in default thresholds
     */
    public static ThresholdClassifier withDefaults() {
        return new ThresholdClassifier(ThresholdsConfig.defaults());
    }

    /**
     * Classify a transition.
     *
     * @param from         previous value (ignored when {@code fromDisabled})
     * @param to           new value (ignored when {@code toDisabled})
     * @param fromDisabled {@code true} if the attribute was disabled
     * @param toDisabled   {@code true} if the attribute is disabled now
     * @param kind         the attribute
     * @return the severity, never {@code null}
     */
    public Severity classify(int from, int to, boolean fromDisabled, boolean toDisabled, AttributeKind kind) {
        if (kind == null) {
            LOG.warn("Classification requested without attribute kind ({} -> {}) - treating as INFO", from, to);
            return Severity.INFO;
        }
        if ((!fromDisabled && !inRange(from)) || (!toDisabled && !inRange(to))) {
            LOG.warn("Malformed {} transition {} -> {} outside [{}, {}] - treating as INFO",
                    kind, from, to, MIN_VALUE, MAX_VALUE);
            return Severity.INFO;
        }

        Severity severity = rules.get(kind).evaluate(from, to, fromDisabled, toDisabled);
        LOG.trace("Classified {} {} -> {} (fromDisabled={}, toDisabled={}) as {}",
                kind, from, to, fromDisabled, toDisabled, severity);
        return severity;
    }

    /**
     * Classify a transition where {@code null} stands for a disabled value.
     *
     * @param kind the attribute
     * @param from previous value, {@code null} if disabled
     * @param to   new value, {@code null} if disabled
     * @return the severity, never {@code null}
     */
    public Severity classify(AttributeKind kind, Integer from, Integer to) {
        return classify(from == null ? 0 : from, to == null ? 0 : to, from == null, to == null, kind);
    }

    /**
     * @param value a commission value
     * @return {@code true} if {@code value} lies in the commission domain
     */
    public static boolean inRange(int value) {
        return value >= MIN_VALUE && value <= MAX_VALUE;
    }
}
