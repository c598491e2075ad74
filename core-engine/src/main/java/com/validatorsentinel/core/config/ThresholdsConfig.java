package com.validatorsentinel.core.config;

import com.validatorsentinel.core.model.AttributeKind;
import com.validatorsentinel.core.model.Severity;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the thresholds YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * commission:
 *   rugLevel: 90
 *   cautionDelta: 10
 * mev:
 *   rugLevel: 90
 *   cautionDelta: 20
 *   enableCautionLevel: 90
 * notifySeverities: [RUG, CAUTION, INFO]
 * </pre>
 *
 * <p>
 * Omitted sections keep their defaults. A section that is present starts from
 * the {@link AttributeThresholds} field defaults, so a partial {@code mev}
 * section must spell out its {@code cautionDelta}. Call {@link #validate()}
 * after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdsConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private AttributeThresholds commission = new AttributeThresholds(90, 10, 90);

    /** MEV commission moves more, so its caution delta is twice the fee one. */
    private AttributeThresholds mev = new AttributeThresholds(90, 20, 90);

    /** Severities that produce a notification; every change class by default. */
    private List<String> notifySeverities = new ArrayList<>(List.of("RUG", "CAUTION", "INFO"));

    /**
     * @return a configuration holding the built-in defaults
     */
    public static ThresholdsConfig defaults() {
        return new ThresholdsConfig();
    }

    /**
     * @param kind the attribute
     * @return its thresholds
     */
    public AttributeThresholds forKind(AttributeKind kind) {
        return switch (kind) {
            case COMMISSION -> commission;
            case MEV -> mev;
        };
    }

    /**
     * @return the parsed notification severities
     */
    public Set<Severity> notifySeveritySet() {
        Set<Severity> result = EnumSet.noneOf(Severity.class);
        for (String label : notifySeverities) {
            Severity severity = Severity.parse(label);
            if (severity != null) {
                result.add(severity);
            }
        }
        return result;
    }

    /**
     * Validate every section of this configuration. Collects all errors and
     * throws a single exception if anything is invalid.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (commission == null) {
            errors.add("'commission' section must not be null");
        } else {
            errors.addAll(commission.validate("commission"));
        }
        if (mev == null) {
            errors.add("'mev' section must not be null");
        } else {
            errors.addAll(mev.validate("mev"));
        }
        for (String label : notifySeverities) {
            if (Severity.parse(label) == null) {
                errors.add("Unknown severity in 'notifySeverities': '" + label
                        + "'. Supported: RUG, CAUTION, INFO");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Thresholds configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public AttributeThresholds getCommission() {
        return commission;
    }

    public void setCommission(AttributeThresholds commission) {
        this.commission = commission;
    }

    public AttributeThresholds getMev() {
        return mev;
    }

    public void setMev(AttributeThresholds mev) {
        this.mev = mev;
    }

    /**
     * @return unmodifiable list of severity labels
     */
    public List<String> getNotifySeverities() {
        return Collections.unmodifiableList(notifySeverities);
    }

    public void setNotifySeverities(List<String> notifySeverities) {
        this.notifySeverities = notifySeverities != null ? new ArrayList<>(notifySeverities) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "ThresholdsConfig{" +
                "commission=" + commission +
                ", mev=" + mev +
                ", notifySeverities=" + notifySeverities +
                '}';
    }
}
