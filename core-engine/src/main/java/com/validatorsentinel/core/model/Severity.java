package com.validatorsentinel.core.model;

import java.util.Comparator;
import java.util.Locale;

/**
 * Classification of a commission or MEV change from the delegator's point of
 * view.
 *
 * <p>
 * Severities form a strict total order {@code RUG > CAUTION > INFO}. A missing
 * or unrecognised severity ranks {@code 0}, below every known value, so it
 * never wins a most-severe selection.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    /** Any other change, kept for the audit trail. */
    INFO(1),

    /** Large increase that does not reach the rug level. */
    CAUTION(2),

    /** Commission raised to (or above) the rug level. */
    RUG(3);

    /** Orders severities by rank; {@code null} sorts first. */
    public static final Comparator<Severity> BY_RANK = Comparator.comparingInt(Severity::rankOf);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * @param other severity to compare against; may be {@code null}
     * @return {@code true} if this severity ranks at or above {@code other}
     */
    public boolean isAtLeast(Severity other) {
        return rank >= rankOf(other);
    }

    /**
     * Rank of a possibly missing severity.
     *
     * @param severity the severity, may be {@code null}
     * @return the rank, or {@code 0} for {@code null}
     */
    public static int rankOf(Severity severity) {
        return severity == null ? 0 : severity.rank;
    }

    /**
     * Parse a severity label, case-insensitively.
     *
     * @param text label such as {@code "rug"}; may be {@code null}
     * @return the severity, or {@code null} if the label is unknown
     */
    public static Severity parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
