package com.validatorsentinel.core.model;

import java.util.Locale;

/**
 * Which severities a subscriber wants to receive.
 *
 * @since 1.0.0
 */
public enum AlertPreference {

    RUGS_ONLY(Severity.RUG),

    RUGS_AND_CAUTIONS(Severity.CAUTION),

    ALL(Severity.INFO);

    private final Severity minimum;

    AlertPreference(Severity minimum) {
        this.minimum = minimum;
    }

    /**
     * @param severity severity of the notification
     * @return {@code true} if a subscriber with this preference should receive it
     */
    public boolean accepts(Severity severity) {
        return severity != null && severity.isAtLeast(minimum);
    }

    /**
     * Parse a stored preference label. Subscribers without a preference, or
     * with an unknown one, receive rugs only.
     *
     * @param text label such as {@code "rugs_and_cautions"} or {@code "all"}
     * @return the preference, never {@code null}
     */
    public static AlertPreference parse(String text) {
        if (text == null || text.isBlank()) {
            return RUGS_ONLY;
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        // labels used by the subscriber table
        if ("ALL_EVENTS".equals(normalized)) {
            return ALL;
        }
        if ("ALL_ALERTS".equals(normalized)) {
            return RUGS_AND_CAUTIONS;
        }
        for (AlertPreference preference : values()) {
            if (preference.name().equals(normalized)) {
                return preference;
            }
        }
        return RUGS_ONLY;
    }
}
