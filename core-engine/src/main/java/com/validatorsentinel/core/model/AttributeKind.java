package com.validatorsentinel.core.model;

/**
 * Operator-controlled validator parameters tracked by the engine.
 *
 * @since 1.0.0
 */
public enum AttributeKind {

    /** Fee (inflation reward) commission, 0 to 100. Never disabled. */
    COMMISSION(false),

    /** MEV commission, 0 to 100, or disabled when the validator runs no MEV client. */
    MEV(true);

    private final boolean disableable;

    AttributeKind(boolean disableable) {
        this.disableable = disableable;
    }

    /**
     * @return {@code true} if a {@code null} value is a legal "disabled" state
     */
    public boolean isDisableable() {
        return disableable;
    }
}
