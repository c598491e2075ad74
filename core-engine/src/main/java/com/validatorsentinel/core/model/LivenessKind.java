package com.validatorsentinel.core.model;

/**
 * Direction of a liveness flip.
 *
 * @since 1.0.0
 */
public enum LivenessKind {

    /** The validator became delinquent. */
    WENT_DOWN,

    /** The validator stopped being delinquent. */
    CAME_UP;

    /**
     * @param delinquent the new delinquency flag
     * @return {@link #WENT_DOWN} for {@code true}, {@link #CAME_UP} otherwise
     */
    public static LivenessKind forFlag(boolean delinquent) {
        return delinquent ? WENT_DOWN : CAME_UP;
    }

    /**
     * @return the delinquency flag this transition leads to
     */
    public boolean delinquentAfter() {
        return this == WENT_DOWN;
    }
}
