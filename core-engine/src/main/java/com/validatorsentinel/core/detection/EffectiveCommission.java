package com.validatorsentinel.core.detection;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Blends fee and MEV commission into the single rate a delegator actually
 * pays, weighted by the share of MEV in total rewards.
 *
 * @since 1.0.0
 */
public final class EffectiveCommission {

    /** Typical share of MEV in a validator's total rewards. */
    public static final double DEFAULT_MEV_REWARD_RATIO = 0.2;

    private EffectiveCommission() {
        // utility class, not instantiable
    }

    /**
     * @param feeCommission  fee commission, 0 to 100
     * @param mevCommission  MEV commission, 0 to 100, {@code null} when disabled
     * @param mevRewardRatio share of MEV in total rewards, 0 to 1
     * @return the effective commission rounded to two decimals
     * @throws IllegalArgumentException if {@code mevRewardRatio} is outside [0, 1]
     */
    public static double calculate(int feeCommission, Integer mevCommission, double mevRewardRatio) {
        if (mevRewardRatio < 0 || mevRewardRatio > 1 || Double.isNaN(mevRewardRatio)) {
            throw new IllegalArgumentException("mevRewardRatio must be in [0, 1], got: " + mevRewardRatio);
        }
        if (mevCommission == null) {
            // no MEV client: delegators only pay the fee commission
            return feeCommission;
        }
        double effective = feeCommission * (1 - mevRewardRatio) + mevCommission * mevRewardRatio;
        return BigDecimal.valueOf(effective).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    public static double calculate(int feeCommission, Integer mevCommission) {
        return calculate(feeCommission, mevCommission, DEFAULT_MEV_REWARD_RATIO);
    }
}
