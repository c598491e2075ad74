package com.validatorsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EffectiveCommission}.
 */
class EffectiveCommissionTest {

    @Test
    @DisplayName("Should blend fee and MEV commission by the reward ratio")
    void blendsByRatio() {
        assertThat(EffectiveCommission.calculate(5, 10, 0.2)).isEqualTo(6.0);
        assertThat(EffectiveCommission.calculate(0, 100, 0.5)).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Should use the default MEV reward ratio")
    void defaultRatio() {
        assertThat(EffectiveCommission.calculate(7, 8)).isEqualTo(7.2);
    }

    @Test
    @DisplayName("Should charge only the fee commission without MEV")
    void withoutMev() {
        assertThat(EffectiveCommission.calculate(5, null, 0.2)).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Should round to two decimals")
    void roundsToTwoDecimals() {
        assertThat(EffectiveCommission.calculate(1, 2, 0.333)).isEqualTo(1.33);
    }

    @Test
    @DisplayName("Should reject a ratio outside [0, 1]")
    void rejectsBadRatio() {
        assertThatThrownBy(() -> EffectiveCommission.calculate(5, 10, 1.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mevRewardRatio");
        assertThatThrownBy(() -> EffectiveCommission.calculate(5, 10, Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
