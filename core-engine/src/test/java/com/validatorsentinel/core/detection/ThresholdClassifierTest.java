package com.validatorsentinel.core.detection;

import com.validatorsentinel.core.config.ThresholdsLoader;
import com.validatorsentinel.core.model.AttributeKind;
import com.validatorsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ThresholdClassifier}.
 */
class ThresholdClassifierTest {

    private final ThresholdClassifier classifier = ThresholdClassifier.withDefaults();

    @Test
    @DisplayName("Commission raised from 5% to 100% is a RUG")
    void commissionJumpToHundredIsRug() {
        assertThat(classifier.classify(AttributeKind.COMMISSION, 5, 100)).isEqualTo(Severity.RUG);
    }

    @Test
    @DisplayName("Commission raised to exactly the rug level is a RUG")
    void commissionAtRugLevelIsRug() {
        assertThat(classifier.classify(AttributeKind.COMMISSION, 85, 90)).isEqualTo(Severity.RUG);
    }

    @Test
    @DisplayName("Commission raised by 15 points below the rug level is a CAUTION")
    void commissionLargeIncreaseIsCaution() {
        assertThat(classifier.classify(AttributeKind.COMMISSION, 0, 15)).isEqualTo(Severity.CAUTION);
    }

    @Test
    @DisplayName("Commission raised by exactly the caution delta is a CAUTION")
    void commissionCautionDeltaBoundary() {
        assertThat(classifier.classify(AttributeKind.COMMISSION, 0, 10)).isEqualTo(Severity.CAUTION);
        assertThat(classifier.classify(AttributeKind.COMMISSION, 0, 9)).isEqualTo(Severity.INFO);
    }

    @Test
    @DisplayName("Small commission increase is INFO")
    void commissionSmallIncreaseIsInfo() {
        assertThat(classifier.classify(AttributeKind.COMMISSION, 50, 55)).isEqualTo(Severity.INFO);
    }

    @Test
    @DisplayName("Commission decrease is INFO, even from 100%")
    void commissionDecreaseIsInfo() {
        assertThat(classifier.classify(AttributeKind.COMMISSION, 100, 0)).isEqualTo(Severity.INFO);
    }

    @Test
    @DisplayName("MEV enabled straight at 95% is a CAUTION")
    void mevEnabledHighIsCaution() {
        assertThat(classifier.classify(AttributeKind.MEV, null, 95)).isEqualTo(Severity.CAUTION);
    }

    @Test
    @DisplayName("MEV enabled at a low commission is INFO")
    void mevEnabledLowIsInfo() {
        assertThat(classifier.classify(AttributeKind.MEV, null, 50)).isEqualTo(Severity.INFO);
    }

    @Test
    @DisplayName("MEV disabled is INFO")
    void mevDisabledIsInfo() {
        assertThat(classifier.classify(AttributeKind.MEV, 5, null)).isEqualTo(Severity.INFO);
        assertThat(classifier.classify(AttributeKind.MEV, 100, null)).isEqualTo(Severity.INFO);
    }

    @Test
    @DisplayName("MEV uses its own wider caution delta")
    void mevCautionDelta() {
        assertThat(classifier.classify(AttributeKind.MEV, 0, 20)).isEqualTo(Severity.CAUTION);
        assertThat(classifier.classify(AttributeKind.MEV, 0, 19)).isEqualTo(Severity.INFO);
        assertThat(classifier.classify(AttributeKind.MEV, 10, 90)).isEqualTo(Severity.RUG);
    }

    @Test
    @DisplayName("Out-of-range values are treated as INFO instead of failing")
    void outOfRangeIsInfo() {
        assertThat(classifier.classify(50, 150, false, false, AttributeKind.COMMISSION)).isEqualTo(Severity.INFO);
        assertThat(classifier.classify(-5, 100, false, false, AttributeKind.MEV)).isEqualTo(Severity.INFO);
    }

    @Test
    @DisplayName("Missing attribute kind is treated as INFO")
    void nullKindIsInfo() {
        assertThat(classifier.classify(0, 100, false, false, null)).isEqualTo(Severity.INFO);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 90, 100})
    @DisplayName("Unchanged value never classifies above INFO")
    void unchangedValueIsInfo(int value) {
        assertThat(classifier.classify(AttributeKind.COMMISSION, value, value)).isEqualTo(Severity.INFO);
        assertThat(classifier.classify(AttributeKind.MEV, value, value)).isEqualTo(Severity.INFO);
    }

    @Test
    @DisplayName("Disabled to disabled is INFO")
    void disabledToDisabledIsInfo() {
        assertThat(classifier.classify(AttributeKind.MEV, null, null)).isEqualTo(Severity.INFO);
    }

    @ParameterizedTest
    @EnumSource(AttributeKind.class)
    @DisplayName("Raising the new value never lowers the severity")
    void severityIsMonotonicInNewValue(AttributeKind kind) {
        for (int from = 0; from <= 100; from++) {
            int previousRank = 0;
            for (int to = 0; to <= 100; to++) {
                int rank = classifier.classify(kind, from, to).rank();
                assertThat(rank)
                        .as("%s %d -> %d", kind, from, to)
                        .isGreaterThanOrEqualTo(previousRank);
                previousRank = rank;
            }
        }
    }

    @Test
    @DisplayName("Thresholds come from the loaded configuration")
    void usesConfiguredThresholds() {
        ThresholdClassifier custom = new ThresholdClassifier(ThresholdsLoader.fromClasspath("test-thresholds.yml"));

        assertThat(custom.classify(AttributeKind.COMMISSION, 0, 5)).isEqualTo(Severity.CAUTION);
        assertThat(custom.classify(AttributeKind.COMMISSION, 0, 80)).isEqualTo(Severity.RUG);
        assertThat(custom.classify(AttributeKind.MEV, null, 50)).isEqualTo(Severity.CAUTION);
    }
}
