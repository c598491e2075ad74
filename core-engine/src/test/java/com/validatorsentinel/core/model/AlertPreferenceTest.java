package com.validatorsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertPreference}.
 */
class AlertPreferenceTest {

    @Test
    @DisplayName("Rugs-only subscribers receive rugs only")
    void rugsOnly() {
        assertThat(AlertPreference.RUGS_ONLY.accepts(Severity.RUG)).isTrue();
        assertThat(AlertPreference.RUGS_ONLY.accepts(Severity.CAUTION)).isFalse();
        assertThat(AlertPreference.RUGS_ONLY.accepts(Severity.INFO)).isFalse();
    }

    @Test
    @DisplayName("Rugs-and-cautions subscribers do not receive INFO")
    void rugsAndCautions() {
        assertThat(AlertPreference.RUGS_AND_CAUTIONS.accepts(Severity.RUG)).isTrue();
        assertThat(AlertPreference.RUGS_AND_CAUTIONS.accepts(Severity.CAUTION)).isTrue();
        assertThat(AlertPreference.RUGS_AND_CAUTIONS.accepts(Severity.INFO)).isFalse();
    }

    @Test
    @DisplayName("Nobody receives a notification without severity")
    void missingSeverity() {
        assertThat(AlertPreference.ALL.accepts(Severity.INFO)).isTrue();
        assertThat(AlertPreference.ALL.accepts(null)).isFalse();
    }

    @Test
    @DisplayName("Should parse stored labels and default to rugs only")
    void parse() {
        assertThat(AlertPreference.parse("all")).isEqualTo(AlertPreference.ALL);
        assertThat(AlertPreference.parse("all_events")).isEqualTo(AlertPreference.ALL);
        assertThat(AlertPreference.parse("all_alerts")).isEqualTo(AlertPreference.RUGS_AND_CAUTIONS);
        assertThat(AlertPreference.parse("rugs_and_cautions")).isEqualTo(AlertPreference.RUGS_AND_CAUTIONS);
        assertThat(AlertPreference.parse("")).isEqualTo(AlertPreference.RUGS_ONLY);
        assertThat(AlertPreference.parse("something")).isEqualTo(AlertPreference.RUGS_ONLY);
        assertThat(AlertPreference.parse(null)).isEqualTo(AlertPreference.RUGS_ONLY);
    }
}
