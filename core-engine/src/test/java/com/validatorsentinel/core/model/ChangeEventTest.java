package com.validatorsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ChangeEvent} and {@link Notification}.
 */
class ChangeEventTest {

    @Test
    @DisplayName("Delta counts a disabled side as zero")
    void deltaWithDisabledSide() {
        assertThat(change(AttributeKind.COMMISSION, 5, 100).getDelta()).isEqualTo(95);
        assertThat(change(AttributeKind.MEV, null, 95).getDelta()).isEqualTo(95);
        assertThat(change(AttributeKind.MEV, 8, null).getDelta()).isEqualTo(-8);
    }

    @Test
    @DisplayName("Key identifies validator, attribute, epoch and value pair")
    void key() {
        assertThat(change(AttributeKind.MEV, null, 95).key()).isEqualTo("Vote111-MEV-873-disabled-95");
        assertThat(change(AttributeKind.COMMISSION, 5, 100).key())
                .isNotEqualTo(change(AttributeKind.COMMISSION, 5, 99).key());
    }

    @Test
    @DisplayName("Notification summary describes the change")
    void summary() {
        Notification rug = Notification.of(change(AttributeKind.COMMISSION, 5, 100));
        Notification mev = Notification.of(change(AttributeKind.MEV, null, 95));

        assertThat(rug.summary()).isEqualTo("RUG: commission 5% -> 100% (+95pp) for Vote111 in epoch 873");
        assertThat(mev.summary()).startsWith("RUG: MEV commission disabled -> 95%");
        assertThat(mev.isFromDisabled()).isTrue();
    }

    @Test
    @DisplayName("Notification requires a severity")
    void notificationRequiresSeverity() {
        ChangeEvent unclassified = ChangeEvent.builder()
                .entityId("Vote111")
                .attribute(AttributeKind.COMMISSION)
                .build();

        assertThatThrownBy(() -> Notification.of(unclassified)).isInstanceOf(NullPointerException.class);
    }

    private static ChangeEvent change(AttributeKind kind, Integer from, Integer to) {
        return ChangeEvent.builder()
                .entityId("Vote111")
                .attribute(kind)
                .epoch(873)
                .fromValue(from)
                .toValue(to)
                .severity(Severity.RUG)
                .build();
    }
}
