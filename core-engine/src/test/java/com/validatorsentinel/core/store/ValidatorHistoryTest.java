package com.validatorsentinel.core.store;

import com.validatorsentinel.core.model.AttributeKind;
import com.validatorsentinel.core.model.AttributeSnapshot;
import com.validatorsentinel.core.model.ChangeEvent;
import com.validatorsentinel.core.model.DailyAvailability;
import com.validatorsentinel.core.model.LivenessEvent;
import com.validatorsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for {@link ValidatorHistory}.
 */
class ValidatorHistoryTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private InMemoryEventStore store;
    private ValidatorHistory history;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        history = new ValidatorHistory(store);
    }

    @Test
    @DisplayName("Effective commission blends the latest fee and MEV commission")
    void effectiveCommissionFromLatestSnapshots() {
        store.upsertSnapshot(new AttributeSnapshot("A", AttributeKind.COMMISSION, 599, 0, T0, 100));
        store.upsertSnapshot(new AttributeSnapshot("A", AttributeKind.COMMISSION, 600, 0, T0, 5));
        store.upsertSnapshot(new AttributeSnapshot("A", AttributeKind.MEV, 600, 0, T0, 10));
        store.upsertSnapshot(new AttributeSnapshot("B", AttributeKind.COMMISSION, 600, 0, T0, 7));
        store.upsertSnapshot(new AttributeSnapshot("B", AttributeKind.MEV, 600, 0, T0, null));

        assertThat(history.effectiveCommission("A")).hasValue(6.0);
        assertThat(history.effectiveCommission("B")).hasValue(7.0);
        assertThat(history.effectiveCommission("unknown")).isEmpty();
    }

    @Test
    @DisplayName("Feed of an empty store is empty")
    void emptyFeed() {
        assertThat(history.feed(10, true)).isEmpty();
    }

    @Test
    @DisplayName("Feed covers the latest epochs and keeps one event per validator")
    void feedKeepsMostSeverePerValidator() {
        store.upsertChangeEvent(change("A", AttributeKind.COMMISSION, 590, Severity.RUG, 5, 100));
        store.upsertChangeEvent(change("A", AttributeKind.COMMISSION, 598, Severity.RUG, 0, 100));
        store.upsertChangeEvent(change("A", AttributeKind.MEV, 600, Severity.INFO, 5, 6));
        store.upsertChangeEvent(change("B", AttributeKind.COMMISSION, 600, Severity.CAUTION, 0, 20));

        List<ChangeEvent> feed = history.feed(5, false);

        assertThat(feed).extracting(ChangeEvent::getEntityId, ChangeEvent::getEpoch)
                .containsExactly(
                        tuple("B", 600L),
                        tuple("A", 598L));
    }

    @Test
    @DisplayName("Feed with showAll returns every event in range")
    void feedShowAll() {
        store.upsertChangeEvent(change("A", AttributeKind.COMMISSION, 590, Severity.RUG, 5, 100));
        store.upsertChangeEvent(change("A", AttributeKind.COMMISSION, 598, Severity.RUG, 0, 100));
        store.upsertChangeEvent(change("A", AttributeKind.MEV, 600, Severity.INFO, 5, 6));

        assertThat(history.feed(5, true)).extracting(ChangeEvent::getEpoch).containsExactly(600L, 598L);
    }

    @Test
    @DisplayName("Epoch feed keeps both attributes of a validator")
    void epochFeedKeepsBothAttributes() {
        store.upsertChangeEvent(change("A", AttributeKind.COMMISSION, 600, Severity.RUG, 0, 100));
        store.upsertChangeEvent(change("A", AttributeKind.MEV, 600, Severity.CAUTION, 0, 30));
        store.upsertChangeEvent(change("A", AttributeKind.MEV, 600, Severity.INFO, 30, 31));

        assertThat(history.epochFeed(600, 600))
                .extracting(ChangeEvent::getSeverity)
                .containsExactlyInAnyOrder(Severity.RUG, Severity.CAUTION);
    }

    @Test
    @DisplayName("Should reject an inverted epoch range")
    void invertedEpochRange() {
        assertThatThrownBy(() -> history.epochFeed(10, 9)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> history.feed(-1, true)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Uptime counts an outage that started before the window")
    void uptimeWithOutageBeforeWindow() {
        store.recordLivenessTransition(LivenessEvent.wentDown("A", T0.minusSeconds(86_400)));
        store.recordLivenessTransition(LivenessEvent.cameUp("A", T0.plusSeconds(3600)));

        List<DailyAvailability> days = history.uptime("A", T0, T0.plusSeconds(43_200));

        assertThat(days).singleElement()
                .extracting(DailyAvailability::getDelinquentMinutes)
                .isEqualTo(60.0);
    }

    @Test
    @DisplayName("Uptime of a validator without transitions is 100%")
    void uptimeWithoutEvents() {
        List<DailyAvailability> days = history.uptime("A", T0, T0.plusSeconds(86_400 * 2));

        assertThat(days).hasSize(3).allSatisfy(d -> assertThat(d.getAvailabilityPercent()).isEqualTo(100.0));
    }

    private static ChangeEvent change(String id, AttributeKind kind, long epoch, Severity severity,
            Integer from, Integer to) {
        return ChangeEvent.builder()
                .entityId(id)
                .attribute(kind)
                .epoch(epoch)
                .observedAt(T0.plusSeconds(epoch))
                .fromValue(from)
                .toValue(to)
                .severity(severity)
                .build();
    }
}
