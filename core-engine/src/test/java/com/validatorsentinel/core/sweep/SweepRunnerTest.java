package com.validatorsentinel.core.sweep;

import com.validatorsentinel.core.config.ThresholdsConfig;
import com.validatorsentinel.core.model.AttributeKind;
import com.validatorsentinel.core.model.AttributeSnapshot;
import com.validatorsentinel.core.model.ChangeEvent;
import com.validatorsentinel.core.model.Notification;
import com.validatorsentinel.core.model.Severity;
import com.validatorsentinel.core.model.ValidatorObservation;
import com.validatorsentinel.core.store.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.validatorsentinel.core.sweep.SweepOrchestratorTest.observation;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SweepRunner}.
 */
class SweepRunnerTest {

    private final List<ValidatorObservation> cycle = new ArrayList<>();
    private final List<Notification> sent = new ArrayList<>();

    private InMemoryEventStore store;
    private SweepOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        orchestrator = new SweepOrchestrator(ThresholdsConfig.defaults());
    }

    @Test
    @DisplayName("Should store the write set and send notifications")
    void storesAndNotifies() {
        SweepRunner runner = new SweepRunner(() -> List.copyOf(cycle), store, sent::add, orchestrator);

        cycle.add(observation("A", 600, 1, 5, null, false));
        runner.run();
        cycle.clear();
        cycle.add(observation("A", 601, 1, 100, null, true));
        SweepRunner.Outcome outcome = runner.run();

        assertThat(outcome.hasFailures()).isFalse();
        assertThat(store.changeEvents("A")).singleElement()
                .extracting(ChangeEvent::getSeverity).isEqualTo(Severity.RUG);
        assertThat(store.isDelinquent("A")).isTrue();
        assertThat(sent).singleElement().extracting(Notification::getSeverity).isEqualTo(Severity.RUG);
    }

    @Test
    @DisplayName("Running the same cycle twice does not duplicate history")
    void rerunIsIdempotent() {
        cycle.add(observation("A", 600, 1, 5, 10, false));
        cycle.add(observation("A", 600, 2, 100, 10, true));
        SweepRunner runner = new SweepRunner(() -> List.copyOf(cycle), store, sent::add, orchestrator);

        runner.run();
        int snapshots = store.snapshotCount();
        int events = store.changeEventCount();
        int transitions = store.livenessEventCount();
        SweepRunner.Outcome second = runner.run();

        assertThat(second.getResult().isEmpty()).isTrue();
        assertThat(store.snapshotCount()).isEqualTo(snapshots);
        assertThat(store.changeEventCount()).isEqualTo(events);
        assertThat(store.livenessEventCount()).isEqualTo(transitions);
        assertThat(sent).hasSize(1);
    }

    @Test
    @DisplayName("A later value at the same epoch and slot overwrites the stored snapshot")
    void samePositionOverwritesAcrossRuns() {
        SweepRunner runner = new SweepRunner(() -> List.copyOf(cycle), store, sent::add, orchestrator);

        cycle.add(observation("A", 600, 0, 5, null, false));
        runner.run();
        cycle.clear();
        cycle.add(observation("A", 600, 0, 100, null, false));
        runner.run();
        SweepRunner.Outcome rerun = runner.run();

        assertThat(store.loadStates(List.of("A")).get("A").latest(AttributeKind.COMMISSION).getValue())
                .isEqualTo(100);
        assertThat(store.changeEvents("A")).singleElement()
                .extracting(ChangeEvent::getSeverity).isEqualTo(Severity.RUG);
        assertThat(rerun.getResult().isEmpty()).isTrue();
        assertThat(sent).hasSize(1);
    }

    @Test
    @DisplayName("A failing notifier does not roll back the writes")
    void notifierFailureIsIsolated() {
        store.upsertSnapshot(new AttributeSnapshot("A", AttributeKind.COMMISSION, 600, 1, null, 5));
        cycle.add(observation("A", 601, 1, 100, null, false));
        cycle.add(observation("B", 601, 1, 5, null, false));
        store.upsertSnapshot(new AttributeSnapshot("B", AttributeKind.COMMISSION, 600, 1, null, 95));
        SweepRunner runner = new SweepRunner(() -> List.copyOf(cycle), store, n -> {
            if ("A".equals(n.getEntityId())) {
                throw new IllegalStateException("channel down");
            }
            sent.add(n);
        }, orchestrator);

        SweepRunner.Outcome outcome = runner.run();

        assertThat(outcome.getNotificationFailures()).isEqualTo(1);
        assertThat(outcome.hasFailures()).isTrue();
        assertThat(store.changeEvents("A")).hasSize(1);
        assertThat(sent).extracting(Notification::getEntityId).containsExactly("B");
    }

    @Test
    @DisplayName("A failing store write is counted and the rest is still written")
    void storeFailureIsIsolated() {
        InMemoryEventStore failingForB = new InMemoryEventStore() {
            @Override
            public synchronized void upsertSnapshot(AttributeSnapshot snapshot) {
                if ("B".equals(snapshot.getEntityId())) {
                    throw new IllegalStateException("disk full");
                }
                super.upsertSnapshot(snapshot);
            }
        };
        cycle.add(observation("A", 600, 1, 5, null, false));
        cycle.add(observation("B", 600, 1, 5, null, false));
        SweepRunner runner = new SweepRunner(() -> List.copyOf(cycle), failingForB, sent::add, orchestrator);

        SweepRunner.Outcome outcome = runner.run();

        assertThat(outcome.getWriteFailures()).isEqualTo(2);
        assertThat(failingForB.snapshotCount()).isEqualTo(2);
    }
}
