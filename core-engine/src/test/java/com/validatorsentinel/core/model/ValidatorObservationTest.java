package com.validatorsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ValidatorObservation} and {@link EntityState}.
 */
class ValidatorObservationTest {

    @Test
    @DisplayName("MEV commission in basis points is stored as a rounded percentage")
    void basisPoints() {
        ValidatorObservation observation = new ValidatorObservation();

        observation.setMevCommissionBps(800);
        assertThat(observation.getMevCommission()).isEqualTo(8);

        observation.setMevCommissionBps(850);
        assertThat(observation.getMevCommission()).isEqualTo(9);

        observation.setMevCommissionBps(10_000);
        assertThat(observation.valueOf(AttributeKind.MEV)).isEqualTo(100);

        observation.setMevCommissionBps(null);
        assertThat(observation.getMevCommission()).isNull();
    }

    @Test
    @DisplayName("Liveness is only sampled when the flag is present")
    void livenessSampled() {
        ValidatorObservation observation = ValidatorObservation.builder().entityId("A").build();
        assertThat(observation.isLivenessSampled()).isFalse();

        observation.setDelinquent(false);
        assertThat(observation.isLivenessSampled()).isTrue();
    }

    @Test
    @DisplayName("Builder requires an entity id")
    void builderRequiresEntityId() {
        assertThatThrownBy(() -> ValidatorObservation.builder().epoch(1).build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Entity state rejects a snapshot of another validator")
    void stateRejectsForeignSnapshot() {
        EntityState state = EntityState.unknown("A");
        AttributeSnapshot foreign = new AttributeSnapshot("B", AttributeKind.COMMISSION, 1, 1, null, 5);

        assertThatThrownBy(() -> state.withSnapshot(foreign)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Entity state knows whether a later snapshot is recorded")
    void hasSnapshotAfter() {
        EntityState state = EntityState.unknown("A")
                .withSnapshot(new AttributeSnapshot("A", AttributeKind.COMMISSION, 600, 50, null, 5));

        assertThat(state.hasSnapshotAfter(599, 999)).isTrue();
        assertThat(state.hasSnapshotAfter(600, 49)).isTrue();
        assertThat(state.hasSnapshotAfter(600, 50)).isFalse();
        assertThat(state.hasSnapshotAfter(601, 0)).isFalse();
        assertThat(EntityState.unknown("A").hasSnapshotAfter(0, 0)).isFalse();
    }
}
