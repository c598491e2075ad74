package com.validatorsentinel.core.store;

import com.validatorsentinel.core.model.AttributeSnapshot;
import com.validatorsentinel.core.model.ChangeEvent;
import com.validatorsentinel.core.model.EntityState;
import com.validatorsentinel.core.model.LivenessEvent;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Durable storage of snapshots, change events and liveness transitions.
 *
 * <p>
 * All writes are upserts by the record's {@code key()}: writing a record
 * whose key already exists is a no-op, so a sweep retried after a partial
 * failure does not duplicate history.
 * </p>
 *
 * @since 1.0.0
 */
public interface EventStore {

    /**
     * Pre-fetch the last recorded state of many validators in one pass.
     *
     * @param entityIds the validators of the sweep
     * @return state per entity id; validators never stored are absent
     */
    Map<String, EntityState> loadStates(Collection<String> entityIds);

    void upsertSnapshot(AttributeSnapshot snapshot);

    void upsertChangeEvent(ChangeEvent event);

    /**
     * Record a liveness transition and the delinquency flag it sets as one
     * unit.
     *
     * @param event the transition
     */
    void recordLivenessTransition(LivenessEvent event);

    /**
     * @return change events with {@code epochFrom <= epoch <= epochTo}
     */
    List<ChangeEvent> changeEvents(long epochFrom, long epochTo);

    /**
     * @return all change events of one validator
     */
    List<ChangeEvent> changeEvents(String entityId);

    /**
     * @return liveness events of one validator with {@code from <= timestamp <= to},
     *         oldest first
     */
    List<LivenessEvent> livenessEvents(String entityId, Instant from, Instant to);

    /**
     * @return the most recent liveness event strictly before {@code instant}
     */
    Optional<LivenessEvent> lastLivenessEventBefore(String entityId, Instant instant);

    /**
     * @return the stored delinquency flag; {@code false} for unknown validators
     */
    boolean isDelinquent(String entityId);

    /**
     * @return the highest epoch of any stored snapshot or change event,
     *         empty if nothing is stored
     */
    OptionalLong latestEpoch();
}
