package com.validatorsentinel.core.store;

import com.validatorsentinel.core.model.AttributeKind;
import com.validatorsentinel.core.model.AttributeSnapshot;
import com.validatorsentinel.core.model.ChangeEvent;
import com.validatorsentinel.core.model.EntityState;
import com.validatorsentinel.core.model.LivenessEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link EventStore} backed by in-process maps.
 *
 * <p>
 * Used by tests and by local runs of {@link com.validatorsentinel.core.sweep.SweepRunner}.
 * Every method synchronizes on the store, so a liveness event and its flag
 * are always observed together.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryEventStore implements EventStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryEventStore.class);

    private static final Comparator<LivenessEvent> BY_TIMESTAMP = Comparator.comparing(LivenessEvent::getTimestamp);

    private final Map<String, AttributeSnapshot> snapshots = new LinkedHashMap<>();
    private final Map<String, ChangeEvent> changeEvents = new LinkedHashMap<>();
    private final Map<String, LivenessEvent> livenessEvents = new LinkedHashMap<>();
    private final Map<String, Boolean> delinquent = new HashMap<>();

    /** entityId -> attribute -> most recent snapshot */
    private final Map<String, Map<AttributeKind, AttributeSnapshot>> latest = new HashMap<>();

    @Override
    public synchronized Map<String, EntityState> loadStates(Collection<String> entityIds) {
        Objects.requireNonNull(entityIds, "entityIds must not be null");
        Map<String, EntityState> states = new HashMap<>();
        for (String entityId : entityIds) {
            Map<AttributeKind, AttributeSnapshot> byKind = latest.get(entityId);
            Boolean flag = delinquent.get(entityId);
            if (byKind == null && flag == null) {
                continue;
            }
            Map<AttributeKind, AttributeSnapshot> known = byKind != null ? byKind : Map.of();
            states.put(entityId, new EntityState(entityId,
                    known.get(AttributeKind.COMMISSION),
                    known.get(AttributeKind.MEV),
                    flag != null && flag));
        }
        return states;
    }

    @Override
    public synchronized void upsertSnapshot(AttributeSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        AttributeSnapshot replaced = snapshots.put(snapshot.key(), snapshot);
        if (replaced != null) {
            LOG.debug("Snapshot {} overwritten: {} -> {}", snapshot.key(), replaced.getValue(), snapshot.getValue());
        }
        Map<AttributeKind, AttributeSnapshot> byKind =
                latest.computeIfAbsent(snapshot.getEntityId(), id -> new HashMap<>());
        AttributeSnapshot current = byKind.get(snapshot.getAttribute());
        if (current == null || snapshot.isNewerThan(current) || current.key().equals(snapshot.key())) {
            byKind.put(snapshot.getAttribute(), snapshot);
        }
    }

    @Override
    public synchronized void upsertChangeEvent(ChangeEvent event) {
        Objects.requireNonNull(event, "ChangeEvent must not be null");
        if (changeEvents.putIfAbsent(event.key(), event) != null) {
            LOG.debug("Change event {} already stored", event.key());
        }
    }

    @Override
    public synchronized void recordLivenessTransition(LivenessEvent event) {
        Objects.requireNonNull(event, "LivenessEvent must not be null");
        if (livenessEvents.putIfAbsent(event.key(), event) != null) {
            LOG.debug("Liveness event {} already stored", event.key());
            return;
        }
        delinquent.put(event.getEntityId(), event.getKind().delinquentAfter());
    }

    @Override
    public synchronized List<ChangeEvent> changeEvents(long epochFrom, long epochTo) {
        List<ChangeEvent> result = new ArrayList<>();
        for (ChangeEvent event : changeEvents.values()) {
            if (event.getEpoch() >= epochFrom && event.getEpoch() <= epochTo) {
                result.add(event);
            }
        }
        return result;
    }

    @Override
    public synchronized List<ChangeEvent> changeEvents(String entityId) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        List<ChangeEvent> result = new ArrayList<>();
        for (ChangeEvent event : changeEvents.values()) {
            if (entityId.equals(event.getEntityId())) {
                result.add(event);
            }
        }
        return result;
    }

    @Override
    public synchronized List<LivenessEvent> livenessEvents(String entityId, Instant from, Instant to) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        List<LivenessEvent> result = new ArrayList<>();
        for (LivenessEvent event : livenessEvents.values()) {
            if (entityId.equals(event.getEntityId())
                    && !event.getTimestamp().isBefore(from)
                    && !event.getTimestamp().isAfter(to)) {
                result.add(event);
            }
        }
        result.sort(BY_TIMESTAMP);
        return result;
    }

    @Override
    public synchronized Optional<LivenessEvent> lastLivenessEventBefore(String entityId, Instant instant) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(instant, "instant must not be null");
        return livenessEvents.values().stream()
                .filter(e -> entityId.equals(e.getEntityId()) && e.getTimestamp().isBefore(instant))
                .max(BY_TIMESTAMP);
    }

    @Override
    public synchronized boolean isDelinquent(String entityId) {
        return delinquent.getOrDefault(entityId, Boolean.FALSE);
    }

    @Override
    public synchronized OptionalLong latestEpoch() {
        OptionalLong fromSnapshots = snapshots.values().stream()
                .mapToLong(AttributeSnapshot::getEpoch)
                .max();
        OptionalLong fromEvents = changeEvents.values().stream()
                .mapToLong(ChangeEvent::getEpoch)
                .max();
        if (fromSnapshots.isEmpty()) {
            return fromEvents;
        }
        if (fromEvents.isEmpty()) {
            return fromSnapshots;
        }
        return OptionalLong.of(Math.max(fromSnapshots.getAsLong(), fromEvents.getAsLong()));
    }

    public synchronized int snapshotCount() {
        return snapshots.size();
    }

    public synchronized int changeEventCount() {
        return changeEvents.size();
    }

    public synchronized int livenessEventCount() {
        return livenessEvents.size();
    }
}
