package com.validatorsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Write set produced by one sweep: everything a collaborator must persist
 * or send. The engine performs none of these side effects itself.
 *
 * <p>
 * Liveness events and the matching entries of {@link #getLivenessUpdates()}
 * must be applied together; a flag without its event (or the reverse) is an
 * inconsistent store.
 * </p>
 *
 * @since 1.0.0
 */
public final class SweepResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<AttributeSnapshot> snapshotsToWrite;
    private final List<ChangeEvent> changeEventsToWrite;
    private final List<LivenessEvent> livenessEventsToWrite;
    private final Map<String, Boolean> livenessUpdates;
    private final List<Notification> notificationsToSend;
    private final List<String> failedEntities;

    private SweepResult(Builder builder) {
        this.snapshotsToWrite = Collections.unmodifiableList(new ArrayList<>(builder.snapshots));
        this.changeEventsToWrite = Collections.unmodifiableList(new ArrayList<>(builder.changeEvents));
        this.livenessEventsToWrite = Collections.unmodifiableList(new ArrayList<>(builder.livenessEvents));
        this.livenessUpdates = Collections.unmodifiableMap(new LinkedHashMap<>(builder.livenessUpdates));
        this.notificationsToSend = Collections.unmodifiableList(new ArrayList<>(builder.notifications));
        this.failedEntities = Collections.unmodifiableList(new ArrayList<>(builder.failedEntities));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SweepResult empty() {
        return new Builder().build();
    }

    /**
     * Accumulates the output of a sweep entity by entity.
     */
    public static class Builder {
        private final List<AttributeSnapshot> snapshots = new ArrayList<>();
        private final List<ChangeEvent> changeEvents = new ArrayList<>();
        private final List<LivenessEvent> livenessEvents = new ArrayList<>();
        private final Map<String, Boolean> livenessUpdates = new LinkedHashMap<>();
        private final List<Notification> notifications = new ArrayList<>();
        private final List<String> failedEntities = new ArrayList<>();

        public Builder snapshot(AttributeSnapshot snapshot) {
            snapshots.add(snapshot);
            return this;
        }

        public Builder changeEvent(ChangeEvent event) {
            changeEvents.add(event);
            return this;
        }

        /**
         * Record a liveness flip together with the flag it sets.
         */
        public Builder livenessTransition(LivenessEvent event) {
            livenessEvents.add(event);
            livenessUpdates.put(event.getEntityId(), event.getKind().delinquentAfter());
            return this;
        }

        public Builder notification(Notification notification) {
            notifications.add(notification);
            return this;
        }

        public Builder failedEntity(String entityId) {
            failedEntities.add(entityId);
            return this;
        }

        /**
         * Append everything from another result, preserving order.
         */
        public Builder addAll(SweepResult other) {
            snapshots.addAll(other.snapshotsToWrite);
            changeEvents.addAll(other.changeEventsToWrite);
            livenessEvents.addAll(other.livenessEventsToWrite);
            livenessUpdates.putAll(other.livenessUpdates);
            notifications.addAll(other.notificationsToSend);
            failedEntities.addAll(other.failedEntities);
            return this;
        }

        public SweepResult build() {
            return new SweepResult(this);
        }
    }

    /**
     * @return {@code true} if there is nothing to write or send
     */
    @JsonIgnore
    public boolean isEmpty() {
        return snapshotsToWrite.isEmpty()
                && changeEventsToWrite.isEmpty()
                && livenessEventsToWrite.isEmpty()
                && notificationsToSend.isEmpty();
    }

    public List<AttributeSnapshot> getSnapshotsToWrite() {
        return snapshotsToWrite;
    }

    public List<ChangeEvent> getChangeEventsToWrite() {
        return changeEventsToWrite;
    }

    public List<LivenessEvent> getLivenessEventsToWrite() {
        return livenessEventsToWrite;
    }

    /**
     * @return entity id to new delinquency flag, one entry per flipped entity
     */
    public Map<String, Boolean> getLivenessUpdates() {
        return livenessUpdates;
    }

    public List<Notification> getNotificationsToSend() {
        return notificationsToSend;
    }

    public List<String> getFailedEntities() {
        return failedEntities;
    }

    @Override
    public String toString() {
        return "SweepResult{" +
                "snapshots=" + snapshotsToWrite.size() +
                ", changeEvents=" + changeEventsToWrite.size() +
                ", livenessEvents=" + livenessEventsToWrite.size() +
                ", notifications=" + notificationsToSend.size() +
                ", failedEntities=" + failedEntities +
                '}';
    }
}
