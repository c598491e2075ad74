package com.validatorsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Recorded flip of a validator's delinquency flag.
 *
 * @since 1.0.0
 */
public final class LivenessEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final LivenessKind kind;
    private final Instant timestamp;

    public LivenessEvent(String entityId, LivenessKind kind, Instant timestamp) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static LivenessEvent wentDown(String entityId, Instant timestamp) {
        return new LivenessEvent(entityId, LivenessKind.WENT_DOWN, timestamp);
    }

    public static LivenessEvent cameUp(String entityId, Instant timestamp) {
        return new LivenessEvent(entityId, LivenessKind.CAME_UP, timestamp);
    }

    @JsonIgnore
    public String key() {
        return entityId + '-' + kind + '-' + timestamp.toEpochMilli();
    }

    public String getEntityId() {
        return entityId;
    }

    public LivenessKind getKind() {
        return kind;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LivenessEvent that))
            return false;
        return entityId.equals(that.entityId) && kind == that.kind && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, kind, timestamp);
    }

    @Override
    public String toString() {
        return "LivenessEvent{" + entityId + ' ' + kind + " at " + timestamp + '}';
    }
}
