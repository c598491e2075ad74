package com.validatorsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Classified transition between two consecutive snapshot values of one
 * attribute.
 *
 * <p>
 * Produced exactly once per qualifying snapshot transition, never for the
 * first observation of an entity. A disabled side has a {@code null} value
 * and counts as {@code 0} in {@link #getDelta()}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code entityId} and {@code attribute} are
 * required; omitting either throws a {@link NullPointerException} at build
 * time. The severity may be {@code null} for events read back from a store
 * with an unrecognised label; such events rank below {@link Severity#INFO}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChangeEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final AttributeKind attribute;
    private final long epoch;
    private final Instant observedAt;
    private final Integer fromValue;
    private final Integer toValue;
    private final Severity severity;

    private ChangeEvent(Builder builder) {
        this.entityId = Objects.requireNonNull(builder.entityId, "entityId must not be null");
        this.attribute = Objects.requireNonNull(builder.attribute, "attribute must not be null");
        this.severity = builder.severity;
        this.epoch = builder.epoch;
        this.observedAt = builder.observedAt;
        this.fromValue = builder.fromValue;
        this.toValue = builder.toValue;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ChangeEvent} instances.
     */
    public static class Builder {
        private String entityId;
        private AttributeKind attribute;
        private long epoch;
        private Instant observedAt;
        private Integer fromValue;
        private Integer toValue;
        private Severity severity;

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder attribute(AttributeKind attribute) {
            this.attribute = attribute;
            return this;
        }

        public Builder epoch(long epoch) {
            this.epoch = epoch;
            return this;
        }

        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        /**
         * @param fromValue previous value, {@code null} when it was disabled
         */
        public Builder fromValue(Integer fromValue) {
            this.fromValue = fromValue;
            return this;
        }

        /**
         * @param toValue new value, {@code null} when it is now disabled
         */
        public Builder toValue(Integer toValue) {
            this.toValue = toValue;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        /**
         * @return a new {@link ChangeEvent}
         * @throws NullPointerException if a required field is missing
         */
        public ChangeEvent build() {
            return new ChangeEvent(this);
        }
    }

    /**
     * Upsert key, mirroring the unique change constraint of the event tables:
     * one event per entity, attribute, epoch and value pair.
     *
     * @return composite key
     */
    @JsonIgnore
    public String key() {
        return entityId + '-' + attribute + '-' + epoch + '-' + render(fromValue) + '-' + render(toValue);
    }

    /**
     * @return {@code to - from}, a disabled side counted as {@code 0}
     */
    public int getDelta() {
        return (toValue == null ? 0 : toValue) - (fromValue == null ? 0 : fromValue);
    }

    public boolean isFromDisabled() {
        return fromValue == null;
    }

    public boolean isToDisabled() {
        return toValue == null;
    }

    public String getEntityId() {
        return entityId;
    }

    public AttributeKind getAttribute() {
        return attribute;
    }

    public long getEpoch() {
        return epoch;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    public Integer getFromValue() {
        return fromValue;
    }

    public Integer getToValue() {
        return toValue;
    }

    public Severity getSeverity() {
        return severity;
    }

    static String render(Integer value) {
        return value == null ? "disabled" : value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChangeEvent that))
            return false;
        return epoch == that.epoch
                && entityId.equals(that.entityId)
                && attribute == that.attribute
                && Objects.equals(observedAt, that.observedAt)
                && Objects.equals(fromValue, that.fromValue)
                && Objects.equals(toValue, that.toValue)
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, attribute, epoch, observedAt, fromValue, toValue, severity);
    }

    @Override
    public String toString() {
        return "ChangeEvent{" +
                "entityId='" + entityId + '\'' +
                ", attribute=" + attribute +
                ", epoch=" + epoch +
                ", " + render(fromValue) + " -> " + render(toValue) +
                ", severity=" + severity +
                ", observedAt=" + observedAt +
                '}';
    }
}
