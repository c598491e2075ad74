package com.validatorsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Stored observation of one attribute value, written only when the value
 * differs from the previous snapshot of the same entity and attribute.
 *
 * <p>
 * Snapshots are immutable. A {@code null} value records a disabled MEV
 * commission.
 * </p>
 *
 * @since 1.0.0
 */
public final class AttributeSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final AttributeKind attribute;
    private final long epoch;
    private final long slot;
    private final Instant observedAt;
    private final Integer value;

    public AttributeSnapshot(String entityId, AttributeKind attribute, long epoch, long slot,
            Instant observedAt, Integer value) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.attribute = Objects.requireNonNull(attribute, "attribute must not be null");
        this.epoch = epoch;
        this.slot = slot;
        this.observedAt = observedAt;
        this.value = value;
    }

    /**
     * Upsert key: one snapshot per entity, attribute and observation point.
     *
     * @return composite key {@code entityId-attribute-epoch-slot}
     */
    @JsonIgnore
    public String key() {
        return entityId + '-' + attribute + '-' + epoch + '-' + slot;
    }

    /**
     * @param other snapshot to compare with
     * @return {@code true} if this snapshot was taken after {@code other}
     */
    public boolean isNewerThan(AttributeSnapshot other) {
        if (other == null) {
            return true;
        }
        if (epoch != other.epoch) {
            return epoch > other.epoch;
        }
        return slot > other.slot;
    }

    @JsonIgnore
    public boolean isDisabled() {
        return value == null;
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

    public long getSlot() {
        return slot;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    public Integer getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AttributeSnapshot that))
            return false;
        return epoch == that.epoch
                && slot == that.slot
                && entityId.equals(that.entityId)
                && attribute == that.attribute
                && Objects.equals(observedAt, that.observedAt)
                && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, attribute, epoch, slot, observedAt, value);
    }

    @Override
    public String toString() {
        return "AttributeSnapshot{" +
                "entityId='" + entityId + '\'' +
                ", attribute=" + attribute +
                ", epoch=" + epoch +
                ", slot=" + slot +
                ", value=" + (value == null ? "disabled" : value) +
                '}';
    }
}
