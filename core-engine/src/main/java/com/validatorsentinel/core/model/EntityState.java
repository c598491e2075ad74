package com.validatorsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Last recorded state of one validator: the most recent snapshot of each
 * tracked attribute and the stored delinquency flag.
 *
 * <p>
 * Instances are immutable; the {@code with*} methods return updated copies.
 * A validator that storage has never seen is represented by
 * {@link #unknown(String)}: no snapshots, and not delinquent (the default of
 * the validator record when it is first created).
 * </p>
 *
 * @since 1.0.0
 */
public final class EntityState implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final AttributeSnapshot latestCommission;
    private final AttributeSnapshot latestMev;
    private final boolean delinquent;

    public EntityState(String entityId, AttributeSnapshot latestCommission, AttributeSnapshot latestMev,
            boolean delinquent) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.latestCommission = latestCommission;
        this.latestMev = latestMev;
        this.delinquent = delinquent;
    }

    public static EntityState unknown(String entityId) {
        return new EntityState(entityId, null, null, false);
    }

    /**
     * @param kind the attribute
     * @return the most recent snapshot, or {@code null} if none exists yet
     */
    public AttributeSnapshot latest(AttributeKind kind) {
        Objects.requireNonNull(kind, "AttributeKind must not be null");
        return switch (kind) {
            case COMMISSION -> latestCommission;
            case MEV -> latestMev;
        };
    }

    /**
     * @param snapshot the new latest snapshot of its attribute
     * @return a copy with {@code snapshot} recorded
     * @throws IllegalArgumentException if the snapshot belongs to another entity
     */
    public EntityState withSnapshot(AttributeSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        if (!entityId.equals(snapshot.getEntityId())) {
            throw new IllegalArgumentException("Snapshot for '" + snapshot.getEntityId()
                    + "' cannot be applied to state of '" + entityId + "'");
        }
        return switch (snapshot.getAttribute()) {
            case COMMISSION -> new EntityState(entityId, snapshot, latestMev, delinquent);
            case MEV -> new EntityState(entityId, latestCommission, snapshot, delinquent);
        };
    }

    public EntityState withDelinquent(boolean newFlag) {
        return newFlag == delinquent ? this : new EntityState(entityId, latestCommission, latestMev, newFlag);
    }

    /**
     * @param epoch observation epoch
     * @param slot  observation slot
     * @return {@code true} if a recorded snapshot was taken after {@code (epoch, slot)}
     */
    public boolean hasSnapshotAfter(long epoch, long slot) {
        return isAfter(latestCommission, epoch, slot) || isAfter(latestMev, epoch, slot);
    }

    private static boolean isAfter(AttributeSnapshot snapshot, long epoch, long slot) {
        return snapshot != null
                && (snapshot.getEpoch() > epoch || (snapshot.getEpoch() == epoch && snapshot.getSlot() > slot));
    }

    public String getEntityId() {
        return entityId;
    }

    public boolean isDelinquent() {
        return delinquent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EntityState that))
            return false;
        return delinquent == that.delinquent
                && entityId.equals(that.entityId)
                && Objects.equals(latestCommission, that.latestCommission)
                && Objects.equals(latestMev, that.latestMev);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, latestCommission, latestMev, delinquent);
    }

    @Override
    public String toString() {
        return "EntityState{" +
                "entityId='" + entityId + '\'' +
                ", commission=" + latestCommission +
                ", mev=" + latestMev +
                ", delinquent=" + delinquent +
                '}';
    }
}
