package com.validatorsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;

/**
 * Current state of one validator as reported by the state source in a single
 * observation cycle.
 *
 * <p>
 * Observations arrive as JSON. Unknown properties are ignored so upstream
 * collectors can add fields without breaking the engine. A {@code null}
 * {@code mevCommission} means MEV is disabled for the validator; a
 * {@code null} {@code delinquent} means liveness was not sampled in this
 * cycle and no liveness decision is made.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. Instances are built once by
 * the deserializer (or the {@link Builder}) and then only read.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValidatorObservation implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Vote account public key. */
    private String entityId;

    /** Protocol epoch the observation belongs to. */
    private long epoch;

    /** Absolute slot at observation time; 0 when unknown. */
    private long slot;

    /** Wall-clock time of the observation. */
    private Instant observedAt;

    /** Fee commission percentage. */
    private Integer commission;

    /** MEV commission percentage, {@code null} when MEV is disabled. */
    private Integer mevCommission;

    /** Delinquency flag, {@code null} when not sampled. */
    private Boolean delinquent;

    /** No-arg constructor required by Jackson. */
    public ValidatorObservation() {
    }

    private ValidatorObservation(Builder builder) {
        this.entityId = Objects.requireNonNull(builder.entityId, "entityId must not be null");
        this.epoch = builder.epoch;
        this.slot = builder.slot;
        this.observedAt = builder.observedAt;
        this.commission = builder.commission;
        this.mevCommission = builder.mevCommission;
        this.delinquent = builder.delinquent;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ValidatorObservation}. Only {@code entityId}
     * is required.
     */
    public static class Builder {
        private String entityId;
        private long epoch;
        private long slot;
        private Instant observedAt;
        private Integer commission;
        private Integer mevCommission;
        private Boolean delinquent;

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder epoch(long epoch) {
            this.epoch = epoch;
            return this;
        }

        public Builder slot(long slot) {
            this.slot = slot;
            return this;
        }

        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        public Builder commission(Integer commission) {
            this.commission = commission;
            return this;
        }

        public Builder mevCommission(Integer mevCommission) {
            this.mevCommission = mevCommission;
            return this;
        }

        public Builder delinquent(Boolean delinquent) {
            this.delinquent = delinquent;
            return this;
        }

        public ValidatorObservation build() {
            return new ValidatorObservation(this);
        }
    }

    /**
     * Value of the given attribute in this observation.
     *
     * @param kind the attribute
     * @return the value, {@code null} when absent or disabled
     */
    public Integer valueOf(AttributeKind kind) {
        Objects.requireNonNull(kind, "AttributeKind must not be null");
        return switch (kind) {
            case COMMISSION -> commission;
            case MEV -> mevCommission;
        };
    }

    @JsonIgnore
    public boolean isLivenessSampled() {
        return delinquent != null;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getEntityId() {
        return entityId;
    }

    public void setEntityId(String entityId) {
        this.entityId = entityId;
    }

    public long getEpoch() {
        return epoch;
    }

    public void setEpoch(long epoch) {
        this.epoch = epoch;
    }

    public long getSlot() {
        return slot;
    }

    public void setSlot(long slot) {
        this.slot = slot;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    public void setObservedAt(Instant observedAt) {
        this.observedAt = observedAt;
    }

    public Integer getCommission() {
        return commission;
    }

    public void setCommission(Integer commission) {
        this.commission = commission;
    }

    public Integer getMevCommission() {
        return mevCommission;
    }

    public void setMevCommission(Integer mevCommission) {
        this.mevCommission = mevCommission;
    }

    /**
     * Accept the MEV commission in basis points, as published by the MEV
     * client's validator API, and store it as a whole percentage.
     *
     * @param bps basis points (10000 = 100%), {@code null} when disabled
     */
    public void setMevCommissionBps(Integer bps) {
        this.mevCommission = bps == null
                ? null
                : BigDecimal.valueOf(bps).divide(BigDecimal.valueOf(100), 0, RoundingMode.HALF_UP).intValue();
    }

    public Boolean getDelinquent() {
        return delinquent;
    }

    public void setDelinquent(Boolean delinquent) {
        this.delinquent = delinquent;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ValidatorObservation that))
            return false;
        return epoch == that.epoch
                && slot == that.slot
                && Objects.equals(entityId, that.entityId)
                && Objects.equals(observedAt, that.observedAt)
                && Objects.equals(commission, that.commission)
                && Objects.equals(mevCommission, that.mevCommission)
                && Objects.equals(delinquent, that.delinquent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, epoch, slot, observedAt, commission, mevCommission, delinquent);
    }

    @Override
    public String toString() {
        return "ValidatorObservation{" +
                "entityId='" + entityId + '\'' +
                ", epoch=" + epoch +
                ", slot=" + slot +
                ", observedAt=" + observedAt +
                ", commission=" + commission +
                ", mevCommission=" + mevCommission +
                ", delinquent=" + delinquent +
                '}';
    }
}
