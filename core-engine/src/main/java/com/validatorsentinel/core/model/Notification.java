package com.validatorsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;

/**
 * Fully formed alert payload handed to the notifier for a qualifying
 * {@link ChangeEvent}.
 *
 * <p>
 * The engine does not know how many channels consume a notification or
 * whether delivery succeeded.
 * </p>
 *
 * @since 1.0.0
 */
public final class Notification implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Severity severity;
    private final String entityId;
    private final AttributeKind attribute;
    private final Integer fromValue;
    private final Integer toValue;
    private final int delta;
    private final long epoch;

    private Notification(ChangeEvent event) {
        this.severity = Objects.requireNonNull(event.getSeverity(), "severity must not be null");
        this.entityId = event.getEntityId();
        this.attribute = event.getAttribute();
        this.fromValue = event.getFromValue();
        this.toValue = event.getToValue();
        this.delta = event.getDelta();
        this.epoch = event.getEpoch();
    }

    /**
     * @param event the classified change
     * @return notification describing {@code event}
     * @throws NullPointerException if the event has no severity
     */
    public static Notification of(ChangeEvent event) {
        Objects.requireNonNull(event, "ChangeEvent must not be null");
        return new Notification(event);
    }

    /**
     * One-line human-readable description, e.g.
     * {@code "RUG: commission 5% -> 100% (+95pp) for Vote111 in epoch 873"}.
     *
     * @return summary text
     */
    @JsonProperty("summary")
    public String summary() {
        String label = attribute == AttributeKind.MEV ? "MEV commission" : "commission";
        return String.format(Locale.ROOT, "%s: %s %s -> %s (%+dpp) for %s in epoch %d",
                severity, label, percent(fromValue), percent(toValue), delta, entityId, epoch);
    }

    private static String percent(Integer value) {
        return value == null ? "disabled" : value + "%";
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getEntityId() {
        return entityId;
    }

    public AttributeKind getAttribute() {
        return attribute;
    }

    public Integer getFromValue() {
        return fromValue;
    }

    public Integer getToValue() {
        return toValue;
    }

    public int getDelta() {
        return delta;
    }

    public long getEpoch() {
        return epoch;
    }

    public boolean isFromDisabled() {
        return fromValue == null;
    }

    public boolean isToDisabled() {
        return toValue == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Notification that))
            return false;
        return delta == that.delta
                && epoch == that.epoch
                && severity == that.severity
                && entityId.equals(that.entityId)
                && attribute == that.attribute
                && Objects.equals(fromValue, that.fromValue)
                && Objects.equals(toValue, that.toValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, entityId, attribute, fromValue, toValue, delta, epoch);
    }

    @Override
    public String toString() {
        return "Notification{" + summary() + '}';
    }
}
