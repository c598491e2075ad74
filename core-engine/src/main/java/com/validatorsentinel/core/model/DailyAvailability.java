package com.validatorsentinel.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Availability of one validator over one calendar day, derived on demand
 * from its liveness transitions.
 *
 * @since 1.0.0
 */
public final class DailyAvailability implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Minutes in a 24-hour day. */
    public static final double MINUTES_PER_DAY = 24 * 60;

    private final String entityId;
    private final LocalDate date;
    private final double delinquentMinutes;
    private final double availabilityPercent;

    /**
     * @param entityId          validator identifier
     * @param date              the calendar day
     * @param delinquentMinutes minutes spent delinquent during the day
     */
    public DailyAvailability(String entityId, LocalDate date, double delinquentMinutes) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.delinquentMinutes = delinquentMinutes;
        this.availabilityPercent = Math.max(0, 100 - delinquentMinutes / MINUTES_PER_DAY * 100);
    }

    public String getEntityId() {
        return entityId;
    }

    public LocalDate getDate() {
        return date;
    }

    public double getDelinquentMinutes() {
        return delinquentMinutes;
    }

    /**
     * @return {@code 100 - delinquentMinutes / 1440 * 100}, floored at 0
     */
    public double getAvailabilityPercent() {
        return availabilityPercent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DailyAvailability that))
            return false;
        return Double.compare(delinquentMinutes, that.delinquentMinutes) == 0
                && entityId.equals(that.entityId)
                && date.equals(that.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, date, delinquentMinutes);
    }

    @Override
    public String toString() {
        return "DailyAvailability{" + entityId + ' ' + date
                + ", delinquentMinutes=" + delinquentMinutes
                + ", availabilityPercent=" + availabilityPercent + '}';
    }
}
