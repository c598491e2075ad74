package com.validatorsentinel.core.uptime;

import com.validatorsentinel.core.model.DailyAvailability;
import com.validatorsentinel.core.model.LivenessEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rebuilds per-day availability from the sparse sequence of liveness flips
 * of one validator.
 *
 * <h3>Algorithm</h3>
 * <p>
 * Every calendar day of the window starts at zero delinquent minutes. The
 * events are walked in timestamp order: {@code WENT_DOWN} opens an outage
 * (a second {@code WENT_DOWN} keeps the earlier start), {@code CAME_UP}
 * closes it and {@code CAME_UP} without an open outage is ignored. Each
 * closed interval {@code [start, end)} is clipped to the window and its
 * minutes are split across the days it overlaps, each day bounded by its
 * own {@code [00:00, 24:00)}. An outage still open at the end of the window
 * is counted up to {@code windowEnd}.
 * </p>
 *
 * <h3>Approximation</h3>
 * <p>
 * A validator without any transition in the window is reported fully
 * available. Absence of recorded downtime is taken as uptime; pass
 * {@code downAtWindowStart} when the stored flag says otherwise.
 * </p>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class UptimeReconstructor {

    private static final Logger LOG = LoggerFactory.getLogger(UptimeReconstructor.class);

    private static final double MILLIS_PER_MINUTE = 60_000d;

    private final ZoneId zone;

    /**
     * Reconstructor using UTC calendar days.
     */
    public UptimeReconstructor() {
        this(ZoneOffset.UTC);
    }

    /**
     * @param zone time zone whose calendar days bucket the result
     */
    public UptimeReconstructor(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    /**
     * Reconstruct daily availability, assuming the validator was up when the
     * window began.
     *
     * @see #reconstruct(String, List, Instant, Instant, boolean, boolean)
     */
    public List<DailyAvailability> reconstruct(String entityId, List<LivenessEvent> events,
            Instant windowStart, Instant windowEnd, boolean currentlyDown) {
        return reconstruct(entityId, events, windowStart, windowEnd, currentlyDown, false);
    }

    /**
     * Reconstruct daily availability for every calendar day in
     * {@code [windowStart, windowEnd]}.
     *
     * @param entityId          validator identifier
     * @param events            liveness events of this validator; sorted by
     *                          timestamp here, so any order is accepted
     * @param windowStart       first instant of the window
     * @param windowEnd         end of the window, usually "now"
     * @param currentlyDown     stored delinquency flag of the validator
     * @param downAtWindowStart {@code true} if an outage was already open at
     *                          {@code windowStart}
     * @return one entry per day, oldest first
     * @throws IllegalArgumentException if {@code windowStart} is after
     *                                  {@code windowEnd}
     */
    public List<DailyAvailability> reconstruct(String entityId, List<LivenessEvent> events,
            Instant windowStart, Instant windowEnd, boolean currentlyDown, boolean downAtWindowStart) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(events, "Events list must not be null");
        Objects.requireNonNull(windowStart, "windowStart must not be null");
        Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        if (windowStart.isAfter(windowEnd)) {
            throw new IllegalArgumentException(
                    "windowStart " + windowStart + " is after windowEnd " + windowEnd);
        }

        Map<LocalDate, Double> minutes = initialiseDays(windowStart, windowEnd);

        List<LivenessEvent> ordered = new ArrayList<>(events);
        ordered.sort(Comparator.comparing(LivenessEvent::getTimestamp));

        Instant openOutageStart = downAtWindowStart ? windowStart : null;
        for (LivenessEvent event : ordered) {
            switch (event.getKind()) {
                case WENT_DOWN -> {
                    if (openOutageStart == null) {
                        openOutageStart = event.getTimestamp();
                    } else {
                        LOG.debug("{}: WENT_DOWN at {} while already down since {} - keeping earlier start",
                                entityId, event.getTimestamp(), openOutageStart);
                    }
                }
                case CAME_UP -> {
                    if (openOutageStart != null) {
                        distribute(minutes, openOutageStart, event.getTimestamp(), windowStart, windowEnd);
                        openOutageStart = null;
                    }
                }
            }
        }

        if (openOutageStart != null) {
            distribute(minutes, openOutageStart, windowEnd, windowStart, windowEnd);
        }
        if (currentlyDown != (openOutageStart != null)) {
            LOG.debug("{}: stored flag currentlyDown={} disagrees with event history (open outage: {})",
                    entityId, currentlyDown, openOutageStart != null);
        }

        List<DailyAvailability> days = new ArrayList<>(minutes.size());
        minutes.forEach((date, delinquent) -> days.add(new DailyAvailability(entityId, date, delinquent)));
        return days;
    }

    private Map<LocalDate, Double> initialiseDays(Instant windowStart, Instant windowEnd) {
        Map<LocalDate, Double> minutes = new LinkedHashMap<>();
        LocalDate last = windowEnd.atZone(zone).toLocalDate();
        for (LocalDate day = windowStart.atZone(zone).toLocalDate(); !day.isAfter(last); day = day.plusDays(1)) {
            minutes.put(day, 0d);
        }
        return minutes;
    }

    /**
     * Add the minutes of {@code [start, end)}, clipped to the window, to every
     * day it overlaps.
     */
    private void distribute(Map<LocalDate, Double> minutes, Instant start, Instant end,
            Instant windowStart, Instant windowEnd) {
        Instant from = start.isBefore(windowStart) ? windowStart : start;
        Instant to = end.isAfter(windowEnd) ? windowEnd : end;
        if (!from.isBefore(to)) {
            return;
        }

        LocalDate lastDay = to.atZone(zone).toLocalDate();
        for (LocalDate day = from.atZone(zone).toLocalDate(); !day.isAfter(lastDay); day = day.plusDays(1)) {
            Instant dayStart = day.atStartOfDay(zone).toInstant();
            Instant dayEnd = day.plusDays(1).atStartOfDay(zone).toInstant();

            Instant overlapStart = from.isAfter(dayStart) ? from : dayStart;
            Instant overlapEnd = to.isBefore(dayEnd) ? to : dayEnd;
            long millis = overlapEnd.toEpochMilli() - overlapStart.toEpochMilli();
            if (millis > 0) {
                minutes.computeIfPresent(day, (d, total) -> total + millis / MILLIS_PER_MINUTE);
            }
        }
    }
}
