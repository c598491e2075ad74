package com.validatorsentinel.core.aggregation;

import com.validatorsentinel.core.model.ChangeEvent;
import com.validatorsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-time fold over stored change events that presents the fee and MEV
 * streams as one feed.
 *
 * <h3>Ordering</h3>
 * <p>
 * Within a group the winner is chosen by severity rank
 * ({@code RUG > CAUTION > INFO > unknown}), then by the most recent
 * {@code observedAt}. Events identical in key, severity and timestamp keep
 * the one that came first in the input, so the result is deterministic.
 * Output is sorted by {@code (epoch desc, observedAt desc)}; the sort is
 * stable.
 * </p>
 *
 * <p>
 * Never mutates its input.
 * </p>
 *
 * @since 1.0.0
 */
public final class EventAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(EventAggregator.class);

    private static final Comparator<Instant> NULLS_OLDEST = Comparator.nullsFirst(Comparator.naturalOrder());

    /** Feed order: newest epoch first, then newest observation. */
    public static final Comparator<ChangeEvent> NEWEST_FIRST = Comparator
            .comparingLong(ChangeEvent::getEpoch)
            .thenComparing(ChangeEvent::getObservedAt, NULLS_OLDEST)
            .reversed();

    /** Selection order: higher severity first, then newer observation. */
    public static final Comparator<ChangeEvent> MOST_SEVERE_FIRST = Comparator
            .comparing(ChangeEvent::getSeverity, Severity.BY_RANK)
            .thenComparing(ChangeEvent::getObservedAt, NULLS_OLDEST)
            .reversed();

    private EventAggregator() {
        // utility class, not instantiable
    }

    /**
     * Aggregate with the live-view grouping ({@link Grouping#PER_ENTITY}).
     *
     * @param events stored events; must not be {@code null}
     * @param mode   aggregation mode; must not be {@code null}
     * @return new list of aggregated events
     */
    public static List<ChangeEvent> aggregate(List<ChangeEvent> events, AggregationMode mode) {
        return aggregate(events, mode, Grouping.PER_ENTITY);
    }

    /**
     * Aggregate a batch of change events.
     *
     * @param events   stored events; must not be {@code null}
     * @param mode     aggregation mode; must not be {@code null}
     * @param grouping grouping key for {@link AggregationMode#MOST_SEVERE};
     *                 ignored for {@link AggregationMode#ALL}
     * @return new list of aggregated events, newest first
     * @throws NullPointerException if an argument or an element is {@code null}
     */
    public static List<ChangeEvent> aggregate(List<ChangeEvent> events, AggregationMode mode, Grouping grouping) {
        Objects.requireNonNull(events, "Events list must not be null");
        Objects.requireNonNull(mode, "AggregationMode must not be null");
        Objects.requireNonNull(grouping, "Grouping must not be null");

        List<ChangeEvent> result = switch (mode) {
            case ALL -> new ArrayList<>(events);
            case MOST_SEVERE -> new ArrayList<>(mostSeverePerKey(events, grouping).values());
        };
        result.sort(NEWEST_FIRST);

        LOG.debug("Aggregated {} event(s) into {} ({} / {})", events.size(), result.size(), mode, grouping);
        return result;
    }

    /**
     * Pick the most severe event per key, keeping input order of first
     * appearance for the keys.
     *
     * @param events   the events
     * @param grouping grouping key
     * @return map of key to the selected event
     */
    static Map<String, ChangeEvent> mostSeverePerKey(List<ChangeEvent> events, Grouping grouping) {
        Map<String, ChangeEvent> chosen = new LinkedHashMap<>();
        for (ChangeEvent event : events) {
            Objects.requireNonNull(event, "Events list must not contain null");
            chosen.merge(grouping.keyOf(event), event, EventAggregator::preferred);
        }
        return chosen;
    }

    /**
     * @return {@code candidate} only if it ranks strictly before {@code current}
     */
    private static ChangeEvent preferred(ChangeEvent current, ChangeEvent candidate) {
        return MOST_SEVERE_FIRST.compare(candidate, current) < 0 ? candidate : current;
    }
}
