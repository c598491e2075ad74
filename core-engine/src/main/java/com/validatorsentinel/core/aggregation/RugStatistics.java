package com.validatorsentinel.core.aggregation;

import com.validatorsentinel.core.model.ChangeEvent;
import com.validatorsentinel.core.model.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Rug-centric read views used by the history charts.
 *
 * @since 1.0.0
 */
public final class RugStatistics {

    private RugStatistics() {
        // utility class, not instantiable
    }

    /**
     * Count rugged validators per epoch. A validator that rugged both fee and
     * MEV commission, or rugged twice, in one epoch counts once.
     *
     * @param events stored events of any severity; must not be {@code null}
     * @return unmodifiable map of epoch to distinct rugged validators,
     *         ascending by epoch
     */
    public static SortedMap<Long, Integer> rugsPerEpoch(List<ChangeEvent> events) {
        Objects.requireNonNull(events, "Events list must not be null");
        SortedMap<Long, Set<String>> validators = new TreeMap<>();
        for (ChangeEvent event : events) {
            if (event.getSeverity() == Severity.RUG) {
                validators.computeIfAbsent(event.getEpoch(), e -> new HashSet<>()).add(event.getEntityId());
            }
        }
        SortedMap<Long, Integer> counts = new TreeMap<>();
        validators.forEach((epoch, ids) -> counts.put(epoch, ids.size()));
        return Collections.unmodifiableSortedMap(counts);
    }

    /**
     * Rugs of one epoch: the most recent rug per validator and attribute, so a
     * validator that rugged both fee and MEV commission appears twice. Sorted
     * by validator, fee commission before MEV.
     *
     * @param events stored events of any severity; must not be {@code null}
     * @param epoch  the epoch
     * @return new list of rug events
     */
    public static List<ChangeEvent> rugsInEpoch(List<ChangeEvent> events, long epoch) {
        Objects.requireNonNull(events, "Events list must not be null");
        List<ChangeEvent> rugs = new ArrayList<>();
        for (ChangeEvent event : events) {
            if (event.getSeverity() == Severity.RUG && event.getEpoch() == epoch) {
                rugs.add(event);
            }
        }
        Map<String, ChangeEvent> latest = EventAggregator.mostSeverePerKey(rugs, Grouping.PER_ENTITY_EPOCH_KIND);

        List<ChangeEvent> result = new ArrayList<>(latest.values());
        result.sort(Comparator.comparing(ChangeEvent::getEntityId).thenComparing(ChangeEvent::getAttribute));
        return result;
    }
}
