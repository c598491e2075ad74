package com.validatorsentinel.core.store;

import com.validatorsentinel.core.aggregation.AggregationMode;
import com.validatorsentinel.core.aggregation.EventAggregator;
import com.validatorsentinel.core.aggregation.Grouping;
import com.validatorsentinel.core.detection.EffectiveCommission;
import com.validatorsentinel.core.model.AttributeKind;
import com.validatorsentinel.core.model.AttributeSnapshot;
import com.validatorsentinel.core.model.ChangeEvent;
import com.validatorsentinel.core.model.DailyAvailability;
import com.validatorsentinel.core.model.EntityState;
import com.validatorsentinel.core.model.LivenessEvent;
import com.validatorsentinel.core.model.LivenessKind;
import com.validatorsentinel.core.uptime.UptimeReconstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Read-side queries over an {@link EventStore}: the event feeds, the uptime
 * series and the effective commission shown on a validator's page.
 *
 * @since 1.0.0
 */
public class ValidatorHistory {

    private static final Logger LOG = LoggerFactory.getLogger(ValidatorHistory.class);

    private final EventStore store;
    private final UptimeReconstructor reconstructor;

    public ValidatorHistory(EventStore store) {
        this(store, new UptimeReconstructor());
    }

    public ValidatorHistory(EventStore store, UptimeReconstructor reconstructor) {
        this.store = Objects.requireNonNull(store, "EventStore must not be null");
        this.reconstructor = Objects.requireNonNull(reconstructor, "UptimeReconstructor must not be null");
    }

    /**
     * Event feed of the most recent epochs.
     *
     * <p>
     * Selects the events of epochs {@code [latest - epochs, latest]}, where
     * {@code latest} is the newest epoch in the store. With {@code showAll}
     * every event is returned; otherwise only the most severe event per
     * validator.
     * </p>
     *
     * @param epochs  how many epochs before the latest to include; not negative
     * @param showAll {@code true} for every event, {@code false} for one per validator
     * @return the feed, newest first; empty when the store holds nothing
     */
    public List<ChangeEvent> feed(int epochs, boolean showAll) {
        if (epochs < 0) {
            throw new IllegalArgumentException("epochs must not be negative, got: " + epochs);
        }
        OptionalLong latest = store.latestEpoch();
        if (latest.isEmpty()) {
            return List.of();
        }
        long minEpoch = latest.getAsLong() - epochs;
        List<ChangeEvent> events = store.changeEvents(minEpoch, latest.getAsLong());
        LOG.debug("Feed over epochs {}-{}: {} event(s), showAll={}", minEpoch, latest.getAsLong(),
                events.size(), showAll);
        return EventAggregator.aggregate(events, showAll ? AggregationMode.ALL : AggregationMode.MOST_SEVERE);
    }

    /**
     * Per-epoch feed: the most severe event per validator, epoch and
     * attribute, so no validator disappears from the epoch it changed in.
     *
     * @param epochFrom first epoch, inclusive
     * @param epochTo   last epoch, inclusive
     * @return the feed, newest first
     */
    public List<ChangeEvent> epochFeed(long epochFrom, long epochTo) {
        if (epochFrom > epochTo) {
            throw new IllegalArgumentException("epochFrom " + epochFrom + " is after epochTo " + epochTo);
        }
        return EventAggregator.aggregate(store.changeEvents(epochFrom, epochTo),
                AggregationMode.MOST_SEVERE, Grouping.PER_ENTITY_EPOCH_KIND);
    }

    /**
     * Daily availability of one validator between {@code from} and {@code to}.
     *
     * <p>
     * An outage that began before {@code from} and is still open at
     * {@code from} counts from the start of the window.
     * </p>
     *
     * @param entityId the validator
     * @param from     window start
     * @param to       window end, usually now
     * @return one entry per calendar day, oldest first
     */
    public List<DailyAvailability> uptime(String entityId, Instant from, Instant to) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        List<LivenessEvent> events = store.livenessEvents(entityId, from, to);
        boolean downAtStart = store.lastLivenessEventBefore(entityId, from)
                .map(e -> e.getKind() == LivenessKind.WENT_DOWN)
                .orElse(false);
        return reconstructor.reconstruct(entityId, events, from, to, store.isDelinquent(entityId), downAtStart);
    }

    /**
     * Effective commission of a validator from its latest stored fee and MEV
     * commission, with the default MEV reward share.
     *
     * @param entityId the validator
     * @return the blended rate; empty when no fee commission is stored
     */
    public OptionalDouble effectiveCommission(String entityId) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        EntityState state = store.loadStates(List.of(entityId)).get(entityId);
        if (state == null) {
            return OptionalDouble.empty();
        }
        AttributeSnapshot fee = state.latest(AttributeKind.COMMISSION);
        if (fee == null || fee.getValue() == null) {
            return OptionalDouble.empty();
        }
        AttributeSnapshot mev = state.latest(AttributeKind.MEV);
        return OptionalDouble.of(EffectiveCommission.calculate(fee.getValue(), mev != null ? mev.getValue() : null));
    }
}
