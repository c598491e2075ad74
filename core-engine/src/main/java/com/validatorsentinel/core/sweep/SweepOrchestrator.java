package com.validatorsentinel.core.sweep;

import com.validatorsentinel.core.config.ThresholdsConfig;
import com.validatorsentinel.core.detection.DeltaDetector;
import com.validatorsentinel.core.detection.EmitDecision;
import com.validatorsentinel.core.detection.ThresholdClassifier;
import com.validatorsentinel.core.model.AttributeKind;
import com.validatorsentinel.core.model.AttributeSnapshot;
import com.validatorsentinel.core.model.ChangeEvent;
import com.validatorsentinel.core.model.EntityState;
import com.validatorsentinel.core.model.LivenessEvent;
import com.validatorsentinel.core.model.Notification;
import com.validatorsentinel.core.model.Severity;
import com.validatorsentinel.core.model.SweepResult;
import com.validatorsentinel.core.model.ValidatorObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs one detection sweep over a batch of validator observations.
 *
 * <p>
 * For every observation the fee commission and the MEV commission go
 * through the {@link DeltaDetector}; a changed value is classified by the
 * {@link ThresholdClassifier} and becomes a {@link ChangeEvent}, plus a
 * {@link Notification} when its severity is one of the configured
 * {@code notifySeverities}. A flipped delinquency flag becomes a
 * {@link LivenessEvent}. The orchestrator only computes the write set; it
 * never touches storage or notification channels.
 * </p>
 *
 * <h3>Ordering</h3>
 * <p>
 * Observations are applied in {@code (entityId, epoch, slot)} order and the
 * running state of an entity is carried from one observation to the next,
 * so a second observation of the same validator in one batch is compared
 * against the first. Observations sharing {@code (entityId, epoch, slot)}
 * collapse to the last one in that order, as they would overwrite the same
 * snapshot. An observation taken before the entity's most recent recorded
 * snapshot, by {@code (epoch, slot)}, is skipped.
 * </p>
 *
 * <h3>Fault isolation</h3>
 * <p>
 * An exception while processing one validator discards that validator's
 * output for the sweep, adds it to {@link SweepResult#getFailedEntities()}
 * and the sweep moves on to the next validator.
 * </p>
 *
 * <p>
 * Thread-safe after construction.
 * </p>
 *
 * @since 1.0.0
 */
public class SweepOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(SweepOrchestrator.class);

    /** Application order of observations within a sweep. */
    public static final Comparator<ValidatorObservation> SWEEP_ORDER = Comparator
            .comparing(ValidatorObservation::getEntityId)
            .thenComparingLong(ValidatorObservation::getEpoch)
            .thenComparingLong(ValidatorObservation::getSlot);

    private final DeltaDetector deltaDetector;
    private final ThresholdClassifier classifier;
    private final Set<Severity> notifySeverities;
    private final Clock clock;

    public SweepOrchestrator(ThresholdsConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * @param config thresholds and notification severities; must be valid
     * @param clock  source of the timestamp for observations that carry none
     */
    public SweepOrchestrator(ThresholdsConfig config, Clock clock) {
        Objects.requireNonNull(config, "ThresholdsConfig must not be null");
        this.deltaDetector = new DeltaDetector();
        this.classifier = new ThresholdClassifier(config);
        this.notifySeverities = config.notifySeveritySet();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Compute the write set for a batch of observations.
     *
     * @param observations the batch, in any order; must not be {@code null}
     * @param priorState   last recorded state keyed by entity id; entities
     *                     missing from the map are treated as never seen
     * @return the combined result, never {@code null}
     */
    public SweepResult runSweep(Collection<ValidatorObservation> observations, Map<String, EntityState> priorState) {
        Objects.requireNonNull(observations, "Observations must not be null");
        Objects.requireNonNull(priorState, "Prior state map must not be null");

        List<ValidatorObservation> ordered = new ArrayList<>(observations.size());
        for (ValidatorObservation observation : observations) {
            if (observation == null || observation.getEntityId() == null) {
                LOG.warn("Skipping observation without entity id: {}", observation);
                continue;
            }
            ordered.add(observation);
        }
        ordered.sort(SWEEP_ORDER);
        ordered = lastPerPosition(ordered);

        SweepResult.Builder sweep = SweepResult.builder();
        int entities = 0;
        int index = 0;
        while (index < ordered.size()) {
            String entityId = ordered.get(index).getEntityId();
            int end = index;
            while (end < ordered.size() && entityId.equals(ordered.get(end).getEntityId())) {
                end++;
            }
            entities++;
            try {
                EntityState state = priorState.getOrDefault(entityId, EntityState.unknown(entityId));
                SweepResult.Builder entity = SweepResult.builder();
                for (ValidatorObservation observation : ordered.subList(index, end)) {
                    EntitySweep step = sweepEntity(observation, state);
                    entity.addAll(step.getResult());
                    state = step.getNextState();
                }
                sweep.addAll(entity.build());
            } catch (RuntimeException e) {
                LOG.error("Sweep failed for validator {}; skipping it for this sweep", entityId, e);
                sweep.failedEntity(entityId);
            }
            index = end;
        }

        SweepResult result = sweep.build();
        LOG.info("Sweep over {} observation(s) of {} validator(s) produced {}",
                ordered.size(), entities, result);
        return result;
    }

    /**
     * Drop every observation followed by another one of the same entity at
     * the same {@code (epoch, slot)}, so the last of them in sweep order wins.
     *
     * @param ordered observations sorted by {@link #SWEEP_ORDER}
     * @return new list with one observation per {@code (entityId, epoch, slot)}
     */
    static List<ValidatorObservation> lastPerPosition(List<ValidatorObservation> ordered) {
        List<ValidatorObservation> kept = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            ValidatorObservation current = ordered.get(i);
            if (i + 1 < ordered.size() && SWEEP_ORDER.compare(current, ordered.get(i + 1)) == 0) {
                LOG.debug("Observation of {} at epoch {} slot {} superseded by a later one in the batch",
                        current.getEntityId(), current.getEpoch(), current.getSlot());
                continue;
            }
            kept.add(current);
        }
        return kept;
    }

    /**
     * Process a single observation against the state of its validator.
     *
     * @param observation the observation; must not be {@code null}
     * @param prior       the validator's last recorded state; must belong to
     *                    the same entity
     * @return the write set of this observation and the state after it
     * @throws IllegalArgumentException if {@code prior} belongs to another
     *                                  entity
     */
    public EntitySweep sweepEntity(ValidatorObservation observation, EntityState prior) {
        Objects.requireNonNull(observation, "Observation must not be null");
        Objects.requireNonNull(prior, "Prior state must not be null");
        String entityId = Objects.requireNonNull(observation.getEntityId(), "entityId must not be null");
        if (!entityId.equals(prior.getEntityId())) {
            throw new IllegalArgumentException("State of '" + prior.getEntityId()
                    + "' cannot be used for observation of '" + entityId + "'");
        }

        if (prior.hasSnapshotAfter(observation.getEpoch(), observation.getSlot())) {
            LOG.warn("Skipping stale observation of {} at epoch {} slot {}: a later snapshot is recorded",
                    entityId, observation.getEpoch(), observation.getSlot());
            return new EntitySweep(SweepResult.empty(), prior);
        }

        Instant observedAt = observation.getObservedAt() != null ? observation.getObservedAt() : clock.instant();
        SweepResult.Builder result = SweepResult.builder();
        EntityState state = prior;

        for (AttributeKind kind : AttributeKind.values()) {
            AttributeSnapshot last = state.latest(kind);
            Integer value = observation.valueOf(kind);
            EmitDecision decision = deltaDetector.shouldEmit(kind, last, value);
            if (!decision.emit()) {
                continue;
            }

            AttributeSnapshot snapshot = new AttributeSnapshot(entityId, kind, observation.getEpoch(),
                    observation.getSlot(), observedAt, value);
            result.snapshot(snapshot);
            state = state.withSnapshot(snapshot);

            if (decision.requiresChangeEvent()) {
                Severity severity = classifier.classify(kind, last.getValue(), value);
                ChangeEvent event = ChangeEvent.builder()
                        .entityId(entityId)
                        .attribute(kind)
                        .epoch(observation.getEpoch())
                        .observedAt(observedAt)
                        .fromValue(last.getValue())
                        .toValue(value)
                        .severity(severity)
                        .build();
                result.changeEvent(event);
                if (notifySeverities.contains(severity)) {
                    result.notification(Notification.of(event));
                }
                LOG.debug("{} change for {}: {}", severity, entityId, event);
            }
        }

        if (observation.isLivenessSampled()) {
            boolean newFlag = observation.getDelinquent();
            if (deltaDetector.shouldEmitLiveness(state.isDelinquent(), newFlag)) {
                LivenessEvent event = new LivenessEvent(entityId, deltaDetector.livenessKind(newFlag), observedAt);
                result.livenessTransition(event);
                state = state.withDelinquent(newFlag);
                LOG.debug("Liveness transition for {}: {}", entityId, event.getKind());
            }
        }

        return new EntitySweep(result.build(), state);
    }

    /**
     * Result of processing one observation: what to write and the state of
     * the validator afterwards.
     */
    public static final class EntitySweep {
        private final SweepResult result;
        private final EntityState nextState;

        public EntitySweep(SweepResult result, EntityState nextState) {
            this.result = Objects.requireNonNull(result, "result must not be null");
            this.nextState = Objects.requireNonNull(nextState, "nextState must not be null");
        }

        public SweepResult getResult() {
            return result;
        }

        public EntityState getNextState() {
            return nextState;
        }

        @Override
        public String toString() {
            return "EntitySweep{result=" + result + ", nextState=" + nextState + '}';
        }
    }
}
