package com.validatorsentinel.core.sweep;

import com.validatorsentinel.core.model.AttributeSnapshot;
import com.validatorsentinel.core.model.ChangeEvent;
import com.validatorsentinel.core.model.EntityState;
import com.validatorsentinel.core.model.LivenessEvent;
import com.validatorsentinel.core.model.Notification;
import com.validatorsentinel.core.model.SweepResult;
import com.validatorsentinel.core.model.ValidatorObservation;
import com.validatorsentinel.core.notify.Notifier;
import com.validatorsentinel.core.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Executes one sweep against its collaborators.
 *
 * <ol>
 * <li>fetch the observations of this cycle</li>
 * <li>pre-fetch the prior state of all their validators in one call</li>
 * <li>compute the write set with {@link SweepOrchestrator}</li>
 * <li>upsert every record into the {@link EventStore}</li>
 * <li>hand each notification to the {@link Notifier}</li>
 * </ol>
 *
 * <p>
 * A failed write or notification is logged and counted; it does not stop
 * the sweep and notifications are never rolled back into writes. Re-running
 * a sweep is safe because the store upserts by key.
 * </p>
 *
 * @since 1.0.0
 */
public class SweepRunner {

    private static final Logger LOG = LoggerFactory.getLogger(SweepRunner.class);

    private final ValidatorStateSource source;
    private final EventStore store;
    private final Notifier notifier;
    private final SweepOrchestrator orchestrator;

    public SweepRunner(ValidatorStateSource source, EventStore store, Notifier notifier,
            SweepOrchestrator orchestrator) {
        this.source = Objects.requireNonNull(source, "ValidatorStateSource must not be null");
        this.store = Objects.requireNonNull(store, "EventStore must not be null");
        this.notifier = Objects.requireNonNull(notifier, "Notifier must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "SweepOrchestrator must not be null");
    }

    /**
     * Run one sweep.
     *
     * @return the outcome of the sweep
     */
    public Outcome run() {
        List<ValidatorObservation> observations = source.fetchObservations();
        Set<String> entityIds = new LinkedHashSet<>();
        for (ValidatorObservation observation : observations) {
            if (observation != null && observation.getEntityId() != null) {
                entityIds.add(observation.getEntityId());
            }
        }
        Map<String, EntityState> prior = store.loadStates(entityIds);
        LOG.info("Starting sweep: {} observation(s), {} known validator(s)", observations.size(), prior.size());

        SweepResult result = orchestrator.runSweep(observations, prior);

        int writeFailures = persist(result);
        int notifyFailures = notifyAll(result.getNotificationsToSend());

        Outcome outcome = new Outcome(result, writeFailures, notifyFailures);
        if (outcome.hasFailures()) {
            LOG.warn("Sweep finished with failures: {}", outcome);
        } else {
            LOG.info("Sweep finished: {}", outcome);
        }
        return outcome;
    }

    private int persist(SweepResult result) {
        int failures = 0;
        for (AttributeSnapshot snapshot : result.getSnapshotsToWrite()) {
            try {
                store.upsertSnapshot(snapshot);
            } catch (RuntimeException e) {
                failures++;
                LOG.error("Failed to store snapshot {}", snapshot.key(), e);
            }
        }
        for (ChangeEvent event : result.getChangeEventsToWrite()) {
            try {
                store.upsertChangeEvent(event);
            } catch (RuntimeException e) {
                failures++;
                LOG.error("Failed to store change event {}", event.key(), e);
            }
        }
        for (LivenessEvent event : result.getLivenessEventsToWrite()) {
            try {
                store.recordLivenessTransition(event);
            } catch (RuntimeException e) {
                failures++;
                LOG.error("Failed to store liveness transition {}", event.key(), e);
            }
        }
        return failures;
    }

    private int notifyAll(List<Notification> notifications) {
        int failures = 0;
        for (Notification notification : notifications) {
            try {
                notifier.send(notification);
            } catch (RuntimeException e) {
                failures++;
                LOG.error("Failed to send notification: {}", notification.summary(), e);
            }
        }
        return failures;
    }

    /**
     * What a sweep computed and how many of its side effects failed.
     */
    public static final class Outcome {
        private final SweepResult result;
        private final int writeFailures;
        private final int notificationFailures;

        Outcome(SweepResult result, int writeFailures, int notificationFailures) {
            this.result = result;
            this.writeFailures = writeFailures;
            this.notificationFailures = notificationFailures;
        }

        public SweepResult getResult() {
            return result;
        }

        public int getWriteFailures() {
            return writeFailures;
        }

        public int getNotificationFailures() {
            return notificationFailures;
        }

        public boolean hasFailures() {
            return writeFailures > 0 || notificationFailures > 0 || !result.getFailedEntities().isEmpty();
        }

        @Override
        public String toString() {
            return "Outcome{" + result +
                    ", writeFailures=" + writeFailures +
                    ", notificationFailures=" + notificationFailures +
                    '}';
        }
    }
}
