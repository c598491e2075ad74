package com.validatorsentinel.flink;

import com.validatorsentinel.core.config.ThresholdsConfig;
import com.validatorsentinel.core.model.EntityState;
import com.validatorsentinel.core.model.Notification;
import com.validatorsentinel.core.model.SweepResult;
import com.validatorsentinel.core.model.ValidatorObservation;
import com.validatorsentinel.core.sweep.SweepOrchestrator;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Keyed Flink function that sweeps each validator observation against the
 * validator's last recorded state.
 *
 * <p>
 * The stream is keyed by vote account, so every validator owns one
 * {@code ValueState<EntityState>} holding its latest fee and MEV commission
 * snapshots and its delinquency flag. The state is checkpointed with the
 * job and plays the role of the stored state a batch sweep loads.
 * </p>
 *
 * <h3>Outputs</h3>
 * <ul>
 * <li>main output: the non-empty {@link SweepResult} of every observation,
 * written to the records topic</li>
 * <li>{@link #NOTIFICATIONS} side output: one {@link Notification} per change
 * whose severity is configured to notify</li>
 * </ul>
 *
 * <h3>Fault isolation</h3>
 * <p>
 * An exception while sweeping an observation is logged and counted; the
 * validator's state is left untouched and nothing is emitted for it.
 * </p>
 *
 * @since 1.0.0
 */
public class SweepProcessFunction
        extends KeyedProcessFunction<String, ValidatorObservation, SweepResult> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SweepProcessFunction.class);

    /** Side output carrying notifications for the alerts topic. */
    public static final OutputTag<Notification> NOTIFICATIONS =
            new OutputTag<>("notifications", TypeInformation.of(Notification.class));

    private final ThresholdsConfig thresholds;

    private transient ValueState<EntityState> entityState;
    private transient SweepOrchestrator orchestrator;
    private transient SweepMetrics metrics;

    /**
     * @param thresholds validated thresholds configuration
     * @throws NullPointerException  if {@code thresholds} is {@code null}
     * @throws IllegalStateException if {@code thresholds} is invalid
     */
    public SweepProcessFunction(ThresholdsConfig thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "ThresholdsConfig must not be null");
        thresholds.validate();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        ValueStateDescriptor<EntityState> descriptor = new ValueStateDescriptor<>(
                "entity-state", TypeInformation.of(EntityState.class));
        entityState = getRuntimeContext().getState(descriptor);

        orchestrator = new SweepOrchestrator(thresholds);
        metrics = new SweepMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("SweepProcessFunction opened with thresholds {}", thresholds);
    }

    @Override
    public void close() {
        LOG.info("SweepProcessFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(ValidatorObservation observation,
            KeyedProcessFunction<String, ValidatorObservation, SweepResult>.Context ctx,
            Collector<SweepResult> out) throws Exception {
        long startNanos = System.nanoTime();
        String entityId = ctx.getCurrentKey();

        EntityState prior = entityState.value();
        if (prior == null) {
            prior = EntityState.unknown(entityId);
        }

        SweepOrchestrator.EntitySweep step;
        try {
            step = orchestrator.sweepEntity(observation, prior);
        } catch (RuntimeException e) {
            LOG.error("Sweep failed for validator {} at epoch {}; state left unchanged",
                    entityId, observation.getEpoch(), e);
            metrics.incrementSweepFailures();
            return;
        }

        entityState.update(step.getNextState());

        SweepResult result = step.getResult();
        if (!result.isEmpty()) {
            out.collect(result);
            for (Notification notification : result.getNotificationsToSend()) {
                ctx.output(NOTIFICATIONS, notification);
                LOG.info("Notification: {}", notification.summary());
            }
        }

        metrics.record(result);
        metrics.incrementObservationsProcessed();
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }
}
