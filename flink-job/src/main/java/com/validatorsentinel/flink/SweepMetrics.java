package com.validatorsentinel.flink;

import com.validatorsentinel.core.model.ChangeEvent;
import com.validatorsentinel.core.model.Severity;
import com.validatorsentinel.core.model.SweepResult;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Flink metric definitions for Validator Sentinel.
 * <p>
 * Exposed through the cluster's configured metric reporters; the job only
 * defines the metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code observations_processed_total}: observations swept</li>
 *   <li>{@code change_events_total}: commission changes recorded</li>
 *   <li>{@code rugs_detected_total}: changes classified as rugs</li>
 *   <li>{@code notifications_total}: notifications emitted</li>
 *   <li>{@code liveness_transitions_total}: delinquency flips</li>
 *   <li>{@code sweep_failures_total}: observations whose sweep threw</li>
 *   <li>{@code processing_latency_ms}: histogram of per-observation latency</li>
 * </ul>
 */
public class SweepMetrics {

    private final Counter observationsProcessed;
    private final Counter changeEvents;
    private final Counter rugsDetected;
    private final Counter notifications;
    private final Counter livenessTransitions;
    private final Counter sweepFailures;
    private final Histogram processingLatency;

    public SweepMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("validator_sentinel");

        this.observationsProcessed = group.counter("observations_processed_total");
        this.changeEvents = group.counter("change_events_total");
        this.rugsDetected = group.counter("rugs_detected_total");
        this.notifications = group.counter("notifications_total");
        this.livenessTransitions = group.counter("liveness_transitions_total");
        this.sweepFailures = group.counter("sweep_failures_total");

        // sliding window of 350 samples, exposes p50/p95/p99
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementObservationsProcessed() {
        observationsProcessed.inc();
    }

    public void incrementSweepFailures() {
        sweepFailures.inc();
    }

    /**
     * Count everything a single sweep step produced.
     */
    public void record(SweepResult result) {
        for (ChangeEvent event : result.getChangeEventsToWrite()) {
            changeEvents.inc();
            if (event.getSeverity() == Severity.RUG) {
                rugsDetected.inc();
            }
        }
        notifications.inc(result.getNotificationsToSend().size());
        livenessTransitions.inc(result.getLivenessEventsToWrite().size());
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
