package com.signalsentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for Signal Sentinel.
 * <p>
 * Reporters (e.g. Prometheus) are configured at cluster level; the job only
 * defines the metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code snapshots_evaluated_total} – snapshots that ran a full cycle</li>
 *   <li>{@code snapshots_skipped_total} – snapshots dropped as out of order or failed</li>
 *   <li>{@code candidate_alerts_total} – candidates produced by the engine</li>
 *   <li>{@code alerts_dispatched_total} – messages confirmed by the channel</li>
 *   <li>{@code dispatch_rejected_total} – candidates not delivered</li>
 *   <li>{@code cycle_latency_ms} – histogram of evaluate + dispatch time</li>
 * </ul>
 */
public class AlertMetrics {

    private final Counter snapshotsEvaluated;
    private final Counter snapshotsSkipped;
    private final Counter candidateAlerts;
    private final Counter alertsDispatched;
    private final Counter dispatchRejected;
    private final Histogram cycleLatency;

    public AlertMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("signal_sentinel");

        this.snapshotsEvaluated = group.counter("snapshots_evaluated_total");
        this.snapshotsSkipped = group.counter("snapshots_skipped_total");
        this.candidateAlerts = group.counter("candidate_alerts_total");
        this.alertsDispatched = group.counter("alerts_dispatched_total");
        this.dispatchRejected = group.counter("dispatch_rejected_total");

        // sliding window of the last 350 cycles
        this.cycleLatency = group
                .histogram("cycle_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementSnapshotsEvaluated() {
        snapshotsEvaluated.inc();
    }

    public void incrementSnapshotsSkipped() {
        snapshotsSkipped.inc();
    }

    public void addCandidates(int count) {
        candidateAlerts.inc(count);
    }

    public void incrementDispatched() {
        alertsDispatched.inc();
    }

    public void incrementRejected() {
        dispatchRejected.inc();
    }

    public void recordLatency(long milliseconds) {
        cycleLatency.update(milliseconds);
    }
}
