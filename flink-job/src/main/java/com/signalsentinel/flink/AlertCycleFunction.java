package com.signalsentinel.flink;

import com.signalsentinel.core.channel.AlertChannel;
import com.signalsentinel.core.channel.AlertChannelFactory;
import com.signalsentinel.core.config.EngineConfig;
import com.signalsentinel.core.dispatch.AlertDispatcher;
import com.signalsentinel.core.dispatch.DispatchResult;
import com.signalsentinel.core.engine.AlertEngine;
import com.signalsentinel.core.model.MarketSnapshot;
import com.signalsentinel.core.state.InMemoryDispatchStateStore;
import com.signalsentinel.core.state.InMemoryEvaluationStateStore;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Flink {@link ProcessFunction} that runs one evaluate + dispatch cycle per
 * incoming {@link MarketSnapshot} and emits a {@link DispatchResult} for
 * every attempted candidate.
 *
 * <h3>State Management</h3>
 * <p>
 * Evaluation and dispatch state live in in-memory stores created in
 * {@link #open(Configuration)}. They are not checkpointed: after a restart the
 * engine starts fresh, which suppresses the first market and whale
 * observation again. The operator must run with parallelism 1, otherwise
 * cooldowns and dedup no longer hold.
 * </p>
 *
 * <h3>Ordering</h3>
 * <p>
 * Cycles are sequential and run through {@link AlertCycle}. A snapshot whose
 * timestamp is earlier than the last processed one is dropped.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertCycleFunction extends ProcessFunction<MarketSnapshot, DispatchResult> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AlertCycleFunction.class);

    private final EngineConfig engineConfig;
    private final JobConfig jobConfig;

    private transient AlertCycle cycle;
    private transient AlertMetrics metrics;

    /**
     * @param engineConfig validated engine configuration
     * @param jobConfig    deployment settings (asset and channel credentials)
     */
    public AlertCycleFunction(EngineConfig engineConfig, JobConfig jobConfig) {
        this.engineConfig = Objects.requireNonNull(engineConfig, "EngineConfig must not be null");
        this.jobConfig = Objects.requireNonNull(jobConfig, "JobConfig must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        AlertChannel channel = AlertChannelFactory.create(
                jobConfig.getTelegramBotToken(),
                jobConfig.getTelegramChannelId(),
                jobConfig.getTelegramTimeout());

        cycle = new AlertCycle(
                new AlertEngine(engineConfig.getAlerts()),
                new AlertDispatcher(engineConfig.getDispatch(), channel),
                jobConfig.getAsset(),
                new InMemoryEvaluationStateStore(),
                new InMemoryDispatchStateStore());

        metrics = new AlertMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("AlertCycleFunction opened: asset={} channel={}", jobConfig.getAsset(), channel.name());
    }

    @Override
    public void close() {
        LOG.info("AlertCycleFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(MarketSnapshot snapshot,
            ProcessFunction<MarketSnapshot, DispatchResult>.Context ctx,
            Collector<DispatchResult> out) {
        long startNanos = System.nanoTime();

        AlertCycle.Outcome outcome = cycle.run(snapshot);
        if (outcome.isSkipped()) {
            metrics.incrementSnapshotsSkipped();
        } else {
            metrics.incrementSnapshotsEvaluated();
            metrics.addCandidates(outcome.getCandidateCount());
            for (DispatchResult result : outcome.getResults()) {
                record(result);
                out.collect(result);
            }
        }

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        metrics.recordLatency(durationMs);
    }

    private void record(DispatchResult result) {
        if (result.isDispatched()) {
            metrics.incrementDispatched();
            LOG.info("Alert dispatched: {}", result);
        } else {
            metrics.incrementRejected();
            LOG.info("Alert not dispatched: {}", result);
        }
    }
}
