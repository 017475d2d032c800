package com.signalsentinel.flink;

import com.signalsentinel.core.dispatch.AlertDispatcher;
import com.signalsentinel.core.dispatch.DispatchResult;
import com.signalsentinel.core.engine.AlertEngine;
import com.signalsentinel.core.model.CandidateAlert;
import com.signalsentinel.core.model.MarketSnapshot;
import com.signalsentinel.core.state.DispatchStateStore;
import com.signalsentinel.core.state.EvaluationStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One evaluate + dispatch pass per snapshot, independent of the Flink
 * runtime. Keeps the last processed timestamp to reject snapshots that go
 * backwards, and turns any cycle failure into a skipped outcome.
 *
 * <p>
 * Not thread-safe; cycles must run sequentially.
 * </p>
 */
final class AlertCycle {

    private static final Logger LOG = LoggerFactory.getLogger(AlertCycle.class);

    private final AlertEngine engine;
    private final AlertDispatcher dispatcher;
    private final String asset;
    private final EvaluationStateStore evaluationStore;
    private final DispatchStateStore dispatchStore;

    private Instant lastTimestamp;

    AlertCycle(AlertEngine engine,
            AlertDispatcher dispatcher,
            String asset,
            EvaluationStateStore evaluationStore,
            DispatchStateStore dispatchStore) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.asset = Objects.requireNonNull(asset, "asset must not be null");
        this.evaluationStore = Objects.requireNonNull(evaluationStore, "evaluationStore must not be null");
        this.dispatchStore = Objects.requireNonNull(dispatchStore, "dispatchStore must not be null");
    }

    /**
     * Run one cycle. Never throws for runtime failures inside the engine,
     * the dispatcher or the channel.
     *
     * @param snapshot the cycle input
     * @return the outcome; skipped for out-of-order snapshots and failed cycles
     */
    Outcome run(MarketSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        if (lastTimestamp != null && snapshot.getTimestamp().isBefore(lastTimestamp)) {
            LOG.warn("Out-of-order snapshot {} (last {}) – skipping", snapshot.getTimestamp(), lastTimestamp);
            return Outcome.SKIPPED;
        }
        lastTimestamp = snapshot.getTimestamp();

        try {
            List<CandidateAlert> candidates = engine.evaluate(snapshot, evaluationStore);
            if (candidates.isEmpty()) {
                return new Outcome(false, 0, List.of());
            }
            List<DispatchResult> results = dispatcher.dispatch(
                    candidates, SnapshotContexts.of(snapshot, asset), dispatchStore);
            return new Outcome(false, candidates.size(), results);
        } catch (RuntimeException e) {
            LOG.error("Cycle {} failed – continuing with next snapshot", snapshot.getTimestamp(), e);
            return Outcome.SKIPPED;
        }
    }

    /**
     * Result of {@link #run(MarketSnapshot)}.
     */
    static final class Outcome {

        static final Outcome SKIPPED = new Outcome(true, 0, List.of());

        private final boolean skipped;
        private final int candidateCount;
        private final List<DispatchResult> results;

        Outcome(boolean skipped, int candidateCount, List<DispatchResult> results) {
            this.skipped = skipped;
            this.candidateCount = candidateCount;
            this.results = List.copyOf(results);
        }

        boolean isSkipped() {
            return skipped;
        }

        int getCandidateCount() {
            return candidateCount;
        }

        List<DispatchResult> getResults() {
            return results;
        }
    }
}
