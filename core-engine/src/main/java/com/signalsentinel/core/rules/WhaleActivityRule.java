package com.signalsentinel.core.rules;

import com.signalsentinel.core.config.AlertConfig;
import com.signalsentinel.core.model.AlertSeverity;
import com.signalsentinel.core.model.AlertType;
import com.signalsentinel.core.model.CandidateAlert;
import com.signalsentinel.core.model.MarketSnapshot;
import com.signalsentinel.core.model.Numbers;
import com.signalsentinel.core.model.WhaleFlow;
import com.signalsentinel.core.state.EvaluationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Whale net-flow spike rule.
 *
 * <p>
 * Compares the current net flow with the value seen on the previous cycle
 * and fires when {@code |current - previous| >= whaleNetFlowThreshold} and
 * the whale alert type is not cooling down. The first observation only
 * records the value.
 * </p>
 *
 * @since 1.0.0
 */
public class WhaleActivityRule implements AlertRule {

    private static final Logger LOG = LoggerFactory.getLogger(WhaleActivityRule.class);

    static final String TITLE = "Whale activity spike";

    @Override
    public RuleOutcome evaluate(MarketSnapshot snapshot, AlertConfig config, EvaluationState state) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        Optional<WhaleFlow> whale = snapshot.getWhale();
        if (whale.isEmpty() || !Double.isFinite(whale.get().getNetFlow())) {
            LOG.trace("Whale net flow absent or not finite – skipping whale rule");
            return RuleOutcome.quiet(state);
        }

        Instant now = snapshot.getTimestamp();
        double current = whale.get().getNetFlow();
        double threshold = config.getWhaleNetFlowThreshold();

        Optional<Double> previous = state.getLastWhaleNetFlow();
        EvaluationState next = state.withLastWhaleNetFlow(current);

        if (previous.isEmpty()) {
            LOG.debug("Initial whale net flow recorded: {}", current);
            return RuleOutcome.quiet(next);
        }

        double delta = current - previous.get();
        if (Math.abs(delta) < threshold) {
            return RuleOutcome.quiet(next);
        }
        if (Cooldowns.isCoolingDown(state, AlertType.WHALE_ACTIVITY_ALERT, now, config.cooldown())) {
            LOG.debug("Whale spike delta={} suppressed by cooldown", delta);
            return RuleOutcome.quiet(next);
        }

        String direction = delta > 0 ? "inflow spike" : "outflow spike";
        CandidateAlert alert = CandidateAlert.builder()
                .type(AlertType.WHALE_ACTIVITY_ALERT)
                .severity(AlertSeverity.HIGH)
                .title(TITLE)
                .message("Whale net flow " + direction + ": Δ " + Numbers.fixed(delta, 0) + ".",
                        "Threshold: " + Numbers.plain(threshold) + ".")
                .createdAt(now)
                .build();

        LOG.debug("Whale rule fired: {} -> {} (delta={})", previous.get(), current, delta);
        return RuleOutcome.fired(alert, next.withFired(AlertType.WHALE_ACTIVITY_ALERT, now));
    }

    @Override
    public AlertType getType() {
        return AlertType.WHALE_ACTIVITY_ALERT;
    }
}
