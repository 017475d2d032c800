package com.signalsentinel.core.rules;

import com.signalsentinel.core.config.AlertConfig;
import com.signalsentinel.core.model.AlertSeverity;
import com.signalsentinel.core.model.AlertType;
import com.signalsentinel.core.model.CandidateAlert;
import com.signalsentinel.core.model.MarketReading;
import com.signalsentinel.core.model.MarketSnapshot;
import com.signalsentinel.core.model.Numbers;
import com.signalsentinel.core.state.EvaluationState;
import com.signalsentinel.core.state.MarketBand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Market-state threshold crossing rule.
 *
 * <p>
 * Classifies the market score into a {@link MarketBand} against
 * {@code marketScoreThreshold} and fires on a band <em>change</em> (edge
 * trigger), never on a band that merely persists.
 * </p>
 *
 * <h3>Startup</h3>
 * <p>
 * The first observation only records the band. Without a previous band there
 * is no crossing, so a freshly started process never alerts on its first
 * snapshot.
 * </p>
 *
 * <h3>Cooldown</h3>
 * <p>
 * A crossing inside the cooldown window of the last <em>fired</em> market
 * alert is swallowed; the band is still recorded so the next crossing is
 * measured from the current position.
 * </p>
 *
 * @since 1.0.0
 */
public class MarketStateRule implements AlertRule {

    private static final Logger LOG = LoggerFactory.getLogger(MarketStateRule.class);

    static final String TITLE = "Market state threshold crossed";

    @Override
    public RuleOutcome evaluate(MarketSnapshot snapshot, AlertConfig config, EvaluationState state) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        Optional<MarketReading> reading = snapshot.getMarket();
        if (reading.isEmpty() || !Double.isFinite(reading.get().getScore())) {
            LOG.trace("Market score absent or not finite – skipping market rule");
            return RuleOutcome.quiet(state);
        }

        MarketReading market = reading.get();
        Instant now = snapshot.getTimestamp();
        double threshold = config.getMarketScoreThreshold();
        MarketBand current = MarketBand.of(market.getScore(), threshold);

        Optional<MarketBand> previous = state.getLastMarketBand();
        EvaluationState next = state.withLastMarketBand(current);

        if (previous.isEmpty()) {
            LOG.debug("Initial market band recorded: {}", current);
            return RuleOutcome.quiet(next);
        }
        if (previous.get() == current) {
            return RuleOutcome.quiet(next);
        }
        if (Cooldowns.isCoolingDown(state, AlertType.MARKET_STATE_ALERT, now, config.cooldown())) {
            LOG.debug("Market band {} -> {} suppressed by cooldown", previous.get(), current);
            return RuleOutcome.quiet(next);
        }

        String direction = current == MarketBand.ABOVE ? "crossed above" : "crossed below";
        CandidateAlert alert = CandidateAlert.builder()
                .type(AlertType.MARKET_STATE_ALERT)
                .severity(AlertSeverity.MEDIUM)
                .title(TITLE)
                .message("Market score " + direction + " " + Numbers.plain(threshold) + ".",
                        "Bias is " + market.getBias() + " with "
                                + Numbers.plain(market.getConfidence()) + "% confidence.")
                .score(market.getScore())
                .createdAt(now)
                .build();

        LOG.debug("Market rule fired: {} -> {} (score={})", previous.get(), current, market.getScore());
        return RuleOutcome.fired(alert, next.withFired(AlertType.MARKET_STATE_ALERT, now));
    }

    @Override
    public AlertType getType() {
        return AlertType.MARKET_STATE_ALERT;
    }
}
