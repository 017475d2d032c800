package com.signalsentinel.core.rules;

import com.signalsentinel.core.config.AlertConfig;
import com.signalsentinel.core.model.AlertSeverity;
import com.signalsentinel.core.model.AlertType;
import com.signalsentinel.core.model.CandidateAlert;
import com.signalsentinel.core.model.MarketSnapshot;
import com.signalsentinel.core.state.EvaluationState;
import com.signalsentinel.core.state.MarketBand;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MarketStateRule}.
 */
class MarketStateRuleTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private final MarketStateRule rule = new MarketStateRule();
    private final AlertConfig config = AlertConfig.of(80, 8, 2000, 30);

    @Test
    @DisplayName("Should only record the band on the first observation")
    void shouldNotFireOnFirstObservation() {
        RuleOutcome outcome = rule.evaluate(snapshot(95, T0), config, EvaluationState.initial());

        assertThat(outcome.getAlerts()).isEmpty();
        assertThat(outcome.getNextState().getLastMarketBand()).contains(MarketBand.ABOVE);
    }

    @Test
    @DisplayName("Should fire when the score crosses above the threshold")
    void shouldFireOnUpwardCrossing() {
        EvaluationState state = EvaluationState.initial().withLastMarketBand(MarketBand.BELOW);

        RuleOutcome outcome = rule.evaluate(snapshot(85, T0), config, state);

        assertThat(outcome.getAlerts()).hasSize(1);
        CandidateAlert alert = outcome.getAlerts().get(0);
        assertThat(alert.getType()).isEqualTo(AlertType.MARKET_STATE_ALERT);
        assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.MEDIUM);
        assertThat(alert.getTitle()).isEqualTo("Market state threshold crossed");
        assertThat(alert.getMessage())
                .isEqualTo("Market score crossed above 80.\nBias is bullish with 72% confidence.");
        assertThat(alert.getScore()).contains(85.0);
        assertThat(alert.getCreatedAt()).isEqualTo(T0);
        assertThat(outcome.getNextState().getLastFired(AlertType.MARKET_STATE_ALERT)).contains(T0);
    }

    @Test
    @DisplayName("Should treat a score equal to the threshold as above")
    void shouldTreatEqualAsAbove() {
        EvaluationState state = EvaluationState.initial().withLastMarketBand(MarketBand.BELOW);

        RuleOutcome outcome = rule.evaluate(snapshot(80, T0), config, state);

        assertThat(outcome.getAlerts()).hasSize(1);
        assertThat(outcome.getAlerts().get(0).getMessage()).startsWith("Market score crossed above 80.");
    }

    @Test
    @DisplayName("Should fire on a downward crossing")
    void shouldFireOnDownwardCrossing() {
        EvaluationState state = EvaluationState.initial().withLastMarketBand(MarketBand.ABOVE);

        RuleOutcome outcome = rule.evaluate(snapshot(60, T0), config, state);

        assertThat(outcome.getAlerts()).singleElement()
                .extracting(CandidateAlert::getMessage)
                .asString()
                .startsWith("Market score crossed below 80.");
        assertThat(outcome.getNextState().getLastMarketBand()).contains(MarketBand.BELOW);
    }

    @Test
    @DisplayName("Should NOT fire while the band is unchanged")
    void shouldNotFireWithoutTransition() {
        EvaluationState state = EvaluationState.initial().withLastMarketBand(MarketBand.ABOVE);

        RuleOutcome outcome = rule.evaluate(snapshot(99, T0), config, state);

        assertThat(outcome.getAlerts()).isEmpty();
        assertThat(outcome.getNextState()).isEqualTo(state);
    }

    @Test
    @DisplayName("Should consume the transition during cooldown")
    void shouldConsumeTransitionDuringCooldown() {
        EvaluationState state = EvaluationState.initial()
                .withLastMarketBand(MarketBand.BELOW)
                .withFired(AlertType.MARKET_STATE_ALERT, T0);

        Instant now = T0.plus(Duration.ofMinutes(10));
        RuleOutcome outcome = rule.evaluate(snapshot(90, now), config, state);

        assertThat(outcome.getAlerts()).isEmpty();
        assertThat(outcome.getNextState().getLastMarketBand()).contains(MarketBand.ABOVE);
        assertThat(outcome.getNextState().getLastFired(AlertType.MARKET_STATE_ALERT)).contains(T0);
    }

    @Test
    @DisplayName("Should fire again once exactly one cooldown has elapsed")
    void shouldFireAtCooldownBoundary() {
        EvaluationState state = EvaluationState.initial()
                .withLastMarketBand(MarketBand.BELOW)
                .withFired(AlertType.MARKET_STATE_ALERT, T0);

        Instant now = T0.plus(Duration.ofMinutes(30));
        RuleOutcome outcome = rule.evaluate(snapshot(90, now), config, state);

        assertThat(outcome.getAlerts()).hasSize(1);
    }

    @Test
    @DisplayName("Should leave state untouched when the market reading is absent or not finite")
    void shouldSkipMissingMarket() {
        EvaluationState state = EvaluationState.initial().withLastMarketBand(MarketBand.BELOW);
        MarketSnapshot noMarket = MarketSnapshot.builder().timestamp(T0).build();

        assertThat(rule.evaluate(noMarket, config, state).getNextState()).isSameAs(state);
        assertThat(rule.evaluate(snapshot(Double.NaN, T0), config, state).getAlerts()).isEmpty();
        assertThat(rule.evaluate(snapshot(Double.NaN, T0), config, state).getNextState()).isSameAs(state);
    }

    private static MarketSnapshot snapshot(double score, Instant at) {
        return MarketSnapshot.builder()
                .market(score, "bullish", 72)
                .timestamp(at)
                .build();
    }
}
