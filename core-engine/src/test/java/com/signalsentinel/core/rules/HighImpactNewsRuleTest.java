package com.signalsentinel.core.rules;

import com.signalsentinel.core.config.AlertConfig;
import com.signalsentinel.core.model.AlertType;
import com.signalsentinel.core.model.CandidateAlert;
import com.signalsentinel.core.model.MarketSnapshot;
import com.signalsentinel.core.model.NewsItem;
import com.signalsentinel.core.state.EvaluationState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link HighImpactNewsRule}.
 */
class HighImpactNewsRuleTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private final HighImpactNewsRule rule = new HighImpactNewsRule();
    private final AlertConfig config = AlertConfig.of(80, 8, 2000, 30);

    @Test
    @DisplayName("Should fire for the highest-scoring qualifying item")
    void shouldPickHighestScore() {
        MarketSnapshot snapshot = snapshot(T0,
                news("n1", 8.2, "ETF inflows accelerate"),
                news("n2", 9.4, "Exchange halts withdrawals"),
                news("n3", 4.0, "Minor update"));

        RuleOutcome outcome = rule.evaluate(snapshot, config, EvaluationState.initial());

        assertThat(outcome.getAlerts()).hasSize(1);
        CandidateAlert alert = outcome.getAlerts().get(0);
        assertThat(alert.getType()).isEqualTo(AlertType.HIGH_IMPACT_NEWS_ALERT);
        assertThat(alert.getSubjectId()).contains("n2");
        assertThat(alert.getTitle()).isEqualTo("High impact news signal");
        assertThat(alert.getMessage()).isEqualTo("High-impact news score 9.4.\nExchange halts withdrawals");
        assertThat(alert.getScore()).contains(9.4);
        assertThat(outcome.getNextState().isNewsCandidated("n2")).isTrue();
        assertThat(outcome.getNextState().isNewsCandidated("n1")).isFalse();
    }

    @Test
    @DisplayName("Should break score ties by ascending id")
    void shouldBreakTiesById() {
        MarketSnapshot snapshot = snapshot(T0, news("b", 9.0, "B"), news("a", 9.0, "A"));

        RuleOutcome outcome = rule.evaluate(snapshot, config, EvaluationState.initial());

        assertThat(outcome.getAlerts()).singleElement()
                .satisfies(alert -> assertThat(alert.getSubjectId()).contains("a"));
    }

    @Test
    @DisplayName("Should skip ids that already produced a candidate")
    void shouldSkipCandidatedIds() {
        EvaluationState state = EvaluationState.initial().withCandidatedNewsId("n2");
        MarketSnapshot snapshot = snapshot(T0, news("n1", 8.2, "Older"), news("n2", 9.4, "Seen"));

        RuleOutcome outcome = rule.evaluate(snapshot, config, state);

        assertThat(outcome.getAlerts()).singleElement()
                .satisfies(alert -> assertThat(alert.getSubjectId()).contains("n1"));
    }

    @Test
    @DisplayName("Should clamp scores into [0, 10] before comparing")
    void shouldClampScores() {
        MarketSnapshot snapshot = snapshot(T0, news("huge", 42.0, "Out of range"));

        RuleOutcome outcome = rule.evaluate(snapshot, config, EvaluationState.initial());

        assertThat(outcome.getAlerts()).singleElement()
                .satisfies(alert -> assertThat(alert.getScore()).contains(10.0));
        assertThat(HighImpactNewsRule.clampScore(-3)).isZero();
        assertThat(HighImpactNewsRule.clampScore(Double.NaN)).isZero();
    }

    @Test
    @DisplayName("Should mark the item as seen even when cooldown suppresses it")
    void shouldConsumeItemDuringCooldown() {
        EvaluationState state = EvaluationState.initial()
                .withFired(AlertType.HIGH_IMPACT_NEWS_ALERT, T0);
        MarketSnapshot snapshot = snapshot(T0.plus(Duration.ofMinutes(1)), news("n9", 9.9, "Suppressed"));

        RuleOutcome outcome = rule.evaluate(snapshot, config, state);

        assertThat(outcome.getAlerts()).isEmpty();
        assertThat(outcome.getNextState().isNewsCandidated("n9")).isTrue();
        assertThat(outcome.getNextState().getLastFired(AlertType.HIGH_IMPACT_NEWS_ALERT)).contains(T0);
    }

    @Test
    @DisplayName("Should ignore items below threshold or without an id")
    void shouldIgnoreNonQualifyingItems() {
        MarketSnapshot snapshot = snapshot(T0, news("low", 7.9, "Low"), news(" ", 9.9, "Blank id"));

        RuleOutcome outcome = rule.evaluate(snapshot, config, EvaluationState.initial());

        assertThat(outcome.getAlerts()).isEmpty();
        assertThat(outcome.getNextState().getCandidatedNewsIds()).isEmpty();
    }

    private static NewsItem news(String id, double score, String title) {
        return new NewsItem(id, title, score, "bullish", 70);
    }

    private static MarketSnapshot snapshot(Instant at, NewsItem... items) {
        return MarketSnapshot.builder()
                .news(List.of(items))
                .timestamp(at)
                .build();
    }
}
