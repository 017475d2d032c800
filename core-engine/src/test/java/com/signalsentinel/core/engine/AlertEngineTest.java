package com.signalsentinel.core.engine;

import com.signalsentinel.core.config.AlertConfig;
import com.signalsentinel.core.model.AlertType;
import com.signalsentinel.core.model.CandidateAlert;
import com.signalsentinel.core.model.MarketSnapshot;
import com.signalsentinel.core.model.NewsItem;
import com.signalsentinel.core.rules.AlertRule;
import com.signalsentinel.core.rules.RuleOutcome;
import com.signalsentinel.core.state.EvaluationState;
import com.signalsentinel.core.state.InMemoryEvaluationStateStore;
import com.signalsentinel.core.state.MarketBand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AlertEngine} across consecutive cycles.
 */
class AlertEngineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");
    private static final Duration CYCLE = Duration.ofMinutes(10);

    private AlertEngine engine;
    private InMemoryEvaluationStateStore store;

    @BeforeEach
    void setUp() {
        engine = new AlertEngine(AlertConfig.of(80, 8, 2000, 5));
        store = new InMemoryEvaluationStateStore();
    }

    @Test
    @DisplayName("Should never fire market or whale alerts on the first snapshot")
    void shouldNotAlertOnStartup() {
        MarketSnapshot first = MarketSnapshot.builder()
                .market(99, "bullish", 90)
                .whaleNetFlow(1_000_000)
                .timestamp(T0)
                .build();

        List<CandidateAlert> candidates = engine.evaluate(first, store);

        assertThat(candidates).isEmpty();
        assertThat(store.get().getLastMarketBand()).isPresent();
        assertThat(store.get().getLastWhaleNetFlow()).contains(1_000_000.0);
    }

    @Test
    @DisplayName("Should fire on band edges only")
    void shouldEdgeTrigger() {
        double[] scores = {70, 85, 85, 60};
        List<Integer> firedAt = new ArrayList<>();

        for (int i = 0; i < scores.length; i++) {
            MarketSnapshot snapshot = MarketSnapshot.builder()
                    .market(scores[i], "neutral", 50)
                    .timestamp(T0.plus(CYCLE.multipliedBy(i)))
                    .build();
            if (!engine.evaluate(snapshot, store).isEmpty()) {
                firedAt.add(i);
            }
        }

        assertThat(firedAt).containsExactly(1, 3);
    }

    @Test
    @DisplayName("Should fire whale alerts on large deltas only")
    void shouldComputeWhaleDelta() {
        double[] flows = {10_000, 10_050, 12_500};
        List<Integer> firedAt = new ArrayList<>();

        for (int i = 0; i < flows.length; i++) {
            MarketSnapshot snapshot = MarketSnapshot.builder()
                    .whaleNetFlow(flows[i])
                    .timestamp(T0.plus(CYCLE.multipliedBy(i)))
                    .build();
            if (!engine.evaluate(snapshot, store).isEmpty()) {
                firedAt.add(i);
            }
        }

        assertThat(firedAt).containsExactly(2);
    }

    @Test
    @DisplayName("Should never re-candidate the same news id")
    void shouldBeIdempotentForNews() {
        NewsItem item = new NewsItem("n-1", "Exchange outage", 9.1, "bearish", 80);

        List<CandidateAlert> first = engine.evaluate(newsSnapshot(T0, item), store);
        List<CandidateAlert> second = engine.evaluate(newsSnapshot(T0.plus(Duration.ofHours(1)), item), store);

        assertThat(first).singleElement()
                .satisfies(alert -> assertThat(alert.getSubjectId()).contains("n-1"));
        assertThat(second).isEmpty();
    }

    @Test
    @DisplayName("Should move to the next unseen news item on a later cycle")
    void shouldWalkNewsAcrossCycles() {
        NewsItem top = new NewsItem("a", "Top", 9.5, "bullish", 80);
        NewsItem next = new NewsItem("b", "Next", 8.5, "bullish", 80);

        List<CandidateAlert> first = engine.evaluate(newsSnapshot(T0, top, next), store);
        List<CandidateAlert> second = engine.evaluate(newsSnapshot(T0.plus(CYCLE), top, next), store);

        assertThat(first).extracting(alert -> alert.getSubjectId().orElse(null)).containsExactly("a");
        assertThat(second).extracting(alert -> alert.getSubjectId().orElse(null)).containsExactly("b");
    }

    @Test
    @DisplayName("Should return candidates in rule order when several fire together")
    void shouldCollectAllRuleCandidates() {
        store.set(EvaluationState.initial()
                .withLastMarketBand(MarketBand.BELOW)
                .withLastWhaleNetFlow(0));
        MarketSnapshot snapshot = MarketSnapshot.builder()
                .market(90, "bullish", 70)
                .whaleNetFlow(-5_000)
                .news(new NewsItem("x", "Headline", 9.0, "bearish", 60))
                .timestamp(T0)
                .build();

        List<CandidateAlert> candidates = engine.evaluate(snapshot, store);

        assertThat(candidates).extracting(CandidateAlert::getType).containsExactly(
                AlertType.MARKET_STATE_ALERT,
                AlertType.WHALE_ACTIVITY_ALERT,
                AlertType.HIGH_IMPACT_NEWS_ALERT);
    }

    @Test
    @DisplayName("Should thread state through custom rules in order and persist it once")
    void shouldThreadStateThroughRules() {
        List<EvaluationState> seen = new ArrayList<>();
        AlertRule marking = new AlertRule() {
            @Override
            public RuleOutcome evaluate(MarketSnapshot snapshot, AlertConfig config, EvaluationState state) {
                seen.add(state);
                return RuleOutcome.quiet(state.withCandidatedNewsId("rule-" + seen.size()));
            }

            @Override
            public AlertType getType() {
                return AlertType.HIGH_IMPACT_NEWS_ALERT;
            }
        };
        AlertEngine custom = new AlertEngine(AlertConfig.of(80, 8, 2000, 5), List.of(marking, marking));

        custom.evaluate(MarketSnapshot.builder().timestamp(T0).build(), store);

        assertThat(seen).hasSize(2);
        assertThat(seen.get(1).isNewsCandidated("rule-1")).isTrue();
        assertThat(store.get().getCandidatedNewsIds()).containsExactlyInAnyOrder("rule-1", "rule-2");
    }

    @Test
    @DisplayName("Should refuse an incomplete config at construction")
    void shouldRejectInvalidConfig() {
        AlertConfig partial = new AlertConfig();
        partial.setCooldownMinutes(30.0);

        assertThatThrownBy(() -> new AlertEngine(partial))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'marketScoreThreshold' is required");
    }

    private static MarketSnapshot newsSnapshot(Instant at, NewsItem... items) {
        return MarketSnapshot.builder()
                .news(List.of(items))
                .timestamp(at)
                .build();
    }
}
