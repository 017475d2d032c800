package com.signalsentinel.core.dispatch;

import com.signalsentinel.core.channel.AlertChannel;
import com.signalsentinel.core.channel.ChannelResult;
import com.signalsentinel.core.config.DispatchConfig;
import com.signalsentinel.core.model.AlertSeverity;
import com.signalsentinel.core.model.AlertType;
import com.signalsentinel.core.model.CandidateAlert;
import com.signalsentinel.core.state.DispatchState;
import com.signalsentinel.core.state.InMemoryDispatchStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertDispatcher}.
 */
class AlertDispatcherTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private RecordingChannel channel;
    private InMemoryDispatchStateStore store;
    private AlertDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        channel = new RecordingChannel();
        store = new InMemoryDispatchStateStore();
        dispatcher = new AlertDispatcher(DispatchConfig.of(10), channel);
    }

    @Test
    @DisplayName("Should deliver exactly one alert per cycle, highest priority first")
    void shouldDispatchSingleAlertPerCycle() {
        List<CandidateAlert> candidates = List.of(news("n1", T0), whale(T0), market(T0));

        List<DispatchResult> results = dispatcher.dispatch(candidates, allContexts("n1"), store);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).isDispatched()).isTrue();
        assertThat(results.get(0).getAlertType()).isEqualTo(AlertType.MARKET_STATE_ALERT);
        assertThat(results.get(0).getChannelResult().getMessageId()).isEqualTo("m-1");
        assertThat(channel.sent).hasSize(1);
        assertThat(channel.sent.get(0)).contains("Market state shift detected");
        assertThat(store.get().getLastSentAt()).contains(T0);
        assertThat(store.get().getLastSent(AlertType.MARKET_STATE_ALERT)).contains(T0);
    }

    @Test
    @DisplayName("Should leave dispatch state untouched when the channel fails")
    void shouldNotChangeStateOnFailure() {
        channel.failNext("chat not found");
        DispatchState before = store.get();

        List<DispatchResult> results = dispatcher.dispatch(List.of(market(T0)), allContexts("n1"), store);

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.isDispatched()).isFalse();
            assertThat(result.getReason()).isEqualTo("Channel send failed: chat not found");
            assertThat(result.getChannelResult().isSuccess()).isFalse();
        });
        assertThat(store.get()).isEqualTo(before);

        List<DispatchResult> retry = dispatcher.dispatch(List.of(market(T0.plusSeconds(60))), allContexts("n1"), store);
        assertThat(retry).singleElement().satisfies(result -> assertThat(result.isDispatched()).isTrue());
    }

    @Test
    @DisplayName("Should fall through to the next candidate after a failed send")
    void shouldTryNextCandidateAfterFailure() {
        channel.failNext("timeout");

        List<DispatchResult> results = dispatcher.dispatch(
                List.of(market(T0), whale(T0)), allContexts("n1"), store);

        assertThat(results).extracting(DispatchResult::isDispatched).containsExactly(false, true);
        assertThat(results.get(1).getAlertType()).isEqualTo(AlertType.WHALE_ACTIVITY_ALERT);
    }

    @Test
    @DisplayName("Should reject a candidate without context and continue")
    void shouldSkipMissingContext() {
        AlertContexts contexts = AlertContexts.builder()
                .whale(new WhaleContext("BTC", 2_265))
                .build();

        List<DispatchResult> results = dispatcher.dispatch(List.of(market(T0), whale(T0)), contexts, store);

        assertThat(results).hasSize(2);
        assertThat(results.get(0).getReason()).isEqualTo("Missing context for alert");
        assertThat(results.get(1).isDispatched()).isTrue();
        assertThat(channel.sent.get(0)).contains("Net flow: +2,265 BTC");
    }

    @Test
    @DisplayName("Should not match a news context registered under a different id")
    void shouldRequireExactNewsContext() {
        List<DispatchResult> results = dispatcher.dispatch(List.of(news("n1", T0)), allContexts("other"), store);

        assertThat(results).singleElement()
                .satisfies(result -> assertThat(result.getReason()).isEqualTo("Missing context for alert"));
        assertThat(channel.sent).isEmpty();
    }

    @Test
    @DisplayName("Should throttle every type during the global cooldown")
    void shouldApplyGlobalCooldown() {
        dispatcher.dispatch(List.of(market(T0)), allContexts("n1"), store);

        List<DispatchResult> results = dispatcher.dispatch(
                List.of(whale(T0.plus(Duration.ofMinutes(9)))), allContexts("n1"), store);

        assertThat(results).singleElement()
                .satisfies(result -> assertThat(result.getReason()).isEqualTo("Rate limited (cooldown active)"));
        assertThat(channel.sent).hasSize(1);

        List<DispatchResult> later = dispatcher.dispatch(
                List.of(whale(T0.plus(Duration.ofMinutes(10)))), allContexts("n1"), store);
        assertThat(later).singleElement().satisfies(result -> assertThat(result.isDispatched()).isTrue());
    }

    @Test
    @DisplayName("Should never deliver the same news id twice")
    void shouldDeduplicateNews() {
        dispatcher.dispatch(List.of(news("n1", T0)), allContexts("n1"), store);

        List<DispatchResult> results = dispatcher.dispatch(
                List.of(news("n1", T0.plus(Duration.ofHours(2)))), allContexts("n1"), store);

        assertThat(results).singleElement()
                .satisfies(result -> assertThat(result.getReason()).isEqualTo("News already dispatched: n1"));
        assertThat(store.get().getDeliveredNewsIds()).containsExactly("n1");
        assertThat(channel.sent).hasSize(1);
    }

    @Test
    @DisplayName("Should treat a throwing channel as a failed send")
    void shouldSurviveThrowingChannel() {
        AlertChannel broken = new AlertChannel() {
            @Override
            public ChannelResult send(String text) {
                throw new IllegalStateException("socket closed");
            }

            @Override
            public String name() {
                return "broken";
            }
        };
        AlertDispatcher failing = new AlertDispatcher(DispatchConfig.of(10), broken);

        List<DispatchResult> results = failing.dispatch(List.of(market(T0)), allContexts("n1"), store);

        assertThat(results).singleElement()
                .satisfies(result -> assertThat(result.getReason()).isEqualTo("Channel send failed: socket closed"));
        assertThat(store.get()).isEqualTo(DispatchState.initial());
    }

    @Test
    @DisplayName("Should return nothing for an empty candidate list")
    void shouldHandleNoCandidates() {
        assertThat(dispatcher.dispatch(List.of(), AlertContexts.empty(), store)).isEmpty();
        assertThat(channel.sent).isEmpty();
    }

    @Test
    @DisplayName("Should refuse a dispatch config without cooldown")
    void shouldRejectInvalidConfig() {
        DispatchConfig empty = new DispatchConfig();

        assertThatThrownBy(() -> new AlertDispatcher(empty, channel))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'cooldownMinutes' is required");
    }

    @Test
    @DisplayName("Should reject a news alert without a subject id even when news context exists")
    void shouldRejectNewsWithoutSubjectId() {
        CandidateAlert withoutId = CandidateAlert.builder()
                .type(AlertType.HIGH_IMPACT_NEWS_ALERT)
                .severity(AlertSeverity.HIGH)
                .title("High impact news signal")
                .message("High-impact news score 9.0.", "Exchange halts withdrawals")
                .score(9.0)
                .createdAt(T0)
                .build();
        AlertContexts contexts = AlertContexts.builder()
                .news(new NewsContext("BTC", "n1", "Exchange halts withdrawals", "bearish", null))
                .build();

        List<DispatchResult> results = dispatcher.dispatch(List.of(withoutId), contexts, store);

        assertThat(results).singleElement()
                .satisfies(result -> assertThat(result.getReason()).isEqualTo("Missing context for alert"));
        assertThat(channel.sent).isEmpty();
        assertThat(store.get().getDeliveredNewsIds()).isEmpty();
    }

    // ---------------------------------------------------------------
    // Fixtures
    // ---------------------------------------------------------------

    private static AlertContexts allContexts(String newsId) {
        return AlertContexts.builder()
                .market(new MarketContext("BTC", 85, "bullish", 72))
                .whale(new WhaleContext("BTC", 2_265))
                .news(new NewsContext("BTC", newsId, "Exchange halts withdrawals", "bearish", "macro"))
                .build();
    }

    private static CandidateAlert market(Instant at) {
        return CandidateAlert.builder()
                .type(AlertType.MARKET_STATE_ALERT)
                .severity(AlertSeverity.MEDIUM)
                .title("Market state threshold crossed")
                .message("Market score crossed above 80.", "Bias is bullish with 72% confidence.")
                .score(85.0)
                .createdAt(at)
                .build();
    }

    private static CandidateAlert whale(Instant at) {
        return CandidateAlert.builder()
                .type(AlertType.WHALE_ACTIVITY_ALERT)
                .severity(AlertSeverity.HIGH)
                .title("Whale activity spike")
                .message("Whale net flow inflow spike: Δ 2265.", "Threshold: 2000.")
                .createdAt(at)
                .build();
    }

    private static CandidateAlert news(String id, Instant at) {
        return CandidateAlert.builder()
                .type(AlertType.HIGH_IMPACT_NEWS_ALERT)
                .severity(AlertSeverity.HIGH)
                .title("High impact news signal")
                .message("High-impact news score 9.0.", "Exchange halts withdrawals")
                .score(9.0)
                .subjectId(id)
                .createdAt(at)
                .build();
    }

    private static final class RecordingChannel implements AlertChannel {
        private final List<String> sent = new ArrayList<>();
        private final Deque<String> failures = new ArrayDeque<>();
        private int sequence;

        void failNext(String reason) {
            failures.add(reason);
        }

        @Override
        public ChannelResult send(String text) {
            if (!failures.isEmpty()) {
                return ChannelResult.failed(failures.poll());
            }
            sent.add(text);
            return ChannelResult.delivered("m-" + (++sequence));
        }

        @Override
        public String name() {
            return "recording";
        }
    }
}
