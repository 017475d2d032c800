package com.signalsentinel.core.dispatch;

import com.signalsentinel.core.model.AlertSeverity;
import com.signalsentinel.core.model.AlertType;
import com.signalsentinel.core.model.CandidateAlert;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertMessageFormatter}.
 */
class AlertMessageFormatterTest {

    private static final Instant AT = Instant.parse("2024-05-01T09:05:42Z");

    private final AlertMessageFormatter formatter = new AlertMessageFormatter();

    @Test
    @DisplayName("Should render the market template")
    void shouldFormatMarketAlert() {
        CandidateAlert alert = alert(AlertType.MARKET_STATE_ALERT, AlertSeverity.MEDIUM, 85.0, null);

        String text = formatter.format(alert, new MarketContext("BTC", 85, "bullish", 72.5));

        assertThat(text).isEqualTo(String.join("\n",
                "🚨 SIGNAL SENTINEL ALERT",
                "",
                "Market state shift detected",
                "",
                "Market: BTC",
                "Score crossed: 85",
                "Bias: Bullish",
                "Confidence: 72.5%",
                "",
                "Key risk:",
                "Momentum may weaken if volume does not follow.",
                "",
                "Time: 2024-05-01 09:05 UTC"));
    }

    @Test
    @DisplayName("Should render the news template with a category-specific caveat")
    void shouldFormatNewsAlert() {
        CandidateAlert alert = alert(AlertType.HIGH_IMPACT_NEWS_ALERT, AlertSeverity.HIGH, 8.5, "n1");

        String text = formatter.format(alert,
                new NewsContext("ETH", "n1", "SEC delays ETF decision", "BEARISH", "macro"));

        assertThat(text).contains(
                "High-impact market signal\n\nSEC delays ETF decision\n\nMarket: ETH",
                "Impact: HIGH",
                "Bias: Bearish",
                "Key risk:\nMacro headline risk could reverse direction quickly.");
    }

    @Test
    @DisplayName("Should fall back to a generic caveat for uncategorized news")
    void shouldUseFallbackCaveat() {
        CandidateAlert alert = alert(AlertType.HIGH_IMPACT_NEWS_ALERT, AlertSeverity.HIGH, 9.0, "n1");

        String text = formatter.format(alert, new NewsContext("BTC", "n1", "Title", "neutral", null));

        assertThat(text).contains("Key risk:\nMonitor for confirmation before acting.");
    }

    @Test
    @DisplayName("Should render signed, grouped whale net flow")
    void shouldFormatWhaleAlert() {
        CandidateAlert alert = alert(AlertType.WHALE_ACTIVITY_ALERT, AlertSeverity.HIGH, null, null);

        String text = formatter.format(alert, new WhaleContext("BTC", 2265));

        assertThat(text).contains("Whale activity spike detected", "Net flow: +2,265 BTC",
                "Large flows may reflect short-term positioning.");
        assertThat(AlertMessageFormatter.signedGrouped(-1_234_567.5)).isEqualTo("-1,234,567.5");
        assertThat(AlertMessageFormatter.signedGrouped(-0.0)).isEqualTo("+0");
    }

    @Test
    @DisplayName("Should refuse a context of another alert type")
    void shouldRejectMismatchedContext() {
        CandidateAlert alert = alert(AlertType.MARKET_STATE_ALERT, AlertSeverity.MEDIUM, 85.0, null);

        assertThatThrownBy(() -> formatter.format(alert, new WhaleContext("BTC", 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should pick the same caveat for the same score every time")
    void shouldSelectCaveatDeterministically() {
        CandidateAlert alert = alert(AlertType.MARKET_STATE_ALERT, AlertSeverity.MEDIUM, 81.5, null);

        String first = KeyRiskCatalog.keyRisk(alert, null);

        assertThat(KeyRiskCatalog.keyRisk(alert, null)).isEqualTo(first);
        assertThat(KeyRiskCatalog.selectIndex(81.5, 2)).isEqualTo(1);
        assertThat(KeyRiskCatalog.selectIndex(-0.5, 2)).isEqualTo(1);
        assertThat(KeyRiskCatalog.selectIndex(Double.NaN, 2)).isZero();
    }

    private static CandidateAlert alert(AlertType type, AlertSeverity severity, Double score, String subjectId) {
        return CandidateAlert.builder()
                .type(type)
                .severity(severity)
                .title("title")
                .message("line", null)
                .score(score)
                .subjectId(subjectId)
                .createdAt(AT)
                .build();
    }
}
