package com.signalsentinel.core.dispatch;

import com.signalsentinel.core.model.CandidateAlert;
import com.signalsentinel.core.model.Numbers;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders a candidate alert and its context into channel text.
 *
 * <p>
 * Each alert type has a fixed template: header, headline, an alert-specific
 * block, a caveat from {@link KeyRiskCatalog} and the cycle time in UTC.
 * Output is plain text (no markup) and fully deterministic for a given
 * alert and context.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertMessageFormatter {

    static final String HEADER = "🚨 SIGNAL SENTINEL ALERT";

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'", Locale.ROOT).withZone(ZoneOffset.UTC);

    /**
     * @param alert   candidate to render
     * @param context context whose {@link AlertContext#getAlertType()} matches
     *                the alert's type
     * @return message text
     * @throws IllegalArgumentException if the context belongs to another alert
     *                                  type
     */
    public String format(CandidateAlert alert, AlertContext context) {
        Objects.requireNonNull(alert, "alert must not be null");
        Objects.requireNonNull(context, "context must not be null");
        if (context.getAlertType() != alert.getType()) {
            throw new IllegalArgumentException("Context " + context.getAlertType()
                    + " cannot format alert " + alert.getType());
        }

        return switch (alert.getType()) {
            case MARKET_STATE_ALERT -> formatMarket(alert, (MarketContext) context);
            case WHALE_ACTIVITY_ALERT -> formatWhale(alert, (WhaleContext) context);
            case HIGH_IMPACT_NEWS_ALERT -> formatNews(alert, (NewsContext) context);
        };
    }

    private String formatMarket(CandidateAlert alert, MarketContext context) {
        return String.join("\n",
                HEADER,
                "",
                "Market state shift detected",
                "",
                "Market: " + context.getAsset(),
                "Score crossed: " + Numbers.plain(context.getScore()),
                "Bias: " + capitalize(context.getBias()),
                "Confidence: " + Numbers.plain(context.getConfidence()) + "%",
                "",
                "Key risk:",
                KeyRiskCatalog.keyRisk(alert, null),
                "",
                "Time: " + formatTime(alert.getCreatedAt()));
    }

    private String formatNews(CandidateAlert alert, NewsContext context) {
        return String.join("\n",
                HEADER,
                "",
                "High-impact market signal",
                "",
                context.getTitle(),
                "",
                "Market: " + context.getAsset(),
                "Impact: " + alert.getSeverity().name(),
                "Bias: " + capitalize(context.getBias()),
                "",
                "Key risk:",
                KeyRiskCatalog.keyRisk(alert, context.getCategory().orElse(null)),
                "",
                "Time: " + formatTime(alert.getCreatedAt()));
    }

    private String formatWhale(CandidateAlert alert, WhaleContext context) {
        return String.join("\n",
                HEADER,
                "",
                "Whale activity spike detected",
                "",
                "Market: " + context.getAsset(),
                "Net flow: " + signedGrouped(context.getNetFlow()) + " " + context.getAsset(),
                "",
                "Key risk:",
                KeyRiskCatalog.keyRisk(alert, null),
                "",
                "Time: " + formatTime(alert.getCreatedAt()));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static String formatTime(Instant instant) {
        return TIME_FORMAT.format(instant);
    }

    static String signedGrouped(double value) {
        double v = value == 0 ? 0d : value; // no "-0"
        DecimalFormat format = new DecimalFormat("#,##0.###", DecimalFormatSymbols.getInstance(Locale.US));
        String text = format.format(v);
        return v >= 0 ? "+" + text : text;
    }

    static String capitalize(String s) {
        if (s == null || s.isEmpty()) {
            return s;
        }
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1).toLowerCase(Locale.ROOT);
    }
}
