package com.signalsentinel.core.dispatch;

import com.signalsentinel.core.model.AlertType;
import com.signalsentinel.core.model.CandidateAlert;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pools of "why this might not matter" caveat lines.
 *
 * <p>
 * Pools are keyed by alert type, or by {@code <type>_<category>} for
 * categorised news. Selection is deterministic: the index is
 * {@code floor(score * 10)} modulo the pool size, a missing score counting as
 * zero, so the same alert always carries the same caveat.
 * </p>
 *
 * @since 1.0.0
 */
public final class KeyRiskCatalog {

    static final String FALLBACK = "Monitor for confirmation before acting.";

    private static final Map<String, List<String>> POOLS = Map.of(
            AlertType.MARKET_STATE_ALERT.name(), List.of(
                    "Momentum may weaken if volume does not follow.",
                    "Score crossing may be temporary without confirmation."),
            AlertType.HIGH_IMPACT_NEWS_ALERT.name() + "_sentiment", List.of(
                    "Crowded positioning may reduce follow-through.",
                    "Sentiment strength lacks volume confirmation."),
            AlertType.HIGH_IMPACT_NEWS_ALERT.name() + "_macro", List.of(
                    "Policy uncertainty may increase short-term volatility.",
                    "Macro headline risk could reverse direction quickly."),
            AlertType.HIGH_IMPACT_NEWS_ALERT.name() + "_onchain", List.of(
                    "Large flows may reflect positioning rather than conviction.",
                    "On-chain activity could be short-term rebalancing."),
            AlertType.WHALE_ACTIVITY_ALERT.name(), List.of(
                    "Large flows may reflect short-term positioning.",
                    "Whale activity does not guarantee directional move."));

    private KeyRiskCatalog() {
        // utility class
    }

    /**
     * @param alert    the alert being formatted
     * @param category optional category, {@code null} for none
     * @return the caveat line for this alert
     */
    public static String keyRisk(CandidateAlert alert, String category) {
        List<String> pool = null;
        if (category != null && !category.isBlank()) {
            pool = POOLS.get(alert.getType().name() + "_" + category.trim().toLowerCase(Locale.ROOT));
        }
        if (pool == null) {
            pool = POOLS.get(alert.getType().name());
        }
        if (pool == null || pool.isEmpty()) {
            return FALLBACK;
        }
        return pool.get(selectIndex(alert.getScore().orElse(0d), pool.size()));
    }

    static int selectIndex(double score, int poolSize) {
        double scaled = Double.isFinite(score) ? Math.floor(score * 10) : 0;
        return (int) Math.floorMod((long) scaled, (long) poolSize);
    }
}
