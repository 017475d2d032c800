package com.signalsentinel.core.rules;

import com.signalsentinel.core.config.AlertConfig;
import com.signalsentinel.core.model.AlertSeverity;
import com.signalsentinel.core.model.AlertType;
import com.signalsentinel.core.model.CandidateAlert;
import com.signalsentinel.core.model.MarketSnapshot;
import com.signalsentinel.core.model.NewsItem;
import com.signalsentinel.core.model.Numbers;
import com.signalsentinel.core.state.EvaluationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * High-impact news rule.
 *
 * <p>
 * Qualifying items are those whose score, clamped into {@code [0, 10]}, is at
 * least {@code highImpactNewsScore}. They are walked by descending score,
 * ties broken by ascending id, so the outcome never depends on upstream list
 * order.
 * </p>
 *
 * <h3>Strict fatigue</h3>
 * <ul>
 * <li>At most one news candidate is produced per cycle.</li>
 * <li>An id that was ever considered is never considered again.</li>
 * <li>The first not-yet-considered item is marked as considered even when
 * the cooldown blocks the candidate; an item whose only chance fell inside
 * the cooldown window is dropped for good.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class HighImpactNewsRule implements AlertRule {

    private static final Logger LOG = LoggerFactory.getLogger(HighImpactNewsRule.class);

    static final String TITLE = "High impact news signal";

    static final double MIN_SCORE = 0.0;
    static final double MAX_SCORE = 10.0;

    private static final Comparator<ScoredItem> IMPACT_ORDER =
            Comparator.comparingDouble(ScoredItem::score).reversed()
                    .thenComparing(scored -> scored.item().getId());

    @Override
    public RuleOutcome evaluate(MarketSnapshot snapshot, AlertConfig config, EvaluationState state) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        Instant now = snapshot.getTimestamp();
        double threshold = config.getHighImpactNewsScore();

        List<ScoredItem> qualifying = snapshot.getNews().stream()
                .filter(Objects::nonNull)
                .filter(item -> item.getId() != null && !item.getId().isBlank())
                .map(item -> new ScoredItem(item, clampScore(item.getScore())))
                .filter(scored -> scored.score() >= threshold)
                .sorted(IMPACT_ORDER)
                .toList();

        for (ScoredItem scored : qualifying) {
            String id = scored.item().getId();
            if (state.isNewsCandidated(id)) {
                continue;
            }

            EvaluationState next = state.withCandidatedNewsId(id);
            if (Cooldowns.isCoolingDown(state, AlertType.HIGH_IMPACT_NEWS_ALERT, now, config.cooldown())) {
                LOG.debug("News [{}] consumed during cooldown – no candidate", id);
                return RuleOutcome.quiet(next);
            }

            CandidateAlert alert = CandidateAlert.builder()
                    .type(AlertType.HIGH_IMPACT_NEWS_ALERT)
                    .severity(AlertSeverity.HIGH)
                    .title(TITLE)
                    .message("High-impact news score " + Numbers.fixed(scored.score(), 1) + ".",
                            scored.item().getTitle())
                    .score(scored.score())
                    .subjectId(id)
                    .createdAt(now)
                    .build();

            LOG.debug("News rule fired: id={} score={}", id, scored.score());
            return RuleOutcome.fired(alert, next.withFired(AlertType.HIGH_IMPACT_NEWS_ALERT, now));
        }

        return RuleOutcome.quiet(state);
    }

    @Override
    public AlertType getType() {
        return AlertType.HIGH_IMPACT_NEWS_ALERT;
    }

    static double clampScore(double score) {
        if (!Double.isFinite(score)) {
            return MIN_SCORE;
        }
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    private static final class ScoredItem {
        private final NewsItem item;
        private final double score;

        ScoredItem(NewsItem item, double score) {
            this.item = item;
            this.score = score;
        }

        NewsItem item() {
            return item;
        }

        double score() {
            return score;
        }
    }
}
