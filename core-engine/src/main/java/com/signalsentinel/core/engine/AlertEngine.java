package com.signalsentinel.core.engine;

import com.signalsentinel.core.config.AlertConfig;
import com.signalsentinel.core.model.CandidateAlert;
import com.signalsentinel.core.model.MarketSnapshot;
import com.signalsentinel.core.rules.AlertRule;
import com.signalsentinel.core.rules.HighImpactNewsRule;
import com.signalsentinel.core.rules.MarketStateRule;
import com.signalsentinel.core.rules.RuleOutcome;
import com.signalsentinel.core.rules.WhaleActivityRule;
import com.signalsentinel.core.state.EvaluationState;
import com.signalsentinel.core.state.EvaluationStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Runs the alert rules against one snapshot.
 *
 * <h3>Cycle</h3>
 * <ol>
 * <li>read the current {@link EvaluationState} from the store</li>
 * <li>fold it through the rules in fixed order: market, whale, news</li>
 * <li>write the final state back</li>
 * <li>return every candidate produced (zero to three; news contributes at
 * most one)</li>
 * </ol>
 *
 * <p>
 * The engine keeps no state of its own; the store passed to
 * {@link #evaluate} is the only thing it mutates. Malformed snapshot fields
 * are clamped or skipped by the rules, so evaluation does not fail on data.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AlertEngine.class);

    private final AlertConfig config;
    private final List<AlertRule> rules;

    /**
     * @param config thresholds and cooldown; must not be {@code null}
     * @throws IllegalStateException if the configuration is invalid
     */
    public AlertEngine(AlertConfig config) {
        this(config, List.of(new MarketStateRule(), new WhaleActivityRule(), new HighImpactNewsRule()));
    }

    AlertEngine(AlertConfig config, List<AlertRule> rules) {
        this.config = Objects.requireNonNull(config, "AlertConfig must not be null");
        config.validate();
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
        LOG.info("AlertEngine created with {} rule(s): {}", this.rules.size(), config);
    }

    /**
     * Evaluate one snapshot and persist the resulting state.
     *
     * @param snapshot the cycle's snapshot; must not be {@code null}
     * @param store    evaluation state owner; must not be {@code null}
     * @return unmodifiable list of candidate alerts in rule order
     */
    public List<CandidateAlert> evaluate(MarketSnapshot snapshot, EvaluationStateStore store) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(store, "store must not be null");

        EvaluationState state = store.get();
        List<CandidateAlert> candidates = new ArrayList<>();

        for (AlertRule rule : rules) {
            RuleOutcome outcome = rule.evaluate(snapshot, config, state);
            candidates.addAll(outcome.getAlerts());
            state = outcome.getNextState();
        }

        store.set(state);

        if (!candidates.isEmpty()) {
            LOG.info("Cycle {} produced {} candidate(s): {}", snapshot.getTimestamp(), candidates.size(),
                    candidates.stream().map(CandidateAlert::getType).toList());
        }
        return Collections.unmodifiableList(candidates);
    }

    public AlertConfig getConfig() {
        return config;
    }
}
