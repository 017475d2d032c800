package com.signalsentinel.core.state;

import com.signalsentinel.core.model.AlertType;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * What the rule evaluators last observed and last alerted.
 *
 * <p>
 * Instances are immutable; every {@code with*} method returns a new state.
 * The engine reads one state from its {@link EvaluationStateStore} at the
 * start of a cycle, folds it through the rules and writes the result back.
 * </p>
 *
 * <h3>Update discipline</h3>
 * <ul>
 * <li>the last market band and last whale net flow are replaced on every
 * cycle that carries the corresponding metric</li>
 * <li>the last-fired timestamp of a type changes only when that type
 * produces a candidate</li>
 * <li>the candidated-news set only grows</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class EvaluationState implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final EvaluationState INITIAL =
            new EvaluationState(null, null, Set.of(), new EnumMap<>(AlertType.class));

    private final MarketBand lastMarketBand;
    private final Double lastWhaleNetFlow;
    private final Set<String> candidatedNewsIds;
    private final Map<AlertType, Instant> lastFiredByType;

    private EvaluationState(MarketBand lastMarketBand,
            Double lastWhaleNetFlow,
            Set<String> candidatedNewsIds,
            Map<AlertType, Instant> lastFiredByType) {
        this.lastMarketBand = lastMarketBand;
        this.lastWhaleNetFlow = lastWhaleNetFlow;
        this.candidatedNewsIds = Collections.unmodifiableSet(new HashSet<>(candidatedNewsIds));
        EnumMap<AlertType, Instant> copy = new EnumMap<>(AlertType.class);
        copy.putAll(lastFiredByType);
        this.lastFiredByType = Collections.unmodifiableMap(copy);
    }

    /**
     * @return the state of a process that has observed nothing yet
     */
    public static EvaluationState initial() {
        return INITIAL;
    }

    // ---------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------

    public EvaluationState withLastMarketBand(MarketBand band) {
        return new EvaluationState(Objects.requireNonNull(band, "band must not be null"),
                lastWhaleNetFlow, candidatedNewsIds, lastFiredByType);
    }

    public EvaluationState withLastWhaleNetFlow(double netFlow) {
        return new EvaluationState(lastMarketBand, netFlow, candidatedNewsIds, lastFiredByType);
    }

    public EvaluationState withCandidatedNewsId(String newsId) {
        Objects.requireNonNull(newsId, "newsId must not be null");
        if (candidatedNewsIds.contains(newsId)) {
            return this;
        }
        Set<String> ids = new HashSet<>(candidatedNewsIds);
        ids.add(newsId);
        return new EvaluationState(lastMarketBand, lastWhaleNetFlow, ids, lastFiredByType);
    }

    public EvaluationState withFired(AlertType type, Instant at) {
        Map<AlertType, Instant> fired = new EnumMap<>(AlertType.class);
        fired.putAll(lastFiredByType);
        fired.put(Objects.requireNonNull(type, "type must not be null"),
                Objects.requireNonNull(at, "at must not be null"));
        return new EvaluationState(lastMarketBand, lastWhaleNetFlow, candidatedNewsIds, fired);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * @return the band seen on the previous cycle, empty before the first
     *         observation
     */
    public Optional<MarketBand> getLastMarketBand() {
        return Optional.ofNullable(lastMarketBand);
    }

    /**
     * @return the net flow seen on the previous cycle, empty before the first
     *         observation
     */
    public Optional<Double> getLastWhaleNetFlow() {
        return Optional.ofNullable(lastWhaleNetFlow);
    }

    public boolean isNewsCandidated(String newsId) {
        return candidatedNewsIds.contains(newsId);
    }

    /**
     * @return unmodifiable view of every news id that has been considered for
     *         a candidate
     */
    public Set<String> getCandidatedNewsIds() {
        return candidatedNewsIds;
    }

    public Optional<Instant> getLastFired(AlertType type) {
        return Optional.ofNullable(lastFiredByType.get(type));
    }

    public Map<AlertType, Instant> getLastFiredByType() {
        return lastFiredByType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EvaluationState that))
            return false;
        return lastMarketBand == that.lastMarketBand
                && Objects.equals(lastWhaleNetFlow, that.lastWhaleNetFlow)
                && candidatedNewsIds.equals(that.candidatedNewsIds)
                && lastFiredByType.equals(that.lastFiredByType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lastMarketBand, lastWhaleNetFlow, candidatedNewsIds, lastFiredByType);
    }

    @Override
    public String toString() {
        return "EvaluationState{" +
                "lastMarketBand=" + lastMarketBand +
                ", lastWhaleNetFlow=" + lastWhaleNetFlow +
                ", candidatedNewsIds=" + candidatedNewsIds.size() +
                ", lastFiredByType=" + lastFiredByType +
                '}';
    }
}
