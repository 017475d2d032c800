package com.signalsentinel.core.rules;

import com.signalsentinel.core.model.AlertType;
import com.signalsentinel.core.state.EvaluationState;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-type cooldown check shared by the rules.
 *
 * @since 1.0.0
 */
final class Cooldowns {

    private Cooldowns() {
        // utility class
    }

    /**
     * @return {@code true} if {@code type} fired less than {@code cooldown}
     *         before {@code now}
     */
    static boolean isCoolingDown(EvaluationState state, AlertType type, Instant now, Duration cooldown) {
        return state.getLastFired(type)
                .map(last -> Duration.between(last, now).compareTo(cooldown) < 0)
                .orElse(false);
    }
}
