package com.signalsentinel.core.model;

/**
 * Severity label attached to a {@link CandidateAlert}.
 *
 * @since 1.0.0
 */
public enum AlertSeverity {
    HIGH,
    MEDIUM
}
