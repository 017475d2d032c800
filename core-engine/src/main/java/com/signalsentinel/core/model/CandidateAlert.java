package com.signalsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A potential notification produced by a rule during one cycle.
 *
 * <p>
 * Candidates live only for the cycle that created them: the engine hands
 * them to the dispatcher, which either delivers one of them or reports why
 * it did not.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code type}, {@code severity}, {@code title},
 * {@code message} and {@code createdAt} are required; omitting any of them
 * throws a {@link NullPointerException} at build time. The message holds at
 * most two lines.
 * </p>
 *
 * @since 1.0.0
 */
public final class CandidateAlert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final AlertType type;
    private final AlertSeverity severity;
    private final String title;
    private final String message;
    private final Double score;
    private final Instant createdAt;
    private final String subjectId;

    private CandidateAlert(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.title = Objects.requireNonNull(builder.title, "title must not be null");
        this.message = Objects.requireNonNull(builder.message, "message must not be null");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt must not be null");
        this.score = builder.score;
        this.subjectId = builder.subjectId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AlertType type;
        private AlertSeverity severity;
        private String title;
        private String message;
        private Double score;
        private Instant createdAt;
        private String subjectId;

        public Builder type(AlertType type) {
            this.type = type;
            return this;
        }

        public Builder severity(AlertSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        /**
         * Set the body from one or two lines.
         *
         * @param line1 first line
         * @param line2 optional second line, ignored when {@code null} or empty
         * @return this builder
         */
        public Builder message(String line1, String line2) {
            this.message = (line2 == null || line2.isEmpty()) ? line1 : line1 + "\n" + line2;
            return this;
        }

        public Builder score(Double score) {
            this.score = score;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public CandidateAlert build() {
            return new CandidateAlert(this);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public AlertType getType() {
        return type;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public String getTitle() {
        return title;
    }

    public String getMessage() {
        return message;
    }

    public Optional<Double> getScore() {
        return Optional.ofNullable(score);
    }

    /**
     * @return the cycle timestamp at which this candidate was generated
     */
    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Identifier of the item the alert is about. Only news alerts carry one
     * (the news item id); market and whale alerts return empty.
     *
     * @return optional subject identifier
     */
    public Optional<String> getSubjectId() {
        return Optional.ofNullable(subjectId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CandidateAlert that))
            return false;
        return type == that.type
                && severity == that.severity
                && Objects.equals(title, that.title)
                && Objects.equals(message, that.message)
                && Objects.equals(score, that.score)
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(subjectId, that.subjectId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, severity, title, message, score, createdAt, subjectId);
    }

    @Override
    public String toString() {
        return "CandidateAlert{" +
                "type=" + type +
                ", severity=" + severity +
                ", title='" + title + '\'' +
                ", score=" + score +
                ", createdAt=" + createdAt +
                (subjectId != null ? ", subjectId='" + subjectId + '\'' : "") +
                '}';
    }
}
