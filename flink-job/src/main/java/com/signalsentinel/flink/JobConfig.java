package com.signalsentinel.flink;

import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the Signal Sentinel Flink job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job is configurable through container env vars or a shell environment.
 * Alert thresholds are not part of this object: they live in the engine YAML
 * document referenced by {@code ENGINE_CONFIG_PATH}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaSnapshotTopic;
    private final String kafkaResultTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Engine
    // ---------------------------------------------------------------
    private final String engineConfigPath;
    private final String asset;

    // ---------------------------------------------------------------
    // Telegram
    // ---------------------------------------------------------------
    private final String telegramBotToken;
    private final String telegramChannelId;
    private final int telegramTimeoutSeconds;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaSnapshotTopic = b.kafkaSnapshotTopic;
        this.kafkaResultTopic = b.kafkaResultTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.engineConfigPath = b.engineConfigPath;
        this.asset = b.asset;
        this.telegramBotToken = b.telegramBotToken;
        this.telegramChannelId = b.telegramChannelId;
        this.telegramTimeoutSeconds = b.telegramTimeoutSeconds;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaSnapshotTopic(env("KAFKA_SNAPSHOT_TOPIC", "market-snapshots"))
                    .kafkaResultTopic(env("KAFKA_RESULT_TOPIC", "alert-dispatch-results"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "signal-sentinel"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .engineConfigPath(env("ENGINE_CONFIG_PATH", ""))
                    .asset(env("ALERT_ASSET", "BTC"))
                    .telegramBotToken(env("TELEGRAM_BOT_TOKEN", ""))
                    .telegramChannelId(env("TELEGRAM_CHANNEL_ID", ""))
                    .telegramTimeoutSeconds(parseIntEnv("TELEGRAM_TIMEOUT_SECONDS", "10"))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * @return {@code true} when both Telegram credentials are set; otherwise
     *         alerts are only logged
     */
    public boolean hasTelegramCredentials() {
        return !telegramBotToken.isBlank() && !telegramChannelId.isBlank();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaSnapshotTopic() {
        return kafkaSnapshotTopic;
    }

    public String getKafkaResultTopic() {
        return kafkaResultTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    public String getAsset() {
        return asset;
    }

    public String getTelegramBotToken() {
        return telegramBotToken;
    }

    public String getTelegramChannelId() {
        return telegramChannelId;
    }

    public Duration getTelegramTimeout() {
        return Duration.ofSeconds(telegramTimeoutSeconds);
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (checkpoint interval &gt; 0, port in [1, 65535], timeout &gt; 0,
     * non-blank topic names and asset).
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaSnapshotTopic = "market-snapshots";
        private String kafkaResultTopic = "alert-dispatch-results";
        private String kafkaGroupId = "signal-sentinel";
        private long checkpointIntervalMs = 60_000;
        private String engineConfigPath = "";
        private String asset = "BTC";
        private String telegramBotToken = "";
        private String telegramChannelId = "";
        private int telegramTimeoutSeconds = 10;
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaSnapshotTopic(String v) {
            this.kafkaSnapshotTopic = v;
            return this;
        }

        public Builder kafkaResultTopic(String v) {
            this.kafkaResultTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        public Builder asset(String v) {
            this.asset = v;
            return this;
        }

        public Builder telegramBotToken(String v) {
            this.telegramBotToken = v;
            return this;
        }

        public Builder telegramChannelId(String v) {
            this.telegramChannelId = v;
            return this;
        }

        public Builder telegramTimeoutSeconds(int v) {
            this.telegramTimeoutSeconds = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaSnapshotTopic, "kafkaSnapshotTopic");
            requireNonBlank(kafkaResultTopic, "kafkaResultTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            requireNonBlank(asset, "asset");

            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (telegramTimeoutSeconds < 1) {
                throw new IllegalArgumentException(
                        "telegramTimeoutSeconds must be >= 1, got: " + telegramTimeoutSeconds);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }

            engineConfigPath = engineConfigPath != null ? engineConfigPath : "";
            telegramBotToken = telegramBotToken != null ? telegramBotToken : "";
            telegramChannelId = telegramChannelId != null ? telegramChannelId : "";
            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    private static String mask(String secret) {
        return secret.isBlank() ? "<unset>" : "****";
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaSnapshotTopic='" + kafkaSnapshotTopic + '\'' +
                ", kafkaResultTopic='" + kafkaResultTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", engineConfigPath='" + engineConfigPath + '\'' +
                ", asset='" + asset + '\'' +
                ", telegramBotToken=" + mask(telegramBotToken) +
                ", telegramChannelId=" + mask(telegramChannelId) +
                ", telegramTimeoutSeconds=" + telegramTimeoutSeconds +
                ", healthPort=" + healthPort +
                '}';
    }
}
