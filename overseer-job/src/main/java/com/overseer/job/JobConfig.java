package com.overseer.job;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration object for the Overseer job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults.
 * This makes the job fully configurable via Kubernetes CronJob env vars,
 * Docker {@code -e} flags, or a shell environment.
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
public final class JobConfig {

    // ---------------------------------------------------------------
    // Job
    // ---------------------------------------------------------------
    private final String jobId;
    private final String queryDir;
    private final List<String> taskTags;
    private final List<String> taskIds;
    private final int parallelism;
    private final long queryTimeoutSeconds;

    // ---------------------------------------------------------------
    // Cache / policy
    // ---------------------------------------------------------------
    private final String cacheDir;
    private final String policyPath;

    // ---------------------------------------------------------------
    // Query source
    // ---------------------------------------------------------------
    private final String jdbcUrl;
    private final String jdbcUser;
    private final String jdbcPassword;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaAlertTopic;
    private final long kafkaSendTimeoutMs;

    private JobConfig(Builder b) {
        this.jobId = b.jobId;
        this.queryDir = b.queryDir;
        this.taskTags = Collections.unmodifiableList(new ArrayList<>(b.taskTags));
        this.taskIds = Collections.unmodifiableList(new ArrayList<>(b.taskIds));
        this.parallelism = b.parallelism;
        this.queryTimeoutSeconds = b.queryTimeoutSeconds;
        this.cacheDir = b.cacheDir;
        this.policyPath = b.policyPath;
        this.jdbcUrl = b.jdbcUrl;
        this.jdbcUser = b.jdbcUser;
        this.jdbcPassword = b.jdbcPassword;
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaSendTimeoutMs = b.kafkaSendTimeoutMs;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link JobConfig} from the given variables.
     *
     * @param env variable name to value
     * @return fully populated configuration
     * @throws IllegalStateException    if a value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        try {
            return new Builder()
                    .jobId(env(env, "OVERSEER_JOB_ID", ""))
                    .queryDir(env(env, "OVERSEER_QUERY_DIR", "queries"))
                    .taskTags(splitList(env(env, "OVERSEER_TASK_TAG", "")))
                    .taskIds(splitList(env(env, "OVERSEER_TASK_ID", "")))
                    .parallelism(Integer.parseInt(env(env, "OVERSEER_PARALLELISM", "4")))
                    .queryTimeoutSeconds(Long.parseLong(env(env, "OVERSEER_QUERY_TIMEOUT_SECONDS", "300")))
                    .cacheDir(env(env, "OVERSEER_CACHE_DIR", ".overseer-cache"))
                    .policyPath(env(env, "OVERSEER_POLICY_PATH", ""))
                    .jdbcUrl(env(env, "OVERSEER_JDBC_URL", ""))
                    .jdbcUser(env(env, "OVERSEER_JDBC_USER", ""))
                    .jdbcPassword(env(env, "OVERSEER_JDBC_PASSWORD", ""))
                    .kafkaBootstrapServers(env(env, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaAlertTopic(env(env, "KAFKA_ALERT_TOPIC", ""))
                    .kafkaSendTimeoutMs(Long.parseLong(env(env, "KAFKA_SEND_TIMEOUT_MS", "30000")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * Build Kafka producer {@link Properties}.
     *
     * @return new Properties instance configured for alert publishing
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("client.id", "overseer-" + jobId);
        props.setProperty("acks", "all");
        props.setProperty("enable.idempotence", "true");
        props.setProperty("delivery.timeout.ms", Long.toString(Math.max(kafkaSendTimeoutMs, 1_000L)));
        props.setProperty("request.timeout.ms", Long.toString(Math.min(kafkaSendTimeoutMs, 30_000L)));
        return props;
    }

    public boolean isKafkaEnabled() {
        return !kafkaAlertTopic.isBlank();
    }

    public Duration getQueryTimeout() {
        return Duration.ofSeconds(queryTimeoutSeconds);
    }

    public Duration getKafkaSendTimeout() {
        return Duration.ofMillis(kafkaSendTimeoutMs);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getJobId() {
        return jobId;
    }

    public String getQueryDir() {
        return queryDir;
    }

    public List<String> getTaskTags() {
        return taskTags;
    }

    public List<String> getTaskIds() {
        return taskIds;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getQueryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    public String getCacheDir() {
        return cacheDir;
    }

    public String getPolicyPath() {
        return policyPath;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public String getJdbcUser() {
        return jdbcUser;
    }

    public String getJdbcPassword() {
        return jdbcPassword;
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public long getKafkaSendTimeoutMs() {
        return kafkaSendTimeoutMs;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (non-blank job ID and cache directory, parallelism &gt; 0,
     * timeouts &gt; 0).
     * </p>
     */
    public static class Builder {
        private String jobId;
        private String queryDir = "queries";
        private List<String> taskTags = new ArrayList<>();
        private List<String> taskIds = new ArrayList<>();
        private int parallelism = 4;
        private long queryTimeoutSeconds = 300;
        private String cacheDir = ".overseer-cache";
        private String policyPath = "";
        private String jdbcUrl = "";
        private String jdbcUser = "";
        private String jdbcPassword = "";
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaAlertTopic = "";
        private long kafkaSendTimeoutMs = 30_000;

        public Builder jobId(String v) {
            this.jobId = v;
            return this;
        }

        public Builder queryDir(String v) {
            this.queryDir = v;
            return this;
        }

        public Builder taskTags(List<String> v) {
            this.taskTags = v != null ? new ArrayList<>(v) : new ArrayList<>();
            return this;
        }

        public Builder taskIds(List<String> v) {
            this.taskIds = v != null ? new ArrayList<>(v) : new ArrayList<>();
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder queryTimeoutSeconds(long v) {
            this.queryTimeoutSeconds = v;
            return this;
        }

        public Builder cacheDir(String v) {
            this.cacheDir = v;
            return this;
        }

        public Builder policyPath(String v) {
            this.policyPath = v != null ? v : "";
            return this;
        }

        public Builder jdbcUrl(String v) {
            this.jdbcUrl = v != null ? v : "";
            return this;
        }

        public Builder jdbcUser(String v) {
            this.jdbcUser = v != null ? v : "";
            return this;
        }

        public Builder jdbcPassword(String v) {
            this.jdbcPassword = v != null ? v : "";
            return this;
        }

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v != null ? v : "";
            return this;
        }

        public Builder kafkaSendTimeoutMs(long v) {
            this.kafkaSendTimeoutMs = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(jobId, "jobId (OVERSEER_JOB_ID)");
            requireNonBlank(queryDir, "queryDir");
            requireNonBlank(cacheDir, "cacheDir");
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (queryTimeoutSeconds < 1) {
                throw new IllegalArgumentException(
                        "queryTimeoutSeconds must be >= 1, got: " + queryTimeoutSeconds);
            }
            if (kafkaSendTimeoutMs < 1) {
                throw new IllegalArgumentException(
                        "kafkaSendTimeoutMs must be >= 1, got: " + kafkaSendTimeoutMs);
            }

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

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public String toString() {
        // credentials are deliberately left out
        return "JobConfig{" +
                "jobId='" + jobId + '\'' +
                ", queryDir='" + queryDir + '\'' +
                ", taskTags=" + taskTags +
                ", taskIds=" + taskIds +
                ", parallelism=" + parallelism +
                ", queryTimeoutSeconds=" + queryTimeoutSeconds +
                ", cacheDir='" + cacheDir + '\'' +
                ", policyPath='" + policyPath + '\'' +
                ", jdbcUrl='" + jdbcUrl + '\'' +
                ", kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaAlertTopic='" + kafkaAlertTopic + '\'' +
                '}';
    }
}
