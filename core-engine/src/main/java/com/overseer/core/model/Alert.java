package com.overseer.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Validated, addressable alert derived from an {@link AlertBody}.
 *
 * <p>
 * Serialized to JSON and handed to the configured notifier. Instances are
 * created by {@link AlertFactory} and are immutable: the ID is assigned once
 * and the timestamp is always an absolute instant.
 * </p>
 *
 * <h3>Schema version</h3>
 * <p>
 * Every alert carries {@link #SCHEMA_VERSION}. Consumers should reject alerts
 * for which {@link #isSupportedVersion()} is {@code false}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "version", "job_id", "timestamp", "title", "description", "attrs"})
public final class Alert {

    /** Schema version stamped on every alert. */
    public static final String SCHEMA_VERSION = "v0";

    private final String id;
    private final String version;
    private final JobId jobId;
    private final Instant timestamp;
    private final String title;
    private final String description;
    private final Map<String, AttrValue> attrs;

    Alert(String id, String version, JobId jobId, Instant timestamp,
            String title, String description, Map<String, AttrValue> attrs) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.version = Objects.requireNonNull(version, "version must not be null");
        this.jobId = Objects.requireNonNull(jobId, "jobId must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.description = description != null ? description : "";
        this.attrs = attrs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attrs))
                : Collections.emptyMap();
    }

    @JsonCreator
    static Alert fromJson(@JsonProperty("id") String id,
            @JsonProperty("version") String version,
            @JsonProperty("job_id") String jobId,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("title") String title,
            @JsonProperty("description") String description,
            @JsonProperty("attrs") Map<String, Object> attrs) {
        return new Alert(id, version, JobId.of(jobId), timestamp, title, description, AttrValue.mapOf(attrs));
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("version")
    public String getVersion() {
        return version;
    }

    @JsonProperty("job_id")
    public JobId getJobId() {
        return jobId;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("title")
    public String getTitle() {
        return title;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    /**
     * @return unmodifiable attribute map
     */
    @JsonProperty("attrs")
    public Map<String, AttrValue> getAttrs() {
        return attrs;
    }

    /**
     * @return {@code true} if this alert was produced with the schema version
     *         this build understands
     */
    @JsonIgnore
    public boolean isSupportedVersion() {
        return SCHEMA_VERSION.equals(version);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return id.equals(alert.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", jobId=" + jobId +
                ", timestamp=" + timestamp +
                ", title='" + title + '\'' +
                '}';
    }
}
