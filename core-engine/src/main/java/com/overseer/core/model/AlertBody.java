package com.overseer.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unvalidated alert content produced by policy evaluation.
 *
 * <p>
 * {@code timestamp} is kept in its raw wire shape (absent, RFC 3339 string,
 * integer or fractional Unix seconds); it is decoded only when an
 * {@link Alert} is constructed by {@link AlertFactory}. An empty title is
 * representable here and rejected there.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"title", "description", "timestamp", "attrs"})
public final class AlertBody {

    private final String title;
    private final String description;
    private final Object timestamp;
    private final Map<String, AttrValue> attrs;

    private AlertBody(Builder builder) {
        this.title = builder.title != null ? builder.title : "";
        this.description = builder.description != null ? builder.description : "";
        this.timestamp = builder.timestamp;
        this.attrs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attrs));
    }

    @JsonCreator
    static AlertBody fromJson(@JsonProperty("title") String title,
            @JsonProperty("description") String description,
            @JsonProperty("timestamp") Object timestamp,
            @JsonProperty("attrs") Map<String, Object> attrs) {
        return builder()
                .title(title)
                .description(description)
                .timestamp(timestamp)
                .attrs(AttrValue.mapOf(attrs))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AlertBody}.
     */
    public static class Builder {
        private String title;
        private String description;
        private Object timestamp;
        private final Map<String, AttrValue> attrs = new LinkedHashMap<>();

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /**
         * @param timestamp {@code null}, an RFC 3339 string or a number of Unix
         *                  seconds
         */
        public Builder timestamp(Object timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder attr(String key, Object value) {
            this.attrs.put(Objects.requireNonNull(key, "attr key must not be null"), AttrValue.of(value));
            return this;
        }

        public Builder attrs(Map<String, AttrValue> attrs) {
            if (attrs != null) {
                attrs.forEach(this::attr);
            }
            return this;
        }

        public AlertBody build() {
            return new AlertBody(this);
        }
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
     * @return the raw, undecoded timestamp value
     */
    @JsonProperty("timestamp")
    public Object getTimestamp() {
        return timestamp;
    }

    @JsonProperty("attrs")
    public Map<String, AttrValue> getAttrs() {
        return attrs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertBody that))
            return false;
        return title.equals(that.title)
                && description.equals(that.description)
                && Objects.equals(timestamp, that.timestamp)
                && attrs.equals(that.attrs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, description, timestamp, attrs);
    }

    @Override
    public String toString() {
        return "AlertBody{" +
                "title='" + title + '\'' +
                ", timestamp=" + timestamp +
                ", attrs=" + attrs.keySet() +
                '}';
    }
}
