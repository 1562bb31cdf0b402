package com.overseer.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.OverseerException;
import com.overseer.core.model.Alert;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON encoding of {@link Alert}.
 *
 * <p>
 * Alert shape: {@code id, version, job_id, timestamp, title, description,
 * attrs}. Decoding rejects alerts whose schema version this build does not
 * understand.
 * </p>
 *
 * <p>
 * Thread-safe: {@link ObjectMapper} is safe for concurrent use once
 * configured.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertCodec {

    private final ObjectMapper mapper;

    public AlertCodec() {
        this(JsonMappers.create());
    }

    public AlertCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * @param alert alert to encode
     * @return UTF-8 JSON bytes
     * @throws IllegalStateException if Jackson cannot serialize the alert
     */
    public byte[] encode(Alert alert) {
        try {
            return mapper.writeValueAsBytes(alert);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize alert " + alert.getId(), e);
        }
    }

    public String encodeToString(Alert alert) {
        try {
            return mapper.writeValueAsString(alert);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize alert " + alert.getId(), e);
        }
    }

    /**
     * @param json alert JSON
     * @return decoded alert
     * @throws OverseerException with {@link ErrorKind#UNSUPPORTED_ALERT_VERSION}
     *                           for an unknown schema version
     * @throws IllegalArgumentException if the JSON is not a valid alert
     */
    public Alert decode(byte[] json) {
        Alert alert;
        try {
            alert = mapper.readValue(json, Alert.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid alert JSON: " + e.getMessage(), e);
        }
        if (!alert.isSupportedVersion()) {
            throw new OverseerException(ErrorKind.UNSUPPORTED_ALERT_VERSION, "unrecognized alert schema version")
                    .with("alert_id", alert.getId())
                    .with("version", alert.getVersion());
        }
        return alert;
    }
}
