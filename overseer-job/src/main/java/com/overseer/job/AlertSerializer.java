package com.overseer.job;

import com.overseer.core.json.AlertCodec;
import com.overseer.core.model.Alert;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;

/**
 * Kafka {@link Serializer} that converts {@link Alert} to JSON bytes for
 * publishing to the alerts topic.
 */
public class AlertSerializer implements Serializer<Alert> {

    private final AlertCodec codec;

    public AlertSerializer() {
        this(new AlertCodec());
    }

    public AlertSerializer(AlertCodec codec) {
        this.codec = codec;
    }

    @Override
    public byte[] serialize(String topic, Alert alert) {
        if (alert == null) {
            return null;
        }
        try {
            return codec.encode(alert);
        } catch (IllegalStateException e) {
            throw new SerializationException("Failed to serialize alert " + alert.getId(), e);
        }
    }
}
