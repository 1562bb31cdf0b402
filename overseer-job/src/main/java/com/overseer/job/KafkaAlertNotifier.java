package com.overseer.job;

import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.OverseerException;
import com.overseer.core.model.Alert;
import com.overseer.core.pipeline.AlertNotifier;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes alerts to a Kafka topic.
 *
 * <p>
 * Each record is keyed by the alert ID so consumers can drop redeliveries.
 * {@link #publish(Alert)} blocks until the broker acknowledges the record
 * or the send timeout elapses.
 * </p>
 *
 * @since 1.0.0
 */
public class KafkaAlertNotifier implements AlertNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaAlertNotifier.class);

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

    private final Producer<String, Alert> producer;
    private final String topic;
    private final Duration sendTimeout;

    public KafkaAlertNotifier(JobConfig config) {
        this(new KafkaProducer<>(config.kafkaProducerProperties(), new StringSerializer(), new AlertSerializer()),
                config.getKafkaAlertTopic(),
                config.getKafkaSendTimeout());
    }

    KafkaAlertNotifier(Producer<String, Alert> producer, String topic, Duration sendTimeout) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout must not be null");
    }

    @Override
    public void publish(Alert alert) {
        ProducerRecord<String, Alert> record = new ProducerRecord<>(topic, alert.getId(), alert);
        try {
            RecordMetadata metadata = producer.send(record).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            LOG.debug("Published alert {} to {}-{}@{}", alert.getId(), metadata.topic(), metadata.partition(),
                    metadata.offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OverseerException(ErrorKind.CANCELLED, "interrupted while publishing alert", e)
                    .with("alert_id", alert.getId());
        } catch (ExecutionException e) {
            throw dispatchFailure(alert, "broker rejected alert", e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException e) {
            throw dispatchFailure(alert, "timed out publishing alert", e);
        }
    }

    private OverseerException dispatchFailure(Alert alert, String message, Throwable cause) {
        return new OverseerException(ErrorKind.ALERT_DISPATCH_FAILED, message, cause)
                .with("alert_id", alert.getId())
                .with("topic", topic);
    }

    @Override
    public void close() {
        producer.close(CLOSE_TIMEOUT);
    }
}
