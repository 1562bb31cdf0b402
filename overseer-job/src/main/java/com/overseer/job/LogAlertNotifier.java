package com.overseer.job;

import com.overseer.core.json.AlertCodec;
import com.overseer.core.model.Alert;
import com.overseer.core.pipeline.AlertNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each alert as one JSON log line. Used when no Kafka topic is
 * configured.
 */
public class LogAlertNotifier implements AlertNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(LogAlertNotifier.class);

    private final AlertCodec codec;

    public LogAlertNotifier() {
        this(new AlertCodec());
    }

    public LogAlertNotifier(AlertCodec codec) {
        this.codec = codec;
    }

    @Override
    public void publish(Alert alert) {
        LOG.info("ALERT {}", codec.encodeToString(alert));
    }
}
