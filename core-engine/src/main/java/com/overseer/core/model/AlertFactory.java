package com.overseer.core.model;

import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.OverseerException;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Turns policy output ({@link AlertBody}) into validated {@link Alert}s.
 *
 * <h3>Construction steps</h3>
 * <ol>
 * <li>Reject an empty title with {@link ErrorKind#MISSING_TITLE}.</li>
 * <li>Decode and resolve the polymorphic timestamp; see
 * {@link AlertTimestamp}.</li>
 * <li>Assign a fresh ID, the schema version and the job ID from the
 * context.</li>
 * </ol>
 *
 * <p>
 * No partially built alert ever escapes: every check runs before the ID is
 * drawn. Failures of the ID generator propagate unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertFactory {

    private final AlertIdGenerator idGenerator;
    private final Clock clock;

    public AlertFactory() {
        this(new TimeOrderedAlertIdGenerator(), Clock.systemUTC());
    }

    public AlertFactory(AlertIdGenerator idGenerator, Clock clock) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Construct an alert.
     *
     * @param context job context supplying the job ID; must not be {@code null}
     * @param body    policy output; must not be {@code null}
     * @return the new alert
     * @throws OverseerException with {@link ErrorKind#MISSING_TITLE},
     *                           {@link ErrorKind#MALFORMED_TIMESTAMP} or
     *                           {@link ErrorKind#UNSUPPORTED_TIMESTAMP_TYPE}
     */
    public Alert create(JobContext context, AlertBody body) {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(body, "body must not be null");

        if (body.getTitle().isEmpty()) {
            throw new OverseerException(ErrorKind.MISSING_TITLE, "title is required")
                    .with("job_id", context.getJobId());
        }

        Instant timestamp = AlertTimestamp.decode(body.getTimestamp()).resolve(clock);

        return new Alert(
                idGenerator.nextId(),
                Alert.SCHEMA_VERSION,
                context.getJobId(),
                timestamp,
                body.getTitle(),
                body.getDescription(),
                body.getAttrs());
    }
}
