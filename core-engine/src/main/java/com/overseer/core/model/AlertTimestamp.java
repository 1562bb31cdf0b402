package com.overseer.core.model;

import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.OverseerException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Objects;

import static java.time.temporal.ChronoField.HOUR_OF_DAY;
import static java.time.temporal.ChronoField.MINUTE_OF_HOUR;
import static java.time.temporal.ChronoField.NANO_OF_SECOND;
import static java.time.temporal.ChronoField.SECOND_OF_MINUTE;

/**
 * Decoded form of the polymorphic {@code timestamp} field of an
 * {@link AlertBody}.
 *
 * <p>
 * The wire value may be absent, an RFC 3339 string, integral Unix seconds or
 * fractional Unix seconds. {@link #decode(Object)} classifies the raw value
 * once and {@link #resolve(Clock)} turns it into an absolute {@link Instant};
 * the variant is never carried past alert construction.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertTimestamp {

    /** Shape of the raw wire value. */
    public enum Kind {
        ABSENT, RFC3339, INTEGER_SECONDS, FLOAT_SECONDS
    }

    /** Value treated as "unset" after resolution and replaced by the clock. */
    public static final Instant ZERO = Instant.parse("0001-01-01T00:00:00Z");

    /** {@code yyyy-MM-ddTHH:mm:ss[.fraction](Z|+hh:mm)}; seconds and offset are mandatory. */
    static final DateTimeFormatter RFC3339 = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .appendValue(HOUR_OF_DAY, 2)
            .appendLiteral(':')
            .appendValue(MINUTE_OF_HOUR, 2)
            .appendLiteral(':')
            .appendValue(SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .appendOffset("+HH:MM", "Z")
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT)
            .withChronology(IsoChronology.INSTANCE);

    private static final BigDecimal NANOS_PER_SECOND = BigDecimal.valueOf(1_000_000_000L);
    private static final AlertTimestamp ABSENT = new AlertTimestamp(Kind.ABSENT, null);

    private final Kind kind;
    private final Object raw;

    private AlertTimestamp(Kind kind, Object raw) {
        this.kind = kind;
        this.raw = raw;
    }

    /**
     * Classify a raw wire value.
     *
     * @param raw value as produced by a JSON decoder or a policy rule
     * @return the decoded variant
     * @throws OverseerException with {@link ErrorKind#UNSUPPORTED_TIMESTAMP_TYPE}
     *                           if the value is not absent, a string or a
     *                           number
     */
    public static AlertTimestamp decode(Object raw) {
        if (raw == null) {
            return ABSENT;
        }
        if (raw instanceof CharSequence cs) {
            return new AlertTimestamp(Kind.RFC3339, cs.toString());
        }
        if (raw instanceof Byte || raw instanceof Short || raw instanceof Integer
                || raw instanceof Long || raw instanceof BigInteger) {
            return new AlertTimestamp(Kind.INTEGER_SECONDS, raw);
        }
        if (raw instanceof Float || raw instanceof Double || raw instanceof BigDecimal) {
            return new AlertTimestamp(Kind.FLOAT_SECONDS, raw);
        }
        throw new OverseerException(ErrorKind.UNSUPPORTED_TIMESTAMP_TYPE, "unsupported timestamp type")
                .with("timestamp", raw)
                .with("type", raw.getClass().getName());
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Resolve to an absolute instant.
     *
     * <p>
     * An absent value, or one that resolves to {@link #ZERO}, yields the
     * current time of {@code clock}.
     * </p>
     *
     * @param clock source of the current time
     * @return absolute instant, never {@code null}
     * @throws OverseerException with {@link ErrorKind#MALFORMED_TIMESTAMP} if
     *                           the value cannot be represented as an instant
     */
    public Instant resolve(Clock clock) {
        Objects.requireNonNull(clock, "clock must not be null");
        Instant resolved = switch (kind) {
            case ABSENT -> clock.instant();
            case RFC3339 -> parseRfc3339((String) raw);
            case INTEGER_SECONDS -> fromSeconds((Number) raw);
            case FLOAT_SECONDS -> fromFractionalSeconds((Number) raw);
        };
        return ZERO.equals(resolved) ? clock.instant() : resolved;
    }

    private static Instant parseRfc3339(String value) {
        try {
            return OffsetDateTime.parse(value, RFC3339).toInstant();
        } catch (DateTimeException e) {
            throw malformed(value, e);
        }
    }

    private static Instant fromSeconds(Number value) {
        try {
            long seconds = value instanceof BigInteger bi ? bi.longValueExact() : value.longValue();
            return Instant.ofEpochSecond(seconds);
        } catch (ArithmeticException | DateTimeException e) {
            throw malformed(value, e);
        }
    }

    private static Instant fromFractionalSeconds(Number value) {
        try {
            if (value instanceof BigDecimal exact) {
                BigDecimal seconds = exact.setScale(0, RoundingMode.FLOOR);
                long nanos = exact.subtract(seconds).multiply(NANOS_PER_SECOND).longValue();
                return Instant.ofEpochSecond(seconds.longValueExact(), nanos);
            }
            double d = value.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new DateTimeException("not a finite number: " + d);
            }
            double seconds = Math.floor(d);
            long nanos = (long) ((d - seconds) * 1e9);
            return Instant.ofEpochSecond((long) seconds, nanos);
        } catch (ArithmeticException | DateTimeException e) {
            throw malformed(value, e);
        }
    }

    private static OverseerException malformed(Object value, Throwable cause) {
        return new OverseerException(ErrorKind.MALFORMED_TIMESTAMP, "failed to parse timestamp", cause)
                .with("timestamp", value);
    }

    @Override
    public String toString() {
        return "AlertTimestamp{" + kind + (raw != null ? ", " + raw : "") + '}';
    }
}
