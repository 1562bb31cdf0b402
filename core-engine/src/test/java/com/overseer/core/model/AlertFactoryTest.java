package com.overseer.core.model;

import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.OverseerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertFactory}.
 */
class AlertFactoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final AtomicInteger issued = new AtomicInteger();
    private AlertFactory factory;
    private JobContext context;

    @BeforeEach
    void setUp() {
        AlertIdGenerator ids = () -> "alert-" + issued.incrementAndGet();
        factory = new AlertFactory(ids, Clock.fixed(NOW, ZoneOffset.UTC));
        context = new JobContext(JobId.of("job-42"));
    }

    private Alert create(Object timestamp) {
        return factory.create(context, AlertBody.builder().title("t").timestamp(timestamp).build());
    }

    @Test
    @DisplayName("Should stamp id, schema version, job id and body content")
    void shouldPopulateAlert() {
        AlertBody body = AlertBody.builder()
                .title("Disk almost full")
                .description("host-1 at 97%")
                .attr("host", "host-1")
                .attr("usage", 97)
                .build();

        Alert alert = factory.create(context, body);

        assertThat(alert.getId()).isEqualTo("alert-1");
        assertThat(alert.getVersion()).isEqualTo(Alert.SCHEMA_VERSION).isEqualTo("v0");
        assertThat(alert.getJobId()).isEqualTo(JobId.of("job-42"));
        assertThat(alert.getTitle()).isEqualTo("Disk almost full");
        assertThat(alert.getDescription()).isEqualTo("host-1 at 97%");
        assertThat(alert.getAttrs()).containsEntry("host", AttrValue.of("host-1"))
                .containsEntry("usage", AttrValue.of(97L));
    }

    @Test
    @DisplayName("Should use the current time when the timestamp is absent")
    void shouldUseNowWhenAbsent() {
        assertThat(create(null).getTimestamp()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should parse RFC 3339 strings in UTC")
    void shouldParseRfc3339Utc() {
        assertThat(create("2024-01-01T00:00:00Z").getTimestamp())
                .isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Should honour offsets and fractional seconds in RFC 3339 strings")
    void shouldParseRfc3339WithOffsetAndFraction() {
        assertThat(create("2024-01-01T02:00:00.250+02:00").getTimestamp())
                .isEqualTo(Instant.parse("2024-01-01T00:00:00.250Z"));
    }

    @Test
    @DisplayName("Should treat integers as whole Unix seconds")
    void shouldParseIntegerSeconds() {
        assertThat(create(1_700_000_000).getTimestamp()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
        assertThat(create(1_700_000_000L).getTimestamp()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
    }

    @Test
    @DisplayName("Should split fractional seconds into seconds and nanoseconds")
    void shouldParseFractionalSeconds() {
        Instant ts = create(1_700_000_000.5).getTimestamp();

        assertThat(ts.getEpochSecond()).isEqualTo(1_700_000_000L);
        assertThat(ts.getNano()).isEqualTo(500_000_000);
    }

    @Test
    @DisplayName("Should floor negative fractional seconds")
    void shouldFloorNegativeFractionalSeconds() {
        Instant ts = create(-1.25).getTimestamp();

        assertThat(ts.getEpochSecond()).isEqualTo(-2L);
        assertThat(ts.getNano()).isEqualTo(750_000_000);
    }

    @Test
    @DisplayName("Should decode BigDecimal seconds exactly")
    void shouldParseBigDecimalSeconds() {
        Instant ts = create(new BigDecimal("1700000000.123456789")).getTimestamp();

        assertThat(ts).isEqualTo(Instant.ofEpochSecond(1_700_000_000L, 123_456_789));
    }

    @Test
    @DisplayName("Should replace the zero instant with the current time")
    void shouldReplaceZeroInstant() {
        assertThat(create("0001-01-01T00:00:00Z").getTimestamp()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should keep integer zero as the Unix epoch")
    void shouldKeepEpochZero() {
        assertThat(create(0).getTimestamp()).isEqualTo(Instant.EPOCH);
    }

    @Test
    @DisplayName("Should reject malformed strings and name the offending value")
    void shouldRejectMalformedString() {
        assertThatThrownBy(() -> create("yesterday"))
                .isInstanceOfSatisfying(OverseerException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.MALFORMED_TIMESTAMP);
                    assertThat(e.getContext()).containsEntry("timestamp", "yesterday");
                });
    }

    @Test
    @DisplayName("Should reject RFC 3339 strings without seconds or offset")
    void shouldRejectIncompleteRfc3339() {
        for (String value : List.of("2024-01-01T00:00Z", "2024-01-01T00:00:00", "2024-01-01")) {
            assertThatThrownBy(() -> create(value))
                    .as(value)
                    .isInstanceOfSatisfying(OverseerException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.MALFORMED_TIMESTAMP));
        }
    }

    @Test
    @DisplayName("Should reject non-finite floating point seconds")
    void shouldRejectNonFiniteSeconds() {
        assertThatThrownBy(() -> create(Double.NaN))
                .isInstanceOfSatisfying(OverseerException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.MALFORMED_TIMESTAMP));
    }

    @Test
    @DisplayName("Should reject unsupported timestamp types and name the type")
    void shouldRejectUnsupportedType() {
        assertThatThrownBy(() -> create(Boolean.TRUE))
                .isInstanceOfSatisfying(OverseerException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.UNSUPPORTED_TIMESTAMP_TYPE);
                    assertThat(e.getContext()).containsEntry("type", "java.lang.Boolean");
                });
    }

    @Test
    @DisplayName("Should reject an empty title before drawing an ID")
    void shouldRejectEmptyTitle() {
        AlertBody body = AlertBody.builder().title("").timestamp("not even a timestamp").build();

        assertThatThrownBy(() -> factory.create(context, body))
                .isInstanceOfSatisfying(OverseerException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.MISSING_TITLE));
        assertThat(issued).hasValue(0);
    }

    @Test
    @DisplayName("Should not draw an ID when the timestamp is malformed")
    void shouldNotIssueIdForMalformedTimestamp() {
        assertThatThrownBy(() -> create("nope")).isInstanceOf(OverseerException.class);
        assertThat(issued).hasValue(0);
    }

    @Test
    @DisplayName("Should assign distinct, time-ordered IDs by default")
    void shouldAssignTimeOrderedIds() throws InterruptedException {
        AlertFactory defaults = new AlertFactory();
        AlertBody body = AlertBody.builder().title("t").build();

        Alert first = defaults.create(context, body);
        Thread.sleep(2);
        Alert second = defaults.create(context, body);

        assertThat(first.getId()).isNotEqualTo(second.getId());
        assertThat(second.getId()).isGreaterThan(first.getId());
        assertThat(first).isNotEqualTo(second);
    }
}
