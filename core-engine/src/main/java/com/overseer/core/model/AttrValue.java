package com.overseer.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dynamic value stored in an alert's {@code attrs} map.
 *
 * <p>
 * A closed set of shapes: null, boolean, 64-bit integer, decimal, string,
 * array and nested object. {@link #of(Object)} converts natural Java and JSON
 * values into this form once, so downstream consumers never deal with
 * untyped data.
 * </p>
 *
 * @since 1.0.0
 */
public final class AttrValue {

    /** Shape of an {@link AttrValue}. */
    public enum Kind {
        NULL, BOOLEAN, INTEGER, DECIMAL, STRING, ARRAY, OBJECT
    }

    public static final AttrValue NULL = new AttrValue(Kind.NULL, null);

    private final Kind kind;
    private final Object value;
    private final List<AttrValue> list;
    private final Map<String, AttrValue> map;

    private AttrValue(Kind kind, Object value) {
        this(kind, value, null, null);
    }

    private AttrValue(Kind kind, Object value, List<AttrValue> list, Map<String, AttrValue> map) {
        this.kind = kind;
        this.value = value;
        this.list = list;
        this.map = map;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    public static AttrValue of(boolean value) {
        return new AttrValue(Kind.BOOLEAN, value);
    }

    public static AttrValue of(long value) {
        return new AttrValue(Kind.INTEGER, value);
    }

    public static AttrValue of(double value) {
        return new AttrValue(Kind.DECIMAL, value);
    }

    public static AttrValue of(String value) {
        return value == null ? NULL : new AttrValue(Kind.STRING, value);
    }

    public static AttrValue ofList(List<AttrValue> values) {
        List<AttrValue> copy = new ArrayList<>();
        for (AttrValue v : values) {
            copy.add(v == null ? NULL : v);
        }
        return new AttrValue(Kind.ARRAY, null, Collections.unmodifiableList(copy), null);
    }

    public static AttrValue ofMap(Map<String, AttrValue> values) {
        Map<String, AttrValue> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> copy.put(k, v == null ? NULL : v));
        return new AttrValue(Kind.OBJECT, null, null, Collections.unmodifiableMap(copy));
    }

    /**
     * Convert an arbitrary value into an {@link AttrValue}.
     *
     * <p>
     * Integral numbers that do not fit in a {@code long} and values of any
     * other type are kept as their string form; {@code java.time} values use
     * their ISO-8601 representation.
     * </p>
     *
     * @param raw value to convert, may be {@code null}
     * @return converted value, never {@code null}
     */
    public static AttrValue of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof AttrValue v) {
            return v;
        }
        if (raw instanceof Boolean b) {
            return of(b.booleanValue());
        }
        if (raw instanceof Byte || raw instanceof Short || raw instanceof Integer || raw instanceof Long) {
            return of(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger bi) {
            return bi.bitLength() < 64 ? of(bi.longValue()) : of(bi.toString());
        }
        if (raw instanceof Float || raw instanceof Double || raw instanceof BigDecimal) {
            return of(((Number) raw).doubleValue());
        }
        if (raw instanceof CharSequence cs) {
            return of(cs.toString());
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, AttrValue> converted = new LinkedHashMap<>();
            map.forEach((k, v) -> converted.put(String.valueOf(k), of(v)));
            return ofMap(converted);
        }
        if (raw instanceof Collection<?> collection) {
            List<AttrValue> converted = new ArrayList<>();
            collection.forEach(v -> converted.add(of(v)));
            return ofList(converted);
        }
        if (raw instanceof Object[] array) {
            List<AttrValue> converted = new ArrayList<>();
            for (Object v : array) {
                converted.add(of(v));
            }
            return ofList(converted);
        }
        if (raw instanceof TemporalAccessor) {
            return of(raw.toString());
        }
        return of(raw.toString());
    }

    /**
     * Convert every value of a map.
     *
     * @param raw source map, may be {@code null}
     * @return unmodifiable converted map, empty if {@code raw} is {@code null}
     */
    public static Map<String, AttrValue> mapOf(Map<String, ?> raw) {
        if (raw == null) {
            return Collections.emptyMap();
        }
        Map<String, AttrValue> converted = new LinkedHashMap<>();
        raw.forEach((k, v) -> converted.put(k, of(v)));
        return Collections.unmodifiableMap(converted);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public Kind getKind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean asBoolean() {
        return (Boolean) require(Kind.BOOLEAN);
    }

    public long asLong() {
        return (Long) require(Kind.INTEGER);
    }

    public double asDouble() {
        if (kind == Kind.INTEGER) {
            return ((Long) value).doubleValue();
        }
        return (Double) require(Kind.DECIMAL);
    }

    public String asString() {
        return (String) require(Kind.STRING);
    }

    public List<AttrValue> asList() {
        require(Kind.ARRAY);
        return list;
    }

    public Map<String, AttrValue> asMap() {
        require(Kind.OBJECT);
        return map;
    }

    /**
     * Plain Java form used for JSON serialization: {@code null},
     * {@link Boolean}, {@link Long}, {@link Double}, {@link String},
     * {@link List} or {@link Map}.
     *
     * @return plain value
     */
    @JsonValue
    public Object toPlain() {
        return switch (kind) {
            case ARRAY -> asList().stream().map(AttrValue::toPlain).toList();
            case OBJECT -> {
                Map<String, Object> out = new LinkedHashMap<>();
                asMap().forEach((k, v) -> out.put(k, v.toPlain()));
                yield out;
            }
            default -> value;
        };
    }

    private Object require(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("AttrValue is " + kind + ", not " + expected);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AttrValue that))
            return false;
        return kind == that.kind
                && Objects.equals(value, that.value)
                && Objects.equals(list, that.list)
                && Objects.equals(map, that.map);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, list, map);
    }

    @Override
    public String toString() {
        return String.valueOf(toPlain());
    }
}
