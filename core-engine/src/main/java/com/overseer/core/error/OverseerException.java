package com.overseer.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unchecked exception raised by every pipeline component.
 *
 * <p>
 * Carries an {@link ErrorKind} so callers can branch on the failure without
 * parsing messages, plus an ordered set of context values (task ID, offending
 * timestamp, ...) that are appended to {@link #getMessage()}.
 * </p>
 *
 * <pre>
 * throw new OverseerException(ErrorKind.MALFORMED_TIMESTAMP, "failed to parse timestamp", e)
 *         .with("timestamp", raw);
 * </pre>
 *
 * @since 1.0.0
 */
public class OverseerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final Map<String, Object> context = new LinkedHashMap<>();

    public OverseerException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public OverseerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Attach a context value to this exception.
     *
     * @param key   context key; must not be {@code null}
     * @param value context value, may be {@code null}
     * @return this exception, for chaining in a {@code throw} statement
     */
    public OverseerException with(String key, Object value) {
        context.put(Objects.requireNonNull(key, "key must not be null"), value);
        return this;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return unmodifiable view of the attached context values
     */
    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    /**
     * @return the message without the appended context values
     */
    public String getBaseMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(kind).append("] ").append(super.getMessage());
        if (!context.isEmpty()) {
            sb.append(' ').append(context);
        }
        return sb.toString();
    }
}
