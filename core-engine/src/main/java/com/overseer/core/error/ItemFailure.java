package com.overseer.core.error;

import java.util.Objects;

/**
 * One failed item inside a batch: the identifier of the task or alert that
 * failed and the exception that caused it.
 */
public final class ItemFailure {

    private final String itemId;
    private final ErrorKind kind;
    private final Throwable cause;

    public ItemFailure(String itemId, ErrorKind kind, Throwable cause) {
        this.itemId = Objects.requireNonNull(itemId, "itemId must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.cause = Objects.requireNonNull(cause, "cause must not be null");
    }

    public String getItemId() {
        return itemId;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return kind + " " + itemId + ": " + cause.getMessage();
    }
}
