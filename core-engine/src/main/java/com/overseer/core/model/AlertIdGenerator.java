package com.overseer.core.model;

/**
 * Source of alert identifiers.
 *
 * <p>
 * Implementations must return a new, globally unique value on every call.
 * A generator that cannot produce an ID must throw an unchecked exception;
 * the pipeline treats that as a process fault and does not recover.
 * </p>
 */
@FunctionalInterface
public interface AlertIdGenerator {

    /**
     * @return a new unique identifier
     */
    String nextId();
}
