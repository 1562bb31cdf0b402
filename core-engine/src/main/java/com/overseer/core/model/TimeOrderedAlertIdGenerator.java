package com.overseer.core.model;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;

import java.util.UUID;

/**
 * {@link AlertIdGenerator} producing version 7 UUIDs: a 48-bit Unix
 * millisecond prefix followed by random bits. The canonical string form
 * sorts chronologically for IDs generated at least one millisecond apart.
 *
 * <p>
 * Thread-safe; a single instance may be shared by the whole process.
 * </p>
 */
public final class TimeOrderedAlertIdGenerator implements AlertIdGenerator {

    private final TimeBasedEpochGenerator generator;

    public TimeOrderedAlertIdGenerator() {
        this.generator = Generators.timeBasedEpochGenerator();
    }

    @Override
    public String nextId() {
        UUID id;
        try {
            id = generator.generate();
        } catch (RuntimeException e) {
            throw new IllegalStateException("Alert ID source is broken; cannot continue", e);
        }
        return id.toString();
    }
}
