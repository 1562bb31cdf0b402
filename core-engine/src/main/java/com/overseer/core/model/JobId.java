package com.overseer.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.OverseerException;

import java.io.Serializable;

/**
 * Opaque identifier of one Run/Eval cycle.
 *
 * <p>
 * The job ID is the cache partition key: the Run phase writes every result
 * under it and the Eval phase reads them back by it. It is always supplied by
 * the caller, never generated.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobId implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String value;

    private JobId(String value) {
        this.value = value;
    }

    /**
     * @param value raw job ID
     * @return the job ID
     * @throws OverseerException with {@link ErrorKind#INVALID_JOB_ID} if
     *                           {@code value} is {@code null} or blank
     */
    @JsonCreator
    public static JobId of(String value) {
        if (value == null || value.isBlank()) {
            throw new OverseerException(ErrorKind.INVALID_JOB_ID, "job ID must not be empty");
        }
        return new JobId(value);
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobId that))
            return false;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
