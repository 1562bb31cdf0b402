package com.overseer.core.pipeline;

import com.overseer.core.model.Alert;

/**
 * Delivers constructed alerts downstream.
 *
 * <p>
 * The pipeline calls {@link #publish(Alert)} once per alert and does not
 * retry; retry policy, if any, belongs to the implementation. A failure is
 * signalled by throwing an unchecked exception.
 * </p>
 */
public interface AlertNotifier extends AutoCloseable {

    /**
     * @param alert alert to deliver
     */
    void publish(Alert alert);

    /**
     * Release transport resources. The default does nothing.
     */
    @Override
    default void close() {
    }
}
