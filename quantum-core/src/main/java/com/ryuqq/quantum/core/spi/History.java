package com.ryuqq.quantum.core.spi;

import java.util.List;

/**
 * Read-only view over the append-only log of every state produced by a reducer.
 *
 * <p><strong>Warning:</strong> the history contains intermediate states that were
 * never published (listeners are notified once per cycle, not once per reducer).
 * It is a debugging aid; do not diff published states against it.</p>
 *
 * @param <T> state type
 * @author Quantum Team
 * @since 1.0.0
 */
public interface History<T> {

    /**
     * Returns a snapshot of the recorded states, oldest first.
     *
     * <p>Safe to call from any thread. The returned list is immutable and does not
     * reflect later pushes.</p>
     *
     * @return recorded states
     */
    List<T> read();

    /**
     * Indicates whether pushes are currently recorded.
     *
     * @return true when enabled
     */
    boolean isEnabled();

    /**
     * Enables recording.
     */
    void enable();

    /**
     * Disables recording. Already recorded states are kept.
     */
    void disable();
}
