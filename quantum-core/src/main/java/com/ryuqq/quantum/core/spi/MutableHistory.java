package com.ryuqq.quantum.core.spi;

/**
 * Writer side of {@link History}, owned by the engine.
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@link #push(Object)} is only called from the engine's serial context</li>
 *   <li>A disabled history must return from {@link #push(Object)} without recording or copying</li>
 *   <li>{@link #read()} may run concurrently with {@link #push(Object)}</li>
 * </ul>
 *
 * @param <T> state type
 * @author Quantum Team
 * @since 1.0.0
 */
public interface MutableHistory<T> extends History<T> {

    /**
     * Appends a state if recording is enabled.
     *
     * @param state state produced by a reducer
     */
    void push(T state);
}
