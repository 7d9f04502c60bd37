package com.ryuqq.quantum.core.spi;

import com.ryuqq.quantum.core.contract.StateListener;

/**
 * Listener registration boundary.
 *
 * <p>Listeners are invoked on a callback executor distinct from the engine. A listener
 * added after some states were published only receives later states.</p>
 *
 * @param <T> state type
 * @author Quantum Team
 * @since 1.0.0
 */
public interface StateObservable<T> {

    /**
     * Registers a listener.
     *
     * @param listener the listener to add
     * @throws IllegalArgumentException if listener is null
     */
    void addListener(StateListener<T> listener);

    /**
     * Unregisters a listener. Unknown listeners are ignored.
     *
     * @param listener the listener to remove
     * @throws IllegalArgumentException if listener is null
     */
    void removeListener(StateListener<T> listener);
}
