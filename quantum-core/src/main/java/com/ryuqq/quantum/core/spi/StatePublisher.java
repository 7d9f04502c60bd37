package com.ryuqq.quantum.core.spi;

/**
 * Outbound port the engine uses to announce a new state.
 *
 * <p><strong>Calling Contract:</strong></p>
 * <ul>
 *   <li>Invoked only from the engine's serial execution context, never concurrently</li>
 *   <li>Invoked at most once per changed state, in engine order</li>
 *   <li>The initial state is published once at construction, before any submission is accepted</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Non-blocking: must hand the state off and return; listener callbacks run elsewhere</li>
 *   <li>Order-preserving: states must reach each listener in publish order</li>
 * </ul>
 *
 * @param <T> state type
 * @author Quantum Team
 * @since 1.0.0
 */
public interface StatePublisher<T> {

    /**
     * Publishes a state to all registered listeners.
     *
     * @param state the state that was just produced by a cycle
     */
    void publish(T state);
}
