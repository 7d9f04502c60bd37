package com.ryuqq.quantum.core.contract;

/**
 * Receives every published state, in publish order.
 *
 * @param <T> state type
 * @author Quantum Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StateListener<T> {

    void onState(T state);
}
