package com.ryuqq.quantum.testkit.contract;

import com.ryuqq.quantum.core.contract.StateListener;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Listener that records every received state in arrival order.
 *
 * <p>Thread-safe. Waiting methods block until the recorded states satisfy a condition
 * or the timeout elapses.</p>
 *
 * @param <T> state type
 * @author Quantum Team
 * @since 1.0.0
 */
public final class RecordingListener<T> implements StateListener<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition received = lock.newCondition();
    private final List<T> states = new ArrayList<>();

    @Override
    public void onState(T state) {
        lock.lock();
        try {
            states.add(state);
            received.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a copy of the recorded states.
     *
     * @return states in arrival order
     */
    public List<T> states() {
        lock.lock();
        try {
            return new ArrayList<>(states);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of recorded states.
     *
     * @return recorded count
     */
    public int size() {
        lock.lock();
        try {
            return states.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until at least {@code count} states were recorded.
     *
     * @param count expected minimum count
     * @param timeout maximum wait
     * @return true if reached, false on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitSize(int count, Duration timeout) throws InterruptedException {
        return awaitMatching(recorded -> recorded.size() >= count, timeout);
    }

    /**
     * Waits until a recorded state matches the predicate.
     *
     * @param predicate state condition
     * @param timeout maximum wait
     * @return true if a matching state arrived, false on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitState(Predicate<T> predicate, Duration timeout) throws InterruptedException {
        return awaitMatching(recorded -> recorded.stream().anyMatch(predicate), timeout);
    }

    private boolean awaitMatching(Predicate<List<T>> condition, Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (!condition.test(states)) {
                if (remaining <= 0L) {
                    return false;
                }
                remaining = received.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }
}
