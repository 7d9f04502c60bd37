package com.ryuqq.quantum.adapter.inmemory.subject;

import com.ryuqq.quantum.core.contract.StateListener;
import com.ryuqq.quantum.core.spi.StateObservable;
import com.ryuqq.quantum.core.spi.StatePublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Listener registry that delivers published states on a callback {@link Executor}.
 *
 * <p>The engine calls {@link #publish(Object)} from its serial context and returns
 * immediately; listeners run later on the callback executor, never on the engine.</p>
 *
 * <p><strong>Delivery Guarantees:</strong></p>
 * <ul>
 *   <li><strong>Order:</strong> states reach every listener in publish order, even when the
 *       callback executor is a multi-threaded pool (at most one drain task is scheduled at a time)</li>
 *   <li><strong>Replay:</strong> a newly added listener first receives the most recently published
 *       state, then every later one; it never receives older states</li>
 *   <li><strong>Membership:</strong> the listener set is captured at publish time, so a removed listener
 *       still receives states published before its removal</li>
 *   <li><strong>Isolation:</strong> a listener exception is logged and does not affect other listeners
 *       or later deliveries</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ExecutorStateSubject&lt;Integer&gt; subject = new ExecutorStateSubject&lt;&gt;(callbackExecutor);
 * subject.addListener(state -&gt; System.out.println("state=" + state));
 * subject.publish(1);
 * </pre>
 *
 * @param <T> state type
 * @author Quantum Team
 * @since 1.0.0
 */
public class ExecutorStateSubject<T> implements StatePublisher<T>, StateObservable<T> {

    private static final Logger log = LoggerFactory.getLogger(ExecutorStateSubject.class);

    private final Executor callbackExecutor;
    private final List<StateListener<T>> listeners = new CopyOnWriteArrayList<>();
    private final Queue<Delivery<T>> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private final ReentrantLock lock = new ReentrantLock();

    private T latest;
    private boolean hasLatest;

    /**
     * Creates a subject delivering on the given executor.
     *
     * @param callbackExecutor executor running listener callbacks
     * @throws IllegalArgumentException if callbackExecutor is null
     */
    public ExecutorStateSubject(Executor callbackExecutor) {
        if (callbackExecutor == null) {
            throw new IllegalArgumentException("callbackExecutor cannot be null");
        }
        this.callbackExecutor = callbackExecutor;
    }

    @Override
    public void addListener(StateListener<T> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        lock.lock();
        try {
            listeners.add(listener);
            if (!hasLatest) {
                return;
            }
            pending.add(new Delivery<>(latest, List.of(listener)));
        } finally {
            lock.unlock();
        }
        scheduleDrain();
    }

    @Override
    public void removeListener(StateListener<T> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.remove(listener);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Never blocks and never runs a listener on the calling thread (unless the
     * callback executor itself runs tasks inline).</p>
     */
    @Override
    public void publish(T state) {
        lock.lock();
        try {
            latest = state;
            hasLatest = true;
            if (listeners.isEmpty()) {
                return;
            }
            pending.add(new Delivery<>(state, List.copyOf(listeners)));
        } finally {
            lock.unlock();
        }
        scheduleDrain();
    }

    /**
     * Returns the number of registered listeners.
     *
     * @return listener count
     */
    public int listenerCount() {
        return listeners.size();
    }

    private void scheduleDrain() {
        if (!scheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            callbackExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            scheduled.set(false);
            int dropped = pending.size();
            pending.clear();
            log.error("Callback executor rejected state delivery, dropped {} pending states", dropped, e);
        }
    }

    private void drain() {
        do {
            try {
                Delivery<T> delivery;
                while ((delivery = pending.poll()) != null) {
                    deliver(delivery);
                }
            } finally {
                scheduled.set(false);
            }
            // a publish may have enqueued between the last poll and the flag reset
        } while (!pending.isEmpty() && scheduled.compareAndSet(false, true));
    }

    private void deliver(Delivery<T> delivery) {
        for (StateListener<T> listener : delivery.listeners()) {
            try {
                listener.onState(delivery.state());
            } catch (RuntimeException e) {
                log.warn("State listener {} failed for state {}", listener, delivery.state(), e);
            }
        }
    }

    private record Delivery<T>(T state, List<StateListener<T>> listeners) {
    }
}
