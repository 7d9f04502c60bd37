package com.ryuqq.quantum.adapter.inmemory.history;

import com.ryuqq.quantum.core.spi.MutableHistory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of {@link MutableHistory} guarded by a read-write lock.
 *
 * <p>Only the engine pushes; any thread may read. Readers receive an immutable copy
 * taken under the read lock, so a read never observes a half-applied push.</p>
 *
 * <p><strong>Cost Model:</strong></p>
 * <ul>
 *   <li><strong>push (disabled):</strong> one volatile read, no locking</li>
 *   <li><strong>push (enabled):</strong> write lock + ArrayList append</li>
 *   <li><strong>read:</strong> read lock + O(N) copy</li>
 * </ul>
 *
 * <p>Recording is disabled by default. Entries are never evicted.</p>
 *
 * @param <T> state type
 * @author Quantum Team
 * @since 1.0.0
 */
public class SynchronizedHistory<T> implements MutableHistory<T> {

    private final List<T> entries = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile boolean enabled;

    /**
     * Creates a disabled history.
     */
    public SynchronizedHistory() {
        this(false);
    }

    /**
     * Creates a history with the given initial recording flag.
     *
     * @param enabled true to record from the first push
     */
    public SynchronizedHistory(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public void push(T state) {
        if (!enabled) {
            return;
        }
        lock.writeLock().lock();
        try {
            entries.add(state);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Null states are kept as recorded, so the copy is built with
     * {@link Collections#unmodifiableList} rather than {@code List.copyOf}.</p>
     */
    @Override
    public List<T> read() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(entries));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void enable() {
        enabled = true;
    }

    @Override
    public void disable() {
        enabled = false;
    }
}
