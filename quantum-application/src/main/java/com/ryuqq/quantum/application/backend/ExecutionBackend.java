package com.ryuqq.quantum.application.backend;

import com.ryuqq.quantum.core.threading.Joinable;

/**
 * Execution strategy that drives an engine's steps.
 *
 * <p>All implementations expose identical ordering and publish semantics; they differ
 * only in how steps are scheduled.</p>
 *
 * <p><strong>Implementations:</strong></p>
 * <ul>
 *   <li>Dedicated thread: wait/notify loop on a thread owned by the instance</li>
 *   <li>Executor: one step task at a time on a pool, a caller's executor, or inline</li>
 *   <li>Cooperative: one step per post on a host loop that already serializes callbacks</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Mutual exclusion: two steps never overlap, even on a multi-threaded executor</li>
 *   <li>No lost wake-ups: after {@link #wakeUp()} returns, a step that observes the new work is guaranteed to run</li>
 *   <li>Ownership: {@link #teardown()} releases only resources the backend created itself</li>
 * </ul>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
public interface ExecutionBackend {

    /**
     * Binds the backend to its engine and starts driving it.
     *
     * @param target the engine to drive
     * @throws IllegalArgumentException if target is null
     * @throws IllegalStateException if already started
     */
    void start(CycleTarget target);

    /**
     * Signals that work arrived or a stop was requested.
     *
     * <p>Called after every accepted submission and after each quit call.
     * Must not block for longer than it takes to hand off a task (except for the
     * synchronous inline backend, which runs the step on the caller).</p>
     */
    void wakeUp();

    /**
     * Releases exclusively owned execution resources.
     *
     * <p>Invoked once, after the engine reached {@code STOPPED}. Backends running on
     * shared or caller-supplied resources return {@link Joinable#completed()}.</p>
     *
     * @return handle that is ready when the resources are released
     */
    Joinable teardown();

    /**
     * Indicates whether {@link #teardown()} releases anything.
     *
     * @return true if the backend owns its execution resource
     */
    boolean ownsResources();
}
