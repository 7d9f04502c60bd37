package com.ryuqq.quantum.application.backend;

/**
 * Engine side of the backend contract.
 *
 * <p>An {@link ExecutionBackend} only decides <em>when</em> and <em>where</em> a step
 * runs; ordering, batching, publishing and lifecycle handling live behind this
 * interface.</p>
 *
 * <p><strong>Step Semantics:</strong></p>
 * <pre>
 * step():
 *   STOPPED         → no-op
 *   FORCE_STOPPING  → discard everything queued, → STOPPED
 *   DRAINING        → one full cycle (the final one), → STOPPED
 *   ACTIVE          → one full cycle
 * </pre>
 *
 * <p><strong>Calling Contract:</strong></p>
 * <ul>
 *   <li>{@link #step()} must never be invoked concurrently with itself</li>
 *   <li>{@link #needsStep()}, {@link #isStopped()} and {@link #awaitWork()} are thread-safe</li>
 * </ul>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
public interface CycleTarget {

    /**
     * Runs one scheduling unit (a cycle, or the stop handling).
     *
     * <p>Exceptions raised by reducers or actions propagate out of this method.</p>
     */
    void step();

    /**
     * Indicates whether a step would do any work: jobs are queued, or a stop was
     * requested and has not completed yet.
     *
     * @return true if a step should be scheduled
     */
    boolean needsStep();

    /**
     * Indicates whether the engine reached {@code STOPPED}.
     *
     * @return true once stopped
     */
    boolean isStopped();

    /**
     * Blocks while the queue is empty and no stop was requested.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    void awaitWork() throws InterruptedException;

    /**
     * Stops the engine because its execution context can no longer run steps.
     *
     * <p>Queued jobs are discarded so that no future hangs.</p>
     *
     * @param cause why the context died
     */
    void abort(Throwable cause);

    /**
     * Name used for logging and thread naming.
     *
     * @return engine name
     */
    String name();
}
