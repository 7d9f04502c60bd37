package com.ryuqq.quantum.core.threading;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle returned by the quit calls.
 *
 * <p>Becomes ready once the instance has stopped and every execution resource it
 * exclusively owned has been released. A failure to release such a resource is
 * reported by {@link #join()} as a {@link QuitException}; state transitions that
 * were already applied are not affected.</p>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
public interface Joinable {

    /**
     * Blocks until ready.
     *
     * @throws InterruptedException if interrupted while waiting
     * @throws QuitException if tearing down an owned resource failed
     */
    void join() throws InterruptedException;

    /**
     * Blocks until ready or until the timeout elapses.
     *
     * @param timeout maximum time to wait
     * @return true if ready, false on timeout
     * @throws InterruptedException if interrupted while waiting
     * @throws QuitException if tearing down an owned resource failed
     */
    boolean join(Duration timeout) throws InterruptedException;

    /**
     * Returns a handle that is ready once this one and then {@code next} are ready.
     *
     * @param next the handle to join after this one
     * @return combined handle
     */
    default Joinable then(Joinable next) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        Joinable first = this;
        return new Joinable() {
            @Override
            public void join() throws InterruptedException {
                first.join();
                next.join();
            }

            @Override
            public boolean join(Duration timeout) throws InterruptedException {
                long deadline = System.nanoTime() + timeout.toNanos();
                if (!first.join(timeout)) {
                    return false;
                }
                long remaining = Math.max(0L, deadline - System.nanoTime());
                return next.join(Duration.ofNanos(remaining));
            }
        };
    }

    /**
     * A handle that is already ready.
     *
     * @return ready handle
     */
    static Joinable completed() {
        return of(CompletableFuture.completedFuture(null));
    }

    /**
     * A handle that reports a teardown failure.
     *
     * @param cause the teardown failure
     * @return failed handle
     */
    static Joinable failed(Throwable cause) {
        return of(CompletableFuture.failedFuture(cause));
    }

    /**
     * Adapts a future. Exceptional completion is reported as {@link QuitException}.
     *
     * @param future the future to wait on
     * @return handle backed by the future
     */
    static Joinable of(CompletableFuture<?> future) {
        if (future == null) {
            throw new IllegalArgumentException("future cannot be null");
        }
        return new Joinable() {
            @Override
            public void join() throws InterruptedException {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    throw new QuitException("Teardown failed", e.getCause());
                }
            }

            @Override
            public boolean join(Duration timeout) throws InterruptedException {
                try {
                    future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
                    return true;
                } catch (TimeoutException e) {
                    return false;
                } catch (ExecutionException e) {
                    throw new QuitException("Teardown failed", e.getCause());
                }
            }
        };
    }
}
