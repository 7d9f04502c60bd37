/**
 * Per-submission completion tokens.
 *
 * <p>{@link com.ryuqq.quantum.core.future.CycleFuture} is returned for every reducer or
 * action submission and resolves to exactly one terminal
 * {@link com.ryuqq.quantum.core.statemachine.JobState}. A future never hangs after
 * its instance has stopped: jobs that will never run resolve to {@code DISCARDED}.</p>
 *
 * @since 1.0.0
 * @author Quantum Team
 */
package com.ryuqq.quantum.core.future;
