/**
 * Job and instance lifecycle state machines.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.quantum.core.statemachine.JobState} - per-submission state (tri-state result)</li>
 *   <li>{@link com.ryuqq.quantum.core.statemachine.JobTransition} - job transition validation</li>
 *   <li>{@link com.ryuqq.quantum.core.statemachine.LifecycleState} - instance lifecycle</li>
 *   <li>{@link com.ryuqq.quantum.core.statemachine.LifecycleTransition} - lifecycle transition validation</li>
 * </ul>
 *
 * <h2>Transition Rules</h2>
 * <pre>
 * Job:       PENDING → COMPLETED | DISCARDED | FAILED
 * Lifecycle: ACTIVE → DRAINING → STOPPED
 *            ACTIVE → FORCE_STOPPING → STOPPED
 *            DRAINING → FORCE_STOPPING
 *
 * Forbidden:
 * - any transition out of a terminal state
 * - FORCE_STOPPING → DRAINING
 * </pre>
 *
 * @since 1.0.0
 * @author Quantum Team
 */
package com.ryuqq.quantum.core.statemachine;
