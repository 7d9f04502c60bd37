/**
 * Ports between the engine and its execution strategies.
 *
 * <ul>
 *   <li>{@link com.ryuqq.quantum.application.backend.CycleTarget} - what a backend drives</li>
 *   <li>{@link com.ryuqq.quantum.application.backend.ExecutionBackend} - how it is driven</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Quantum Team
 */
package com.ryuqq.quantum.application.backend;
