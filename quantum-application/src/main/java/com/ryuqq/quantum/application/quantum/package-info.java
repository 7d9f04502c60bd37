/**
 * Quantum 공개 API.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.quantum.application.quantum.Quantum} - 상태 저장소 인터페이스</li>
 *   <li>{@link com.ryuqq.quantum.application.quantum.Quitable} - quit / quitSafely</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ActorQuantum, StateActor, backends)
 *   ↓ implements
 * application (Quantum, ExecutionBackend, CycleTarget)
 *   ↓ depends on
 * core (Reducer, Action, CycleFuture, LifecycleState, Threading, SPI)
 * </pre>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
package com.ryuqq.quantum.application.quantum;
