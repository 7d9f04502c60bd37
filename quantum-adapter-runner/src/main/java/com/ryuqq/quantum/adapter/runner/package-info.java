/**
 * Quantum 런타임 어댑터.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.quantum.adapter.runner.Quantums} - 생성 팩토리</li>
 *   <li>{@link com.ryuqq.quantum.adapter.runner.ActorQuantum} - Quantum 구현체</li>
 *   <li>{@code engine} - StateActor와 작업 큐</li>
 *   <li>{@code backend} - 전용 스레드 / Executor / 협력형 루프 백엔드</li>
 * </ul>
 *
 * <h2>스레딩 모델</h2>
 * <pre>
 * producer threads ──submit──▶ JobQueue (lock)
 *                                   │ wakeUp
 *                                   ▼
 *                     ExecutionBackend ──step──▶ StateActor (serial)
 *                                                    │ publish
 *                                                    ▼
 *                               ExecutorStateSubject ──callbackExecutor──▶ listeners
 * </pre>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
package com.ryuqq.quantum.adapter.runner;
