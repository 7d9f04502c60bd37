/**
 * 상태 엔진 (StateActor)과 작업 큐.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.quantum.adapter.runner.engine.StateActor} - 사이클 실행, 생명주기 관리</li>
 *   <li>JobQueue - Reducer/Action 대기열 (StateActor의 lock으로 보호)</li>
 *   <li>Batch - 사이클 시작 시 분리된 작업 묶음</li>
 * </ul>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
package com.ryuqq.quantum.adapter.runner.engine;
