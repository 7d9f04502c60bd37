package com.ryuqq.quantum.core.statemachine;

/**
 * 제출된 작업(Reducer/Action)의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → COMPLETED (엔진이 실행 완료)</li>
 *   <li>PENDING → DISCARDED (quit() 또는 종료 후 제출로 실행되지 않음)</li>
 *   <li>PENDING → FAILED (사용자 코드에서 예외 발생)</li>
 *   <li><strong>종료 상태에서는 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <pre>
 * PENDING
 *    │
 *    ├─► COMPLETED (실행됨)
 *    ├─► DISCARDED (버려짐)
 *    └─► FAILED    (예외)
 * </pre>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
public enum JobState {

    /**
     * 큐에서 대기 중.
     */
    PENDING,

    /**
     * 엔진이 실행을 마침.
     */
    COMPLETED,

    /**
     * 실행되지 않고 버려짐.
     */
    DISCARDED,

    /**
     * 실행 중 예외 발생.
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, DISCARDED, FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this != PENDING;
    }
}
