package com.ryuqq.quantum.core.statemachine;

/**
 * Quantum 인스턴스의 생명주기 상태.
 *
 * <pre>
 * ACTIVE ──quit()──────► FORCE_STOPPING ──► STOPPED
 *    │                        ▲
 *    └──quitSafely()──► DRAINING ──(마지막 사이클)──► STOPPED
 *                             └──quit()──┘
 * </pre>
 *
 * <p><strong>불변식:</strong> STOPPED에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
public enum LifecycleState {

    /**
     * 제출을 받고 사이클을 실행하는 중.
     */
    ACTIVE,

    /**
     * quitSafely() 호출됨. 마지막 사이클 한 번을 남겨둔 상태.
     */
    DRAINING,

    /**
     * quit() 호출됨. 실행 중인 작업만 마치고 나머지는 버림.
     */
    FORCE_STOPPING,

    /**
     * 종료 완료.
     */
    STOPPED;

    /**
     * 새 작업 제출을 받을 수 있는지 확인.
     *
     * @return ACTIVE인 경우에만 true
     */
    public boolean isAcceptingSubmissions() {
        return this == ACTIVE;
    }

    /**
     * 종료가 요청되었는지 확인.
     *
     * @return DRAINING, FORCE_STOPPING, STOPPED인 경우 true
     */
    public boolean isStopRequested() {
        return this != ACTIVE;
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return STOPPED인 경우 true
     */
    public boolean isTerminal() {
        return this == STOPPED;
    }
}
