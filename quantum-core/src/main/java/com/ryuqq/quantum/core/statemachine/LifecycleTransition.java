package com.ryuqq.quantum.core.statemachine;

/**
 * 생명주기 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>ACTIVE → DRAINING (quitSafely)</li>
 *   <li>ACTIVE → FORCE_STOPPING (quit)</li>
 *   <li>DRAINING → FORCE_STOPPING (draining 중 quit)</li>
 *   <li>DRAINING → STOPPED (마지막 사이클 완료)</li>
 *   <li>FORCE_STOPPING → STOPPED</li>
 * </ul>
 *
 * <p>FORCE_STOPPING → DRAINING은 허용되지 않습니다. 강제 종료는 되돌릴 수 없습니다.</p>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
public final class LifecycleTransition {

    // Utility class - prevent instantiation
    private LifecycleTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이 가능 여부 확인 (예외 없음).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean canTransition(LifecycleState from, LifecycleState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return switch (from) {
            case ACTIVE -> to == LifecycleState.DRAINING || to == LifecycleState.FORCE_STOPPING;
            case DRAINING -> to == LifecycleState.FORCE_STOPPING || to == LifecycleState.STOPPED;
            case FORCE_STOPPING -> to == LifecycleState.STOPPED;
            case STOPPED -> false;
        };
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(LifecycleState from, LifecycleState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
        if (!canTransition(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid lifecycle transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static LifecycleState transition(LifecycleState current, LifecycleState next) {
        validate(current, next);
        return next;
    }
}
