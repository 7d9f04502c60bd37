package com.ryuqq.quantum.core.statemachine;

/**
 * 작업 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → COMPLETED</li>
 *   <li>PENDING → DISCARDED</li>
 *   <li>PENDING → FAILED</li>
 * </ul>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
public final class JobTransition {

    // Utility class - prevent instantiation
    private JobTransition() {
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
    public static boolean canTransition(JobState from, JobState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return from == JobState.PENDING && to.isTerminal();
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(JobState from, JobState to) {
        if (!canTransition(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid job state transition: %s → %s", from, to)
            );
        }
    }
}
