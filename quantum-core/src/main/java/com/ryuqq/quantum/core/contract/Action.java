package com.ryuqq.quantum.core.contract;

/**
 * 상태 조회 콜백 (Action).
 *
 * <p>Action은 상태를 변경하지 않고 읽기만 합니다. 같은 사이클에서 먼저 큐에 들어온
 * 모든 Reducer가 적용된 이후의 상태를 전달받습니다.</p>
 *
 * @param <T> 상태 타입
 * @author Quantum Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Action<T> {

    /**
     * 현재 상태로 부수 효과 실행.
     *
     * @param state 이번 사이클의 Reducer가 모두 적용된 상태
     */
    void perform(T state);
}
