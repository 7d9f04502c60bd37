package com.ryuqq.quantum.adapter.runner.engine;

import com.ryuqq.quantum.core.contract.Action;
import com.ryuqq.quantum.core.future.CycleFuture;

/**
 * 대기 중인 Action과 그 완료 토큰.
 *
 * @param action 상태 조회 콜백
 * @param future 호출자에게 반환된 Future
 * @param <T> 상태 타입
 * @author Quantum Team
 * @since 1.0.0
 */
record ActionJob<T>(Action<T> action, CycleFuture future) {
}
