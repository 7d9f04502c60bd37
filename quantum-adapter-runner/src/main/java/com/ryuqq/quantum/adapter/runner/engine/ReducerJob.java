package com.ryuqq.quantum.adapter.runner.engine;

import com.ryuqq.quantum.core.contract.Reducer;
import com.ryuqq.quantum.core.future.CycleFuture;

/**
 * 대기 중인 Reducer와 그 완료 토큰.
 *
 * @param reducer 상태 변환 함수
 * @param future 호출자에게 반환된 Future
 * @param <T> 상태 타입
 * @author Quantum Team
 * @since 1.0.0
 */
record ReducerJob<T>(Reducer<T> reducer, CycleFuture future) {
}
