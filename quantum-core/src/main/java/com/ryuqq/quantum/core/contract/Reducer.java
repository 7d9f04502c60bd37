package com.ryuqq.quantum.core.contract;

/**
 * 상태 변환 함수 (Reducer).
 *
 * <p>현재 상태를 받아 다음 상태를 반환하는 순수 함수입니다.
 * 엔진의 단일 실행 컨텍스트에서만 호출되며, 제출 순서(FIFO)대로 정확히 한 번 적용됩니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>입력 객체를 직접 변경하지 않고 새 인스턴스를 반환해야 합니다.</li>
 *   <li>입력을 그대로 반환하면 NO-OP으로 간주되어 publish되지 않습니다.</li>
 *   <li>장시간 블로킹 작업을 포함하지 않아야 합니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * quantum.setState(state -&gt; state.withRevision(state.revision() + 1));
 * </pre>
 *
 * @param <T> 상태 타입
 * @author Quantum Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Reducer<T> {

    /**
     * 다음 상태 계산.
     *
     * @param state 현재 상태
     * @return 다음 상태 (변경이 없으면 입력 그대로)
     */
    T reduce(T state);
}
