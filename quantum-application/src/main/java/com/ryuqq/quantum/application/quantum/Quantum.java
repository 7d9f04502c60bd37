package com.ryuqq.quantum.application.quantum;

import com.ryuqq.quantum.application.config.QuantumConfig;
import com.ryuqq.quantum.core.contract.Action;
import com.ryuqq.quantum.core.contract.Reducer;
import com.ryuqq.quantum.core.future.CycleFuture;
import com.ryuqq.quantum.core.spi.History;
import com.ryuqq.quantum.core.spi.StateObservable;
import com.ryuqq.quantum.core.statemachine.LifecycleState;

/**
 * 단일 작성자(single-writer) 상태 저장소.
 *
 * <p>여러 스레드가 Reducer와 Action을 제출하고, 내부 엔진 하나가 이를 직렬로 적용합니다.
 * 리스너는 겹치지 않고 엄격히 정렬된 상태 시퀀스만 관찰합니다.</p>
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>한 시점에 실행 중인 Reducer/Action은 최대 하나</li>
 *   <li>Reducer는 제출 순서(FIFO)대로, Action도 제출 순서대로 실행</li>
 *   <li>상태가 실제로 바뀐 사이클에서만 publish (NO-OP Reducer는 publish 안 함)</li>
 *   <li>생성 직후 초기 상태를 한 번 publish</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Quantum&lt;Counter&gt; quantum = Quantums.create(new Counter(0));
 * quantum.addListener(counter -&gt; render(counter));
 *
 * quantum.setState(counter -&gt; counter.increment());
 * quantum.withState(counter -&gt; log.info("current: {}", counter));
 *
 * quantum.quitSafely().join();
 * </pre>
 *
 * @param <T> 상태 타입 (불변 객체 권장, equals로 변경 여부 판단)
 * @author Quantum Team
 * @since 1.0.0
 */
public interface Quantum<T> extends StateObservable<T>, Quitable {

    /**
     * Reducer 제출 (결과 대기 없음).
     *
     * <p>Reducer는 내부 엔진에서 실행되며, 장시간 블로킹 작업을 포함하면 안 됩니다.
     * 상태 객체를 직접 변경하지 말고 복사본을 반환해야 하며,
     * 입력을 그대로 반환하면 NO-OP으로 처리됩니다.</p>
     *
     * @param reducer 상태 변환 함수
     * @throws IllegalArgumentException reducer가 null인 경우
     */
    default void setState(Reducer<T> reducer) {
        setStateFuture(reducer);
    }

    /**
     * Reducer 제출.
     *
     * @param reducer 상태 변환 함수
     * @return Reducer가 적용되거나 버려지면 종료되는 Future
     * @throws IllegalArgumentException reducer가 null인 경우
     */
    CycleFuture setStateFuture(Reducer<T> reducer);

    /**
     * Action 제출 (결과 대기 없음).
     *
     * <p>Action은 다음 사이클의 마지막에 실행되며, 그 전에 대기 중인 Reducer가 모두 적용됩니다.</p>
     *
     * @param action 상태 조회 콜백
     * @throws IllegalArgumentException action이 null인 경우
     */
    default void withState(Action<T> action) {
        withStateFuture(action);
    }

    /**
     * Action 제출.
     *
     * @param action 상태 조회 콜백
     * @return Action이 실행되거나 버려지면 종료되는 Future
     * @throws IllegalArgumentException action이 null인 경우
     */
    CycleFuture withStateFuture(Action<T> action);

    /**
     * 모든 Reducer가 만든 상태의 기록 (중간 상태 포함, 기본 비활성).
     *
     * <p><strong>주의:</strong> 디버깅 용도입니다. 리스너는 Reducer마다가 아니라 사이클마다 호출되므로,
     * 기록에는 publish되지 않은 상태가 포함됩니다. diff 계산에 사용하지 마세요.</p>
     *
     * @return 상태 기록
     */
    History<T> history();

    /**
     * 생성 시 사용된 설정 (불변).
     *
     * @return 인스턴스 설정
     */
    QuantumConfig config();

    /**
     * 현재 생명주기 상태.
     *
     * @return 생명주기 상태
     */
    LifecycleState lifecycle();

    /**
     * 종료(STOPPED) 리스너 등록.
     *
     * <p>이미 종료된 경우 호출 스레드에서 즉시 실행됩니다.</p>
     *
     * @param listener 종료 시 한 번 실행될 콜백
     * @throws IllegalArgumentException listener가 null인 경우
     */
    void addQuittedListener(Runnable listener);
}
