package com.ryuqq.quantum.application.quantum;

import com.ryuqq.quantum.core.threading.Joinable;

/**
 * 종료 가능한 컴포넌트.
 *
 * <p>두 호출 모두 멱등이며, 엔진 스레드를 포함한 어느 스레드에서나 호출할 수 있습니다.
 * 단, 엔진 스레드에서 반환된 {@link Joinable}을 join하면 교착 상태가 됩니다.</p>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
public interface Quitable {

    /**
     * 강제 종료.
     *
     * <p>큐에 남아 있는 Reducer/Action은 모두 버려지고(DISCARDED),
     * 현재 실행 중인 작업만 마무리됩니다.</p>
     *
     * @return 백엔드 정리가 끝나면 준비되는 핸들
     */
    Joinable quit();

    /**
     * 안전 종료.
     *
     * <p>정확히 한 번의 사이클을 더 실행하여 그 시점까지 큐에 들어온 작업을 모두 처리한 뒤 종료합니다.</p>
     *
     * @return 백엔드 정리가 끝나면 준비되는 핸들
     */
    Joinable quitSafely();
}
