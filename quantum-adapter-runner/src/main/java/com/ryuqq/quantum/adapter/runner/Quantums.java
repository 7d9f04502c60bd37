package com.ryuqq.quantum.adapter.runner;

import com.ryuqq.quantum.adapter.runner.backend.CooperativeBackend;
import com.ryuqq.quantum.adapter.runner.backend.DedicatedThreadBackend;
import com.ryuqq.quantum.adapter.runner.backend.ExecutorBackend;
import com.ryuqq.quantum.application.backend.ExecutionBackend;
import com.ryuqq.quantum.application.config.QuantumConfig;
import com.ryuqq.quantum.application.config.QuantumDefaults;
import com.ryuqq.quantum.application.quantum.Quantum;
import com.ryuqq.quantum.core.threading.Threading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Quantum} 생성 팩토리.
 *
 * <p><strong>Threading별 백엔드:</strong></p>
 * <ul>
 *   <li>DEDICATED_THREAD → {@link DedicatedThreadBackend} (스레드 소유)</li>
 *   <li>SHARED_POOL → {@link ExecutorBackend#shared} + {@link QuantumDefaults} 공유 풀</li>
 *   <li>DEDICATED_POOL → {@link ExecutorBackend#owned} + 고정 크기 전용 풀</li>
 *   <li>CALLER_SUPPLIED_EXECUTOR → {@link ExecutorBackend#shared} (호출자 Executor는 종료하지 않음)</li>
 *   <li>SYNCHRONOUS_INLINE → {@link ExecutorBackend#inline()}</li>
 *   <li>COOPERATIVE_SINGLE_THREAD → {@link CooperativeBackend}</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Quantum&lt;Integer&gt; counter = Quantums.create(0);
 * Quantum&lt;Integer&gt; inline = Quantums.create(0, Threading.sync());
 * Quantum&lt;Integer&gt; recorded = Quantums.create(0, new QuantumConfig().withHistoryEnabled(true));
 * </pre>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
public final class Quantums {

    private static final Logger log = LoggerFactory.getLogger(Quantums.class);

    // Utility class - prevent instantiation
    private Quantums() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본 설정으로 생성.
     *
     * @param initial 초기 상태
     * @param <T> 상태 타입
     * @return 시작된 Quantum (초기 상태 publish 완료)
     * @throws IllegalArgumentException initial이 null인 경우
     */
    public static <T> Quantum<T> create(T initial) {
        return create(initial, new QuantumConfig());
    }

    /**
     * 실행 방식만 지정해 생성.
     *
     * @param initial 초기 상태
     * @param threading 실행 방식
     * @param <T> 상태 타입
     * @return 시작된 Quantum
     * @throws IllegalArgumentException initial 또는 threading이 null인 경우
     */
    public static <T> Quantum<T> create(T initial, Threading threading) {
        return create(initial, new QuantumConfig().withThreading(threading));
    }

    /**
     * 설정을 지정해 생성.
     *
     * @param initial 초기 상태
     * @param config 인스턴스 설정
     * @param <T> 상태 타입
     * @return 시작된 Quantum
     * @throws IllegalArgumentException initial 또는 config가 null인 경우
     */
    public static <T> Quantum<T> create(T initial, QuantumConfig config) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        ActorQuantum<T> quantum = new ActorQuantum<>(initial, config, backendFor(config));
        quantum.start();
        log.debug("Quantum {} created: threading={}, history={}",
            config.workerName(), config.threading().kind(), config.historyEnabled());
        return quantum;
    }

    /**
     * 설정에 맞는 백엔드 생성.
     *
     * @param config 인스턴스 설정
     * @return 새 백엔드
     */
    static ExecutionBackend backendFor(QuantumConfig config) {
        Threading threading = config.threading();
        return switch (threading.kind()) {
            case DEDICATED_THREAD -> new DedicatedThreadBackend(config.workerName());
            case SHARED_POOL -> ExecutorBackend.shared(QuantumDefaults.settings().pool());
            case DEDICATED_POOL -> ExecutorBackend.owned(Executors.newFixedThreadPool(
                ((Threading.DedicatedPool) threading).threads(), workerFactory(config.workerName())));
            case CALLER_SUPPLIED_EXECUTOR -> ExecutorBackend.shared(((Threading.Custom) threading).executor());
            case SYNCHRONOUS_INLINE -> ExecutorBackend.inline();
            case COOPERATIVE_SINGLE_THREAD -> new CooperativeBackend(((Threading.Cooperative) threading).loop());
        };
    }

    private static ThreadFactory workerFactory(String workerName) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, workerName + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
