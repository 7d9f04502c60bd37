package com.ryuqq.quantum.application.config;

import com.ryuqq.quantum.core.threading.Threading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * 프로세스 전역 기본 설정.
 *
 * <p>인스턴스 생성 시점에 한 번 읽히며, 이미 생성된 인스턴스에는 영향을 주지 않습니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>threading: {@link Threading#pool()} (공유 풀)</li>
 *   <li>pool: 데몬 스레드 cached pool ("quantum-pool-N")</li>
 *   <li>callbackExecutor: 데몬 단일 스레드 ("quantum-callback")</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * QuantumDefaults.configure(settings -&gt; settings.withThreading(Threading.dedicatedThread()));
 * </pre>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
public final class QuantumDefaults {

    private static final Logger log = LoggerFactory.getLogger(QuantumDefaults.class);

    private static final ExecutorService SHARED_POOL =
        Executors.newCachedThreadPool(daemonFactory("quantum-pool-"));

    private static final ExecutorService SHARED_CALLBACK =
        Executors.newSingleThreadExecutor(daemonFactory("quantum-callback-"));

    private static final Settings INITIAL = new Settings(Threading.pool(), SHARED_POOL, SHARED_CALLBACK);

    private static final AtomicReference<Settings> SETTINGS = new AtomicReference<>(INITIAL);

    // Utility class - prevent instantiation
    private QuantumDefaults() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 현재 기본 설정 조회.
     *
     * @return 기본 설정
     */
    public static Settings settings() {
        return SETTINGS.get();
    }

    /**
     * 기본 설정 변경 (원자적).
     *
     * @param update 현재 설정을 받아 새 설정을 반환하는 함수
     * @return 변경된 설정
     * @throws IllegalArgumentException update가 null이거나 null을 반환한 경우
     */
    public static Settings configure(UnaryOperator<Settings> update) {
        if (update == null) {
            throw new IllegalArgumentException("update cannot be null");
        }
        Settings updated = SETTINGS.updateAndGet(current -> {
            Settings next = update.apply(current);
            if (next == null) {
                throw new IllegalArgumentException("update cannot return null");
            }
            return next;
        });
        log.info("Quantum defaults configured: threading={}", updated.threading().kind());
        return updated;
    }

    /**
     * 최초 기본 설정으로 되돌림.
     */
    public static void reset() {
        SETTINGS.set(INITIAL);
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * 기본 설정 값 (불변 record).
     *
     * @param threading 기본 실행 방식
     * @param pool {@link Threading.Pool}이 사용하는 공유 Executor (인스턴스가 종료하지 않음)
     * @param callbackExecutor 기본 리스너 호출 Executor
     */
    public record Settings(Threading threading, Executor pool, Executor callbackExecutor) {

        public Settings {
            if (threading == null) {
                throw new IllegalArgumentException("threading cannot be null");
            }
            if (pool == null) {
                throw new IllegalArgumentException("pool cannot be null");
            }
            if (callbackExecutor == null) {
                throw new IllegalArgumentException("callbackExecutor cannot be null");
            }
        }

        public Settings withThreading(Threading threading) {
            return new Settings(threading, pool, callbackExecutor);
        }

        public Settings withPool(Executor pool) {
            return new Settings(threading, pool, callbackExecutor);
        }

        public Settings withCallbackExecutor(Executor callbackExecutor) {
            return new Settings(threading, pool, callbackExecutor);
        }
    }
}
