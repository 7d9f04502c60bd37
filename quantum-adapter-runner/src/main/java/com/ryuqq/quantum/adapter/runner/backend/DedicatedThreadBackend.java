package com.ryuqq.quantum.adapter.runner.backend;

import com.ryuqq.quantum.application.backend.CycleTarget;
import com.ryuqq.quantum.application.backend.ExecutionBackend;
import com.ryuqq.quantum.core.threading.Joinable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 전용 스레드 하나에서 엔진을 구동하는 백엔드.
 *
 * <p><strong>실행 루프:</strong></p>
 * <pre>
 * while (!stopped) {
 *     step()
 *     if (!stopped) awaitWork()   // 큐가 비어 있고 종료 요청이 없는 동안 대기
 * }
 * </pre>
 *
 * <p>깨우기는 엔진의 Condition signal로 이루어지므로 {@link #wakeUp()}은 아무 것도 하지 않습니다.</p>
 *
 * <p><strong>예외 처리:</strong> 사용자 코드 예외나 인터럽트로 루프가 끝나면 엔진을
 * {@link CycleTarget#abort(Throwable)}로 종료시켜 대기 중인 Future가 남지 않도록 합니다.
 * 사용자 코드 예외는 이후 스레드의 UncaughtExceptionHandler로 전파됩니다.</p>
 *
 * <p>스레드는 인스턴스 소유이며, 종료 핸들은 스레드가 끝나면 준비됩니다.</p>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
public final class DedicatedThreadBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(DedicatedThreadBackend.class);

    private final String threadName;
    private final AtomicReference<Thread> worker = new AtomicReference<>();
    private final CompletableFuture<Void> exited = new CompletableFuture<>();

    /**
     * 생성자.
     *
     * @param threadName 워커 스레드 이름
     * @throws IllegalArgumentException threadName이 null이거나 비어 있는 경우
     */
    public DedicatedThreadBackend(String threadName) {
        if (threadName == null || threadName.isBlank()) {
            throw new IllegalArgumentException("threadName cannot be null or blank");
        }
        this.threadName = threadName;
    }

    @Override
    public void start(CycleTarget target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        Thread thread = new Thread(() -> runLoop(target), threadName);
        thread.setDaemon(true);
        if (!worker.compareAndSet(null, thread)) {
            throw new IllegalStateException("Backend already started: " + threadName);
        }
        thread.start();
    }

    @Override
    public void wakeUp() {
        // awaitWork() is woken by the engine's condition
    }

    @Override
    public Joinable teardown() {
        return Joinable.of(exited);
    }

    @Override
    public boolean ownsResources() {
        return true;
    }

    /**
     * 워커 스레드 (시작 전이면 null).
     *
     * @return 워커 스레드
     */
    Thread workerThread() {
        return worker.get();
    }

    private void runLoop(CycleTarget target) {
        log.debug("Worker thread {} started", threadName);
        try {
            while (!target.isStopped()) {
                target.step();
                if (!target.isStopped()) {
                    target.awaitWork();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            target.abort(e);
        } catch (RuntimeException | Error e) {
            target.abort(e);
            throw e;
        } finally {
            exited.complete(null);
            log.debug("Worker thread {} exited", threadName);
        }
    }
}
