package com.ryuqq.quantum.adapter.runner.backend;

import com.ryuqq.quantum.application.backend.CycleTarget;
import com.ryuqq.quantum.application.backend.ExecutionBackend;
import com.ryuqq.quantum.core.threading.Joinable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Executor}에 step 작업을 하나씩 제출하는 백엔드.
 *
 * <p><strong>스케줄링 규칙:</strong></p>
 * <ul>
 *   <li>단일 permit({@code scheduled})을 획득한 경우에만 step 작업을 제출</li>
 *   <li>step 종료 후 permit을 반납하고, 남은 작업이 있으면 다시 제출</li>
 *   <li>멀티 스레드 풀에서도 두 step이 겹치지 않음</li>
 * </ul>
 *
 * <p><strong>모드:</strong></p>
 * <ul>
 *   <li>{@link #shared(Executor)}: 공유/호출자 제공 Executor, 종료 시 shutdown하지 않음</li>
 *   <li>{@link #owned(ExecutorService)}: 인스턴스 전용 풀, 종료 시 shutdown 후 종료 대기</li>
 *   <li>{@link #inline()}: 제출 스레드에서 직접 실행 (재귀 대신 루프)</li>
 * </ul>
 *
 * <p><strong>예외 처리:</strong></p>
 * <ul>
 *   <li>사용자 코드 예외는 step 작업 밖으로 전파되며, permit 반납과 재스케줄은 그대로 수행</li>
 *   <li>인라인 모드는 남은 작업(종료 처리 포함)을 모두 실행한 뒤 첫 예외를 제출자에게 전파</li>
 *   <li>Executor가 작업을 거부하면 엔진을 abort (대기 중인 Future는 DISCARDED)</li>
 * </ul>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
public final class ExecutorBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(ExecutorBackend.class);

    private final Executor executor;
    private final ExecutorService owned;
    private final boolean inline;
    private final AtomicBoolean scheduled = new AtomicBoolean(false);

    private volatile CycleTarget target;

    private ExecutorBackend(Executor executor, ExecutorService owned, boolean inline) {
        this.executor = executor;
        this.owned = owned;
        this.inline = inline;
    }

    /**
     * 공유 Executor 백엔드 생성 (종료 시 Executor를 건드리지 않음).
     *
     * @param executor 공유 또는 호출자 제공 Executor
     * @return 백엔드
     * @throws IllegalArgumentException executor가 null인 경우
     */
    public static ExecutorBackend shared(Executor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        return new ExecutorBackend(executor, null, false);
    }

    /**
     * 전용 풀 백엔드 생성 (종료 시 shutdown).
     *
     * @param executorService 인스턴스 전용 ExecutorService
     * @return 백엔드
     * @throws IllegalArgumentException executorService가 null인 경우
     */
    public static ExecutorBackend owned(ExecutorService executorService) {
        if (executorService == null) {
            throw new IllegalArgumentException("executorService cannot be null");
        }
        return new ExecutorBackend(executorService, executorService, false);
    }

    /**
     * 동기 인라인 백엔드 생성.
     *
     * <p>제출한 스레드가 사이클을 직접 실행합니다. 다른 스레드가 이미 실행 중이면
     * 그 스레드가 남은 작업까지 처리합니다.</p>
     *
     * @return 백엔드
     */
    public static ExecutorBackend inline() {
        return new ExecutorBackend(Runnable::run, null, true);
    }

    @Override
    public void start(CycleTarget target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (this.target != null) {
            throw new IllegalStateException("Backend already started: " + target.name());
        }
        this.target = target;
    }

    @Override
    public void wakeUp() {
        if (target == null) {
            throw new IllegalStateException("Backend not started");
        }
        schedule();
    }

    @Override
    public Joinable teardown() {
        if (owned == null) {
            return Joinable.completed();
        }
        try {
            owned.shutdown();
        } catch (RuntimeException e) {
            log.error("Failed to shut down owned executor of {}", target.name(), e);
            return Joinable.failed(e);
        }
        return new TerminationJoinable(owned);
    }

    @Override
    public boolean ownsResources() {
        return owned != null;
    }

    private void schedule() {
        if (!scheduled.compareAndSet(false, true)) {
            return;
        }
        if (inline) {
            driveInline();
            return;
        }
        try {
            executor.execute(this::drive);
        } catch (RejectedExecutionException e) {
            scheduled.set(false);
            target.abort(e);
        }
    }

    private void drive() {
        try {
            target.step();
        } finally {
            scheduled.set(false);
            if (target.needsStep()) {
                schedule();
            }
        }
    }

    private void driveInline() {
        RuntimeException failure = null;
        do {
            try {
                target.step();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else if (failure != e) {
                    failure.addSuppressed(e);
                }
            } finally {
                scheduled.set(false);
            }
        } while (target.needsStep() && scheduled.compareAndSet(false, true));
        if (failure != null) {
            throw failure;
        }
    }

    private static final class TerminationJoinable implements Joinable {

        private final ExecutorService executorService;

        private TerminationJoinable(ExecutorService executorService) {
            this.executorService = executorService;
        }

        @Override
        public void join() throws InterruptedException {
            while (!executorService.awaitTermination(1, TimeUnit.SECONDS)) {
                log.debug("Waiting for owned executor termination");
            }
        }

        @Override
        public boolean join(Duration timeout) throws InterruptedException {
            return executorService.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }
    }
}
