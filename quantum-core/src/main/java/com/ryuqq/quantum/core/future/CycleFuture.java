package com.ryuqq.quantum.core.future;

import com.ryuqq.quantum.core.statemachine.JobState;
import com.ryuqq.quantum.core.statemachine.JobTransition;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * 제출된 작업 하나의 완료 토큰.
 *
 * <p>{@code setStateFuture}/{@code withStateFuture} 호출 시 생성되며,
 * 엔진이 해당 작업을 실행하거나 버리기로 결정하면 종료 상태가 됩니다.</p>
 *
 * <p><strong>세 가지 결과:</strong></p>
 * <ul>
 *   <li>{@link JobState#COMPLETED}: 작업이 실행됨</li>
 *   <li>{@link JobState#DISCARDED}: quit() 또는 종료 후 제출로 실행되지 않음</li>
 *   <li>{@link JobState#FAILED}: 사용자 코드에서 예외 발생 ({@link #join()}이 {@link CycleFailedException}을 던짐)</li>
 * </ul>
 *
 * <p>Future는 호출자가 소유하며, 엔진은 상태 전이만 수행합니다.
 * 종료 상태로의 전이는 한 번만 일어납니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CycleFuture future = quantum.setStateFuture(state -&gt; state.next());
 * if (future.join() == JobState.COMPLETED) {
 *     // Reducer 적용 완료
 * }
 * </pre>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
public final class CycleFuture {

    private static final Result PENDING = new Result(JobState.PENDING, null);

    private final AtomicReference<Result> result = new AtomicReference<>(PENDING);
    private final CompletableFuture<JobState> done = new CompletableFuture<>();

    private CycleFuture() {
    }

    /**
     * 대기 상태(PENDING)의 Future 생성.
     *
     * @return 새 CycleFuture
     */
    public static CycleFuture pending() {
        return new CycleFuture();
    }

    /**
     * 이미 버려진(DISCARDED) Future 생성.
     *
     * <p>종료된 인스턴스에 제출된 작업에 사용됩니다.</p>
     *
     * @return DISCARDED 상태의 CycleFuture
     */
    public static CycleFuture discarded() {
        CycleFuture future = new CycleFuture();
        future.discard();
        return future;
    }

    /**
     * 실행 완료로 전이.
     *
     * @return 이번 호출로 전이된 경우 true, 이미 종료 상태였으면 false
     */
    public boolean complete() {
        return transition(JobState.COMPLETED, null);
    }

    /**
     * 버려짐으로 전이.
     *
     * @return 이번 호출로 전이된 경우 true, 이미 종료 상태였으면 false
     */
    public boolean discard() {
        return transition(JobState.DISCARDED, null);
    }

    /**
     * 실패로 전이.
     *
     * @param cause 사용자 코드에서 발생한 예외
     * @return 이번 호출로 전이된 경우 true, 이미 종료 상태였으면 false
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public boolean fail(Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        return transition(JobState.FAILED, cause);
    }

    private boolean transition(JobState next, Throwable cause) {
        Result current = result.get();
        if (!JobTransition.canTransition(current.state(), next)
            || !result.compareAndSet(current, new Result(next, cause))) {
            return false;
        }
        done.complete(next);
        return true;
    }

    /**
     * 현재 상태 조회 (비블로킹).
     *
     * @return 현재 상태
     */
    public JobState state() {
        return result.get().state();
    }

    /**
     * 종료 상태 여부.
     *
     * @return COMPLETED, DISCARDED, FAILED인 경우 true
     */
    public boolean isDone() {
        return result.get().state().isTerminal();
    }

    /**
     * 실패 원인 조회.
     *
     * @return FAILED인 경우 원인 예외, 그 외에는 null
     */
    public Throwable getFailureOrNull() {
        return result.get().cause();
    }

    /**
     * 종료 상태가 될 때까지 대기.
     *
     * @return COMPLETED 또는 DISCARDED
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     * @throws CycleFailedException 작업이 FAILED로 끝난 경우
     */
    public JobState join() throws InterruptedException {
        try {
            return unwrap(done.get());
        } catch (ExecutionException e) {
            // done은 항상 정상 완료되므로 도달하지 않음
            throw new IllegalStateException("CycleFuture completed exceptionally", e.getCause());
        }
    }

    /**
     * 주어진 시간 동안 종료 상태를 대기.
     *
     * @param timeout 최대 대기 시간
     * @return 종료 상태, 시간 초과 시 {@link JobState#PENDING}
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     * @throws CycleFailedException 작업이 FAILED로 끝난 경우
     * @throws IllegalArgumentException timeout이 null이거나 음수인 경우
     */
    public JobState join(Duration timeout) throws InterruptedException {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative (current: " + timeout + ")");
        }
        try {
            return unwrap(done.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            return JobState.PENDING;
        } catch (ExecutionException e) {
            throw new IllegalStateException("CycleFuture completed exceptionally", e.getCause());
        }
    }

    /**
     * 종료 시 콜백 등록.
     *
     * <p>이미 종료된 경우 호출 스레드에서 즉시 실행됩니다.
     * 그렇지 않으면 전이를 수행한 스레드(보통 엔진)에서 실행됩니다.</p>
     *
     * @param callback 종료 상태를 받는 콜백
     * @throws IllegalArgumentException callback이 null인 경우
     */
    public void whenDone(Consumer<JobState> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        done.thenAccept(callback);
    }

    /**
     * {@link CompletableFuture}로 변환.
     *
     * <p>FAILED인 경우 {@link CycleFailedException}으로 예외 완료됩니다.</p>
     *
     * @return 이 Future의 결과를 따르는 새 CompletableFuture
     */
    public CompletableFuture<JobState> toCompletableFuture() {
        return done.thenApply(this::unwrap);
    }

    private JobState unwrap(JobState terminal) {
        if (terminal == JobState.FAILED) {
            throw new CycleFailedException("Job failed while being applied", result.get().cause());
        }
        return terminal;
    }

    @Override
    public String toString() {
        return "CycleFuture{state=" + result.get().state() + "}";
    }

    private record Result(JobState state, Throwable cause) {
    }
}
