package com.ryuqq.quantum.adapter.runner.engine;

import com.ryuqq.quantum.application.backend.CycleTarget;
import com.ryuqq.quantum.application.backend.ExecutionBackend;
import com.ryuqq.quantum.core.contract.Action;
import com.ryuqq.quantum.core.contract.Reducer;
import com.ryuqq.quantum.core.future.CycleFuture;
import com.ryuqq.quantum.core.spi.MutableHistory;
import com.ryuqq.quantum.core.spi.StatePublisher;
import com.ryuqq.quantum.core.statemachine.LifecycleState;
import com.ryuqq.quantum.core.statemachine.LifecycleTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 단일 작성자 상태 엔진.
 *
 * <p>제출된 Reducer/Action을 큐에 쌓고, {@link ExecutionBackend}가 호출하는 {@link #step()}에서
 * 직렬로 적용합니다. 상태는 엔진의 직렬 컨텍스트에서만 변경됩니다.</p>
 *
 * <p><strong>사이클 처리 흐름:</strong></p>
 * <pre>
 * runCycle()
 *   ↓
 * 1. snapshot = state
 * 2. lock 안에서 Reducer 큐와 Action 큐를 한 번에 분리 (Batch)
 * 3. For each Reducer (FIFO):
 *      FORCE_STOPPING이면 나머지 버림
 *      state = reducer.reduce(state) → history.push(state) → future.complete()
 * 4. For each Action (FIFO):
 *      FORCE_STOPPING이면 나머지 버림
 *      action.perform(state)
 * 5. state != snapshot이면 publish(state)
 * 6. 실행된 Action의 future.complete()
 * </pre>
 *
 * <p><strong>생명주기 처리:</strong></p>
 * <ul>
 *   <li>ACTIVE: 사이클 실행</li>
 *   <li>DRAINING: 마지막 사이클 한 번 실행 후 STOPPED</li>
 *   <li>FORCE_STOPPING: 진행 중인 작업만 마치고 나머지는 DISCARDED 처리 후 STOPPED</li>
 *   <li>STOPPED: 아무 것도 하지 않음</li>
 * </ul>
 *
 * <p><strong>사용자 코드 예외:</strong></p>
 * <ul>
 *   <li>해당 작업의 Future는 FAILED</li>
 *   <li>실행되지 못한 나머지 작업은 큐 앞쪽으로 복원 (다음 사이클에서 유효)</li>
 *   <li>이미 적용된 Reducer로 상태가 바뀌었으면 publish</li>
 *   <li>예외는 삼키지 않고 {@link #step()} 호출자(백엔드 컨텍스트)로 전파</li>
 * </ul>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>큐와 생명주기 전이는 하나의 {@link ReentrantLock}으로 보호 (enqueue 시간만큼만 보유)</li>
 *   <li>사용자 코드는 lock 밖에서 실행</li>
 *   <li>{@link #step()} 동시 진입은 {@link IllegalStateException}으로 거부</li>
 * </ul>
 *
 * @param <T> 상태 타입
 * @author Quantum Team
 * @since 1.0.0
 */
public final class StateActor<T> implements CycleTarget {

    private static final Logger log = LoggerFactory.getLogger(StateActor.class);

    private final String name;
    private final StatePublisher<T> publisher;
    private final MutableHistory<T> history;
    private final ExecutionBackend backend;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition workArrived = lock.newCondition();
    private final JobQueue<T> queue = new JobQueue<>();
    private final AtomicReference<LifecycleState> lifecycle = new AtomicReference<>(LifecycleState.ACTIVE);
    private final AtomicInteger activeSteps = new AtomicInteger();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CompletableFuture<Void> stopped = new CompletableFuture<>();

    private volatile T state;

    /**
     * 생성자.
     *
     * @param name 엔진 이름 (로그용)
     * @param initial 초기 상태
     * @param publisher 상태 publish 대상
     * @param history Reducer 결과 기록
     * @param backend 실행 백엔드
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StateActor(String name, T initial, StatePublisher<T> publisher,
                      MutableHistory<T> history, ExecutionBackend backend) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        if (history == null) {
            throw new IllegalArgumentException("history cannot be null");
        }
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }

        this.name = name;
        this.state = initial;
        this.publisher = publisher;
        this.history = history;
        this.backend = backend;
    }

    /**
     * 초기 상태를 publish한 후 백엔드 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("StateActor already started: " + name);
        }
        publisher.publish(state);
        backend.start(this);
        log.debug("StateActor {} started", name);
    }

    /**
     * Reducer 제출.
     *
     * @param reducer 상태 변환 함수
     * @return Reducer Future (ACTIVE가 아니면 즉시 DISCARDED)
     * @throws IllegalArgumentException reducer가 null인 경우
     */
    public CycleFuture submitReducer(Reducer<T> reducer) {
        if (reducer == null) {
            throw new IllegalArgumentException("reducer cannot be null");
        }
        CycleFuture future = CycleFuture.pending();
        lock.lock();
        try {
            if (!lifecycle.get().isAcceptingSubmissions()) {
                return reject("reducer", future);
            }
            queue.addReducer(new ReducerJob<>(reducer, future));
            workArrived.signalAll();
        } finally {
            lock.unlock();
        }
        backend.wakeUp();
        return future;
    }

    /**
     * Action 제출.
     *
     * @param action 상태 조회 콜백
     * @return Action Future (ACTIVE가 아니면 즉시 DISCARDED)
     * @throws IllegalArgumentException action이 null인 경우
     */
    public CycleFuture submitAction(Action<T> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        CycleFuture future = CycleFuture.pending();
        lock.lock();
        try {
            if (!lifecycle.get().isAcceptingSubmissions()) {
                return reject("action", future);
            }
            queue.addAction(new ActionJob<>(action, future));
            workArrived.signalAll();
        } finally {
            lock.unlock();
        }
        backend.wakeUp();
        return future;
    }

    /**
     * 종료 요청 (멱등).
     *
     * <p>force=true는 quit(), force=false는 quitSafely()에 해당합니다.
     * DRAINING 중의 강제 종료 요청은 FORCE_STOPPING으로 승격되며, 그 반대는 무시됩니다.</p>
     *
     * @param force 강제 종료 여부
     * @return 이번 호출로 상태가 바뀌었으면 true
     */
    public boolean requestStop(boolean force) {
        LifecycleState next = force ? LifecycleState.FORCE_STOPPING : LifecycleState.DRAINING;
        LifecycleState previous;
        lock.lock();
        try {
            previous = lifecycle.get();
            if (!LifecycleTransition.canTransition(previous, next)) {
                return false;
            }
            lifecycle.set(next);
            workArrived.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("StateActor {} stop requested: {} → {}", name, previous, next);
        backend.wakeUp();
        return true;
    }

    @Override
    public void step() {
        if (activeSteps.incrementAndGet() != 1) {
            activeSteps.decrementAndGet();
            throw new IllegalStateException("Concurrent step rejected: " + name);
        }
        try {
            LifecycleState current = lifecycle.get();
            if (current == LifecycleState.STOPPED) {
                return;
            }
            if (current == LifecycleState.FORCE_STOPPING) {
                terminate();
                return;
            }
            runCycle();
            if (current == LifecycleState.DRAINING || lifecycle.get() == LifecycleState.FORCE_STOPPING) {
                terminate();
            }
        } finally {
            activeSteps.decrementAndGet();
        }
    }

    @Override
    public boolean needsStep() {
        lock.lock();
        try {
            LifecycleState current = lifecycle.get();
            if (current == LifecycleState.STOPPED) {
                return false;
            }
            return !queue.isEmpty() || current.isStopRequested();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isStopped() {
        return lifecycle.get() == LifecycleState.STOPPED;
    }

    @Override
    public void awaitWork() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty() && lifecycle.get() == LifecycleState.ACTIVE) {
                workArrived.await();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void abort(Throwable cause) {
        log.error("StateActor {} lost its execution context, stopping", name, cause);
        lock.lock();
        try {
            LifecycleState current = lifecycle.get();
            if (LifecycleTransition.canTransition(current, LifecycleState.FORCE_STOPPING)) {
                lifecycle.set(LifecycleState.FORCE_STOPPING);
            }
        } finally {
            lock.unlock();
        }
        terminate();
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * 현재 생명주기 상태.
     *
     * @return 생명주기 상태
     */
    public LifecycleState lifecycle() {
        return lifecycle.get();
    }

    /**
     * STOPPED 도달 시 완료되는 Future (호출마다 새 복사본).
     *
     * @return 종료 Future
     */
    public CompletableFuture<Void> whenStopped() {
        return stopped.copy();
    }

    /**
     * 엔진이 마지막으로 적용한 상태.
     *
     * @return 현재 상태
     */
    public T state() {
        return state;
    }

    private CycleFuture reject(String kind, CycleFuture future) {
        future.discard();
        log.debug("StateActor {} rejected {} submission in {}", name, kind, lifecycle.get());
        return future;
    }

    private void runCycle() {
        Batch<T> batch = detach();
        if (batch.isEmpty()) {
            return;
        }
        log.debug("StateActor {} cycle: {} reducers, {} actions", name,
            batch.reducers().size(), batch.actions().size());

        T snapshot = state;
        List<ReducerJob<T>> reducers = batch.reducers();
        List<ActionJob<T>> actions = batch.actions();
        int reducerIndex = 0;
        int actionIndex = 0;

        try {
            for (; reducerIndex < reducers.size(); reducerIndex++) {
                if (isForceStopping()) {
                    discard(reducers.subList(reducerIndex, reducers.size()), actions);
                    publishIfChanged(snapshot);
                    return;
                }
                ReducerJob<T> job = reducers.get(reducerIndex);
                T next = job.reducer().reduce(state);
                state = next;
                history.push(next);
                job.future().complete();
            }

            for (; actionIndex < actions.size(); actionIndex++) {
                if (isForceStopping()) {
                    discard(List.of(), actions.subList(actionIndex, actions.size()));
                    break;
                }
                actions.get(actionIndex).action().perform(state);
            }

            publishIfChanged(snapshot);
            completeActions(actions.subList(0, actionIndex));
        } catch (RuntimeException | Error e) {
            if (reducerIndex < reducers.size()) {
                reducers.get(reducerIndex).future().fail(e);
                restore(reducers.subList(reducerIndex + 1, reducers.size()), actions);
                publishIfChanged(snapshot);
                log.error("StateActor {} reducer failed, {} jobs requeued", name,
                    reducers.size() - reducerIndex - 1 + actions.size(), e);
            } else {
                actions.get(actionIndex).future().fail(e);
                restore(List.of(), actions.subList(actionIndex + 1, actions.size()));
                publishIfChanged(snapshot);
                completeActions(actions.subList(0, actionIndex));
                log.error("StateActor {} action failed, {} actions requeued", name,
                    actions.size() - actionIndex - 1, e);
            }
            throw e;
        }
    }

    private Batch<T> detach() {
        lock.lock();
        try {
            return queue.detach();
        } finally {
            lock.unlock();
        }
    }

    private boolean isForceStopping() {
        return lifecycle.get() == LifecycleState.FORCE_STOPPING;
    }

    private void publishIfChanged(T snapshot) {
        T current = state;
        if (Objects.equals(snapshot, current)) {
            log.debug("StateActor {} cycle left state unchanged, publish suppressed", name);
            return;
        }
        publisher.publish(current);
    }

    private void completeActions(List<ActionJob<T>> executed) {
        executed.forEach(job -> job.future().complete());
    }

    private void discard(List<ReducerJob<T>> reducers, List<ActionJob<T>> actions) {
        reducers.forEach(job -> job.future().discard());
        actions.forEach(job -> job.future().discard());
    }

    private void restore(List<ReducerJob<T>> reducers, List<ActionJob<T>> actions) {
        lock.lock();
        try {
            if (lifecycle.get() != LifecycleState.STOPPED) {
                queue.requeueFirst(reducers, actions);
                return;
            }
        } finally {
            lock.unlock();
        }
        discard(reducers, actions);
    }

    private void terminate() {
        List<CycleFuture> leftovers;
        LifecycleState previous;
        lock.lock();
        try {
            previous = lifecycle.get();
            if (previous == LifecycleState.STOPPED) {
                return;
            }
            lifecycle.set(LifecycleTransition.transition(previous, LifecycleState.STOPPED));
            leftovers = queue.drainFutures();
            workArrived.signalAll();
        } finally {
            lock.unlock();
        }
        leftovers.forEach(CycleFuture::discard);
        log.info("StateActor {} stopped from {}, {} queued jobs discarded", name, previous, leftovers.size());
        stopped.complete(null);
    }
}
