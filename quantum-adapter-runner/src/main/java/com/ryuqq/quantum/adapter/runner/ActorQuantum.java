package com.ryuqq.quantum.adapter.runner;

import com.ryuqq.quantum.adapter.inmemory.history.SynchronizedHistory;
import com.ryuqq.quantum.adapter.inmemory.subject.ExecutorStateSubject;
import com.ryuqq.quantum.adapter.runner.engine.StateActor;
import com.ryuqq.quantum.application.backend.ExecutionBackend;
import com.ryuqq.quantum.application.config.QuantumConfig;
import com.ryuqq.quantum.application.quantum.Quantum;
import com.ryuqq.quantum.core.contract.Action;
import com.ryuqq.quantum.core.contract.Reducer;
import com.ryuqq.quantum.core.contract.StateListener;
import com.ryuqq.quantum.core.future.CycleFuture;
import com.ryuqq.quantum.core.spi.History;
import com.ryuqq.quantum.core.statemachine.LifecycleState;
import com.ryuqq.quantum.core.threading.Joinable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link StateActor} 기반 {@link Quantum} 구현체.
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>{@link StateActor}: 큐, 사이클, 생명주기</li>
 *   <li>{@link ExecutionBackend}: 사이클 실행 위치 (설정의 threading으로 결정)</li>
 *   <li>{@link ExecutorStateSubject}: callbackExecutor에서 리스너 호출</li>
 *   <li>{@link SynchronizedHistory}: Reducer 결과 기록</li>
 * </ul>
 *
 * <p><strong>종료 흐름:</strong></p>
 * <pre>
 * quit() / quitSafely()
 *   ↓
 * actor.requestStop(force) → backend.wakeUp()
 *   ↓ (엔진 컨텍스트에서)
 * STOPPED → backend.teardown() → quitted 리스너 실행
 *   ↓
 * 반환된 Joinable: STOPPED 이후 백엔드 자원 해제까지 대기
 * </pre>
 *
 * <p>인스턴스는 {@link Quantums}를 통해 생성합니다.</p>
 *
 * @param <T> 상태 타입
 * @author Quantum Team
 * @since 1.0.0
 */
public final class ActorQuantum<T> implements Quantum<T> {

    private static final Logger log = LoggerFactory.getLogger(ActorQuantum.class);

    private final QuantumConfig config;
    private final ExecutorStateSubject<T> subject;
    private final SynchronizedHistory<T> history;
    private final StateActor<T> actor;
    private final CompletableFuture<Joinable> teardown;
    private final List<Runnable> quittedListeners = new ArrayList<>();
    private boolean quittedFired;

    ActorQuantum(T initial, QuantumConfig config, ExecutionBackend backend) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }

        this.config = config;
        this.subject = new ExecutorStateSubject<>(config.callbackExecutor());
        this.history = new SynchronizedHistory<>(config.historyEnabled());
        this.actor = new StateActor<>(config.workerName(), initial, subject, history, backend);
        this.teardown = actor.whenStopped().thenApply(ignored -> {
            Joinable released = backend.teardown();
            fireQuitted();
            return released;
        });
    }

    /**
     * 초기 상태 publish 후 엔진 시작.
     */
    void start() {
        actor.start();
    }

    @Override
    public CycleFuture setStateFuture(Reducer<T> reducer) {
        return actor.submitReducer(reducer);
    }

    @Override
    public CycleFuture withStateFuture(Action<T> action) {
        return actor.submitAction(action);
    }

    @Override
    public void addListener(StateListener<T> listener) {
        subject.addListener(listener);
    }

    @Override
    public void removeListener(StateListener<T> listener) {
        subject.removeListener(listener);
    }

    @Override
    public Joinable quit() {
        actor.requestStop(true);
        return new QuitHandle();
    }

    @Override
    public Joinable quitSafely() {
        actor.requestStop(false);
        return new QuitHandle();
    }

    @Override
    public History<T> history() {
        return history;
    }

    @Override
    public QuantumConfig config() {
        return config;
    }

    @Override
    public LifecycleState lifecycle() {
        return actor.lifecycle();
    }

    /**
     * {@inheritDoc}
     *
     * <p>종료 전에 등록된 리스너는 엔진 컨텍스트에서 백엔드 해제 시작 직후 실행되며,
     * quit 핸들은 리스너 실행이 끝난 뒤 준비됩니다.</p>
     */
    @Override
    public void addQuittedListener(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        synchronized (quittedListeners) {
            if (!quittedFired) {
                quittedListeners.add(listener);
                return;
            }
        }
        runQuittedListener(listener);
    }

    @Override
    public String toString() {
        return "ActorQuantum[" + actor.name() + ", " + actor.lifecycle() + "]";
    }

    private void fireQuitted() {
        List<Runnable> listeners;
        synchronized (quittedListeners) {
            quittedFired = true;
            listeners = new ArrayList<>(quittedListeners);
            quittedListeners.clear();
        }
        listeners.forEach(this::runQuittedListener);
    }

    private void runQuittedListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Quitted listener of {} failed", actor.name(), e);
        }
    }

    /**
     * STOPPED 도달 후 백엔드 자원 해제까지 기다리는 핸들.
     */
    private final class QuitHandle implements Joinable {

        @Override
        public void join() throws InterruptedException {
            Joinable.of(teardown).join();
            teardown.join().join();
        }

        @Override
        public boolean join(Duration timeout) throws InterruptedException {
            if (timeout == null) {
                throw new IllegalArgumentException("timeout cannot be null");
            }
            long deadline = System.nanoTime() + timeout.toNanos();
            if (!Joinable.of(teardown).join(timeout)) {
                return false;
            }
            long remaining = Math.max(0L, deadline - System.nanoTime());
            return teardown.join().join(Duration.ofNanos(remaining));
        }
    }
}
