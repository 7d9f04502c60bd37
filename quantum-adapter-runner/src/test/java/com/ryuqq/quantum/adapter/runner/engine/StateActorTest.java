package com.ryuqq.quantum.adapter.runner.engine;

import com.ryuqq.quantum.adapter.inmemory.history.SynchronizedHistory;
import com.ryuqq.quantum.application.backend.ExecutionBackend;
import com.ryuqq.quantum.core.future.CycleFuture;
import com.ryuqq.quantum.core.spi.StatePublisher;
import com.ryuqq.quantum.core.statemachine.JobState;
import com.ryuqq.quantum.core.statemachine.LifecycleState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

/**
 * StateActor 유닛 테스트.
 *
 * <p>백엔드를 Mock으로 두고 {@code step()}을 직접 호출하여 사이클 단위로 검증합니다:</p>
 * <ul>
 *   <li>사이클: Reducer FIFO 적용, 변경 시에만 publish, Action은 Reducer 이후</li>
 *   <li>생명주기: quit / quitSafely / abort</li>
 *   <li>사용자 코드 예외: FAILED + 나머지 복원 + 예외 전파</li>
 * </ul>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class StateActorTest {

    @Mock
    private StatePublisher<Integer> publisher;

    @Mock
    private ExecutionBackend backend;

    private SynchronizedHistory<Integer> history;
    private StateActor<Integer> actor;

    @BeforeEach
    void setUp() {
        history = new SynchronizedHistory<>(true);
        actor = new StateActor<>("test-actor", 0, publisher, history, backend);
        actor.start();
        clearInvocations(publisher, backend);
    }

    // ========== 시작 ==========

    @Test
    void start_초기_상태_publish_후_백엔드_시작() {
        StateActor<Integer> fresh = new StateActor<>("fresh", 5, publisher, history, backend);

        fresh.start();

        InOrder order = inOrder(publisher, backend);
        order.verify(publisher).publish(5);
        order.verify(backend).start(fresh);
    }

    @Test
    void start_두번_호출_시_예외() {
        assertThatThrownBy(actor::start)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already started");
    }

    @Test
    void 생성자_null_의존성_예외() {
        assertThatThrownBy(() -> new StateActor<>("x", 0, null, history, backend))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("publisher");
        assertThatThrownBy(() -> new StateActor<>("x", 0, publisher, history, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("backend");
    }

    // ========== 사이클 ==========

    @Test
    void step_여러_Reducer_순서대로_적용_후_한번만_publish() {
        CycleFuture first = actor.submitReducer(state -> state + 1);
        CycleFuture second = actor.submitReducer(state -> state * 10);
        CycleFuture third = actor.submitReducer(state -> state + 2);

        actor.step();

        verify(publisher, times(1)).publish(anyInt());
        verify(publisher).publish(12);
        assertThat(actor.state()).isEqualTo(12);
        assertThat(history.read()).containsExactly(1, 10, 12);
        assertThat(List.of(first, second, third)).allSatisfy(f -> assertThat(f.state()).isEqualTo(JobState.COMPLETED));
        verify(backend, times(3)).wakeUp();
    }

    @Test
    void step_순_결과가_스냅샷과_같으면_publish_생략() {
        actor.submitReducer(state -> state + 1);
        actor.submitReducer(state -> state - 1);

        actor.step();

        verify(publisher, never()).publish(anyInt());
        assertThat(history.read()).containsExactly(1, 0);
    }

    @Test
    void step_빈_큐는_아무_것도_하지_않음() {
        actor.step();

        verifyNoMoreInteractions(publisher);
        assertThat(actor.lifecycle()).isEqualTo(LifecycleState.ACTIVE);
    }

    @Test
    void action_같은_사이클의_Reducer_이후_상태를_관찰하고_publish_후_완료() {
        AtomicReference<CycleFuture> actionFuture = new AtomicReference<>();
        List<Integer> observed = new ArrayList<>();
        List<JobState> stateAtPublish = new ArrayList<>();
        doAnswer(invocation -> {
            stateAtPublish.add(actionFuture.get().state());
            return null;
        }).when(publisher).publish(anyInt());

        actor.submitReducer(state -> state + 1);
        actionFuture.set(actor.submitAction(observed::add));
        actor.submitReducer(state -> state + 1);
        actor.step();

        assertThat(observed).containsExactly(2);
        assertThat(stateAtPublish).containsExactly(JobState.PENDING);
        assertThat(actionFuture.get().state()).isEqualTo(JobState.COMPLETED);
    }

    @Test
    void step_사이클_중_제출된_작업은_다음_사이클에서_처리() {
        AtomicReference<CycleFuture> late = new AtomicReference<>();
        actor.submitReducer(state -> {
            late.set(actor.submitReducer(inner -> inner + 100));
            return state + 1;
        });

        actor.step();
        assertThat(late.get().state()).isEqualTo(JobState.PENDING);
        assertThat(actor.needsStep()).isTrue();

        actor.step();
        assertThat(late.get().state()).isEqualTo(JobState.COMPLETED);
        assertThat(actor.state()).isEqualTo(101);
    }

    @Test
    void step_동시_진입_시_IllegalStateException() {
        AtomicReference<Throwable> nested = new AtomicReference<>();
        actor.submitReducer(state -> {
            try {
                actor.step();
            } catch (IllegalStateException e) {
                nested.set(e);
            }
            return state + 1;
        });

        actor.step();

        assertThat(nested.get())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Concurrent step");
        assertThat(actor.state()).isEqualTo(1);
    }

    // ========== 사용자 코드 예외 ==========

    @Test
    void reducer_예외_시_FAILED_나머지_복원_변경분_publish_후_전파() {
        IllegalStateException failure = new IllegalStateException("bad reducer");
        CycleFuture applied = actor.submitReducer(state -> state + 1);
        CycleFuture failing = actor.submitReducer(state -> {
            throw failure;
        });
        CycleFuture remaining = actor.submitReducer(state -> state + 10);
        CycleFuture action = actor.submitAction(state -> { });

        assertThatThrownBy(actor::step).isSameAs(failure);

        assertThat(applied.state()).isEqualTo(JobState.COMPLETED);
        assertThat(failing.state()).isEqualTo(JobState.FAILED);
        assertThat(failing.getFailureOrNull()).isSameAs(failure);
        assertThat(remaining.state()).isEqualTo(JobState.PENDING);
        assertThat(action.state()).isEqualTo(JobState.PENDING);
        verify(publisher).publish(1);

        actor.step();

        assertThat(remaining.state()).isEqualTo(JobState.COMPLETED);
        assertThat(action.state()).isEqualTo(JobState.COMPLETED);
        assertThat(actor.state()).isEqualTo(11);
    }

    @Test
    void action_예외_시_앞선_Action_완료_뒤_Action_복원() {
        CycleFuture before = actor.submitAction(state -> { });
        CycleFuture failing = actor.submitAction(state -> {
            throw new IllegalArgumentException("bad action");
        });
        CycleFuture after = actor.submitAction(state -> { });

        assertThatThrownBy(actor::step).isInstanceOf(IllegalArgumentException.class);

        assertThat(before.state()).isEqualTo(JobState.COMPLETED);
        assertThat(failing.state()).isEqualTo(JobState.FAILED);
        assertThat(after.state()).isEqualTo(JobState.PENDING);

        actor.step();
        assertThat(after.state()).isEqualTo(JobState.COMPLETED);
    }

    // ========== 생명주기 ==========

    @Test
    void quit_대기_작업_DISCARDED_후_STOPPED() throws Exception {
        CycleFuture pending = actor.submitReducer(state -> state + 1);
        CycleFuture pendingAction = actor.submitAction(state -> { });

        assertThat(actor.requestStop(true)).isTrue();
        assertThat(actor.needsStep()).isTrue();
        actor.step();

        assertThat(pending.state()).isEqualTo(JobState.DISCARDED);
        assertThat(pendingAction.state()).isEqualTo(JobState.DISCARDED);
        assertThat(actor.lifecycle()).isEqualTo(LifecycleState.STOPPED);
        assertThat(actor.whenStopped()).isDone();
        assertThat(actor.needsStep()).isFalse();
        verify(publisher, never()).publish(anyInt());
    }

    @Test
    void quit_사이클_도중_요청_시_실행_중인_Reducer만_완료() {
        CycleFuture first = actor.submitReducer(state -> {
            actor.requestStop(true);
            return state + 1;
        });
        CycleFuture second = actor.submitReducer(state -> state + 1);
        CycleFuture action = actor.submitAction(state -> { });

        actor.step();

        assertThat(first.state()).isEqualTo(JobState.COMPLETED);
        assertThat(second.state()).isEqualTo(JobState.DISCARDED);
        assertThat(action.state()).isEqualTo(JobState.DISCARDED);
        verify(publisher).publish(1);
        assertThat(actor.isStopped()).isTrue();
    }

    @Test
    void quitSafely_마지막_사이클_실행_후_STOPPED() {
        CycleFuture queued = actor.submitReducer(state -> state + 3);

        actor.requestStop(false);
        CycleFuture rejected = actor.submitReducer(state -> state + 100);
        actor.step();

        assertThat(queued.state()).isEqualTo(JobState.COMPLETED);
        assertThat(rejected.state()).isEqualTo(JobState.DISCARDED);
        assertThat(actor.state()).isEqualTo(3);
        assertThat(actor.lifecycle()).isEqualTo(LifecycleState.STOPPED);
        verify(publisher).publish(3);
    }

    @Test
    void quitSafely_사이클_도중_요청_시_다음_step이_마지막_사이클() {
        AtomicReference<CycleFuture> queuedDuringCycle = new AtomicReference<>();
        actor.submitReducer(state -> {
            queuedDuringCycle.set(actor.submitReducer(inner -> inner + 1));
            actor.requestStop(false);
            return state + 1;
        });

        actor.step();
        assertThat(actor.lifecycle()).isEqualTo(LifecycleState.DRAINING);
        assertThat(actor.needsStep()).isTrue();

        actor.step();
        assertThat(queuedDuringCycle.get().state()).isEqualTo(JobState.COMPLETED);
        assertThat(actor.lifecycle()).isEqualTo(LifecycleState.STOPPED);
    }

    @Test
    void requestStop_멱등_및_quitSafely_후_quit_승격() {
        assertThat(actor.requestStop(false)).isTrue();
        assertThat(actor.requestStop(false)).isFalse();
        assertThat(actor.requestStop(true)).isTrue();
        assertThat(actor.requestStop(false)).isFalse();
        assertThat(actor.lifecycle()).isEqualTo(LifecycleState.FORCE_STOPPING);
        verify(backend, times(2)).wakeUp();
    }

    @Test
    void 종료_후_제출_즉시_DISCARDED_백엔드_깨우지_않음() {
        actor.requestStop(true);
        actor.step();
        clearInvocations(backend);

        CycleFuture reducer = actor.submitReducer(state -> state + 1);
        CycleFuture action = actor.submitAction(state -> { });

        assertThat(reducer.state()).isEqualTo(JobState.DISCARDED);
        assertThat(action.state()).isEqualTo(JobState.DISCARDED);
        verify(backend, never()).wakeUp();
    }

    @Test
    void abort_대기_작업_DISCARDED_후_즉시_STOPPED() {
        CycleFuture pending = actor.submitReducer(state -> state + 1);
        clearInvocations(backend);

        actor.abort(new IllegalStateException("executor gone"));

        assertThat(pending.state()).isEqualTo(JobState.DISCARDED);
        assertThat(actor.isStopped()).isTrue();
        verify(backend, never()).wakeUp();
    }

    @Test
    void null_제출_예외() {
        assertThatThrownBy(() -> actor.submitReducer(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> actor.submitAction(null)).isInstanceOf(IllegalArgumentException.class);
    }

    // ========== awaitWork ==========

    @Test
    void awaitWork_대기_중_Action_제출_시_깨어남() throws Exception {
        CountDownLatch woke = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                actor.awaitWork();
                woke.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();

        assertThat(woke.await(100, TimeUnit.MILLISECONDS)).isFalse();
        actor.submitAction(state -> { });

        assertThat(woke.await(5, TimeUnit.SECONDS)).isTrue();
        waiter.join(5_000);
    }

    @Test
    void awaitWork_종료_요청_시_깨어남() throws Exception {
        CountDownLatch woke = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                actor.awaitWork();
                woke.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();

        actor.requestStop(false);

        assertThat(woke.await(5, TimeUnit.SECONDS)).isTrue();
        waiter.join(5_000);
    }
}
