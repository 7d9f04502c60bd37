package com.ryuqq.quantum.adapter.runner.backend;

import com.ryuqq.quantum.adapter.inmemory.history.SynchronizedHistory;
import com.ryuqq.quantum.adapter.runner.engine.StateActor;
import com.ryuqq.quantum.core.future.CycleFailedException;
import com.ryuqq.quantum.core.future.CycleFuture;
import com.ryuqq.quantum.core.spi.StatePublisher;
import com.ryuqq.quantum.core.statemachine.JobState;
import com.ryuqq.quantum.core.statemachine.LifecycleState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

/**
 * DedicatedThreadBackend 테스트.
 *
 * <p>실제 {@link StateActor}를 전용 스레드에서 구동합니다.</p>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DedicatedThreadBackendTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @Mock
    private StatePublisher<Integer> publisher;

    private DedicatedThreadBackend backend;
    private StateActor<Integer> actor;

    @BeforeEach
    void setUp() {
        backend = new DedicatedThreadBackend("quantum-test-worker");
        actor = new StateActor<>("quantum-test-worker", 0, publisher, new SynchronizedHistory<>(), backend);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (backend.workerThread() == null) {
            return;
        }
        actor.requestStop(true);
        assertThat(backend.teardown().join(TIMEOUT)).isTrue();
    }

    @Test
    void 이름이_지정된_데몬_스레드에서_사이클_실행() throws Exception {
        actor.start();
        Thread worker = backend.workerThread();

        CycleFuture future = actor.submitReducer(state -> state + 1);

        assertThat(future.join(TIMEOUT)).isEqualTo(JobState.COMPLETED);
        assertThat(worker.getName()).isEqualTo("quantum-test-worker");
        assertThat(worker.isDaemon()).isTrue();
        verify(publisher, timeout(TIMEOUT.toMillis())).publish(1);
    }

    @Test
    void quit_후_스레드_종료() throws Exception {
        actor.start();
        Thread worker = backend.workerThread();

        actor.requestStop(true);

        assertThat(backend.teardown().join(TIMEOUT)).isTrue();
        worker.join(TIMEOUT.toMillis());
        assertThat(worker.isAlive()).isFalse();
        assertThat(actor.lifecycle()).isEqualTo(LifecycleState.STOPPED);
    }

    @Test
    void Reducer_예외_시_인스턴스_abort_및_남은_작업_DISCARDED() throws Exception {
        actor.start();
        CountDownLatch release = new CountDownLatch(1);
        CycleFuture failing = actor.submitReducer(state -> {
            awaitQuietly(release);
            throw new IllegalStateException("reducer failed");
        });
        CycleFuture queued = actor.submitReducer(state -> state + 1);

        release.countDown();

        actor.whenStopped().get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        assertThat(failing.state()).isEqualTo(JobState.FAILED);
        assertThatThrownBy(failing::join).isInstanceOf(CycleFailedException.class);
        assertThat(queued.join(TIMEOUT)).isEqualTo(JobState.DISCARDED);
        assertThat(actor.submitReducer(state -> state + 1).state()).isEqualTo(JobState.DISCARDED);
        assertThat(actor.state()).isZero();
    }

    @Test
    void 워커_인터럽트_시_인스턴스_abort() throws Exception {
        actor.start();

        backend.workerThread().interrupt();

        actor.whenStopped().get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        assertThat(actor.lifecycle()).isEqualTo(LifecycleState.STOPPED);
        assertThat(backend.teardown().join(TIMEOUT)).isTrue();
    }

    @Test
    void start_두번_호출_시_예외() {
        actor.start();

        assertThatThrownBy(() -> backend.start(actor))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already started");
    }

    @Test
    void 빈_스레드_이름_예외() {
        assertThatThrownBy(() -> new DedicatedThreadBackend(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 자원_소유() {
        assertThat(backend.ownsResources()).isTrue();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
