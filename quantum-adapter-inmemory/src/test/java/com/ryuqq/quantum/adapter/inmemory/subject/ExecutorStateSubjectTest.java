package com.ryuqq.quantum.adapter.inmemory.subject;

import com.ryuqq.quantum.core.contract.StateListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;

/**
 * ExecutorStateSubject tests.
 *
 * <p>Delivery order, replay of the latest state, listener isolation, and rejection handling.</p>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ExecutorStateSubjectTest {

    @Mock
    private StateListener<Integer> failingListener;

    private ExecutorService callbackExecutor;

    @BeforeEach
    void setUp() {
        callbackExecutor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        callbackExecutor.shutdownNow();
    }

    @Test
    void testPublish_OnPoolExecutor_PreservesOrder() throws Exception {
        // given
        ExecutorStateSubject<Integer> subject = new ExecutorStateSubject<>(callbackExecutor);
        List<Integer> received = new CopyOnWriteArrayList<>();
        subject.addListener(received::add);

        // when
        for (int i = 0; i < 1_000; i++) {
            subject.publish(i);
        }
        flush();

        // then
        assertThat(received).hasSize(1_000);
        assertThat(received).isSorted();
    }

    @Test
    void testAddListener_ReplaysLatestStateOnly() throws Exception {
        // given
        ExecutorStateSubject<Integer> subject = new ExecutorStateSubject<>(Runnable::run);
        subject.publish(1);
        subject.publish(2);
        List<Integer> received = new CopyOnWriteArrayList<>();

        // when
        subject.addListener(received::add);
        subject.publish(3);

        // then
        assertThat(received).containsExactly(2, 3);
    }

    @Test
    void testAddListener_BeforeAnyPublish_ReceivesNothingUntilPublish() {
        // given
        ExecutorStateSubject<Integer> subject = new ExecutorStateSubject<>(Runnable::run);
        List<Integer> received = new CopyOnWriteArrayList<>();

        // when
        subject.addListener(received::add);

        // then
        assertThat(received).isEmpty();
        subject.publish(7);
        assertThat(received).containsExactly(7);
    }

    @Test
    void testRemoveListener_StopsFurtherDeliveries() {
        // given
        ExecutorStateSubject<Integer> subject = new ExecutorStateSubject<>(Runnable::run);
        List<Integer> received = new CopyOnWriteArrayList<>();
        StateListener<Integer> listener = received::add;
        subject.addListener(listener);
        subject.publish(1);

        // when
        subject.removeListener(listener);
        subject.publish(2);

        // then
        assertThat(received).containsExactly(1);
        assertThat(subject.listenerCount()).isZero();
    }

    @Test
    void testListenerFailure_DoesNotAffectOtherListenersOrLaterStates() throws Exception {
        // given
        ExecutorStateSubject<Integer> subject = new ExecutorStateSubject<>(callbackExecutor);
        doThrow(new IllegalStateException("listener bug")).when(failingListener).onState(anyInt());
        List<Integer> received = new CopyOnWriteArrayList<>();
        subject.addListener(failingListener);
        subject.addListener(received::add);

        // when
        subject.publish(1);
        subject.publish(2);
        flush();

        // then
        assertThat(received).containsExactly(1, 2);
        InOrder order = inOrder(failingListener);
        order.verify(failingListener).onState(1);
        order.verify(failingListener).onState(2);
    }

    @Test
    void testPublish_RejectedByExecutor_DropsPendingAndRecovers() {
        // given
        RejectingOnceExecutor executor = new RejectingOnceExecutor();
        ExecutorStateSubject<Integer> subject = new ExecutorStateSubject<>(executor);
        List<Integer> received = new CopyOnWriteArrayList<>();
        subject.addListener(received::add);

        // when
        subject.publish(1);
        subject.publish(2);

        // then
        assertThat(received).containsExactly(2);
    }

    @Test
    void testPublish_WithoutListeners_NeverTouchesExecutor() {
        // given
        Executor executor = command -> {
            throw new AssertionError("executor must not be used");
        };
        ExecutorStateSubject<Integer> subject = new ExecutorStateSubject<>(executor);

        // when
        subject.publish(1);

        // then
        assertThat(subject.listenerCount()).isZero();
    }

    @Test
    void testNullArguments_ThrowException() {
        assertThatThrownBy(() -> new ExecutorStateSubject<Integer>(null))
            .isInstanceOf(IllegalArgumentException.class);

        ExecutorStateSubject<Integer> subject = new ExecutorStateSubject<>(Runnable::run);
        assertThatThrownBy(() -> subject.addListener(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> subject.removeListener(null)).isInstanceOf(IllegalArgumentException.class);
    }

    private void flush() throws InterruptedException {
        callbackExecutor.shutdown();
        assertThat(callbackExecutor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
    }

    private static final class RejectingOnceExecutor implements Executor {

        private boolean rejected;

        @Override
        public void execute(Runnable command) {
            if (!rejected) {
                rejected = true;
                throw new RejectedExecutionException("callback executor saturated");
            }
            command.run();
        }
    }
}
