package com.ryuqq.quantum.adapter.runner.engine;

import com.ryuqq.quantum.core.future.CycleFuture;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reducer 큐와 Action 큐의 쌍.
 *
 * <p><strong>주의:</strong> 스레드 안전하지 않습니다.
 * 모든 접근은 {@link StateActor}의 lock 안에서 이루어집니다.</p>
 *
 * <p><strong>연산:</strong></p>
 * <ul>
 *   <li>{@link #detach()}: 두 큐를 한 번에 비우고 Batch로 반환 (사이클 시작)</li>
 *   <li>{@link #requeueFirst(List, List)}: 실행되지 못한 작업을 원래 순서대로 앞쪽에 복원</li>
 *   <li>{@link #drainFutures()}: 종료 시 남은 작업의 Future 수집</li>
 * </ul>
 *
 * @param <T> 상태 타입
 * @author Quantum Team
 * @since 1.0.0
 */
final class JobQueue<T> {

    private final Deque<ReducerJob<T>> reducers = new ArrayDeque<>();
    private final Deque<ActionJob<T>> actions = new ArrayDeque<>();

    void addReducer(ReducerJob<T> job) {
        reducers.addLast(job);
    }

    void addAction(ActionJob<T> job) {
        actions.addLast(job);
    }

    boolean isEmpty() {
        return reducers.isEmpty() && actions.isEmpty();
    }

    int size() {
        return reducers.size() + actions.size();
    }

    /**
     * 대기 중인 모든 작업을 분리.
     *
     * @return 분리된 작업 묶음 (큐가 비어 있으면 빈 Batch)
     */
    Batch<T> detach() {
        if (isEmpty()) {
            return Batch.empty();
        }
        Batch<T> batch = new Batch<>(new ArrayList<>(reducers), new ArrayList<>(actions));
        reducers.clear();
        actions.clear();
        return batch;
    }

    /**
     * 실행되지 못한 작업을 큐 앞쪽에 복원 (상대 순서 유지).
     *
     * @param pendingReducers 복원할 Reducer (제출 순서)
     * @param pendingActions 복원할 Action (제출 순서)
     */
    void requeueFirst(List<ReducerJob<T>> pendingReducers, List<ActionJob<T>> pendingActions) {
        for (int i = pendingReducers.size() - 1; i >= 0; i--) {
            reducers.addFirst(pendingReducers.get(i));
        }
        for (int i = pendingActions.size() - 1; i >= 0; i--) {
            actions.addFirst(pendingActions.get(i));
        }
    }

    /**
     * 남은 작업을 모두 제거하고 Future 목록 반환.
     *
     * @return Reducer Future 다음 Action Future 순
     */
    List<CycleFuture> drainFutures() {
        List<CycleFuture> futures = new ArrayList<>(size());
        reducers.forEach(job -> futures.add(job.future()));
        actions.forEach(job -> futures.add(job.future()));
        reducers.clear();
        actions.clear();
        return futures;
    }
}
