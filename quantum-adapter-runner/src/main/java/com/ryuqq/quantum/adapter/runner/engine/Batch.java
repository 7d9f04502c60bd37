package com.ryuqq.quantum.adapter.runner.engine;

import java.util.List;

/**
 * 한 사이클이 처리할 작업 묶음 (사이클 시작 시점에 큐에서 분리됨).
 *
 * @param reducers 제출 순서대로의 Reducer 목록
 * @param actions 제출 순서대로의 Action 목록
 * @param <T> 상태 타입
 * @author Quantum Team
 * @since 1.0.0
 */
record Batch<T>(List<ReducerJob<T>> reducers, List<ActionJob<T>> actions) {

    Batch {
        reducers = List.copyOf(reducers);
        actions = List.copyOf(actions);
    }

    static <T> Batch<T> empty() {
        return new Batch<>(List.of(), List.of());
    }

    boolean isEmpty() {
        return reducers.isEmpty() && actions.isEmpty();
    }

    int size() {
        return reducers.size() + actions.size();
    }
}
