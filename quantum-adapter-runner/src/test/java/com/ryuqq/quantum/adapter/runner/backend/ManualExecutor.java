package com.ryuqq.quantum.adapter.runner.backend;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 제출된 작업을 모아 두었다가 테스트가 직접 실행하는 Executor.
 */
final class ManualExecutor implements Executor {

    private final Deque<Runnable> tasks = new ArrayDeque<>();
    private boolean rejecting;

    @Override
    public void execute(Runnable command) {
        if (rejecting) {
            throw new RejectedExecutionException("rejecting");
        }
        tasks.addLast(command);
    }

    void reject() {
        rejecting = true;
    }

    int pending() {
        return tasks.size();
    }

    void runNext() {
        Runnable task = tasks.pollFirst();
        if (task == null) {
            throw new IllegalStateException("no task queued");
        }
        task.run();
    }
}
