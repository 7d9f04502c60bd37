package com.ryuqq.quantum.adapter.runner.backend;

import com.ryuqq.quantum.application.backend.CycleTarget;
import com.ryuqq.quantum.application.backend.ExecutionBackend;
import com.ryuqq.quantum.core.threading.Joinable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 호스트 메시지 루프에 step을 게시(post)하는 백엔드.
 *
 * <p>제출이나 종료 요청마다 step 작업 하나를 루프에 게시합니다. 루프가 작업을
 * 직렬로 실행한다는 전제이며, 여러 게시 중 첫 번째가 사이클 전체를 처리하고
 * 나머지는 빈 step이 됩니다.</p>
 *
 * <p><strong>안전장치:</strong></p>
 * <ul>
 *   <li>루프가 작업을 동시에 실행하면 경고 로그 후 다시 게시</li>
 *   <li>사용자 코드 예외로 step이 끝나고 작업이 남아 있으면 다시 게시한 뒤 예외 전파</li>
 *   <li>루프가 게시를 거부하면 엔진을 abort</li>
 * </ul>
 *
 * <p>루프는 호출자 소유이므로 종료 시 아무 것도 해제하지 않습니다.</p>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
public final class CooperativeBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(CooperativeBackend.class);

    private final Executor loop;
    private final AtomicBoolean cycling = new AtomicBoolean(false);

    private volatile CycleTarget target;

    /**
     * 생성자.
     *
     * @param loop 작업을 직렬로 실행하는 호스트 루프
     * @throws IllegalArgumentException loop가 null인 경우
     */
    public CooperativeBackend(Executor loop) {
        if (loop == null) {
            throw new IllegalArgumentException("loop cannot be null");
        }
        this.loop = loop;
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
        post();
    }

    @Override
    public Joinable teardown() {
        return Joinable.completed();
    }

    @Override
    public boolean ownsResources() {
        return false;
    }

    private void post() {
        try {
            loop.execute(this::runStep);
        } catch (RejectedExecutionException e) {
            target.abort(e);
        }
    }

    private void runStep() {
        if (!cycling.compareAndSet(false, true)) {
            log.warn("Host loop of {} ran steps concurrently, re-posting", target.name());
            post();
            return;
        }
        boolean completed = false;
        try {
            target.step();
            completed = true;
        } finally {
            cycling.set(false);
            if (!completed && target.needsStep()) {
                post();
            }
        }
    }
}
