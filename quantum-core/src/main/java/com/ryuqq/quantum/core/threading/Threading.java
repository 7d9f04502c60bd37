package com.ryuqq.quantum.core.threading;

import java.util.concurrent.Executor;

/**
 * Quantum 인스턴스의 실행 방식 선택.
 *
 * <p>여섯 가지 방식이 있으며, 생성 시점에 하나의 실행 백엔드로 매핑됩니다:</p>
 * <ul>
 *   <li>{@link DedicatedThread}: 인스턴스 전용 스레드 (wait/notify 루프, 종료 시 스레드 정리)</li>
 *   <li>{@link Pool}: 프로세스 공유 스레드 풀 (종료 시 풀을 정리하지 않음)</li>
 *   <li>{@link DedicatedPool}: 인스턴스 전용 스레드 풀 (종료 시 풀 정리)</li>
 *   <li>{@link Custom}: 호출자가 제공한 Executor (종료 시 정리하지 않음)</li>
 *   <li>{@link Sync}: 제출한 스레드에서 즉시 사이클 실행</li>
 *   <li>{@link Cooperative}: 이미 직렬화된 루프(UI 메시지 루프 등)에 제출마다 한 사이클씩 post</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 있으며, {@link #kind()}로 분기합니다.</p>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
public sealed interface Threading
    permits Threading.DedicatedThread, Threading.Pool, Threading.DedicatedPool, Threading.Custom,
            Threading.Sync, Threading.Cooperative {

    /**
     * 실행 방식 종류.
     */
    enum Kind {
        DEDICATED_THREAD,
        SHARED_POOL,
        DEDICATED_POOL,
        CALLER_SUPPLIED_EXECUTOR,
        SYNCHRONOUS_INLINE,
        COOPERATIVE_SINGLE_THREAD
    }

    /**
     * 실행 방식 종류 조회.
     *
     * @return 종류
     */
    Kind kind();

    /**
     * 인스턴스 전용 스레드.
     */
    record DedicatedThread() implements Threading {
        @Override
        public Kind kind() {
            return Kind.DEDICATED_THREAD;
        }
    }

    /**
     * 프로세스 공유 풀.
     */
    record Pool() implements Threading {
        @Override
        public Kind kind() {
            return Kind.SHARED_POOL;
        }
    }

    /**
     * 인스턴스 전용 스레드 풀.
     *
     * @param threads 풀 크기 (1 이상, 크기와 관계없이 사이클은 겹치지 않음)
     */
    record DedicatedPool(int threads) implements Threading {
        public DedicatedPool {
            if (threads <= 0) {
                throw new IllegalArgumentException("threads must be positive (current: " + threads + ")");
            }
        }

        @Override
        public Kind kind() {
            return Kind.DEDICATED_POOL;
        }
    }

    /**
     * 호출자 제공 Executor.
     *
     * @param executor 사이클을 실행할 Executor (스레드 풀이어도 사이클은 겹치지 않음)
     */
    record Custom(Executor executor) implements Threading {
        public Custom {
            if (executor == null) {
                throw new IllegalArgumentException("executor cannot be null");
            }
        }

        @Override
        public Kind kind() {
            return Kind.CALLER_SUPPLIED_EXECUTOR;
        }
    }

    /**
     * 제출 스레드에서 즉시 실행.
     */
    record Sync() implements Threading {
        @Override
        public Kind kind() {
            return Kind.SYNCHRONOUS_INLINE;
        }
    }

    /**
     * 협력적 단일 스레드 루프.
     *
     * @param loop 콜백을 이미 직렬화하는 Executor (단일 스레드여야 함)
     */
    record Cooperative(Executor loop) implements Threading {
        public Cooperative {
            if (loop == null) {
                throw new IllegalArgumentException("loop cannot be null");
            }
        }

        @Override
        public Kind kind() {
            return Kind.COOPERATIVE_SINGLE_THREAD;
        }
    }

    static Threading dedicatedThread() {
        return new DedicatedThread();
    }

    static Threading pool() {
        return new Pool();
    }

    static Threading dedicatedPool(int threads) {
        return new DedicatedPool(threads);
    }

    static Threading custom(Executor executor) {
        return new Custom(executor);
    }

    static Threading sync() {
        return new Sync();
    }

    static Threading cooperative(Executor loop) {
        return new Cooperative(loop);
    }
}
