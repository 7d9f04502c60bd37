package com.ryuqq.quantum.application.config;

import com.ryuqq.quantum.core.threading.Threading;

import java.util.concurrent.Executor;

/**
 * Quantum 인스턴스 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>threading: 사이클 실행 방식 (기본값: {@link QuantumDefaults}의 프로세스 기본값)</li>
 *   <li>callbackExecutor: 리스너 호출용 Executor (엔진과 분리된 실행 컨텍스트)</li>
 *   <li>historyEnabled: 상태 기록 활성화 여부 (기본 false)</li>
 *   <li>workerName: 전용 스레드/풀 스레드 이름 접두어 (기본 "quantum-worker")</li>
 * </ul>
 *
 * <p>생성 이후 변경되지 않으며, 다른 인스턴스를 설정하는 데 재사용할 수 있습니다.</p>
 *
 * @author Quantum Team
 * @since 1.0.0
 * @param threading 실행 방식 (null 불가)
 * @param callbackExecutor 리스너 호출 Executor (null 불가)
 * @param historyEnabled 상태 기록 활성화 여부
 * @param workerName 워커 이름 (null/blank 불가)
 */
public record QuantumConfig(
    Threading threading,
    Executor callbackExecutor,
    boolean historyEnabled,
    String workerName
) {

    /**
     * 기본 워커 이름.
     */
    public static final String DEFAULT_WORKER_NAME = "quantum-worker";

    /**
     * 기본 설정 생성자.
     *
     * <p>threading과 callbackExecutor는 호출 시점의 {@link QuantumDefaults} 값을 사용합니다.</p>
     */
    public QuantumConfig() {
        this(QuantumDefaults.settings().threading(), QuantumDefaults.settings().callbackExecutor(),
            false, DEFAULT_WORKER_NAME);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public QuantumConfig {
        if (threading == null) {
            throw new IllegalArgumentException("threading cannot be null");
        }
        if (callbackExecutor == null) {
            throw new IllegalArgumentException("callbackExecutor cannot be null");
        }
        if (workerName == null || workerName.isBlank()) {
            throw new IllegalArgumentException("workerName cannot be null or blank");
        }
    }

    /**
     * threading만 변경한 새 인스턴스 생성.
     */
    public QuantumConfig withThreading(Threading threading) {
        return new QuantumConfig(threading, callbackExecutor, historyEnabled, workerName);
    }

    /**
     * callbackExecutor만 변경한 새 인스턴스 생성.
     */
    public QuantumConfig withCallbackExecutor(Executor callbackExecutor) {
        return new QuantumConfig(threading, callbackExecutor, historyEnabled, workerName);
    }

    /**
     * historyEnabled만 변경한 새 인스턴스 생성.
     */
    public QuantumConfig withHistoryEnabled(boolean historyEnabled) {
        return new QuantumConfig(threading, callbackExecutor, historyEnabled, workerName);
    }

    /**
     * workerName만 변경한 새 인스턴스 생성.
     */
    public QuantumConfig withWorkerName(String workerName) {
        return new QuantumConfig(threading, callbackExecutor, historyEnabled, workerName);
    }
}
