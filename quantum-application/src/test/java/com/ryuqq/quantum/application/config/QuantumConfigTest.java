package com.ryuqq.quantum.application.config;

import com.ryuqq.quantum.core.threading.Threading;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * QuantumConfig 테스트.
 *
 * @author Quantum Team
 * @since 1.0.0
 */
class QuantumConfigTest {

    private final Executor direct = Runnable::run;

    @AfterEach
    void resetDefaults() {
        QuantumDefaults.reset();
    }

    @Test
    void 기본_생성자_프로세스_기본값_사용() {
        QuantumConfig config = new QuantumConfig();

        assertThat(config.threading()).isEqualTo(Threading.pool());
        assertThat(config.callbackExecutor()).isSameAs(QuantumDefaults.settings().callbackExecutor());
        assertThat(config.historyEnabled()).isFalse();
        assertThat(config.workerName()).isEqualTo(QuantumConfig.DEFAULT_WORKER_NAME);
    }

    @Test
    void 기본_생성자_생성_시점의_기본값_반영() {
        QuantumDefaults.configure(settings -> settings.withThreading(Threading.dedicatedThread()));

        QuantumConfig config = new QuantumConfig();

        assertThat(config.threading()).isEqualTo(Threading.dedicatedThread());
    }

    @Test
    void withX_해당_항목만_변경된_새_인스턴스_반환() {
        QuantumConfig original = new QuantumConfig();

        QuantumConfig changed = original
            .withThreading(Threading.sync())
            .withCallbackExecutor(direct)
            .withHistoryEnabled(true)
            .withWorkerName("counter");

        assertThat(changed.threading()).isEqualTo(Threading.sync());
        assertThat(changed.callbackExecutor()).isSameAs(direct);
        assertThat(changed.historyEnabled()).isTrue();
        assertThat(changed.workerName()).isEqualTo("counter");
        assertThat(original.threading()).isEqualTo(Threading.pool());
        assertThat(original.historyEnabled()).isFalse();
    }

    @Test
    void threading_null_예외() {
        assertThatThrownBy(() -> new QuantumConfig(null, direct, false, "worker"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("threading");
    }

    @Test
    void callbackExecutor_null_예외() {
        assertThatThrownBy(() -> new QuantumConfig().withCallbackExecutor(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("callbackExecutor");
    }

    @Test
    void workerName_공백_예외() {
        assertThatThrownBy(() -> new QuantumConfig().withWorkerName("  "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("workerName");
    }
}
