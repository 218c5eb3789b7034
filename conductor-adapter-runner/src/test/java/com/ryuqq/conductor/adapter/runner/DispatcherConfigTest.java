package com.ryuqq.conductor.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DispatcherConfig / SweeperConfig 검증 테스트.
 */
class DispatcherConfigTest {

    @Test
    void 기본값() {
        DispatcherConfig config = new DispatcherConfig();

        assertThat(config.maxWorkers()).isEqualTo(8);
        assertThat(config.eventBufferCapacity()).isEqualTo(1000);
        assertThat(config.bridgePollIntervalMs()).isEqualTo(25);
        assertThat(config.shutdownTimeoutMs()).isEqualTo(10000);
    }

    @Test
    void withX는_해당_필드만_변경함() {
        DispatcherConfig config = new DispatcherConfig().withMaxWorkers(2).withEventBufferCapacity(16);

        assertThat(config.maxWorkers()).isEqualTo(2);
        assertThat(config.eventBufferCapacity()).isEqualTo(16);
        assertThat(config.bridgePollIntervalMs()).isEqualTo(25);
        assertThat(config.withShutdownTimeoutMs(0).shutdownTimeoutMs()).isZero();
    }

    @Test
    void 잘못된_값은_현재값과_함께_거부됨() {
        assertThatThrownBy(() -> new DispatcherConfig().withMaxWorkers(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("maxWorkers must be positive (current: 0)");
        assertThatThrownBy(() -> new DispatcherConfig().withEventBufferCapacity(-1))
            .hasMessage("eventBufferCapacity must be positive (current: -1)");
        assertThatThrownBy(() -> new DispatcherConfig().withBridgePollIntervalMs(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DispatcherConfig().withShutdownTimeoutMs(-5))
            .hasMessage("shutdownTimeoutMs cannot be negative (current: -5)");
    }

    @Test
    void SweeperConfig_기본값과_검증() {
        SweeperConfig config = new SweeperConfig();

        assertThat(config.scanIntervalMs()).isEqualTo(60000);
        assertThat(config.retentionMs()).isEqualTo(600000);
        assertThat(config.batchSize()).isEqualTo(100);
        assertThatThrownBy(() -> config.withBatchSize(0))
            .hasMessage("batchSize must be positive (current: 0)");
        assertThatThrownBy(() -> config.withScanIntervalMs(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
