package com.ryuqq.conductor.adapter.runner;

/**
 * BackgroundDispatcher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxWorkers: 동시 실행 워커 스레드 수 (기본 8)</li>
 *   <li>eventBufferCapacity: 구독자별 이벤트 버퍼 크기 (기본 1000)</li>
 *   <li>bridgePollIntervalMs: 비동기 호출 대기 중 취소 확인 간격 (기본 25ms)</li>
 *   <li>shutdownTimeoutMs: shutdown 시 워커 종료 대기 시간 (기본 10000ms)</li>
 * </ul>
 *
 * <p>작업 종류마다 동시에 하나씩만 실행되므로 maxWorkers가 작업 종류 수보다 작으면
 * 나중에 시작한 작업은 워커가 빌 때까지 PENDING으로 대기합니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 * @param maxWorkers 워커 스레드 수 (1 이상이어야 함)
 * @param eventBufferCapacity 구독자별 버퍼 크기 (1 이상이어야 함)
 * @param bridgePollIntervalMs 취소 확인 간격 (밀리초, 양수여야 함)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 0 이상이어야 함)
 */
public record DispatcherConfig(
    int maxWorkers,
    int eventBufferCapacity,
    long bridgePollIntervalMs,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxWorkers=8, eventBufferCapacity=1000, bridgePollIntervalMs=25ms,
     * shutdownTimeoutMs=10000ms</p>
     */
    public DispatcherConfig() {
        this(8, 1000, 25, 10000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DispatcherConfig {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException(
                "maxWorkers must be positive (current: " + maxWorkers + ")"
            );
        }
        if (eventBufferCapacity <= 0) {
            throw new IllegalArgumentException(
                "eventBufferCapacity must be positive (current: " + eventBufferCapacity + ")"
            );
        }
        if (bridgePollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "bridgePollIntervalMs must be positive (current: " + bridgePollIntervalMs + ")"
            );
        }
        if (shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs cannot be negative (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    public DispatcherConfig withMaxWorkers(int maxWorkers) {
        return new DispatcherConfig(maxWorkers, eventBufferCapacity, bridgePollIntervalMs, shutdownTimeoutMs);
    }

    public DispatcherConfig withEventBufferCapacity(int eventBufferCapacity) {
        return new DispatcherConfig(maxWorkers, eventBufferCapacity, bridgePollIntervalMs, shutdownTimeoutMs);
    }

    public DispatcherConfig withBridgePollIntervalMs(long bridgePollIntervalMs) {
        return new DispatcherConfig(maxWorkers, eventBufferCapacity, bridgePollIntervalMs, shutdownTimeoutMs);
    }

    public DispatcherConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new DispatcherConfig(maxWorkers, eventBufferCapacity, bridgePollIntervalMs, shutdownTimeoutMs);
    }
}
