package com.ryuqq.conductor.adapter.runner;

/**
 * HistorySweeper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 60000ms = 1분)</li>
 *   <li>retentionMs: 종료된 작업 보존 기간 (기본 600000ms = 10분)</li>
 *   <li>batchSize: 한 번의 스캔에서 제거할 최대 항목 수 (기본 100)</li>
 * </ul>
 *
 * <p>보존 기간은 UI가 완료 결과를 표시할 시간보다 충분히 길어야 합니다.
 * 너무 짧으면 사용자가 결과를 확인하기 전에 getStatus()가 empty를 반환합니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param retentionMs 보존 기간 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record SweeperConfig(
    long scanIntervalMs,
    long retentionMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=60000ms (1분), retentionMs=600000ms (10분), batchSize=100</p>
     */
    public SweeperConfig() {
        this(60000, 600000, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SweeperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (retentionMs <= 0) {
            throw new IllegalArgumentException(
                "retentionMs must be positive (current: " + retentionMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    /**
     * scanIntervalMs만 변경한 새 인스턴스 생성.
     */
    public SweeperConfig withScanIntervalMs(long scanIntervalMs) {
        return new SweeperConfig(scanIntervalMs, retentionMs, batchSize);
    }

    /**
     * retentionMs만 변경한 새 인스턴스 생성.
     */
    public SweeperConfig withRetentionMs(long retentionMs) {
        return new SweeperConfig(scanIntervalMs, retentionMs, batchSize);
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public SweeperConfig withBatchSize(int batchSize) {
        return new SweeperConfig(scanIntervalMs, retentionMs, batchSize);
    }
}
