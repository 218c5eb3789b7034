package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.spi.OperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * HistorySweeper 컴포넌트.
 *
 * <p>종료된 지 retentionMs가 지난 작업을 Registry에서 제거해 메모리 사용량을 제한합니다.
 * UI가 {@code remove(id)}를 호출하지 않고 버린 작업 이력도 결국 정리됩니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>보존 기간이 지난 종료 작업 제거 (배치 단위)</li>
 *   <li>PENDING/RUNNING 작업은 절대 제거하지 않음 (Registry가 보장)</li>
 *   <li>예외 발생 시 로그만 남기고 다음 주기에 재시도</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * HistorySweeper sweeper = new HistorySweeper(registry, new SweeperConfig());
 * ScheduledFuture&lt;?&gt; task = sweeper.schedule(scheduler);
 * </pre>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class HistorySweeper {

    private static final Logger log = LoggerFactory.getLogger(HistorySweeper.class);
    private final OperationRegistry registry;
    private final SweeperConfig config;
    private final Clock clock;

    /**
     * 생성자 (시스템 UTC 시계 사용).
     *
     * @param registry 상태 Registry
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public HistorySweeper(OperationRegistry registry, SweeperConfig config) {
        this(registry, config, Clock.systemUTC());
    }

    /**
     * 생성자 (커스텀 시계 주입).
     *
     * @param registry 상태 Registry
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public HistorySweeper(OperationRegistry registry, SweeperConfig config, Clock clock) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.registry = registry;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 보존 기간이 지난 종료 작업 한 배치 제거.
     *
     * <p><strong>처리 흐름:</strong></p>
     * <pre>
     * 1. cutoff = now - retentionMs
     * 2. registry.sweepTerminatedBefore(cutoff, batchSize)
     * 3. 제거 건수 로깅
     * </pre>
     *
     * @return 제거된 항목 수 (실패 시 0)
     */
    public int sweep() {
        // 1. 기준 시각 계산
        Instant cutoff = clock.instant().minusMillis(config.retentionMs());

        // 2. 배치 제거
        try {
            int removed = registry.sweepTerminatedBefore(cutoff, config.batchSize());

            // 3. 결과 로깅
            if (removed > 0) {
                log.info("History sweep removed {} operation(s) terminated before {}", removed, cutoff);
            } else {
                log.debug("History sweep found nothing terminated before {}", cutoff);
            }
            return removed;

        } catch (RuntimeException e) {
            log.error("History sweep failed", e);
            return 0;
        }
    }

    /**
     * scanIntervalMs 주기로 {@link #sweep()}을 예약.
     *
     * @param scheduler 예약 실행기 (호출자가 소유)
     * @return 예약 핸들 (cancel로 중지)
     */
    public ScheduledFuture<?> schedule(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        return scheduler.scheduleWithFixedDelay(
            this::sweep, config.scanIntervalMs(), config.scanIntervalMs(), TimeUnit.MILLISECONDS);
    }
}
