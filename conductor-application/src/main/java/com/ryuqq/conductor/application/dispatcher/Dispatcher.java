package com.ryuqq.conductor.application.dispatcher;

import com.ryuqq.conductor.core.error.AlreadyRunningException;
import com.ryuqq.conductor.core.model.OperationId;
import com.ryuqq.conductor.core.model.OperationKind;
import com.ryuqq.conductor.core.model.OperationParams;
import com.ryuqq.conductor.core.spi.EventReceiver;

/**
 * 백그라운드 작업 시작 진입점.
 *
 * <p>UI 스레드에서 호출되며, 작업을 예약한 뒤 즉시 OperationId를 반환합니다 (fire-and-forget).
 * 진행 상황과 결과는 {@link #subscribe()}로 얻은 수신자 또는 상태 조회 API로 확인합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * EventReceiver events = dispatcher.subscribe();
 *
 * try {
 *     OperationId id = dispatcher.start(OperationKind.AI_ANALYSIS, params);
 * } catch (AlreadyRunningException e) {
 *     // 같은 종류의 작업이 이미 실행 중
 * }
 *
 * // 매 프레임마다
 * events.tryNext().ifPresent(this::render);
 * </pre>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface Dispatcher {

    /**
     * 작업을 시작.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>종류별 단일 실행 검사 (Registry에 PENDING 등록)</li>
     *   <li>입력 스냅샷 기반 실행 계획 생성</li>
     *   <li>새 CancellationToken과 함께 워커 예약</li>
     *   <li>OperationId 동기 반환</li>
     * </ol>
     *
     * @param kind 작업 종류
     * @param params 입력 스냅샷
     * @return 새 작업 ID
     * @throws AlreadyRunningException 같은 종류의 작업이 PENDING 또는 RUNNING 상태인 경우
     * @throws IllegalArgumentException kind/params가 null이거나 kind에 등록된 작업이 없는 경우
     * @throws java.util.concurrent.RejectedExecutionException 종료된 Dispatcher에 요청한 경우
     */
    OperationId start(OperationKind kind, OperationParams params) throws AlreadyRunningException;

    /**
     * 이벤트 구독.
     *
     * @return 새 수신자 (구독 이후 발행된 이벤트만 수신)
     */
    EventReceiver subscribe();

    /**
     * 새 작업 수락 중지, 실행 중인 작업 취소 요청 후 제한 시간 동안 종료 대기.
     */
    void shutdown();
}
