package com.ryuqq.conductor.application.query;

import com.ryuqq.conductor.core.error.AlreadyTerminalException;
import com.ryuqq.conductor.core.error.OperationNotFoundException;
import com.ryuqq.conductor.core.model.OperationId;
import com.ryuqq.conductor.core.model.RunningOperation;
import com.ryuqq.conductor.core.status.OperationStatus;

import java.util.List;
import java.util.Optional;

/**
 * 작업 상태 조회 및 취소 API.
 *
 * <p>모든 메서드는 블로킹 없이 즉시 반환되며 I/O를 수행하지 않으므로
 * 렌더 루프에서 매 프레임 호출해도 안전합니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface OperationQuery {

    /**
     * 상태 스냅샷 조회.
     *
     * @param id 작업 ID
     * @return 상태, 알 수 없거나 제거된 ID이면 empty
     */
    Optional<OperationStatus> getStatus(OperationId id);

    /**
     * 실행 중(PENDING/RUNNING) 작업 목록.
     *
     * @return (kind, id) 목록
     */
    List<RunningOperation> listRunning();

    /**
     * 취소 요청.
     *
     * <p>취소 토큰을 설정하고 Registry를 즉시 CANCELLED로 전이합니다. 워커는 다음 체크포인트에서
     * 중단되며, 이후 해당 ID로 Completed/Failed 이벤트는 발행되지 않습니다.</p>
     *
     * @param id 작업 ID
     * @throws OperationNotFoundException 알 수 없는 ID
     * @throws AlreadyTerminalException 이미 종료된 작업
     */
    void cancel(OperationId id) throws OperationNotFoundException, AlreadyTerminalException;

    /**
     * 종료된 작업 이력 제거.
     *
     * @param id 작업 ID
     * @return 제거되었으면 true
     * @throws IllegalStateException 아직 종료되지 않은 작업인 경우
     */
    boolean remove(OperationId id);
}
