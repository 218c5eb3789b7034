package com.ryuqq.conductor.application.catalog;

import com.ryuqq.conductor.core.model.OperationKind;
import com.ryuqq.conductor.core.model.OperationParams;
import com.ryuqq.conductor.core.plan.OperationPlan;

/**
 * 작업 종류별 실행 계획 생성기.
 *
 * <p>{@link #plan(OperationParams)}는 UI 스레드에서 호출되므로 I/O 없이 계획만 조립해야 합니다.
 * 실제 작업은 반환된 Step들이 워커 스레드에서 수행합니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface OperationFactory {

    /**
     * @return 이 팩토리가 담당하는 작업 종류
     */
    OperationKind kind();

    /**
     * 실행 계획 생성.
     *
     * @param params 입력 스냅샷
     * @return 실행 계획
     */
    OperationPlan plan(OperationParams params);
}
