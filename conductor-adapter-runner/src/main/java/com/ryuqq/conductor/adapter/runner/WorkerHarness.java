package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.error.CollaboratorException;
import com.ryuqq.conductor.core.error.UserInputException;
import com.ryuqq.conductor.core.event.EventPayload;
import com.ryuqq.conductor.core.event.OperationEvent;
import com.ryuqq.conductor.core.model.OperationId;
import com.ryuqq.conductor.core.model.OperationKind;
import com.ryuqq.conductor.core.model.OperationParams;
import com.ryuqq.conductor.core.plan.OperationPlan;
import com.ryuqq.conductor.core.plan.Step;
import com.ryuqq.conductor.core.plan.StepCancelledException;
import com.ryuqq.conductor.core.spi.EventPublisher;
import com.ryuqq.conductor.core.spi.OperationRegistry;
import com.ryuqq.conductor.core.status.OperationStatus;
import com.ryuqq.conductor.core.status.Running;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 작업 하나의 Step 시퀀스를 워커 스레드에서 실행.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run()
 *   1. RUNNING 진입 (Dispatcher가 먼저 전이했으면 그대로 진행, 취소되었으면 종료)
 *   2. For each Step:
 *      a. 취소 체크포인트 → 취소 시 Cancelled
 *      b. Progress 이벤트 + Registry 메시지 갱신
 *      c. step.execute(context)
 *   3. 마지막 Step 결과로 Completed
 *   4. 실패 정규화 → Failed(message)
 *   5. finally: AsyncBridge 정리
 * </pre>
 *
 * <p><strong>실패 정규화:</strong></p>
 * <ul>
 *   <li>UserInputException → 메시지 그대로 (INFO)</li>
 *   <li>CollaboratorException → 메시지 그대로 (WARN)</li>
 *   <li>기타 checked Exception → 메시지 또는 클래스 이름 (WARN)</li>
 *   <li>RuntimeException / Error → "internal error" (ERROR + 스택 트레이스)</li>
 * </ul>
 *
 * <p>종료 이벤트는 Registry 전이에 성공한 경우에만 발행합니다. 따라서 UI가 먼저 취소한 작업에
 * 대해서는 Completed/Failed 이벤트가 절대 발행되지 않습니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class WorkerHarness {

    private static final Logger log = LoggerFactory.getLogger(WorkerHarness.class);

    /**
     * 프로그래밍 오류에 대해 사용자에게 노출되는 메시지.
     */
    public static final String INTERNAL_ERROR = "internal error";

    private final OperationRegistry registry;
    private final EventPublisher publisher;
    private final long bridgePollIntervalMs;

    /**
     * 생성자.
     *
     * @param registry 상태 Registry
     * @param publisher 이벤트 발행자
     * @param bridgePollIntervalMs AsyncBridge 취소 확인 간격
     * @throws IllegalArgumentException 의존성이 null이거나 간격이 양수가 아닌 경우
     */
    public WorkerHarness(OperationRegistry registry, EventPublisher publisher, long bridgePollIntervalMs) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        if (bridgePollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "bridgePollIntervalMs must be positive (current: " + bridgePollIntervalMs + ")");
        }
        this.registry = registry;
        this.publisher = publisher;
        this.bridgePollIntervalMs = bridgePollIntervalMs;
    }

    /**
     * 작업 실행. 예외를 던지지 않습니다.
     *
     * @param id 작업 ID
     * @param kind 작업 종류
     * @param plan 실행 계획
     * @param params 입력 스냅샷
     * @param token 취소 토큰
     */
    public void run(OperationId id, OperationKind kind, OperationPlan plan, OperationParams params, CancellationToken token) {
        HarnessStepContext context = new HarnessStepContext(
            id, kind, params, token, publisher, registry, bridgePollIntervalMs);
        try {
            // 1. RUNNING 진입
            if (!enterRunning(id, plan.steps().get(0).description())) {
                log.info("{} {} was cancelled before it started", kind, id);
                return;
            }

            // 2. Step 순차 실행
            String result = "";
            for (Step step : plan.steps()) {
                if (token.isCancelled()) {
                    finishCancelled(id, kind);
                    return;
                }
                context.progress(step.description());
                log.debug("{} {} step: {}", kind, id, step.description());
                String output = step.execute(context);
                result = output == null ? "" : output;
                context.setPreviousResult(result);
            }

            // 3. 완료
            finishCompleted(id, kind, result);

        } catch (StepCancelledException e) {
            finishCancelled(id, kind);
        } catch (UserInputException e) {
            log.info("{} {} failed: {}", kind, id, e.getMessage());
            finishFailed(id, kind, e.getMessage());
        } catch (CollaboratorException e) {
            log.warn("{} {} failed ({}): {}", kind, id, e.getCollaborator(), e.getMessage());
            finishFailed(id, kind, e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} {} failed with an unexpected error", kind, id, e);
            finishFailed(id, kind, INTERNAL_ERROR);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finishCancelled(id, kind);
        } catch (Exception e) {
            log.warn("{} {} failed: {}", kind, id, e.toString());
            finishFailed(id, kind, messageOf(e));
        } catch (Error e) {
            log.error("{} {} failed with a fatal error", kind, id, e);
            finishFailed(id, kind, INTERNAL_ERROR);
        } finally {
            context.close();
        }
    }

    /**
     * PENDING → RUNNING 전이.
     *
     * <p>Dispatcher도 워커 예약 직후 같은 전이를 시도하므로 둘 중 먼저 도착한 쪽이 전이하고,
     * 나중 쪽은 현재 상태가 RUNNING인지로 진행 여부를 판단합니다.</p>
     *
     * @return 계속 진행해야 하면 true
     */
    private boolean enterRunning(OperationId id, String message) {
        if (registry.markRunning(id, message)) {
            return true;
        }
        Optional<OperationStatus> status = registry.getStatus(id);
        return status.isPresent() && status.get() instanceof Running;
    }

    private void finishCompleted(OperationId id, OperationKind kind, String result) {
        if (registry.complete(id, result)) {
            publisher.publish(OperationEvent.now(id, kind, new EventPayload.Completed(result)));
            log.info("{} {} completed", kind, id);
        } else {
            log.debug("{} {} finished after it was already terminal, result discarded", kind, id);
        }
    }

    private void finishFailed(OperationId id, OperationKind kind, String message) {
        if (registry.fail(id, message)) {
            publisher.publish(OperationEvent.now(id, kind, new EventPayload.Failed(message)));
        } else {
            log.debug("{} {} failed after it was already terminal, failure discarded", kind, id);
        }
    }

    private void finishCancelled(OperationId id, OperationKind kind) {
        if (registry.cancel(id)) {
            publisher.publish(OperationEvent.now(id, kind, new EventPayload.Cancelled()));
        }
        log.info("{} {} cancelled", kind, id);
    }

    private static String messageOf(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }
}
