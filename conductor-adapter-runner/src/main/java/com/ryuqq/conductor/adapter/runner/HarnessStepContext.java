package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.event.EventPayload;
import com.ryuqq.conductor.core.event.OperationEvent;
import com.ryuqq.conductor.core.model.OperationId;
import com.ryuqq.conductor.core.model.OperationKind;
import com.ryuqq.conductor.core.model.OperationParams;
import com.ryuqq.conductor.core.plan.AsyncCall;
import com.ryuqq.conductor.core.plan.StepContext;
import com.ryuqq.conductor.core.spi.EventPublisher;
import com.ryuqq.conductor.core.spi.OperationRegistry;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * WorkerHarness가 Step에 넘기는 {@link StepContext} 구현체.
 *
 * <p>워커 스레드 전용입니다. {@link AsyncBridge}는 첫 {@link #awaitAsync(AsyncCall)} 호출 시
 * 생성되고 {@link #close()}에서 정리됩니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
final class HarnessStepContext implements StepContext, AutoCloseable {

    private final OperationId operationId;
    private final OperationKind kind;
    private final OperationParams params;
    private final CancellationToken token;
    private final EventPublisher publisher;
    private final OperationRegistry registry;
    private final long bridgePollIntervalMs;
    private final Map<String, Object> attributes = new HashMap<>();
    private String previousResult;
    private AsyncBridge bridge;

    HarnessStepContext(
        OperationId operationId,
        OperationKind kind,
        OperationParams params,
        CancellationToken token,
        EventPublisher publisher,
        OperationRegistry registry,
        long bridgePollIntervalMs
    ) {
        this.operationId = operationId;
        this.kind = kind;
        this.params = params;
        this.token = token;
        this.publisher = publisher;
        this.registry = registry;
        this.bridgePollIntervalMs = bridgePollIntervalMs;
    }

    @Override
    public OperationId operationId() {
        return operationId;
    }

    @Override
    public OperationKind kind() {
        return kind;
    }

    @Override
    public OperationParams params() {
        return params;
    }

    @Override
    public Optional<String> previousResult() {
        return Optional.ofNullable(previousResult);
    }

    void setPreviousResult(String result) {
        this.previousResult = result;
    }

    @Override
    public void progress(String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        // 종료 이후의 진행 메시지는 Registry와 구독자 모두에게 버림
        if (registry.updateProgress(operationId, text)) {
            publisher.publish(OperationEvent.now(operationId, kind, new EventPayload.Progress(text)));
        }
    }

    @Override
    public boolean isCancelled() {
        return token.isCancelled();
    }

    @Override
    public <T> T awaitAsync(AsyncCall<T> call) throws Exception {
        if (bridge == null) {
            bridge = new AsyncBridge(operationId, token, bridgePollIntervalMs);
        }
        return bridge.await(call);
    }

    @Override
    public void put(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        attributes.put(key, value);
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = attributes.get(key);
        if (type.isInstance(value)) {
            return Optional.of(type.cast(value));
        }
        return Optional.empty();
    }

    @Override
    public void close() {
        if (bridge != null) {
            bridge.close();
        }
    }
}
