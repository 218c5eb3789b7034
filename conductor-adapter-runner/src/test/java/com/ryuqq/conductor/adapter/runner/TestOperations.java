package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.application.catalog.OperationFactory;
import com.ryuqq.conductor.core.event.BusMessage;
import com.ryuqq.conductor.core.event.EventPayload;
import com.ryuqq.conductor.core.event.OperationEvent;
import com.ryuqq.conductor.core.model.OperationId;
import com.ryuqq.conductor.core.model.OperationKind;
import com.ryuqq.conductor.core.model.OperationParams;
import com.ryuqq.conductor.core.plan.OperationPlan;
import com.ryuqq.conductor.core.plan.Step;
import com.ryuqq.conductor.core.spi.EventReceiver;
import com.ryuqq.conductor.core.status.OperationStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runner 테스트용 작업 팩토리 / 대기 헬퍼.
 */
final class TestOperations {

    private TestOperations() {
    }

    static OperationFactory factory(OperationKind kind, Step... steps) {
        return new OperationFactory() {
            @Override
            public OperationKind kind() {
                return kind;
            }

            @Override
            public OperationPlan plan(OperationParams params) {
                return OperationPlan.of(steps);
            }
        };
    }

    static Step awaiting(String description, CountDownLatch latch) {
        return Step.of(description, ctx -> {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch was never released");
            }
            return description;
        });
    }

    static Step returning(String description, String result) {
        return Step.of(description, ctx -> result);
    }

    static OperationStatus awaitTerminal(Supplier<Optional<OperationStatus>> status) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            Optional<OperationStatus> current = status.get();
            if (current.isPresent() && current.get().isTerminal()) {
                return current.get();
            }
            Thread.sleep(5);
        }
        throw new AssertionError("operation did not reach a terminal state in time");
    }

    static void awaitCondition(Supplier<Boolean> condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (condition.get()) {
                return;
            }
            Thread.sleep(5);
        }
        throw new AssertionError("condition not met in time");
    }

    static List<BusMessage> drain(EventReceiver receiver) {
        List<BusMessage> messages = new ArrayList<>();
        Optional<BusMessage> next;
        while ((next = receiver.tryNext()).isPresent()) {
            messages.add(next.get());
        }
        return messages;
    }

    /**
     * 해당 작업의 종료 이벤트가 도착할 때까지 수신한 모든 메시지.
     */
    static List<BusMessage> collectUntilTerminal(EventReceiver receiver, OperationId id) throws InterruptedException {
        List<BusMessage> messages = new ArrayList<>();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            messages.addAll(drain(receiver));
            for (EventPayload payload : payloadsOf(messages, id)) {
                if (payload.isTerminal()) {
                    return messages;
                }
            }
            Thread.sleep(5);
        }
        throw new AssertionError("no terminal event received for " + id);
    }

    static List<EventPayload> payloadsOf(List<BusMessage> messages, OperationId id) {
        List<EventPayload> payloads = new ArrayList<>();
        for (BusMessage message : messages) {
            if (message instanceof OperationEvent && ((OperationEvent) message).operationId().equals(id)) {
                payloads.add(((OperationEvent) message).payload());
            }
        }
        return payloads;
    }
}
