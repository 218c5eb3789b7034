package com.ryuqq.conductor.workflow.operation;

import com.ryuqq.conductor.adapter.runner.BackgroundDispatcher;
import com.ryuqq.conductor.adapter.runner.DispatcherConfig;
import com.ryuqq.conductor.application.catalog.OperationCatalog;
import com.ryuqq.conductor.application.catalog.OperationFactory;
import com.ryuqq.conductor.core.event.BusMessage;
import com.ryuqq.conductor.core.event.EventPayload;
import com.ryuqq.conductor.core.event.OperationEvent;
import com.ryuqq.conductor.core.model.OperationId;
import com.ryuqq.conductor.core.model.OperationParams;
import com.ryuqq.conductor.core.spi.EventReceiver;
import com.ryuqq.conductor.core.status.OperationStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 작업 하나를 실제 Dispatcher로 끝까지 실행하는 테스트 헬퍼.
 */
final class OperationRuns {

    private OperationRuns() {
    }

    static Result run(OperationFactory factory, OperationParams params) throws Exception {
        BackgroundDispatcher dispatcher = BackgroundDispatcher.inMemory(OperationCatalog.of(factory), new DispatcherConfig());
        try {
            EventReceiver events = dispatcher.subscribe();
            OperationId id = dispatcher.start(factory.kind(), params);
            List<EventPayload> payloads = new ArrayList<>();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!hasTerminal(payloads)) {
                if (System.nanoTime() > deadline) {
                    throw new AssertionError("operation " + id + " did not finish in time");
                }
                Optional<BusMessage> next = events.tryNext();
                if (next.isEmpty()) {
                    Thread.sleep(5);
                    continue;
                }
                if (next.get() instanceof OperationEvent) {
                    payloads.add(((OperationEvent) next.get()).payload());
                }
            }
            return new Result(dispatcher.getStatus(id).orElseThrow(), payloads);
        } finally {
            dispatcher.shutdown();
        }
    }

    private static boolean hasTerminal(List<EventPayload> payloads) {
        return !payloads.isEmpty() && payloads.get(payloads.size() - 1).isTerminal();
    }

    record Result(OperationStatus status, List<EventPayload> events) {

        List<String> progressTexts() {
            List<String> texts = new ArrayList<>();
            for (EventPayload payload : events) {
                if (payload instanceof EventPayload.Progress) {
                    texts.add(((EventPayload.Progress) payload).text());
                }
            }
            return texts;
        }
    }
}
