package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.model.OperationId;
import com.ryuqq.conductor.core.plan.AsyncCall;
import com.ryuqq.conductor.core.plan.StepCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 워커 스레드에서 비동기 전용 협력자를 호출하기 위한 브리지.
 *
 * <p>작업 하나당 하나씩 생성되며, 첫 호출 시점에 전용 {@link ExecutorService}를 만들어
 * 협력자에게 넘깁니다. 워커 스레드는 결과를 기다리는 동안만 블록되고, 워커 풀이나
 * Registry 락을 점유하지 않으므로 Dispatcher를 교착시키지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * await(call)
 *   1. 취소 여부 확인 → 취소되었으면 StepCancelledException
 *   2. call.start(scopedExecutor) → CompletableFuture
 *   3. pollIntervalMs 단위로 future.get() 대기
 *      - 대기 중 취소 감지 → future.cancel(true) + StepCancelledException
 *      - 실패 → ExecutionException/CompletionException을 벗겨 원인 예외 전파
 *   4. 결과 반환
 * close()
 *   → scopedExecutor.shutdownNow() (성공/실패/취소/패닉 모든 경로에서 호출)
 * </pre>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class AsyncBridge implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsyncBridge.class);

    private static final long CLOSE_AWAIT_MS = 1000;

    private final OperationId operationId;
    private final CancellationToken token;
    private final long pollIntervalMs;
    private ExecutorService executor;
    private boolean closed;

    /**
     * 생성자.
     *
     * @param operationId 소유 작업 ID (스레드 이름에 사용)
     * @param token 취소 토큰
     * @param pollIntervalMs 취소 확인 간격 (밀리초)
     * @throws IllegalArgumentException 파라미터가 유효하지 않은 경우
     */
    public AsyncBridge(OperationId operationId, CancellationToken token, long pollIntervalMs) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be positive (current: " + pollIntervalMs + ")");
        }
        this.operationId = operationId;
        this.token = token;
        this.pollIntervalMs = pollIntervalMs;
    }

    /**
     * 비동기 호출을 시작하고 완료될 때까지 워커 스레드에서 대기.
     *
     * @param call 비동기 호출
     * @param <T> 결과 타입
     * @return 호출 결과
     * @throws StepCancelledException 대기 중 취소된 경우
     * @throws Exception future가 실패한 원인 예외
     */
    public <T> T await(AsyncCall<T> call) throws Exception {
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }
        if (token.isCancelled()) {
            throw new StepCancelledException(operationId);
        }

        CompletableFuture<T> future = call.start(executor());
        if (future == null) {
            throw new IllegalStateException("AsyncCall returned null future for " + operationId);
        }

        while (true) {
            try {
                return future.get(pollIntervalMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (token.isCancelled()) {
                    future.cancel(true);
                    log.debug("Async call of {} cancelled while waiting", operationId);
                    throw new StepCancelledException(operationId);
                }
            } catch (ExecutionException e) {
                throw unwrap(e.getCause());
            } catch (CancellationException e) {
                if (token.isCancelled()) {
                    throw new StepCancelledException(operationId);
                }
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                throw new StepCancelledException(operationId);
            }
        }
    }

    /**
     * 전용 executor 종료. 여러 번 호출해도 안전합니다.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(CLOSE_AWAIT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Async bridge threads of {} did not stop within {}ms", operationId, CLOSE_AWAIT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * @return close()가 호출되었으면 true
     */
    public synchronized boolean isClosed() {
        return closed;
    }

    private synchronized ExecutorService executor() {
        if (closed) {
            throw new IllegalStateException("AsyncBridge of " + operationId + " is closed");
        }
        if (executor == null) {
            executor = Executors.newCachedThreadPool(new BridgeThreadFactory(operationId));
        }
        return executor;
    }

    private static Exception unwrap(Throwable cause) {
        Throwable current = cause;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof Exception) {
            return (Exception) current;
        }
        if (current instanceof Error) {
            throw (Error) current;
        }
        return new IllegalStateException("Async call failed", current);
    }

    /**
     * "conductor-bridge-{opId}-{n}" 이름의 데몬 스레드 생성.
     */
    private static final class BridgeThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        BridgeThreadFactory(OperationId operationId) {
            this.prefix = "conductor-bridge-" + operationId.getValue() + "-";
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
