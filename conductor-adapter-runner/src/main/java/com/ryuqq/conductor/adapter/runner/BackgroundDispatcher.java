package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.adapter.inmemory.bus.InMemoryEventBus;
import com.ryuqq.conductor.adapter.inmemory.registry.InMemoryOperationRegistry;
import com.ryuqq.conductor.application.catalog.OperationCatalog;
import com.ryuqq.conductor.application.catalog.OperationFactory;
import com.ryuqq.conductor.application.dispatcher.Dispatcher;
import com.ryuqq.conductor.application.query.OperationQuery;
import com.ryuqq.conductor.core.error.AlreadyRunningException;
import com.ryuqq.conductor.core.error.AlreadyTerminalException;
import com.ryuqq.conductor.core.error.OperationNotFoundException;
import com.ryuqq.conductor.core.event.EventPayload;
import com.ryuqq.conductor.core.event.OperationEvent;
import com.ryuqq.conductor.core.model.OperationId;
import com.ryuqq.conductor.core.model.OperationKind;
import com.ryuqq.conductor.core.model.OperationParams;
import com.ryuqq.conductor.core.model.RunningOperation;
import com.ryuqq.conductor.core.plan.OperationPlan;
import com.ryuqq.conductor.core.spi.EventBus;
import com.ryuqq.conductor.core.spi.EventReceiver;
import com.ryuqq.conductor.core.spi.OperationRecord;
import com.ryuqq.conductor.core.spi.OperationRegistry;
import com.ryuqq.conductor.core.status.OperationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatcher / OperationQuery 구현체.
 *
 * <p>고정 크기 워커 풀에서 {@link WorkerHarness}를 실행하고, Registry와 EventBus를 통해
 * UI 루프에 상태를 노출합니다.</p>
 *
 * <p><strong>start() 처리 흐름:</strong></p>
 * <pre>
 * 1. catalog.require(kind)        → 등록되지 않은 종류면 IllegalArgumentException
 * 2. registry.register(kind)      → PENDING (단일 실행 위반 시 AlreadyRunningException)
 * 3. factory.plan(params)         → 입력 스냅샷 기반 실행 계획
 * 4. workers.execute(harness.run) → 예약 실패 시 PENDING 항목 제거 후 예외 재전파
 * 5. registry.markRunning(id)     → 예약이 확인된 뒤에만 RUNNING
 * 6. OperationId 반환
 * </pre>
 *
 * <p><strong>cancel() 처리 흐름:</strong></p>
 * <pre>
 * 1. 토큰 설정 (워커는 다음 체크포인트에서 중단)
 * 2. registry.cancel(id) → 전이에 성공하면 Cancelled 이벤트 발행
 * </pre>
 *
 * <p>모든 조회 메서드는 Registry의 O(1) 연산만 수행하므로 렌더 루프에서 매 프레임 호출해도 됩니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class BackgroundDispatcher implements Dispatcher, OperationQuery {

    private static final Logger log = LoggerFactory.getLogger(BackgroundDispatcher.class);

    private final EventBus bus;
    private final OperationRegistry registry;
    private final OperationCatalog catalog;
    private final DispatcherConfig config;
    private final WorkerHarness harness;
    private final ExecutorService workers;
    private final Map<OperationId, CancellationToken> tokens;
    private volatile boolean shutdown;

    /**
     * 생성자.
     *
     * @param bus 이벤트 버스
     * @param registry 상태 Registry
     * @param catalog 작업 카탈로그
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BackgroundDispatcher(EventBus bus, OperationRegistry registry, OperationCatalog catalog, DispatcherConfig config) {
        this(bus, registry, catalog, config,
            config == null ? null : Executors.newFixedThreadPool(config.maxWorkers(), new WorkerThreadFactory()));
    }

    /**
     * 생성자 (워커 풀 주입, 테스트용).
     */
    BackgroundDispatcher(
        EventBus bus,
        OperationRegistry registry,
        OperationCatalog catalog,
        DispatcherConfig config,
        ExecutorService workers
    ) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (workers == null) {
            throw new IllegalArgumentException("workers cannot be null");
        }
        this.bus = bus;
        this.registry = registry;
        this.catalog = catalog;
        this.config = config;
        this.harness = new WorkerHarness(registry, bus, config.bridgePollIntervalMs());
        this.workers = workers;
        this.tokens = new ConcurrentHashMap<>();
    }

    /**
     * 인메모리 EventBus / Registry로 구성된 Dispatcher 생성.
     *
     * @param catalog 작업 카탈로그
     * @param config 설정 (eventBufferCapacity가 구독자 버퍼 크기로 사용됨)
     * @return 새 Dispatcher
     */
    public static BackgroundDispatcher inMemory(OperationCatalog catalog, DispatcherConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new BackgroundDispatcher(
            new InMemoryEventBus(config.eventBufferCapacity()),
            new InMemoryOperationRegistry(),
            catalog,
            config
        );
    }

    @Override
    public OperationId start(OperationKind kind, OperationParams params) throws AlreadyRunningException {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        if (shutdown) {
            throw new RejectedExecutionException("Dispatcher is shut down");
        }

        // 1. 종류별 팩토리 조회 (Registry를 건드리기 전에 실패)
        OperationFactory factory = catalog.require(kind);

        // 2. 단일 실행 검사 + PENDING 등록
        OperationId id = registry.register(kind);

        // 3. 실행 계획 생성
        OperationPlan plan = planOrRelease(id, factory, params);

        // 4. 워커 예약
        CancellationToken token = new CancellationToken();
        tokens.put(id, token);
        try {
            workers.execute(() -> {
                try {
                    harness.run(id, kind, plan, params, token);
                } finally {
                    tokens.remove(id);
                }
            });
        } catch (RejectedExecutionException e) {
            tokens.remove(id);
            release(id);
            log.warn("Could not schedule {} {}: {}", kind, id, e.getMessage());
            throw e;
        }

        // 5. 예약 확인 후 RUNNING (워커가 먼저 전이했으면 no-op)
        registry.markRunning(id, "Starting " + kind.displayName() + "...");
        log.info("Started {} as {}", kind, id);
        return id;
    }

    @Override
    public EventReceiver subscribe() {
        return bus.subscribe();
    }

    @Override
    public Optional<OperationStatus> getStatus(OperationId id) {
        return registry.getStatus(id);
    }

    @Override
    public List<RunningOperation> listRunning() {
        return registry.listRunning();
    }

    @Override
    public void cancel(OperationId id) throws OperationNotFoundException, AlreadyTerminalException {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        OperationRecord record = registry.find(id).orElseThrow(() -> new OperationNotFoundException(id));
        if (record.isTerminal()) {
            throw new AlreadyTerminalException(id, record.status().state());
        }

        // 1. 토큰 설정
        CancellationToken token = tokens.get(id);
        if (token != null) {
            token.cancel();
        }

        // 2. Registry 전이 + 이벤트 발행
        if (registry.cancel(id)) {
            bus.publish(OperationEvent.now(id, record.kind(), new EventPayload.Cancelled()));
            log.info("Cancellation requested for {} {}", record.kind(), id);
            return;
        }

        // 조회와 전이 사이에 워커가 먼저 종료한 경우
        OperationStatus current = registry.getStatus(id).orElseThrow(() -> new OperationNotFoundException(id));
        throw new AlreadyTerminalException(id, current.state());
    }

    @Override
    public boolean remove(OperationId id) {
        return registry.remove(id);
    }

    /**
     * Dispatcher 종료.
     *
     * <p>새 작업 수락을 중지하고 모든 토큰을 취소한 뒤, shutdownTimeoutMs 동안 워커 종료를 기다립니다.
     * 시간 내 종료되지 않으면 워커 스레드를 인터럽트합니다.</p>
     */
    @Override
    public void shutdown() {
        shutdown = true;
        workers.shutdown();
        tokens.values().forEach(CancellationToken::cancel);
        log.info("Dispatcher shutting down, {} operation(s) still live", tokens.size());
        try {
            if (!workers.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not stop within {}ms, interrupting", config.shutdownTimeoutMs());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * @return shutdown() 이후 모든 워커가 종료되었으면 true
     */
    public boolean isTerminated() {
        return workers.isTerminated();
    }

    private OperationPlan planOrRelease(OperationId id, OperationFactory factory, OperationParams params) {
        try {
            return factory.plan(params);
        } catch (RuntimeException e) {
            release(id);
            throw e;
        }
    }

    /**
     * 예약되지 못한 PENDING 항목을 제거해 같은 종류를 다시 시작할 수 있게 함.
     */
    private void release(OperationId id) {
        registry.cancel(id);
        registry.remove(id);
    }

    /**
     * "conductor-worker-{n}" 이름의 데몬 스레드 생성.
     */
    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "conductor-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
