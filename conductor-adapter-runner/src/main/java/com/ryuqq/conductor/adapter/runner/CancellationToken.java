package com.ryuqq.conductor.adapter.runner;

/**
 * 작업별 취소 플래그.
 *
 * <p>Dispatcher가 설정하고 워커가 체크포인트에서 읽습니다. volatile 필드 하나로 구성되며
 * 최종적 가시성(eventual visibility)만 보장합니다. 한 번 설정되면 해제되지 않습니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    /**
     * 취소 요청. 여러 번 호출해도 안전합니다.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
