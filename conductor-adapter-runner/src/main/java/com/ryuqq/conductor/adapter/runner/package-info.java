/**
 * 백그라운드 작업 실행 어댑터.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.BackgroundDispatcher} - 작업 시작 / 조회 / 취소</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.WorkerHarness} - Step 실행, 취소 체크포인트, 실패 정규화</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.AsyncBridge} - 비동기 전용 협력자 호출 브리지</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.CancellationToken} - 협력적 취소 플래그</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.HistorySweeper} - 종료된 작업 이력 정리</li>
 * </ul>
 *
 * <p><strong>설정:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.DispatcherConfig}</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.SweeperConfig}</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.conductor.adapter.runner;
