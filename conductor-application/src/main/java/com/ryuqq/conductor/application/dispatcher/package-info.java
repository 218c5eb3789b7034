/**
 * 작업 시작 포트.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.application.dispatcher.Dispatcher} - 작업 시작 및 이벤트 구독</li>
 * </ul>
 *
 * <p>구현체는 adapter-runner 모듈의 {@code BackgroundDispatcher}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.conductor.application.dispatcher;
