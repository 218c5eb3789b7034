/**
 * 상태 조회 포트.
 *
 * <ul>
 *   <li>{@link com.ryuqq.conductor.application.query.OperationQuery} - getStatus / listRunning / cancel / remove</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.conductor.application.query;
