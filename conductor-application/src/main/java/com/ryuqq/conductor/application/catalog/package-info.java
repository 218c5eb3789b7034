/**
 * 작업 카탈로그.
 *
 * <ul>
 *   <li>{@link com.ryuqq.conductor.application.catalog.OperationFactory} - 종류별 실행 계획 생성</li>
 *   <li>{@link com.ryuqq.conductor.application.catalog.OperationCatalog} - 종류 → 팩토리 조회</li>
 * </ul>
 *
 * <p>구체 팩토리는 conductor-workflow 모듈에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.conductor.application.catalog;
