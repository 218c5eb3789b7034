/**
 * 릴리스 도구의 구체 작업 (AI 분석, 릴리스 노트, semantic-release, 버전 정보, GitHub Actions 설정).
 *
 * <p>각 작업은 {@code OperationFactory}로, 협력자 위에서 Step 목록을 만듭니다.</p>
 */
package com.ryuqq.conductor.workflow.operation;
