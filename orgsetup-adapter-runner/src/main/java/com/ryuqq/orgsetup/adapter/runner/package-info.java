/**
 * Runner Adapter Layer - 조직 셋업 saga 구현체.
 *
 * <p>이 패키지는 {@link com.ryuqq.orgsetup.application.orchestrator.SetupOrchestrator}의
 * 구현체와 그 구성 요소를 포함합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.orgsetup.adapter.runner.DefaultSetupOrchestrator} - 단계 실행, 재시도, 롤백 조정</li>
 *   <li>{@link com.ryuqq.orgsetup.adapter.runner.RetryPolicy} - 오류 분류와 백오프 계산</li>
 *   <li>{@link com.ryuqq.orgsetup.adapter.runner.ConflictResolver} - 409 충돌 분류와 기존 리소스 재사용</li>
 *   <li>{@link com.ryuqq.orgsetup.adapter.runner.ResourceRegistry} - 생성 순서 기록</li>
 *   <li>{@link com.ryuqq.orgsetup.adapter.runner.RollbackCoordinator} - 역순 보상과 수동 정리 보고서</li>
 *   <li>{@link com.ryuqq.orgsetup.adapter.runner.IdempotencyKeyDeriver} - 요청 기반 멱등성 키 생성</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DefaultSetupOrchestrator)
 *   ↓ implements
 * application (SetupOrchestrator interface)
 *   ↓ depends on
 * core (model, outcome, report, statemachine)
 *   ↓ depends on
 * core/spi (IdempotencyKeyStore, 리소스 서비스)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.orgsetup.adapter.runner;
