/**
 * Organization Setup Application Layer - 셋업 실행 조정 API.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.orgsetup.application.orchestrator.SetupOrchestrator} - 셋업 실행 조정자</li>
 *   <li>{@link com.ryuqq.orgsetup.application.orchestrator.SetupOptions} - 실행 옵션</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.orgsetup.application.orchestrator;
