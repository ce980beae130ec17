/**
 * 조직 셋업 도메인 모델.
 *
 * <p>요청, 멱등성 키, 단계, 리소스 핸들, 충돌 정보, 결과 등
 * 셋업 실행에 필요한 불변 값 타입을 제공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.orgsetup.core.model;
