/**
 * 셋업 단계 시도 결과 타입.
 *
 * <p>예외 대신 sealed 타입으로 성공, 충돌, 일시적 실패, 영구 실패를 구분합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.orgsetup.core.outcome;
