/**
 * 조직 셋업 예외 계층.
 *
 * <p>모든 예외는 {@link com.ryuqq.orgsetup.core.exception.OrgSetupException}을 상속하며
 * 오류 코드를 가집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.orgsetup.core.exception;
