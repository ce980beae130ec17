/**
 * 롤백 결과와 수동 정리 보고서.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.orgsetup.core.report;
