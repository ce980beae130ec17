package com.ryuqq.orgsetup.application.orchestrator;

import com.ryuqq.orgsetup.core.exception.SetupException;
import com.ryuqq.orgsetup.core.model.SetupRequest;
import com.ryuqq.orgsetup.core.model.SetupResult;
import com.ryuqq.orgsetup.core.report.ManualCleanupReport;

/**
 * 조직 셋업 실행 조정자.
 *
 * <p>조직 → 테넌트 → 관리자 → API 키 → 도메인 순서로 리소스를 생성하는 saga를 실행합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SetupRequest request = SetupRequest.builder()
 *     .name("Acme")
 *     .subdomain("acme")
 *     .adminName("Jane Doe")
 *     .adminEmail("jane@acme.io")
 *     .build();
 *
 * try {
 *     SetupResult result = orchestrator.setup(request, SetupOptions.defaults().withIdempotencyKey("acme-001"));
 *     if (result.isPartial()) {
 *         // 도메인 설정만 실패: 조직, 테넌트, 관리자, API 키는 사용 가능
 *     }
 * } catch (SetupException e) {
 *     if (e.requiresManualCleanup()) {
 *         ManualCleanupReport report = e.getManualCleanupReport();
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SetupOrchestrator {

    /**
     * 조직 셋업 실행.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>요청 유효성 검증 (실패 시 SetupValidationException, 리소스 생성 없음)</li>
     *   <li>멱등성 키 결정 (없으면 요청 내용으로 생성)</li>
     *   <li>키 예약, 이미 완료된 키면 저장된 결과를 재반환 (리소스 API 호출 없음)</li>
     *   <li>단계별 실행 (일시적 오류는 재시도, 충돌은 기존 리소스 재사용 시도)</li>
     *   <li>필수 단계 실패 시 롤백 후 SetupException</li>
     *   <li>성공 시 결과 저장 후 반환</li>
     * </ol>
     *
     * @param request 셋업 요청
     * @param options 실행 옵션
     * @return 셋업 결과 (도메인 단계 실패 시 partial)
     * @throws IllegalArgumentException request 또는 options가 null인 경우
     * @throws com.ryuqq.orgsetup.core.exception.SetupValidationException 요청이 유효하지 않은 경우
     * @throws com.ryuqq.orgsetup.core.exception.IdempotencyConflictException 키가 진행 중이거나 다른 요청에 사용된 경우
     * @throws SetupException 필수 단계가 실패한 경우
     */
    SetupResult setup(SetupRequest request, SetupOptions options);

    /**
     * 기본 옵션으로 조직 셋업 실행.
     *
     * @param request 셋업 요청
     * @return 셋업 결과
     * @see #setup(SetupRequest, SetupOptions)
     */
    default SetupResult setup(SetupRequest request) {
        return setup(request, SetupOptions.defaults());
    }

    /**
     * 실패한 셋업에 대한 수동 정리 보고서 생성 (롤백을 다시 실행하지 않음).
     *
     * @param failure 셋업 실패 예외
     * @return 수동 정리 보고서
     * @throws IllegalArgumentException failure가 null인 경우
     */
    ManualCleanupReport generateManualCleanupReport(SetupException failure);
}
