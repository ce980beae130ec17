package com.ryuqq.orgsetup.core.report;

import com.ryuqq.orgsetup.core.model.ResourceHandle;
import com.ryuqq.orgsetup.core.model.ResourceKind;

/**
 * 운영자가 수동으로 정리해야 하는 리소스 하나.
 *
 * @param kind 리소스 종류
 * @param resourceId 리소스 ID
 * @param cleanupEndpoint 정리 호출 (예: "DELETE /tenants/tnt_1")
 * @param verificationEndpoint 정리 확인용 조회 엔드포인트
 * @param verificationStep 확인 절차 설명
 * @param manualProcedure 수동 정리 절차 설명
 * @param lastError 자동 보상 실패 원인 (보상을 시도하지 않았으면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CleanupItem(
    ResourceKind kind,
    String resourceId,
    String cleanupEndpoint,
    String verificationEndpoint,
    String verificationStep,
    String manualProcedure,
    String lastError
) {

    /**
     * 리소스 핸들로부터 정리 항목 생성.
     *
     * @param handle 리소스 핸들
     * @param lastError 자동 보상 실패 원인 (null 가능)
     * @return CleanupItem
     */
    public static CleanupItem from(ResourceHandle handle, String lastError) {
        ResourceKind kind = handle.kind();
        String targetId = handle.compensation().targetId();
        return new CleanupItem(
            kind,
            handle.externalId(),
            handle.compensation().toString(),
            kind.verificationEndpoint(targetId),
            kind.verificationStep(targetId),
            kind.manualProcedure(targetId),
            lastError
        );
    }
}
