package com.ryuqq.orgsetup.core.report;

import com.ryuqq.orgsetup.core.model.ResourceHandle;

/**
 * 리소스 하나에 대한 보상 동작 결과.
 *
 * @param handle 대상 리소스 핸들
 * @param status 결과 상태
 * @param attempts 보상 호출 시도 횟수 (SKIPPED는 0)
 * @param lastError 마지막 오류 메시지 (성공 시 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CompensationResult(
    ResourceHandle handle,
    CompensationStatus status,
    int attempts,
    String lastError
) {

    public CompensationResult {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts cannot be negative (current: " + attempts + ")");
        }
    }

    public static CompensationResult compensated(ResourceHandle handle, int attempts) {
        return new CompensationResult(handle, CompensationStatus.COMPENSATED, attempts, null);
    }

    public static CompensationResult skipped(ResourceHandle handle) {
        return new CompensationResult(handle, CompensationStatus.SKIPPED, 0, null);
    }

    public static CompensationResult failed(ResourceHandle handle, int attempts, String lastError) {
        return new CompensationResult(handle, CompensationStatus.FAILED, attempts, lastError);
    }

    public boolean isFailed() {
        return status == CompensationStatus.FAILED;
    }
}
