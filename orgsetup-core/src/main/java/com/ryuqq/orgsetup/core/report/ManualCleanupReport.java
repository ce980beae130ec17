package com.ryuqq.orgsetup.core.report;

import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import com.ryuqq.orgsetup.core.model.SetupStep;

import java.time.Instant;
import java.util.List;

/**
 * 자동 롤백으로 정리하지 못한 리소스의 수동 정리 보고서.
 *
 * <p>항목은 정리해야 하는 순서(생성의 역순)로 나열됩니다.</p>
 *
 * @param idempotencyKey 실패한 셋업의 멱등성 키 (알 수 없으면 null)
 * @param failurePoint 실패한 단계 (알 수 없으면 null)
 * @param items 정리 항목
 * @param generatedAt 생성 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ManualCleanupReport(
    IdempotencyKey idempotencyKey,
    SetupStep failurePoint,
    List<CleanupItem> items,
    Instant generatedAt
) {

    public ManualCleanupReport {
        if (generatedAt == null) {
            throw new IllegalArgumentException("generatedAt cannot be null");
        }
        items = items == null ? List.of() : List.copyOf(items);
    }

    /**
     * 수동 조치가 필요한지 확인.
     *
     * @return 정리 항목이 하나라도 있으면 true
     */
    public boolean requiresAction() {
        return !items.isEmpty();
    }
}
