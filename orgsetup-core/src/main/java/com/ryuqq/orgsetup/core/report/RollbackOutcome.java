package com.ryuqq.orgsetup.core.report;

import java.util.List;

/**
 * 롤백 실행 결과.
 *
 * <p>results는 보상을 수행한 순서(생성의 역순)입니다.
 * 실패한 항목은 manualCleanupReport에 포함됩니다.</p>
 *
 * @param results 리소스별 보상 결과
 * @param manualCleanupReport 수동 정리 보고서 (실패가 없으면 항목이 비어 있음)
 * @param interrupted 롤백 도중 인터럽트가 발생했는지 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RollbackOutcome(
    List<CompensationResult> results,
    ManualCleanupReport manualCleanupReport,
    boolean interrupted
) {

    public RollbackOutcome {
        if (manualCleanupReport == null) {
            throw new IllegalArgumentException("manualCleanupReport cannot be null");
        }
        results = results == null ? List.of() : List.copyOf(results);
    }

    /**
     * 모든 소유 리소스가 보상되었는지 확인.
     *
     * @return 실패 항목이 없으면 true
     */
    public boolean isFullySuccessful() {
        return results.stream().noneMatch(CompensationResult::isFailed);
    }

    public long count(CompensationStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }
}
