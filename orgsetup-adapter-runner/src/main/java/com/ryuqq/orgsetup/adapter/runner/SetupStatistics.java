package com.ryuqq.orgsetup.adapter.runner;

/**
 * 셋업 통계 스냅샷.
 *
 * @param setupsStarted 시작된 셋업 수 (재반환 제외)
 * @param setupsCompleted 성공한 셋업 수 (부분 성공 포함)
 * @param setupsPartial 부분 성공 수
 * @param setupsFailed 실패한 셋업 수
 * @param replays 저장된 결과를 재반환한 수
 * @param retries 단계 재시도 수
 * @param conflictsResolved 기존 리소스 재사용으로 해결한 충돌 수
 * @param compensationsFailed 실패한 보상 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SetupStatistics(
    long setupsStarted,
    long setupsCompleted,
    long setupsPartial,
    long setupsFailed,
    long replays,
    long retries,
    long conflictsResolved,
    long compensationsFailed
) {

    /**
     * 시작된 셋업 대비 성공 비율.
     *
     * @return 0.0 ~ 1.0 (시작된 셋업이 없으면 0.0)
     */
    public double successRate() {
        return setupsStarted == 0 ? 0.0 : (double) setupsCompleted / setupsStarted;
    }

    /**
     * 시작된 셋업당 평균 재시도 수.
     *
     * @return 평균 재시도 수 (시작된 셋업이 없으면 0.0)
     */
    public double averageRetriesPerSetup() {
        return setupsStarted == 0 ? 0.0 : (double) retries / setupsStarted;
    }
}
