package com.ryuqq.orgsetup.core.model;

import java.time.Duration;

/**
 * 재시도 가능한 단계 하나의 재시도 상태 (불변).
 *
 * <p>단계마다 {@link #initial()}에서 시작하여 실패할 때마다
 * {@link #recordFailure(Throwable, Duration)}로 새 상태를 만듭니다.</p>
 *
 * @param attemptCount 지금까지 수행한 시도 횟수
 * @param cumulativeDelay 누적 대기 시간
 * @param lastError 마지막 오류 (없으면 null)
 * @param nextDelay 다음 시도 전 대기 시간
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RetryState(
    int attemptCount,
    Duration cumulativeDelay,
    Throwable lastError,
    Duration nextDelay
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException attemptCount가 음수이거나 Duration이 null/음수인 경우
     */
    public RetryState {
        if (attemptCount < 0) {
            throw new IllegalArgumentException("attemptCount cannot be negative (current: " + attemptCount + ")");
        }
        if (cumulativeDelay == null || cumulativeDelay.isNegative()) {
            throw new IllegalArgumentException("cumulativeDelay cannot be null or negative");
        }
        if (nextDelay == null || nextDelay.isNegative()) {
            throw new IllegalArgumentException("nextDelay cannot be null or negative");
        }
    }

    /**
     * 최초 상태 (시도 0회).
     *
     * @return 초기 RetryState
     */
    public static RetryState initial() {
        return new RetryState(0, Duration.ZERO, null, Duration.ZERO);
    }

    /**
     * 실패를 기록한 새 상태 생성.
     *
     * @param error 실패 원인
     * @param delay 다음 시도 전 대기 시간
     * @return attemptCount가 1 증가한 새 RetryState
     */
    public RetryState recordFailure(Throwable error, Duration delay) {
        return new RetryState(attemptCount + 1, cumulativeDelay.plus(delay), error, delay);
    }
}
