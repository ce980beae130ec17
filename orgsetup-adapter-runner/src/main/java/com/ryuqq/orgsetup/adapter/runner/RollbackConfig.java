package com.ryuqq.orgsetup.adapter.runner;

import java.time.Duration;

/**
 * 롤백 보상 동작 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 리소스당 보상 호출 최대 시도 횟수 (기본 3)</li>
 *   <li>baseDelay: 보상 재시도 기본 대기 시간 (기본 5초, 재시도마다 2배)</li>
 *   <li>maxDelay: 보상 재시도 최대 대기 시간 (기본 60초)</li>
 *   <li>interProcedureDelay: 리소스 사이 대기 시간 (기본 0)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param baseDelay 기본 대기 시간 (양수)
 * @param maxDelay 최대 대기 시간 (baseDelay 이상)
 * @param interProcedureDelay 리소스 사이 대기 시간 (0 이상)
 */
public record RollbackConfig(
    int maxAttempts,
    Duration baseDelay,
    Duration maxDelay,
    Duration interProcedureDelay
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, baseDelay=5s, maxDelay=60s, interProcedureDelay=0</p>
     */
    public RollbackConfig() {
        this(3, Duration.ofSeconds(5), Duration.ofSeconds(60), Duration.ZERO);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RollbackConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelay == null || baseDelay.isZero() || baseDelay.isNegative()) {
            throw new IllegalArgumentException(
                "baseDelay must be positive (current: " + baseDelay + ")"
            );
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (interProcedureDelay == null || interProcedureDelay.isNegative()) {
            throw new IllegalArgumentException(
                "interProcedureDelay cannot be null or negative (current: " + interProcedureDelay + ")"
            );
        }
    }

    /**
     * 보상 재시도용 RetryConfig (jitter 없음, 배수 2.0).
     *
     * @return RetryConfig
     */
    public RetryConfig toRetryConfig() {
        return new RetryConfig(baseDelay, 2.0, maxDelay, maxAttempts, 0.0);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RollbackConfig withMaxAttempts(int maxAttempts) {
        return new RollbackConfig(maxAttempts, baseDelay, maxDelay, interProcedureDelay);
    }

    /**
     * baseDelay만 변경한 새 인스턴스 생성.
     */
    public RollbackConfig withBaseDelay(Duration baseDelay) {
        return new RollbackConfig(maxAttempts, baseDelay, maxDelay, interProcedureDelay);
    }

    /**
     * maxDelay만 변경한 새 인스턴스 생성.
     */
    public RollbackConfig withMaxDelay(Duration maxDelay) {
        return new RollbackConfig(maxAttempts, baseDelay, maxDelay, interProcedureDelay);
    }

    /**
     * interProcedureDelay만 변경한 새 인스턴스 생성.
     */
    public RollbackConfig withInterProcedureDelay(Duration interProcedureDelay) {
        return new RollbackConfig(maxAttempts, baseDelay, maxDelay, interProcedureDelay);
    }
}
