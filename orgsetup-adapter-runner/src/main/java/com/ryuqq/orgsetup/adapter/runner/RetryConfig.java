package com.ryuqq.orgsetup.adapter.runner;

import java.time.Duration;

/**
 * 단계 재시도 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>baseDelay: 첫 재시도 전 대기 시간 (기본 1초)</li>
 *   <li>multiplier: 지수 배수 (기본 2.0)</li>
 *   <li>maxDelay: 최대 대기 시간 (기본 60초)</li>
 *   <li>maxAttempts: 단계당 최대 시도 횟수, 첫 시도 포함 (기본 3)</li>
 *   <li>jitterFactor: Jitter 비율 (기본 0.1)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param baseDelay 기본 대기 시간 (양수여야 함)
 * @param multiplier 지수 배수 (1.0 이상)
 * @param maxDelay 최대 대기 시간 (baseDelay 이상)
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 */
public record RetryConfig(
    Duration baseDelay,
    double multiplier,
    Duration maxDelay,
    int maxAttempts,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: baseDelay=1s, multiplier=2.0, maxDelay=60s, maxAttempts=3, jitterFactor=0.1</p>
     */
    public RetryConfig() {
        this(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60), 3, 0.1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (baseDelay == null || baseDelay.isZero() || baseDelay.isNegative()) {
            throw new IllegalArgumentException(
                "baseDelay must be positive (current: " + baseDelay + ")"
            );
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException(
                "multiplier must be >= 1.0 (current: " + multiplier + ")"
            );
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * baseDelay만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withBaseDelay(Duration baseDelay) {
        return new RetryConfig(baseDelay, multiplier, maxDelay, maxAttempts, jitterFactor);
    }

    /**
     * multiplier만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withMultiplier(double multiplier) {
        return new RetryConfig(baseDelay, multiplier, maxDelay, maxAttempts, jitterFactor);
    }

    /**
     * maxDelay만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withMaxDelay(Duration maxDelay) {
        return new RetryConfig(baseDelay, multiplier, maxDelay, maxAttempts, jitterFactor);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(baseDelay, multiplier, maxDelay, maxAttempts, jitterFactor);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withJitterFactor(double jitterFactor) {
        return new RetryConfig(baseDelay, multiplier, maxDelay, maxAttempts, jitterFactor);
    }
}
