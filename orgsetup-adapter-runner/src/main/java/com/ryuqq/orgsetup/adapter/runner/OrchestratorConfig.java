package com.ryuqq.orgsetup.adapter.runner;

import com.ryuqq.orgsetup.core.model.ApiKeyPolicy;

import java.time.Duration;

/**
 * DefaultSetupOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>retry: 단계 재시도 설정</li>
 *   <li>rollback: 보상 동작 설정</li>
 *   <li>keyTimeBucket: 자동 생성 키의 시간 버킷 (기본 1시간)</li>
 *   <li>inFlightWaitTimeout: 같은 키가 진행 중일 때 완료를 기다리는 시간 (기본 0, 즉시 거절)</li>
 *   <li>inFlightPollInterval: 진행 중 키 폴링 간격 (기본 10ms)</li>
 *   <li>baseDomain: 커스텀 도메인이 없을 때 {@code <subdomain>.<baseDomain>}으로 도메인 구성 (기본 checkout.clubify.com)</li>
 *   <li>apiKeyPolicy: 관리자 API 키 정책</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param retry 재시도 설정
 * @param rollback 롤백 설정
 * @param keyTimeBucket 키 시간 버킷 (1초 이상)
 * @param inFlightWaitTimeout 진행 중 키 대기 시간 (0 이상)
 * @param inFlightPollInterval 폴링 간격 (양수)
 * @param baseDomain 플랫폼 기본 도메인
 * @param apiKeyPolicy API 키 정책
 */
public record OrchestratorConfig(
    RetryConfig retry,
    RollbackConfig rollback,
    Duration keyTimeBucket,
    Duration inFlightWaitTimeout,
    Duration inFlightPollInterval,
    String baseDomain,
    ApiKeyPolicy apiKeyPolicy
) {

    public static final String DEFAULT_BASE_DOMAIN = "checkout.clubify.com";

    /**
     * 기본 설정 생성자.
     */
    public OrchestratorConfig() {
        this(
            new RetryConfig(),
            new RollbackConfig(),
            Duration.ofHours(1),
            Duration.ZERO,
            Duration.ofMillis(10),
            DEFAULT_BASE_DOMAIN,
            new ApiKeyPolicy()
        );
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrchestratorConfig {
        if (retry == null) {
            throw new IllegalArgumentException("retry cannot be null");
        }
        if (rollback == null) {
            throw new IllegalArgumentException("rollback cannot be null");
        }
        if (keyTimeBucket == null || keyTimeBucket.getSeconds() < 1) {
            throw new IllegalArgumentException(
                "keyTimeBucket must be at least 1 second (current: " + keyTimeBucket + ")"
            );
        }
        if (inFlightWaitTimeout == null || inFlightWaitTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "inFlightWaitTimeout cannot be null or negative (current: " + inFlightWaitTimeout + ")"
            );
        }
        if (inFlightPollInterval == null || inFlightPollInterval.isZero() || inFlightPollInterval.isNegative()) {
            throw new IllegalArgumentException(
                "inFlightPollInterval must be positive (current: " + inFlightPollInterval + ")"
            );
        }
        if (baseDomain == null || baseDomain.isBlank()) {
            throw new IllegalArgumentException("baseDomain cannot be null or blank");
        }
        if (apiKeyPolicy == null) {
            throw new IllegalArgumentException("apiKeyPolicy cannot be null");
        }
    }

    /**
     * retry만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withRetry(RetryConfig retry) {
        return new OrchestratorConfig(retry, rollback, keyTimeBucket, inFlightWaitTimeout, inFlightPollInterval, baseDomain, apiKeyPolicy);
    }

    /**
     * rollback만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withRollback(RollbackConfig rollback) {
        return new OrchestratorConfig(retry, rollback, keyTimeBucket, inFlightWaitTimeout, inFlightPollInterval, baseDomain, apiKeyPolicy);
    }

    /**
     * keyTimeBucket만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withKeyTimeBucket(Duration keyTimeBucket) {
        return new OrchestratorConfig(retry, rollback, keyTimeBucket, inFlightWaitTimeout, inFlightPollInterval, baseDomain, apiKeyPolicy);
    }

    /**
     * inFlightWaitTimeout만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withInFlightWaitTimeout(Duration inFlightWaitTimeout) {
        return new OrchestratorConfig(retry, rollback, keyTimeBucket, inFlightWaitTimeout, inFlightPollInterval, baseDomain, apiKeyPolicy);
    }

    /**
     * inFlightPollInterval만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withInFlightPollInterval(Duration inFlightPollInterval) {
        return new OrchestratorConfig(retry, rollback, keyTimeBucket, inFlightWaitTimeout, inFlightPollInterval, baseDomain, apiKeyPolicy);
    }

    /**
     * baseDomain만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withBaseDomain(String baseDomain) {
        return new OrchestratorConfig(retry, rollback, keyTimeBucket, inFlightWaitTimeout, inFlightPollInterval, baseDomain, apiKeyPolicy);
    }

    /**
     * apiKeyPolicy만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withApiKeyPolicy(ApiKeyPolicy apiKeyPolicy) {
        return new OrchestratorConfig(retry, rollback, keyTimeBucket, inFlightWaitTimeout, inFlightPollInterval, baseDomain, apiKeyPolicy);
    }
}
