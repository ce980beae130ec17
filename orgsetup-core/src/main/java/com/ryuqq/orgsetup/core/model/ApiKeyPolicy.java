package com.ryuqq.orgsetup.core.model;

/**
 * 관리자 API 키 발급 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scope: 키 범위 (기본 "organization")</li>
 *   <li>autoRotate: 자동 교체 여부 (기본 false)</li>
 *   <li>maxKeyAgeDays: 최대 사용 기간 (기본 90일)</li>
 *   <li>gracePeriodHours: 교체 후 기존 키 유예 시간 (기본 24시간)</li>
 * </ul>
 *
 * @param scope 키 범위
 * @param autoRotate 자동 교체 여부
 * @param maxKeyAgeDays 최대 사용 기간 (일, 양수여야 함)
 * @param gracePeriodHours 유예 시간 (시간, 0 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ApiKeyPolicy(
    String scope,
    boolean autoRotate,
    int maxKeyAgeDays,
    int gracePeriodHours
) {

    /**
     * 기본 정책 생성자.
     *
     * <p>기본값: scope=organization, autoRotate=false, maxKeyAgeDays=90, gracePeriodHours=24</p>
     */
    public ApiKeyPolicy() {
        this("organization", false, 90, 24);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ApiKeyPolicy {
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException("scope cannot be null or blank");
        }
        if (maxKeyAgeDays <= 0) {
            throw new IllegalArgumentException(
                "maxKeyAgeDays must be positive (current: " + maxKeyAgeDays + ")"
            );
        }
        if (gracePeriodHours < 0) {
            throw new IllegalArgumentException(
                "gracePeriodHours cannot be negative (current: " + gracePeriodHours + ")"
            );
        }
        if (gracePeriodHours > maxKeyAgeDays * 24) {
            throw new IllegalArgumentException(
                "gracePeriodHours must not exceed maxKeyAgeDays (grace: " + gracePeriodHours
                    + "h, maxAge: " + maxKeyAgeDays + "d)"
            );
        }
    }

    /**
     * scope만 변경한 새 인스턴스 생성.
     */
    public ApiKeyPolicy withScope(String scope) {
        return new ApiKeyPolicy(scope, autoRotate, maxKeyAgeDays, gracePeriodHours);
    }

    /**
     * autoRotate만 변경한 새 인스턴스 생성.
     */
    public ApiKeyPolicy withAutoRotate(boolean autoRotate) {
        return new ApiKeyPolicy(scope, autoRotate, maxKeyAgeDays, gracePeriodHours);
    }

    /**
     * maxKeyAgeDays만 변경한 새 인스턴스 생성.
     */
    public ApiKeyPolicy withMaxKeyAgeDays(int maxKeyAgeDays) {
        return new ApiKeyPolicy(scope, autoRotate, maxKeyAgeDays, gracePeriodHours);
    }

    /**
     * gracePeriodHours만 변경한 새 인스턴스 생성.
     */
    public ApiKeyPolicy withGracePeriodHours(int gracePeriodHours) {
        return new ApiKeyPolicy(scope, autoRotate, maxKeyAgeDays, gracePeriodHours);
    }
}
