package com.ryuqq.orgsetup.core.model;

import java.time.Instant;

/**
 * 셋업 과정에서 확보한 외부 리소스의 핸들.
 *
 * <p>ResourceRegistry에 단계 순서대로 기록되며, 롤백 시 역순으로 보상 동작이 수행됩니다.</p>
 *
 * <p><strong>소유 여부(owned):</strong></p>
 * <ul>
 *   <li>true: 이번 실행이 직접 생성한 리소스 (롤백 대상)</li>
 *   <li>false: 충돌 해결로 재사용한 기존 리소스 (롤백 시 건너뜀)</li>
 * </ul>
 *
 * @param kind 리소스 종류
 * @param externalId 외부 시스템의 리소스 ID
 * @param createdAt 확보 시각
 * @param compensation 보상 동작 기술자
 * @param owned 이번 실행이 생성했는지 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ResourceHandle(
    ResourceKind kind,
    String externalId,
    Instant createdAt,
    CompensatingAction compensation,
    boolean owned
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 externalId가 빈 문자열인 경우
     */
    public ResourceHandle {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("externalId cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (compensation == null) {
            throw new IllegalArgumentException("compensation cannot be null");
        }
    }

    /**
     * 이번 실행이 생성한 리소스 핸들.
     *
     * @param kind 리소스 종류
     * @param externalId 리소스 ID
     * @param compensationTargetId 보상 호출 대상 ID (대부분 externalId와 동일, DOMAIN은 tenant ID)
     * @param createdAt 생성 시각
     * @return owned=true 핸들
     */
    public static ResourceHandle created(ResourceKind kind, String externalId, String compensationTargetId, Instant createdAt) {
        return new ResourceHandle(kind, externalId, createdAt, kind.compensationFor(compensationTargetId), true);
    }

    /**
     * 충돌 해결로 재사용한 리소스 핸들.
     *
     * @param kind 리소스 종류
     * @param externalId 리소스 ID
     * @param compensationTargetId 보상 호출 대상 ID
     * @param resolvedAt 재사용 확정 시각
     * @return owned=false 핸들
     */
    public static ResourceHandle reused(ResourceKind kind, String externalId, String compensationTargetId, Instant resolvedAt) {
        return new ResourceHandle(kind, externalId, resolvedAt, kind.compensationFor(compensationTargetId), false);
    }
}
