package com.ryuqq.orgsetup.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * 셋업 한 번의 실행 동안 모든 협력자 호출에 전달되는 불변 컨텍스트.
 *
 * <p>각 단계가 끝나면 생성된 ID를 담은 새 컨텍스트가 만들어지며,
 * 이전 컨텍스트는 변경되지 않습니다.</p>
 *
 * @param correlationId 실행 추적용 ID
 * @param idempotencyKey 멱등성 키 (독립 롤백 등에서는 null 가능)
 * @param organizationId 생성된 조직 ID (아직 없으면 null)
 * @param tenantId 생성된 테넌트 ID (아직 없으면 null)
 * @param adminUserId 생성된 관리자 ID (아직 없으면 null)
 * @param deadline 호출자 마감 시각 (없으면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RequestContext(
    String correlationId,
    IdempotencyKey idempotencyKey,
    String organizationId,
    String tenantId,
    String adminUserId,
    Instant deadline
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException correlationId가 null이거나 빈 문자열인 경우
     */
    public RequestContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId cannot be null or blank");
        }
    }

    /**
     * 새 실행 컨텍스트 생성 (correlationId는 UUID).
     *
     * @param idempotencyKey 멱등성 키 (null 가능)
     * @param deadline 마감 시각 (null 가능)
     * @return RequestContext
     */
    public static RequestContext start(IdempotencyKey idempotencyKey, Instant deadline) {
        return new RequestContext(UUID.randomUUID().toString(), idempotencyKey, null, null, null, deadline);
    }

    /**
     * 셋업 실행과 무관한 작업(독립 롤백 등)용 컨텍스트.
     *
     * @return 키와 마감 시각이 없는 RequestContext
     */
    public static RequestContext detached() {
        return start(null, null);
    }

    public RequestContext withOrganizationId(String organizationId) {
        return new RequestContext(correlationId, idempotencyKey, organizationId, tenantId, adminUserId, deadline);
    }

    public RequestContext withTenantId(String tenantId) {
        return new RequestContext(correlationId, idempotencyKey, organizationId, tenantId, adminUserId, deadline);
    }

    public RequestContext withAdminUserId(String adminUserId) {
        return new RequestContext(correlationId, idempotencyKey, organizationId, tenantId, adminUserId, deadline);
    }

    /**
     * 마감 시각이 지났는지 확인.
     *
     * @param now 현재 시각
     * @return deadline이 있고 now가 deadline 이후(같음 포함)이면 true
     */
    public boolean isExpired(Instant now) {
        return deadline != null && !now.isBefore(deadline);
    }
}
