package com.ryuqq.orgsetup.core.model.resource;

/**
 * 테넌트에 연결된 도메인 설정.
 *
 * @param tenantId 테넌트 ID
 * @param domain 도메인 호스트명
 * @param verified DNS 검증 완료 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DomainConfig(
    String tenantId,
    String domain,
    boolean verified
) {

    public DomainConfig {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be null or blank");
        }
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain cannot be null or blank");
        }
    }
}
