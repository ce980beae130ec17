package com.ryuqq.orgsetup.core.model.resource;

/**
 * 테넌트 관리자 사용자 리소스.
 *
 * @param id 사용자 ID
 * @param tenantId 소속 테넌트 ID
 * @param name 이름
 * @param email 이메일
 * @param role 역할 (예: organization_admin)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AdminUser(
    String id,
    String tenantId,
    String name,
    String email,
    String role
) {

    public AdminUser {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be null or blank");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email cannot be null or blank");
        }
    }
}
