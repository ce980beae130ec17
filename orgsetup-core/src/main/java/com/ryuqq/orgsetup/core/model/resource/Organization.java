package com.ryuqq.orgsetup.core.model.resource;

/**
 * 조직 리소스.
 *
 * @param id 조직 ID
 * @param name 조직 이름
 * @param subdomain 서브도메인 (null 가능)
 * @param customDomain 커스텀 도메인 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Organization(
    String id,
    String name,
    String subdomain,
    String customDomain
) {

    public Organization {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }
}
