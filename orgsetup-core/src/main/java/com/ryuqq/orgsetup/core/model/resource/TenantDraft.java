package com.ryuqq.orgsetup.core.model.resource;

/**
 * 테넌트 생성 요청 본문.
 *
 * @param name 테넌트 이름
 * @param subdomain 서브도메인 (null 가능)
 * @param customDomain 커스텀 도메인 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TenantDraft(
    String name,
    String subdomain,
    String customDomain
) {
}
