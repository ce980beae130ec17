package com.ryuqq.orgsetup.core.model.resource;

import java.util.Map;

/**
 * 조직 생성 요청 본문.
 *
 * @param name 조직 이름
 * @param subdomain 서브도메인 (null 가능)
 * @param customDomain 커스텀 도메인 (null 가능)
 * @param contactEmail 연락처 이메일
 * @param settings 조직 설정
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OrganizationDraft(
    String name,
    String subdomain,
    String customDomain,
    String contactEmail,
    Map<String, Object> settings
) {
}
