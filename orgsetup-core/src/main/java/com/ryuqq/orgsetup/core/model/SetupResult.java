package com.ryuqq.orgsetup.core.model;

import com.ryuqq.orgsetup.core.model.resource.AdminUser;
import com.ryuqq.orgsetup.core.model.resource.ApiKey;
import com.ryuqq.orgsetup.core.model.resource.DomainConfig;
import com.ryuqq.orgsetup.core.model.resource.Organization;
import com.ryuqq.orgsetup.core.model.resource.Tenant;

/**
 * 조직 셋업 결과.
 *
 * <p>조직, 테넌트, 관리자, API 키는 항상 존재합니다. 도메인 설정은
 * 건너뛰었거나 실패한 경우 null입니다.</p>
 *
 * @param organization 조직
 * @param tenant 테넌트
 * @param adminUser 관리자 사용자
 * @param apiKey API 키
 * @param domain 도메인 설정 (null 가능)
 * @param metadata 실행 메타데이터
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SetupResult(
    Organization organization,
    Tenant tenant,
    AdminUser adminUser,
    ApiKey apiKey,
    DomainConfig domain,
    SetupMetadata metadata
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 리소스 또는 metadata가 null인 경우
     */
    public SetupResult {
        if (organization == null || tenant == null || adminUser == null || apiKey == null) {
            throw new IllegalArgumentException("organization, tenant, adminUser and apiKey are required");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
    }

    /**
     * 부분 성공 여부.
     *
     * @return 도메인 설정이 실패했으면 true
     */
    public boolean isPartial() {
        return metadata.partial();
    }

    /**
     * 저장된 결과를 재반환한 복사본.
     *
     * <p>리소스는 그대로이며 메타데이터의 replayed만 true가 됩니다.</p>
     *
     * @return 재반환용 SetupResult
     */
    public SetupResult asReplay() {
        return new SetupResult(organization, tenant, adminUser, apiKey, domain, metadata.asReplay());
    }
}
