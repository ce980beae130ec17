package com.ryuqq.orgsetup.adapter.runner;

import com.ryuqq.orgsetup.core.spi.AdminUserService;
import com.ryuqq.orgsetup.core.spi.ApiKeyService;
import com.ryuqq.orgsetup.core.spi.DomainService;
import com.ryuqq.orgsetup.core.spi.OrganizationService;
import com.ryuqq.orgsetup.core.spi.TenantService;

/**
 * 셋업 단계와 보상 동작이 호출하는 리소스 API 묶음.
 *
 * @param organizations 조직 API
 * @param tenants 테넌트 API
 * @param adminUsers 관리자 사용자 API
 * @param apiKeys API 키 API
 * @param domains 도메인 API
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PlatformServices(
    OrganizationService organizations,
    TenantService tenants,
    AdminUserService adminUsers,
    ApiKeyService apiKeys,
    DomainService domains
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 서비스 중 하나라도 null인 경우
     */
    public PlatformServices {
        if (organizations == null || tenants == null || adminUsers == null || apiKeys == null || domains == null) {
            throw new IllegalArgumentException("All platform services are required");
        }
    }
}
