package com.ryuqq.orgsetup.core.spi;

import com.ryuqq.orgsetup.core.model.RequestContext;
import com.ryuqq.orgsetup.core.model.resource.Tenant;
import com.ryuqq.orgsetup.core.model.resource.TenantDraft;

import java.util.Optional;

/**
 * 테넌트 리소스 API.
 *
 * <p>모든 메서드는 실패 시 {@link com.ryuqq.orgsetup.core.exception.ResourceApiException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TenantService {

    Tenant create(RequestContext context, String organizationId, TenantDraft draft);

    Optional<Tenant> findById(RequestContext context, String tenantId);

    void delete(RequestContext context, String tenantId);
}
