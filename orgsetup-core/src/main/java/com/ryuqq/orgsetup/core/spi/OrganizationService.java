package com.ryuqq.orgsetup.core.spi;

import com.ryuqq.orgsetup.core.model.RequestContext;
import com.ryuqq.orgsetup.core.model.resource.Organization;
import com.ryuqq.orgsetup.core.model.resource.OrganizationDraft;

import java.util.Optional;

/**
 * 조직 리소스 API.
 *
 * <p>모든 메서드는 실패 시 {@link com.ryuqq.orgsetup.core.exception.ResourceApiException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface OrganizationService {

    Organization create(RequestContext context, OrganizationDraft draft);

    Optional<Organization> findById(RequestContext context, String organizationId);

    Optional<Organization> findBySubdomain(RequestContext context, String subdomain);

    Optional<Organization> findByDomain(RequestContext context, String domain);

    void delete(RequestContext context, String organizationId);
}
