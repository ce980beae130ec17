package com.ryuqq.orgsetup.core.spi;

import com.ryuqq.orgsetup.core.model.RequestContext;
import com.ryuqq.orgsetup.core.model.resource.DomainConfig;

import java.util.Optional;

/**
 * 테넌트 도메인 설정 API.
 *
 * <p>모든 메서드는 실패 시 {@link com.ryuqq.orgsetup.core.exception.ResourceApiException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DomainService {

    DomainConfig configure(RequestContext context, String tenantId, String domain);

    Optional<DomainConfig> find(RequestContext context, String tenantId);

    void remove(RequestContext context, String tenantId);
}
