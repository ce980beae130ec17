package com.ryuqq.orgsetup.core.spi;

import com.ryuqq.orgsetup.core.model.ApiKeyPolicy;
import com.ryuqq.orgsetup.core.model.RequestContext;
import com.ryuqq.orgsetup.core.model.resource.ApiKey;

/**
 * API 키 발급 API.
 *
 * <p>모든 메서드는 실패 시 {@link com.ryuqq.orgsetup.core.exception.ResourceApiException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ApiKeyService {

    ApiKey generate(RequestContext context, String userId, ApiKeyPolicy policy);

    void revoke(RequestContext context, String keyId);
}
