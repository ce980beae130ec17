package com.ryuqq.orgsetup.core.spi;

import com.ryuqq.orgsetup.core.model.RequestContext;
import com.ryuqq.orgsetup.core.model.resource.AdminUser;
import com.ryuqq.orgsetup.core.model.resource.AdminUserDraft;

import java.util.Optional;

/**
 * 관리자 사용자 리소스 API.
 *
 * <p>모든 메서드는 실패 시 {@link com.ryuqq.orgsetup.core.exception.ResourceApiException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AdminUserService {

    AdminUser create(RequestContext context, String tenantId, AdminUserDraft draft);

    Optional<AdminUser> findById(RequestContext context, String userId);

    Optional<AdminUser> findByEmail(RequestContext context, String tenantId, String email);

    void delete(RequestContext context, String userId);
}
