package com.ryuqq.orgsetup.core.model.resource;

import java.time.Instant;

/**
 * 관리자에게 발급된 API 키.
 *
 * <p>secret은 toString에 노출하지 않습니다.</p>
 *
 * @param id 키 ID
 * @param userId 소유 사용자 ID
 * @param secret 키 값
 * @param scope 키 범위
 * @param expiresAt 만료 시각 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ApiKey(
    String id,
    String userId,
    String secret,
    String scope,
    Instant expiresAt
) {

    public ApiKey {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return "ApiKey{id=" + id + ", userId=" + userId + ", scope=" + scope + ", expiresAt=" + expiresAt + '}';
    }
}
