package com.ryuqq.orgsetup.core.model;

import java.util.List;
import java.util.Map;

/**
 * 분류된 충돌 정보.
 *
 * <p>충돌 응답에서 추출한 정보를 담으며, ConflictResolver가 기존 리소스를
 * 재사용할 수 있는지 판단하는 데 사용됩니다.</p>
 *
 * @param type 충돌 유형
 * @param step 충돌이 발생한 단계
 * @param fields 충돌한 필드 이름 목록
 * @param existingResourceId 기존 리소스 ID (알 수 없으면 null)
 * @param existingValues 기존 리소스의 충돌 필드 값
 * @param suggestions 해결 제안
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ConflictRecord(
    ConflictType type,
    SetupStep step,
    List<String> fields,
    String existingResourceId,
    Map<String, String> existingValues,
    List<String> suggestions
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException type 또는 step이 null인 경우
     */
    public ConflictRecord {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        fields = fields == null ? List.of() : List.copyOf(fields);
        existingValues = existingValues == null ? Map.of() : Map.copyOf(existingValues);
        suggestions = suggestions == null ? type.suggestions() : List.copyOf(suggestions);
    }

    /**
     * 기존 리소스 ID를 알고 있는지 확인.
     *
     * @return existingResourceId가 있으면 true
     */
    public boolean hasExistingResourceId() {
        return existingResourceId != null && !existingResourceId.isBlank();
    }

    /**
     * 기존 리소스를 조회할 수 있는 엔드포인트 (ID를 모르면 null).
     *
     * @return 조회 엔드포인트 또는 null
     */
    public String retrievalEndpoint() {
        if (!hasExistingResourceId()) {
            return null;
        }
        return step.resourceKind().verificationEndpoint(existingResourceId);
    }
}
