package com.ryuqq.orgsetup.core.model;

/**
 * 리소스를 되돌리기 위한 보상 호출 기술자.
 *
 * @param operation HTTP 메서드 (예: DELETE, POST)
 * @param endpoint 보상 엔드포인트 (예: /tenants/tnt_1)
 * @param targetId 보상 대상 ID
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CompensatingAction(
    String operation,
    String endpoint,
    String targetId
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null이거나 빈 문자열인 경우
     */
    public CompensatingAction {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint cannot be null or blank");
        }
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("targetId cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return operation + " " + endpoint;
    }
}
