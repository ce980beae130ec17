package com.ryuqq.orgsetup.core.model;

/**
 * 셋업 과정에서 생성되는 외부 리소스의 종류.
 *
 * <p>각 종류는 보상(compensation) 호출과 수동 정리 절차에 필요한
 * 엔드포인트 정보를 함께 가지고 있습니다.</p>
 *
 * <p><strong>보상 동작:</strong></p>
 * <ul>
 *   <li>ORGANIZATION: DELETE /organizations/{id}</li>
 *   <li>TENANT: DELETE /tenants/{id}</li>
 *   <li>ADMIN_USER: DELETE /admins/{id}</li>
 *   <li>API_KEY: POST /api-keys/{id}/revoke</li>
 *   <li>DOMAIN: DELETE /tenants/{tenantId}/domain</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ResourceKind {

    ORGANIZATION(
        "organization", "DELETE", "/organizations/%s", "/organizations/%s",
        "Remove organization and all associated data"
    ),
    TENANT(
        "tenant", "DELETE", "/tenants/%s", "/tenants/%s",
        "Remove tenant configuration and isolation"
    ),
    ADMIN_USER(
        "admin_user", "DELETE", "/admins/%s", "/admins/%s",
        "Remove admin user account and permissions"
    ),
    API_KEY(
        "api_key", "POST", "/api-keys/%s/revoke", "/api-keys/%s/status",
        "Revoke API key and invalidate all tokens"
    ),
    DOMAIN(
        "domain", "DELETE", "/tenants/%s/domain", "/tenants/%s/domain",
        "Remove custom domain and SSL configuration"
    );

    private final String code;
    private final String compensationMethod;
    private final String cleanupEndpointTemplate;
    private final String verificationEndpointTemplate;
    private final String procedureDescription;

    ResourceKind(
        String code,
        String compensationMethod,
        String cleanupEndpointTemplate,
        String verificationEndpointTemplate,
        String procedureDescription
    ) {
        this.code = code;
        this.compensationMethod = compensationMethod;
        this.cleanupEndpointTemplate = cleanupEndpointTemplate;
        this.verificationEndpointTemplate = verificationEndpointTemplate;
        this.procedureDescription = procedureDescription;
    }

    /**
     * 리소스 종류 코드 (예: "api_key").
     *
     * @return 코드 문자열
     */
    public String code() {
        return code;
    }

    /**
     * 대상 ID에 대한 보상 동작 기술자 생성.
     *
     * @param targetId 보상 대상 ID (DOMAIN의 경우 tenant ID)
     * @return CompensatingAction
     * @throws IllegalArgumentException targetId가 null이거나 빈 문자열인 경우
     */
    public CompensatingAction compensationFor(String targetId) {
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("targetId cannot be null or blank");
        }
        return new CompensatingAction(
            compensationMethod,
            String.format(cleanupEndpointTemplate, targetId),
            targetId
        );
    }

    /**
     * 정리 결과를 확인할 수 있는 조회 엔드포인트.
     *
     * @param targetId 대상 ID
     * @return 검증용 엔드포인트
     */
    public String verificationEndpoint(String targetId) {
        return String.format(verificationEndpointTemplate, targetId);
    }

    /**
     * 수동 정리 절차 설명.
     *
     * @param targetId 대상 ID
     * @return "METHOD endpoint - 설명" 형식의 문자열
     */
    public String manualProcedure(String targetId) {
        return compensationMethod + " " + String.format(cleanupEndpointTemplate, targetId)
            + " - " + procedureDescription;
    }

    /**
     * 정리 후 확인 절차 설명.
     *
     * @param targetId 대상 ID
     * @return 확인 절차 문자열
     */
    public String verificationStep(String targetId) {
        if (this == API_KEY) {
            return "GET " + verificationEndpoint(targetId) + " should report the key as revoked";
        }
        return "GET " + verificationEndpoint(targetId) + " should return 404";
    }
}
