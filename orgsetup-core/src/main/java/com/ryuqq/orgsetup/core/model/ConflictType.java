package com.ryuqq.orgsetup.core.model;

import java.util.List;

/**
 * 리소스 생성 시 발생하는 충돌(409) 유형.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ConflictType {

    SUBDOMAIN_EXISTS("subdomain_exists", List.of(
        "Try alternative subdomain suggestions",
        "Use idempotency key to safely retry operation",
        "Reuse the existing tenant if it belongs to this organization"
    )),
    EMAIL_EXISTS("email_exists", List.of(
        "Use a different email address for the admin user",
        "Use idempotency key to safely retry operation",
        "Reuse the existing user if it belongs to this tenant"
    )),
    DOMAIN_EXISTS("domain_exists", List.of(
        "Choose a different custom domain",
        "Remove the domain from the tenant that currently owns it",
        "Complete setup without a custom domain"
    )),
    ORGANIZATION_EXISTS("organization_exists", List.of(
        "Use idempotency key to safely retry operation",
        "Reuse the existing organization if the name and subdomain match",
        "Choose a different organization name"
    )),
    UNKNOWN("unknown", List.of(
        "Check existing resources",
        "Contact support if issue persists"
    ));

    private final String code;
    private final List<String> suggestions;

    ConflictType(String code, List<String> suggestions) {
        this.code = code;
        this.suggestions = suggestions;
    }

    /**
     * 충돌 코드 (예: "email_exists").
     *
     * @return 코드 문자열
     */
    public String code() {
        return code;
    }

    /**
     * 충돌 유형별 기본 해결 제안.
     *
     * @return 불변 리스트
     */
    public List<String> suggestions() {
        return suggestions;
    }

    /**
     * 코드 문자열로 충돌 유형 조회.
     *
     * <p>알 수 없는 코드는 {@link #UNKNOWN}으로 매핑됩니다.</p>
     *
     * @param code 충돌 코드
     * @return ConflictType
     */
    public static ConflictType fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        for (ConflictType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
