package com.ryuqq.orgsetup.core.model.resource;

/**
 * 관리자 사용자 생성 요청 본문.
 *
 * @param name 이름
 * @param email 이메일
 * @param password 비밀번호 (null이면 초대 메일 방식)
 * @param role 역할
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AdminUserDraft(
    String name,
    String email,
    String password,
    String role
) {

    @Override
    public String toString() {
        return "AdminUserDraft{name=" + name + ", email=" + email + ", role=" + role + '}';
    }
}
