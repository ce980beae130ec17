package com.ryuqq.orgsetup.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 조직 셋업 요청.
 *
 * <p>조직, 테넌트, 관리자 사용자, API 키, 도메인 생성에 필요한 입력을 담습니다.
 * 유효성 검증은 생성 시점이 아니라 {@link #violations()}로 수행하여
 * 모든 위반 사항을 한 번에 보고할 수 있도록 합니다.</p>
 *
 * <p><strong>검증 규칙:</strong></p>
 * <ul>
 *   <li>name: 필수</li>
 *   <li>adminEmail: 필수, 이메일 형식</li>
 *   <li>subdomain: 선택, DNS 라벨 형식 (소문자, 숫자, 하이픈)</li>
 *   <li>customDomain: 선택, 호스트명 형식</li>
 *   <li>adminPassword: 선택, 있으면 8자 이상</li>
 *   <li>settings: 키는 null이 아닌 문자열, 값은 JSON으로 표현 가능한 타입
 *       (문자열, 숫자, boolean, enum, 중첩 Map/Collection/배열)</li>
 * </ul>
 *
 * <p>adminName을 지정하지 않으면 {@value #DEFAULT_ADMIN_NAME}을 사용합니다.</p>
 *
 * @param name 조직 이름
 * @param subdomain 서브도메인 (null 가능)
 * @param customDomain 커스텀 도메인 (null 가능)
 * @param adminName 관리자 이름 (기본 DPO)
 * @param adminEmail 관리자 이메일
 * @param adminPassword 관리자 비밀번호 (null 가능)
 * @param adminRole 관리자 역할 (기본 organization_admin)
 * @param settings 조직 설정 (불변 복사본)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SetupRequest(
    String name,
    String subdomain,
    String customDomain,
    String adminName,
    String adminEmail,
    String adminPassword,
    String adminRole,
    Map<String, Object> settings
) {

    public static final String DEFAULT_ADMIN_ROLE = "organization_admin";
    public static final String DEFAULT_ADMIN_NAME = "DPO";

    private static final int MIN_PASSWORD_LENGTH = 8;
    private static final int MAX_SETTINGS_DEPTH = 16;
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern SUBDOMAIN = Pattern.compile("^[a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?$");
    private static final Pattern HOSTNAME = Pattern.compile(
        "^(?=.{1,253}$)([a-zA-Z0-9]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?\\.)+[a-zA-Z]{2,63}$"
    );

    /**
     * Compact Constructor.
     *
     * <p>settings는 방어적으로 복사되며, adminName과 adminRole이 비어 있으면 기본값을 사용합니다.</p>
     */
    public SetupRequest {
        adminName = adminName == null || adminName.isBlank() ? DEFAULT_ADMIN_NAME : adminName;
        adminRole = adminRole == null || adminRole.isBlank() ? DEFAULT_ADMIN_ROLE : adminRole;
        settings = settings == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(settings));
    }

    /**
     * 유효성 위반 사항 목록.
     *
     * @return 위반 메시지 목록 (유효하면 빈 리스트)
     */
    public List<String> violations() {
        List<String> violations = new ArrayList<>();
        if (isBlank(name)) {
            violations.add("name is required");
        }
        if (isBlank(adminEmail)) {
            violations.add("adminEmail is required");
        } else if (!EMAIL.matcher(adminEmail.trim()).matches()) {
            violations.add("adminEmail is not a valid email address: " + adminEmail);
        }
        if (subdomain != null && !SUBDOMAIN.matcher(subdomain).matches()) {
            violations.add("subdomain must be a lowercase DNS label: " + subdomain);
        }
        if (customDomain != null && !HOSTNAME.matcher(customDomain).matches()) {
            violations.add("customDomain is not a valid hostname: " + customDomain);
        }
        if (adminPassword != null && adminPassword.length() < MIN_PASSWORD_LENGTH) {
            violations.add("adminPassword must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        collectSettingViolations("settings", settings, 0, violations);
        return violations;
    }

    private static void collectSettingViolations(String path, Object value, int depth, List<String> violations) {
        if (depth > MAX_SETTINGS_DEPTH) {
            violations.add(path + " is nested deeper than " + MAX_SETTINGS_DEPTH + " levels");
            return;
        }
        if (value == null || value instanceof String || value instanceof Number
            || value instanceof Boolean || value instanceof Enum<?>) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    violations.add(path + " has a non-string key: " + entry.getKey());
                    continue;
                }
                collectSettingViolations(path + "." + key, entry.getValue(), depth + 1, violations);
            }
            return;
        }
        if (value instanceof Collection<?> collection) {
            int index = 0;
            for (Object element : collection) {
                collectSettingViolations(path + "[" + index++ + "]", element, depth + 1, violations);
            }
            return;
        }
        if (value instanceof Object[] array) {
            for (int i = 0; i < array.length; i++) {
                collectSettingViolations(path + "[" + i + "]", array[i], depth + 1, violations);
            }
            return;
        }
        violations.add(path + " has an unsupported value type: " + value.getClass().getName());
    }

    /**
     * 유효한 요청인지 확인.
     *
     * @return 위반 사항이 없으면 true
     */
    public boolean isValid() {
        return violations().isEmpty();
    }

    /**
     * 비밀번호를 가린 문자열 표현.
     */
    @Override
    public String toString() {
        return "SetupRequest{name=" + name
            + ", subdomain=" + subdomain
            + ", customDomain=" + customDomain
            + ", adminEmail=" + adminEmail
            + ", adminRole=" + adminRole + '}';
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Builder 생성.
     *
     * @return 새 Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * SetupRequest Builder.
     */
    public static final class Builder {

        private String name;
        private String subdomain;
        private String customDomain;
        private String adminName;
        private String adminEmail;
        private String adminPassword;
        private String adminRole;
        private final Map<String, Object> settings = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder subdomain(String subdomain) {
            this.subdomain = subdomain;
            return this;
        }

        public Builder customDomain(String customDomain) {
            this.customDomain = customDomain;
            return this;
        }

        public Builder adminName(String adminName) {
            this.adminName = adminName;
            return this;
        }

        public Builder adminEmail(String adminEmail) {
            this.adminEmail = adminEmail;
            return this;
        }

        public Builder adminPassword(String adminPassword) {
            this.adminPassword = adminPassword;
            return this;
        }

        public Builder adminRole(String adminRole) {
            this.adminRole = adminRole;
            return this;
        }

        public Builder setting(String key, Object value) {
            this.settings.put(key, value);
            return this;
        }

        public Builder settings(Map<String, Object> settings) {
            this.settings.clear();
            if (settings != null) {
                this.settings.putAll(settings);
            }
            return this;
        }

        public SetupRequest build() {
            return new SetupRequest(
                name, subdomain, customDomain, adminName, adminEmail, adminPassword, adminRole, settings
            );
        }
    }
}
