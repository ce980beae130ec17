package com.ryuqq.orgsetup.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SetupRequest 테스트.
 *
 * <p>요청 검증 규칙을 확인합니다:</p>
 * <ul>
 *   <li>필수 필드 (name, adminEmail), adminName 기본값</li>
 *   <li>이메일, 서브도메인, 커스텀 도메인 형식</li>
 *   <li>비밀번호 최소 길이</li>
 *   <li>adminRole 기본값, settings 방어적 복사와 값 타입</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SetupRequestTest {

    private static SetupRequest.Builder valid() {
        return SetupRequest.builder()
            .name("Acme Corp")
            .subdomain("acme")
            .adminName("Jane Admin")
            .adminEmail("admin@acme.com")
            .adminPassword("s3cure-passw0rd");
    }

    @Test
    void violations_ValidRequest_ReturnsEmpty() {
        // When
        SetupRequest request = valid().customDomain("shop.acme.com").build();

        // Then
        assertTrue(request.isValid());
        assertTrue(request.violations().isEmpty());
    }

    @Test
    void violations_MissingRequiredFields_ListsEach() {
        // Given
        SetupRequest request = SetupRequest.builder().build();

        // When
        List<String> violations = request.violations();

        // Then
        assertTrue(violations.contains("name is required"));
        assertTrue(violations.contains("adminEmail is required"));
        assertEquals(2, violations.size(), "Optional fields must not be reported: " + violations);
    }

    @Test
    void constructor_MissingAdminName_UsesDefault() {
        // Given
        SetupRequest request = SetupRequest.builder()
            .name("Acme")
            .subdomain("acme")
            .adminEmail("a@acme.com")
            .build();

        // Then
        assertTrue(request.isValid(), "Violations: " + request.violations());
        assertEquals(SetupRequest.DEFAULT_ADMIN_NAME, request.adminName());
        assertEquals("DPO", valid().adminName("  ").build().adminName());
    }

    @Test
    void violations_InvalidEmail_Reported() {
        SetupRequest request = valid().adminEmail("admin-at-acme").build();

        assertFalse(request.isValid());
        assertTrue(request.violations().get(0).startsWith("adminEmail is not a valid email address"));
    }

    @Test
    void violations_UppercaseSubdomain_Reported() {
        SetupRequest request = valid().subdomain("Acme").build();

        assertEquals(List.of("subdomain must be a lowercase DNS label: Acme"), request.violations());
    }

    @Test
    void violations_InvalidCustomDomain_Reported() {
        SetupRequest request = valid().customDomain("not a domain").build();

        assertFalse(request.isValid());
    }

    @Test
    void violations_ShortPassword_Reported() {
        SetupRequest request = valid().adminPassword("short").build();

        assertEquals(List.of("adminPassword must be at least 8 characters"), request.violations());
    }

    @Test
    void violations_NoPassword_Allowed() {
        SetupRequest request = valid().adminPassword(null).build();

        assertTrue(request.isValid());
    }

    @Test
    void constructor_BlankRole_UsesDefault() {
        SetupRequest request = valid().adminRole(" ").build();

        assertEquals(SetupRequest.DEFAULT_ADMIN_ROLE, request.adminRole());
    }

    @Test
    void constructor_Settings_DefensivelyCopied() {
        // Given
        Map<String, Object> settings = new HashMap<>();
        settings.put("plan", "pro");

        // When
        SetupRequest request = valid().settings(settings).build();
        settings.put("region", "eu");

        // Then
        assertEquals(Map.of("plan", "pro"), request.settings());
        assertThrows(UnsupportedOperationException.class, () -> request.settings().put("x", 1));
    }

    @Test
    void violations_NestedJsonSettings_Allowed() {
        // Given
        Map<String, Object> settings = new HashMap<>();
        settings.put("plan", "pro");
        settings.put("seats", 25);
        settings.put("trial", false);
        settings.put("features", List.of("sso", Map.of("audit", true)));
        settings.put("limits", Map.of("storage", 10.5, "note", "n/a"));
        settings.put("owner", null);

        // When
        SetupRequest request = valid().settings(settings).build();

        // Then
        assertTrue(request.isValid(), "Violations: " + request.violations());
    }

    @Test
    void violations_UnserializableSettingValue_Reported() {
        // Given
        Map<String, Object> settings = new HashMap<>();
        settings.put("plan", "pro");
        settings.put("lock", new Object());
        settings.put("nested", Map.of("stream", List.of(Optional.empty())));

        // When
        List<String> violations = valid().settings(settings).build().violations();

        // Then
        assertEquals(2, violations.size(), "Violations: " + violations);
        assertTrue(violations.contains("settings.lock has an unsupported value type: java.lang.Object"));
        assertTrue(violations.contains("settings.nested.stream[0] has an unsupported value type: java.util.Optional"));
    }

    @Test
    void violations_NonStringSettingKey_Reported() {
        // Given
        Map<Object, Object> nested = new HashMap<>();
        nested.put(42, "answer");
        Map<String, Object> settings = new HashMap<>();
        settings.put("nested", nested);

        // When
        List<String> violations = valid().settings(settings).build().violations();

        // Then
        assertEquals(List.of("settings.nested has a non-string key: 42"), violations);
    }

    @Test
    void toString_NeverContainsPassword() {
        SetupRequest request = valid().build();

        assertFalse(request.toString().contains("s3cure-passw0rd"));
    }
}
