package com.ryuqq.orgsetup.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ApiKeyPolicy 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ApiKeyPolicyTest {

    @Test
    void defaultConstructor_OrganizationScopeNinetyDays() {
        // When
        ApiKeyPolicy policy = new ApiKeyPolicy();

        // Then
        assertEquals("organization", policy.scope());
        assertFalse(policy.autoRotate());
        assertEquals(90, policy.maxKeyAgeDays());
        assertEquals(24, policy.gracePeriodHours());
    }

    @Test
    void withMethods_ChangeOnlyOneField() {
        // Given
        ApiKeyPolicy policy = new ApiKeyPolicy();

        // When
        ApiKeyPolicy rotated = policy.withAutoRotate(true).withMaxKeyAgeDays(30);

        // Then
        assertTrue(rotated.autoRotate());
        assertEquals(30, rotated.maxKeyAgeDays());
        assertEquals(policy.scope(), rotated.scope());
        assertEquals(policy.gracePeriodHours(), rotated.gracePeriodHours());
    }

    @Test
    void constructor_InvalidValues_ThrowsException() {
        ApiKeyPolicy policy = new ApiKeyPolicy();

        assertThrows(IllegalArgumentException.class, () -> policy.withMaxKeyAgeDays(0));
        assertThrows(IllegalArgumentException.class, () -> policy.withGracePeriodHours(-1));
        assertThrows(IllegalArgumentException.class, () -> policy.withScope(""));
    }

    @Test
    void constructor_GracePeriodLongerThanKeyAge_ThrowsException() {
        // Given
        ApiKeyPolicy oneDay = new ApiKeyPolicy().withMaxKeyAgeDays(1);

        // When & Then
        assertEquals(24, oneDay.gracePeriodHours());
        IllegalArgumentException exception =
            assertThrows(IllegalArgumentException.class, () -> oneDay.withGracePeriodHours(25));
        assertTrue(exception.getMessage().contains("gracePeriodHours must not exceed maxKeyAgeDays"));
    }
}
