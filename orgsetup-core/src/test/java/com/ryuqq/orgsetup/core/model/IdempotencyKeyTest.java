package com.ryuqq.orgsetup.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IdempotencyKey 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class IdempotencyKeyTest {

    @Test
    void of_ValidValue_CreatesKey() {
        // When
        IdempotencyKey key = IdempotencyKey.of("org_setup_493000_ab12:v1.0");

        // Then
        assertEquals("org_setup_493000_ab12:v1.0", key.getValue());
    }

    @Test
    void of_NullOrBlank_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> IdempotencyKey.of(null));
        assertThrows(IllegalArgumentException.class, () -> IdempotencyKey.of("  "));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> IdempotencyKey.of("key with spaces"));
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void of_TooLong_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> IdempotencyKey.of("a".repeat(256)));
        assertDoesNotThrow(() -> IdempotencyKey.of("a".repeat(255)));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        // Given
        IdempotencyKey key1 = IdempotencyKey.of("idem-001");
        IdempotencyKey key2 = IdempotencyKey.of("idem-001");

        // Then
        assertEquals(key1, key2);
        assertEquals(key1.hashCode(), key2.hashCode());
        assertNotEquals(key1, IdempotencyKey.of("idem-002"));
    }
}
