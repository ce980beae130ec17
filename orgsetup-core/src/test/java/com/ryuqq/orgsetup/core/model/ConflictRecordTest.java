package com.ryuqq.orgsetup.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConflictRecord, ConflictType 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ConflictRecordTest {

    @Test
    void conflictType_FromCode_IsCaseInsensitiveWithUnknownFallback() {
        assertEquals(ConflictType.EMAIL_EXISTS, ConflictType.fromCode("EMAIL_EXISTS"));
        assertEquals(ConflictType.DOMAIN_EXISTS, ConflictType.fromCode("domain_exists"));
        assertEquals(ConflictType.UNKNOWN, ConflictType.fromCode("something_else"));
        assertEquals(ConflictType.UNKNOWN, ConflictType.fromCode(null));
    }

    @Test
    void constructor_NoSuggestions_UsesTypeDefaults() {
        // When
        ConflictRecord record = new ConflictRecord(
            ConflictType.SUBDOMAIN_EXISTS, SetupStep.TENANT_CREATION, null, null, null, null);

        // Then
        assertEquals(ConflictType.SUBDOMAIN_EXISTS.suggestions(), record.suggestions());
        assertEquals(List.of(), record.fields());
        assertEquals(Map.of(), record.existingValues());
        assertFalse(record.hasExistingResourceId());
        assertNull(record.retrievalEndpoint());
    }

    @Test
    void constructor_Fields_DefensivelyCopied() {
        // Given
        List<String> fields = new ArrayList<>(List.of("subdomain"));

        // When
        ConflictRecord record = new ConflictRecord(
            ConflictType.SUBDOMAIN_EXISTS, SetupStep.TENANT_CREATION, fields, "tenant_1", null, null);
        fields.add("name");

        // Then
        assertEquals(List.of("subdomain"), record.fields());
    }

    @Test
    void retrievalEndpoint_WithExistingId_UsesStepResourceKind() {
        // When
        ConflictRecord record = new ConflictRecord(
            ConflictType.SUBDOMAIN_EXISTS, SetupStep.TENANT_CREATION, List.of("subdomain"), "tenant_1", null, null);

        // Then
        assertTrue(record.hasExistingResourceId());
        assertEquals("/tenants/tenant_1", record.retrievalEndpoint());
    }

    @Test
    void constructor_MissingTypeOrStep_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new ConflictRecord(null, SetupStep.TENANT_CREATION, null, null, null, null));
        assertThrows(IllegalArgumentException.class,
            () -> new ConflictRecord(ConflictType.UNKNOWN, null, null, null, null, null));
    }
}
