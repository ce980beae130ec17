package com.ryuqq.orgsetup.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ResourceKind, SetupStep 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ResourceKindTest {

    @Test
    void compensationFor_UsesKindSpecificEndpoint() {
        assertEquals("DELETE /organizations/org_1", ResourceKind.ORGANIZATION.compensationFor("org_1").toString());
        assertEquals("DELETE /tenants/tenant_1", ResourceKind.TENANT.compensationFor("tenant_1").toString());
        assertEquals("DELETE /admins/user_1", ResourceKind.ADMIN_USER.compensationFor("user_1").toString());
        assertEquals("POST /api-keys/key_1/revoke", ResourceKind.API_KEY.compensationFor("key_1").toString());
        assertEquals("DELETE /tenants/tenant_1/domain", ResourceKind.DOMAIN.compensationFor("tenant_1").toString());
    }

    @Test
    void compensationFor_BlankTarget_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ResourceKind.TENANT.compensationFor(" "));
    }

    @Test
    void verificationStep_ApiKeyChecksRevocation() {
        assertEquals("GET /api-keys/key_1/status should report the key as revoked",
            ResourceKind.API_KEY.verificationStep("key_1"));
        assertEquals("GET /tenants/tenant_1 should return 404", ResourceKind.TENANT.verificationStep("tenant_1"));
    }

    @Test
    void setupStep_OnlyDomainIsNonCritical() {
        for (SetupStep step : SetupStep.values()) {
            assertEquals(step != SetupStep.DOMAIN_CONFIGURATION, step.isCritical(), step.name());
            assertEquals(step, SetupStep.producing(step.resourceKind()));
        }
    }
}
