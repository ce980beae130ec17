package com.ryuqq.orgsetup.testkit.contract;

import com.ryuqq.orgsetup.adapter.runner.PlatformServices;
import com.ryuqq.orgsetup.core.exception.ApiErrorKind;
import com.ryuqq.orgsetup.core.exception.ResourceApiException;
import com.ryuqq.orgsetup.core.model.ApiKeyPolicy;
import com.ryuqq.orgsetup.core.model.RequestContext;
import com.ryuqq.orgsetup.core.model.resource.ApiKey;
import com.ryuqq.orgsetup.core.model.resource.Organization;
import com.ryuqq.orgsetup.core.model.resource.OrganizationDraft;
import com.ryuqq.orgsetup.core.model.resource.Tenant;
import com.ryuqq.orgsetup.core.model.resource.TenantDraft;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * InMemoryPlatform fake behaviour tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryPlatformTest {

    private static final RequestContext CONTEXT = RequestContext.detached();

    private MutableClock clock;
    private InMemoryPlatform platform;
    private PlatformServices services;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        platform = new InMemoryPlatform(clock);
        services = platform.services();
    }

    @Test
    void createOrganization_DuplicateSubdomain_ConflictWithExistingId() {
        Organization existing = platform.seedOrganization("Acme Corp", "acme", null);

        ResourceApiException exception = assertThrows(ResourceApiException.class,
            () -> services.organizations().create(CONTEXT, draft("Other", "ACME")));

        assertEquals(ApiErrorKind.CONFLICT, exception.getKind());
        assertEquals("subdomain_exists", exception.getConflictCode());
        assertEquals(existing.id(), exception.getExistingResourceId());
        assertEquals(List.of("subdomain"), exception.getConflictFields());
    }

    @Test
    void deleteTenant_Missing_NotFound() {
        ResourceApiException exception = assertThrows(ResourceApiException.class,
            () -> services.tenants().delete(CONTEXT, "tenant_404"));

        assertEquals(ApiErrorKind.NOT_FOUND, exception.getKind());
    }

    @Test
    void failNext_ThrowsInjectedErrorsInOrderThenSucceeds() {
        ResourceApiException first = ResourceApiException.timeout("t1");
        ResourceApiException second = ResourceApiException.serverError(500, "boom");
        platform.failNext(InMemoryPlatform.Operation.CREATE_ORGANIZATION, first, second);

        assertSame(first, assertThrows(ResourceApiException.class,
            () -> services.organizations().create(CONTEXT, draft("Acme", "acme"))));
        assertSame(second, assertThrows(ResourceApiException.class,
            () -> services.organizations().create(CONTEXT, draft("Acme", "acme"))));
        services.organizations().create(CONTEXT, draft("Acme", "acme"));

        assertEquals(3, platform.callCount(InMemoryPlatform.Operation.CREATE_ORGANIZATION));
        assertEquals(1, platform.organizationCount());
    }

    @Test
    void generateApiKey_ExpiryFollowsPolicy() {
        Organization org = services.organizations().create(CONTEXT, draft("Acme", "acme"));
        Tenant tenant = platform.seedTenant(org.id(), "Acme", "acme");

        ApiKey key = services.apiKeys().generate(CONTEXT, "user_1", new ApiKeyPolicy().withMaxKeyAgeDays(30));

        assertEquals(clock.instant().plus(Duration.ofDays(30)), key.expiresAt());
        assertTrue(key.secret().startsWith("sk_live_"));
        assertEquals("organization", key.scope());
        assertEquals(1, platform.activeApiKeyCount());
        assertEquals(org.id(), tenant.organizationId());
    }

    @Test
    void reset_RemovesResourcesCallsAndFailures() {
        platform.seedOrganization("Acme", "acme", null);
        platform.failAlways(InMemoryPlatform.Operation.CREATE_TENANT, ResourceApiException.timeout("t"));
        services.tenants().findById(CONTEXT, "tenant_1");

        platform.reset();

        assertTrue(platform.isEmpty());
        assertTrue(platform.calls().isEmpty());
        services.tenants().create(CONTEXT, "org_1", new TenantDraft("Acme", "acme", null));
    }

    private static OrganizationDraft draft(String name, String subdomain) {
        return new OrganizationDraft(name, subdomain, null, "admin@acme.com", Map.of());
    }
}
