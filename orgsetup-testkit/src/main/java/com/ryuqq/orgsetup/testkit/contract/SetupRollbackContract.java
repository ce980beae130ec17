package com.ryuqq.orgsetup.testkit.contract;

import com.ryuqq.orgsetup.adapter.runner.DefaultSetupOrchestrator;
import com.ryuqq.orgsetup.application.orchestrator.SetupOptions;
import com.ryuqq.orgsetup.core.exception.ResourceApiException;
import com.ryuqq.orgsetup.core.exception.SetupException;
import com.ryuqq.orgsetup.core.model.ResourceKind;
import com.ryuqq.orgsetup.core.model.SetupResult;
import com.ryuqq.orgsetup.core.model.SetupStep;
import com.ryuqq.orgsetup.core.model.resource.Organization;
import com.ryuqq.orgsetup.core.report.CleanupItem;
import com.ryuqq.orgsetup.core.report.CompensationStatus;
import com.ryuqq.orgsetup.core.report.ManualCleanupReport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.CONFIGURE_DOMAIN;
import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.CREATE_ADMIN_USER;
import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.CREATE_ORGANIZATION;
import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.CREATE_TENANT;
import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.DELETE_ADMIN_USER;
import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.DELETE_ORGANIZATION;
import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.DELETE_TENANT;
import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.GENERATE_API_KEY;
import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.REVOKE_API_KEY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract for step ordering and reverse-order rollback.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Steps run in the fixed order organization → tenant → admin → API key → domain</li>
 *   <li>A critical failure compensates completed steps in reverse order</li>
 *   <li>A failing compensation does not stop the rest and lands in the cleanup report</li>
 *   <li>Reused resources are never compensated</li>
 *   <li>With rollback disabled, every owned resource is reported for manual cleanup</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class SetupRollbackContract extends AbstractContractTest {

    @Test
    public void setup_Success_StepsRunInFixedOrder() {
        SetupResult result = newOrchestrator().setup(validRequest().build());

        assertCallOrder(CREATE_ORGANIZATION, CREATE_TENANT, CREATE_ADMIN_USER, GENERATE_API_KEY, CONFIGURE_DOMAIN);
        assertEquals(List.of(SetupStep.values()), result.metadata().completedSteps());
        assertEquals(result.organization().id(), result.tenant().organizationId());
        assertEquals(result.tenant().id(), result.adminUser().tenantId());
        assertEquals(result.adminUser().id(), result.apiKey().userId());
        assertEquals("acme.checkout.clubify.com", result.domain().domain());
        assertFalse(result.isPartial());
    }

    @Test
    public void setup_FailureAtAdminUser_RollsBackTenantThenOrganization() {
        platform.failAlways(CREATE_ADMIN_USER, ResourceApiException.validation("password policy violated"));

        SetupException exception = assertThrows(SetupException.class,
            () -> newOrchestrator().setup(validRequest().build()));

        assertEquals(SetupStep.ADMIN_USER_CREATION, exception.getStep());
        assertEquals(List.of(SetupStep.ORGANIZATION_CREATION, SetupStep.TENANT_CREATION),
            exception.getCompletedSteps());
        assertCallOrder(CREATE_ORGANIZATION, CREATE_TENANT, CREATE_ADMIN_USER, DELETE_TENANT, DELETE_ORGANIZATION);
        assertTrue(exception.isRollbackExecuted());
        assertNull(exception.getManualCleanupReport());
        assertPlatformEmpty();
    }

    @Test
    public void setup_FailureAtApiKey_RollsBackAdminTenantOrganization() {
        platform.failAlways(GENERATE_API_KEY, ResourceApiException.ofStatus(403, "api keys disabled"));

        SetupException exception = assertThrows(SetupException.class,
            () -> newOrchestrator().setup(validRequest().build()));

        assertEquals(SetupStep.API_KEY_GENERATION, exception.getStep());
        assertEquals(3, exception.getCompletedSteps().size());
        assertCallOrder(DELETE_ADMIN_USER, DELETE_TENANT, DELETE_ORGANIZATION);
        assertEquals(0, platform.callCount(REVOKE_API_KEY));
        assertEquals(3, exception.getRollbackOutcome().count(CompensationStatus.COMPENSATED));
        assertPlatformEmpty();
    }

    @Test
    public void setup_CompensationFails_ContinuesAndReportsManualCleanup() {
        platform.failAlways(GENERATE_API_KEY, ResourceApiException.validation("scope not allowed"));
        platform.failAlways(DELETE_TENANT, ResourceApiException.ofStatus(403, "tenant is locked"));

        DefaultSetupOrchestrator orchestrator = newOrchestrator();
        SetupException exception = assertThrows(SetupException.class,
            () -> orchestrator.setup(validRequest().build()));

        assertCallOrder(DELETE_ADMIN_USER, DELETE_TENANT, DELETE_ORGANIZATION);
        assertTrue(exception.isRollbackAttempted());
        assertFalse(exception.isRollbackExecuted());
        assertTrue(exception.requiresManualCleanup());

        ManualCleanupReport report = exception.getManualCleanupReport();
        assertNotNull(report);
        assertEquals(SetupStep.API_KEY_GENERATION, report.failurePoint());
        assertEquals(1, report.items().size());
        CleanupItem item = report.items().get(0);
        assertEquals(ResourceKind.TENANT, item.kind());
        assertEquals("DELETE /tenants/" + item.resourceId(), item.cleanupEndpoint());
        assertTrue(item.lastError().contains("tenant is locked"));
        assertEquals(1, platform.tenantCount());
        assertEquals(0, platform.organizationCount());

        assertSame(report, orchestrator.generateManualCleanupReport(exception));
    }

    @Test
    public void setup_TransientCompensationFailure_RetriedWithBackoff() {
        platform.failAlways(CREATE_ADMIN_USER, ResourceApiException.validation("rejected"));
        platform.failNext(DELETE_TENANT, ResourceApiException.serverError(503, "unavailable"));

        SetupException exception = assertThrows(SetupException.class,
            () -> newOrchestrator().setup(validRequest().build()));

        assertTrue(exception.isRollbackExecuted());
        assertEquals(2, platform.callCount(DELETE_TENANT));
        assertEquals(List.of(Duration.ofSeconds(5)), sleeper.sleeps());
        assertPlatformEmpty();
    }

    @Test
    public void setup_CompensationTargetAlreadyGone_CountsAsCompensated() {
        platform.failAlways(CREATE_ADMIN_USER, ResourceApiException.validation("rejected"));
        platform.beforeCall(DELETE_TENANT, () -> platform.reset());

        SetupException exception = assertThrows(SetupException.class,
            () -> newOrchestrator().setup(validRequest().build()));

        assertTrue(exception.isRollbackExecuted(), "404 during compensation must count as compensated");
        assertNull(exception.getManualCleanupReport());
    }

    @Test
    public void setup_ReusedOrganization_NotCompensated() {
        Organization existing = platform.seedOrganization("Acme Corp", "acme", null);
        platform.failAlways(CREATE_ADMIN_USER, ResourceApiException.validation("rejected"));

        SetupException exception = assertThrows(SetupException.class,
            () -> newOrchestrator().setup(validRequest().build()));

        assertEquals(0, platform.callCount(DELETE_ORGANIZATION));
        assertEquals(1, platform.callCount(DELETE_TENANT));
        assertEquals(1, exception.getRollbackOutcome().count(CompensationStatus.SKIPPED));
        assertTrue(exception.isRollbackExecuted());
        assertEquals(1, platform.organizationCount());
        assertEquals(existing.id(), exception.getCreatedResources().get(0).externalId());
    }

    @Test
    public void setup_RollbackDisabled_ReportsEveryOwnedResource() {
        platform.failAlways(GENERATE_API_KEY, ResourceApiException.validation("rejected"));
        DefaultSetupOrchestrator orchestrator = newOrchestrator();

        SetupException exception = assertThrows(SetupException.class,
            () -> orchestrator.setup(validRequest().build(), SetupOptions.defaults().withEnableRollback(false)));

        assertFalse(exception.isRollbackAttempted());
        assertFalse(exception.isRollbackExecuted());
        assertTrue(exception.requiresManualCleanup());
        assertEquals(0, platform.callCount(DELETE_ORGANIZATION));
        List<ResourceKind> reported = exception.getManualCleanupReport().items().stream()
            .map(CleanupItem::kind)
            .toList();
        assertEquals(List.of(ResourceKind.ADMIN_USER, ResourceKind.TENANT, ResourceKind.ORGANIZATION), reported);
        assertEquals(reported, orchestrator.generateManualCleanupReport(exception).items().stream()
            .map(CleanupItem::kind)
            .toList());
    }

    @Test
    public void setup_FirstStepFails_NothingToRollBack() {
        platform.failAlways(CREATE_ORGANIZATION, ResourceApiException.validation("name rejected"));

        SetupException exception = assertThrows(SetupException.class,
            () -> newOrchestrator().setup(validRequest().build()));

        assertEquals(SetupStep.ORGANIZATION_CREATION, exception.getStep());
        assertTrue(exception.getCompletedSteps().isEmpty());
        assertFalse(exception.isRollbackAttempted());
        assertFalse(exception.requiresManualCleanup());
        assertEquals(1, platform.calls().size());
    }
}
