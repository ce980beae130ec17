package com.ryuqq.orgsetup.testkit.contract;

import com.ryuqq.orgsetup.adapter.runner.DefaultSetupOrchestrator;
import com.ryuqq.orgsetup.application.orchestrator.SetupOptions;
import com.ryuqq.orgsetup.core.exception.ResourceApiException;
import com.ryuqq.orgsetup.core.exception.SetupCancelledException;
import com.ryuqq.orgsetup.core.exception.SetupException;
import com.ryuqq.orgsetup.core.exception.UnresolvableConflictException;
import com.ryuqq.orgsetup.core.model.RecoveryType;
import com.ryuqq.orgsetup.core.model.RequestContext;
import com.ryuqq.orgsetup.core.model.ResourceHandle;
import com.ryuqq.orgsetup.core.model.SetupStep;
import com.ryuqq.orgsetup.core.model.SetupResult;
import com.ryuqq.orgsetup.core.model.resource.Organization;
import com.ryuqq.orgsetup.core.model.resource.Tenant;
import com.ryuqq.orgsetup.core.spi.SetupObserver;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.CONFIGURE_DOMAIN;
import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.CREATE_ADMIN_USER;
import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.CREATE_ORGANIZATION;
import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.CREATE_TENANT;
import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.DELETE_ORGANIZATION;
import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.DELETE_TENANT;
import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.FIND_TENANT;
import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.GENERATE_API_KEY;
import static com.ryuqq.orgsetup.testkit.contract.InMemoryPlatform.Operation.REMOVE_DOMAIN;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract for retries, conflict recovery, the non-critical domain step and cancellation.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Transient failures are retried with exponential backoff (1s, 2s with jitter off)</li>
 *   <li>409 conflicts reuse the existing resource when its identity matches</li>
 *   <li>A transient failure while looking up the conflicting resource retries the step</li>
 *   <li>Domain failures yield a partial result without rollback</li>
 *   <li>Deadline and interruption cancel the setup and roll back</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class SetupRecoveryContract extends AbstractContractTest {

    // ============================================================
    // Retry
    // ============================================================

    @Test
    public void setup_TransientTenantFailures_RetriedWithExponentialBackoff() {
        platform.failNext(CREATE_TENANT,
            ResourceApiException.serverError(503, "unavailable"),
            ResourceApiException.timeout("read timed out"));

        SetupResult result = newOrchestrator().setup(validRequest().build());

        assertEquals(3, platform.callCount(CREATE_TENANT));
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.sleeps());
        assertEquals(1, platform.tenantCount());
        assertFalse(result.isPartial());
    }

    @Test
    public void setup_TransportFailure_Retried() {
        platform.failNext(GENERATE_API_KEY, new UncheckedIOException(new IOException("connection refused")));

        newOrchestrator().setup(validRequest().build());

        assertEquals(2, platform.callCount(GENERATE_API_KEY));
        assertEquals(List.of(Duration.ofSeconds(1)), sleeper.sleeps());
    }

    @Test
    public void setup_RetriesExhausted_FailsAndRollsBack() {
        platform.failAlways(CREATE_TENANT, ResourceApiException.serverError(502, "bad gateway"));

        SetupException exception = assertThrows(SetupException.class,
            () -> newOrchestrator().setup(validRequest().build()));

        assertEquals(SetupStep.TENANT_CREATION, exception.getStep());
        assertInstanceOf(ResourceApiException.class, exception.getCause());
        assertEquals(3, platform.callCount(CREATE_TENANT));
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.sleeps());
        assertEquals(1, platform.callCount(DELETE_ORGANIZATION));
        assertPlatformEmpty();
    }

    @Test
    public void setup_RetryDisabled_SingleAttempt() {
        platform.failAlways(CREATE_TENANT, ResourceApiException.serverError(503, "unavailable"));

        assertThrows(SetupException.class, () -> newOrchestrator()
            .setup(validRequest().build(), SetupOptions.defaults().withEnableRetry(false)));

        assertEquals(1, platform.callCount(CREATE_TENANT));
        assertTrue(sleeper.sleeps().isEmpty());
    }

    @Test
    public void setup_NonRetryableFailure_NotRetried() {
        platform.failAlways(CREATE_TENANT, ResourceApiException.ofStatus(401, "token expired"));

        assertThrows(SetupException.class, () -> newOrchestrator().setup(validRequest().build()));

        assertEquals(1, platform.callCount(CREATE_TENANT));
        assertTrue(sleeper.sleeps().isEmpty());
    }

    // ============================================================
    // Conflict recovery
    // ============================================================

    @Test
    public void setup_OrganizationConflictSameIdentity_ReusesExisting() {
        Organization existing = platform.seedOrganization("Acme Corp", "acme", null);

        SetupResult result = newOrchestrator().setup(validRequest().build());

        assertEquals(existing.id(), result.organization().id());
        assertEquals(existing.id(), result.tenant().organizationId());
        assertEquals(List.of(SetupStep.ORGANIZATION_CREATION), result.metadata().reusedSteps());
        assertEquals(RecoveryType.REUSED_EXISTING, result.metadata().recoveryType());
        assertEquals(1, platform.organizationCount());
    }

    @Test
    public void setup_ResumeAfterFailureWithoutRollback_ReusesOrganizationAndTenant() {
        DefaultSetupOrchestrator orchestrator = newOrchestrator();
        SetupOptions noRollback = SetupOptions.defaults().withEnableRollback(false);
        platform.failNext(CREATE_ADMIN_USER, ResourceApiException.validation("password policy violated"));

        SetupException first = assertThrows(SetupException.class,
            () -> orchestrator.setup(validRequest().build(), noRollback));
        assertTrue(first.requiresManualCleanup());
        assertFalse(first.isRollbackAttempted());

        SetupResult resumed = orchestrator.setup(validRequest().build(), noRollback);

        assertEquals(List.of(SetupStep.ORGANIZATION_CREATION, SetupStep.TENANT_CREATION),
            resumed.metadata().reusedSteps());
        assertEquals(RecoveryType.REUSED_EXISTING, resumed.metadata().recoveryType());
        assertEquals(first.getCreatedResources().get(1).externalId(), resumed.tenant().id());
        assertEquals(1, platform.organizationCount());
        assertEquals(1, platform.tenantCount());
        assertEquals(2, platform.callCount(CREATE_TENANT));
    }

    @Test
    public void setup_OrganizationConflictDifferentIdentity_FailsWithoutSideEffects() {
        platform.seedOrganization("Someone Else Ltd", "acme", null);

        SetupException exception = assertThrows(SetupException.class,
            () -> newOrchestrator().setup(validRequest().build()));

        assertEquals(SetupStep.ORGANIZATION_CREATION, exception.getStep());
        UnresolvableConflictException conflict =
            assertInstanceOf(UnresolvableConflictException.class, exception.getCause());
        assertEquals("subdomain_exists", conflict.getConflict().type().code());
        assertFalse(conflict.getConflict().suggestions().isEmpty());
        assertEquals(0, platform.tenantCount());
        assertEquals(1, platform.organizationCount());
    }

    @Test
    public void setup_StaleConflictWithoutExistingResource_OneFreshAttempt() {
        platform.failNext(CREATE_ADMIN_USER, ResourceApiException.conflict(
            "email_exists", List.of("email"), null, Map.of("email", "admin@acme.com"), "email already registered"));

        SetupResult result = newOrchestrator().setup(validRequest().build());

        assertEquals(2, platform.callCount(CREATE_ADMIN_USER));
        assertTrue(result.metadata().reusedSteps().isEmpty());
        assertEquals(RecoveryType.NONE, result.metadata().recoveryType());
    }

    @Test
    public void setup_ConflictPersistsAfterFreshAttempt_Fails() {
        platform.failAlways(CREATE_ADMIN_USER, ResourceApiException.conflict(
            "email_exists", List.of("email"), null, Map.of(), "email already registered"));

        SetupException exception = assertThrows(SetupException.class,
            () -> newOrchestrator().setup(validRequest().build()));

        assertEquals(SetupStep.ADMIN_USER_CREATION, exception.getStep());
        assertInstanceOf(UnresolvableConflictException.class, exception.getCause());
        assertEquals(2, platform.callCount(CREATE_ADMIN_USER));
        assertPlatformEmpty();
    }

    @Test
    public void setup_TenantConflictSameOrganization_ReusesOnlyTenant() {
        AtomicReference<Tenant> seeded = new AtomicReference<>();
        SetupObserver tenantAppears = tenantSeededAfterOrganization(seeded);

        SetupResult result = newOrchestrator(deterministicConfig(), tenantAppears).setup(validRequest().build());

        assertEquals(seeded.get().id(), result.tenant().id());
        assertEquals(result.organization().id(), result.tenant().organizationId());
        assertEquals(List.of(SetupStep.TENANT_CREATION), result.metadata().reusedSteps());
        assertEquals(RecoveryType.REUSED_EXISTING, result.metadata().recoveryType());
        assertEquals(1, platform.tenantCount());
        assertEquals(1, platform.callCount(CREATE_TENANT));
        assertEquals(seeded.get().id(), result.adminUser().tenantId());
    }

    @Test
    public void setup_TenantConflictForeignOrganization_RejectedAndRolledBack() {
        Organization other = platform.seedOrganization("Other Corp", "other", null);
        Tenant foreign = platform.seedTenant(other.id(), "Other Corp", "acme");

        SetupException exception = assertThrows(SetupException.class,
            () -> newOrchestrator().setup(validRequest().build()));

        assertEquals(SetupStep.TENANT_CREATION, exception.getStep());
        UnresolvableConflictException conflict =
            assertInstanceOf(UnresolvableConflictException.class, exception.getCause());
        assertEquals(foreign.id(), conflict.getConflict().existingResourceId());
        assertTrue(exception.isRollbackExecuted());
        assertEquals(1, platform.callCount(DELETE_ORGANIZATION));
        assertEquals(0, platform.callCount(DELETE_TENANT));
        assertEquals(1, platform.organizationCount(), "Only the foreign organization remains");
        assertEquals(1, platform.tenantCount(), "The foreign tenant is never touched");
    }

    @Test
    public void setup_ConflictLookupTransportFailure_StepRetriedThenReused() {
        AtomicReference<Tenant> seeded = new AtomicReference<>();
        platform.failNext(FIND_TENANT, new UncheckedIOException(new IOException("connection reset")));

        SetupResult result = newOrchestrator(deterministicConfig(), tenantSeededAfterOrganization(seeded))
            .setup(validRequest().build());

        assertEquals(seeded.get().id(), result.tenant().id());
        assertEquals(List.of(SetupStep.TENANT_CREATION), result.metadata().reusedSteps());
        assertEquals(2, platform.callCount(CREATE_TENANT));
        assertEquals(2, platform.callCount(FIND_TENANT));
        assertEquals(List.of(Duration.ofSeconds(1)), sleeper.sleeps());
    }

    @Test
    public void setup_ConflictLookupKeepsFailing_FailsWithCauseAndRollsBack() {
        AtomicReference<Tenant> seeded = new AtomicReference<>();
        platform.failAlways(FIND_TENANT, new UncheckedIOException(new IOException("connection reset")));

        SetupException exception = assertThrows(SetupException.class,
            () -> newOrchestrator(deterministicConfig(), tenantSeededAfterOrganization(seeded))
                .setup(validRequest().build()));

        assertEquals(SetupStep.TENANT_CREATION, exception.getStep());
        UnresolvableConflictException conflict =
            assertInstanceOf(UnresolvableConflictException.class, exception.getCause());
        assertInstanceOf(UncheckedIOException.class, conflict.getCause());
        assertEquals(3, platform.callCount(CREATE_TENANT));
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.sleeps());
        assertEquals(1, platform.callCount(DELETE_ORGANIZATION));
        assertEquals(0, platform.organizationCount());
        assertEquals(1, platform.tenantCount());
    }

    /**
     * Seeds a tenant with the request's subdomain under the organization just created,
     * so the tenant step hits a conflict that points at it.
     */
    private SetupObserver tenantSeededAfterOrganization(AtomicReference<Tenant> seeded) {
        return new SetupObserver() {
            @Override
            public void onStepCompleted(RequestContext context, SetupStep step, ResourceHandle handle) {
                if (step == SetupStep.ORGANIZATION_CREATION && seeded.get() == null) {
                    seeded.set(platform.seedTenant(handle.externalId(), "Acme Corp", "acme"));
                }
            }
        };
    }

    // ============================================================
    // Domain step
    // ============================================================

    @Test
    public void setup_DomainFails_PartialResultWithoutRollback() {
        platform.failAlways(CONFIGURE_DOMAIN, ResourceApiException.validation("domain not allowed"));

        SetupResult result = newOrchestrator().setup(validRequest().customDomain("shop.acme.com").build());

        assertTrue(result.isPartial());
        assertNull(result.domain());
        assertFalse(result.metadata().notes().isEmpty());
        assertTrue(result.metadata().notes().get(0).contains("shop.acme.com"));
        assertEquals(4, result.metadata().completedSteps().size());
        assertEquals(0, platform.callCount(DELETE_ORGANIZATION));
        assertEquals(0, platform.callCount(REMOVE_DOMAIN));
        assertEquals(1, platform.organizationCount());
        assertEquals(1, platform.activeApiKeyCount());
    }

    @Test
    public void setup_CustomDomain_TakesPrecedenceOverSubdomain() {
        SetupResult result = newOrchestrator().setup(validRequest().customDomain("Shop.Acme.com").build());

        assertEquals("shop.acme.com", result.domain().domain());
    }

    @Test
    public void setup_NoSubdomainNoCustomDomain_DomainStepSkipped() {
        SetupResult result = newOrchestrator().setup(validRequest().subdomain(null).build());

        assertNull(result.domain());
        assertFalse(result.isPartial());
        assertEquals(List.of(SetupStep.DOMAIN_CONFIGURATION), result.metadata().skippedSteps());
        assertEquals(0, platform.callCount(CONFIGURE_DOMAIN));
    }

    @Test
    public void setup_PartialResult_ReplayedAsPartial() {
        platform.failAlways(CONFIGURE_DOMAIN, ResourceApiException.validation("domain not allowed"));
        DefaultSetupOrchestrator orchestrator = newOrchestrator();
        SetupOptions options = SetupOptions.defaults().withIdempotencyKey("partial-001");

        orchestrator.setup(validRequest().build(), options);
        SetupResult replay = orchestrator.setup(validRequest().build(), options);

        assertTrue(replay.metadata().replayed());
        assertTrue(replay.isPartial());
    }

    // ============================================================
    // Cancellation
    // ============================================================

    @Test
    public void setup_BackoffWouldExceedDeadline_CancelledAndRolledBack() {
        platform.failAlways(CREATE_TENANT, ResourceApiException.serverError(503, "unavailable"));

        SetupException exception = assertThrows(SetupException.class, () -> newOrchestrator()
            .setup(validRequest().build(), SetupOptions.defaults().withTimeout(Duration.ofSeconds(2))));

        assertTrue(exception.isCancelled());
        assertEquals(SetupStep.TENANT_CREATION, exception.getStep());
        assertEquals(List.of(Duration.ofSeconds(1)), sleeper.sleeps(),
            "A backoff that would overrun the deadline must not be started");
        assertEquals(2, platform.callCount(CREATE_TENANT));
        assertPlatformEmpty();
    }

    @Test
    public void setup_DeadlinePassedBetweenSteps_CancelledBeforeNextStep() {
        platform.beforeCall(CREATE_TENANT, () -> clock.advance(Duration.ofSeconds(30)));

        SetupException exception = assertThrows(SetupException.class, () -> newOrchestrator()
            .setup(validRequest().build(), SetupOptions.defaults().withTimeout(Duration.ofSeconds(10))));

        assertTrue(exception.isCancelled());
        assertEquals(SetupStep.ADMIN_USER_CREATION, exception.getStep());
        assertEquals(0, platform.callCount(CREATE_ADMIN_USER));
        SetupCancelledException cancelled = assertInstanceOf(SetupCancelledException.class, exception.getCause());
        assertFalse(cancelled.isInterrupted());
        assertPlatformEmpty();
    }

    @Test
    public void setup_InterruptedDuringBackoff_RollsBackAndRestoresInterruptFlag() {
        platform.failAlways(CREATE_ADMIN_USER, ResourceApiException.serverError(503, "unavailable"));
        sleeper.interruptOnSleep(1);

        SetupException exception = assertThrows(SetupException.class,
            () -> newOrchestrator().setup(validRequest().build()));

        assertTrue(Thread.interrupted(), "Interrupt flag must be restored after rollback");
        assertTrue(exception.isCancelled());
        assertEquals(1, platform.callCount(CREATE_ADMIN_USER));
        SetupCancelledException cancelled = assertInstanceOf(SetupCancelledException.class, exception.getCause());
        assertTrue(cancelled.isInterrupted());
        assertTrue(exception.isRollbackExecuted());
        assertPlatformEmpty();
    }

    @Test
    public void setup_ThreadInterruptedBetweenSteps_CancelledAtNextStep() {
        platform.beforeCall(CREATE_TENANT, () -> Thread.currentThread().interrupt());

        SetupException exception = assertThrows(SetupException.class,
            () -> newOrchestrator().setup(validRequest().build()));

        assertTrue(Thread.interrupted());
        assertEquals(SetupStep.ADMIN_USER_CREATION, exception.getStep());
        assertTrue(exception.isCancelled());
        assertEquals(2, exception.getRollbackOutcome().results().size());
        assertPlatformEmpty();
    }
}
