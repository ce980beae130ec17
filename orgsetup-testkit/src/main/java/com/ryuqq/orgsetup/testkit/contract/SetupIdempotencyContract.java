package com.ryuqq.orgsetup.testkit.contract;

import com.ryuqq.orgsetup.adapter.runner.DefaultSetupOrchestrator;
import com.ryuqq.orgsetup.application.orchestrator.SetupOptions;
import com.ryuqq.orgsetup.core.exception.IdempotencyConflictException;
import com.ryuqq.orgsetup.core.exception.ResourceApiException;
import com.ryuqq.orgsetup.core.exception.SetupException;
import com.ryuqq.orgsetup.core.exception.SetupValidationException;
import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import com.ryuqq.orgsetup.core.model.RequestContext;
import com.ryuqq.orgsetup.core.model.SetupRequest;
import com.ryuqq.orgsetup.core.model.SetupResult;
import com.ryuqq.orgsetup.core.model.SetupStep;
import com.ryuqq.orgsetup.core.spi.ReservationStatus;
import com.ryuqq.orgsetup.core.spi.SetupObserver;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract for idempotent organization setup.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Same key twice → stored result replayed, zero platform calls</li>
 *   <li>Same key, different request → rejected before any platform call</li>
 *   <li>Failed setup releases the key so a retry runs again</li>
 *   <li>Invalid request → no reservation taken</li>
 *   <li>Concurrent callers with one key → one setup, the other rejected or replayed</li>
 *   <li>Minimal request (no admin name, password or role) replays under the same key</li>
 *   <li>A run whose reservation was taken over cannot commit and only compensates its own resources</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class SetupIdempotencyContract extends AbstractContractTest {

    /**
     * How long the store under test honours an in-flight reservation.
     *
     * @return reservation lease
     */
    protected abstract Duration reservationLease();

    @Test
    public void setup_MinimalRequestSameKeyTwice_SecondRunMakesNoPlatformCalls() {
        DefaultSetupOrchestrator orchestrator = newOrchestrator();
        SetupRequest request = SetupRequest.builder()
            .name("Acme")
            .subdomain("acme")
            .adminEmail("a@acme.com")
            .build();
        SetupOptions options = SetupOptions.defaults().withIdempotencyKey("k1");

        SetupResult first = orchestrator.setup(request, options);
        List<InMemoryPlatform.Operation> callsAfterFirst = new ArrayList<>(platform.calls());
        SetupResult second = orchestrator.setup(request, options);

        assertFalse(first.metadata().replayed());
        assertEquals(SetupRequest.DEFAULT_ADMIN_NAME, first.adminUser().name());
        assertEquals(SetupRequest.DEFAULT_ADMIN_ROLE, first.adminUser().role());
        assertTrue(second.metadata().replayed(), "Second call must be marked as replayed");
        assertEquals(first.organization(), second.organization());
        assertEquals(first.tenant(), second.tenant());
        assertEquals(first.adminUser(), second.adminUser());
        assertEquals(first.apiKey(), second.apiKey());
        assertEquals(callsAfterFirst, platform.calls(), "Replay must not touch the platform");
    }

    @Test
    public void setup_SameKeyTwice_SecondCallReplaysWithoutPlatformCalls() {
        DefaultSetupOrchestrator orchestrator = newOrchestrator();
        SetupRequest request = validRequest().build();
        SetupOptions options = SetupOptions.defaults().withIdempotencyKey("idem-replay-001");

        SetupResult first = orchestrator.setup(request, options);
        int callsAfterFirst = platform.calls().size();
        SetupResult second = orchestrator.setup(request, options);

        assertFalse(first.metadata().replayed());
        assertTrue(second.metadata().replayed(), "Second call must be marked as replayed");
        assertEquals(first.organization(), second.organization());
        assertEquals(first.apiKey(), second.apiKey());
        assertEquals(callsAfterFirst, platform.calls().size(), "Replay must not touch the platform");
        assertEquals(1, platform.organizationCount());
    }

    @Test
    public void setup_DerivedKey_ReplaysWithinTimeBucket() {
        DefaultSetupOrchestrator orchestrator = newOrchestrator();
        SetupRequest request = validRequest().build();

        SetupResult first = orchestrator.setup(request);
        clock.advance(Duration.ofMinutes(5));
        SetupResult second = orchestrator.setup(request);

        assertTrue(second.metadata().replayed());
        assertEquals(first.metadata().idempotencyKey(), second.metadata().idempotencyKey());
        assertEquals(1, platform.organizationCount());
    }

    @Test
    public void setup_SameKeyDifferentRequest_RejectedWithoutPlatformCalls() {
        DefaultSetupOrchestrator orchestrator = newOrchestrator();
        SetupOptions options = SetupOptions.defaults().withIdempotencyKey("idem-mismatch-001");
        orchestrator.setup(validRequest().build(), options);
        int callsAfterFirst = platform.calls().size();

        SetupRequest different = validRequest().name("Other Corp").subdomain("other").build();
        IdempotencyConflictException exception = assertThrows(IdempotencyConflictException.class,
            () -> orchestrator.setup(different, options));

        assertEquals(IdempotencyConflictException.Reason.FINGERPRINT_MISMATCH, exception.getReason());
        assertEquals(callsAfterFirst, platform.calls().size());
    }

    @Test
    public void setup_FailedRun_ReleasesKeyAndRetryExecutesAgain() {
        DefaultSetupOrchestrator orchestrator = newOrchestrator();
        SetupRequest request = validRequest().build();
        SetupOptions options = SetupOptions.defaults().withIdempotencyKey("idem-release-001");
        platform.failNext(InMemoryPlatform.Operation.CREATE_TENANT, ResourceApiException.validation("tenant rejected"));

        assertThrows(SetupException.class, () -> orchestrator.setup(request, options));
        assertTrue(keyStore.lookup(IdempotencyKey.of("idem-release-001")).isEmpty(),
            "A failed setup must never be committed");

        SetupResult retried = orchestrator.setup(request, options);

        assertFalse(retried.metadata().replayed());
        assertEquals(1, platform.organizationCount());
        assertEquals(2, platform.callCount(InMemoryPlatform.Operation.CREATE_ORGANIZATION));
    }

    @Test
    public void setup_InvalidRequest_NoReservationTaken() {
        DefaultSetupOrchestrator orchestrator = newOrchestrator();
        SetupRequest invalid = validRequest().adminEmail("not-an-email").build();
        SetupOptions options = SetupOptions.defaults().withIdempotencyKey("idem-invalid-001");

        SetupValidationException exception = assertThrows(SetupValidationException.class,
            () -> orchestrator.setup(invalid, options));

        assertFalse(exception.getViolations().isEmpty());
        assertTrue(platform.calls().isEmpty());
        assertEquals(ReservationStatus.ACQUIRED,
            keyStore.reserve(IdempotencyKey.of("idem-invalid-001"), "fp-other").status(),
            "Validation failure must not leave a reservation behind");
    }

    @Test
    public void setup_ConcurrentSameKey_SecondCallerRejectedWhileInFlight() throws Exception {
        DefaultSetupOrchestrator orchestrator = newOrchestrator();
        SetupRequest request = validRequest().build();
        SetupOptions options = SetupOptions.defaults().withIdempotencyKey("idem-concurrent-001");
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        platform.beforeCall(InMemoryPlatform.Operation.CREATE_ORGANIZATION, () -> {
            entered.countDown();
            awaitQuietly(release);
        });

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SetupResult> first = executor.submit(() -> orchestrator.setup(request, options));
            assertTrue(entered.await(5, TimeUnit.SECONDS), "First setup never reached the platform");

            IdempotencyConflictException exception = assertThrows(IdempotencyConflictException.class,
                () -> orchestrator.setup(request, options));
            assertEquals(IdempotencyConflictException.Reason.IN_FLIGHT, exception.getReason());

            release.countDown();
            SetupResult result = first.get(5, TimeUnit.SECONDS);
            assertFalse(result.metadata().replayed());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        assertEquals(1, platform.callCount(InMemoryPlatform.Operation.CREATE_ORGANIZATION));
        assertTrue(orchestrator.setup(request, options).metadata().replayed());
    }

    @Test
    public void setup_ConcurrentSameKeyWithWait_SecondCallerReceivesReplay() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch committed = new CountDownLatch(1);
        SetupObserver commitSignal = new SetupObserver() {
            @Override
            public void onSetupCompleted(RequestContext context, SetupResult result) {
                committed.countDown();
            }
        };
        // the waiting caller's poll lets the first setup finish, then waits for its commit
        DefaultSetupOrchestrator orchestrator = new DefaultSetupOrchestrator(
            platform.services(), keyStore,
            deterministicConfig().withInFlightWaitTimeout(Duration.ofMinutes(1)),
            duration -> {
                release.countDown();
                committed.await(5, TimeUnit.SECONDS);
            },
            clock, commitSignal
        );
        SetupRequest request = validRequest().build();
        SetupOptions options = SetupOptions.defaults().withIdempotencyKey("idem-concurrent-002");
        platform.beforeCall(InMemoryPlatform.Operation.CREATE_ORGANIZATION, () -> {
            entered.countDown();
            awaitQuietly(release);
        });

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SetupResult> first = executor.submit(() -> orchestrator.setup(request, options));
            assertTrue(entered.await(5, TimeUnit.SECONDS), "First setup never reached the platform");

            SetupResult waited = orchestrator.setup(request, options);
            SetupResult original = first.get(5, TimeUnit.SECONDS);

            assertTrue(waited.metadata().replayed());
            assertEquals(original.organization(), waited.organization());
            assertNotEquals(original.metadata().replayed(), waited.metadata().replayed());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
        assertEquals(1, platform.organizationCount());
    }

    @Test
    public void setup_ReservationTakenOverBeforeCommit_LoserRollsBackOnlyItsOwnResources() {
        DefaultSetupOrchestrator orchestrator = newOrchestrator();
        SetupRequest request = validRequest().build();
        SetupOptions options = SetupOptions.defaults().withIdempotencyKey("k1");
        AtomicBoolean tookOver = new AtomicBoolean();
        List<SetupResult> winner = new ArrayList<>();
        // the lease lapses while the first run waits on key generation; a second run takes over and commits
        platform.beforeCall(InMemoryPlatform.Operation.GENERATE_API_KEY, () -> {
            if (tookOver.compareAndSet(false, true)) {
                clock.advance(reservationLease().plusMinutes(1));
                winner.add(orchestrator.setup(request, options));
            }
        });

        SetupException exception = assertThrows(SetupException.class, () -> orchestrator.setup(request, options));

        IdempotencyConflictException lost = assertInstanceOf(IdempotencyConflictException.class, exception.getCause());
        assertEquals(IdempotencyConflictException.Reason.RESERVATION_LOST, lost.getReason());
        assertEquals(SetupStep.DOMAIN_CONFIGURATION, exception.getStep());
        assertTrue(exception.isRollbackExecuted());

        assertEquals(1, winner.size());
        assertEquals(winner.get(0), keyStore.lookup(IdempotencyKey.of("k1")).orElseThrow(),
            "The taking-over run's result must stay committed");
        assertEquals(1, platform.callCount(InMemoryPlatform.Operation.REVOKE_API_KEY));
        assertEquals(0, platform.callCount(InMemoryPlatform.Operation.DELETE_ORGANIZATION));
        assertEquals(0, platform.callCount(InMemoryPlatform.Operation.DELETE_TENANT));
        assertEquals(0, platform.callCount(InMemoryPlatform.Operation.DELETE_ADMIN_USER));
        assertEquals(0, platform.callCount(InMemoryPlatform.Operation.REMOVE_DOMAIN));
        assertEquals(1, platform.organizationCount());
        assertEquals(1, platform.tenantCount());
        assertEquals(1, platform.adminUserCount());
        assertEquals(1, platform.activeApiKeyCount());
        assertEquals(1, platform.domainCount());

        SetupResult replay = orchestrator.setup(request, options);
        assertTrue(replay.metadata().replayed());
        assertEquals(winner.get(0).apiKey(), replay.apiKey());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Timed out waiting for test latch");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for test latch", e);
        }
    }
}
