package com.ryuqq.orgsetup.testkit.contract;

import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import com.ryuqq.orgsetup.core.model.SetupResult;
import com.ryuqq.orgsetup.core.spi.Reservation;
import com.ryuqq.orgsetup.core.spi.ReservationStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract every {@link com.ryuqq.orgsetup.core.spi.IdempotencyKeyStore} must satisfy.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Reservation is a compare-and-set (one ACQUIRED among concurrent callers)</li>
 *   <li>Committed results are returned by lookup and never removed by release</li>
 *   <li>Fingerprint mismatch is reported for both in-flight and completed keys</li>
 *   <li>Stale in-flight reservations are taken over after the lease</li>
 *   <li>Only the current owner token can commit or release a reservation</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class IdempotencyKeyStoreContract extends AbstractContractTest {

    private static final String FINGERPRINT = "fp-aaaa";
    private static final String OTHER_FINGERPRINT = "fp-bbbb";

    /**
     * How long the store under test honours an in-flight reservation.
     *
     * @return reservation lease
     */
    protected abstract Duration reservationLease();

    @Test
    public void reserve_NewKey_Acquired() {
        IdempotencyKey key = IdempotencyKey.of("store-001");

        Reservation reservation = keyStore.reserve(key, FINGERPRINT);

        assertEquals(ReservationStatus.ACQUIRED, reservation.status());
        assertTrue(reservation.token() != null && !reservation.token().isBlank(), "Acquired reservation must carry a token");
        assertTrue(keyStore.lookup(key).isEmpty(), "In-flight reservation must not expose a result");
    }

    @Test
    public void reserve_InFlightSameFingerprint_InFlight() {
        IdempotencyKey key = IdempotencyKey.of("store-002");
        keyStore.reserve(key, FINGERPRINT);

        Reservation second = keyStore.reserve(key, FINGERPRINT);

        assertEquals(ReservationStatus.IN_FLIGHT, second.status());
        assertFalse(second.isAcquired());
    }

    @Test
    public void reserve_InFlightDifferentFingerprint_Mismatch() {
        IdempotencyKey key = IdempotencyKey.of("store-003");
        keyStore.reserve(key, FINGERPRINT);

        assertEquals(ReservationStatus.FINGERPRINT_MISMATCH, keyStore.reserve(key, OTHER_FINGERPRINT).status());
    }

    @Test
    public void commit_ThenReserve_CompletedAndLookupReturnsResult() {
        IdempotencyKey key = IdempotencyKey.of("store-004");
        SetupResult result = sampleResult(key);
        Reservation reservation = keyStore.reserve(key, FINGERPRINT);

        keyStore.commit(reservation, result);

        assertEquals(ReservationStatus.COMPLETED, keyStore.reserve(key, FINGERPRINT).status());
        assertEquals(result, keyStore.lookup(key).orElseThrow());
    }

    @Test
    public void reserve_CompletedDifferentFingerprint_Mismatch() {
        IdempotencyKey key = IdempotencyKey.of("store-005");
        keyStore.commit(keyStore.reserve(key, FINGERPRINT), sampleResult(key));

        assertEquals(ReservationStatus.FINGERPRINT_MISMATCH, keyStore.reserve(key, OTHER_FINGERPRINT).status());
    }

    @Test
    public void release_InFlight_KeyCanBeReservedAgain() {
        IdempotencyKey key = IdempotencyKey.of("store-006");
        Reservation reservation = keyStore.reserve(key, FINGERPRINT);

        keyStore.release(reservation);

        assertEquals(ReservationStatus.ACQUIRED, keyStore.reserve(key, OTHER_FINGERPRINT).status());
    }

    @Test
    public void release_Committed_ResultKept() {
        IdempotencyKey key = IdempotencyKey.of("store-007");
        Reservation reservation = keyStore.reserve(key, FINGERPRINT);
        keyStore.commit(reservation, sampleResult(key));

        keyStore.release(reservation);

        assertTrue(keyStore.lookup(key).isPresent(), "release must never remove a committed result");
        assertEquals(ReservationStatus.COMPLETED, keyStore.reserve(key, FINGERPRINT).status());
    }

    @Test
    public void release_UnknownKey_NoEffect() {
        IdempotencyKey key = IdempotencyKey.of("store-008");

        keyStore.release(Reservation.acquired(key, "never-issued"));

        assertEquals(ReservationStatus.ACQUIRED, keyStore.reserve(key, FINGERPRINT).status());
    }

    @Test
    public void commit_WithoutReservation_Rejected() {
        IdempotencyKey key = IdempotencyKey.of("store-009");
        Reservation forged = Reservation.acquired(key, "never-issued");

        assertThrows(IllegalStateException.class, () -> keyStore.commit(forged, sampleResult(key)));
        assertTrue(keyStore.lookup(key).isEmpty());
    }

    @Test
    public void commit_NotAcquiredReservation_Rejected() {
        IdempotencyKey key = IdempotencyKey.of("store-014");
        keyStore.reserve(key, FINGERPRINT);
        Reservation inFlight = keyStore.reserve(key, FINGERPRINT);

        assertThrows(IllegalArgumentException.class, () -> keyStore.commit(inFlight, sampleResult(key)));
        assertTrue(keyStore.lookup(key).isEmpty());
    }

    @Test
    public void commit_Twice_Rejected() {
        IdempotencyKey key = IdempotencyKey.of("store-010");
        Reservation reservation = keyStore.reserve(key, FINGERPRINT);
        keyStore.commit(reservation, sampleResult(key));

        assertThrows(IllegalStateException.class, () -> keyStore.commit(reservation, sampleResult(key)));
    }

    @Test
    public void reserve_StaleInFlight_TakenOverAfterLease() {
        IdempotencyKey key = IdempotencyKey.of("store-011");
        keyStore.reserve(key, FINGERPRINT);

        clock.advance(reservationLease().minusSeconds(1));
        assertEquals(ReservationStatus.IN_FLIGHT, keyStore.reserve(key, FINGERPRINT).status(),
            "Reservation inside the lease must still be honoured");

        clock.advance(Duration.ofSeconds(1));
        assertEquals(ReservationStatus.ACQUIRED, keyStore.reserve(key, FINGERPRINT).status(),
            "Reservation past the lease must be taken over");
    }

    @Test
    public void commit_AfterTakeover_StaleOwnerRejectedAndNewOwnerCommits() {
        IdempotencyKey key = IdempotencyKey.of("store-015");
        Reservation stale = keyStore.reserve(key, FINGERPRINT);
        clock.advance(reservationLease());
        Reservation current = keyStore.reserve(key, FINGERPRINT);
        assertNotEquals(stale.token(), current.token(), "Takeover must issue a new owner token");

        assertThrows(IllegalStateException.class, () -> keyStore.commit(stale, sampleResult(key)));
        assertTrue(keyStore.lookup(key).isEmpty(), "Rejected commit must not store a result");

        SetupResult result = sampleResult(key);
        keyStore.commit(current, result);
        assertEquals(result, keyStore.lookup(key).orElseThrow());
        assertThrows(IllegalStateException.class, () -> keyStore.commit(stale, sampleResult(key)));
    }

    @Test
    public void release_AfterTakeover_StaleOwnerLeavesNewReservation() {
        IdempotencyKey key = IdempotencyKey.of("store-016");
        Reservation stale = keyStore.reserve(key, FINGERPRINT);
        clock.advance(reservationLease());
        Reservation current = keyStore.reserve(key, FINGERPRINT);

        keyStore.release(stale);

        assertEquals(ReservationStatus.IN_FLIGHT, keyStore.reserve(key, FINGERPRINT).status(),
            "A stale owner must not release the new owner's reservation");
        keyStore.commit(current, sampleResult(key));
        assertTrue(keyStore.lookup(key).isPresent());
    }

    @Test
    public void reserve_CompletedKey_NeverTakenOver() {
        IdempotencyKey key = IdempotencyKey.of("store-012");
        keyStore.commit(keyStore.reserve(key, FINGERPRINT), sampleResult(key));

        clock.advance(reservationLease().multipliedBy(10));

        assertEquals(ReservationStatus.COMPLETED, keyStore.reserve(key, FINGERPRINT).status());
    }

    @Test
    public void reserve_ConcurrentCallers_ExactlyOneAcquires() throws Exception {
        IdempotencyKey key = IdempotencyKey.of("store-013");
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ReservationStatus>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<ReservationStatus> task = () -> {
                    start.await();
                    return keyStore.reserve(key, FINGERPRINT).status();
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            int acquired = 0;
            for (Future<ReservationStatus> future : futures) {
                ReservationStatus status = future.get(5, TimeUnit.SECONDS);
                if (status == ReservationStatus.ACQUIRED) {
                    acquired++;
                } else {
                    assertEquals(ReservationStatus.IN_FLIGHT, status);
                }
            }
            assertEquals(1, acquired, "Exactly one concurrent reserve must acquire the key");
        } finally {
            executor.shutdownNow();
        }
        assertFalse(keyStore.lookup(key).isPresent());
    }
}
