package com.ryuqq.orgsetup.adapter.inmemory.store;

import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import com.ryuqq.orgsetup.core.model.SetupResult;
import com.ryuqq.orgsetup.core.spi.IdempotencyKeyStore;
import com.ryuqq.orgsetup.core.spi.Reservation;
import com.ryuqq.orgsetup.core.spi.ReservationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link IdempotencyKeyStore} for testing and reference purposes.
 *
 * <p>Every state change runs inside {@link ConcurrentHashMap#compute}, so a reservation
 * is an atomic compare-and-set: of any number of concurrent {@code reserve} calls for
 * the same key, exactly one observes {@link ReservationStatus#ACQUIRED}.</p>
 *
 * <p><strong>Entry lifecycle:</strong></p>
 * <ul>
 *   <li>absent → in-flight ({@code reserve})</li>
 *   <li>in-flight → completed ({@code commit})</li>
 *   <li>in-flight → absent ({@code release})</li>
 *   <li>in-flight older than the lease → taken over by the next {@code reserve}</li>
 * </ul>
 *
 * <p>Each acquired reservation carries a fresh random token. {@code commit} and
 * {@code release} only act on the entry holding the caller's token, so an execution
 * whose reservation was taken over cannot overwrite or drop the new owner's entry.</p>
 *
 * <p>Completed entries are never evicted. Data is lost on process restart.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryIdempotencyKeyStore implements IdempotencyKeyStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryIdempotencyKeyStore.class);

    /**
     * Default lease after which an in-flight reservation may be taken over.
     */
    public static final Duration DEFAULT_LEASE = Duration.ofMinutes(10);

    private final ConcurrentHashMap<IdempotencyKey, Entry> entries = new ConcurrentHashMap<>();
    private final Duration lease;
    private final Clock clock;

    /**
     * Creates a store with the default lease and the system clock.
     */
    public InMemoryIdempotencyKeyStore() {
        this(DEFAULT_LEASE, Clock.systemUTC());
    }

    /**
     * Creates a store.
     *
     * @param lease how long an in-flight reservation is honoured
     * @param clock clock used to age reservations
     * @throws IllegalArgumentException if lease is null or not positive, or clock is null
     */
    public InMemoryIdempotencyKeyStore(Duration lease, Clock clock) {
        if (lease == null || lease.isZero() || lease.isNegative()) {
            throw new IllegalArgumentException("lease must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.lease = lease;
        this.clock = clock;
    }

    @Override
    public Optional<SetupResult> lookup(IdempotencyKey key) {
        requireKey(key);
        Entry entry = entries.get(key);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.result());
    }

    @Override
    public Reservation reserve(IdempotencyKey key, String fingerprint) {
        requireKey(key);
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new IllegalArgumentException("fingerprint cannot be null or blank");
        }

        Instant now = clock.instant();
        Reservation[] reservation = new Reservation[1];
        entries.compute(key, (k, current) -> {
            if (current == null) {
                Entry acquired = Entry.inFlight(fingerprint, UUID.randomUUID().toString(), now);
                reservation[0] = Reservation.acquired(key, acquired.token());
                return acquired;
            }
            if (current.isCompleted()) {
                reservation[0] = Reservation.of(key, current.fingerprint().equals(fingerprint)
                    ? ReservationStatus.COMPLETED
                    : ReservationStatus.FINGERPRINT_MISMATCH);
                return current;
            }
            if (!now.isBefore(current.reservedAt().plus(lease))) {
                log.warn("Taking over stale reservation for {} (reserved at {}, lease {})",
                    key, current.reservedAt(), lease);
                Entry acquired = Entry.inFlight(fingerprint, UUID.randomUUID().toString(), now);
                reservation[0] = Reservation.acquired(key, acquired.token());
                return acquired;
            }
            reservation[0] = Reservation.of(key, current.fingerprint().equals(fingerprint)
                ? ReservationStatus.IN_FLIGHT
                : ReservationStatus.FINGERPRINT_MISMATCH);
            return current;
        });
        return reservation[0];
    }

    @Override
    public void commit(Reservation reservation, SetupResult result) {
        requireAcquired(reservation);
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        IdempotencyKey key = reservation.key();
        entries.compute(key, (k, current) -> {
            if (current == null) {
                throw new IllegalStateException("No reservation to commit for " + key);
            }
            if (current.isCompleted()) {
                throw new IllegalStateException("Result already committed for " + key);
            }
            if (!current.token().equals(reservation.token())) {
                throw new IllegalStateException("Reservation for " + key + " was taken over by another execution");
            }
            return current.complete(result);
        });
    }

    @Override
    public void release(Reservation reservation) {
        requireAcquired(reservation);
        entries.computeIfPresent(reservation.key(), (k, current) -> {
            if (current.isCompleted()) {
                return current;
            }
            if (!current.token().equals(reservation.token())) {
                log.debug("Not releasing {}: reservation now belongs to another execution", k);
                return current;
            }
            return null;
        });
    }

    /**
     * Clears all entries.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        entries.clear();
    }

    /**
     * Returns the number of stored entries, in-flight and completed.
     *
     * @return the number of entries
     */
    public int size() {
        return entries.size();
    }

    private static void requireKey(IdempotencyKey key) {
        if (key == null) {
            throw new IllegalArgumentException("IdempotencyKey cannot be null");
        }
    }

    private static void requireAcquired(Reservation reservation) {
        if (reservation == null) {
            throw new IllegalArgumentException("reservation cannot be null");
        }
        if (!reservation.isAcquired()) {
            throw new IllegalArgumentException("reservation was not acquired: " + reservation.status());
        }
    }

    private record Entry(String fingerprint, String token, SetupResult result, Instant reservedAt) {

        static Entry inFlight(String fingerprint, String token, Instant reservedAt) {
            return new Entry(fingerprint, token, null, reservedAt);
        }

        boolean isCompleted() {
            return result != null;
        }

        Entry complete(SetupResult result) {
            return new Entry(fingerprint, token, result, reservedAt);
        }
    }
}
