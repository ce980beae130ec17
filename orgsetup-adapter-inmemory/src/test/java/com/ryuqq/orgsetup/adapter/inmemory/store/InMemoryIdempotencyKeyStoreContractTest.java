package com.ryuqq.orgsetup.adapter.inmemory.store;

import com.ryuqq.orgsetup.core.spi.IdempotencyKeyStore;
import com.ryuqq.orgsetup.testkit.contract.IdempotencyKeyStoreContract;

import java.time.Clock;
import java.time.Duration;

/**
 * Runs the store-level reserve / commit / release contract against {@link InMemoryIdempotencyKeyStore}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryIdempotencyKeyStoreContractTest extends IdempotencyKeyStoreContract {

    private static final Duration LEASE = Duration.ofMinutes(10);

    @Override
    protected IdempotencyKeyStore createIdempotencyKeyStore(Clock clock) {
        return new InMemoryIdempotencyKeyStore(LEASE, clock);
    }

    @Override
    protected Duration reservationLease() {
        return LEASE;
    }
}
