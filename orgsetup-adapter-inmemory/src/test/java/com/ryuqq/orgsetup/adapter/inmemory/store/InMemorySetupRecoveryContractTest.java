package com.ryuqq.orgsetup.adapter.inmemory.store;

import com.ryuqq.orgsetup.core.spi.IdempotencyKeyStore;
import com.ryuqq.orgsetup.testkit.contract.SetupRecoveryContract;

import java.time.Clock;
import java.time.Duration;

/**
 * Runs the retry, conflict recovery, partial domain and cancellation contract against {@link InMemoryIdempotencyKeyStore}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemorySetupRecoveryContractTest extends SetupRecoveryContract {

    private static final Duration LEASE = Duration.ofMinutes(10);

    @Override
    protected IdempotencyKeyStore createIdempotencyKeyStore(Clock clock) {
        return new InMemoryIdempotencyKeyStore(LEASE, clock);
    }
}
