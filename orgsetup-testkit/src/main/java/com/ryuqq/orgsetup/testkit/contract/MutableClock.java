package com.ryuqq.orgsetup.testkit.contract;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock whose current instant is moved explicitly by the test.
 *
 * <p>Thread-safe. Used together with {@link RecordingSleeper} so that backoff waits
 * advance time without blocking.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final AtomicReference<Instant> now;
    private final ZoneId zone;

    public MutableClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    private MutableClock(Instant start, ZoneId zone) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = new AtomicReference<>(start);
        this.zone = zone;
    }

    /**
     * Moves the clock forward.
     *
     * @param amount non-negative duration
     * @return the new instant
     */
    public Instant advance(Duration amount) {
        if (amount == null || amount.isNegative()) {
            throw new IllegalArgumentException("amount must be non-negative");
        }
        return now.updateAndGet(current -> current.plus(amount));
    }

    public void set(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        now.set(instant);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(now.get(), zone);
    }

    @Override
    public Instant instant() {
        return now.get();
    }
}
