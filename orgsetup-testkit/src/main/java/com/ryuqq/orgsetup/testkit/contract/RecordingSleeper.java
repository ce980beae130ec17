package com.ryuqq.orgsetup.testkit.contract;

import com.ryuqq.orgsetup.adapter.runner.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Sleeper} that records every requested wait and advances a {@link MutableClock}
 * instead of blocking.
 *
 * <p>{@link #interruptOnSleep(int)} makes the n-th wait throw {@link InterruptedException},
 * which simulates a cancellation arriving while a retry is backing off.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RecordingSleeper implements Sleeper {

    private final MutableClock clock;
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private final AtomicInteger interruptAt = new AtomicInteger(-1);

    public RecordingSleeper(MutableClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        sleeps.add(duration);
        if (sleeps.size() == interruptAt.get()) {
            throw new InterruptedException("interrupted by test on sleep #" + sleeps.size());
        }
        clock.advance(duration);
    }

    /**
     * Makes the given (1-based) sleep call throw {@link InterruptedException}.
     *
     * @param sleepNumber which sleep to interrupt
     */
    public void interruptOnSleep(int sleepNumber) {
        if (sleepNumber <= 0) {
            throw new IllegalArgumentException("sleepNumber must be positive");
        }
        interruptAt.set(sleepNumber);
    }

    public List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }

    public Duration totalSlept() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }

    public void clear() {
        sleeps.clear();
        interruptAt.set(-1);
    }
}
