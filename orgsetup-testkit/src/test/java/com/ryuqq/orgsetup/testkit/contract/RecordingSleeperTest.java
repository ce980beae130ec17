package com.ryuqq.orgsetup.testkit.contract;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * RecordingSleeper / MutableClock tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RecordingSleeperTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void sleep_RecordsAndAdvancesClock() throws InterruptedException {
        MutableClock clock = new MutableClock(START);
        RecordingSleeper sleeper = new RecordingSleeper(clock);

        sleeper.sleep(Duration.ofSeconds(1));
        sleeper.sleep(Duration.ofSeconds(2));

        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.sleeps());
        assertEquals(Duration.ofSeconds(3), sleeper.totalSlept());
        assertEquals(START.plusSeconds(3), clock.instant());
    }

    @Test
    void interruptOnSleep_ThrowsOnRequestedCallWithoutAdvancing() throws InterruptedException {
        MutableClock clock = new MutableClock(START);
        RecordingSleeper sleeper = new RecordingSleeper(clock);
        sleeper.interruptOnSleep(2);

        sleeper.sleep(Duration.ofSeconds(1));
        assertThrows(InterruptedException.class, () -> sleeper.sleep(Duration.ofSeconds(2)));

        assertEquals(START.plusSeconds(1), clock.instant());
    }

    @Test
    void advance_NegativeDuration_Rejected() {
        MutableClock clock = new MutableClock(START);

        assertThrows(IllegalArgumentException.class, () -> clock.advance(Duration.ofSeconds(-1)));
    }
}
