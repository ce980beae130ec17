package com.ryuqq.orgsetup.core.spi;

import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reservation 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ReservationTest {

    private static final IdempotencyKey KEY = IdempotencyKey.of("idem-reservation-001");

    @Test
    void acquired_CarriesToken() {
        // When
        Reservation reservation = Reservation.acquired(KEY, "token-1");

        // Then
        assertTrue(reservation.isAcquired());
        assertEquals("token-1", reservation.token());
        assertEquals(KEY, reservation.key());
    }

    @Test
    void acquired_BlankToken_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Reservation.acquired(KEY, " "));
        assertThrows(IllegalArgumentException.class, () -> Reservation.acquired(KEY, null));
    }

    @Test
    void constructor_NotAcquired_DropsToken() {
        // When
        Reservation reservation = new Reservation(KEY, ReservationStatus.IN_FLIGHT, "token-1");

        // Then
        assertFalse(reservation.isAcquired());
        assertNull(reservation.token());
    }

    @Test
    void of_NullKeyOrStatus_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Reservation.of(null, ReservationStatus.COMPLETED));
        assertThrows(IllegalArgumentException.class, () -> Reservation.of(KEY, null));
    }
}
