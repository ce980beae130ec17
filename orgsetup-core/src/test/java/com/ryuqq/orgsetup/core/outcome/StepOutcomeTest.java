package com.ryuqq.orgsetup.core.outcome;

import com.ryuqq.orgsetup.core.model.ConflictRecord;
import com.ryuqq.orgsetup.core.model.ConflictType;
import com.ryuqq.orgsetup.core.model.SetupStep;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StepOutcome 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StepOutcomeTest {

    @Test
    void success_IsOnlySuccess() {
        // When
        StepOutcome<String> outcome = new Success<>("org_1");

        // Then
        assertTrue(outcome.isSuccess());
        assertFalse(outcome.isConflict());
        assertFalse(outcome.isTransient());
        assertFalse(outcome.isFatal());
    }

    @Test
    void conflict_CarriesRecord() {
        // Given
        ConflictRecord record = new ConflictRecord(
            ConflictType.EMAIL_EXISTS, SetupStep.ADMIN_USER_CREATION, List.of("email"), "user_1", null, null);

        // When
        StepOutcome<String> outcome = new Conflict<>(record, null);

        // Then
        assertTrue(outcome.isConflict());
        assertSame(record, ((Conflict<String>) outcome).record());
    }

    @Test
    void transientAndFatal_AreDistinguished() {
        StepOutcome<String> retry = new Transient<>(new RuntimeException("timeout"));
        StepOutcome<String> fatal = new Fatal<>(new RuntimeException("forbidden"));

        assertTrue(retry.isTransient());
        assertFalse(retry.isFatal());
        assertTrue(fatal.isFatal());
        assertFalse(fatal.isTransient());
    }

    @Test
    void constructors_NullPayload_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Success<String>(null));
        assertThrows(IllegalArgumentException.class, () -> new Conflict<String>(null, null));
        assertThrows(IllegalArgumentException.class, () -> new Transient<String>(null));
        assertThrows(IllegalArgumentException.class, () -> new Fatal<String>(null));
    }
}
