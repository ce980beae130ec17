package com.ryuqq.orgsetup.core.exception;

import com.ryuqq.orgsetup.core.model.ConflictRecord;
import com.ryuqq.orgsetup.core.model.ConflictType;
import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import com.ryuqq.orgsetup.core.model.ResourceHandle;
import com.ryuqq.orgsetup.core.model.ResourceKind;
import com.ryuqq.orgsetup.core.model.SetupStep;
import com.ryuqq.orgsetup.core.report.CleanupItem;
import com.ryuqq.orgsetup.core.report.CompensationResult;
import com.ryuqq.orgsetup.core.report.ManualCleanupReport;
import com.ryuqq.orgsetup.core.report.RollbackOutcome;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SetupException 테스트.
 *
 * <p>롤백 상태 플래그와 복구 방법 도출을 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SetupExceptionTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final IdempotencyKey KEY = IdempotencyKey.of("idem-failure-001");

    private final ResourceHandle org = ResourceHandle.created(ResourceKind.ORGANIZATION, "org_1", "org_1", NOW);
    private final ResourceHandle tenant = ResourceHandle.created(ResourceKind.TENANT, "tenant_1", "tenant_1", NOW);

    @Test
    void rolledBackCleanly_FullRetry() {
        // Given
        RollbackOutcome outcome = new RollbackOutcome(
            List.of(CompensationResult.compensated(tenant, 1), CompensationResult.compensated(org, 1)),
            emptyReport(), false);

        // When
        SetupException exception = failure(ResourceApiException.validation("bad password"), outcome, null);

        // Then
        assertTrue(exception.isRollbackAttempted());
        assertTrue(exception.isRollbackExecuted());
        assertFalse(exception.requiresManualCleanup());
        assertFalse(exception.isCancelled());
        assertEquals(List.of(RecoveryOption.Action.FULL_RETRY), actions(exception));
        assertEquals(SetupException.ERROR_CODE, exception.getErrorCode());
        assertTrue(exception.getMessage().contains("ADMIN_USER_CREATION"));
    }

    @Test
    void compensationFailed_ManualCleanupThenRetry() {
        // Given
        ManualCleanupReport report = new ManualCleanupReport(
            KEY, SetupStep.ADMIN_USER_CREATION, List.of(CleanupItem.from(tenant, "locked")), NOW);
        RollbackOutcome outcome = new RollbackOutcome(
            List.of(CompensationResult.failed(tenant, 3, "locked"), CompensationResult.compensated(org, 1)),
            report, false);

        // When
        SetupException exception = failure(ResourceApiException.validation("bad"), outcome, report);

        // Then
        assertTrue(exception.isRollbackAttempted());
        assertFalse(exception.isRollbackExecuted());
        assertTrue(exception.requiresManualCleanup());
        assertEquals(List.of(RecoveryOption.Action.MANUAL_CLEANUP_THEN_RETRY), actions(exception));
    }

    @Test
    void noRollbackWithResources_ResumeWithSameKey() {
        SetupException exception = failure(ResourceApiException.validation("bad"), null, null);

        assertFalse(exception.isRollbackAttempted());
        assertEquals(List.of(RecoveryOption.Action.RESUME_WITH_SAME_KEY), actions(exception));
    }

    @Test
    void transientCause_RetryWithBackoffFirst() {
        RollbackOutcome outcome = new RollbackOutcome(List.of(), emptyReport(), false);

        SetupException exception = failure(ResourceApiException.serverError(503, "down"), outcome, null);

        assertEquals(List.of(RecoveryOption.Action.RETRY_WITH_BACKOFF, RecoveryOption.Action.FULL_RETRY),
            actions(exception));
    }

    @Test
    void unresolvableConflict_RetryWithAdjustedInput() {
        // Given
        ConflictRecord conflict = new ConflictRecord(
            ConflictType.EMAIL_EXISTS, SetupStep.ADMIN_USER_CREATION, List.of("email"), "user_9", null, null);
        RollbackOutcome outcome = new RollbackOutcome(List.of(), emptyReport(), false);

        // When
        SetupException exception = failure(new UnresolvableConflictException(conflict, "other user"), outcome, null);

        // Then
        List<RecoveryOption> options = exception.getRecoveryOptions();
        assertEquals(RecoveryOption.Action.RETRY_WITH_ADJUSTED_INPUT, options.get(0).action());
        assertTrue(options.get(0).description().contains("email_exists"));
    }

    @Test
    void cancelled_IsCancelled() {
        SetupCancelledException cancelled =
            new SetupCancelledException(SetupStep.ADMIN_USER_CREATION, "deadline exceeded", false, null);

        SetupException exception = failure(cancelled, new RollbackOutcome(List.of(), emptyReport(), false), null);

        assertTrue(exception.isCancelled());
        assertEquals(RecoveryOption.Action.RETRY_WITH_BACKOFF, actions(exception).get(0));
    }

    @Test
    void reservationLost_ResumeWithSameKeyFirst() {
        // Given
        IdempotencyConflictException lost = new IdempotencyConflictException(
            KEY, IdempotencyConflictException.Reason.RESERVATION_LOST, new IllegalStateException("taken over"));
        RollbackOutcome outcome = new RollbackOutcome(List.of(), emptyReport(), false);

        // When
        SetupException exception = failure(lost, outcome, null);

        // Then
        assertEquals(RecoveryOption.Action.RESUME_WITH_SAME_KEY, actions(exception).get(0));
        assertTrue(lost.getMessage().contains("was taken over by another execution"));
        assertInstanceOf(IllegalStateException.class, lost.getCause());
    }

    @Test
    void constructor_NullStep_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new SetupException(KEY, null, List.of(), List.of(), null, null, new RuntimeException()));
    }

    @Test
    void resourceApiException_FromStatus_MapsKinds() {
        assertEquals(ApiErrorKind.VALIDATION, ResourceApiException.ofStatus(422, "x").getKind());
        assertEquals(ApiErrorKind.UNAUTHORIZED, ResourceApiException.ofStatus(401, "x").getKind());
        assertEquals(ApiErrorKind.CONFLICT, ResourceApiException.ofStatus(409, "x").getKind());
        assertEquals(ApiErrorKind.RATE_LIMITED, ResourceApiException.ofStatus(429, "x").getKind());
        assertEquals(ApiErrorKind.NETWORK_TIMEOUT, ResourceApiException.ofStatus(504, "x").getKind());
        assertEquals(ApiErrorKind.SERVER_ERROR, ResourceApiException.ofStatus(500, "x").getKind());
        assertEquals(ApiErrorKind.UNKNOWN, ResourceApiException.ofStatus(302, "x").getKind());
        assertEquals(504, ResourceApiException.ofStatus(504, "x").getHttpStatus());
    }

    private SetupException failure(Throwable cause, RollbackOutcome outcome, ManualCleanupReport report) {
        return new SetupException(
            KEY, SetupStep.ADMIN_USER_CREATION,
            List.of(SetupStep.ORGANIZATION_CREATION, SetupStep.TENANT_CREATION),
            List.of(org, tenant), outcome, report, cause);
    }

    private static ManualCleanupReport emptyReport() {
        return new ManualCleanupReport(KEY, SetupStep.ADMIN_USER_CREATION, List.of(), NOW);
    }

    private static List<RecoveryOption.Action> actions(SetupException exception) {
        return exception.getRecoveryOptions().stream().map(RecoveryOption::action).toList();
    }
}
