package com.ryuqq.orgsetup.core.exception;

import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import com.ryuqq.orgsetup.core.model.ResourceHandle;
import com.ryuqq.orgsetup.core.model.SetupStep;
import com.ryuqq.orgsetup.core.report.ManualCleanupReport;
import com.ryuqq.orgsetup.core.report.RollbackOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * 필수 단계 실패로 셋업이 완료되지 못함.
 *
 * <p><strong>포함 정보:</strong></p>
 * <ul>
 *   <li>step: 실패한 단계</li>
 *   <li>completedSteps: 실패 전에 완료된 단계</li>
 *   <li>createdResources: 실패 시점의 리소스 레지스트리 스냅샷</li>
 *   <li>rollbackOutcome: 롤백을 시도했으면 그 결과</li>
 *   <li>manualCleanupReport: 자동으로 정리하지 못한 리소스 (없으면 null)</li>
 * </ul>
 *
 * <p>{@link #isRollbackExecuted()}는 롤백이 실행되어 모든 소유 리소스를
 * 정리한 경우에만 true입니다. false이고 {@link #requiresManualCleanup()}이
 * true이면 수동 정리 보고서를 처리해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SetupException extends OrgSetupException {

    public static final String ERROR_CODE = "SETUP_FAILED";

    private final IdempotencyKey idempotencyKey;
    private final SetupStep step;
    private final List<SetupStep> completedSteps;
    private final List<ResourceHandle> createdResources;
    private final RollbackOutcome rollbackOutcome;
    private final ManualCleanupReport manualCleanupReport;

    /**
     * 생성자.
     *
     * @param idempotencyKey 멱등성 키
     * @param step 실패한 단계
     * @param completedSteps 완료된 단계
     * @param createdResources 리소스 레지스트리 스냅샷
     * @param rollbackOutcome 롤백 결과 (롤백하지 않았으면 null)
     * @param manualCleanupReport 수동 정리 보고서 (정리할 것이 없으면 null)
     * @param cause 실패 원인
     */
    public SetupException(
        IdempotencyKey idempotencyKey,
        SetupStep step,
        List<SetupStep> completedSteps,
        List<ResourceHandle> createdResources,
        RollbackOutcome rollbackOutcome,
        ManualCleanupReport manualCleanupReport,
        Throwable cause
    ) {
        super(ERROR_CODE, describe(step, cause, rollbackOutcome), cause);
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        this.idempotencyKey = idempotencyKey;
        this.step = step;
        this.completedSteps = completedSteps == null ? List.of() : List.copyOf(completedSteps);
        this.createdResources = createdResources == null ? List.of() : List.copyOf(createdResources);
        this.rollbackOutcome = rollbackOutcome;
        this.manualCleanupReport = manualCleanupReport;
    }

    private static String describe(SetupStep step, Throwable cause, RollbackOutcome rollbackOutcome) {
        StringBuilder message = new StringBuilder("Organization setup failed at ").append(step);
        if (cause != null && cause.getMessage() != null) {
            message.append(": ").append(cause.getMessage());
        }
        if (rollbackOutcome != null) {
            message.append(rollbackOutcome.isFullySuccessful()
                ? " (rolled back)"
                : " (rollback incomplete, manual cleanup required)");
        }
        return message.toString();
    }

    public IdempotencyKey getIdempotencyKey() {
        return idempotencyKey;
    }

    public SetupStep getStep() {
        return step;
    }

    public List<SetupStep> getCompletedSteps() {
        return completedSteps;
    }

    public List<ResourceHandle> getCreatedResources() {
        return createdResources;
    }

    /**
     * 롤백 결과.
     *
     * @return 롤백을 시도했으면 결과, 아니면 null
     */
    public RollbackOutcome getRollbackOutcome() {
        return rollbackOutcome;
    }

    public ManualCleanupReport getManualCleanupReport() {
        return manualCleanupReport;
    }

    public boolean isRollbackAttempted() {
        return rollbackOutcome != null;
    }

    /**
     * 롤백이 실행되어 모든 소유 리소스가 정리되었는지 확인.
     *
     * @return 롤백 성공 시 true
     */
    public boolean isRollbackExecuted() {
        return rollbackOutcome != null && rollbackOutcome.isFullySuccessful();
    }

    public boolean requiresManualCleanup() {
        return manualCleanupReport != null && manualCleanupReport.requiresAction();
    }

    /**
     * 호출자 취소(인터럽트 또는 마감 시각 초과)로 실패했는지 확인.
     *
     * @return 취소된 경우 true
     */
    public boolean isCancelled() {
        return getCause() instanceof SetupCancelledException;
    }

    /**
     * 실패 원인과 정리 상태에 따른 복구 방법.
     *
     * @return 복구 방법 목록 (권장 순서)
     */
    public List<RecoveryOption> getRecoveryOptions() {
        List<RecoveryOption> options = new ArrayList<>();
        Throwable cause = getCause();

        if (isCancelled()) {
            options.add(new RecoveryOption(RecoveryOption.Action.RETRY_WITH_BACKOFF,
                "Setup was cancelled; retry with a longer deadline"));
        } else if (cause instanceof IdempotencyConflictException) {
            options.add(new RecoveryOption(RecoveryOption.Action.RESUME_WITH_SAME_KEY,
                "Another execution took over the idempotency key; call again with the same key to receive its result"));
        } else if (cause instanceof UnresolvableConflictException conflict) {
            options.add(new RecoveryOption(RecoveryOption.Action.RETRY_WITH_ADJUSTED_INPUT,
                "Change the conflicting " + conflict.getConflict().type().code() + " value and retry"));
        } else if (cause instanceof ResourceApiException api && isTransient(api.getKind())) {
            options.add(new RecoveryOption(RecoveryOption.Action.RETRY_WITH_BACKOFF,
                "Transient " + api.getKind() + " persisted through all retries; retry later"));
        }

        if (requiresManualCleanup()) {
            options.add(new RecoveryOption(RecoveryOption.Action.MANUAL_CLEANUP_THEN_RETRY,
                "Clean up " + manualCleanupReport.items().size() + " leftover resource(s) before retrying"));
        } else if (!isRollbackAttempted() && !createdResources.isEmpty()) {
            options.add(new RecoveryOption(RecoveryOption.Action.RESUME_WITH_SAME_KEY,
                "Retry with the same idempotency key; resources created so far are reused through conflict resolution"));
        } else {
            options.add(new RecoveryOption(RecoveryOption.Action.FULL_RETRY,
                "No resources are left behind; the setup can be retried from the beginning"));
        }
        return options;
    }

    private static boolean isTransient(ApiErrorKind kind) {
        return kind == ApiErrorKind.NETWORK_TIMEOUT
            || kind == ApiErrorKind.CONNECTION_RESET
            || kind == ApiErrorKind.SERVER_ERROR
            || kind == ApiErrorKind.RATE_LIMITED;
    }
}
