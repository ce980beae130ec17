package com.ryuqq.orgsetup.core.exception;

import com.ryuqq.orgsetup.core.model.SetupStep;

/**
 * 호출자 요청(인터럽트 또는 마감 시각 초과)으로 셋업이 중단됨.
 *
 * <p>{@link SetupException}의 cause로 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SetupCancelledException extends OrgSetupException {

    public static final String ERROR_CODE = "SETUP_CANCELLED";

    private final SetupStep step;
    private final boolean interrupted;

    public SetupCancelledException(SetupStep step, String reason, boolean interrupted, Throwable cause) {
        super(ERROR_CODE, "Setup cancelled at " + step + ": " + reason, cause);
        this.step = step;
        this.interrupted = interrupted;
    }

    public SetupStep getStep() {
        return step;
    }

    /**
     * 스레드 인터럽트로 중단되었는지 여부 (false면 마감 시각 초과).
     *
     * @return 인터럽트 여부
     */
    public boolean isInterrupted() {
        return interrupted;
    }
}
