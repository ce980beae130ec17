package com.ryuqq.orgsetup.core.spi;

import com.ryuqq.orgsetup.core.exception.SetupException;
import com.ryuqq.orgsetup.core.model.ConflictRecord;
import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import com.ryuqq.orgsetup.core.model.RequestContext;
import com.ryuqq.orgsetup.core.model.ResourceHandle;
import com.ryuqq.orgsetup.core.model.RetryState;
import com.ryuqq.orgsetup.core.model.SetupResult;
import com.ryuqq.orgsetup.core.model.SetupStep;
import com.ryuqq.orgsetup.core.report.CompensationResult;

/**
 * 셋업 진행 상황 관찰자.
 *
 * <p>모든 메서드는 기본 구현이 비어 있으므로 필요한 콜백만 재정의합니다.
 * 콜백은 셋업을 실행하는 스레드에서 동기적으로 호출되며,
 * 콜백에서 발생한 예외는 셋업 흐름에 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SetupObserver {

    default void onSetupStarted(RequestContext context) {
    }

    default void onReplay(IdempotencyKey key, SetupResult result) {
    }

    default void onStepStarted(RequestContext context, SetupStep step) {
    }

    default void onStepCompleted(RequestContext context, SetupStep step, ResourceHandle handle) {
    }

    default void onStepSkipped(RequestContext context, SetupStep step, String reason) {
    }

    default void onRetry(RequestContext context, SetupStep step, RetryState state) {
    }

    default void onConflictResolved(RequestContext context, SetupStep step, ConflictRecord conflict) {
    }

    default void onStepFailed(RequestContext context, SetupStep step, Throwable cause) {
    }

    default void onRollbackStep(RequestContext context, CompensationResult result) {
    }

    default void onSetupCompleted(RequestContext context, SetupResult result) {
    }

    default void onSetupFailed(RequestContext context, SetupException failure) {
    }

    /**
     * 아무 동작도 하지 않는 관찰자.
     *
     * @return no-op SetupObserver
     */
    static SetupObserver noOp() {
        return new SetupObserver() {
        };
    }
}
