package com.ryuqq.orgsetup.adapter.runner;

import com.ryuqq.orgsetup.core.exception.SetupException;
import com.ryuqq.orgsetup.core.model.ConflictRecord;
import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import com.ryuqq.orgsetup.core.model.RequestContext;
import com.ryuqq.orgsetup.core.model.ResourceHandle;
import com.ryuqq.orgsetup.core.model.RetryState;
import com.ryuqq.orgsetup.core.model.SetupResult;
import com.ryuqq.orgsetup.core.model.SetupStep;
import com.ryuqq.orgsetup.core.report.CompensationResult;
import com.ryuqq.orgsetup.core.spi.SetupObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 관찰자 예외가 셋업 흐름에 전파되지 않도록 감싸는 관찰자.
 *
 * <p>관찰자에서 발생한 RuntimeException은 WARN으로 기록하고 흐름을 계속합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class GuardedSetupObserver implements SetupObserver {

    private static final Logger log = LoggerFactory.getLogger(GuardedSetupObserver.class);

    private final SetupObserver delegate;

    private GuardedSetupObserver(SetupObserver delegate) {
        this.delegate = delegate;
    }

    static SetupObserver wrap(SetupObserver observer) {
        if (observer == null) {
            return SetupObserver.noOp();
        }
        if (observer instanceof GuardedSetupObserver) {
            return observer;
        }
        return new GuardedSetupObserver(observer);
    }

    private void guard(String callback, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("SetupObserver {} threw, ignoring", callback, e);
        }
    }

    @Override
    public void onSetupStarted(RequestContext context) {
        guard("onSetupStarted", () -> delegate.onSetupStarted(context));
    }

    @Override
    public void onReplay(IdempotencyKey key, SetupResult result) {
        guard("onReplay", () -> delegate.onReplay(key, result));
    }

    @Override
    public void onStepStarted(RequestContext context, SetupStep step) {
        guard("onStepStarted", () -> delegate.onStepStarted(context, step));
    }

    @Override
    public void onStepCompleted(RequestContext context, SetupStep step, ResourceHandle handle) {
        guard("onStepCompleted", () -> delegate.onStepCompleted(context, step, handle));
    }

    @Override
    public void onStepSkipped(RequestContext context, SetupStep step, String reason) {
        guard("onStepSkipped", () -> delegate.onStepSkipped(context, step, reason));
    }

    @Override
    public void onRetry(RequestContext context, SetupStep step, RetryState state) {
        guard("onRetry", () -> delegate.onRetry(context, step, state));
    }

    @Override
    public void onConflictResolved(RequestContext context, SetupStep step, ConflictRecord conflict) {
        guard("onConflictResolved", () -> delegate.onConflictResolved(context, step, conflict));
    }

    @Override
    public void onStepFailed(RequestContext context, SetupStep step, Throwable cause) {
        guard("onStepFailed", () -> delegate.onStepFailed(context, step, cause));
    }

    @Override
    public void onRollbackStep(RequestContext context, CompensationResult result) {
        guard("onRollbackStep", () -> delegate.onRollbackStep(context, result));
    }

    @Override
    public void onSetupCompleted(RequestContext context, SetupResult result) {
        guard("onSetupCompleted", () -> delegate.onSetupCompleted(context, result));
    }

    @Override
    public void onSetupFailed(RequestContext context, SetupException failure) {
        guard("onSetupFailed", () -> delegate.onSetupFailed(context, failure));
    }
}
