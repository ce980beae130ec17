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

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 여러 관찰자에게 순서대로 전달하는 관찰자.
 *
 * <p>각 관찰자는 개별적으로 보호되므로 하나가 예외를 던져도 나머지는 호출됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CompositeSetupObserver implements SetupObserver {

    private final List<SetupObserver> observers;

    /**
     * 생성자.
     *
     * @param observers 관찰자 목록 (등록 순서대로 호출)
     * @throws IllegalArgumentException observers가 null이거나 null 요소를 포함하는 경우
     */
    public CompositeSetupObserver(List<SetupObserver> observers) {
        if (observers == null || observers.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("observers cannot be null or contain null");
        }
        this.observers = observers.stream().map(GuardedSetupObserver::wrap).toList();
    }

    public static CompositeSetupObserver of(SetupObserver... observers) {
        return new CompositeSetupObserver(List.of(observers));
    }

    private void each(Consumer<SetupObserver> callback) {
        observers.forEach(callback);
    }

    @Override
    public void onSetupStarted(RequestContext context) {
        each(o -> o.onSetupStarted(context));
    }

    @Override
    public void onReplay(IdempotencyKey key, SetupResult result) {
        each(o -> o.onReplay(key, result));
    }

    @Override
    public void onStepStarted(RequestContext context, SetupStep step) {
        each(o -> o.onStepStarted(context, step));
    }

    @Override
    public void onStepCompleted(RequestContext context, SetupStep step, ResourceHandle handle) {
        each(o -> o.onStepCompleted(context, step, handle));
    }

    @Override
    public void onStepSkipped(RequestContext context, SetupStep step, String reason) {
        each(o -> o.onStepSkipped(context, step, reason));
    }

    @Override
    public void onRetry(RequestContext context, SetupStep step, RetryState state) {
        each(o -> o.onRetry(context, step, state));
    }

    @Override
    public void onConflictResolved(RequestContext context, SetupStep step, ConflictRecord conflict) {
        each(o -> o.onConflictResolved(context, step, conflict));
    }

    @Override
    public void onStepFailed(RequestContext context, SetupStep step, Throwable cause) {
        each(o -> o.onStepFailed(context, step, cause));
    }

    @Override
    public void onRollbackStep(RequestContext context, CompensationResult result) {
        each(o -> o.onRollbackStep(context, result));
    }

    @Override
    public void onSetupCompleted(RequestContext context, SetupResult result) {
        each(o -> o.onSetupCompleted(context, result));
    }

    @Override
    public void onSetupFailed(RequestContext context, SetupException failure) {
        each(o -> o.onSetupFailed(context, failure));
    }
}
