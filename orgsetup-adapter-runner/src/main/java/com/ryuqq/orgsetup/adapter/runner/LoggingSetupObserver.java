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
 * 셋업 진행 상황을 SLF4J로 기록하는 관찰자.
 *
 * <p>단계 시작/완료는 DEBUG/INFO, 재시도와 충돌 해결은 WARN/INFO,
 * 실패는 ERROR로 기록합니다. 모든 메시지에 correlationId를 포함합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LoggingSetupObserver implements SetupObserver {

    private final Logger log;

    public LoggingSetupObserver() {
        this(LoggerFactory.getLogger(LoggingSetupObserver.class));
    }

    /**
     * 로거를 지정하여 생성.
     *
     * @param log 기록할 Logger
     * @throws IllegalArgumentException log가 null인 경우
     */
    public LoggingSetupObserver(Logger log) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.log = log;
    }

    @Override
    public void onSetupStarted(RequestContext context) {
        log.info("[{}] Organization setup started (key: {}, deadline: {})",
            context.correlationId(), context.idempotencyKey(), context.deadline());
    }

    @Override
    public void onReplay(IdempotencyKey key, SetupResult result) {
        log.info("Setup for {} already completed, returning stored result (organization: {})",
            key, result.organization().id());
    }

    @Override
    public void onStepStarted(RequestContext context, SetupStep step) {
        log.debug("[{}] {} started", context.correlationId(), step);
    }

    @Override
    public void onStepCompleted(RequestContext context, SetupStep step, ResourceHandle handle) {
        log.info("[{}] {} completed: {} {}{}", context.correlationId(), step,
            handle.kind(), handle.externalId(), handle.owned() ? "" : " (reused)");
    }

    @Override
    public void onStepSkipped(RequestContext context, SetupStep step, String reason) {
        log.info("[{}] {} skipped: {}", context.correlationId(), step, reason);
    }

    @Override
    public void onRetry(RequestContext context, SetupStep step, RetryState state) {
        log.warn("[{}] {} attempt {} failed, retrying in {}ms: {}", context.correlationId(), step,
            state.attemptCount(), state.nextDelay().toMillis(),
            state.lastError() == null ? null : state.lastError().getMessage());
    }

    @Override
    public void onConflictResolved(RequestContext context, SetupStep step, ConflictRecord conflict) {
        log.info("[{}] {} conflict {} resolved by reusing existing resource {}", context.correlationId(),
            step, conflict.type(), conflict.existingResourceId());
    }

    @Override
    public void onStepFailed(RequestContext context, SetupStep step, Throwable cause) {
        log.error("[{}] {} failed: {}", context.correlationId(), step, cause.getMessage());
    }

    @Override
    public void onRollbackStep(RequestContext context, CompensationResult result) {
        if (result.isFailed()) {
            log.error("[{}] Compensation of {} {} failed after {} attempt(s): {}", context.correlationId(),
                result.handle().kind(), result.handle().externalId(), result.attempts(), result.lastError());
        } else {
            log.info("[{}] Compensation of {} {}: {}", context.correlationId(),
                result.handle().kind(), result.handle().externalId(), result.status());
        }
    }

    @Override
    public void onSetupCompleted(RequestContext context, SetupResult result) {
        log.info("[{}] Organization setup completed (organization: {}, partial: {}, reused: {})",
            context.correlationId(), result.organization().id(), result.isPartial(),
            result.metadata().reusedSteps());
    }

    @Override
    public void onSetupFailed(RequestContext context, SetupException failure) {
        log.error("[{}] Organization setup failed at {} (rollback executed: {}, manual cleanup required: {})",
            context.correlationId(), failure.getStep(), failure.isRollbackExecuted(),
            failure.requiresManualCleanup());
    }
}
