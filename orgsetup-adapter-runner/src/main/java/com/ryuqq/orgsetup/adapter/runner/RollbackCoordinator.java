package com.ryuqq.orgsetup.adapter.runner;

import com.ryuqq.orgsetup.core.exception.ApiErrorKind;
import com.ryuqq.orgsetup.core.exception.ResourceApiException;
import com.ryuqq.orgsetup.core.exception.SetupException;
import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import com.ryuqq.orgsetup.core.model.RequestContext;
import com.ryuqq.orgsetup.core.model.ResourceHandle;
import com.ryuqq.orgsetup.core.model.SetupStep;
import com.ryuqq.orgsetup.core.report.CleanupItem;
import com.ryuqq.orgsetup.core.report.CompensationResult;
import com.ryuqq.orgsetup.core.report.ManualCleanupReport;
import com.ryuqq.orgsetup.core.report.RollbackOutcome;
import com.ryuqq.orgsetup.core.spi.SetupObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 보상 동작(compensating action) 실행기.
 *
 * <p>리소스 레지스트리 스냅샷을 생성의 역순으로 되돌립니다.
 * 한 리소스의 보상이 실패해도 중단하지 않고 나머지를 계속 처리하며,
 * 실패한 리소스는 수동 정리 보고서에 남깁니다.</p>
 *
 * <p><strong>리소스별 처리:</strong></p>
 * <ol>
 *   <li>재사용한 리소스(owned=false): SKIPPED</li>
 *   <li>보상 호출 (관리자 삭제, API 키 폐기, 테넌트 삭제, 조직 삭제, 도메인 제거)</li>
 *   <li>404: 이미 없으므로 COMPENSATED</li>
 *   <li>일시적 오류: 백오프 후 재시도 (최대 maxAttempts)</li>
 *   <li>그 외 또는 재시도 소진: FAILED, 수동 정리 대상</li>
 * </ol>
 *
 * <p><strong>인터럽트:</strong> 롤백 도중 인터럽트되면 이후 백오프 대기는 생략하지만
 * 남은 리소스는 모두 한 번씩 보상을 시도합니다. 종료 시 인터럽트 플래그를 복원합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RollbackCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RollbackCoordinator.class);

    private final PlatformServices services;
    private final RollbackConfig config;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Clock clock;
    private final SetupObserver observer;

    /**
     * 기본 설정으로 생성.
     *
     * @param services 리소스 API
     */
    public RollbackCoordinator(PlatformServices services) {
        this(services, new RollbackConfig(), Sleeper.threadSleep(), Clock.systemUTC(), SetupObserver.noOp());
    }

    /**
     * 생성자.
     *
     * @param services 리소스 API
     * @param config 롤백 설정
     * @param sleeper 재시도 대기
     * @param clock 보고서 시각용 Clock
     * @param observer 관찰자
     * @throws IllegalArgumentException 인자 중 하나라도 null인 경우
     */
    public RollbackCoordinator(
        PlatformServices services,
        RollbackConfig config,
        Sleeper sleeper,
        Clock clock,
        SetupObserver observer
    ) {
        if (services == null || config == null || sleeper == null || clock == null || observer == null) {
            throw new IllegalArgumentException("services, config, sleeper, clock and observer cannot be null");
        }
        this.services = services;
        this.config = config;
        this.retryPolicy = new RetryPolicy(config.toRetryConfig());
        this.sleeper = sleeper;
        this.clock = clock;
        this.observer = GuardedSetupObserver.wrap(observer);
    }

    /**
     * 스냅샷 롤백 (셋업 실행과 무관한 독립 호출).
     *
     * @param snapshot 리소스 스냅샷 (생성 순서)
     * @return 롤백 결과
     */
    public RollbackOutcome rollback(List<ResourceHandle> snapshot) {
        return rollback(RequestContext.detached(), snapshot, null);
    }

    /**
     * 스냅샷 롤백.
     *
     * @param context 요청 컨텍스트
     * @param snapshot 리소스 스냅샷 (생성 순서)
     * @param failurePoint 실패한 단계 (보고서용, null 가능)
     * @return 롤백 결과 (예외를 던지지 않음)
     * @throws IllegalArgumentException context 또는 snapshot이 null인 경우
     */
    public RollbackOutcome rollback(RequestContext context, List<ResourceHandle> snapshot, SetupStep failurePoint) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }

        RollbackRun run = new RollbackRun(Thread.interrupted());
        log.info("Rollback started for {} resource(s), failure point: {}", snapshot.size(), failurePoint);

        List<CompensationResult> results = new ArrayList<>();
        List<CleanupItem> cleanupItems = new ArrayList<>();
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            ResourceHandle handle = snapshot.get(i);
            CompensationResult result = compensate(context, handle, run);
            results.add(result);
            if (result.isFailed()) {
                cleanupItems.add(CleanupItem.from(handle, result.lastError()));
            }
            observer.onRollbackStep(context, result);

            if (i > 0 && result.attempts() > 0) {
                pause(config.interProcedureDelay(), run);
            }
        }

        ManualCleanupReport report = new ManualCleanupReport(
            context.idempotencyKey(), failurePoint, cleanupItems, clock.instant()
        );
        RollbackOutcome outcome = new RollbackOutcome(results, report, run.interrupted);
        if (outcome.isFullySuccessful()) {
            log.info("Rollback completed: {} resource(s) compensated", results.size());
        } else {
            log.error("Rollback incomplete: {} resource(s) require manual cleanup", cleanupItems.size());
        }

        if (run.interrupted) {
            Thread.currentThread().interrupt();
        }
        return outcome;
    }

    private CompensationResult compensate(RequestContext context, ResourceHandle handle, RollbackRun run) {
        if (!handle.owned()) {
            log.info("Skipping compensation of reused {} {}", handle.kind(), handle.externalId());
            return CompensationResult.skipped(handle);
        }

        int attempt = 0;
        while (true) {
            attempt++;
            try {
                invokeCompensation(context, handle);
                log.info("Compensated {} {} ({})", handle.kind(), handle.externalId(), handle.compensation());
                return CompensationResult.compensated(handle, attempt);
            } catch (ResourceApiException e) {
                if (e.getKind() == ApiErrorKind.NOT_FOUND) {
                    log.info("{} {} already absent, treating as compensated", handle.kind(), handle.externalId());
                    return CompensationResult.compensated(handle, attempt);
                }
                if (run.interrupted
                    || retryPolicy.classify(e) != ErrorClass.RETRYABLE
                    || !retryPolicy.hasMoreAttempts(attempt)) {
                    return failed(handle, attempt, e);
                }
                Duration delay = retryPolicy.nextDelay(attempt);
                log.warn("Compensation of {} {} failed (attempt {}), retrying in {}ms: {}",
                    handle.kind(), handle.externalId(), attempt, delay.toMillis(), e.getMessage());
                pause(delay, run);
            } catch (RuntimeException e) {
                return failed(handle, attempt, e);
            }
        }
    }

    private CompensationResult failed(ResourceHandle handle, int attempts, RuntimeException e) {
        log.error("Compensation of {} {} failed after {} attempt(s)", handle.kind(), handle.externalId(), attempts, e);
        return CompensationResult.failed(handle, attempts, e.getMessage() == null ? e.getClass().getName() : e.getMessage());
    }

    private void invokeCompensation(RequestContext context, ResourceHandle handle) {
        String targetId = handle.compensation().targetId();
        switch (handle.kind()) {
            case ORGANIZATION -> services.organizations().delete(context, targetId);
            case TENANT -> services.tenants().delete(context, targetId);
            case ADMIN_USER -> services.adminUsers().delete(context, targetId);
            case API_KEY -> services.apiKeys().revoke(context, targetId);
            case DOMAIN -> services.domains().remove(context, targetId);
        }
    }

    private void pause(Duration delay, RollbackRun run) {
        if (run.interrupted || delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            log.warn("Rollback interrupted, continuing remaining compensations without delay");
            run.interrupted = true;
        }
    }

    /**
     * 롤백을 실행하지 않고 수동 정리 보고서 생성.
     *
     * <p>롤백을 시도했다면 그때 남은 실패 항목을, 시도하지 않았다면
     * 소유한 모든 리소스를 생성의 역순으로 보고합니다.</p>
     *
     * @param failure 셋업 실패 예외
     * @return 수동 정리 보고서
     * @throws IllegalArgumentException failure가 null인 경우
     */
    public ManualCleanupReport generateManualCleanupReport(SetupException failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        if (failure.getRollbackOutcome() != null) {
            return failure.getRollbackOutcome().manualCleanupReport();
        }
        return generateManualCleanupReport(
            failure.getIdempotencyKey(), failure.getCreatedResources(), failure.getStep()
        );
    }

    /**
     * 핸들 목록으로 수동 정리 보고서 생성.
     *
     * @param key 멱등성 키 (null 가능)
     * @param handles 리소스 핸들 (생성 순서)
     * @param failurePoint 실패한 단계 (null 가능)
     * @return 소유 리소스를 역순으로 나열한 보고서
     */
    public ManualCleanupReport generateManualCleanupReport(
        IdempotencyKey key,
        List<ResourceHandle> handles,
        SetupStep failurePoint
    ) {
        if (handles == null) {
            throw new IllegalArgumentException("handles cannot be null");
        }
        List<CleanupItem> items = new ArrayList<>();
        for (int i = handles.size() - 1; i >= 0; i--) {
            ResourceHandle handle = handles.get(i);
            if (handle.owned()) {
                items.add(CleanupItem.from(handle, null));
            }
        }
        return new ManualCleanupReport(key, failurePoint, items, clock.instant());
    }

    private static final class RollbackRun {

        private boolean interrupted;

        private RollbackRun(boolean interrupted) {
            this.interrupted = interrupted;
        }
    }
}
