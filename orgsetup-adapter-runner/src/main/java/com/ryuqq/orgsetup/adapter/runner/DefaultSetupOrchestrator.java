package com.ryuqq.orgsetup.adapter.runner;

import com.ryuqq.orgsetup.application.orchestrator.SetupOptions;
import com.ryuqq.orgsetup.application.orchestrator.SetupOrchestrator;
import com.ryuqq.orgsetup.core.exception.IdempotencyConflictException;
import com.ryuqq.orgsetup.core.exception.SetupCancelledException;
import com.ryuqq.orgsetup.core.exception.SetupException;
import com.ryuqq.orgsetup.core.exception.SetupValidationException;
import com.ryuqq.orgsetup.core.exception.UnresolvableConflictException;
import com.ryuqq.orgsetup.core.model.ConflictRecord;
import com.ryuqq.orgsetup.core.model.ConflictType;
import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import com.ryuqq.orgsetup.core.model.RecoveryType;
import com.ryuqq.orgsetup.core.model.RequestContext;
import com.ryuqq.orgsetup.core.model.ResourceHandle;
import com.ryuqq.orgsetup.core.model.RetryState;
import com.ryuqq.orgsetup.core.model.SetupMetadata;
import com.ryuqq.orgsetup.core.model.SetupRequest;
import com.ryuqq.orgsetup.core.model.SetupResult;
import com.ryuqq.orgsetup.core.model.SetupStep;
import com.ryuqq.orgsetup.core.model.resource.AdminUser;
import com.ryuqq.orgsetup.core.model.resource.AdminUserDraft;
import com.ryuqq.orgsetup.core.model.resource.ApiKey;
import com.ryuqq.orgsetup.core.model.resource.DomainConfig;
import com.ryuqq.orgsetup.core.model.resource.Organization;
import com.ryuqq.orgsetup.core.model.resource.OrganizationDraft;
import com.ryuqq.orgsetup.core.model.resource.Tenant;
import com.ryuqq.orgsetup.core.model.resource.TenantDraft;
import com.ryuqq.orgsetup.core.outcome.Conflict;
import com.ryuqq.orgsetup.core.outcome.Fatal;
import com.ryuqq.orgsetup.core.outcome.StepOutcome;
import com.ryuqq.orgsetup.core.outcome.Success;
import com.ryuqq.orgsetup.core.outcome.Transient;
import com.ryuqq.orgsetup.core.report.ManualCleanupReport;
import com.ryuqq.orgsetup.core.report.RollbackOutcome;
import com.ryuqq.orgsetup.core.spi.IdempotencyKeyStore;
import com.ryuqq.orgsetup.core.spi.Reservation;
import com.ryuqq.orgsetup.core.spi.SetupObserver;
import com.ryuqq.orgsetup.core.statemachine.SetupState;
import com.ryuqq.orgsetup.core.statemachine.SetupStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 조직 셋업 saga 구현체.
 *
 * <p>조직 → 테넌트 → 관리자 → API 키 → 도메인 순서로 리소스를 생성하며,
 * 각 단계의 시도 결과를 {@link StepOutcome}으로 분류하여 처리합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>요청 검증 (실패 시 키 예약 없이 SetupValidationException)</li>
 *   <li>멱등성 키 결정 및 예약 (완료된 키는 저장된 결과 재반환)</li>
 *   <li>단계 실행: Success → 등록, Conflict → ConflictResolver, Transient → 백오프 재시도, Fatal → 실패</li>
 *   <li>도메인 단계 실패는 부분 성공 (롤백 없음)</li>
 *   <li>필수 단계 실패 시 롤백, 키 예약 해제, SetupException</li>
 *   <li>성공 시 결과 저장 (commit). 그 사이 다른 실행이 키를 인수했다면
 *       그 실행의 결과가 참조하지 않는 리소스만 롤백하고 SetupException</li>
 * </ol>
 *
 * <p><strong>스레드 모델:</strong> 단계는 호출 스레드에서 순차 실행됩니다.
 * 여러 스레드가 동시에 setup을 호출할 수 있으며, 공유 상태는 멱등성 저장소뿐입니다.</p>
 *
 * <p><strong>취소:</strong> 각 시도 전과 백오프 대기 전에 인터럽트와 마감 시각을 확인합니다.
 * 취소되면 즉시 롤백으로 넘어가고, 인터럽트였다면 롤백 후 인터럽트 플래그를 복원합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultSetupOrchestrator implements SetupOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultSetupOrchestrator.class);

    private final PlatformServices services;
    private final IdempotencyKeyStore store;
    private final OrchestratorConfig config;
    private final Sleeper sleeper;
    private final Clock clock;
    private final SetupObserver observer;
    private final RetryPolicy retryPolicy;
    private final ConflictResolver conflictResolver;
    private final RollbackCoordinator rollbackCoordinator;
    private final IdempotencyKeyDeriver keyDeriver;

    /**
     * 기본 설정으로 생성.
     *
     * @param services 리소스 API
     * @param store 멱등성 키 저장소
     */
    public DefaultSetupOrchestrator(PlatformServices services, IdempotencyKeyStore store) {
        this(services, store, new OrchestratorConfig(), Sleeper.threadSleep(), Clock.systemUTC(), SetupObserver.noOp());
    }

    /**
     * 생성자.
     *
     * @param services 리소스 API
     * @param store 멱등성 키 저장소
     * @param config 설정
     * @param sleeper 백오프 대기
     * @param clock 마감 시각 및 타임스탬프용 Clock
     * @param observer 관찰자
     * @throws IllegalArgumentException 인자 중 하나라도 null인 경우
     */
    public DefaultSetupOrchestrator(
        PlatformServices services,
        IdempotencyKeyStore store,
        OrchestratorConfig config,
        Sleeper sleeper,
        Clock clock,
        SetupObserver observer
    ) {
        if (services == null || store == null || config == null || sleeper == null || clock == null || observer == null) {
            throw new IllegalArgumentException("services, store, config, sleeper, clock and observer cannot be null");
        }
        this.services = services;
        this.store = store;
        this.config = config;
        this.sleeper = sleeper;
        this.clock = clock;
        this.observer = GuardedSetupObserver.wrap(observer);
        this.retryPolicy = new RetryPolicy(config.retry());
        this.conflictResolver = new ConflictResolver();
        this.rollbackCoordinator = new RollbackCoordinator(services, config.rollback(), sleeper, clock, this.observer);
        this.keyDeriver = new IdempotencyKeyDeriver(clock, config.keyTimeBucket());
    }

    @Override
    public SetupResult setup(SetupRequest request, SetupOptions options) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        // 1. 검증 (키 예약 전)
        List<String> violations = new ArrayList<>(request.violations());
        IdempotencyKey key = null;
        if (options.idempotencyKey() != null) {
            try {
                key = IdempotencyKey.of(options.idempotencyKey());
            } catch (IllegalArgumentException e) {
                violations.add("idempotencyKey: " + e.getMessage());
            }
        }
        if (!violations.isEmpty()) {
            throw new SetupValidationException(violations);
        }

        // 2. 키 결정 및 예약
        String fingerprint = keyDeriver.fingerprint(request);
        if (key == null) {
            key = keyDeriver.derive(request);
        }
        Reservation reservation = acquire(key, fingerprint);
        if (!reservation.isAcquired()) {
            IdempotencyKey completedKey = key;
            SetupResult replay = store.lookup(key)
                .orElseThrow(() -> new IllegalStateException(
                    "Store reported COMPLETED but holds no result for " + completedKey))
                .asReplay();
            log.info("Replaying stored setup result for {}", key);
            observer.onReplay(key, replay);
            return replay;
        }

        // 3. 실행 (실패 시 예약 해제, 결과는 절대 commit하지 않음)
        Execution execution = new Execution(request, options, reservation, clock.instant());
        boolean committed = false;
        try {
            SetupResult result = execute(execution);
            committed = true;
            log.info("Organization setup committed for {} (partial: {})", key, result.isPartial());
            observer.onSetupCompleted(execution.context, result);
            return result;
        } finally {
            if (!committed) {
                store.release(reservation);
            }
        }
    }

    @Override
    public ManualCleanupReport generateManualCleanupReport(SetupException failure) {
        return rollbackCoordinator.generateManualCleanupReport(failure);
    }

    /**
     * 키 예약.
     *
     * @return ACQUIRED 또는 COMPLETED 예약
     */
    private Reservation acquire(IdempotencyKey key, String fingerprint) {
        Instant waitUntil = clock.instant().plus(config.inFlightWaitTimeout());
        while (true) {
            Reservation reservation = store.reserve(key, fingerprint);
            switch (reservation.status()) {
                case ACQUIRED, COMPLETED -> {
                    return reservation;
                }
                case FINGERPRINT_MISMATCH -> throw new IdempotencyConflictException(
                    key, IdempotencyConflictException.Reason.FINGERPRINT_MISMATCH);
                case IN_FLIGHT -> {
                    if (!clock.instant().isBefore(waitUntil)) {
                        throw new IdempotencyConflictException(key, IdempotencyConflictException.Reason.IN_FLIGHT);
                    }
                    waitForInFlight(key);
                }
            }
        }
    }

    private void waitForInFlight(IdempotencyKey key) {
        try {
            sleeper.sleep(config.inFlightPollInterval());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            IdempotencyConflictException conflict =
                new IdempotencyConflictException(key, IdempotencyConflictException.Reason.IN_FLIGHT);
            conflict.addSuppressed(e);
            throw conflict;
        }
    }

    private SetupResult execute(Execution exec) {
        SetupRequest request = exec.request;
        observer.onSetupStarted(exec.context);

        // 1. 조직
        StepRun<Organization> organization = runStep(exec, SetupStep.ORGANIZATION_CREATION,
            () -> services.organizations().create(exec.context, new OrganizationDraft(
                request.name().trim(), request.subdomain(), request.customDomain(),
                request.adminEmail(), request.settings())),
            organizationLookup(exec));
        if (organization.failed()) {
            throw fail(exec, SetupStep.ORGANIZATION_CREATION, organization.failure());
        }
        String organizationId = organization.resource().id();
        record(exec, SetupStep.ORGANIZATION_CREATION, organization.reused(), organizationId, organizationId);
        exec.context = exec.context.withOrganizationId(organizationId);

        // 2. 테넌트
        StepRun<Tenant> tenant = runStep(exec, SetupStep.TENANT_CREATION,
            () -> services.tenants().create(exec.context, organizationId, new TenantDraft(
                request.name().trim(), request.subdomain(), request.customDomain())),
            tenantLookup(exec));
        if (tenant.failed()) {
            throw fail(exec, SetupStep.TENANT_CREATION, tenant.failure());
        }
        String tenantId = tenant.resource().id();
        record(exec, SetupStep.TENANT_CREATION, tenant.reused(), tenantId, tenantId);
        exec.context = exec.context.withTenantId(tenantId);

        // 3. 관리자
        StepRun<AdminUser> admin = runStep(exec, SetupStep.ADMIN_USER_CREATION,
            () -> services.adminUsers().create(exec.context, tenantId, new AdminUserDraft(
                request.adminName().trim(), request.adminEmail().trim(),
                request.adminPassword(), request.adminRole())),
            adminUserLookup(exec));
        if (admin.failed()) {
            throw fail(exec, SetupStep.ADMIN_USER_CREATION, admin.failure());
        }
        String adminUserId = admin.resource().id();
        record(exec, SetupStep.ADMIN_USER_CREATION, admin.reused(), adminUserId, adminUserId);
        exec.context = exec.context.withAdminUserId(adminUserId);

        // 4. API 키
        StepRun<ApiKey> apiKey = runStep(exec, SetupStep.API_KEY_GENERATION,
            () -> services.apiKeys().generate(exec.context, adminUserId, config.apiKeyPolicy()),
            ExistingResourceLookup.none());
        if (apiKey.failed()) {
            throw fail(exec, SetupStep.API_KEY_GENERATION, apiKey.failure());
        }
        record(exec, SetupStep.API_KEY_GENERATION, apiKey.reused(), apiKey.resource().id(), apiKey.resource().id());

        // 5. 도메인 (비필수)
        DomainConfig domain = configureDomain(exec, tenantId);

        SetupMetadata metadata = new SetupMetadata(
            exec.key,
            exec.completedSteps,
            exec.reusedSteps,
            exec.skippedSteps,
            exec.reusedSteps.isEmpty() ? RecoveryType.NONE : RecoveryType.REUSED_EXISTING,
            exec.partial,
            false,
            exec.notes,
            exec.startedAt,
            clock.instant()
        );
        SetupResult result = new SetupResult(
            organization.resource(), tenant.resource(), admin.resource(), apiKey.resource(), domain, metadata
        );
        commit(exec, result);
        exec.moveTo(SetupState.COMPLETED);
        return result;
    }

    /**
     * 결과 저장. 실패하면 다른 실행이 키를 인수한 것으로 보고 필수 단계 실패와 같이 처리합니다.
     *
     * <p>인수한 실행이 이미 결과를 저장했다면, 그 결과가 참조하는 리소스는
     * 충돌 해결로 공유된 것이므로 롤백 대상에서 제외합니다.</p>
     */
    private void commit(Execution exec, SetupResult result) {
        try {
            store.commit(exec.reservation, result);
        } catch (RuntimeException e) {
            log.warn("Could not commit setup result for {}: {}", exec.key, e.getMessage());
            IdempotencyConflictException lost = new IdempotencyConflictException(
                exec.key, IdempotencyConflictException.Reason.RESERVATION_LOST, e);
            throw fail(exec, exec.currentStep, lost, withoutSharedResources(exec));
        }
    }

    private List<ResourceHandle> withoutSharedResources(Execution exec) {
        Optional<SetupResult> winner;
        try {
            winner = store.lookup(exec.key);
        } catch (RuntimeException e) {
            log.warn("Could not read the committed result for {}, compensating every owned resource", exec.key, e);
            winner = Optional.empty();
        }
        List<ResourceHandle> snapshot = exec.registry.snapshot();
        if (winner.isEmpty()) {
            return snapshot;
        }

        Set<String> shared = referencedIds(winner.get());
        List<ResourceHandle> handles = new ArrayList<>(snapshot.size());
        for (ResourceHandle handle : snapshot) {
            if (handle.owned() && shared.contains(handle.externalId())) {
                log.info("{} {} is used by the committed result for {}, not compensating",
                    handle.kind(), handle.externalId(), exec.key);
                handles.add(ResourceHandle.reused(handle.kind(), handle.externalId(),
                    handle.compensation().targetId(), handle.createdAt()));
            } else {
                handles.add(handle);
            }
        }
        return handles;
    }

    private static Set<String> referencedIds(SetupResult result) {
        Set<String> ids = new HashSet<>();
        ids.add(result.organization().id());
        ids.add(result.tenant().id());
        ids.add(result.adminUser().id());
        ids.add(result.apiKey().id());
        if (result.domain() != null) {
            ids.add(result.domain().domain());
        }
        return ids;
    }

    private DomainConfig configureDomain(Execution exec, String tenantId) {
        String targetDomain = resolveTargetDomain(exec.request);
        if (targetDomain == null) {
            exec.currentStep = SetupStep.DOMAIN_CONFIGURATION;
            String reason = "no custom domain or subdomain requested";
            exec.skippedSteps.add(SetupStep.DOMAIN_CONFIGURATION);
            exec.notes.add("Domain configuration skipped: " + reason);
            observer.onStepSkipped(exec.context, SetupStep.DOMAIN_CONFIGURATION, reason);
            return null;
        }

        StepRun<DomainConfig> domain = runStep(exec, SetupStep.DOMAIN_CONFIGURATION,
            () -> services.domains().configure(exec.context, tenantId, targetDomain),
            domainLookup(exec, tenantId, targetDomain));
        if (domain.failed()) {
            if (domain.failure() instanceof SetupCancelledException) {
                throw fail(exec, SetupStep.DOMAIN_CONFIGURATION, domain.failure());
            }
            log.warn("Domain configuration for {} failed, completing without domain: {}",
                targetDomain, domain.failure().getMessage());
            observer.onStepFailed(exec.context, SetupStep.DOMAIN_CONFIGURATION, domain.failure());
            exec.partial = true;
            exec.notes.add("Domain configuration failed for " + targetDomain + ": " + domain.failure().getMessage()
                + "; organization, tenant, admin user and API key remain usable");
            return null;
        }
        record(exec, SetupStep.DOMAIN_CONFIGURATION, domain.reused(), domain.resource().domain(), tenantId);
        return domain.resource();
    }

    private String resolveTargetDomain(SetupRequest request) {
        if (request.customDomain() != null) {
            return request.customDomain().toLowerCase(Locale.ROOT);
        }
        if (request.subdomain() != null) {
            return request.subdomain() + "." + config.baseDomain();
        }
        return null;
    }

    /**
     * 단계 하나 실행 (재시도, 충돌 해결 포함).
     */
    private <T> StepRun<T> runStep(
        Execution exec,
        SetupStep step,
        Supplier<T> call,
        ExistingResourceLookup<T> lookup
    ) {
        exec.moveTo(SetupState.running(step));
        exec.currentStep = step;
        observer.onStepStarted(exec.context, step);

        RetryState retryState = RetryState.initial();
        boolean freshAttemptUsed = false;
        int attempt = 0;

        while (true) {
            SetupCancelledException cancelled = checkCancellation(exec, step);
            if (cancelled != null) {
                return StepRun.failed(cancelled);
            }

            attempt++;
            StepOutcome<T> outcome = attempt(step, call);

            if (outcome instanceof Success<T> success) {
                return StepRun.created(success.resource());
            }

            if (outcome instanceof Conflict<T> conflict) {
                try {
                    ConflictResolution<T> resolution = conflictResolver.resolve(conflict.record(), lookup);
                    if (resolution.isReuse()) {
                        observer.onConflictResolved(exec.context, step, conflict.record());
                        return StepRun.reused(resolution.existing());
                    }
                    if (freshAttemptUsed) {
                        return StepRun.failed(new UnresolvableConflictException(
                            conflict.record(), "conflict persisted after a fresh attempt", conflict.cause()));
                    }
                    freshAttemptUsed = true;
                    continue;
                } catch (UnresolvableConflictException e) {
                    if (!lookupFailedTransiently(e)) {
                        return StepRun.failed(e);
                    }
                    // 조회 실패가 일시적이면 단계 전체를 백오프 후 재시도
                    outcome = new Transient<>(e);
                }
            }

            if (outcome instanceof Transient<T> transientFailure) {
                Throwable error = transientFailure.error();
                if (!exec.options.enableRetry() || !retryPolicy.hasMoreAttempts(attempt)) {
                    return StepRun.failed(error);
                }
                Duration delay = retryPolicy.nextDelay(attempt);
                retryState = retryState.recordFailure(error, delay);
                observer.onRetry(exec.context, step, retryState);

                SetupCancelledException interruptedBackoff = sleepBeforeRetry(exec, step, delay);
                if (interruptedBackoff != null) {
                    interruptedBackoff.addSuppressed(error);
                    return StepRun.failed(interruptedBackoff);
                }
                continue;
            }

            return StepRun.failed(((Fatal<T>) outcome).error());
        }
    }

    private <T> StepOutcome<T> attempt(SetupStep step, Supplier<T> call) {
        try {
            return new Success<>(call.get());
        } catch (RuntimeException e) {
            return switch (retryPolicy.classify(e)) {
                case RETRYABLE -> new Transient<>(e);
                case CONFLICT_RETRYABLE -> toConflict(step, e);
                case NON_RETRYABLE -> new Fatal<>(e);
            };
        }
    }

    private boolean lookupFailedTransiently(UnresolvableConflictException e) {
        return e.getCause() != null && retryPolicy.classify(e.getCause()) == ErrorClass.RETRYABLE;
    }

    private <T> StepOutcome<T> toConflict(SetupStep step, RuntimeException e) {
        ConflictRecord conflict = conflictResolver.classify(step, e);
        if (conflict == null) {
            return new Fatal<>(e);
        }
        return new Conflict<>(conflict, e);
    }

    private SetupCancelledException checkCancellation(Execution exec, SetupStep step) {
        if (Thread.interrupted()) {
            return new SetupCancelledException(step, "thread interrupted", true, null);
        }
        if (exec.context.isExpired(clock.instant())) {
            return new SetupCancelledException(step, "deadline exceeded", false, null);
        }
        return null;
    }

    private SetupCancelledException sleepBeforeRetry(Execution exec, SetupStep step, Duration delay) {
        Instant deadline = exec.context.deadline();
        if (deadline != null && clock.instant().plus(delay).isAfter(deadline)) {
            return new SetupCancelledException(
                step, "retry in " + delay.toMillis() + "ms would exceed the deadline", false, null);
        }
        try {
            sleeper.sleep(delay);
            return null;
        } catch (InterruptedException e) {
            return new SetupCancelledException(step, "interrupted during retry backoff", true, e);
        }
    }

    private void record(Execution exec, SetupStep step, boolean reused, String externalId, String compensationTargetId) {
        Instant now = clock.instant();
        ResourceHandle handle = reused
            ? ResourceHandle.reused(step.resourceKind(), externalId, compensationTargetId, now)
            : ResourceHandle.created(step.resourceKind(), externalId, compensationTargetId, now);
        exec.registry.register(handle);
        exec.completedSteps.add(step);
        if (reused) {
            exec.reusedSteps.add(step);
        }
        observer.onStepCompleted(exec.context, step, handle);
    }

    /**
     * 필수 단계 실패 처리: 롤백(활성화 시) 후 SetupException 생성.
     */
    private SetupException fail(Execution exec, SetupStep step, Throwable cause) {
        return fail(exec, step, cause, exec.registry.snapshot());
    }

    private SetupException fail(Execution exec, SetupStep step, Throwable cause, List<ResourceHandle> snapshot) {
        observer.onStepFailed(exec.context, step, cause);
        exec.moveTo(SetupState.FAILED);

        RollbackOutcome rollbackOutcome = null;
        ManualCleanupReport report = null;

        if (exec.options.enableRollback() && !snapshot.isEmpty()) {
            exec.moveTo(SetupState.ROLLING_BACK);
            rollbackOutcome = rollbackCoordinator.rollback(exec.context, snapshot, step);
            exec.moveTo(SetupState.ROLLED_BACK);
            if (rollbackOutcome.manualCleanupReport().requiresAction()) {
                report = rollbackOutcome.manualCleanupReport();
            }
        } else if (snapshot.stream().anyMatch(ResourceHandle::owned)) {
            report = rollbackCoordinator.generateManualCleanupReport(exec.key, snapshot, step);
        }

        if (cause instanceof SetupCancelledException cancelled && cancelled.isInterrupted()) {
            Thread.currentThread().interrupt();
        }

        SetupException failure = new SetupException(
            exec.key, step, exec.completedSteps, snapshot, rollbackOutcome, report, cause
        );
        log.error("Organization setup failed at {} for {} (completed: {}, rollback attempted: {}, manual cleanup: {})",
            step, exec.key, exec.completedSteps, failure.isRollbackAttempted(), failure.requiresManualCleanup());
        observer.onSetupFailed(exec.context, failure);
        return failure;
    }

    // ============================================================
    // 충돌 시 기존 리소스 조회 전략
    // ============================================================

    private ExistingResourceLookup<Organization> organizationLookup(Execution exec) {
        SetupRequest request = exec.request;
        return ExistingResourceLookup.of(
            conflict -> conflict.hasExistingResourceId()
                || request.subdomain() != null
                || request.customDomain() != null,
            conflict -> {
                if (conflict.hasExistingResourceId()) {
                    return services.organizations().findById(exec.context, conflict.existingResourceId());
                }
                if (conflict.type() == ConflictType.DOMAIN_EXISTS && request.customDomain() != null) {
                    return services.organizations().findByDomain(exec.context, request.customDomain());
                }
                if (request.subdomain() != null) {
                    return services.organizations().findBySubdomain(exec.context, request.subdomain());
                }
                return services.organizations().findByDomain(exec.context, request.customDomain());
            },
            existing -> sameValue(existing.name(), request.name())
                && sameValue(existing.subdomain(), request.subdomain())
                && (request.customDomain() == null || sameValue(existing.customDomain(), request.customDomain()))
        );
    }

    private ExistingResourceLookup<Tenant> tenantLookup(Execution exec) {
        SetupRequest request = exec.request;
        return ExistingResourceLookup.of(
            ConflictRecord::hasExistingResourceId,
            conflict -> services.tenants().findById(exec.context, conflict.existingResourceId()),
            existing -> Objects.equals(existing.organizationId(), exec.context.organizationId())
                && sameValue(existing.subdomain(), request.subdomain())
        );
    }

    private ExistingResourceLookup<AdminUser> adminUserLookup(Execution exec) {
        SetupRequest request = exec.request;
        return ExistingResourceLookup.of(
            conflict -> true,
            conflict -> conflict.hasExistingResourceId()
                ? services.adminUsers().findById(exec.context, conflict.existingResourceId())
                : services.adminUsers().findByEmail(exec.context, exec.context.tenantId(), request.adminEmail()),
            existing -> Objects.equals(existing.tenantId(), exec.context.tenantId())
                && sameValue(existing.email(), request.adminEmail())
        );
    }

    private ExistingResourceLookup<DomainConfig> domainLookup(Execution exec, String tenantId, String targetDomain) {
        return ExistingResourceLookup.of(
            conflict -> true,
            conflict -> services.domains().find(exec.context, tenantId),
            existing -> Objects.equals(existing.tenantId(), tenantId)
                && sameValue(existing.domain(), targetDomain)
        );
    }

    private static boolean sameValue(String left, String right) {
        return Objects.equals(normalize(left), normalize(right));
    }

    private static String normalize(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }

    // ============================================================
    // 실행 단위 상태
    // ============================================================

    /**
     * 셋업 실행 하나의 가변 상태. 실행 스레드 밖으로 공유하지 않습니다.
     */
    private static final class Execution {

        private final SetupRequest request;
        private final SetupOptions options;
        private final Reservation reservation;
        private final IdempotencyKey key;
        private final Instant startedAt;
        private final ResourceRegistry registry = new ResourceRegistry();
        private final List<SetupStep> completedSteps = new ArrayList<>();
        private final List<SetupStep> reusedSteps = new ArrayList<>();
        private final List<SetupStep> skippedSteps = new ArrayList<>();
        private final List<String> notes = new ArrayList<>();
        private RequestContext context;
        private SetupState state = SetupState.IDLE;
        private SetupStep currentStep = SetupStep.ORGANIZATION_CREATION;
        private boolean partial;

        private Execution(SetupRequest request, SetupOptions options, Reservation reservation, Instant startedAt) {
            this.request = request;
            this.options = options;
            this.reservation = reservation;
            this.key = reservation.key();
            this.startedAt = startedAt;
            Instant deadline = options.timeout() == null ? null : startedAt.plus(options.timeout());
            this.context = RequestContext.start(key, deadline);
        }

        private void moveTo(SetupState next) {
            state = SetupStateTransition.transition(state, next);
        }
    }

    /**
     * 단계 실행 결과. failure가 null이 아니면 실패입니다.
     */
    private record StepRun<T>(T resource, boolean reused, Throwable failure) {

        static <T> StepRun<T> created(T resource) {
            return new StepRun<>(resource, false, null);
        }

        static <T> StepRun<T> reused(T resource) {
            return new StepRun<>(resource, true, null);
        }

        static <T> StepRun<T> failed(Throwable failure) {
            return new StepRun<>(null, false, failure);
        }

        boolean failed() {
            return failure != null;
        }
    }
}
