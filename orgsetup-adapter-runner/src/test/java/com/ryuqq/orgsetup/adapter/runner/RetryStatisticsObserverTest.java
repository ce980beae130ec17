package com.ryuqq.orgsetup.adapter.runner;

import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import com.ryuqq.orgsetup.core.model.RequestContext;
import com.ryuqq.orgsetup.core.model.ResourceHandle;
import com.ryuqq.orgsetup.core.model.ResourceKind;
import com.ryuqq.orgsetup.core.model.RetryState;
import com.ryuqq.orgsetup.core.model.SetupStep;
import com.ryuqq.orgsetup.core.report.CompensationResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * RetryStatisticsObserver 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RetryStatisticsObserverTest {

    private final RequestContext context = RequestContext.start(IdempotencyKey.of("idem-stats-001"), null);

    @Test
    void snapshot_초기값은_모두_0() {
        SetupStatistics statistics = new RetryStatisticsObserver().snapshot();

        assertThat(statistics.setupsStarted()).isZero();
        assertThat(statistics.successRate()).isZero();
        assertThat(statistics.averageRetriesPerSetup()).isZero();
    }

    @Test
    void onRetry_단계별_재시도_횟수를_집계() {
        // given
        RetryStatisticsObserver observer = new RetryStatisticsObserver();

        // when
        observer.onSetupStarted(context);
        observer.onSetupStarted(context);
        observer.onRetry(context, SetupStep.TENANT_CREATION, RetryState.initial());
        observer.onRetry(context, SetupStep.TENANT_CREATION, RetryState.initial());
        observer.onRetry(context, SetupStep.DOMAIN_CONFIGURATION, RetryState.initial());

        // then
        assertThat(observer.retriesFor(SetupStep.TENANT_CREATION)).isEqualTo(2);
        assertThat(observer.retriesFor(SetupStep.DOMAIN_CONFIGURATION)).isEqualTo(1);
        assertThat(observer.retriesFor(SetupStep.ORGANIZATION_CREATION)).isZero();
        assertThat(observer.snapshot().retries()).isEqualTo(3);
        assertThat(observer.snapshot().averageRetriesPerSetup()).isEqualTo(1.5);
    }

    @Test
    void onRollbackStep_실패한_보상만_집계() {
        // given
        RetryStatisticsObserver observer = new RetryStatisticsObserver();
        ResourceHandle handle = ResourceHandle.created(ResourceKind.TENANT, "tenant_1", "tenant_1", Instant.EPOCH);

        // when
        observer.onRollbackStep(context, CompensationResult.compensated(handle, 1));
        observer.onRollbackStep(context, CompensationResult.skipped(handle));
        observer.onRollbackStep(context, CompensationResult.failed(handle, 3, "locked"));

        // then
        assertThat(observer.snapshot().compensationsFailed()).isEqualTo(1);
    }

    @Test
    void successRate_완료_대비_시작_비율() {
        SetupStatistics statistics = new SetupStatistics(4, 3, 1, 1, 0, 0, 0, 0);

        assertThat(statistics.successRate()).isEqualTo(0.75);
    }
}
