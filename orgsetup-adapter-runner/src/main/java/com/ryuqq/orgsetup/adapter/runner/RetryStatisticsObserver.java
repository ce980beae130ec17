package com.ryuqq.orgsetup.adapter.runner;

import com.ryuqq.orgsetup.core.exception.SetupException;
import com.ryuqq.orgsetup.core.model.ConflictRecord;
import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import com.ryuqq.orgsetup.core.model.RequestContext;
import com.ryuqq.orgsetup.core.model.RetryState;
import com.ryuqq.orgsetup.core.model.SetupResult;
import com.ryuqq.orgsetup.core.model.SetupStep;
import com.ryuqq.orgsetup.core.report.CompensationResult;
import com.ryuqq.orgsetup.core.spi.SetupObserver;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * 재시도와 셋업 결과를 집계하는 관찰자.
 *
 * <p>여러 스레드의 셋업이 같은 인스턴스를 공유할 수 있도록 모든 카운터는 스레드 안전합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RetryStatisticsObserver implements SetupObserver {

    private final LongAdder setupsStarted = new LongAdder();
    private final LongAdder setupsCompleted = new LongAdder();
    private final LongAdder setupsPartial = new LongAdder();
    private final LongAdder setupsFailed = new LongAdder();
    private final LongAdder replays = new LongAdder();
    private final LongAdder retries = new LongAdder();
    private final LongAdder conflictsResolved = new LongAdder();
    private final LongAdder compensationsFailed = new LongAdder();
    private final Map<SetupStep, AtomicLong> retriesByStep = new EnumMap<>(SetupStep.class);

    public RetryStatisticsObserver() {
        for (SetupStep step : SetupStep.values()) {
            retriesByStep.put(step, new AtomicLong());
        }
    }

    @Override
    public void onSetupStarted(RequestContext context) {
        setupsStarted.increment();
    }

    @Override
    public void onReplay(IdempotencyKey key, SetupResult result) {
        replays.increment();
    }

    @Override
    public void onRetry(RequestContext context, SetupStep step, RetryState state) {
        retries.increment();
        retriesByStep.get(step).incrementAndGet();
    }

    @Override
    public void onConflictResolved(RequestContext context, SetupStep step, ConflictRecord conflict) {
        conflictsResolved.increment();
    }

    @Override
    public void onRollbackStep(RequestContext context, CompensationResult result) {
        if (result.isFailed()) {
            compensationsFailed.increment();
        }
    }

    @Override
    public void onSetupCompleted(RequestContext context, SetupResult result) {
        setupsCompleted.increment();
        if (result.isPartial()) {
            setupsPartial.increment();
        }
    }

    @Override
    public void onSetupFailed(RequestContext context, SetupException failure) {
        setupsFailed.increment();
    }

    /**
     * 단계별 재시도 수.
     *
     * @param step 단계
     * @return 누적 재시도 수
     */
    public long retriesFor(SetupStep step) {
        return retriesByStep.get(step).get();
    }

    /**
     * 현재 통계 스냅샷.
     *
     * @return SetupStatistics
     */
    public SetupStatistics snapshot() {
        return new SetupStatistics(
            setupsStarted.sum(),
            setupsCompleted.sum(),
            setupsPartial.sum(),
            setupsFailed.sum(),
            replays.sum(),
            retries.sum(),
            conflictsResolved.sum(),
            compensationsFailed.sum()
        );
    }
}
