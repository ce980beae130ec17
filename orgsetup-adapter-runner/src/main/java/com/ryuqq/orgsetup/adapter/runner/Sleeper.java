package com.ryuqq.orgsetup.adapter.runner;

import java.time.Duration;

/**
 * 인터럽트 가능한 대기.
 *
 * <p>백오프 대기를 추상화하여 테스트에서 실제 시간을 소비하지 않도록 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정한 시간만큼 대기.
     *
     * @param duration 대기 시간
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * {@link Thread#sleep(long)} 기반 Sleeper.
     *
     * @return 실제로 대기하는 Sleeper
     */
    static Sleeper threadSleep() {
        return duration -> {
            if (!duration.isZero() && !duration.isNegative()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
