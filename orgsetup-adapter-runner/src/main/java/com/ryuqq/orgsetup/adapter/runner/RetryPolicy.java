package com.ryuqq.orgsetup.adapter.runner;

import com.ryuqq.orgsetup.core.exception.ResourceApiException;
import com.ryuqq.orgsetup.core.exception.UnresolvableConflictException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.DoubleSupplier;

/**
 * 오류 분류와 Exponential Backoff with Jitter 계산.
 *
 * <p>순수 계산만 수행하며 직접 대기하지 않습니다. 대기는 호출자가
 * {@link Sleeper}로 수행하므로 인터럽트와 마감 시각을 호출자가 제어할 수 있습니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = min(baseDelay * multiplier^(attemptNumber-1), maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * delay = min(exponential + jitter, maxDelay)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1s, multiplier=2.0, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attemptNumber=1 실패 후: 1000-1100ms</li>
 *   <li>attemptNumber=2 실패 후: 2000-2200ms</li>
 *   <li>attemptNumber=3 실패 후: 4000-4400ms</li>
 * </ul>
 *
 * <p><strong>오류 분류:</strong></p>
 * <ul>
 *   <li>RETRYABLE: 네트워크 타임아웃, 연결 재설정, 5xx, 429, IOException</li>
 *   <li>CONFLICT_RETRYABLE: 409 충돌</li>
 *   <li>NON_RETRYABLE: 400/422, 401, 403, 404, 그 외 모든 오류</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RetryPolicy {

    private final RetryConfig config;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성.
     */
    public RetryPolicy() {
        this(new RetryConfig());
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param config 재시도 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public RetryPolicy(RetryConfig config) {
        this(config, Math::random);
    }

    /**
     * 난수 공급자를 지정하여 생성.
     *
     * @param config 재시도 설정
     * @param random [0.0, 1.0) 범위 난수 공급자
     * @throws IllegalArgumentException config 또는 random이 null인 경우
     */
    public RetryPolicy(RetryConfig config, DoubleSupplier random) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.config = config;
        this.random = random;
    }

    /**
     * 오류 분류.
     *
     * @param error 발생한 오류
     * @return ErrorClass
     */
    public ErrorClass classify(Throwable error) {
        if (error instanceof ResourceApiException api) {
            return switch (api.getKind()) {
                case NETWORK_TIMEOUT, CONNECTION_RESET, SERVER_ERROR, RATE_LIMITED -> ErrorClass.RETRYABLE;
                case CONFLICT -> ErrorClass.CONFLICT_RETRYABLE;
                case VALIDATION, UNAUTHORIZED, FORBIDDEN, NOT_FOUND, UNKNOWN -> ErrorClass.NON_RETRYABLE;
            };
        }
        if (error instanceof UnresolvableConflictException) {
            return ErrorClass.NON_RETRYABLE;
        }
        if (isTransportFailure(error) || (error != null && isTransportFailure(error.getCause()))) {
            return ErrorClass.RETRYABLE;
        }
        return ErrorClass.NON_RETRYABLE;
    }

    private static boolean isTransportFailure(Throwable error) {
        return error instanceof IOException
            || error instanceof UncheckedIOException
            || error instanceof TimeoutException;
    }

    /**
     * 재시도 여부 판단.
     *
     * @param error 마지막 오류
     * @param attemptNumber 지금까지 수행한 시도 횟수 (1부터 시작)
     * @return RETRYABLE이고 최대 시도 횟수에 도달하지 않았으면 true
     */
    public boolean shouldRetry(Throwable error, int attemptNumber) {
        return classify(error) == ErrorClass.RETRYABLE && hasMoreAttempts(attemptNumber);
    }

    /**
     * 남은 시도가 있는지 확인.
     *
     * @param attemptNumber 지금까지 수행한 시도 횟수
     * @return attemptNumber가 maxAttempts보다 작으면 true
     */
    public boolean hasMoreAttempts(int attemptNumber) {
        return attemptNumber < config.maxAttempts();
    }

    /**
     * 다음 시도 전 대기 시간 계산.
     *
     * @param attemptNumber 실패한 시도 번호 (1부터 시작)
     * @return 대기 시간
     * @throws IllegalArgumentException attemptNumber가 양수가 아닌 경우
     */
    public Duration nextDelay(int attemptNumber) {
        if (attemptNumber <= 0) {
            throw new IllegalArgumentException(
                "attemptNumber must be positive (current: " + attemptNumber + ")"
            );
        }
        long baseMs = config.baseDelay().toMillis();
        long maxMs = config.maxDelay().toMillis();

        // 1. 지수적 백오프 (pow 결과가 Infinity여도 min으로 제한됨)
        double exponential = Math.min(baseMs * Math.pow(config.multiplier(), attemptNumber - 1), maxMs);

        // 2. Jitter 추가 (0 ~ exponential * jitterFactor)
        double jitter = exponential * config.jitterFactor() * random.getAsDouble();

        // 3. 최대값 제한
        return Duration.ofMillis((long) Math.min(exponential + jitter, maxMs));
    }

    public RetryConfig getConfig() {
        return config;
    }
}
