package com.ryuqq.orgsetup.adapter.runner;

import com.ryuqq.orgsetup.core.exception.ResourceApiException;
import com.ryuqq.orgsetup.core.exception.UnresolvableConflictException;
import com.ryuqq.orgsetup.core.model.ConflictRecord;
import com.ryuqq.orgsetup.core.model.ConflictType;
import com.ryuqq.orgsetup.core.model.SetupStep;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RetryPolicy 유닛 테스트.
 *
 * <p>오류 분류와 백오프 계산을 검증합니다:</p>
 * <ul>
 *   <li>RETRYABLE / NON_RETRYABLE / CONFLICT_RETRYABLE 분류</li>
 *   <li>지수적 증가와 maxDelay 제한</li>
 *   <li>jitter 범위</li>
 *   <li>최대 시도 횟수</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(new RetryConfig().withJitterFactor(0.0));

    // ============================================================
    // 1. 오류 분류
    // ============================================================

    @Test
    void classify_네트워크_타임아웃_연결재설정_5xx_429는_RETRYABLE() {
        assertThat(policy.classify(ResourceApiException.timeout("t"))).isEqualTo(ErrorClass.RETRYABLE);
        assertThat(policy.classify(ResourceApiException.connectionReset("r"))).isEqualTo(ErrorClass.RETRYABLE);
        assertThat(policy.classify(ResourceApiException.serverError(503, "s"))).isEqualTo(ErrorClass.RETRYABLE);
        assertThat(policy.classify(ResourceApiException.ofStatus(429, "slow down"))).isEqualTo(ErrorClass.RETRYABLE);
    }

    @Test
    void classify_IOException_계열은_RETRYABLE() {
        assertThat(policy.classify(new UncheckedIOException(new IOException("reset")))).isEqualTo(ErrorClass.RETRYABLE);
        assertThat(policy.classify(new RuntimeException(new TimeoutException("t")))).isEqualTo(ErrorClass.RETRYABLE);
    }

    @Test
    void classify_검증_인증_권한_404는_NON_RETRYABLE() {
        assertThat(policy.classify(ResourceApiException.validation("bad"))).isEqualTo(ErrorClass.NON_RETRYABLE);
        assertThat(policy.classify(ResourceApiException.ofStatus(401, "u"))).isEqualTo(ErrorClass.NON_RETRYABLE);
        assertThat(policy.classify(ResourceApiException.ofStatus(403, "f"))).isEqualTo(ErrorClass.NON_RETRYABLE);
        assertThat(policy.classify(ResourceApiException.notFound("n"))).isEqualTo(ErrorClass.NON_RETRYABLE);
    }

    @Test
    void classify_알_수_없는_오류는_NON_RETRYABLE() {
        assertThat(policy.classify(new IllegalStateException("bug"))).isEqualTo(ErrorClass.NON_RETRYABLE);
        assertThat(policy.classify(null)).isEqualTo(ErrorClass.NON_RETRYABLE);
    }

    @Test
    void classify_409는_CONFLICT_RETRYABLE() {
        ResourceApiException conflict = ResourceApiException.conflict(
            "email_exists", List.of("email"), "user_1", Map.of(), "taken");

        assertThat(policy.classify(conflict)).isEqualTo(ErrorClass.CONFLICT_RETRYABLE);
    }

    @Test
    void classify_해결_불가_충돌은_NON_RETRYABLE() {
        ConflictRecord record = new ConflictRecord(
            ConflictType.EMAIL_EXISTS, SetupStep.ADMIN_USER_CREATION, List.of("email"), null, Map.of(), null);

        assertThat(policy.classify(new UnresolvableConflictException(record, "mismatch")))
            .isEqualTo(ErrorClass.NON_RETRYABLE);
    }

    // ============================================================
    // 2. 백오프 계산
    // ============================================================

    @Test
    void nextDelay_jitter_없으면_지수적으로_증가() {
        assertThat(policy.nextDelay(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.nextDelay(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.nextDelay(3)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void nextDelay_maxDelay를_넘지_않음() {
        assertThat(policy.nextDelay(7)).isEqualTo(Duration.ofSeconds(60));
        assertThat(policy.nextDelay(200)).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void nextDelay_jitter는_0과_delay_곱하기_jitterFactor_사이() {
        RetryPolicy maxJitter = new RetryPolicy(new RetryConfig(), () -> 0.999);
        RetryPolicy noJitter = new RetryPolicy(new RetryConfig(), () -> 0.0);

        assertThat(maxJitter.nextDelay(2).toMillis()).isBetween(2000L, 2200L);
        assertThat(noJitter.nextDelay(2)).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void nextDelay_jitter_적용후에도_maxDelay_제한() {
        RetryPolicy maxJitter = new RetryPolicy(new RetryConfig(), () -> 0.999);

        assertThat(maxJitter.nextDelay(10)).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void nextDelay_0_이하_시도번호는_예외() {
        assertThatThrownBy(() -> policy.nextDelay(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attemptNumber");
    }

    // ============================================================
    // 3. 재시도 여부
    // ============================================================

    @Test
    void shouldRetry_RETRYABLE이고_시도가_남으면_true() {
        ResourceApiException error = ResourceApiException.serverError(500, "boom");

        assertThat(policy.shouldRetry(error, 1)).isTrue();
        assertThat(policy.shouldRetry(error, 2)).isTrue();
        assertThat(policy.shouldRetry(error, 3)).isFalse();
    }

    @Test
    void shouldRetry_충돌과_NON_RETRYABLE은_false() {
        assertThat(policy.shouldRetry(ResourceApiException.validation("v"), 1)).isFalse();
        assertThat(policy.shouldRetry(ResourceApiException.conflict(
            "subdomain_exists", List.of(), null, Map.of(), "c"), 1)).isFalse();
    }
}
