package com.ryuqq.orgsetup.adapter.runner;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RetryConfig / RollbackConfig / OrchestratorConfig 검증 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RetryConfigTest {

    @Test
    void 기본값() {
        RetryConfig config = new RetryConfig();

        assertThat(config.baseDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.multiplier()).isEqualTo(2.0);
        assertThat(config.maxDelay()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.maxAttempts()).isEqualTo(3);
        assertThat(config.jitterFactor()).isEqualTo(0.1);
    }

    @Test
    void with_메서드는_해당_필드만_변경() {
        RetryConfig config = new RetryConfig().withMaxAttempts(5).withMultiplier(3.0);

        assertThat(config.maxAttempts()).isEqualTo(5);
        assertThat(config.multiplier()).isEqualTo(3.0);
        assertThat(config.baseDelay()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void maxDelay가_baseDelay보다_작으면_예외() {
        assertThatThrownBy(() -> new RetryConfig().withMaxDelay(Duration.ofMillis(500)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDelay");
    }

    @Test
    void jitterFactor_범위_밖이면_예외() {
        assertThatThrownBy(() -> new RetryConfig().withJitterFactor(1.5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("jitterFactor");
    }

    @Test
    void multiplier가_1_미만이면_예외() {
        assertThatThrownBy(() -> new RetryConfig().withMultiplier(0.5))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void maxAttempts가_0이면_예외() {
        assertThatThrownBy(() -> new RetryConfig().withMaxAttempts(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void RollbackConfig_기본값과_RetryConfig_변환() {
        RollbackConfig rollback = new RollbackConfig();

        RetryConfig retry = rollback.toRetryConfig();

        assertThat(retry.baseDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(retry.maxDelay()).isEqualTo(Duration.ofSeconds(60));
        assertThat(retry.maxAttempts()).isEqualTo(3);
        assertThat(retry.jitterFactor()).isZero();
        assertThat(rollback.interProcedureDelay()).isZero();
    }

    @Test
    void RollbackConfig_음수_interProcedureDelay는_예외() {
        assertThatThrownBy(() -> new RollbackConfig().withInterProcedureDelay(Duration.ofSeconds(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void OrchestratorConfig_기본값() {
        OrchestratorConfig config = new OrchestratorConfig();

        assertThat(config.keyTimeBucket()).isEqualTo(Duration.ofHours(1));
        assertThat(config.inFlightWaitTimeout()).isZero();
        assertThat(config.baseDomain()).isEqualTo(OrchestratorConfig.DEFAULT_BASE_DOMAIN);
        assertThat(config.apiKeyPolicy().scope()).isEqualTo("organization");
    }

    @Test
    void OrchestratorConfig_잘못된_값은_예외() {
        OrchestratorConfig config = new OrchestratorConfig();

        assertThatThrownBy(() -> config.withKeyTimeBucket(Duration.ofMillis(10)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withInFlightPollInterval(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withBaseDomain(" "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withRetry(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
