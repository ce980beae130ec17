package com.ryuqq.orgsetup.adapter.runner;

import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import com.ryuqq.orgsetup.core.model.SetupRequest;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * IdempotencyKeyDeriver 유닛 테스트.
 *
 * <p>요청 지문과 멱등성 키 파생 규칙을 검증합니다:</p>
 * <ul>
 *   <li>같은 요청, 같은 시간 구간이면 같은 키</li>
 *   <li>비밀번호는 지문에 포함되지 않음</li>
 *   <li>이메일, 서브도메인은 대소문자 무시</li>
 *   <li>시간 구간이 바뀌면 다른 키</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class IdempotencyKeyDeriverTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:15:00Z");

    private final IdempotencyKeyDeriver deriver =
        new IdempotencyKeyDeriver(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofHours(1));

    @Test
    void derive_같은_요청이면_같은_키() {
        // given
        SetupRequest first = request().build();
        SetupRequest second = request().build();

        // when
        IdempotencyKey a = deriver.derive(first);
        IdempotencyKey b = deriver.derive(second);

        // then
        assertThat(a).isEqualTo(b);
    }

    @Test
    void derive_키_형식은_접두사_시간구간_해시() {
        IdempotencyKey key = deriver.derive(request().build());

        long bucket = NOW.getEpochSecond() / 3600;
        assertThat(key.getValue()).startsWith(IdempotencyKeyDeriver.KEY_PREFIX + bucket + "_");
        assertThat(key.getValue()).matches("org_setup_\\d+_[0-9a-f]{32}");
    }

    @Test
    void derive_시간구간이_바뀌면_다른_키() {
        IdempotencyKeyDeriver nextHour = new IdempotencyKeyDeriver(
            Clock.fixed(NOW.plus(Duration.ofHours(1)), ZoneOffset.UTC), Duration.ofHours(1));

        assertThat(nextHour.derive(request().build())).isNotEqualTo(deriver.derive(request().build()));
    }

    @Test
    void fingerprint_비밀번호는_지문에_포함되지_않음() {
        SetupRequest one = request().adminPassword("first-password").build();
        SetupRequest other = request().adminPassword("second-password").build();

        assertThat(deriver.fingerprint(one)).isEqualTo(deriver.fingerprint(other));
        assertThat(deriver.canonicalJson(one)).doesNotContain("password");
    }

    @Test
    void fingerprint_이메일과_도메인은_대소문자를_무시() {
        SetupRequest lower = request().adminEmail("admin@acme.com").customDomain("shop.acme.com").build();
        SetupRequest mixed = request().adminEmail("Admin@ACME.com").customDomain("Shop.Acme.COM").build();

        assertThat(deriver.fingerprint(lower)).isEqualTo(deriver.fingerprint(mixed));
    }

    @Test
    void fingerprint_이름이_다르면_다른_지문() {
        assertThat(deriver.fingerprint(request().name("Acme Corp").build()))
            .isNotEqualTo(deriver.fingerprint(request().name("Acme Inc").build()));
    }

    @Test
    void fingerprint_설정_순서는_지문에_영향_없음() {
        SetupRequest ab = request().setting("plan", "pro").setting("region", "eu").build();
        SetupRequest ba = request().setting("region", "eu").setting("plan", "pro").build();

        assertThat(deriver.fingerprint(ab)).isEqualTo(deriver.fingerprint(ba));
        assertThat(deriver.fingerprint(ab)).hasSize(64);
    }

    @Test
    void canonicalJson_키가_정렬된_JSON() {
        String json = deriver.canonicalJson(request().build());

        assertThat(json).startsWith("{\"admin_email\":\"admin@acme.com\"");
        assertThat(json).contains("\"custom_domain\":null");
        assertThat(json).endsWith("\"subdomain\":\"acme\"}");
    }

    @Test
    void 생성자_1초_미만_구간은_예외() {
        assertThatThrownBy(() -> new IdempotencyKeyDeriver(Clock.systemUTC(), Duration.ofMillis(500)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("timeBucket");
    }

    private static SetupRequest.Builder request() {
        return SetupRequest.builder()
            .name("Acme Corp")
            .subdomain("acme")
            .adminName("Jane Admin")
            .adminEmail("admin@acme.com")
            .adminPassword("s3cure-passw0rd");
    }
}
