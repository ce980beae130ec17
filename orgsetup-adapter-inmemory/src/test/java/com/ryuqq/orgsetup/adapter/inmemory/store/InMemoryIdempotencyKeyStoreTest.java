package com.ryuqq.orgsetup.adapter.inmemory.store;

import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import com.ryuqq.orgsetup.core.model.RecoveryType;
import com.ryuqq.orgsetup.core.model.SetupMetadata;
import com.ryuqq.orgsetup.core.model.SetupResult;
import com.ryuqq.orgsetup.core.model.SetupStep;
import com.ryuqq.orgsetup.core.model.resource.AdminUser;
import com.ryuqq.orgsetup.core.model.resource.ApiKey;
import com.ryuqq.orgsetup.core.model.resource.Organization;
import com.ryuqq.orgsetup.core.model.resource.Tenant;
import com.ryuqq.orgsetup.core.spi.Reservation;
import com.ryuqq.orgsetup.core.spi.ReservationStatus;
import com.ryuqq.orgsetup.testkit.contract.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryIdempotencyKeyStore 단위 테스트.
 *
 * <p>계약 테스트가 다루지 않는 구현 고유 동작을 검증합니다:</p>
 * <ul>
 *   <li>인자 검증</li>
 *   <li>lease 만료 후 다른 fingerprint로 인수</li>
 *   <li>소유 토큰 검증과 예외 메시지</li>
 *   <li>clear / size</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryIdempotencyKeyStoreTest {

    private MutableClock clock;
    private InMemoryIdempotencyKeyStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        store = new InMemoryIdempotencyKeyStore(Duration.ofMinutes(1), clock);
    }

    @Test
    void 생성자_lease가_0이면_예외() {
        assertThatThrownBy(() -> new InMemoryIdempotencyKeyStore(Duration.ZERO, clock))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("lease");
    }

    @Test
    void reserve_빈_fingerprint면_예외() {
        assertThatThrownBy(() -> store.reserve(IdempotencyKey.of("k-1"), " "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reserve_null_키면_예외() {
        assertThatThrownBy(() -> store.reserve(null, "fp"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("IdempotencyKey");
    }

    @Test
    void lease_만료된_예약은_다른_fingerprint로도_인수됨() {
        IdempotencyKey key = IdempotencyKey.of("k-2");
        store.reserve(key, "fp-old");

        clock.advance(Duration.ofMinutes(2));

        assertThat(store.reserve(key, "fp-new").status()).isEqualTo(ReservationStatus.ACQUIRED);
        assertThat(store.reserve(key, "fp-new").status()).isEqualTo(ReservationStatus.IN_FLIGHT);
        assertThat(store.reserve(key, "fp-old").status()).isEqualTo(ReservationStatus.FINGERPRINT_MISMATCH);
    }

    @Test
    void commit_null_결과면_예외() {
        IdempotencyKey key = IdempotencyKey.of("k-3");
        Reservation reservation = store.reserve(key, "fp");

        assertThatThrownBy(() -> store.commit(reservation, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void commit_null_예약이면_예외() {
        assertThatThrownBy(() -> store.commit(null, result(IdempotencyKey.of("k-9"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("reservation cannot be null");
    }

    @Test
    void commit_획득하지_못한_예약이면_예외() {
        // given
        IdempotencyKey key = IdempotencyKey.of("k-6");
        store.reserve(key, "fp");
        Reservation inFlight = store.reserve(key, "fp");

        // when & then
        assertThatThrownBy(() -> store.commit(inFlight, result(key)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("reservation was not acquired: IN_FLIGHT");
    }

    @Test
    void commit_인수된_예약의_이전_토큰이면_taken_over_예외() {
        // given
        IdempotencyKey key = IdempotencyKey.of("k-7");
        Reservation stale = store.reserve(key, "fp");
        clock.advance(Duration.ofMinutes(1));
        Reservation current = store.reserve(key, "fp");

        // when & then
        assertThat(current.token()).isNotEqualTo(stale.token());
        assertThatThrownBy(() -> store.commit(stale, result(key)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("was taken over by another execution");
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void release_이전_토큰은_현재_예약을_지우지_않음() {
        // given
        IdempotencyKey key = IdempotencyKey.of("k-8");
        Reservation stale = store.reserve(key, "fp");
        clock.advance(Duration.ofMinutes(1));
        store.reserve(key, "fp");

        // when
        store.release(stale);

        // then
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.reserve(key, "fp").status()).isEqualTo(ReservationStatus.IN_FLIGHT);
    }

    @Test
    void clear_모든_항목_제거() {
        store.reserve(IdempotencyKey.of("k-4"), "fp");
        store.reserve(IdempotencyKey.of("k-5"), "fp");
        assertThat(store.size()).isEqualTo(2);

        store.clear();

        assertThat(store.size()).isZero();
        assertThat(store.lookup(IdempotencyKey.of("k-4"))).isEmpty();
    }

    private SetupResult result(IdempotencyKey key) {
        Instant now = clock.instant();
        SetupMetadata metadata = new SetupMetadata(
            key, List.of(SetupStep.ORGANIZATION_CREATION, SetupStep.TENANT_CREATION,
                SetupStep.ADMIN_USER_CREATION, SetupStep.API_KEY_GENERATION),
            List.of(), List.of(SetupStep.DOMAIN_CONFIGURATION), RecoveryType.NONE,
            false, false, List.of(), now, now);
        return new SetupResult(
            new Organization("org_1", "Acme", "acme", null),
            new Tenant("tenant_1", "org_1", "Acme", "acme"),
            new AdminUser("user_1", "tenant_1", "DPO", "a@acme.com", "organization_admin"),
            new ApiKey("key_1", "user_1", "sk_live_x", "organization", now.plusSeconds(86_400)),
            null,
            metadata);
    }
}
