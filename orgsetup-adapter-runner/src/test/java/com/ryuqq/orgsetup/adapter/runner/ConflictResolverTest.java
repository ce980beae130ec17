package com.ryuqq.orgsetup.adapter.runner;

import com.ryuqq.orgsetup.core.exception.ResourceApiException;
import com.ryuqq.orgsetup.core.exception.UnresolvableConflictException;
import com.ryuqq.orgsetup.core.model.ConflictRecord;
import com.ryuqq.orgsetup.core.model.ConflictType;
import com.ryuqq.orgsetup.core.model.SetupStep;
import com.ryuqq.orgsetup.core.model.resource.Organization;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ConflictResolver 유닛 테스트.
 *
 * <p>409 응답의 분류와 기존 리소스 재사용 판단을 검증합니다:</p>
 * <ul>
 *   <li>충돌 코드 → ConflictType 매핑</li>
 *   <li>동일 리소스 확인 시 재사용</li>
 *   <li>다른 리소스이거나 조회 불가 시 해결 불가</li>
 *   <li>기존 리소스가 사라진 경우 재시도 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ConflictResolverTest {

    private final ConflictResolver resolver = new ConflictResolver();

    private final Organization existing = new Organization("org_7", "Acme Corp", "acme", null);

    // ============================================================
    // 1. 충돌 분류
    // ============================================================

    @Test
    void classify_409_응답이면_ConflictRecord_생성() {
        // given
        ResourceApiException error = ResourceApiException.conflict(
            "subdomain_exists", List.of("subdomain"), "org_7", Map.of("subdomain", "acme"), "taken");

        // when
        ConflictRecord record = resolver.classify(SetupStep.ORGANIZATION_CREATION, error);

        // then
        assertThat(record).isNotNull();
        assertThat(record.type()).isEqualTo(ConflictType.SUBDOMAIN_EXISTS);
        assertThat(record.step()).isEqualTo(SetupStep.ORGANIZATION_CREATION);
        assertThat(record.fields()).containsExactly("subdomain");
        assertThat(record.existingResourceId()).isEqualTo("org_7");
        assertThat(record.suggestions()).anyMatch(s -> s.contains("/organizations/org_7"));
    }

    @Test
    void classify_알_수_없는_충돌_코드는_UNKNOWN() {
        ResourceApiException error = ResourceApiException.conflict("whatever", null, null, null, "c");

        ConflictRecord record = resolver.classify(SetupStep.TENANT_CREATION, error);

        assertThat(record.type()).isEqualTo(ConflictType.UNKNOWN);
        assertThat(record.hasExistingResourceId()).isFalse();
    }

    @Test
    void classify_충돌이_아니면_null() {
        assertThat(resolver.classify(SetupStep.TENANT_CREATION, ResourceApiException.validation("v"))).isNull();
        assertThat(resolver.classify(SetupStep.TENANT_CREATION, new IllegalStateException("x"))).isNull();
    }

    // ============================================================
    // 2. 해결
    // ============================================================

    @Test
    void resolve_동일_리소스면_재사용() {
        // given
        ConflictRecord conflict = conflict("org_7");
        ExistingResourceLookup<Organization> lookup = ExistingResourceLookup.of(
            c -> true, c -> Optional.of(existing), org -> org.subdomain().equals("acme"));

        // when
        ConflictResolution<Organization> resolution = resolver.resolve(conflict, lookup);

        // then
        assertThat(resolution.isReuse()).isTrue();
        assertThat(resolution.existing()).isEqualTo(existing);
    }

    @Test
    void resolve_다른_리소스면_UnresolvableConflictException() {
        ConflictRecord conflict = conflict("org_7");
        ExistingResourceLookup<Organization> lookup = ExistingResourceLookup.of(
            c -> true, c -> Optional.of(existing), org -> false);

        assertThatThrownBy(() -> resolver.resolve(conflict, lookup))
            .isInstanceOf(UnresolvableConflictException.class)
            .hasMessageContaining("does not match");
    }

    @Test
    void resolve_조회를_지원하지_않으면_UnresolvableConflictException() {
        assertThatThrownBy(() -> resolver.resolve(conflict(null), ExistingResourceLookup.<Organization>none()))
            .isInstanceOf(UnresolvableConflictException.class)
            .satisfies(e -> assertThat(((UnresolvableConflictException) e).getConflict().type())
                .isEqualTo(ConflictType.SUBDOMAIN_EXISTS));
    }

    @Test
    void resolve_기존_리소스가_사라졌으면_재시도_허용() {
        ExistingResourceLookup<Organization> lookup = ExistingResourceLookup.of(
            c -> true, c -> Optional.empty(), org -> true);

        ConflictResolution<Organization> resolution = resolver.resolve(conflict("org_7"), lookup);

        assertThat(resolution.isFreshAttempt()).isTrue();
    }

    @Test
    void resolve_조회_API_실패는_원인과_함께_UnresolvableConflictException() {
        ResourceApiException lookupFailure = ResourceApiException.serverError(500, "lookup down");
        ExistingResourceLookup<Organization> lookup = ExistingResourceLookup.of(
            c -> true, c -> { throw lookupFailure; }, org -> true);

        assertThatThrownBy(() -> resolver.resolve(conflict("org_7"), lookup))
            .isInstanceOf(UnresolvableConflictException.class)
            .hasCause(lookupFailure);
    }

    @Test
    void resolve_조회_중_전송_오류도_원인과_함께_UnresolvableConflictException() {
        UncheckedIOException transportFailure = new UncheckedIOException(new IOException("connection reset"));
        ExistingResourceLookup<Organization> lookup = ExistingResourceLookup.of(
            c -> true, c -> { throw transportFailure; }, org -> true);

        assertThatThrownBy(() -> resolver.resolve(conflict("org_7"), lookup))
            .isInstanceOf(UnresolvableConflictException.class)
            .hasCause(transportFailure)
            .hasMessageContaining("connection reset");
    }

    private static ConflictRecord conflict(String existingId) {
        return new ConflictRecord(
            ConflictType.SUBDOMAIN_EXISTS, SetupStep.ORGANIZATION_CREATION,
            List.of("subdomain"), existingId, Map.of(), null);
    }
}
