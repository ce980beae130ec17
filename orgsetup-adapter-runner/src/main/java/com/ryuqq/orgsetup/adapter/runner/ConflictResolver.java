package com.ryuqq.orgsetup.adapter.runner;

import com.ryuqq.orgsetup.core.exception.ResourceApiException;
import com.ryuqq.orgsetup.core.exception.UnresolvableConflictException;
import com.ryuqq.orgsetup.core.model.ConflictRecord;
import com.ryuqq.orgsetup.core.model.ConflictType;
import com.ryuqq.orgsetup.core.model.SetupStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 리소스 생성 충돌(409) 분류 및 해결.
 *
 * <p>이전 실행이 이미 만든 리소스와 충돌한 경우, 그 리소스가 이번 요청의
 * 리소스임을 확인한 뒤 재사용합니다. 서로 다른 리소스를 조용히 합치지 않도록
 * 동일성 확인에 실패하면 해결 불가로 처리합니다.</p>
 *
 * <p><strong>해결 절차:</strong></p>
 * <ol>
 *   <li>조회 방법이 없으면 → UnresolvableConflictException</li>
 *   <li>조회 실패 → UnresolvableConflictException (원인 포함, 일시적 오류 여부는 호출자가 판단)</li>
 *   <li>기존 리소스가 없음 (삭제됨) → 한 번 더 생성 시도</li>
 *   <li>동일성 불일치 → UnresolvableConflictException</li>
 *   <li>동일성 확인 → 기존 리소스 재사용</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    /**
     * 오류에서 충돌 정보 추출.
     *
     * @param step 충돌이 발생한 단계
     * @param error 발생한 오류
     * @return 충돌 정보 (충돌이 아니면 null)
     * @throws IllegalArgumentException step이 null인 경우
     */
    public ConflictRecord classify(SetupStep step, Throwable error) {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        if (!(error instanceof ResourceApiException api) || !api.isConflict()) {
            return null;
        }
        ConflictType type = ConflictType.fromCode(api.getConflictCode());
        List<String> suggestions = new ArrayList<>(type.suggestions());
        String existingId = api.getExistingResourceId();
        if (existingId != null && !existingId.isBlank()) {
            suggestions.add("Retrieve existing resource: GET " + step.resourceKind().verificationEndpoint(existingId));
        }
        return new ConflictRecord(
            type,
            step,
            api.getConflictFields(),
            existingId,
            api.getExistingValues(),
            suggestions
        );
    }

    /**
     * 충돌 해결.
     *
     * @param conflict 충돌 정보
     * @param lookup 기존 리소스 조회 전략
     * @param <T> 리소스 타입
     * @return 재사용 또는 재시도 결정
     * @throws IllegalArgumentException conflict 또는 lookup이 null인 경우
     * @throws UnresolvableConflictException 기존 리소스를 재사용할 수 없는 경우
     */
    public <T> ConflictResolution<T> resolve(ConflictRecord conflict, ExistingResourceLookup<T> lookup) {
        if (conflict == null) {
            throw new IllegalArgumentException("conflict cannot be null");
        }
        if (lookup == null) {
            throw new IllegalArgumentException("lookup cannot be null");
        }
        if (!lookup.supports(conflict)) {
            throw new UnresolvableConflictException(conflict, "no lookup available for the existing resource");
        }

        Optional<T> existing;
        try {
            existing = lookup.fetch(conflict);
        } catch (RuntimeException e) {
            throw new UnresolvableConflictException(conflict, "lookup of the existing resource failed: " + e.getMessage(), e);
        }

        if (existing.isEmpty()) {
            log.info("Conflict {} at {} refers to a resource that no longer exists, allowing a fresh attempt",
                conflict.type().code(), conflict.step());
            return ConflictResolution.freshAttempt();
        }
        if (!lookup.confirmsIdentity(existing.get())) {
            throw new UnresolvableConflictException(conflict, "existing resource does not match this request");
        }

        log.info("Conflict {} at {} resolved by reusing existing resource {}",
            conflict.type().code(), conflict.step(), conflict.existingResourceId());
        return ConflictResolution.reuse(existing.get());
    }
}
