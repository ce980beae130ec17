package com.ryuqq.orgsetup.adapter.runner;

import com.ryuqq.orgsetup.core.model.ConflictRecord;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 충돌한 기존 리소스 조회 전략.
 *
 * <p>단계마다 조회 방법과 "같은 요청의 리소스인지" 판단하는 기준이 다르므로
 * 오케스트레이터가 단계별로 구성하여 {@link ConflictResolver}에 전달합니다.</p>
 *
 * @param <T> 리소스 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ExistingResourceLookup<T> {

    /**
     * 이 충돌에 대한 조회 방법이 있는지 확인.
     *
     * @param conflict 충돌 정보
     * @return 조회 가능하면 true
     */
    boolean supports(ConflictRecord conflict);

    /**
     * 기존 리소스 조회.
     *
     * @param conflict 충돌 정보
     * @return 기존 리소스 (더 이상 존재하지 않으면 empty)
     */
    Optional<T> fetch(ConflictRecord conflict);

    /**
     * 조회한 리소스가 이번 요청이 만들려던 리소스와 같은지 확인.
     *
     * @param existing 조회한 리소스
     * @return 동일하면 true
     */
    boolean confirmsIdentity(T existing);

    /**
     * 함수 조합으로 조회 전략 생성.
     *
     * @param supports 지원 여부 판단
     * @param fetch 조회 함수
     * @param identity 동일성 판단
     * @param <T> 리소스 타입
     * @return ExistingResourceLookup
     */
    static <T> ExistingResourceLookup<T> of(
        Predicate<ConflictRecord> supports,
        Function<ConflictRecord, Optional<T>> fetch,
        Predicate<T> identity
    ) {
        return new ExistingResourceLookup<>() {
            @Override
            public boolean supports(ConflictRecord conflict) {
                return supports.test(conflict);
            }

            @Override
            public Optional<T> fetch(ConflictRecord conflict) {
                return fetch.apply(conflict);
            }

            @Override
            public boolean confirmsIdentity(T existing) {
                return identity.test(existing);
            }
        };
    }

    /**
     * 조회 방법이 없는 전략 (모든 충돌이 해결 불가).
     *
     * @param <T> 리소스 타입
     * @return 아무 충돌도 지원하지 않는 ExistingResourceLookup
     */
    static <T> ExistingResourceLookup<T> none() {
        return of(conflict -> false, conflict -> Optional.empty(), existing -> false);
    }
}
