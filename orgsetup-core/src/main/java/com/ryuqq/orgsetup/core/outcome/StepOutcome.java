package com.ryuqq.orgsetup.core.outcome;

/**
 * 셋업 단계 한 번의 시도 결과.
 *
 * <p>StepOutcome은 네 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 리소스 생성 성공</li>
 *   <li>{@link Conflict}: 동일 리소스가 이미 존재 (409), 충돌 해결 대상</li>
 *   <li>{@link Transient}: 일시적 실패, 재시도 가능</li>
 *   <li>{@link Fatal}: 영구적 실패, 재시도 불가</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @param <T> 단계가 생성하는 리소스 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface StepOutcome<T> permits Success, Conflict, Transient, Fatal {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * 결과가 충돌인지 확인.
     *
     * @return 충돌 여부
     */
    default boolean isConflict() {
        return this instanceof Conflict;
    }

    /**
     * 결과가 재시도 가능한 실패인지 확인.
     *
     * @return 일시적 실패 여부
     */
    default boolean isTransient() {
        return this instanceof Transient;
    }

    /**
     * 결과가 영구 실패인지 확인.
     *
     * @return 영구 실패 여부
     */
    default boolean isFatal() {
        return this instanceof Fatal;
    }
}
