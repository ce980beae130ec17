package com.ryuqq.orgsetup.core.model;

import java.time.Instant;
import java.util.List;

/**
 * 셋업 실행 메타데이터.
 *
 * @param idempotencyKey 실행에 사용된 멱등성 키
 * @param completedSteps 완료된 단계 (재사용 포함, 실행 순서)
 * @param reusedSteps 기존 리소스를 재사용한 단계
 * @param skippedSteps 실행하지 않은 단계 (예: 대상 도메인이 없는 도메인 설정)
 * @param recoveryType 복구 유형
 * @param partial 비필수 단계 실패로 부분 성공했는지 여부
 * @param replayed 저장된 결과를 재반환했는지 여부
 * @param notes 부가 설명
 * @param startedAt 실행 시작 시각
 * @param completedAt 실행 완료 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SetupMetadata(
    IdempotencyKey idempotencyKey,
    List<SetupStep> completedSteps,
    List<SetupStep> reusedSteps,
    List<SetupStep> skippedSteps,
    RecoveryType recoveryType,
    boolean partial,
    boolean replayed,
    List<String> notes,
    Instant startedAt,
    Instant completedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public SetupMetadata {
        if (idempotencyKey == null) {
            throw new IllegalArgumentException("idempotencyKey cannot be null");
        }
        if (recoveryType == null) {
            throw new IllegalArgumentException("recoveryType cannot be null");
        }
        if (startedAt == null || completedAt == null) {
            throw new IllegalArgumentException("startedAt and completedAt cannot be null");
        }
        completedSteps = completedSteps == null ? List.of() : List.copyOf(completedSteps);
        reusedSteps = reusedSteps == null ? List.of() : List.copyOf(reusedSteps);
        skippedSteps = skippedSteps == null ? List.of() : List.copyOf(skippedSteps);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    /**
     * replayed=true로 표시한 복사본.
     *
     * @return 재반환용 메타데이터
     */
    public SetupMetadata asReplay() {
        return new SetupMetadata(
            idempotencyKey, completedSteps, reusedSteps, skippedSteps,
            recoveryType, partial, true, notes, startedAt, completedAt
        );
    }
}
