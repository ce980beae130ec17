package com.ryuqq.orgsetup.core.outcome;

import com.ryuqq.orgsetup.core.model.ConflictRecord;

/**
 * 동일 리소스가 이미 존재하는 충돌.
 *
 * <p>재사용 가능 여부는 ConflictResolver가 판단합니다.</p>
 *
 * @param record 분류된 충돌 정보
 * @param cause 원본 오류
 * @param <T> 리소스 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Conflict<T>(ConflictRecord record, Throwable cause) implements StepOutcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException record가 null인 경우
     */
    public Conflict {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
    }
}
