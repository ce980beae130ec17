package com.ryuqq.orgsetup.core.outcome;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>유효성 검증 실패 (400)</li>
 *   <li>인증/권한 오류 (401, 403)</li>
 *   <li>해결할 수 없는 충돌</li>
 * </ul>
 *
 * @param error 실패 원인
 * @param <T> 리소스 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fatal<T>(Throwable error) implements StepOutcome<T> {

    public Fatal {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }
}
