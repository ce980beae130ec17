package com.ryuqq.orgsetup.core.outcome;

/**
 * 리소스 생성 성공.
 *
 * @param resource 생성된 리소스
 * @param <T> 리소스 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Success<T>(T resource) implements StepOutcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException resource가 null인 경우
     */
    public Success {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
    }
}
