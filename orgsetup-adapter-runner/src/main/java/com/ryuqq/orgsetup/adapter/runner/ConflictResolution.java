package com.ryuqq.orgsetup.adapter.runner;

/**
 * 충돌 해결 결과.
 *
 * <ul>
 *   <li>reuse: 기존 리소스를 이번 단계의 결과로 사용</li>
 *   <li>freshAttempt: 기존 리소스가 사라졌으므로 한 번 더 생성 시도해도 안전</li>
 * </ul>
 *
 * @param existing 재사용할 리소스 (freshAttempt이면 null)
 * @param <T> 리소스 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ConflictResolution<T>(T existing) {

    public static <T> ConflictResolution<T> reuse(T existing) {
        if (existing == null) {
            throw new IllegalArgumentException("existing cannot be null");
        }
        return new ConflictResolution<>(existing);
    }

    public static <T> ConflictResolution<T> freshAttempt() {
        return new ConflictResolution<>(null);
    }

    public boolean isReuse() {
        return existing != null;
    }

    public boolean isFreshAttempt() {
        return existing == null;
    }
}
