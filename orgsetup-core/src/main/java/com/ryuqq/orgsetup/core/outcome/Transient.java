package com.ryuqq.orgsetup.core.outcome;

/**
 * 일시적 실패 (재시도 가능).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>네트워크 타임아웃, 연결 재설정</li>
 *   <li>5xx 서버 오류</li>
 *   <li>429 Too Many Requests</li>
 * </ul>
 *
 * @param error 실패 원인
 * @param <T> 리소스 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Transient<T>(Throwable error) implements StepOutcome<T> {

    public Transient {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }
}
