package com.ryuqq.orgsetup.core.exception;

import com.ryuqq.orgsetup.core.model.IdempotencyKey;

/**
 * 멱등성 키를 사용할 수 없는 경우.
 *
 * <ul>
 *   <li>IN_FLIGHT: 같은 키로 다른 실행이 진행 중</li>
 *   <li>FINGERPRINT_MISMATCH: 같은 키가 다른 요청 내용으로 이미 사용됨</li>
 *   <li>RESERVATION_LOST: lease 만료로 다른 실행이 키를 인수하여 결과를 저장할 수 없음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class IdempotencyConflictException extends OrgSetupException {

    /**
     * 키를 사용할 수 없는 이유.
     */
    public enum Reason {
        IN_FLIGHT,
        FINGERPRINT_MISMATCH,
        RESERVATION_LOST
    }

    private final IdempotencyKey key;
    private final Reason reason;

    public IdempotencyConflictException(IdempotencyKey key, Reason reason) {
        this(key, reason, null);
    }

    public IdempotencyConflictException(IdempotencyKey key, Reason reason, Throwable cause) {
        super("IDEMPOTENCY_" + reason.name(), describe(key, reason), cause);
        this.key = key;
        this.reason = reason;
    }

    private static String describe(IdempotencyKey key, Reason reason) {
        return switch (reason) {
            case IN_FLIGHT -> "Setup with " + key + " is already in progress";
            case FINGERPRINT_MISMATCH -> key + " was already used with a different request";
            case RESERVATION_LOST -> "Reservation for " + key + " was taken over by another execution";
        };
    }

    public IdempotencyKey getKey() {
        return key;
    }

    public Reason getReason() {
        return reason;
    }
}
