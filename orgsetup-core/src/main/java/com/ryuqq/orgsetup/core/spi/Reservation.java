package com.ryuqq.orgsetup.core.spi;

import com.ryuqq.orgsetup.core.model.IdempotencyKey;

/**
 * 멱등성 키 예약 결과와 소유 토큰.
 *
 * <p>ACQUIRED인 경우에만 token을 가지며, commit/release는 이 토큰을 가진
 * 실행만 수행할 수 있습니다. lease 만료로 다른 실행이 키를 인수하면 이전
 * 토큰은 더 이상 유효하지 않습니다.</p>
 *
 * @param key 멱등성 키
 * @param status 예약 결과
 * @param token 소유 토큰 (ACQUIRED가 아니면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Reservation(IdempotencyKey key, ReservationStatus status, String token) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key/status가 null이거나, ACQUIRED인데 token이 없는 경우
     */
    public Reservation {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (status.isAcquired() && (token == null || token.isBlank())) {
            throw new IllegalArgumentException("an acquired reservation must carry a token");
        }
        if (!status.isAcquired()) {
            token = null;
        }
    }

    public static Reservation acquired(IdempotencyKey key, String token) {
        return new Reservation(key, ReservationStatus.ACQUIRED, token);
    }

    public static Reservation of(IdempotencyKey key, ReservationStatus status) {
        return new Reservation(key, status, null);
    }

    public boolean isAcquired() {
        return status.isAcquired();
    }
}
