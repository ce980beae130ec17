package com.ryuqq.orgsetup.core.spi;

/**
 * 멱등성 키 예약 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ReservationStatus {

    /** 예약 성공, 호출자가 실행 권한을 가짐 */
    ACQUIRED,

    /** 같은 키로 다른 실행이 진행 중 (lease 만료 전) */
    IN_FLIGHT,

    /** 이미 완료된 결과가 저장되어 있음 */
    COMPLETED,

    /** 같은 키가 다른 요청 fingerprint로 사용됨 */
    FINGERPRINT_MISMATCH;

    public boolean isAcquired() {
        return this == ACQUIRED;
    }
}
