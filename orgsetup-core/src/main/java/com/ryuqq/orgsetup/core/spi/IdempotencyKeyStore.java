package com.ryuqq.orgsetup.core.spi;

import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import com.ryuqq.orgsetup.core.model.SetupResult;

import java.util.Optional;

/**
 * 멱등성 키 저장소 SPI (Service Provider Interface).
 *
 * <p>같은 키로 들어온 셋업 요청이 최대 한 번만 실행되도록 보장합니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>reserve는 원자적 compare-and-set이어야 함 (동시 요청 중 하나만 ACQUIRED)</li>
 *   <li>예약 시 요청 fingerprint를 저장하고, 다른 fingerprint로 재사용되면 FINGERPRINT_MISMATCH</li>
 *   <li>lease가 만료된 진행 중 예약은 다른 호출자가 가져갈 수 있음 (실행 중 프로세스 종료 대비)</li>
 *   <li>release는 완료된 결과를 절대 삭제하지 않음</li>
 *   <li>commit/release는 현재 예약의 토큰과 일치할 때만 동작 (인수된 예약은 이전 소유자가 변경 불가)</li>
 * </ul>
 *
 * <p><strong>동시성 제어 권장 방안:</strong></p>
 * <ul>
 *   <li>Database Unique Constraint + 상태 컬럼</li>
 *   <li>Redis SET NX PX (lease = TTL)</li>
 *   <li>ConcurrentHashMap.compute (단일 프로세스, 테스트용)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface IdempotencyKeyStore {

    /**
     * 완료된 셋업 결과 조회.
     *
     * @param key 멱등성 키
     * @return 완료된 결과 (없거나 진행 중이면 empty)
     * @throws IllegalArgumentException key가 null인 경우
     */
    Optional<SetupResult> lookup(IdempotencyKey key);

    /**
     * 키 예약 (원자적).
     *
     * @param key 멱등성 키
     * @param fingerprint 요청 내용의 해시
     * @return 예약 결과 (ACQUIRED면 새 소유 토큰 포함)
     * @throws IllegalArgumentException key 또는 fingerprint가 null인 경우
     */
    Reservation reserve(IdempotencyKey key, String fingerprint);

    /**
     * 예약한 키에 결과를 저장하고 완료 상태로 전환.
     *
     * @param reservation ACQUIRED 예약
     * @param result 셋업 결과
     * @throws IllegalArgumentException reservation 또는 result가 null이거나 ACQUIRED가 아닌 경우
     * @throws IllegalStateException 예약이 없거나, 이미 완료되었거나, 다른 실행이 인수한 경우
     */
    void commit(Reservation reservation, SetupResult result);

    /**
     * 진행 중 예약 해제 (실패 시).
     *
     * <p>완료된 결과와 다른 토큰의 예약은 삭제하지 않습니다.
     * 예약이 없으면 아무 일도 하지 않습니다.</p>
     *
     * @param reservation ACQUIRED 예약
     * @throws IllegalArgumentException reservation이 null이거나 ACQUIRED가 아닌 경우
     */
    void release(Reservation reservation);
}
