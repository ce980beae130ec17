/**
 * SPI (Service Provider Interface) 패키지.
 *
 * <p>셋업 오케스트레이터가 의존하는 외부 협력자 계약입니다.</p>
 * <ul>
 *   <li>{@link com.ryuqq.orgsetup.core.spi.IdempotencyKeyStore}: 멱등성 키 예약/저장</li>
 *   <li>리소스 API: Organization, Tenant, AdminUser, ApiKey, Domain 서비스</li>
 *   <li>{@link com.ryuqq.orgsetup.core.spi.SetupObserver}: 진행 상황 관찰</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.orgsetup.core.spi;
