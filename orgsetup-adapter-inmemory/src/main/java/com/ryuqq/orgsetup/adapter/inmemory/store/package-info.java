/**
 * In-memory idempotency key store.
 *
 * <p>{@link com.ryuqq.orgsetup.adapter.inmemory.store.InMemoryIdempotencyKeyStore} is the
 * reference implementation of {@link com.ryuqq.orgsetup.core.spi.IdempotencyKeyStore}
 * used by the contract tests in {@code orgsetup-testkit}.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not shared between processes</li>
 * </ul>
 *
 * @see com.ryuqq.orgsetup.core.spi.IdempotencyKeyStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.orgsetup.adapter.inmemory.store;
