/**
 * Contract test kit for organization setup.
 *
 * <p>Store implementations extend the abstract contracts and supply their
 * {@link com.ryuqq.orgsetup.core.spi.IdempotencyKeyStore} through
 * {@link com.ryuqq.orgsetup.testkit.contract.AbstractContractTest#createIdempotencyKeyStore(java.time.Clock)}.</p>
 *
 * <p><strong>Contracts:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.orgsetup.testkit.contract.IdempotencyKeyStoreContract}: reserve / commit / release semantics</li>
 *   <li>{@link com.ryuqq.orgsetup.testkit.contract.SetupIdempotencyContract}: replay, fingerprint mismatch, concurrent callers</li>
 *   <li>{@link com.ryuqq.orgsetup.testkit.contract.SetupRollbackContract}: ordering and reverse compensation</li>
 *   <li>{@link com.ryuqq.orgsetup.testkit.contract.SetupRecoveryContract}: retry, conflicts, partial domain, cancellation</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.orgsetup.testkit.contract;
