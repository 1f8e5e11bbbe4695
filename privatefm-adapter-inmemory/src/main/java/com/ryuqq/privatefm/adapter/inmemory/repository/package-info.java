/**
 * In-memory repository adapter implementation package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.privatefm.adapter.inmemory.repository.InMemoryNamespaceRepository}:
 *       namespaces with compare-and-set status transitions</li>
 *   <li>{@link com.ryuqq.privatefm.adapter.inmemory.repository.InMemoryMergeOperationRepository}:
 *       merge operations with an atomic single-active insert</li>
 *   <li>{@link com.ryuqq.privatefm.adapter.inmemory.repository.InMemoryFallbackOperationRepository}</li>
 *   <li>{@link com.ryuqq.privatefm.adapter.inmemory.repository.InMemoryEventLogRepository}:
 *       append-only log with per-namespace sequence assignment</li>
 *   <li>{@link com.ryuqq.privatefm.adapter.inmemory.repository.InMemoryAdapterResetRepository}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.privatefm.adapter.inmemory.repository;
