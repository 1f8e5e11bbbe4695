package com.ryuqq.privatefm.core.spi;

import com.ryuqq.privatefm.core.model.FallbackOperation;
import com.ryuqq.privatefm.core.model.NamespaceId;
import com.ryuqq.privatefm.core.model.OperationId;
import com.ryuqq.privatefm.core.statemachine.OperationStatus;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Fallback operation persistence SPI.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface FallbackOperationRepository {

    void insert(FallbackOperation operation);

    void save(FallbackOperation operation);

    /**
     * Atomically applies {@code change} if the stored status is one of {@code expected}.
     *
     * @return the stored result, or empty if absent or the status did not match
     */
    Optional<FallbackOperation> transition(OperationId operationId, Set<OperationStatus> expected, UnaryOperator<FallbackOperation> change);

    Optional<FallbackOperation> find(OperationId operationId);

    /**
     * @param namespaceId the namespace
     * @return operations, most recently scheduled first
     */
    List<FallbackOperation> findByNamespace(NamespaceId namespaceId);
}
