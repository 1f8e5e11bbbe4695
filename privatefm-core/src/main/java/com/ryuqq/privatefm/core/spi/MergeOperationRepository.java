package com.ryuqq.privatefm.core.spi;

import com.ryuqq.privatefm.core.model.MergeOperation;
import com.ryuqq.privatefm.core.model.NamespaceId;
import com.ryuqq.privatefm.core.model.OperationId;
import com.ryuqq.privatefm.core.statemachine.OperationStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Merge operation persistence SPI.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MergeOperationRepository {

    /**
     * Inserts the operation only if the namespace has no PENDING or RUNNING operation.
     * The check and the insert are atomic.
     *
     * @param operation the new operation
     * @return true if inserted
     */
    boolean insertIfNoActive(MergeOperation operation);

    /**
     * Inserts unconditionally (forced merges).
     *
     * @param operation the new operation
     */
    void insert(MergeOperation operation);

    /**
     * Replaces a stored operation.
     *
     * @param operation the new value
     */
    void save(MergeOperation operation);

    /**
     * Atomically applies {@code change} if the stored status is one of {@code expected}.
     *
     * @param operationId the operation
     * @param expected statuses the caller expects
     * @param change the change to apply to the stored value
     * @return the stored result, or empty if absent or the status did not match
     */
    Optional<MergeOperation> transition(OperationId operationId, Set<OperationStatus> expected, UnaryOperator<MergeOperation> change);

    Optional<MergeOperation> find(OperationId operationId);

    /**
     * @param namespaceId the namespace
     * @param limit maximum number of results
     * @return operations, most recently scheduled first
     */
    List<MergeOperation> findByNamespace(NamespaceId namespaceId, int limit);

    /**
     * @param namespaceId the namespace
     * @return PENDING or RUNNING operations of the namespace
     */
    List<MergeOperation> findActive(NamespaceId namespaceId);

    /**
     * @return every operation, for statistics
     */
    List<MergeOperation> findAll();

    /**
     * Deletes terminal operations completed before {@code cutoff}.
     *
     * @param cutoff retention cutoff
     * @return number of deleted operations
     */
    int deleteTerminalBefore(Instant cutoff);
}
