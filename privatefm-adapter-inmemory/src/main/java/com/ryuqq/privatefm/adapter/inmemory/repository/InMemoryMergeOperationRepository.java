package com.ryuqq.privatefm.adapter.inmemory.repository;

import com.ryuqq.privatefm.core.model.MergeOperation;
import com.ryuqq.privatefm.core.model.NamespaceId;
import com.ryuqq.privatefm.core.model.OperationId;
import com.ryuqq.privatefm.core.spi.MergeOperationRepository;
import com.ryuqq.privatefm.core.statemachine.OperationStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link MergeOperationRepository} SPI.
 *
 * <p>{@link #insertIfNoActive(MergeOperation)} checks for a PENDING/RUNNING operation of the
 * namespace and inserts under the repository monitor, so concurrent triggers for the same
 * namespace admit exactly one operation.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryMergeOperationRepository implements MergeOperationRepository {

    private static final Comparator<MergeOperation> NEWEST_FIRST =
        Comparator.comparing(MergeOperation::scheduledAt).reversed()
            .thenComparing(op -> op.operationId().getValue());

    private final ConcurrentHashMap<OperationId, MergeOperation> operations = new ConcurrentHashMap<>();

    @Override
    public synchronized boolean insertIfNoActive(MergeOperation operation) {
        boolean hasActive = operations.values().stream()
            .anyMatch(op -> op.namespaceId().equals(operation.namespaceId()) && op.status().isActive());
        if (hasActive) {
            return false;
        }
        insert(operation);
        return true;
    }

    @Override
    public synchronized void insert(MergeOperation operation) {
        if (operations.putIfAbsent(operation.operationId(), operation) != null) {
            throw new IllegalStateException("Merge operation already exists: " + operation.operationId());
        }
    }

    @Override
    public synchronized void save(MergeOperation operation) {
        if (!operations.containsKey(operation.operationId())) {
            throw new IllegalStateException("Merge operation not found: " + operation.operationId());
        }
        operations.put(operation.operationId(), operation);
    }

    @Override
    public synchronized Optional<MergeOperation> transition(
        OperationId operationId,
        Set<OperationStatus> expected,
        UnaryOperator<MergeOperation> change
    ) {
        MergeOperation current = operations.get(operationId);
        if (current == null || !expected.contains(current.status())) {
            return Optional.empty();
        }
        MergeOperation updated = change.apply(current);
        operations.put(operationId, updated);
        return Optional.of(updated);
    }

    @Override
    public Optional<MergeOperation> find(OperationId operationId) {
        return Optional.ofNullable(operations.get(operationId));
    }

    @Override
    public List<MergeOperation> findByNamespace(NamespaceId namespaceId, int limit) {
        return operations.values().stream()
            .filter(op -> op.namespaceId().equals(namespaceId))
            .sorted(NEWEST_FIRST)
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<MergeOperation> findActive(NamespaceId namespaceId) {
        return operations.values().stream()
            .filter(op -> op.namespaceId().equals(namespaceId) && op.status().isActive())
            .sorted(NEWEST_FIRST)
            .collect(Collectors.toList());
    }

    @Override
    public List<MergeOperation> findAll() {
        return operations.values().stream().sorted(NEWEST_FIRST).collect(Collectors.toList());
    }

    @Override
    public synchronized int deleteTerminalBefore(Instant cutoff) {
        int deleted = 0;
        Iterator<Map.Entry<OperationId, MergeOperation>> it = operations.entrySet().iterator();
        while (it.hasNext()) {
            MergeOperation op = it.next().getValue();
            if (op.status().isTerminal() && op.completedAt() != null && op.completedAt().isBefore(cutoff)) {
                it.remove();
                deleted++;
            }
        }
        return deleted;
    }
}
