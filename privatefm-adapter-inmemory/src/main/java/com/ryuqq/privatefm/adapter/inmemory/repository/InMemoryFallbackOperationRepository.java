package com.ryuqq.privatefm.adapter.inmemory.repository;

import com.ryuqq.privatefm.core.model.FallbackOperation;
import com.ryuqq.privatefm.core.model.NamespaceId;
import com.ryuqq.privatefm.core.model.OperationId;
import com.ryuqq.privatefm.core.spi.FallbackOperationRepository;
import com.ryuqq.privatefm.core.statemachine.OperationStatus;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link FallbackOperationRepository} SPI.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryFallbackOperationRepository implements FallbackOperationRepository {

    private final ConcurrentHashMap<OperationId, FallbackOperation> operations = new ConcurrentHashMap<>();

    @Override
    public void insert(FallbackOperation operation) {
        if (operations.putIfAbsent(operation.operationId(), operation) != null) {
            throw new IllegalStateException("Fallback operation already exists: " + operation.operationId());
        }
    }

    @Override
    public synchronized void save(FallbackOperation operation) {
        if (!operations.containsKey(operation.operationId())) {
            throw new IllegalStateException("Fallback operation not found: " + operation.operationId());
        }
        operations.put(operation.operationId(), operation);
    }

    @Override
    public synchronized Optional<FallbackOperation> transition(
        OperationId operationId,
        Set<OperationStatus> expected,
        UnaryOperator<FallbackOperation> change
    ) {
        FallbackOperation current = operations.get(operationId);
        if (current == null || !expected.contains(current.status())) {
            return Optional.empty();
        }
        FallbackOperation updated = change.apply(current);
        operations.put(operationId, updated);
        return Optional.of(updated);
    }

    @Override
    public Optional<FallbackOperation> find(OperationId operationId) {
        return Optional.ofNullable(operations.get(operationId));
    }

    @Override
    public List<FallbackOperation> findByNamespace(NamespaceId namespaceId) {
        return operations.values().stream()
            .filter(op -> op.namespaceId().equals(namespaceId))
            .sorted(Comparator.comparing(FallbackOperation::scheduledAt).reversed())
            .collect(Collectors.toList());
    }
}
