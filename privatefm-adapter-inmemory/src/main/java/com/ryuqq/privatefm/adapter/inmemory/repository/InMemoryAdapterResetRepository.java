package com.ryuqq.privatefm.adapter.inmemory.repository;

import com.ryuqq.privatefm.core.model.AdapterResetRequest;
import com.ryuqq.privatefm.core.model.OperationId;
import com.ryuqq.privatefm.core.spi.AdapterResetRepository;
import com.ryuqq.privatefm.core.statemachine.ResetStatus;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of {@link AdapterResetRepository} SPI.
 *
 * <p>At most one non-terminal request per (learner, subject) is admitted by
 * {@link #insertIfNoActive(AdapterResetRequest)}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryAdapterResetRepository implements AdapterResetRepository {

    private final ConcurrentHashMap<OperationId, AdapterResetRequest> requests = new ConcurrentHashMap<>();

    @Override
    public synchronized boolean insertIfNoActive(AdapterResetRequest request) {
        boolean hasActive = requests.values().stream()
            .anyMatch(r -> r.learnerId().equals(request.learnerId())
                && r.subject().equals(request.subject())
                && !r.status().isTerminal());
        if (hasActive) {
            return false;
        }
        requests.put(request.requestId(), request);
        return true;
    }

    @Override
    public synchronized void save(AdapterResetRequest request) {
        if (!requests.containsKey(request.requestId())) {
            throw new IllegalStateException("Reset request not found: " + request.requestId());
        }
        requests.put(request.requestId(), request);
    }

    @Override
    public synchronized Optional<AdapterResetRequest> transition(
        OperationId requestId,
        Set<ResetStatus> expected,
        UnaryOperator<AdapterResetRequest> change
    ) {
        AdapterResetRequest current = requests.get(requestId);
        if (current == null || !expected.contains(current.status())) {
            return Optional.empty();
        }
        AdapterResetRequest updated = change.apply(current);
        requests.put(requestId, updated);
        return Optional.of(updated);
    }

    @Override
    public Optional<AdapterResetRequest> find(OperationId requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    @Override
    public Optional<AdapterResetRequest> findByApprovalId(String approvalRequestId) {
        if (approvalRequestId == null) {
            return Optional.empty();
        }
        return requests.values().stream()
            .filter(r -> approvalRequestId.equals(r.approvalRequestId()))
            .findFirst();
    }
}
