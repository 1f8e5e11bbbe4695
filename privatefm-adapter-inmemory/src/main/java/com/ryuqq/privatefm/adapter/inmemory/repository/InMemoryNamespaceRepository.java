package com.ryuqq.privatefm.adapter.inmemory.repository;

import com.ryuqq.privatefm.core.model.LearnerId;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.model.NamespaceId;
import com.ryuqq.privatefm.core.spi.NamespaceRepository;
import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link NamespaceRepository} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>byId:</strong> ConcurrentHashMap&lt;NamespaceId, Namespace&gt; - current value per namespace</li>
 *   <li><strong>byLearner:</strong> ConcurrentHashMap&lt;LearnerId, NamespaceId&gt; - one namespace per learner</li>
 * </ul>
 *
 * <p><strong>Concurrency:</strong> writes are synchronized on the repository, so a
 * {@link #transition(NamespaceId, Set, UnaryOperator)} reads and replaces the stored value
 * without interleaving. Reads are lock-free.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryNamespaceRepository implements NamespaceRepository {

    private final ConcurrentHashMap<NamespaceId, Namespace> byId = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<LearnerId, NamespaceId> byLearner = new ConcurrentHashMap<>();

    @Override
    public synchronized boolean insert(Namespace namespace) {
        if (namespace == null) {
            throw new IllegalArgumentException("namespace cannot be null");
        }
        if (byLearner.containsKey(namespace.learnerId()) || byId.containsKey(namespace.id())) {
            return false;
        }
        byId.put(namespace.id(), namespace);
        byLearner.put(namespace.learnerId(), namespace.id());
        return true;
    }

    @Override
    public Optional<Namespace> findByLearner(LearnerId learnerId) {
        NamespaceId id = byLearner.get(learnerId);
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    @Override
    public Optional<Namespace> findById(NamespaceId namespaceId) {
        return Optional.ofNullable(byId.get(namespaceId));
    }

    @Override
    public List<Namespace> findByStatuses(Set<NamespaceStatus> statuses) {
        return byId.values().stream()
            .filter(ns -> statuses == null || statuses.isEmpty() || statuses.contains(ns.status()))
            .sorted(Comparator.comparing(Namespace::createdAt).thenComparing(ns -> ns.id().getValue()))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<Namespace> transition(
        NamespaceId namespaceId,
        Set<NamespaceStatus> expected,
        UnaryOperator<Namespace> change
    ) {
        Namespace current = byId.get(namespaceId);
        if (current == null || !expected.contains(current.status())) {
            return Optional.empty();
        }
        Namespace updated = change.apply(current);
        if (!updated.id().equals(namespaceId)) {
            throw new IllegalStateException("transition cannot change the namespace id");
        }
        byId.put(namespaceId, updated);
        return Optional.of(updated);
    }

    @Override
    public synchronized void save(Namespace namespace) {
        if (!byId.containsKey(namespace.id())) {
            throw new IllegalStateException("Namespace not found: " + namespace.id());
        }
        byId.put(namespace.id(), namespace);
    }

    @Override
    public synchronized void remove(NamespaceId namespaceId) {
        Namespace removed = byId.remove(namespaceId);
        if (removed != null) {
            byLearner.remove(removed.learnerId(), namespaceId);
        }
    }
}
