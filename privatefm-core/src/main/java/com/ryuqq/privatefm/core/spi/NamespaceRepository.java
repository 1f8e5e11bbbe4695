package com.ryuqq.privatefm.core.spi;

import com.ryuqq.privatefm.core.model.LearnerId;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.model.NamespaceId;
import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Namespace persistence SPI.
 *
 * <p><strong>Concurrency contract:</strong> status changes go through
 * {@link #transition(NamespaceId, Set, UnaryOperator)}, a compare-and-set on the
 * current status. Two concurrent callers expecting the same status cannot both win.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface NamespaceRepository {

    /**
     * Inserts a new namespace.
     *
     * @param namespace the namespace
     * @return true if inserted, false if a namespace already exists for the learner
     */
    boolean insert(Namespace namespace);

    /**
     * @param learnerId the learner
     * @return the learner's namespace, including a DELETED one
     */
    Optional<Namespace> findByLearner(LearnerId learnerId);

    /**
     * @param namespaceId the namespace id
     * @return the namespace
     */
    Optional<Namespace> findById(NamespaceId namespaceId);

    /**
     * Lists namespaces whose status is one of {@code statuses}, ordered by creation time.
     *
     * @param statuses status filter; empty means all
     * @return matching namespaces
     */
    List<Namespace> findByStatuses(Set<NamespaceStatus> statuses);

    /**
     * Atomically applies {@code change} if the stored status is one of {@code expected}.
     *
     * @param namespaceId the namespace
     * @param expected statuses the caller expects
     * @param change the change to apply to the stored value
     * @return the stored result, or empty if absent or the status did not match
     */
    Optional<Namespace> transition(NamespaceId namespaceId, Set<NamespaceStatus> expected, UnaryOperator<Namespace> change);

    /**
     * Replaces the stored namespace unconditionally.
     *
     * @param namespace the new value
     */
    void save(Namespace namespace);

    /**
     * Hard-removes a namespace. Only used to roll back a failed creation.
     *
     * @param namespaceId the namespace
     */
    void remove(NamespaceId namespaceId);
}
