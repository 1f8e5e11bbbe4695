package com.ryuqq.privatefm.core.spi;

import com.ryuqq.privatefm.core.model.NamespaceId;
import com.ryuqq.privatefm.core.model.ResourceQuota;

import java.util.Optional;

/**
 * Tracks isolated resources allocated to namespaces.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResourceTracker {

    /**
     * Allocates a quota.
     *
     * @param quota the quota
     * @throws com.ryuqq.privatefm.core.exception.OrchestratorException if allocation fails
     */
    void allocate(ResourceQuota quota);

    /**
     * Releases the quota of a namespace. Releasing an unallocated namespace is a no-op.
     *
     * @param namespaceId the namespace
     */
    void release(NamespaceId namespaceId);

    /**
     * @param namespaceId the namespace
     * @return the allocated quota, if any
     */
    Optional<ResourceQuota> find(NamespaceId namespaceId);
}
