package com.ryuqq.privatefm.adapter.inmemory.external;

import com.ryuqq.privatefm.core.model.NamespaceId;
import com.ryuqq.privatefm.core.model.ResourceQuota;
import com.ryuqq.privatefm.core.spi.ResourceTracker;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ResourceTracker} that records allocations in a map.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryResourceTracker implements ResourceTracker {

    private final ConcurrentHashMap<NamespaceId, ResourceQuota> allocations = new ConcurrentHashMap<>();
    private volatile boolean failing;

    @Override
    public void allocate(ResourceQuota quota) {
        if (failing) {
            throw new IllegalStateException("Resource allocation failed for namespace " + quota.namespaceId());
        }
        allocations.put(quota.namespaceId(), quota);
    }

    @Override
    public void release(NamespaceId namespaceId) {
        allocations.remove(namespaceId);
    }

    @Override
    public Optional<ResourceQuota> find(NamespaceId namespaceId) {
        return Optional.ofNullable(allocations.get(namespaceId));
    }

    public int allocatedCount() {
        return allocations.size();
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }
}
