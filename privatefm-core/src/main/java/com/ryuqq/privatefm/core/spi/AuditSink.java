package com.ryuqq.privatefm.core.spi;

import java.util.Map;

/**
 * Audit trail SPI.
 *
 * <p>Implementations may throw; callers wrap the sink so that audit failures
 * never abort the audited operation.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AuditSink {

    /**
     * Records an audit entry.
     *
     * @param action action name (e.g. ADAPTER_RESET_REQUESTED)
     * @param resourceType resource type (e.g. adapter_reset)
     * @param resourceId resource id
     * @param actor acting principal
     * @param details additional details
     */
    void record(String action, String resourceType, String resourceId, String actor, Map<String, Object> details);
}
