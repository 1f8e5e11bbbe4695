package com.ryuqq.privatefm.core.spi;

import java.util.List;

/**
 * Names of the work queues consumed by the runner module.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class QueueNames {

    public static final String MERGE_QUEUE = "merge_queue";
    public static final String FALLBACK_QUEUE = "fallback_queue";
    public static final String ADAPTER_RESET_QUEUE = "adapter_reset_queue";

    public static final List<String> ALL = List.of(MERGE_QUEUE, FALLBACK_QUEUE, ADAPTER_RESET_QUEUE);

    private QueueNames() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
