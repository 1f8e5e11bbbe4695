package com.ryuqq.privatefm.core.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * FIFO work queue SPI carrying operation ids.
 *
 * <p>Queues carry only identifiers; the work itself is persisted in the
 * corresponding repository so that redelivery is harmless.</p>
 *
 * <p><strong>Delivery semantics:</strong> at-most-once per pop. A popped item whose
 * handler fails is not re-enqueued.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see QueueNames
 */
public interface WorkQueue {

    /**
     * Appends an item to the tail of a queue.
     *
     * @param queue queue name
     * @param item item (an operation or request id)
     * @throws IllegalArgumentException if queue or item is null or blank
     */
    void push(String queue, String item);

    /**
     * Pops the head of a queue, waiting up to {@code timeout} for an item.
     *
     * @param queue queue name
     * @param timeout maximum wait
     * @return the item, or empty on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    Optional<String> blockingPop(String queue, Duration timeout) throws InterruptedException;

    /**
     * Current queue length.
     *
     * @param queue queue name
     * @return number of pending items
     */
    int length(String queue);
}
