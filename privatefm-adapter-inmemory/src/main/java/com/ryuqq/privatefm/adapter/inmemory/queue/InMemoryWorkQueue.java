package com.ryuqq.privatefm.adapter.inmemory.queue;

import com.ryuqq.privatefm.core.spi.WorkQueue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-memory implementation of {@link WorkQueue} SPI.
 *
 * <p>One unbounded FIFO {@link LinkedBlockingQueue} per queue name, created on first use.
 * An item popped by one consumer is not visible to others; there is no acknowledgement
 * or redelivery.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryWorkQueue implements WorkQueue {

    private final ConcurrentHashMap<String, LinkedBlockingQueue<String>> queues = new ConcurrentHashMap<>();

    @Override
    public void push(String queue, String item) {
        if (item == null || item.isBlank()) {
            throw new IllegalArgumentException("item cannot be null or blank");
        }
        queueFor(queue).add(item);
    }

    @Override
    public Optional<String> blockingPop(String queue, Duration timeout) throws InterruptedException {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative (current: " + timeout + ")");
        }
        return Optional.ofNullable(queueFor(queue).poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public int length(String queue) {
        LinkedBlockingQueue<String> q = queues.get(queue);
        return q == null ? 0 : q.size();
    }

    /**
     * Items currently waiting in {@code queue}, head first.
     */
    public List<String> snapshot(String queue) {
        LinkedBlockingQueue<String> q = queues.get(queue);
        return q == null ? List.of() : new ArrayList<>(q);
    }

    /**
     * Removes and returns every item waiting in {@code queue}, head first.
     */
    public List<String> drain(String queue) {
        List<String> drained = new ArrayList<>();
        LinkedBlockingQueue<String> q = queues.get(queue);
        if (q != null) {
            q.drainTo(drained);
        }
        return drained;
    }

    private LinkedBlockingQueue<String> queueFor(String queue) {
        if (queue == null || queue.isBlank()) {
            throw new IllegalArgumentException("queue cannot be null or blank");
        }
        return queues.computeIfAbsent(queue, name -> new LinkedBlockingQueue<>());
    }
}
