package com.ryuqq.privatefm.application.runtime;

/**
 * Queue-driven background worker.
 *
 * <p>Each call to {@link #pump()} processes at most one unit of queued work
 * (a merge, fallback or adapter reset id). Callers invoke it repeatedly from a
 * supervised loop.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump() starts
 *   ↓
 * 1. Pop one id from the work queue (bounded wait)
 * 2. Empty → return false (caller backs off)
 * 3. Execute via the coordinator bound to the queue
 * 4. Log the Outcome (Ok / Fail); per-item exceptions are caught and logged
 * 5. Return true
 * </pre>
 *
 * <p><strong>Processing Guarantees:</strong></p>
 * <ul>
 *   <li>At-least-once: an id may be delivered more than once; coordinators return
 *       the stored outcome for terminal work</li>
 *   <li>Failed items are never re-enqueued by the runtime</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Executes a single pump cycle.
     *
     * @return true if an item was processed, false if the queue was empty
     * @throws InterruptedException if interrupted while waiting on the queue
     */
    boolean pump() throws InterruptedException;
}
