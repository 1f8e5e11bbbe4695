package com.ryuqq.privatefm.adapter.inmemory.external;

import com.ryuqq.privatefm.core.exception.FatalException;
import com.ryuqq.privatefm.core.exception.TransientException;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.spi.AdapterMerger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simulated {@link AdapterMerger}.
 *
 * <p>Reports {@code adapters_merged = subjects × 10} and a fixed
 * {@code parameters_updated}. Failures can be scripted per call with
 * {@link #failNextWith(RuntimeException)}, e.g. a {@link TransientException}
 * to exercise retries or a {@link FatalException} to simulate corruption.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SimulatedAdapterMerger implements AdapterMerger {

    public static final int ADAPTERS_PER_SUBJECT = 10;
    public static final long PARAMETERS_UPDATED = 1_250_000L;

    private final Deque<RuntimeException> scriptedFailures = new ArrayDeque<>();
    private int invocations;

    @Override
    public synchronized Map<String, Object> merge(Namespace namespace, String fmVersion) {
        invocations++;
        RuntimeException failure = scriptedFailures.poll();
        if (failure != null) {
            throw failure;
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("adapters_merged", namespace.subjects().size() * ADAPTERS_PER_SUBJECT);
        stats.put("parameters_updated", PARAMETERS_UPDATED);
        stats.put("fm_version", fmVersion);
        return stats;
    }

    public synchronized void failNextWith(RuntimeException failure) {
        scriptedFailures.add(failure);
    }

    public synchronized int invocations() {
        return invocations;
    }
}
