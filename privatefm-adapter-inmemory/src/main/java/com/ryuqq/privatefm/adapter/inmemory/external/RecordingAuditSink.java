package com.ryuqq.privatefm.adapter.inmemory.external;

import com.ryuqq.privatefm.core.spi.AuditSink;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * {@link AuditSink} that keeps entries in memory.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingAuditSink implements AuditSink {

    private final List<Entry> entries = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    @Override
    public void record(String action, String resourceType, String resourceId, String actor, Map<String, Object> details) {
        if (failing) {
            throw new IllegalStateException("Audit sink unavailable");
        }
        entries.add(new Entry(action, resourceType, resourceId, actor, Map.copyOf(details)));
    }

    public List<Entry> entries() {
        return List.copyOf(entries);
    }

    public List<String> actions() {
        return entries.stream().map(Entry::action).collect(Collectors.toList());
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public record Entry(String action, String resourceType, String resourceId, String actor, Map<String, Object> details) {
    }
}
