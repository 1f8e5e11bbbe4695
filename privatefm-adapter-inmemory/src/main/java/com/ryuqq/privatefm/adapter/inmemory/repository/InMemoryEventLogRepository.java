package com.ryuqq.privatefm.adapter.inmemory.repository;

import com.ryuqq.privatefm.core.model.EventLogEntry;
import com.ryuqq.privatefm.core.model.NamespaceId;
import com.ryuqq.privatefm.core.spi.EventLogRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link EventLogRepository} SPI.
 *
 * <p><strong>Sequence assignment:</strong> each namespace owns a {@link NamespaceLog} whose
 * monitor guards both its counter and its entries. {@link #append(EventLogEntry)} increments
 * the counter and appends in one critical section, so sequence numbers are gapless and
 * unique per namespace. Appends to different namespaces do not contend.</p>
 *
 * <p>Entries are kept in ascending sequence order; retention cleanup removes entries
 * without renumbering the rest.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryEventLogRepository implements EventLogRepository {

    private final ConcurrentHashMap<NamespaceId, NamespaceLog> logs = new ConcurrentHashMap<>();

    @Override
    public EventLogEntry append(EventLogEntry draft) {
        if (draft == null) {
            throw new IllegalArgumentException("draft cannot be null");
        }
        if (draft.sequenceNumber() != 0) {
            throw new IllegalArgumentException("draft must not carry a sequence number (current: "
                + draft.sequenceNumber() + ")");
        }
        NamespaceLog log = logs.computeIfAbsent(draft.namespaceId(), id -> new NamespaceLog());
        synchronized (log) {
            EventLogEntry stored = draft.withSequenceNumber(++log.lastSequence);
            log.entries.add(stored);
            return stored;
        }
    }

    @Override
    public List<EventLogEntry> findByNamespace(NamespaceId namespaceId, String eventType, int limit) {
        List<EventLogEntry> result = new ArrayList<>();
        for (EventLogEntry entry : snapshot(namespaceId)) {
            if (eventType == null || eventType.equals(entry.eventType())) {
                result.add(entry);
            }
        }
        List<EventLogEntry> newestFirst = new ArrayList<>(result.size());
        for (int i = result.size() - 1; i >= 0 && newestFirst.size() < limit; i--) {
            newestFirst.add(result.get(i));
        }
        return newestFirst;
    }

    @Override
    public List<EventLogEntry> findForReplay(NamespaceId namespaceId, String subject) {
        List<EventLogEntry> result = new ArrayList<>();
        for (EventLogEntry entry : snapshot(namespaceId)) {
            if (subject == null || subject.equals(entry.subject())) {
                result.add(entry);
            }
        }
        return result;
    }

    @Override
    public long count(NamespaceId namespaceId) {
        return snapshot(namespaceId).size();
    }

    @Override
    public Map<String, Long> countByType(NamespaceId namespaceId) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (EventLogEntry entry : snapshot(namespaceId)) {
            counts.merge(entry.eventType(), 1L, Long::sum);
        }
        return counts;
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        int deleted = 0;
        for (NamespaceLog log : logs.values()) {
            synchronized (log) {
                int before = log.entries.size();
                log.entries.removeIf(entry -> entry.createdAt().isBefore(cutoff));
                deleted += before - log.entries.size();
            }
        }
        return deleted;
    }

    private List<EventLogEntry> snapshot(NamespaceId namespaceId) {
        NamespaceLog log = logs.get(namespaceId);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            return new ArrayList<>(log.entries);
        }
    }

    private static final class NamespaceLog {
        private long lastSequence;
        private final List<EventLogEntry> entries = new ArrayList<>();
    }
}
