package com.ryuqq.privatefm.core.spi;

import com.ryuqq.privatefm.core.model.EventLogEntry;
import com.ryuqq.privatefm.core.model.NamespaceId;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Append-only event log SPI.
 *
 * <p><strong>Sequence contract:</strong> {@link #append(EventLogEntry)} assigns the next
 * sequence number of the namespace atomically. Per namespace, sequence numbers start at 1
 * and have no gaps or duplicates regardless of concurrent appenders.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventLogRepository {

    /**
     * Appends a draft entry and assigns its sequence number.
     *
     * @param draft entry with sequence number 0
     * @return the stored entry with its assigned sequence number
     */
    EventLogEntry append(EventLogEntry draft);

    /**
     * @param namespaceId the namespace
     * @param eventType optional type filter, null for all
     * @param limit maximum number of results
     * @return entries, newest first
     */
    List<EventLogEntry> findByNamespace(NamespaceId namespaceId, String eventType, int limit);

    /**
     * @param namespaceId the namespace
     * @param subject optional subject filter, null for all
     * @return entries in ascending sequence order
     */
    List<EventLogEntry> findForReplay(NamespaceId namespaceId, String subject);

    long count(NamespaceId namespaceId);

    /**
     * @param namespaceId the namespace
     * @return entry count per event type
     */
    Map<String, Long> countByType(NamespaceId namespaceId);

    /**
     * Deletes entries created before {@code cutoff}. Sequence numbers of retained entries are unchanged.
     *
     * @param cutoff retention cutoff
     * @return number of deleted entries
     */
    int deleteOlderThan(Instant cutoff);
}
