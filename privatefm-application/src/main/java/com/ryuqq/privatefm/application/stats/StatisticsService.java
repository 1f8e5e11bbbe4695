package com.ryuqq.privatefm.application.stats;

import com.ryuqq.privatefm.application.context.OrchestratorContext;
import com.ryuqq.privatefm.application.support.NamespaceLookup;
import com.ryuqq.privatefm.core.model.MergeOperation;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.spi.EventLogRepository;
import com.ryuqq.privatefm.core.spi.MergeOperationRepository;
import com.ryuqq.privatefm.core.spi.NamespaceRepository;
import com.ryuqq.privatefm.core.spi.QueueNames;
import com.ryuqq.privatefm.core.spi.WorkQueue;
import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;
import com.ryuqq.privatefm.core.statemachine.OperationStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Namespace/전체 통계 집계.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StatisticsService {

    private static final Duration RECENT_WINDOW = Duration.ofHours(24);

    private final NamespaceRepository namespaces;
    private final MergeOperationRepository mergeOperations;
    private final EventLogRepository eventLog;
    private final WorkQueue workQueue;
    private final Clock clock;

    public StatisticsService(OrchestratorContext context) {
        this.namespaces = context.namespaces();
        this.mergeOperations = context.mergeOperations();
        this.eventLog = context.eventLog();
        this.workQueue = context.workQueue();
        this.clock = context.clock();
    }

    public NamespaceStatistics namespaceStatistics(String learnerId) {
        Namespace namespace = NamespaceLookup.require(namespaces, learnerId);
        Instant now = clock.instant();

        List<MergeOperation> operations = mergeOperations.findByNamespace(namespace.id(), Integer.MAX_VALUE);
        double uptimeHours = Duration.between(namespace.createdAt(), now).toSeconds() / 3600.0;

        return new NamespaceStatistics(
            namespace.id(),
            namespace.learnerId(),
            namespace.status(),
            namespace.versionCount(),
            Math.round(uptimeHours * 100) / 100.0,
            countBy(operations, MergeOperation::status, OperationStatus.class),
            eventLog.countByType(namespace.id()),
            namespace.lastMergeAt(),
            namespace.createdAt(),
            namespace.updatedAt()
        );
    }

    public GlobalStatistics globalStatistics() {
        Instant now = clock.instant();
        Instant recentCutoff = now.minus(RECENT_WINDOW);

        List<Namespace> allNamespaces = namespaces.findByStatuses(EnumSet.noneOf(NamespaceStatus.class));
        List<MergeOperation> allOperations = mergeOperations.findAll();

        long recentNamespaces = allNamespaces.stream()
            .filter(ns -> !ns.createdAt().isBefore(recentCutoff))
            .count();
        long recentMerges = allOperations.stream()
            .filter(op -> !op.scheduledAt().isBefore(recentCutoff))
            .count();

        Map<String, Integer> queueLengths = new LinkedHashMap<>();
        for (String queue : QueueNames.ALL) {
            queueLengths.put(queue, workQueue.length(queue));
        }

        return new GlobalStatistics(
            allNamespaces.size(),
            countBy(allNamespaces, Namespace::status, NamespaceStatus.class),
            allOperations.size(),
            countBy(allOperations, MergeOperation::status, OperationStatus.class),
            recentNamespaces,
            recentMerges,
            queueLengths,
            now
        );
    }

    private static <T, E extends Enum<E>> Map<E, Long> countBy(List<T> items, Function<T, E> key, Class<E> type) {
        return items.stream()
            .collect(Collectors.groupingBy(key, () -> new EnumMap<>(type), Collectors.counting()));
    }
}
