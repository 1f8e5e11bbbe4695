package com.ryuqq.privatefm.application.stats;

import com.ryuqq.privatefm.core.model.LearnerId;
import com.ryuqq.privatefm.core.model.NamespaceId;
import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;
import com.ryuqq.privatefm.core.statemachine.OperationStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Namespace 단위 통계.
 *
 * @param mergeOperations 상태별 Merge 작업 수
 * @param events 유형별 이벤트 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record NamespaceStatistics(
    NamespaceId namespaceId,
    LearnerId learnerId,
    NamespaceStatus status,
    int versionCount,
    double uptimeHours,
    Map<OperationStatus, Long> mergeOperations,
    Map<String, Long> events,
    Instant lastMergeAt,
    Instant createdAt,
    Instant updatedAt
) {

    public NamespaceStatistics {
        mergeOperations = Map.copyOf(mergeOperations);
        events = Map.copyOf(events);
    }
}
