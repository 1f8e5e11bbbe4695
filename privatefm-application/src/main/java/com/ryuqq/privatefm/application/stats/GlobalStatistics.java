package com.ryuqq.privatefm.application.stats;

import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;
import com.ryuqq.privatefm.core.statemachine.OperationStatus;

import java.time.Instant;
import java.util.Map;

/**
 * 전체 통계.
 *
 * @param recentNamespaces 최근 24시간 내 생성된 Namespace 수
 * @param recentMergeOperations 최근 24시간 내 예약된 Merge 작업 수
 * @param queueLengths 큐별 대기 항목 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GlobalStatistics(
    long totalNamespaces,
    Map<NamespaceStatus, Long> namespaceStatusDistribution,
    long totalMergeOperations,
    Map<OperationStatus, Long> mergeStatusDistribution,
    long recentNamespaces,
    long recentMergeOperations,
    Map<String, Integer> queueLengths,
    Instant timestamp
) {

    public GlobalStatistics {
        namespaceStatusDistribution = Map.copyOf(namespaceStatusDistribution);
        mergeStatusDistribution = Map.copyOf(mergeStatusDistribution);
        queueLengths = Map.copyOf(queueLengths);
    }
}
