package com.ryuqq.privatefm.application.orchestrator;

import com.ryuqq.privatefm.application.reset.ApprovalCallbackResult;
import com.ryuqq.privatefm.application.stats.GlobalStatistics;
import com.ryuqq.privatefm.application.stats.NamespaceStatistics;
import com.ryuqq.privatefm.core.model.AdapterResetRequest;
import com.ryuqq.privatefm.core.model.ApprovalDecision;
import com.ryuqq.privatefm.core.model.EventLogEntry;
import com.ryuqq.privatefm.core.model.FallbackOperation;
import com.ryuqq.privatefm.core.model.FallbackReason;
import com.ryuqq.privatefm.core.model.MergeOperation;
import com.ryuqq.privatefm.core.model.MergeOperationType;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.model.NamespaceHealth;
import com.ryuqq.privatefm.core.model.OperationId;
import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Namespace 관리 API.
 *
 * <p>HTTP 계층 같은 외부 진입점이 호출하는 단일 진입점입니다. 비동기 작업(Merge, Fallback, Reset)은
 * 작업을 생성하고 큐에 게시한 뒤 즉시 반환하며, 실행은 runner 모듈의 워커가 담당합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Namespace ns = orchestrator.createNamespace("learner-1", List.of("math"), "fm-v1.0", null, null);
 * MergeOperation op = orchestrator.triggerMerge("learner-1", MergeOperationType.MANUAL, null, false);
 *
 * // 워커 실행 후
 * orchestrator.getMergeOperation(op.operationId()).map(MergeOperation::status);  // COMPLETED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface NamespaceOrchestrator {

    // ===== Namespace =====

    Namespace createNamespace(
        String learnerId,
        Collection<String> subjects,
        String baseFmVersion,
        Map<String, Object> isolationConfig,
        Map<String, Object> mergeConfig
    );

    Optional<Namespace> getNamespace(String learnerId);

    List<Namespace> listNamespaces(NamespaceStatus statusFilter, int offset, int limit);

    /**
     * Guardian 키로 인가된 soft delete.
     */
    Namespace deleteNamespace(String learnerId, String guardianKey);

    // ===== Merge =====

    MergeOperation triggerMerge(String learnerId, MergeOperationType operationType, String targetFmVersion, boolean force);

    MergeOperation cancelMerge(OperationId operationId);

    Optional<MergeOperation> getMergeOperation(OperationId operationId);

    List<MergeOperation> listMergeOperations(String learnerId, int limit);

    // ===== Health / Fallback =====

    NamespaceHealth getHealth(String learnerId);

    FallbackOperation initiateFallback(String learnerId, FallbackReason reason, String targetFmVersion);

    // ===== Events =====

    /**
     * API 주체의 학습 이벤트 기록 (재생 대상).
     */
    EventLogEntry recordLearningEvent(
        String learnerId,
        String eventType,
        String subject,
        Map<String, Object> eventData,
        String correlationId
    );

    List<EventLogEntry> listEvents(String learnerId, String eventType, int limit);

    // ===== Adapter Reset =====

    AdapterResetRequest requestReset(String learnerId, String subject, String reason, String requestedBy, String requesterRole);

    ApprovalCallbackResult handleApprovalDecision(ApprovalDecision decision);

    AdapterResetRequest getResetStatus(OperationId requestId);

    // ===== Statistics =====

    NamespaceStatistics getNamespaceStatistics(String learnerId);

    GlobalStatistics getGlobalStatistics();
}
