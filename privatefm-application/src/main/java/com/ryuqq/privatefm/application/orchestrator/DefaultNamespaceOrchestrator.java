package com.ryuqq.privatefm.application.orchestrator;

import com.ryuqq.privatefm.application.context.OrchestratorServices;
import com.ryuqq.privatefm.application.reset.ApprovalCallbackResult;
import com.ryuqq.privatefm.application.stats.GlobalStatistics;
import com.ryuqq.privatefm.application.stats.NamespaceStatistics;
import com.ryuqq.privatefm.application.support.NamespaceLookup;
import com.ryuqq.privatefm.core.exception.ValidationException;
import com.ryuqq.privatefm.core.model.AdapterResetRequest;
import com.ryuqq.privatefm.core.model.ApprovalDecision;
import com.ryuqq.privatefm.core.model.EventActor;
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
 * {@link NamespaceOrchestrator} 기본 구현.
 *
 * <p>각 요청을 담당 서비스에 위임합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DefaultNamespaceOrchestrator implements NamespaceOrchestrator {

    private final OrchestratorServices services;

    public DefaultNamespaceOrchestrator(OrchestratorServices services) {
        if (services == null) {
            throw new IllegalArgumentException("services cannot be null");
        }
        this.services = services;
    }

    @Override
    public Namespace createNamespace(
        String learnerId,
        Collection<String> subjects,
        String baseFmVersion,
        Map<String, Object> isolationConfig,
        Map<String, Object> mergeConfig
    ) {
        return services.namespaceRegistry().create(learnerId, subjects, baseFmVersion, isolationConfig, mergeConfig);
    }

    @Override
    public Optional<Namespace> getNamespace(String learnerId) {
        return services.namespaceRegistry().get(learnerId);
    }

    @Override
    public List<Namespace> listNamespaces(NamespaceStatus statusFilter, int offset, int limit) {
        return services.namespaceRegistry().list(statusFilter, offset, limit);
    }

    @Override
    public Namespace deleteNamespace(String learnerId, String guardianKey) {
        return services.namespaceRegistry().delete(learnerId, guardianKey);
    }

    @Override
    public MergeOperation triggerMerge(String learnerId, MergeOperationType operationType, String targetFmVersion, boolean force) {
        return services.mergeCoordinator().triggerMerge(learnerId, operationType, targetFmVersion, force);
    }

    @Override
    public MergeOperation cancelMerge(OperationId operationId) {
        return services.mergeCoordinator().cancel(operationId);
    }

    @Override
    public Optional<MergeOperation> getMergeOperation(OperationId operationId) {
        return services.mergeCoordinator().getOperation(operationId);
    }

    @Override
    public List<MergeOperation> listMergeOperations(String learnerId, int limit) {
        return services.mergeCoordinator().listOperations(learnerId, limit);
    }

    @Override
    public NamespaceHealth getHealth(String learnerId) {
        return services.healthEvaluator().checkHealth(learnerId);
    }

    @Override
    public FallbackOperation initiateFallback(String learnerId, FallbackReason reason, String targetFmVersion) {
        return services.fallbackManager().initiateFallback(learnerId, reason, targetFmVersion);
    }

    @Override
    public EventLogEntry recordLearningEvent(
        String learnerId,
        String eventType,
        String subject,
        Map<String, Object> eventData,
        String correlationId
    ) {
        if (eventType == null || eventType.isBlank()) {
            throw new ValidationException("eventType cannot be null or blank");
        }
        Namespace namespace = NamespaceLookup.require(services.context().namespaces(), learnerId);
        if (namespace.status() == NamespaceStatus.DELETED) {
            throw new ValidationException("Cannot record events for a deleted namespace (learner: " + learnerId + ")");
        }
        if (subject != null && !namespace.hasSubject(subject)) {
            throw new ValidationException("Subject '" + subject + "' not found in learner's subjects");
        }
        return services.eventLogService().logEvent(namespace.id(), namespace.learnerId(), eventType, eventData,
            subject, namespace.currentCheckpointHash(), correlationId, EventActor.API);
    }

    @Override
    public List<EventLogEntry> listEvents(String learnerId, String eventType, int limit) {
        return services.eventLogService().listEvents(NamespaceLookup.parseLearnerId(learnerId), eventType, limit);
    }

    @Override
    public AdapterResetRequest requestReset(String learnerId, String subject, String reason, String requestedBy, String requesterRole) {
        return services.adapterResetExecutor().requestReset(learnerId, subject, reason, requestedBy, requesterRole);
    }

    @Override
    public ApprovalCallbackResult handleApprovalDecision(ApprovalDecision decision) {
        return services.adapterResetExecutor().handleApprovalDecision(decision);
    }

    @Override
    public AdapterResetRequest getResetStatus(OperationId requestId) {
        return services.adapterResetExecutor().getStatus(requestId);
    }

    @Override
    public NamespaceStatistics getNamespaceStatistics(String learnerId) {
        return services.statisticsService().namespaceStatistics(learnerId);
    }

    @Override
    public GlobalStatistics getGlobalStatistics() {
        return services.statisticsService().globalStatistics();
    }
}
