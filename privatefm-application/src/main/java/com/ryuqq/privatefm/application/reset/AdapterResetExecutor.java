package com.ryuqq.privatefm.application.reset;

import com.ryuqq.privatefm.application.audit.AuditActions;
import com.ryuqq.privatefm.application.audit.SafeAuditor;
import com.ryuqq.privatefm.application.checkpoint.CheckpointManager;
import com.ryuqq.privatefm.application.context.OrchestratorContext;
import com.ryuqq.privatefm.application.event.EventLogService;
import com.ryuqq.privatefm.application.event.LearningUpdateApplier;
import com.ryuqq.privatefm.application.metrics.OrchestratorMetrics;
import com.ryuqq.privatefm.application.support.NamespaceLookup;
import com.ryuqq.privatefm.core.exception.ConflictException;
import com.ryuqq.privatefm.core.exception.NamespaceNotFoundException;
import com.ryuqq.privatefm.core.exception.OperationNotFoundException;
import com.ryuqq.privatefm.core.exception.TransientException;
import com.ryuqq.privatefm.core.exception.ValidationException;
import com.ryuqq.privatefm.core.model.AdapterResetRequest;
import com.ryuqq.privatefm.core.model.ApprovalDecision;
import com.ryuqq.privatefm.core.model.ApprovalRequest;
import com.ryuqq.privatefm.core.model.EventActor;
import com.ryuqq.privatefm.core.model.EventLogEntry;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.model.NamespaceEventTypes;
import com.ryuqq.privatefm.core.model.OperationId;
import com.ryuqq.privatefm.core.outcome.Fail;
import com.ryuqq.privatefm.core.outcome.Ok;
import com.ryuqq.privatefm.core.outcome.Outcome;
import com.ryuqq.privatefm.core.spi.AdapterResetRepository;
import com.ryuqq.privatefm.core.spi.ApprovalService;
import com.ryuqq.privatefm.core.spi.NamespaceRepository;
import com.ryuqq.privatefm.core.spi.QueueNames;
import com.ryuqq.privatefm.core.spi.WorkQueue;
import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;
import com.ryuqq.privatefm.core.statemachine.ResetStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 과목 Adapter Reset 요청/승인/실행.
 *
 * <p><strong>실행 흐름 ({@link #executeReset(OperationId)}):</strong></p>
 * <pre>
 * 20  Deleting existing adapter
 * 40  Re-cloning base foundation model
 * 60  Retrieving event log
 * 60→95 Replaying learner events (이벤트마다 eventsReplayed 갱신)
 * 95  Finalizing (CORRUPTED Namespace는 ACTIVE로 복구)
 * 100 Completed
 * </pre>
 *
 * <p>재생 도중 실패하면 이미 재생한 이벤트는 되돌리지 않으며,
 * 부분 진행 상황은 {@code eventsReplayed}로 확인할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AdapterResetExecutor {

    private static final Logger log = LoggerFactory.getLogger(AdapterResetExecutor.class);

    private final NamespaceRepository namespaces;
    private final AdapterResetRepository requests;
    private final WorkQueue workQueue;
    private final ApprovalService approvalService;
    private final SafeAuditor auditor;
    private final ResetApprovalPolicy approvalPolicy;
    private final EventLogService eventLogService;
    private final CheckpointManager checkpointManager;
    private final LearningUpdateApplier applier;
    private final OrchestratorMetrics metrics;
    private final Clock clock;

    public AdapterResetExecutor(
        OrchestratorContext context,
        EventLogService eventLogService,
        CheckpointManager checkpointManager,
        LearningUpdateApplier applier
    ) {
        if (eventLogService == null || checkpointManager == null || applier == null) {
            throw new IllegalArgumentException("eventLogService, checkpointManager and applier cannot be null");
        }
        this.namespaces = context.namespaces();
        this.requests = context.resetRequests();
        this.workQueue = context.workQueue();
        this.approvalService = context.approvalService();
        this.auditor = new SafeAuditor(context.auditSink());
        this.approvalPolicy = new ResetApprovalPolicy(context.permissionChecker());
        this.eventLogService = eventLogService;
        this.checkpointManager = checkpointManager;
        this.applier = applier;
        this.metrics = context.metrics();
        this.clock = context.clock();
    }

    /**
     * Reset 요청 생성.
     *
     * @param learnerId 학습자 ID
     * @param subject 과목
     * @param reason 사유
     * @param requestedBy 요청자 ID
     * @param requesterRole 요청자 역할 (guardian, teacher, ...)
     * @return 생성된 요청 (APPROVED 또는 PENDING_APPROVAL)
     * @throws NamespaceNotFoundException Namespace가 없는 경우
     * @throws ValidationException 과목이 Namespace에 없거나 요청자 정보가 비어 있는 경우
     * @throws ConflictException 같은 과목에 진행 중인 요청이 있는 경우
     * @throws TransientException 승인 요청 생성에 실패한 경우
     */
    public AdapterResetRequest requestReset(
        String learnerId,
        String subject,
        String reason,
        String requestedBy,
        String requesterRole
    ) {
        if (requestedBy == null || requestedBy.isBlank()) {
            throw new ValidationException("requestedBy cannot be null or blank");
        }
        if (requesterRole == null || requesterRole.isBlank()) {
            throw new ValidationException("requesterRole cannot be null or blank");
        }
        Namespace namespace = findNamespace(learnerId);
        if (!namespace.hasSubject(subject)) {
            throw new ValidationException("Subject '" + subject + "' not found in learner's subjects");
        }

        boolean requiresApproval = approvalPolicy.requiresApproval(requesterRole, requestedBy, namespace.learnerId());
        AdapterResetRequest request = AdapterResetRequest.create(namespace.learnerId(), namespace.id(), subject,
            requestedBy, requesterRole, reason, !requiresApproval, clock.instant());

        if (!requests.insertIfNoActive(request)) {
            throw new ConflictException("A reset request is already pending or in progress for this subject");
        }

        if (requiresApproval) {
            request = attachApprovalRequest(request);
        } else {
            workQueue.push(QueueNames.ADAPTER_RESET_QUEUE, request.requestId().getValue());
        }

        audit(request, AuditActions.ADAPTER_RESET_REQUESTED, requestedBy);
        log.info("Adapter reset requested: learner={}, subject={}, request={}, role={}, approvalRequired={}",
            learnerId, subject, request.requestId().getValue(), requesterRole, requiresApproval);
        return request;
    }

    private AdapterResetRequest attachApprovalRequest(AdapterResetRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("subject", request.subject());
        details.put("reset_request_id", request.requestId().getValue());

        String approvalId;
        try {
            approvalId = approvalService.createApprovalRequest(new ApprovalRequest(
                ApprovalRequest.TYPE_ADAPTER_RESET,
                request.learnerId(),
                request.requestedBy(),
                request.requesterRole(),
                request.reason(),
                details
            ));
        } catch (RuntimeException e) {
            requests.transition(request.requestId(), EnumSet.of(ResetStatus.PENDING_APPROVAL),
                r -> r.fail("Failed to create approval request: " + e.getMessage(), clock.instant()));
            throw new TransientException("Failed to create approval request", e);
        }

        AdapterResetRequest withApproval = request.withApprovalRequestId(approvalId);
        requests.save(withApproval);
        return withApproval;
    }

    /**
     * 승인 서비스 콜백 처리.
     *
     * @param decision 승인 결정
     * @return PROCESSED 또는 IGNORED
     */
    public ApprovalCallbackResult handleApprovalDecision(ApprovalDecision decision) {
        Optional<AdapterResetRequest> found = requests.findByApprovalId(decision.approvalRequestId());
        if (found.isEmpty()) {
            log.warn("Reset request not found for approval: approvalId={}", decision.approvalRequestId());
            return ApprovalCallbackResult.IGNORED;
        }
        OperationId requestId = found.get().requestId();

        if (decision.decision() == ApprovalDecision.Decision.APPROVED) {
            Optional<AdapterResetRequest> approved = requests.transition(requestId,
                EnumSet.of(ResetStatus.PENDING_APPROVAL), r -> r.approve(decision.decidedBy(), clock.instant()));
            if (approved.isEmpty()) {
                return ignored(found.get());
            }
            workQueue.push(QueueNames.ADAPTER_RESET_QUEUE, requestId.getValue());
            audit(approved.get(), AuditActions.ADAPTER_RESET_APPROVED, decision.decidedBy());
            log.info("Adapter reset approved and queued: request={}, approvedBy={}",
                requestId.getValue(), decision.decidedBy());
            return ApprovalCallbackResult.PROCESSED;
        }

        Optional<AdapterResetRequest> rejected = requests.transition(requestId,
            EnumSet.of(ResetStatus.PENDING_APPROVAL),
            r -> r.reject(decision.decidedBy(), decision.reason(), clock.instant()));
        if (rejected.isEmpty()) {
            return ignored(found.get());
        }
        audit(rejected.get(), AuditActions.ADAPTER_RESET_REJECTED, decision.decidedBy());
        log.info("Adapter reset rejected: request={}, rejectedBy={}, reason={}",
            requestId.getValue(), decision.decidedBy(), decision.reason());
        return ApprovalCallbackResult.PROCESSED;
    }

    private ApprovalCallbackResult ignored(AdapterResetRequest request) {
        log.info("Approval decision ignored, request already decided: request={}, status={}",
            request.requestId().getValue(), request.status());
        return ApprovalCallbackResult.IGNORED;
    }

    /**
     * Reset 실행.
     *
     * @param requestId 요청 ID
     * @return 실행 결과 (종료된 요청이면 저장된 결과)
     */
    public Outcome executeReset(OperationId requestId) {
        Optional<AdapterResetRequest> found = requests.find(requestId);
        if (found.isEmpty()) {
            log.error("Reset request not found during execution: {}", requestId.getValue());
            return Fail.of("OPERATION_NOT_FOUND", "Reset request not found: " + requestId.getValue());
        }
        if (found.get().status().isTerminal()) {
            return storedOutcome(found.get());
        }

        Optional<AdapterResetRequest> started = requests.transition(requestId,
            EnumSet.of(ResetStatus.APPROVED, ResetStatus.EXECUTING), r -> r.startExecuting(clock.instant()));
        if (started.isEmpty()) {
            AdapterResetRequest current = requests.find(requestId).orElse(found.get());
            if (current.status() == ResetStatus.PENDING_APPROVAL) {
                return Fail.of("NOT_APPROVED", "Reset request is awaiting approval");
            }
            return storedOutcome(current);
        }

        AdapterResetRequest request = started.get();
        try {
            return reset(request);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Adapter reset execution failed: request={}", requestId.getValue(), e);
            requests.transition(requestId, EnumSet.of(ResetStatus.EXECUTING, ResetStatus.APPROVED),
                r -> r.fail(message, clock.instant()));
            metrics.recordReset(ResetStatus.FAILED.name(), elapsedSince(request.startedAt()));
            return Fail.of("RESET_FAILED", message, e.getClass().getName());
        }
    }

    private Outcome reset(AdapterResetRequest started) {
        Namespace namespace = namespaces.findById(started.namespaceId())
            .orElseThrow(() -> NamespaceNotFoundException.forLearner(started.learnerId().getValue()));
        String subject = started.subject();

        AdapterResetRequest request = advance(started, ResetStage.DELETING_ADAPTER);
        checkpointManager.deleteSubjectAdapter(namespace, subject);

        request = advance(request, ResetStage.RECLONING_BASE_MODEL);
        checkpointManager.cloneBaseModel(namespace, subject, namespace.baseFmVersion());

        request = advance(request, ResetStage.RETRIEVING_EVENTS);
        List<EventLogEntry> events = eventLogService.replayableEvents(namespace.id(), subject);

        request = advance(request, ResetStage.REPLAYING_EVENTS);
        long replayed = 0;
        for (EventLogEntry event : events) {
            applier.apply(namespace, subject, event);
            replayed++;
            request = request.withEventsReplayed(replayed, ResetStage.replayPercent(replayed, events.size()));
            requests.save(request);
        }

        request = advance(request, ResetStage.FINALIZING);
        namespaces.transition(namespace.id(), EnumSet.of(NamespaceStatus.CORRUPTED),
            ns -> ns.transitionTo(NamespaceStatus.ACTIVE, clock.instant()))
            .ifPresent(ns -> log.info("Corrupted namespace restored by adapter reset: learner={}",
                ns.learnerId().getValue()));

        AdapterResetRequest completed = request.complete(clock.instant());
        requests.save(completed);
        metrics.recordReset(ResetStatus.COMPLETED.name(), elapsedSince(completed.startedAt()));

        Map<String, Object> eventData = new LinkedHashMap<>();
        eventData.put("reset_request_id", completed.requestId().getValue());
        eventData.put("subject", subject);
        eventData.put("events_replayed", replayed);
        eventLogService.logEvent(namespace.id(), namespace.learnerId(), NamespaceEventTypes.ADAPTER_RESET_COMPLETED,
            eventData, subject, null, null, EventActor.SYSTEM);
        audit(completed, AuditActions.ADAPTER_RESET_COMPLETED, completed.requestedBy());

        log.info("Adapter reset completed: request={}, learner={}, subject={}, eventsReplayed={}",
            completed.requestId().getValue(), completed.learnerId().getValue(), subject, replayed);
        return new Ok(completed.requestId(), "Adapter reset completed: " + replayed + " events replayed");
    }

    private Duration elapsedSince(Instant startedAt) {
        return startedAt == null ? Duration.ZERO : Duration.between(startedAt, clock.instant());
    }

    private AdapterResetRequest advance(AdapterResetRequest request, ResetStage stage) {
        AdapterResetRequest updated = request.progress(stage.progressPercent(), stage.displayName());
        requests.save(updated);
        return updated;
    }

    /**
     * 요청 상태 조회.
     *
     * @throws OperationNotFoundException 요청이 없는 경우
     */
    public AdapterResetRequest getStatus(OperationId requestId) {
        return requests.find(requestId)
            .orElseThrow(() -> new OperationNotFoundException("Reset request not found: " + requestId.getValue()));
    }

    private void audit(AdapterResetRequest request, String action, String actor) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("learner_id", request.learnerId().getValue());
        details.put("subject", request.subject());
        details.put("actor_role", request.requesterRole());
        details.put("status", request.status().name());
        if (request.reason() != null) {
            details.put("reason", request.reason());
        }
        auditor.record(action, AuditActions.RESOURCE_ADAPTER_RESET, request.requestId().getValue(), actor, details);
    }

    private Namespace findNamespace(String learnerId) {
        return NamespaceLookup.require(namespaces, learnerId);
    }

    private Outcome storedOutcome(AdapterResetRequest request) {
        switch (request.status()) {
            case COMPLETED:
                return new Ok(request.requestId(), "Adapter reset completed");
            case REJECTED:
                return Fail.of("REJECTED", "Reset request was rejected");
            default:
                String message = request.errorMessage() != null ? request.errorMessage() : "Adapter reset failed";
                return Fail.of("RESET_FAILED", message);
        }
    }
}
