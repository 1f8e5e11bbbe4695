package com.ryuqq.privatefm.application.fallback;

import com.ryuqq.privatefm.application.checkpoint.CheckpointManager;
import com.ryuqq.privatefm.application.context.OrchestratorContext;
import com.ryuqq.privatefm.application.event.EventLogService;
import com.ryuqq.privatefm.application.event.LearningUpdateApplier;
import com.ryuqq.privatefm.application.metrics.OrchestratorMetrics;
import com.ryuqq.privatefm.application.support.NamespaceLookup;
import com.ryuqq.privatefm.core.exception.ConflictException;
import com.ryuqq.privatefm.core.exception.NamespaceNotFoundException;
import com.ryuqq.privatefm.core.exception.ValidationException;
import com.ryuqq.privatefm.core.model.CheckpointInfo;
import com.ryuqq.privatefm.core.model.EventLogEntry;
import com.ryuqq.privatefm.core.model.FallbackOperation;
import com.ryuqq.privatefm.core.model.FallbackReason;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.model.NamespaceEventTypes;
import com.ryuqq.privatefm.core.model.OperationId;
import com.ryuqq.privatefm.core.outcome.Fail;
import com.ryuqq.privatefm.core.outcome.Ok;
import com.ryuqq.privatefm.core.outcome.Outcome;
import com.ryuqq.privatefm.core.spi.FallbackOperationRepository;
import com.ryuqq.privatefm.core.spi.ModelRegistry;
import com.ryuqq.privatefm.core.spi.NamespaceRepository;
import com.ryuqq.privatefm.core.spi.QueueNames;
import com.ryuqq.privatefm.core.spi.WorkQueue;
import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;
import com.ryuqq.privatefm.core.statemachine.OperationStatus;
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
 * Fallback 복구 시작/실행.
 *
 * <p><strong>실행 흐름 ({@link #executeFallback(OperationId)}):</strong></p>
 * <pre>
 * 1. 과목별 Adapter 삭제 후 대상 FM 버전의 기반 모델 복제
 * 2. 이벤트 로그를 순번 순서로 재생 (과목 태그가 있는 이벤트만 해당 과목에 적용)
 * 3. 버전 1 체크포인트 저장
 * 4. versionCount=1, baseFmVersion=대상 버전, Namespace ACTIVE
 * </pre>
 *
 * <p>실패하면 작업 FAILED, Namespace CORRUPTED로 전이하며 자동 재시도하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FallbackManager {

    private static final Logger log = LoggerFactory.getLogger(FallbackManager.class);

    private static final int FALLBACK_CHECKPOINT_VERSION = 1;

    private final NamespaceRepository namespaces;
    private final FallbackOperationRepository operations;
    private final WorkQueue workQueue;
    private final ModelRegistry modelRegistry;
    private final EventLogService eventLogService;
    private final CheckpointManager checkpointManager;
    private final LearningUpdateApplier applier;
    private final OrchestratorMetrics metrics;
    private final Clock clock;

    public FallbackManager(
        OrchestratorContext context,
        EventLogService eventLogService,
        CheckpointManager checkpointManager,
        LearningUpdateApplier applier
    ) {
        if (eventLogService == null || checkpointManager == null || applier == null) {
            throw new IllegalArgumentException("eventLogService, checkpointManager and applier cannot be null");
        }
        this.namespaces = context.namespaces();
        this.operations = context.fallbackOperations();
        this.workQueue = context.workQueue();
        this.modelRegistry = context.modelRegistry();
        this.eventLogService = eventLogService;
        this.checkpointManager = checkpointManager;
        this.applier = applier;
        this.metrics = context.metrics();
        this.clock = context.clock();
    }

    /**
     * Fallback 시작.
     *
     * @param learnerId 학습자 ID
     * @param reason 사유
     * @param targetFmVersion 대상 FM 버전 (null이면 최신 버전)
     * @return PENDING 작업
     * @throws NamespaceNotFoundException Namespace가 없는 경우
     * @throws ConflictException ACTIVE/MERGING/CORRUPTED가 아닌 경우
     */
    public FallbackOperation initiateFallback(String learnerId, FallbackReason reason, String targetFmVersion) {
        if (reason == null) {
            throw new ValidationException("reason cannot be null");
        }
        Namespace namespace = findNamespace(learnerId);

        String target = targetFmVersion != null && !targetFmVersion.isBlank()
            ? targetFmVersion
            : modelRegistry.latestVersion();
        long eventsToReplay = eventLogService.countEvents(namespace.id());

        Namespace started = namespaces.transition(namespace.id(),
                EnumSet.of(NamespaceStatus.ACTIVE, NamespaceStatus.MERGING, NamespaceStatus.CORRUPTED),
                ns -> ns.fallbackStarted(clock.instant()))
            .orElseThrow(() -> new ConflictException(
                "Namespace cannot enter fallback (learner: " + learnerId + ", status: "
                    + currentStatus(namespace) + ")"));

        FallbackOperation operation = FallbackOperation.pending(started.id(), started.learnerId(), reason, target,
            eventsToReplay, clock.instant());
        operations.insert(operation);

        Map<String, Object> eventData = new LinkedHashMap<>();
        eventData.put("fallback_operation_id", operation.operationId().getValue());
        eventData.put("reason", reason.code());
        eventData.put("target_fm_version", target);
        eventData.put("events_to_replay", eventsToReplay);
        eventLogService.logEvent(started, NamespaceEventTypes.FALLBACK_INITIATED, eventData);

        workQueue.push(QueueNames.FALLBACK_QUEUE, operation.operationId().getValue());

        log.info("Fallback initiated: learner={}, op={}, reason={}, target={}, eventsToReplay={}",
            learnerId, operation.operationId().getValue(), reason, target, eventsToReplay);
        return operation;
    }

    /**
     * Fallback 실행.
     *
     * @param operationId 작업 ID
     * @return 실행 결과 (종료된 작업이면 저장된 결과)
     */
    public Outcome executeFallback(OperationId operationId) {
        Optional<FallbackOperation> found = operations.find(operationId);
        if (found.isEmpty()) {
            log.warn("Fallback operation not found: {}", operationId.getValue());
            return Fail.of("OPERATION_NOT_FOUND", "Fallback operation not found: " + operationId.getValue());
        }
        FallbackOperation operation = found.get();
        if (operation.status().isTerminal()) {
            return storedOutcome(operation);
        }

        Optional<FallbackOperation> started = operations.transition(operationId,
            EnumSet.of(OperationStatus.PENDING), op -> op.start(clock.instant()));
        if (started.isEmpty()) {
            return operations.find(operationId).map(this::storedOutcome)
                .orElseGet(() -> Fail.of("OPERATION_NOT_FOUND", "Fallback operation disappeared"));
        }
        FallbackOperation running = started.get();

        Optional<Namespace> current = namespaces.findById(running.namespaceId());
        if (current.isEmpty() || current.get().status() != NamespaceStatus.FALLBACK) {
            String status = current.map(ns -> ns.status().name()).orElse("MISSING");
            return failFallback(running, "Namespace not in FALLBACK state: " + status);
        }

        try {
            return recover(running, current.get());
        } catch (RuntimeException e) {
            log.error("Fallback failed: op={}", operationId.getValue(), e);
            return failFallback(running, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private Outcome recover(FallbackOperation operation, Namespace namespace) {
        String target = operation.targetFmVersion();
        for (String subject : namespace.subjects()) {
            checkpointManager.deleteSubjectAdapter(namespace, subject);
            checkpointManager.cloneBaseModel(namespace, subject, target);
        }

        long replayed = 0;
        List<EventLogEntry> events = eventLogService.replayableEvents(namespace.id(), null);
        for (EventLogEntry event : events) {
            if (namespace.hasSubject(event.subject())) {
                applier.apply(namespace, event.subject(), event);
            }
            replayed++;
        }
        FallbackOperation progress = operation.withEventsReplayed(replayed);
        operations.save(progress);

        String hash = checkpointManager.generateHash(namespace.id(), target, FALLBACK_CHECKPOINT_VERSION);
        CheckpointInfo checkpoint = checkpointManager.store(namespace.id(), hash, target, FALLBACK_CHECKPOINT_VERSION);

        Namespace recovered = namespaces.transition(namespace.id(), EnumSet.of(NamespaceStatus.FALLBACK),
                ns -> ns.fallbackCompleted(target, checkpoint.hash(), clock.instant()))
            .orElse(null);
        if (recovered == null) {
            return failFallback(progress, "Namespace left FALLBACK state before recovery completed");
        }

        operations.save(progress.complete(clock.instant()));
        metrics.recordFallback(OperationStatus.COMPLETED.name(), elapsedSince(operation.startedAt()));

        Map<String, Object> eventData = new LinkedHashMap<>();
        eventData.put("fallback_operation_id", operation.operationId().getValue());
        eventData.put("reason", operation.reason().code());
        eventData.put("target_fm_version", target);
        eventData.put("new_checkpoint_hash", checkpoint.hash());
        eventData.put("recovered_version", recovered.versionCount());
        eventData.put("events_replayed", replayed);
        eventLogService.logEvent(recovered, NamespaceEventTypes.FALLBACK_COMPLETED, eventData, checkpoint.hash());

        log.info("Fallback completed: op={}, namespace={}, target={}, eventsReplayed={}",
            operation.operationId().getValue(), namespace.id().getValue(), target, replayed);
        return new Ok(operation.operationId(), "Fallback completed: " + checkpoint.hash());
    }

    private Outcome failFallback(FallbackOperation operation, String message) {
        operations.save(operation.fail(message, clock.instant()));
        metrics.recordFallback(OperationStatus.FAILED.name(), elapsedSince(operation.startedAt()));
        Optional<Namespace> corrupted = namespaces.transition(operation.namespaceId(),
            EnumSet.of(NamespaceStatus.FALLBACK),
            ns -> ns.transitionTo(NamespaceStatus.CORRUPTED, clock.instant()));

        Optional<Namespace> target = corrupted.isPresent() ? corrupted : namespaces.findById(operation.namespaceId());
        target.ifPresent(ns -> {
            Map<String, Object> eventData = new LinkedHashMap<>();
            eventData.put("fallback_operation_id", operation.operationId().getValue());
            eventData.put("reason", operation.reason().code());
            eventData.put("error", message);
            eventLogService.logEvent(ns, NamespaceEventTypes.FALLBACK_FAILED, eventData);
        });
        log.warn("Fallback failed: op={}, error={}", operation.operationId().getValue(), message);
        return Fail.of("FALLBACK_FAILED", message);
    }

    private Duration elapsedSince(Instant startedAt) {
        return startedAt == null ? Duration.ZERO : Duration.between(startedAt, clock.instant());
    }

    public Optional<FallbackOperation> getOperation(OperationId operationId) {
        return operations.find(operationId);
    }

    public List<FallbackOperation> listOperations(String learnerId) {
        return operations.findByNamespace(findNamespace(learnerId).id());
    }

    private Namespace findNamespace(String learnerId) {
        return NamespaceLookup.require(namespaces, learnerId);
    }

    private String currentStatus(Namespace namespace) {
        return namespaces.findById(namespace.id()).map(ns -> ns.status().name()).orElse("MISSING");
    }

    private Outcome storedOutcome(FallbackOperation operation) {
        if (operation.status() == OperationStatus.COMPLETED) {
            return new Ok(operation.operationId(), "Fallback completed");
        }
        String message = operation.errorMessage() != null ? operation.errorMessage() : "Fallback failed";
        return Fail.of("FALLBACK_FAILED", message);
    }
}
