package com.ryuqq.privatefm.application.merge;

import com.ryuqq.privatefm.application.checkpoint.CheckpointManager;
import com.ryuqq.privatefm.application.context.OrchestratorContext;
import com.ryuqq.privatefm.application.event.EventLogService;
import com.ryuqq.privatefm.application.metrics.OrchestratorMetrics;
import com.ryuqq.privatefm.application.support.NamespaceLookup;
import com.ryuqq.privatefm.core.exception.ConflictException;
import com.ryuqq.privatefm.core.exception.FatalException;
import com.ryuqq.privatefm.core.exception.NamespaceNotFoundException;
import com.ryuqq.privatefm.core.exception.OperationNotFoundException;
import com.ryuqq.privatefm.core.exception.TransientException;
import com.ryuqq.privatefm.core.exception.ValidationException;
import com.ryuqq.privatefm.core.model.CheckpointInfo;
import com.ryuqq.privatefm.core.model.MergeOperation;
import com.ryuqq.privatefm.core.model.MergeOperationType;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.model.NamespaceEventTypes;
import com.ryuqq.privatefm.core.model.OperationId;
import com.ryuqq.privatefm.core.outcome.Fail;
import com.ryuqq.privatefm.core.outcome.Ok;
import com.ryuqq.privatefm.core.outcome.Outcome;
import com.ryuqq.privatefm.core.retry.BackoffCalculator;
import com.ryuqq.privatefm.core.retry.Sleeper;
import com.ryuqq.privatefm.core.spi.AdapterMerger;
import com.ryuqq.privatefm.core.spi.MergeOperationRepository;
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
 * Merge 작업 생성/실행/취소.
 *
 * <p><strong>실행 흐름 ({@link #executeMerge(OperationId)}):</strong></p>
 * <pre>
 * 1. 종료된 작업이면 저장된 결과 반환 (재실행 없음)
 * 2. Namespace ACTIVE → MERGING (CAS, 이미 MERGING이면 그대로 진행)
 * 3. 작업 PENDING → RUNNING
 * 4. 단계 실행 (20 → 40 → 70 → 90 → 100)
 *    - TransientException: backoff 후 최대 mergeMaxAttempts까지 재시도
 *    - FatalException: 작업 FAILED, Namespace CORRUPTED
 *    - 기타 예외: 작업 FAILED, Namespace ACTIVE 복귀
 * 5. 성공: 체크포인트 저장, versionCount+1, Namespace ACTIVE, 작업 COMPLETED
 * </pre>
 *
 * <p>실패/재시도 시에도 작업은 마지막으로 도달한 stage와 progressPercent를 유지합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MergeCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MergeCoordinator.class);

    public static final int MAX_LIST_LIMIT = 100;

    private final NamespaceRepository namespaces;
    private final MergeOperationRepository operations;
    private final WorkQueue workQueue;
    private final ModelRegistry modelRegistry;
    private final AdapterMerger adapterMerger;
    private final EventLogService eventLogService;
    private final CheckpointManager checkpointManager;
    private final BackoffCalculator backoffCalculator;
    private final Sleeper sleeper;
    private final OrchestratorMetrics metrics;
    private final Clock clock;
    private final int maxAttempts;

    public MergeCoordinator(OrchestratorContext context, EventLogService eventLogService, CheckpointManager checkpointManager) {
        if (eventLogService == null || checkpointManager == null) {
            throw new IllegalArgumentException("eventLogService and checkpointManager cannot be null");
        }
        this.namespaces = context.namespaces();
        this.operations = context.mergeOperations();
        this.workQueue = context.workQueue();
        this.modelRegistry = context.modelRegistry();
        this.adapterMerger = context.adapterMerger();
        this.eventLogService = eventLogService;
        this.checkpointManager = checkpointManager;
        this.backoffCalculator = context.backoffCalculator();
        this.sleeper = context.sleeper();
        this.metrics = context.metrics();
        this.clock = context.clock();
        this.maxAttempts = context.config().mergeMaxAttempts();
    }

    /**
     * Merge 작업 생성 및 merge_queue 게시.
     *
     * @param learnerId 학습자 ID
     * @param operationType 작업 유형
     * @param targetFmVersion 대상 FM 버전 (null이면 최신 버전)
     * @param force true면 상태 검사와 활성 작업 중복 검사를 건너뜀
     * @return PENDING 작업
     * @throws NamespaceNotFoundException Namespace가 없는 경우
     * @throws ConflictException ACTIVE가 아니거나 활성 작업이 이미 있는 경우 (force 제외)
     */
    public MergeOperation triggerMerge(String learnerId, MergeOperationType operationType, String targetFmVersion, boolean force) {
        if (operationType == null) {
            throw new ValidationException("operationType cannot be null");
        }
        Namespace namespace = findNamespace(learnerId);

        if (namespace.status() == NamespaceStatus.DELETED) {
            throw new ConflictException("Cannot merge a deleted namespace (learner: " + learnerId + ")");
        }
        if (!force && namespace.status() != NamespaceStatus.ACTIVE) {
            throw new ConflictException(
                "Namespace must be ACTIVE to merge (learner: " + learnerId + ", status: " + namespace.status() + ")");
        }

        String fmVersion = targetFmVersion != null && !targetFmVersion.isBlank()
            ? targetFmVersion
            : modelRegistry.latestVersion();

        MergeOperation operation = MergeOperation.pending(namespace.id(), namespace.learnerId(), operationType,
            namespace.currentCheckpointHash(), fmVersion, clock.instant());

        if (force) {
            operations.insert(operation);
        } else if (!operations.insertIfNoActive(operation)) {
            throw new ConflictException("Merge operation already in progress (learner: " + learnerId + ")");
        }

        Map<String, Object> eventData = new LinkedHashMap<>();
        eventData.put("merge_operation_id", operation.operationId().getValue());
        eventData.put("operation_type", operationType.name());
        eventData.put("target_fm_version", fmVersion);
        eventData.put("force", force);
        eventLogService.logEvent(namespace, NamespaceEventTypes.MERGE_INITIATED, eventData);

        workQueue.push(QueueNames.MERGE_QUEUE, operation.operationId().getValue());

        log.info("Merge triggered: learner={}, op={}, type={}, fmVersion={}, force={}",
            learnerId, operation.operationId().getValue(), operationType, fmVersion, force);
        return operation;
    }

    /**
     * Merge 실행.
     *
     * @param operationId 작업 ID
     * @return 실행 결과 (종료된 작업이면 저장된 결과)
     */
    public Outcome executeMerge(OperationId operationId) {
        Optional<MergeOperation> found = operations.find(operationId);
        if (found.isEmpty()) {
            log.warn("Merge operation not found: {}", operationId.getValue());
            return Fail.of("OPERATION_NOT_FOUND", "Merge operation not found: " + operationId.getValue());
        }
        MergeOperation operation = found.get();
        if (operation.status().isTerminal()) {
            log.debug("Merge operation already terminal: op={}, status={}", operationId.getValue(), operation.status());
            return storedOutcome(operation);
        }

        Optional<Namespace> merging = namespaces.transition(operation.namespaceId(),
            EnumSet.of(NamespaceStatus.ACTIVE, NamespaceStatus.MERGING),
            ns -> ns.status() == NamespaceStatus.MERGING ? ns : ns.transitionTo(NamespaceStatus.MERGING, clock.instant()));
        if (merging.isEmpty()) {
            String status = namespaces.findById(operation.namespaceId())
                .map(ns -> ns.status().name())
                .orElse("MISSING");
            String message = "Namespace not in mergeable state: " + status;
            operations.transition(operationId, EnumSet.of(OperationStatus.PENDING, OperationStatus.RUNNING),
                op -> op.fail(message, clock.instant()));
            logMergeFailed(operation, message, false);
            recordOutcome(operation, OperationStatus.FAILED);
            log.warn("Merge rejected: op={}, {}", operationId.getValue(), message);
            return Fail.of("INVALID_STATE", message);
        }

        Optional<MergeOperation> started = operations.transition(operationId,
            EnumSet.of(OperationStatus.PENDING, OperationStatus.RUNNING), op -> op.start(clock.instant()));
        if (started.isEmpty()) {
            // 그 사이 취소된 경우
            restoreActive(operation);
            return operations.find(operationId).map(this::storedOutcome)
                .orElseGet(() -> Fail.of("OPERATION_NOT_FOUND", "Merge operation disappeared: " + operationId.getValue()));
        }

        return runWithRetry(started.get(), merging.get());
    }

    private Outcome runWithRetry(MergeOperation operation, Namespace namespace) {
        MergeOperation current = operation;
        int attempt = 1;
        while (true) {
            try {
                return completeMerge(runStages(current, namespace));
            } catch (TransientException e) {
                current = latest(current);
                if (attempt >= maxAttempts) {
                    return failMerge(current, "Merge failed after " + attempt + " attempts: " + e.getMessage());
                }
                long delay = backoffCalculator.calculate(attempt);
                log.warn("Transient merge error, retrying: op={}, attempt={}, delayMs={}, error={}",
                    current.operationId().getValue(), attempt, delay, e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return failMerge(current, "Merge interrupted during retry backoff");
                }
                attempt++;
                current = current.withAttemptCount(current.attemptCount() + 1);
                operations.save(current);
            } catch (FatalException e) {
                return corruptMerge(latest(current), e);
            } catch (RuntimeException e) {
                current = latest(current);
                log.error("Merge failed: op={}", current.operationId().getValue(), e);
                return failMerge(current, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }
    }

    /**
     * 단계 진행으로 저장된 최신 작업 상태.
     */
    private MergeOperation latest(MergeOperation operation) {
        return operations.find(operation.operationId()).orElse(operation);
    }

    private MergeResult runStages(MergeOperation operation, Namespace namespace) {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("start_time", clock.instant().toString());

        MergeOperation current = advance(operation, MergeStage.LOADING_FOUNDATION_MODEL);
        current = advance(current, MergeStage.LOADING_ADAPTERS);

        stats.putAll(adapterMerger.merge(namespace, operation.fmVersion()));
        current = advance(current, MergeStage.PERFORMING_MERGE);

        int version = namespace.versionCount() + 1;
        String hash = checkpointManager.generateHash(namespace.id(), operation.fmVersion(), version);
        CheckpointInfo checkpoint = checkpointManager.store(namespace.id(), hash, operation.fmVersion(), version);
        current = advance(current, MergeStage.GENERATING_CHECKPOINT);

        stats.put("end_time", clock.instant().toString());
        stats.put("checkpoint_size_bytes", checkpoint.sizeBytes());
        current = advance(current, MergeStage.FINALIZING);
        return new MergeResult(current, checkpoint, stats);
    }

    private MergeOperation advance(MergeOperation operation, MergeStage stage) {
        MergeOperation updated = operation.progress(stage.progressPercent(), stage.displayName());
        operations.save(updated);
        log.debug("Merge progress: op={}, stage={}, progress={}",
            operation.operationId().getValue(), stage.displayName(), stage.progressPercent());
        return updated;
    }

    private Outcome completeMerge(MergeResult result) {
        MergeOperation operation = result.operation();
        String hash = result.checkpoint().hash();
        Optional<Namespace> merged = namespaces.transition(operation.namespaceId(),
            EnumSet.of(NamespaceStatus.MERGING), ns -> ns.mergeCompleted(hash, clock.instant()));
        if (merged.isEmpty()) {
            return failMerge(operation, "Namespace left MERGING state before merge completed");
        }

        MergeOperation completed = operation.complete(hash, result.stats(), clock.instant());
        operations.save(completed);
        recordOutcome(completed, OperationStatus.COMPLETED);

        Map<String, Object> eventData = new LinkedHashMap<>();
        eventData.put("merge_operation_id", operation.operationId().getValue());
        eventData.put("checkpoint_hash", hash);
        eventData.put("version", merged.get().versionCount());
        eventData.put("merge_stats", result.stats());
        eventLogService.logEvent(merged.get(), NamespaceEventTypes.MERGE_COMPLETED, eventData, hash);

        log.info("Merge completed: op={}, namespace={}, version={}, checkpoint={}",
            operation.operationId().getValue(), operation.namespaceId().getValue(), merged.get().versionCount(), hash);
        return new Ok(operation.operationId(), "Merge completed: " + hash);
    }

    private Outcome failMerge(MergeOperation operation, String message) {
        MergeOperation failed = operation.fail(message, clock.instant());
        operations.save(failed);
        restoreActive(operation);
        logMergeFailed(operation, message, false);
        recordOutcome(failed, OperationStatus.FAILED);
        log.warn("Merge failed: op={}, error={}", operation.operationId().getValue(), message);
        return Fail.of("MERGE_FAILED", message);
    }

    private Outcome corruptMerge(MergeOperation operation, FatalException e) {
        MergeOperation failed = operation.fail(e.getMessage(), clock.instant());
        operations.save(failed);
        namespaces.transition(operation.namespaceId(),
            EnumSet.of(NamespaceStatus.MERGING, NamespaceStatus.ACTIVE),
            ns -> ns.transitionTo(NamespaceStatus.CORRUPTED, clock.instant()));
        logMergeFailed(operation, e.getMessage(), true);
        recordOutcome(failed, OperationStatus.FAILED);
        log.error("Merge corrupted namespace: op={}, namespace={}",
            operation.operationId().getValue(), operation.namespaceId().getValue(), e);
        return Fail.of("CHECKPOINT_CORRUPTED", e.getMessage(), e.getClass().getName());
    }

    private void recordOutcome(MergeOperation operation, OperationStatus status) {
        Duration duration = operation.startedAt() == null
            ? Duration.ZERO
            : Duration.between(operation.startedAt(), clock.instant());
        metrics.recordMerge(status.name(), duration);
    }

    private void restoreActive(MergeOperation operation) {
        boolean othersRunning = operations.findActive(operation.namespaceId()).stream()
            .anyMatch(op -> !op.operationId().equals(operation.operationId())
                && op.status() == OperationStatus.RUNNING);
        if (othersRunning) {
            return;
        }
        namespaces.transition(operation.namespaceId(), EnumSet.of(NamespaceStatus.MERGING),
            ns -> ns.transitionTo(NamespaceStatus.ACTIVE, clock.instant()));
    }

    private void logMergeFailed(MergeOperation operation, String message, boolean corruption) {
        namespaces.findById(operation.namespaceId()).ifPresent(ns -> {
            Map<String, Object> eventData = new LinkedHashMap<>();
            eventData.put("merge_operation_id", operation.operationId().getValue());
            eventData.put("error", message);
            if (corruption) {
                eventData.put("corruption_detected", true);
            }
            eventLogService.logEvent(ns, NamespaceEventTypes.MERGE_FAILED, eventData);
        });
    }

    /**
     * PENDING 작업 취소.
     *
     * @throws OperationNotFoundException 작업이 없는 경우
     * @throws ConflictException PENDING이 아닌 경우
     */
    public MergeOperation cancel(OperationId operationId) {
        MergeOperation existing = getOperation(operationId)
            .orElseThrow(() -> new OperationNotFoundException("Merge operation not found: " + operationId.getValue()));
        MergeOperation cancelled = operations.transition(operationId, EnumSet.of(OperationStatus.PENDING),
                op -> op.cancel(clock.instant()))
            .orElseThrow(() -> new ConflictException(
                "Only PENDING merge operations can be cancelled (current: " + existing.status() + ")"));

        namespaces.findById(cancelled.namespaceId()).ifPresent(ns ->
            eventLogService.logEvent(ns, NamespaceEventTypes.MERGE_CANCELLED,
                Map.of("merge_operation_id", operationId.getValue())));
        log.info("Merge cancelled: op={}", operationId.getValue());
        return cancelled;
    }

    public Optional<MergeOperation> getOperation(OperationId operationId) {
        return operations.find(operationId);
    }

    /**
     * 학습자의 Merge 작업 목록 (최신순).
     */
    public List<MergeOperation> listOperations(String learnerId, int limit) {
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new ValidationException("limit must be 1.." + MAX_LIST_LIMIT + " (current: " + limit + ")");
        }
        Namespace namespace = findNamespace(learnerId);
        return operations.findByNamespace(namespace.id(), limit);
    }

    private Namespace findNamespace(String learnerId) {
        return NamespaceLookup.require(namespaces, learnerId);
    }

    private Outcome storedOutcome(MergeOperation operation) {
        switch (operation.status()) {
            case COMPLETED:
                return new Ok(operation.operationId(), "Merge completed: " + operation.targetCheckpointHash());
            case CANCELLED:
                return Fail.of("CANCELLED", "Merge operation was cancelled");
            default:
                String message = operation.errorMessage() != null ? operation.errorMessage() : "Merge failed";
                return Fail.of("MERGE_FAILED", message);
        }
    }

    private record MergeResult(MergeOperation operation, CheckpointInfo checkpoint, Map<String, Object> stats) {
    }
}
