package com.ryuqq.privatefm.adapter.runner;

import com.ryuqq.privatefm.adapter.inmemory.external.InMemoryResourceTracker;
import com.ryuqq.privatefm.adapter.inmemory.external.RecordingApprovalService;
import com.ryuqq.privatefm.adapter.inmemory.external.RecordingAuditSink;
import com.ryuqq.privatefm.adapter.inmemory.external.SimulatedAdapterMerger;
import com.ryuqq.privatefm.adapter.inmemory.external.StaticModelRegistry;
import com.ryuqq.privatefm.adapter.inmemory.external.StaticResetPermissionChecker;
import com.ryuqq.privatefm.adapter.inmemory.queue.InMemoryWorkQueue;
import com.ryuqq.privatefm.adapter.inmemory.repository.InMemoryAdapterResetRepository;
import com.ryuqq.privatefm.adapter.inmemory.repository.InMemoryEventLogRepository;
import com.ryuqq.privatefm.adapter.inmemory.repository.InMemoryFallbackOperationRepository;
import com.ryuqq.privatefm.adapter.inmemory.repository.InMemoryMergeOperationRepository;
import com.ryuqq.privatefm.adapter.inmemory.repository.InMemoryNamespaceRepository;
import com.ryuqq.privatefm.adapter.inmemory.store.InMemoryCheckpointStore;
import com.ryuqq.privatefm.adapter.inmemory.time.MutableClock;
import com.ryuqq.privatefm.application.context.OrchestratorConfig;
import com.ryuqq.privatefm.application.context.OrchestratorContext;
import com.ryuqq.privatefm.application.context.OrchestratorServices;
import com.ryuqq.privatefm.core.model.MergeOperation;
import com.ryuqq.privatefm.core.model.MergeOperationType;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.retry.BackoffCalculator;
import com.ryuqq.privatefm.core.spi.QueueNames;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runner 테스트용 In-Memory 서비스 구성.
 *
 * <p>Sleeper는 대기하지 않고 요청된 지연만 기록합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class RunnerFixture {

    static final Instant START = Instant.parse("2026-03-01T02:00:00Z");
    static final String FM_VERSION = "fm-v1.0";

    final MutableClock clock = new MutableClock(START);
    final InMemoryNamespaceRepository namespaces = new InMemoryNamespaceRepository();
    final InMemoryMergeOperationRepository mergeOperations = new InMemoryMergeOperationRepository();
    final InMemoryFallbackOperationRepository fallbackOperations = new InMemoryFallbackOperationRepository();
    final InMemoryEventLogRepository eventLog = new InMemoryEventLogRepository();
    final InMemoryAdapterResetRepository resetRequests = new InMemoryAdapterResetRepository();
    final InMemoryCheckpointStore checkpointStore = new InMemoryCheckpointStore(clock);
    final InMemoryWorkQueue workQueue = new InMemoryWorkQueue();
    final StaticModelRegistry modelRegistry = new StaticModelRegistry(FM_VERSION);
    final SimulatedAdapterMerger adapterMerger = new SimulatedAdapterMerger();
    final List<Long> sleeps = new CopyOnWriteArrayList<>();
    final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    final OrchestratorServices services;
    final JobStatsRecorder recorder;

    RunnerFixture() {
        OrchestratorConfig config = new OrchestratorConfig().withGuardianApiKey("guardian-secret");
        OrchestratorContext context = OrchestratorContext.builder()
            .namespaces(namespaces)
            .mergeOperations(mergeOperations)
            .fallbackOperations(fallbackOperations)
            .eventLog(eventLog)
            .resetRequests(resetRequests)
            .checkpointStore(checkpointStore)
            .workQueue(workQueue)
            .modelRegistry(modelRegistry)
            .approvalService(new RecordingApprovalService())
            .auditSink(new RecordingAuditSink())
            .permissionChecker(new StaticResetPermissionChecker())
            .resourceTracker(new InMemoryResourceTracker())
            .adapterMerger(adapterMerger)
            .config(config)
            .clock(clock)
            .sleeper(sleeps::add)
            .backoffCalculator(new BackoffCalculator(config.backoffBaseMs(), config.backoffMaxMs(), 0.0))
            .meterRegistry(meterRegistry)
            .build();
        this.services = new OrchestratorServices(context);
        this.recorder = new JobStatsRecorder(checkpointStore, clock, config.jobStatsRetention());
    }

    Namespace createNamespace(String learnerId, String... subjects) {
        return services.namespaceRegistry().create(learnerId, List.of(subjects), FM_VERSION, null, null);
    }

    /**
     * 현재 시각에 Merge를 완료한 Namespace.
     */
    Namespace mergedNamespace(String learnerId, String... subjects) {
        createNamespace(learnerId, subjects);
        MergeOperation operation = services.mergeCoordinator()
            .triggerMerge(learnerId, MergeOperationType.MANUAL, null, false);
        workQueue.drain(QueueNames.MERGE_QUEUE);
        services.mergeCoordinator().executeMerge(operation.operationId());
        return services.namespaceRegistry().require(learnerId);
    }

    void advance(Duration duration) {
        clock.advance(duration);
    }
}
