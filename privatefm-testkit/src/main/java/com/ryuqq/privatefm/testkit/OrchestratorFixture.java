package com.ryuqq.privatefm.testkit;

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
import com.ryuqq.privatefm.adapter.runner.JobStatsRecorder;
import com.ryuqq.privatefm.adapter.runner.QueueWorkerConfig;
import com.ryuqq.privatefm.adapter.runner.QueueWorkerRunner;
import com.ryuqq.privatefm.application.context.OrchestratorConfig;
import com.ryuqq.privatefm.application.context.OrchestratorContext;
import com.ryuqq.privatefm.application.context.OrchestratorServices;
import com.ryuqq.privatefm.application.orchestrator.DefaultNamespaceOrchestrator;
import com.ryuqq.privatefm.application.orchestrator.NamespaceOrchestrator;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.retry.BackoffCalculator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import com.ryuqq.privatefm.core.spi.QueueNames;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fully wired orchestrator on in-memory adapters with a controllable clock.
 *
 * <p>Every SPI implementation is exposed as a public field so tests can inject failures
 * or inspect state. Queues are drained synchronously on the calling thread with
 * {@link #drain(String)} instead of running background workers.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * OrchestratorFixture fixture = new OrchestratorFixture();
 * fixture.orchestrator().createNamespace("L1", List.of("math"), "fm-v1.0", null, null);
 * fixture.orchestrator().triggerMerge("L1", MergeOperationType.MANUAL, null, false);
 * fixture.drainAll();
 * </pre>
 *
 * <p>The sleeper never blocks; requested delays are recorded in {@link #sleeps}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OrchestratorFixture {

    public static final Instant START = Instant.parse("2026-03-01T02:00:00Z");
    public static final String FM_VERSION = "fm-v1.0";
    public static final String GUARDIAN_KEY = "guardian-secret";

    private static final QueueWorkerConfig DRAIN_CONFIG = new QueueWorkerConfig(1, 0, 1);

    public final MutableClock clock = new MutableClock(START);
    public final InMemoryNamespaceRepository namespaces = new InMemoryNamespaceRepository();
    public final InMemoryMergeOperationRepository mergeOperations = new InMemoryMergeOperationRepository();
    public final InMemoryFallbackOperationRepository fallbackOperations = new InMemoryFallbackOperationRepository();
    public final InMemoryEventLogRepository eventLog = new InMemoryEventLogRepository();
    public final InMemoryAdapterResetRepository resetRequests = new InMemoryAdapterResetRepository();
    public final InMemoryCheckpointStore checkpointStore = new InMemoryCheckpointStore(clock);
    public final InMemoryWorkQueue workQueue = new InMemoryWorkQueue();
    public final StaticModelRegistry modelRegistry = new StaticModelRegistry(FM_VERSION);
    public final RecordingApprovalService approvalService = new RecordingApprovalService();
    public final RecordingAuditSink auditSink = new RecordingAuditSink();
    public final StaticResetPermissionChecker permissionChecker = new StaticResetPermissionChecker();
    public final InMemoryResourceTracker resourceTracker = new InMemoryResourceTracker();
    public final SimulatedAdapterMerger adapterMerger = new SimulatedAdapterMerger();
    public final List<Long> sleeps = new CopyOnWriteArrayList<>();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private final OrchestratorContext context;
    private final OrchestratorServices services;
    private final NamespaceOrchestrator orchestrator;
    private final JobStatsRecorder jobStatsRecorder;
    private final Map<String, QueueWorkerRunner> runners = new HashMap<>();

    public OrchestratorFixture() {
        this(new OrchestratorConfig().withGuardianApiKey(GUARDIAN_KEY));
    }

    public OrchestratorFixture(OrchestratorConfig config) {
        this.context = OrchestratorContext.builder()
            .namespaces(namespaces)
            .mergeOperations(mergeOperations)
            .fallbackOperations(fallbackOperations)
            .eventLog(eventLog)
            .resetRequests(resetRequests)
            .checkpointStore(checkpointStore)
            .workQueue(workQueue)
            .modelRegistry(modelRegistry)
            .approvalService(approvalService)
            .auditSink(auditSink)
            .permissionChecker(permissionChecker)
            .resourceTracker(resourceTracker)
            .adapterMerger(adapterMerger)
            .config(config)
            .clock(clock)
            .sleeper(sleeps::add)
            .backoffCalculator(new BackoffCalculator(config.backoffBaseMs(), config.backoffMaxMs(), 0.0))
            .meterRegistry(meterRegistry)
            .build();
        this.services = new OrchestratorServices(context);
        this.orchestrator = new DefaultNamespaceOrchestrator(services);
        this.jobStatsRecorder = new JobStatsRecorder(checkpointStore, clock, config.jobStatsRetention());
        for (String queue : QueueNames.ALL) {
            runners.put(queue, QueueWorkerRunner.forQueue(services, queue, DRAIN_CONFIG));
        }
    }

    public OrchestratorContext context() {
        return context;
    }

    public OrchestratorServices services() {
        return services;
    }

    public NamespaceOrchestrator orchestrator() {
        return orchestrator;
    }

    public JobStatsRecorder jobStatsRecorder() {
        return jobStatsRecorder;
    }

    /**
     * Returns the runner bound to the given queue.
     *
     * @throws IllegalArgumentException if the queue is unknown
     */
    public QueueWorkerRunner runner(String queue) {
        QueueWorkerRunner runner = runners.get(queue);
        if (runner == null) {
            throw new IllegalArgumentException("Unknown queue: " + queue);
        }
        return runner;
    }

    /**
     * Processes queued items on the calling thread until the queue is empty.
     *
     * @return number of items processed
     */
    public int drain(String queue) {
        QueueWorkerRunner runner = runner(queue);
        int processed = 0;
        try {
            while (runner.pump()) {
                processed++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while draining " + queue, e);
        }
        return processed;
    }

    /**
     * Drains every queue, repeating until all are empty.
     *
     * @return total number of items processed
     */
    public int drainAll() {
        int total = 0;
        int round;
        do {
            round = 0;
            for (String queue : QueueNames.ALL) {
                round += drain(queue);
            }
            total += round;
        } while (round > 0);
        return total;
    }

    /**
     * Creates an ACTIVE namespace on {@link #FM_VERSION}.
     */
    public Namespace createNamespace(String learnerId, String... subjects) {
        return orchestrator.createNamespace(learnerId, List.of(subjects), FM_VERSION, null, null);
    }

    public Namespace namespace(String learnerId) {
        return orchestrator.getNamespace(learnerId)
            .orElseThrow(() -> new IllegalStateException("No namespace for learner " + learnerId));
    }

    public void advance(Duration duration) {
        clock.advance(duration);
    }
}
