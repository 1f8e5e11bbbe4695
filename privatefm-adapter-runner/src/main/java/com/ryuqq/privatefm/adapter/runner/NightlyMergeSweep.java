package com.ryuqq.privatefm.adapter.runner;

import com.ryuqq.privatefm.application.context.OrchestratorServices;
import com.ryuqq.privatefm.application.merge.MergeCoordinator;
import com.ryuqq.privatefm.core.exception.ConflictException;
import com.ryuqq.privatefm.core.model.MergeOperation;
import com.ryuqq.privatefm.core.model.MergeOperationType;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.retry.Sleeper;
import com.ryuqq.privatefm.core.spi.MergeOperationRepository;
import com.ryuqq.privatefm.core.spi.NamespaceRepository;
import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * 야간 정기 Merge 트리거.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. ACTIVE이면서 mergeAge(20시간) 안에 Merge되지 않은 Namespace 조회
 * 2. batchSize 단위로 나누어 ExecutorService에 동시 제출
 *    - PENDING/RUNNING 작업이 있으면 건너뜀
 *    - 없으면 triggerMerge(NIGHTLY)
 * 3. 배치 사이 batchDelay 대기 (취소 확인)
 * 4. SweepReport 반환 및 Job 통계 기록
 * </pre>
 *
 * <p>Namespace 단위 오류는 errors 카운터로 집계되고 다음 Namespace 처리를 막지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class NightlyMergeSweep implements Sweep {

    private static final Logger log = LoggerFactory.getLogger(NightlyMergeSweep.class);

    public static final String JOB_NAME = "nightly_merge";

    private final NamespaceRepository namespaces;
    private final MergeOperationRepository mergeOperations;
    private final MergeCoordinator mergeCoordinator;
    private final NightlyMergeConfig config;
    private final ExecutorService executor;
    private final JobStatsRecorder recorder;
    private final Clock clock;
    private final Sleeper sleeper;

    private volatile boolean cancelled;

    public NightlyMergeSweep(
        OrchestratorServices services,
        NightlyMergeConfig config,
        ExecutorService executor,
        JobStatsRecorder recorder
    ) {
        if (services == null || config == null || executor == null || recorder == null) {
            throw new IllegalArgumentException("services, config, executor and recorder cannot be null");
        }
        this.namespaces = services.context().namespaces();
        this.mergeOperations = services.context().mergeOperations();
        this.mergeCoordinator = services.mergeCoordinator();
        this.config = config;
        this.executor = executor;
        this.recorder = recorder;
        this.clock = services.context().clock();
        this.sleeper = services.context().sleeper();
    }

    @Override
    public String jobName() {
        return JOB_NAME;
    }

    @Override
    public Duration interval() {
        return config.interval();
    }

    @Override
    public boolean enabled() {
        return config.enabled();
    }

    /**
     * 다음 배치 경계에서 실행을 멈추도록 요청.
     *
     * <p>실행 전에 요청하면 다음 실행이 첫 배치 전에 멈춥니다. 요청은 실행이 끝날 때 초기화됩니다.</p>
     */
    public void cancel() {
        cancelled = true;
    }

    @Override
    public SweepReport run() {
        Instant startedAt = clock.instant();
        if (!config.enabled()) {
            log.info("Nightly merge job disabled");
            return SweepReport.disabled(JOB_NAME, startedAt);
        }

        log.info("Starting nightly merge job");
        Map<String, Long> counters = new LinkedHashMap<>();
        counters.put("namespaces_found", 0L);
        counters.put("namespaces_processed", 0L);
        counters.put("merges_initiated", 0L);
        counters.put("merges_skipped", 0L);
        counters.put("errors", 0L);

        SweepStatus status = SweepStatus.COMPLETED;
        String fatalError = null;
        try {
            List<Namespace> candidates = namespacesNeedingMerge(startedAt);
            counters.put("namespaces_found", (long) candidates.size());

            for (int from = 0; from < candidates.size(); from += config.batchSize()) {
                if (cancelled) {
                    status = SweepStatus.CANCELLED;
                    break;
                }
                List<Namespace> batch = candidates.subList(from, Math.min(candidates.size(), from + config.batchSize()));
                processBatch(batch, counters);

                boolean moreBatches = from + config.batchSize() < candidates.size();
                if (moreBatches && !config.batchDelay().isZero()) {
                    sleeper.sleep(config.batchDelay().toMillis());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = SweepStatus.CANCELLED;
        } catch (RuntimeException e) {
            log.error("Nightly merge job failed", e);
            status = SweepStatus.FAILED;
            fatalError = String.valueOf(e.getMessage());
        }

        cancelled = false;

        SweepReport report = new SweepReport(JOB_NAME, status, counters, startedAt, clock.instant(), fatalError);
        log.info("Nightly merge job finished: status={}, stats={}", status, counters);
        recorder.record(report);
        return report;
    }

    private List<Namespace> namespacesNeedingMerge(Instant now) {
        Instant cutoff = now.minus(config.mergeAge());
        return namespaces.findByStatuses(EnumSet.of(NamespaceStatus.ACTIVE)).stream()
            .filter(ns -> ns.lastMergeAt() == null || ns.lastMergeAt().isBefore(cutoff))
            .collect(Collectors.toList());
    }

    private void processBatch(List<Namespace> batch, Map<String, Long> counters) throws InterruptedException {
        List<Future<Boolean>> futures = new ArrayList<>(batch.size());
        for (Namespace namespace : batch) {
            futures.add(executor.submit(() -> processNamespace(namespace)));
        }
        for (Future<Boolean> future : futures) {
            try {
                boolean initiated = future.get();
                counters.merge("namespaces_processed", 1L, Long::sum);
                counters.merge(initiated ? "merges_initiated" : "merges_skipped", 1L, Long::sum);
            } catch (ExecutionException e) {
                counters.merge("errors", 1L, Long::sum);
                log.error("Batch merge error", e.getCause());
            }
        }
    }

    /**
     * @return Merge를 트리거했으면 true, 이미 진행 중이라 건너뛰었으면 false
     */
    private boolean processNamespace(Namespace namespace) {
        if (!mergeOperations.findActive(namespace.id()).isEmpty()) {
            return false;
        }
        try {
            MergeOperation operation = mergeCoordinator.triggerMerge(
                namespace.learnerId().getValue(), MergeOperationType.NIGHTLY, null, false);
            log.debug("Nightly merge triggered: learner={}, operation={}",
                namespace.learnerId().getValue(), operation.operationId().getValue());
            return true;
        } catch (ConflictException e) {
            log.debug("Nightly merge skipped, operation already active: learner={}", namespace.learnerId().getValue());
            return false;
        }
    }
}
