package com.ryuqq.privatefm.adapter.runner;

import com.ryuqq.privatefm.application.checkpoint.StorageKeys;
import com.ryuqq.privatefm.application.context.OrchestratorContext;
import com.ryuqq.privatefm.core.spi.CheckpointStore;
import com.ryuqq.privatefm.core.spi.EventLogRepository;
import com.ryuqq.privatefm.core.spi.MergeOperationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 오래된 데이터 정리.
 *
 * <ul>
 *   <li>retention보다 오래 전에 종료된 Merge 작업 삭제</li>
 *   <li>retention × 2보다 오래된 이벤트 삭제</li>
 *   <li>만료 시각이 없는 체크포인트 키에 retention 만료 설정</li>
 *   <li>만료된 키 회수</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CleanupSweep implements Sweep {

    private static final Logger log = LoggerFactory.getLogger(CleanupSweep.class);

    public static final String JOB_NAME = "cleanup";

    private final MergeOperationRepository mergeOperations;
    private final EventLogRepository eventLog;
    private final CheckpointStore store;
    private final CleanupConfig config;
    private final JobStatsRecorder recorder;
    private final Clock clock;

    public CleanupSweep(OrchestratorContext context, CleanupConfig config, JobStatsRecorder recorder) {
        if (context == null || config == null || recorder == null) {
            throw new IllegalArgumentException("context, config and recorder cannot be null");
        }
        this.mergeOperations = context.mergeOperations();
        this.eventLog = context.eventLog();
        this.store = context.checkpointStore();
        this.config = config;
        this.recorder = recorder;
        this.clock = context.clock();
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

    @Override
    public SweepReport run() {
        Instant startedAt = clock.instant();
        if (!config.enabled()) {
            log.info("Cleanup job disabled");
            return SweepReport.disabled(JOB_NAME, startedAt);
        }

        log.info("Starting cleanup job");
        Map<String, Long> counters = new LinkedHashMap<>();
        SweepStatus status = SweepStatus.COMPLETED;
        String fatalError = null;
        try {
            counters.put("merge_operations_cleaned",
                (long) mergeOperations.deleteTerminalBefore(startedAt.minus(config.retention())));
            counters.put("event_logs_cleaned",
                (long) eventLog.deleteOlderThan(startedAt.minus(config.eventRetention())));

            long expirySet = 0;
            for (String key : store.listKeys(StorageKeys.CHECKPOINT_PREFIX)) {
                if (store.expiresAt(key).isEmpty() && store.expire(key, config.retention())) {
                    expirySet++;
                }
            }
            counters.put("checkpoint_expiry_set", expirySet);
            counters.put("checkpoints_cleaned", (long) store.evictExpired());
        } catch (RuntimeException e) {
            log.error("Cleanup job failed", e);
            status = SweepStatus.FAILED;
            fatalError = String.valueOf(e.getMessage());
        }

        SweepReport report = new SweepReport(JOB_NAME, status, counters, startedAt, clock.instant(), fatalError);
        log.info("Cleanup job finished: status={}, stats={}", status, counters);
        recorder.record(report);
        return report;
    }
}
