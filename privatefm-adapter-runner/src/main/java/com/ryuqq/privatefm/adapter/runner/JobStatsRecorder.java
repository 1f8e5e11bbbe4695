package com.ryuqq.privatefm.adapter.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.privatefm.application.checkpoint.StorageKeys;
import com.ryuqq.privatefm.application.support.Jsons;
import com.ryuqq.privatefm.core.spi.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

/**
 * 주기 작업 통계를 체크포인트 저장소에 JSON으로 기록.
 *
 * <p>키는 {@code job_stats:{job}:{yyyyMMdd}} (UTC 기준 날짜)이며 같은 날의 재실행은 덮어씁니다.
 * 기록 실패는 WARN으로 남기고 작업 결과에 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JobStatsRecorder {

    private static final Logger log = LoggerFactory.getLogger(JobStatsRecorder.class);

    private final CheckpointStore store;
    private final Clock clock;
    private final Duration retention;
    private final ObjectMapper mapper;

    public JobStatsRecorder(CheckpointStore store, Clock clock, Duration retention) {
        if (store == null || clock == null) {
            throw new IllegalArgumentException("store and clock cannot be null");
        }
        if (retention == null || retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("retention must be positive (current: " + retention + ")");
        }
        this.store = store;
        this.clock = clock;
        this.retention = retention;
        this.mapper = Jsons.mapper();
    }

    /**
     * 보고서 기록. DISABLED 보고서는 기록하지 않습니다.
     *
     * @return 기록 여부
     */
    public boolean record(SweepReport report) {
        if (report.status() == SweepStatus.DISABLED) {
            return false;
        }
        String key = StorageKeys.jobStats(report.job(), today());
        try {
            store.put(key, mapper.writeValueAsBytes(report.toStats()), retention);
            log.debug("Job stats recorded: key={}", key);
            return true;
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to record job stats: key={}", key, e);
            return false;
        }
    }

    /**
     * 특정 날짜의 통계 조회.
     *
     * @throws IllegalStateException 저장된 JSON이 손상된 경우
     */
    public Optional<Map<String, Object>> find(String job, LocalDate day) {
        return store.get(StorageKeys.jobStats(job, day)).map(Jsons::toMap);
    }

    public LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
