package com.ryuqq.privatefm.adapter.runner;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 주기 작업 1회 실행 결과 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param job 작업 이름 (예: nightly_merge)
 * @param status 실행 결과 상태
 * @param counters 작업별 카운터 (삽입 순서 유지)
 * @param startedAt 시작 시각
 * @param finishedAt 종료 시각
 * @param fatalError 작업 전체 실패 메시지 (FAILED가 아니면 null)
 */
public record SweepReport(
    String job,
    SweepStatus status,
    Map<String, Long> counters,
    Instant startedAt,
    Instant finishedAt,
    String fatalError
) {

    public SweepReport {
        if (job == null || job.isBlank()) {
            throw new IllegalArgumentException("job cannot be null or blank");
        }
        if (status == null || startedAt == null || finishedAt == null) {
            throw new IllegalArgumentException("status, startedAt and finishedAt cannot be null");
        }
        counters = counters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(counters));
    }

    /**
     * 비활성화된 작업 보고서.
     */
    public static SweepReport disabled(String job, Instant now) {
        return new SweepReport(job, SweepStatus.DISABLED, Map.of(), now, now, null);
    }

    /**
     * 카운터 값 (없으면 0).
     */
    public long counter(String name) {
        return counters.getOrDefault(name, 0L);
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    /**
     * Job 통계 저장용 필드 맵.
     */
    public Map<String, Object> toStats() {
        Map<String, Object> stats = new LinkedHashMap<>(counters);
        stats.put("status", status.name().toLowerCase());
        stats.put("start_time", startedAt.toString());
        stats.put("end_time", finishedAt.toString());
        stats.put("duration_minutes", duration().toMillis() / 60000.0);
        if (fatalError != null) {
            stats.put("fatal_error", fatalError);
        }
        return stats;
    }
}
