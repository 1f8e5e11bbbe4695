package com.ryuqq.privatefm.adapter.runner;

import com.ryuqq.privatefm.application.context.EnvValues;

import java.time.Duration;
import java.util.Map;

/**
 * CleanupSweep 설정 (불변 record).
 *
 * <p>이벤트 로그는 retention의 2배 동안 보존됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param enabled 실행 여부 (기본 true, CLEANUP_ENABLED)
 * @param retention 종료된 Merge 작업 보존 기간 (기본 30일, CLEANUP_RETENTION_DAYS)
 * @param interval 실행 주기 (기본 24시간)
 */
public record CleanupConfig(boolean enabled, Duration retention, Duration interval) {

    public CleanupConfig() {
        this(true, Duration.ofDays(30), Duration.ofHours(24));
    }

    public CleanupConfig {
        if (retention == null || retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be positive (current: " + retention + ")");
        }
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive (current: " + interval + ")");
        }
    }

    public static CleanupConfig fromEnvironment(Map<String, String> env) {
        CleanupConfig defaults = new CleanupConfig();
        return new CleanupConfig(
            EnvValues.booleanValue(env, "CLEANUP_ENABLED", defaults.enabled()),
            Duration.ofDays(EnvValues.intValue(env, "CLEANUP_RETENTION_DAYS", (int) defaults.retention().toDays())),
            defaults.interval()
        );
    }

    public Duration eventRetention() {
        return retention.multipliedBy(2);
    }

    public CleanupConfig withEnabled(boolean enabled) {
        return new CleanupConfig(enabled, retention, interval);
    }

    public CleanupConfig withRetention(Duration retention) {
        return new CleanupConfig(enabled, retention, interval);
    }
}
