package com.ryuqq.privatefm.adapter.runner;

import com.ryuqq.privatefm.application.context.EnvValues;

import java.time.Duration;
import java.util.Map;

/**
 * HealthCheckSweep 설정 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param enabled 실행 여부 (기본 true, HEALTH_CHECK_ENABLED)
 * @param interval 실행 주기 (기본 1시간)
 */
public record HealthCheckConfig(boolean enabled, Duration interval) {

    public HealthCheckConfig() {
        this(true, Duration.ofHours(1));
    }

    public HealthCheckConfig {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive (current: " + interval + ")");
        }
    }

    public static HealthCheckConfig fromEnvironment(Map<String, String> env) {
        HealthCheckConfig defaults = new HealthCheckConfig();
        return new HealthCheckConfig(
            EnvValues.booleanValue(env, "HEALTH_CHECK_ENABLED", defaults.enabled()),
            defaults.interval()
        );
    }

    public HealthCheckConfig withEnabled(boolean enabled) {
        return new HealthCheckConfig(enabled, interval);
    }

    public HealthCheckConfig withInterval(Duration interval) {
        return new HealthCheckConfig(enabled, interval);
    }
}
