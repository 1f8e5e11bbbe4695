package com.ryuqq.privatefm.adapter.runner;

import java.time.Duration;

/**
 * OrchestratorScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>sweepParallelism: Nightly Merge 배치 fan-out 스레드 수 (기본 4)</li>
 *   <li>restartBackoffBaseMs / restartBackoffMaxMs: 루프 재시작 backoff (기본 1000ms / 60000ms)</li>
 *   <li>shutdownTimeout: stop() 시 루프 종료 대기 시간 (기본 30초)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SchedulerConfig(
    int sweepParallelism,
    long restartBackoffBaseMs,
    long restartBackoffMaxMs,
    Duration shutdownTimeout
) {

    public SchedulerConfig() {
        this(4, 1000, 60000, Duration.ofSeconds(30));
    }

    public SchedulerConfig {
        if (sweepParallelism <= 0) {
            throw new IllegalArgumentException("sweepParallelism must be positive (current: " + sweepParallelism + ")");
        }
        if (restartBackoffBaseMs <= 0 || restartBackoffMaxMs < restartBackoffBaseMs) {
            throw new IllegalArgumentException(
                "restart backoff range invalid (base: " + restartBackoffBaseMs + ", max: " + restartBackoffMaxMs + ")"
            );
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be non-negative (current: " + shutdownTimeout + ")");
        }
    }

    public SchedulerConfig withRestartBackoff(long restartBackoffBaseMs, long restartBackoffMaxMs) {
        return new SchedulerConfig(sweepParallelism, restartBackoffBaseMs, restartBackoffMaxMs, shutdownTimeout);
    }

    public SchedulerConfig withShutdownTimeout(Duration shutdownTimeout) {
        return new SchedulerConfig(sweepParallelism, restartBackoffBaseMs, restartBackoffMaxMs, shutdownTimeout);
    }
}
