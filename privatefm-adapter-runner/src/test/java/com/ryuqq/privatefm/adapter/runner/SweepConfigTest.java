package com.ryuqq.privatefm.adapter.runner;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 주기 작업 설정 record 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SweepConfigTest {

    // ============================================================
    // NightlyMergeConfig
    // ============================================================

    @Test
    void NightlyMergeConfig_기본값() {
        NightlyMergeConfig config = new NightlyMergeConfig();

        assertThat(config.enabled()).isTrue();
        assertThat(config.batchSize()).isEqualTo(10);
        assertThat(config.batchDelay()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.mergeAge()).isEqualTo(Duration.ofHours(20));
        assertThat(config.interval()).isEqualTo(Duration.ofHours(24));
    }

    @Test
    void NightlyMergeConfig_환경_변수를_읽음() {
        NightlyMergeConfig config = NightlyMergeConfig.fromEnvironment(Map.of(
            "NIGHTLY_MERGE_ENABLED", "false",
            "MERGE_BATCH_SIZE", "25",
            "MERGE_DELAY_SECONDS", "5"));

        assertThat(config.enabled()).isFalse();
        assertThat(config.batchSize()).isEqualTo(25);
        assertThat(config.batchDelay()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void NightlyMergeConfig_배치_크기가_0이면_IllegalArgumentException() {
        assertThatThrownBy(() -> new NightlyMergeConfig().withBatchSize(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // CleanupConfig / HealthCheckConfig
    // ============================================================

    @Test
    void CleanupConfig_이벤트_보존기간은_두배() {
        CleanupConfig config = CleanupConfig.fromEnvironment(Map.of("CLEANUP_RETENTION_DAYS", "10"));

        assertThat(config.retention()).isEqualTo(Duration.ofDays(10));
        assertThat(config.eventRetention()).isEqualTo(Duration.ofDays(20));
        assertThat(config.enabled()).isTrue();
    }

    @Test
    void CleanupConfig_보존기간이_0이면_IllegalArgumentException() {
        assertThatThrownBy(() -> new CleanupConfig().withRetention(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void HealthCheckConfig_기본은_1시간_간격() {
        assertThat(new HealthCheckConfig().interval()).isEqualTo(Duration.ofHours(1));
        assertThat(HealthCheckConfig.fromEnvironment(Map.of("HEALTH_CHECK_ENABLED", "false")).enabled()).isFalse();
    }

    // ============================================================
    // SchedulerConfig / QueueWorkerConfig
    // ============================================================

    @Test
    void SchedulerConfig_backoff_최대가_기본보다_작으면_IllegalArgumentException() {
        assertThatThrownBy(() -> new SchedulerConfig().withRestartBackoff(1000, 10))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void QueueWorkerConfig_기본값과_검증() {
        QueueWorkerConfig config = new QueueWorkerConfig();

        assertThat(config.popTimeoutMs()).isEqualTo(5000);
        assertThat(config.idleDelayMs()).isEqualTo(1000);
        assertThat(config.workersPerQueue()).isEqualTo(1);
        assertThatThrownBy(() -> config.withPopTimeoutMs(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withWorkersPerQueue(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
