package com.ryuqq.privatefm.adapter.runner;

import com.ryuqq.privatefm.application.context.EnvValues;

import java.time.Duration;
import java.util.Map;

/**
 * NightlyMergeSweep 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enabled: 실행 여부 (기본 true, NIGHTLY_MERGE_ENABLED)</li>
 *   <li>batchSize: 동시에 트리거할 Namespace 수 (기본 10, MERGE_BATCH_SIZE)</li>
 *   <li>batchDelay: 배치 사이 대기 (기본 30초, MERGE_DELAY_SECONDS)</li>
 *   <li>mergeAge: 이 시간 안에 Merge된 Namespace는 건너뜀 (기본 20시간)</li>
 *   <li>interval: 실행 주기 (기본 24시간)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record NightlyMergeConfig(
    boolean enabled,
    int batchSize,
    Duration batchDelay,
    Duration mergeAge,
    Duration interval
) {

    public NightlyMergeConfig() {
        this(true, 10, Duration.ofSeconds(30), Duration.ofHours(20), Duration.ofHours(24));
    }

    public NightlyMergeConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        if (batchDelay == null || batchDelay.isNegative()) {
            throw new IllegalArgumentException("batchDelay must be non-negative (current: " + batchDelay + ")");
        }
        if (mergeAge == null || mergeAge.isNegative() || mergeAge.isZero()) {
            throw new IllegalArgumentException("mergeAge must be positive (current: " + mergeAge + ")");
        }
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive (current: " + interval + ")");
        }
    }

    /**
     * 환경 변수에서 설정 생성. 없는 값은 기본값을 사용합니다.
     *
     * @throws IllegalArgumentException 숫자 형식이 잘못된 경우
     */
    public static NightlyMergeConfig fromEnvironment(Map<String, String> env) {
        NightlyMergeConfig defaults = new NightlyMergeConfig();
        return new NightlyMergeConfig(
            EnvValues.booleanValue(env, "NIGHTLY_MERGE_ENABLED", defaults.enabled()),
            EnvValues.intValue(env, "MERGE_BATCH_SIZE", defaults.batchSize()),
            Duration.ofSeconds(EnvValues.intValue(env, "MERGE_DELAY_SECONDS", (int) defaults.batchDelay().toSeconds())),
            defaults.mergeAge(),
            defaults.interval()
        );
    }

    public NightlyMergeConfig withEnabled(boolean enabled) {
        return new NightlyMergeConfig(enabled, batchSize, batchDelay, mergeAge, interval);
    }

    public NightlyMergeConfig withBatchSize(int batchSize) {
        return new NightlyMergeConfig(enabled, batchSize, batchDelay, mergeAge, interval);
    }

    public NightlyMergeConfig withBatchDelay(Duration batchDelay) {
        return new NightlyMergeConfig(enabled, batchSize, batchDelay, mergeAge, interval);
    }

    public NightlyMergeConfig withInterval(Duration interval) {
        return new NightlyMergeConfig(enabled, batchSize, batchDelay, mergeAge, interval);
    }
}
