package com.ryuqq.privatefm.application.context;

import java.time.Duration;
import java.util.Map;

/**
 * Orchestrator 전역 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>guardianApiKey: Namespace 삭제 인가 키 (null이면 삭제 불가)</li>
 *   <li>maxVersionLag: 건강 검사 경고 기준 버전 지연 (기본 3)</li>
 *   <li>strictMaxVersionLag: Fallback 트리거 기준 버전 지연 (기본 5)</li>
 *   <li>checkpointRetention: 체크포인트/무결성 마커 보존 기간 (기본 30일)</li>
 *   <li>maxNamespaceSizeGb: 기본 저장소 한도 (기본 10.0GB)</li>
 *   <li>staleMergeThreshold: Merge 지연 경고 기준 (기본 48시간)</li>
 *   <li>mergeMaxAttempts: Merge 일시 오류 최대 시도 횟수 (기본 3)</li>
 *   <li>backoffBaseMs / backoffMaxMs: 재시도 backoff 범위 (기본 1000ms / 30000ms)</li>
 *   <li>jobStatsRetention: Job 통계 보존 기간 (기본 7일)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OrchestratorConfig(
    String guardianApiKey,
    int maxVersionLag,
    int strictMaxVersionLag,
    Duration checkpointRetention,
    double maxNamespaceSizeGb,
    Duration staleMergeThreshold,
    int mergeMaxAttempts,
    long backoffBaseMs,
    long backoffMaxMs,
    Duration jobStatsRetention
) {

    /**
     * 기본 설정 생성자.
     */
    public OrchestratorConfig() {
        this(null, 3, 5, Duration.ofDays(30), 10.0, Duration.ofHours(48), 3, 1000, 30000, Duration.ofDays(7));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrchestratorConfig {
        if (maxVersionLag < 0) {
            throw new IllegalArgumentException("maxVersionLag must be non-negative (current: " + maxVersionLag + ")");
        }
        if (strictMaxVersionLag < maxVersionLag) {
            throw new IllegalArgumentException(
                "strictMaxVersionLag must be >= maxVersionLag (max: " + maxVersionLag + ", strict: " + strictMaxVersionLag + ")"
            );
        }
        requirePositive(checkpointRetention, "checkpointRetention");
        requirePositive(staleMergeThreshold, "staleMergeThreshold");
        requirePositive(jobStatsRetention, "jobStatsRetention");
        if (maxNamespaceSizeGb <= 0) {
            throw new IllegalArgumentException("maxNamespaceSizeGb must be positive (current: " + maxNamespaceSizeGb + ")");
        }
        if (mergeMaxAttempts <= 0) {
            throw new IllegalArgumentException("mergeMaxAttempts must be positive (current: " + mergeMaxAttempts + ")");
        }
        if (backoffBaseMs <= 0 || backoffMaxMs < backoffBaseMs) {
            throw new IllegalArgumentException(
                "backoff range invalid (base: " + backoffBaseMs + ", max: " + backoffMaxMs + ")"
            );
        }
        if (guardianApiKey != null && guardianApiKey.isBlank()) {
            guardianApiKey = null;
        }
    }

    /**
     * 환경 변수에서 설정 생성. 없는 값은 기본값을 사용합니다.
     *
     * <p>읽는 변수: GUARDIAN_API_KEY, MAX_VERSION_LAG, CHECKPOINT_RETENTION_DAYS, MAX_NAMESPACE_SIZE_GB</p>
     *
     * @param env 환경 변수 맵 (보통 {@code System.getenv()})
     * @return 설정
     * @throws IllegalArgumentException 숫자 형식이 잘못된 경우
     */
    public static OrchestratorConfig fromEnvironment(Map<String, String> env) {
        OrchestratorConfig defaults = new OrchestratorConfig();
        int maxLag = EnvValues.intValue(env, "MAX_VERSION_LAG", defaults.maxVersionLag());
        return new OrchestratorConfig(
            env.get("GUARDIAN_API_KEY"),
            maxLag,
            Math.max(defaults.strictMaxVersionLag(), maxLag),
            Duration.ofDays(EnvValues.intValue(env, "CHECKPOINT_RETENTION_DAYS", 30)),
            EnvValues.doubleValue(env, "MAX_NAMESPACE_SIZE_GB", defaults.maxNamespaceSizeGb()),
            defaults.staleMergeThreshold(),
            defaults.mergeMaxAttempts(),
            defaults.backoffBaseMs(),
            defaults.backoffMaxMs(),
            defaults.jobStatsRetention()
        );
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + duration + ")");
        }
    }

    public OrchestratorConfig withGuardianApiKey(String guardianApiKey) {
        return new OrchestratorConfig(guardianApiKey, maxVersionLag, strictMaxVersionLag, checkpointRetention,
            maxNamespaceSizeGb, staleMergeThreshold, mergeMaxAttempts, backoffBaseMs, backoffMaxMs, jobStatsRetention);
    }

    public OrchestratorConfig withMaxVersionLag(int maxVersionLag) {
        return new OrchestratorConfig(guardianApiKey, maxVersionLag, strictMaxVersionLag, checkpointRetention,
            maxNamespaceSizeGb, staleMergeThreshold, mergeMaxAttempts, backoffBaseMs, backoffMaxMs, jobStatsRetention);
    }

    public OrchestratorConfig withMergeMaxAttempts(int mergeMaxAttempts) {
        return new OrchestratorConfig(guardianApiKey, maxVersionLag, strictMaxVersionLag, checkpointRetention,
            maxNamespaceSizeGb, staleMergeThreshold, mergeMaxAttempts, backoffBaseMs, backoffMaxMs, jobStatsRetention);
    }

    public OrchestratorConfig withBackoff(long backoffBaseMs, long backoffMaxMs) {
        return new OrchestratorConfig(guardianApiKey, maxVersionLag, strictMaxVersionLag, checkpointRetention,
            maxNamespaceSizeGb, staleMergeThreshold, mergeMaxAttempts, backoffBaseMs, backoffMaxMs, jobStatsRetention);
    }

    public OrchestratorConfig withCheckpointRetention(Duration checkpointRetention) {
        return new OrchestratorConfig(guardianApiKey, maxVersionLag, strictMaxVersionLag, checkpointRetention,
            maxNamespaceSizeGb, staleMergeThreshold, mergeMaxAttempts, backoffBaseMs, backoffMaxMs, jobStatsRetention);
    }
}
