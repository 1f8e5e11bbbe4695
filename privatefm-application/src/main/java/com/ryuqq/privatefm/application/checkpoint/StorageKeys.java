package com.ryuqq.privatefm.application.checkpoint;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * CheckpointStore 키 규칙.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StorageKeys {

    public static final String CHECKPOINT_PREFIX = "checkpoint:";
    public static final String INTEGRITY_SUFFIX = ":integrity";
    public static final String INTEGRITY_VERIFIED = "verified";

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    private StorageKeys() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String checkpoint(String hash) {
        return CHECKPOINT_PREFIX + hash;
    }

    public static String integrityMarker(String hash) {
        return CHECKPOINT_PREFIX + hash + INTEGRITY_SUFFIX;
    }

    public static String adapter(String nsUid, String subject) {
        return "adapter:" + nsUid + ":" + subject;
    }

    public static String trainingMetadata(String nsUid, String subject) {
        return "metadata:" + nsUid + ":" + subject;
    }

    /**
     * 과목 Adapter의 중간 체크포인트 키 접두사 ({@code adapter:{nsUid}:{subject}:{step}}).
     */
    public static String subjectCheckpointPrefix(String nsUid, String subject) {
        return adapter(nsUid, subject) + ":";
    }

    public static boolean isIntegrityMarker(String key) {
        return key.startsWith(CHECKPOINT_PREFIX) && key.endsWith(INTEGRITY_SUFFIX);
    }

    /**
     * @return 체크포인트 메타데이터 키의 해시, 마커 키면 null
     */
    public static String hashOf(String checkpointKey) {
        if (!checkpointKey.startsWith(CHECKPOINT_PREFIX) || isIntegrityMarker(checkpointKey)) {
            return null;
        }
        return checkpointKey.substring(CHECKPOINT_PREFIX.length());
    }

    public static String resources(String nsUid) {
        return "namespace:" + nsUid + ":resources";
    }

    /**
     * @return 예: job_stats:nightly_merge:20260301
     */
    public static String jobStats(String job, LocalDate day) {
        return "job_stats:" + job + ":" + DAY.format(day);
    }
}
