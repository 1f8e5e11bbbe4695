package com.ryuqq.privatefm.core.model;

import com.ryuqq.privatefm.core.statemachine.OperationStatus;
import com.ryuqq.privatefm.core.statemachine.OperationTransitions;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merge 시도 한 건.
 *
 * <p>Namespace당 PENDING/RUNNING 작업은 최대 하나이며 (force 제외),
 * 종료된 작업은 Cleanup Sweep이 보존 기간 이후 삭제합니다.</p>
 *
 * @param operationId 작업 ID
 * @param namespaceId Namespace ID
 * @param learnerId 학습자 ID
 * @param status 작업 상태
 * @param operationType 작업 유형
 * @param sourceCheckpointHash Merge 시작 시점 체크포인트 (null 가능)
 * @param targetCheckpointHash Merge 결과 체크포인트 (완료 전 null)
 * @param fmVersion 대상 Foundation Model 버전
 * @param progressPercent 진행률 (0~100)
 * @param stage 현재 단계 이름 (null 가능)
 * @param errorMessage 실패 메시지 (null 가능)
 * @param scheduledAt 예약 시각
 * @param startedAt 시작 시각 (null 가능)
 * @param completedAt 종료 시각 (null 가능)
 * @param mergeStats Merge 통계 (불변)
 * @param attemptCount 실행 시도 횟수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MergeOperation(
    OperationId operationId,
    NamespaceId namespaceId,
    LearnerId learnerId,
    OperationStatus status,
    MergeOperationType operationType,
    String sourceCheckpointHash,
    String targetCheckpointHash,
    String fmVersion,
    int progressPercent,
    String stage,
    String errorMessage,
    Instant scheduledAt,
    Instant startedAt,
    Instant completedAt,
    Map<String, Object> mergeStats,
    int attemptCount
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 없거나 범위를 벗어난 경우
     */
    public MergeOperation {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (namespaceId == null) {
            throw new IllegalArgumentException("namespaceId cannot be null");
        }
        if (learnerId == null) {
            throw new IllegalArgumentException("learnerId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (operationType == null) {
            throw new IllegalArgumentException("operationType cannot be null");
        }
        if (fmVersion == null || fmVersion.isBlank()) {
            throw new IllegalArgumentException("fmVersion cannot be null or blank");
        }
        if (progressPercent < 0 || progressPercent > 100) {
            throw new IllegalArgumentException("progressPercent must be 0..100 (current: " + progressPercent + ")");
        }
        if (scheduledAt == null) {
            throw new IllegalArgumentException("scheduledAt cannot be null");
        }
        mergeStats = mergeStats == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(mergeStats));
    }

    /**
     * PENDING 상태의 새 작업 생성.
     */
    public static MergeOperation pending(
        NamespaceId namespaceId,
        LearnerId learnerId,
        MergeOperationType operationType,
        String sourceCheckpointHash,
        String fmVersion,
        Instant now
    ) {
        return new MergeOperation(OperationId.generate(), namespaceId, learnerId, OperationStatus.PENDING,
            operationType, sourceCheckpointHash, null, fmVersion, 0, null, null, now, null, null, null, 0);
    }

    /**
     * RUNNING 전이 (재전달된 RUNNING 작업 재개 포함). 시도 횟수가 1 증가합니다.
     */
    public MergeOperation start(Instant now) {
        OperationTransitions.validate(status, OperationStatus.RUNNING);
        return new MergeOperation(operationId, namespaceId, learnerId, OperationStatus.RUNNING, operationType,
            sourceCheckpointHash, targetCheckpointHash, fmVersion, progressPercent, stage, errorMessage,
            scheduledAt, startedAt == null ? now : startedAt, completedAt, mergeStats, attemptCount + 1);
    }

    /**
     * 진행률/단계 갱신.
     */
    public MergeOperation progress(int percent, String stageName) {
        return new MergeOperation(operationId, namespaceId, learnerId, status, operationType,
            sourceCheckpointHash, targetCheckpointHash, fmVersion, percent, stageName, errorMessage,
            scheduledAt, startedAt, completedAt, mergeStats, attemptCount);
    }

    /**
     * 재시도 시도 횟수 기록.
     */
    public MergeOperation withAttemptCount(int attempts) {
        return new MergeOperation(operationId, namespaceId, learnerId, status, operationType,
            sourceCheckpointHash, targetCheckpointHash, fmVersion, progressPercent, stage, errorMessage,
            scheduledAt, startedAt, completedAt, mergeStats, attempts);
    }

    /**
     * COMPLETED 전이.
     */
    public MergeOperation complete(String targetHash, Map<String, Object> stats, Instant now) {
        OperationTransitions.validate(status, OperationStatus.COMPLETED);
        return new MergeOperation(operationId, namespaceId, learnerId, OperationStatus.COMPLETED, operationType,
            sourceCheckpointHash, targetHash, fmVersion, 100, "Finalizing", null,
            scheduledAt, startedAt, now, stats, attemptCount);
    }

    /**
     * FAILED 전이.
     */
    public MergeOperation fail(String message, Instant now) {
        OperationTransitions.validate(status, OperationStatus.FAILED);
        return new MergeOperation(operationId, namespaceId, learnerId, OperationStatus.FAILED, operationType,
            sourceCheckpointHash, targetCheckpointHash, fmVersion, progressPercent, stage, message,
            scheduledAt, startedAt, now, mergeStats, attemptCount);
    }

    /**
     * CANCELLED 전이 (PENDING에서만 허용).
     */
    public MergeOperation cancel(Instant now) {
        OperationTransitions.validate(status, OperationStatus.CANCELLED);
        return new MergeOperation(operationId, namespaceId, learnerId, OperationStatus.CANCELLED, operationType,
            sourceCheckpointHash, targetCheckpointHash, fmVersion, progressPercent, stage, "Cancelled",
            scheduledAt, startedAt, now, mergeStats, attemptCount);
    }
}
