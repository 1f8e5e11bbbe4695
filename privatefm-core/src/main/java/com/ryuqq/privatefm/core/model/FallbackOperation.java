package com.ryuqq.privatefm.core.model;

import com.ryuqq.privatefm.core.statemachine.OperationStatus;
import com.ryuqq.privatefm.core.statemachine.OperationTransitions;

import java.time.Instant;

/**
 * Fallback 복구 작업 한 건.
 *
 * <p>fallback_queue에는 작업 ID만 실리며, 실행에 필요한 사유/대상 버전은
 * 이 레코드에서 읽습니다. Fallback은 자동 재시도되지 않습니다.</p>
 *
 * @param operationId 작업 ID
 * @param namespaceId Namespace ID
 * @param learnerId 학습자 ID
 * @param reason 복구 사유
 * @param targetFmVersion 재기반 대상 버전
 * @param eventsToReplay 시작 시점의 재생 대상 이벤트 수
 * @param eventsReplayed 실제 재생된 이벤트 수
 * @param status 작업 상태
 * @param errorMessage 실패 메시지 (null 가능)
 * @param scheduledAt 예약 시각
 * @param startedAt 시작 시각 (null 가능)
 * @param completedAt 종료 시각 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record FallbackOperation(
    OperationId operationId,
    NamespaceId namespaceId,
    LearnerId learnerId,
    FallbackReason reason,
    String targetFmVersion,
    long eventsToReplay,
    long eventsReplayed,
    OperationStatus status,
    String errorMessage,
    Instant scheduledAt,
    Instant startedAt,
    Instant completedAt
) {

    public FallbackOperation {
        if (operationId == null || namespaceId == null || learnerId == null) {
            throw new IllegalArgumentException("operationId, namespaceId and learnerId cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (targetFmVersion == null || targetFmVersion.isBlank()) {
            throw new IllegalArgumentException("targetFmVersion cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (scheduledAt == null) {
            throw new IllegalArgumentException("scheduledAt cannot be null");
        }
    }

    public static FallbackOperation pending(
        NamespaceId namespaceId,
        LearnerId learnerId,
        FallbackReason reason,
        String targetFmVersion,
        long eventsToReplay,
        Instant now
    ) {
        return new FallbackOperation(OperationId.generate(), namespaceId, learnerId, reason, targetFmVersion,
            eventsToReplay, 0, OperationStatus.PENDING, null, now, null, null);
    }

    public FallbackOperation start(Instant now) {
        OperationTransitions.validate(status, OperationStatus.RUNNING);
        return new FallbackOperation(operationId, namespaceId, learnerId, reason, targetFmVersion,
            eventsToReplay, eventsReplayed, OperationStatus.RUNNING, errorMessage, scheduledAt, now, completedAt);
    }

    public FallbackOperation withEventsReplayed(long replayed) {
        return new FallbackOperation(operationId, namespaceId, learnerId, reason, targetFmVersion,
            eventsToReplay, replayed, status, errorMessage, scheduledAt, startedAt, completedAt);
    }

    public FallbackOperation complete(Instant now) {
        OperationTransitions.validate(status, OperationStatus.COMPLETED);
        return new FallbackOperation(operationId, namespaceId, learnerId, reason, targetFmVersion,
            eventsToReplay, eventsReplayed, OperationStatus.COMPLETED, null, scheduledAt, startedAt, now);
    }

    public FallbackOperation fail(String message, Instant now) {
        OperationTransitions.validate(status, OperationStatus.FAILED);
        return new FallbackOperation(operationId, namespaceId, learnerId, reason, targetFmVersion,
            eventsToReplay, eventsReplayed, OperationStatus.FAILED, message, scheduledAt, startedAt, now);
    }
}
