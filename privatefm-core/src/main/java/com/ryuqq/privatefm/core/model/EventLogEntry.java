package com.ryuqq.privatefm.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Namespace 이벤트 로그 항목 (append-only).
 *
 * <p>sequenceNumber는 Namespace별로 1부터 빈틈없이 증가하며, 저장소가
 * append 시점에 원자적으로 할당합니다. 할당 전 초안은 sequenceNumber가 0입니다.</p>
 *
 * @param eventId 이벤트 ID
 * @param namespaceId Namespace ID
 * @param learnerId 학습자 ID
 * @param eventType 이벤트 유형 (예: namespace_created, PROBLEM_SOLVED)
 * @param eventData 이벤트 데이터 (불변)
 * @param subject 과목 코드 (null 가능)
 * @param checkpointHash 관련 체크포인트 해시 (null 가능)
 * @param sequenceNumber Namespace 내 순번 (초안은 0)
 * @param correlationId 상관관계 ID
 * @param createdBy 발생 주체
 * @param createdAt 생성 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EventLogEntry(
    String eventId,
    NamespaceId namespaceId,
    LearnerId learnerId,
    String eventType,
    Map<String, Object> eventData,
    String subject,
    String checkpointHash,
    long sequenceNumber,
    String correlationId,
    EventActor createdBy,
    Instant createdAt
) {

    public EventLogEntry {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId cannot be null or blank");
        }
        if (namespaceId == null || learnerId == null) {
            throw new IllegalArgumentException("namespaceId and learnerId cannot be null");
        }
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType cannot be null or blank");
        }
        if (sequenceNumber < 0) {
            throw new IllegalArgumentException("sequenceNumber must be non-negative (current: " + sequenceNumber + ")");
        }
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId cannot be null or blank");
        }
        if (createdBy == null || createdAt == null) {
            throw new IllegalArgumentException("createdBy and createdAt cannot be null");
        }
        eventData = eventData == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(eventData));
    }

    /**
     * 순번 할당 전 초안 생성. correlationId가 없으면 새로 생성합니다.
     */
    public static EventLogEntry draft(
        NamespaceId namespaceId,
        LearnerId learnerId,
        String eventType,
        Map<String, Object> eventData,
        String subject,
        String checkpointHash,
        String correlationId,
        EventActor createdBy,
        Instant now
    ) {
        String correlation = correlationId == null || correlationId.isBlank()
            ? UUID.randomUUID().toString()
            : correlationId;
        return new EventLogEntry(UUID.randomUUID().toString(), namespaceId, learnerId, eventType, eventData,
            subject, checkpointHash, 0, correlation, createdBy == null ? EventActor.SYSTEM : createdBy, now);
    }

    /**
     * 순번이 할당된 사본 반환 (저장소 전용).
     */
    public EventLogEntry withSequenceNumber(long sequence) {
        return new EventLogEntry(eventId, namespaceId, learnerId, eventType, eventData, subject,
            checkpointHash, sequence, correlationId, createdBy, createdAt);
    }
}
