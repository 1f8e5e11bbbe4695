package com.ryuqq.privatefm.application.event;

import com.ryuqq.privatefm.application.context.OrchestratorContext;
import com.ryuqq.privatefm.core.exception.NamespaceNotFoundException;
import com.ryuqq.privatefm.core.exception.ValidationException;
import com.ryuqq.privatefm.core.model.EventActor;
import com.ryuqq.privatefm.core.model.EventLogEntry;
import com.ryuqq.privatefm.core.model.LearnerId;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.model.NamespaceId;
import com.ryuqq.privatefm.core.spi.EventLogRepository;
import com.ryuqq.privatefm.core.spi.NamespaceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Namespace 이벤트 로그 기록/조회.
 *
 * <p>순번 할당은 {@link EventLogRepository#append(EventLogEntry)}가 원자적으로 수행하므로
 * 이 서비스는 동시 호출에 안전합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class EventLogService {

    private static final Logger log = LoggerFactory.getLogger(EventLogService.class);

    public static final int MAX_LIST_LIMIT = 1000;

    private final EventLogRepository eventLog;
    private final NamespaceRepository namespaces;
    private final Clock clock;

    public EventLogService(OrchestratorContext context) {
        this.eventLog = context.eventLog();
        this.namespaces = context.namespaces();
        this.clock = context.clock();
    }

    /**
     * 이벤트 기록.
     *
     * @param namespaceId Namespace ID
     * @param learnerId 학습자 ID
     * @param eventType 이벤트 유형
     * @param eventData 이벤트 데이터
     * @param subject 과목 (null 가능)
     * @param checkpointHash 관련 체크포인트 (null 가능)
     * @param correlationId 상관관계 ID (null이면 생성)
     * @param createdBy 발생 주체 (null이면 SYSTEM)
     * @return 순번이 할당된 항목
     */
    public EventLogEntry logEvent(
        NamespaceId namespaceId,
        LearnerId learnerId,
        String eventType,
        Map<String, Object> eventData,
        String subject,
        String checkpointHash,
        String correlationId,
        EventActor createdBy
    ) {
        EventLogEntry draft = EventLogEntry.draft(namespaceId, learnerId, eventType, eventData, subject,
            checkpointHash, correlationId, createdBy, clock.instant());
        EventLogEntry stored = eventLog.append(draft);
        log.debug("Event logged: namespace={}, type={}, seq={}",
            namespaceId.getValue(), eventType, stored.sequenceNumber());
        return stored;
    }

    /**
     * SYSTEM 주체의 생명주기 이벤트 기록.
     */
    public EventLogEntry logEvent(Namespace namespace, String eventType, Map<String, Object> eventData) {
        return logEvent(namespace.id(), namespace.learnerId(), eventType, eventData, null, null, null, EventActor.SYSTEM);
    }

    /**
     * 체크포인트가 연관된 SYSTEM 이벤트 기록.
     */
    public EventLogEntry logEvent(Namespace namespace, String eventType, Map<String, Object> eventData, String checkpointHash) {
        return logEvent(namespace.id(), namespace.learnerId(), eventType, eventData, null, checkpointHash, null,
            EventActor.SYSTEM);
    }

    /**
     * 학습자의 이벤트 조회 (최신순).
     *
     * @param learnerId 학습자 ID
     * @param eventType 유형 필터 (null이면 전체)
     * @param limit 최대 개수 (1 ~ {@value #MAX_LIST_LIMIT})
     * @return 이벤트 목록
     * @throws NamespaceNotFoundException Namespace가 없는 경우
     * @throws ValidationException limit이 범위를 벗어난 경우
     */
    public List<EventLogEntry> listEvents(LearnerId learnerId, String eventType, int limit) {
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new ValidationException("limit must be 1.." + MAX_LIST_LIMIT + " (current: " + limit + ")");
        }
        Namespace namespace = namespaces.findByLearner(learnerId)
            .orElseThrow(() -> NamespaceNotFoundException.forLearner(learnerId.getValue()));
        return eventLog.findByNamespace(namespace.id(), eventType, limit);
    }

    /**
     * 재생 대상 이벤트 (순번 오름차순).
     *
     * @param namespaceId Namespace ID
     * @param subject 과목 필터 (null이면 전체)
     * @return 이벤트 목록
     */
    public List<EventLogEntry> replayableEvents(NamespaceId namespaceId, String subject) {
        return eventLog.findForReplay(namespaceId, subject);
    }

    public long countEvents(NamespaceId namespaceId) {
        return eventLog.count(namespaceId);
    }

    public Map<String, Long> countByType(NamespaceId namespaceId) {
        return eventLog.countByType(namespaceId);
    }
}
