package com.ryuqq.privatefm.application.event;

import com.ryuqq.privatefm.application.checkpoint.StorageKeys;
import com.ryuqq.privatefm.application.support.Jsons;
import com.ryuqq.privatefm.core.model.EventLogEntry;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.spi.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 기본 LearningUpdateApplier.
 *
 * <p>학습 이벤트 유형을 인식하면 과목의 학습 메타데이터
 * ({@code metadata:{nsUid}:{subject}})의 training_steps를 1 증가시킵니다.
 * 메타데이터가 없으면 적용만 하고 기록은 건너뜁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TrainingMetadataApplier implements LearningUpdateApplier {

    private static final Logger log = LoggerFactory.getLogger(TrainingMetadataApplier.class);

    public static final Set<String> SUPPORTED_EVENT_TYPES = Set.of(
        "PROBLEM_SOLVED",
        "ANSWER_SUBMITTED",
        "HINT_REQUESTED",
        "MISTAKE_MADE",
        "CONCEPT_MASTERED",
        "SKILL_PRACTICED"
    );

    private final CheckpointStore store;
    private final Clock clock;

    public TrainingMetadataApplier(CheckpointStore store, Clock clock) {
        if (store == null || clock == null) {
            throw new IllegalArgumentException("store and clock cannot be null");
        }
        this.store = store;
        this.clock = clock;
    }

    @Override
    public boolean apply(Namespace namespace, String subject, EventLogEntry event) {
        if (!SUPPORTED_EVENT_TYPES.contains(event.eventType())) {
            log.debug("Event type not applicable for learning update: type={}, subject={}", event.eventType(), subject);
            return false;
        }

        String metadataKey = StorageKeys.trainingMetadata(namespace.nsUid(), subject);
        Optional<byte[]> current = store.get(metadataKey);
        if (current.isPresent()) {
            Map<String, Object> metadata = Jsons.toMap(current.get());
            Object steps = metadata.get("training_steps");
            long next = (steps instanceof Number ? ((Number) steps).longValue() : 0L) + 1;
            metadata.put("training_steps", next);
            metadata.put("last_event_replayed", event.eventId());
            metadata.put("last_update", clock.instant().toString());
            store.put(metadataKey, Jsons.toBytes(metadata));
        }
        return true;
    }
}
