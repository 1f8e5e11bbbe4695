package com.ryuqq.privatefm.application.fallback;

import com.ryuqq.privatefm.application.checkpoint.StorageKeys;
import com.ryuqq.privatefm.application.support.InMemoryContextFixture;
import com.ryuqq.privatefm.application.support.Jsons;
import com.ryuqq.privatefm.core.exception.ConflictException;
import com.ryuqq.privatefm.core.model.EventActor;
import com.ryuqq.privatefm.core.model.EventLogEntry;
import com.ryuqq.privatefm.core.model.FallbackOperation;
import com.ryuqq.privatefm.core.model.FallbackReason;
import com.ryuqq.privatefm.core.model.LearnerId;
import com.ryuqq.privatefm.core.model.MergeOperation;
import com.ryuqq.privatefm.core.model.MergeOperationType;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.outcome.Fail;
import com.ryuqq.privatefm.core.outcome.Outcome;
import com.ryuqq.privatefm.core.spi.QueueNames;
import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;
import com.ryuqq.privatefm.core.statemachine.OperationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FallbackManager 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class FallbackManagerTest {

    private InMemoryContextFixture fixture;
    private FallbackManager manager;

    @BeforeEach
    void setUp() {
        fixture = new InMemoryContextFixture();
        manager = fixture.services().fallbackManager();
    }

    private Namespace namespace() {
        return fixture.namespaces.findByLearner(LearnerId.of("learner-1")).orElseThrow();
    }

    private Namespace mergedTwice() {
        fixture.createNamespace("learner-1", "math", "science");
        for (int i = 0; i < 2; i++) {
            MergeOperation op = fixture.services().mergeCoordinator()
                .triggerMerge("learner-1", MergeOperationType.MANUAL, null, false);
            fixture.services().mergeCoordinator().executeMerge(op.operationId());
        }
        return namespace();
    }

    private void learningEvent(Namespace ns, String subject) {
        fixture.services().eventLogService().logEvent(ns.id(), ns.learnerId(), "PROBLEM_SOLVED",
            Map.of("score", 1), subject, null, null, EventActor.API);
    }

    // ============================================================
    // initiateFallback
    // ============================================================

    @Test
    void initiateFallback_Namespace를_FALLBACK으로_전이하고_큐에_게시함() {
        // given
        Namespace ns = mergedTwice();
        long eventsBefore = fixture.eventLog.count(ns.id());

        // when
        FallbackOperation operation = manager.initiateFallback("learner-1", FallbackReason.MANUAL_REQUEST, null);

        // then
        assertThat(operation.status()).isEqualTo(OperationStatus.PENDING);
        assertThat(operation.eventsToReplay()).isEqualTo(eventsBefore);
        assertThat(operation.targetFmVersion()).isEqualTo(InMemoryContextFixture.FM_VERSION);
        assertThat(namespace().status()).isEqualTo(NamespaceStatus.FALLBACK);
        assertThat(namespace().lastFallbackAt()).isNotNull();
        assertThat(fixture.workQueue.snapshot(QueueNames.FALLBACK_QUEUE))
            .containsExactly(operation.operationId().getValue());
        assertThat(fixture.eventLog.findByNamespace(ns.id(), "fallback_initiated", 1)).singleElement()
            .satisfies(e -> assertThat(e.eventData()).containsEntry("reason", "manual_request"));
    }

    @Test
    void initiateFallback_이미_FALLBACK이면_ConflictException() {
        mergedTwice();
        manager.initiateFallback("learner-1", FallbackReason.MANUAL_REQUEST, null);

        assertThatThrownBy(() -> manager.initiateFallback("learner-1", FallbackReason.MANUAL_REQUEST, null))
            .isInstanceOf(ConflictException.class);
    }

    // ============================================================
    // executeFallback
    // ============================================================

    @Test
    void executeFallback_버전을_1로_초기화하고_ACTIVE로_복귀함() {
        // given
        Namespace ns = mergedTwice();
        String oldHash = ns.currentCheckpointHash();
        learningEvent(ns, "math");
        fixture.modelRegistry.setLatestVersion("fm-v1.1");
        FallbackOperation operation = manager.initiateFallback("learner-1", FallbackReason.VERSION_LAG, null);

        // when
        Outcome outcome = manager.executeFallback(operation.operationId());

        // then
        assertThat(outcome.isOk()).isTrue();
        Namespace recovered = namespace();
        assertThat(recovered.status()).isEqualTo(NamespaceStatus.ACTIVE);
        assertThat(recovered.versionCount()).isEqualTo(1);
        assertThat(recovered.baseFmVersion()).isEqualTo("fm-v1.1");
        assertThat(recovered.currentCheckpointHash()).isNotEqualTo(oldHash);

        FallbackOperation completed = manager.getOperation(operation.operationId()).orElseThrow();
        assertThat(completed.status()).isEqualTo(OperationStatus.COMPLETED);
        assertThat(completed.eventsReplayed()).isEqualTo(operation.eventsToReplay() + 1);
    }

    @Test
    void executeFallback_과목_Adapter를_재복제하고_과목_이벤트만_적용함() {
        // given
        Namespace ns = mergedTwice();
        learningEvent(ns, "math");
        learningEvent(ns, "math");
        learningEvent(ns, "history");
        FallbackOperation operation = manager.initiateFallback("learner-1", FallbackReason.MANUAL_REQUEST, null);

        // when
        manager.executeFallback(operation.operationId());

        // then
        Map<String, Object> math = Jsons.toMap(fixture.checkpointStore
            .get(StorageKeys.trainingMetadata(ns.nsUid(), "math")).orElseThrow());
        Map<String, Object> science = Jsons.toMap(fixture.checkpointStore
            .get(StorageKeys.trainingMetadata(ns.nsUid(), "science")).orElseThrow());
        assertThat(((Number) math.get("training_steps")).intValue()).isEqualTo(2);
        assertThat(((Number) science.get("training_steps")).intValue()).isZero();
        assertThat(fixture.checkpointStore.get(StorageKeys.adapter(ns.nsUid(), "math"))).isPresent();
    }

    @Test
    void executeFallback_기반_모델이_없으면_CORRUPTED로_전이함() {
        // given
        mergedTwice();
        fixture.modelRegistry.removeBaseModel(InMemoryContextFixture.FM_VERSION, "science");
        FallbackOperation operation = manager.initiateFallback("learner-1", FallbackReason.CORRUPTION_DETECTED, null);

        // when
        Outcome outcome = manager.executeFallback(operation.operationId());

        // then
        assertThat(((Fail) outcome).errorCode()).isEqualTo("FALLBACK_FAILED");
        assertThat(namespace().status()).isEqualTo(NamespaceStatus.CORRUPTED);
        assertThat(manager.getOperation(operation.operationId()).orElseThrow().status())
            .isEqualTo(OperationStatus.FAILED);
        List<EventLogEntry> failures = fixture.eventLog.findByNamespace(namespace().id(), "fallback_failed", 5);
        assertThat(failures).hasSize(1);
    }

    @Test
    void executeFallback_CORRUPTED_Namespace도_복구함() {
        // given
        mergedTwice();
        fixture.modelRegistry.removeBaseModel(InMemoryContextFixture.FM_VERSION, "science");
        FallbackOperation failed = manager.initiateFallback("learner-1", FallbackReason.CORRUPTION_DETECTED, null);
        manager.executeFallback(failed.operationId());
        fixture.modelRegistry.setLatestVersion("fm-v1.1");

        // when
        FallbackOperation retry = manager.initiateFallback("learner-1", FallbackReason.CORRUPTION_DETECTED, null);
        Outcome outcome = manager.executeFallback(retry.operationId());

        // then
        assertThat(outcome.isOk()).isTrue();
        assertThat(namespace().status()).isEqualTo(NamespaceStatus.ACTIVE);
        assertThat(manager.listOperations("learner-1")).hasSize(2);
    }

    @Test
    void executeFallback_완료된_작업은_다시_실행하지_않음() {
        mergedTwice();
        FallbackOperation operation = manager.initiateFallback("learner-1", FallbackReason.MANUAL_REQUEST, null);
        manager.executeFallback(operation.operationId());
        String hash = namespace().currentCheckpointHash();

        Outcome again = manager.executeFallback(operation.operationId());

        assertThat(again.isOk()).isTrue();
        assertThat(namespace().currentCheckpointHash()).isEqualTo(hash);
    }
}
