package com.ryuqq.privatefm.application.merge;

import com.ryuqq.privatefm.application.checkpoint.StorageKeys;
import com.ryuqq.privatefm.application.support.InMemoryContextFixture;
import com.ryuqq.privatefm.core.exception.ConflictException;
import com.ryuqq.privatefm.core.exception.FatalException;
import com.ryuqq.privatefm.core.exception.NamespaceNotFoundException;
import com.ryuqq.privatefm.core.exception.OperationNotFoundException;
import com.ryuqq.privatefm.core.exception.TransientException;
import com.ryuqq.privatefm.core.model.EventLogEntry;
import com.ryuqq.privatefm.core.model.LearnerId;
import com.ryuqq.privatefm.core.model.MergeOperation;
import com.ryuqq.privatefm.core.model.MergeOperationType;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.model.OperationId;
import com.ryuqq.privatefm.core.outcome.Fail;
import com.ryuqq.privatefm.core.outcome.Outcome;
import com.ryuqq.privatefm.core.spi.QueueNames;
import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;
import com.ryuqq.privatefm.core.statemachine.OperationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MergeCoordinator 테스트.
 *
 * <p>In-Memory 어댑터 위에서 트리거/실행/취소와 오류 분류를 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class MergeCoordinatorTest {

    private InMemoryContextFixture fixture;
    private MergeCoordinator coordinator;

    @BeforeEach
    void setUp() {
        fixture = new InMemoryContextFixture();
        coordinator = fixture.services().mergeCoordinator();
    }

    private Namespace namespace() {
        return fixture.namespaces.findByLearner(LearnerId.of("learner-1")).orElseThrow();
    }

    // ============================================================
    // triggerMerge
    // ============================================================

    @Test
    void triggerMerge_PENDING_작업을_만들고_큐에_게시함() {
        // given
        fixture.createNamespace("learner-1", "math");

        // when
        MergeOperation operation = coordinator.triggerMerge("learner-1", MergeOperationType.MANUAL, null, false);

        // then
        assertThat(operation.status()).isEqualTo(OperationStatus.PENDING);
        assertThat(operation.fmVersion()).isEqualTo(InMemoryContextFixture.FM_VERSION);
        assertThat(fixture.workQueue.snapshot(QueueNames.MERGE_QUEUE))
            .containsExactly(operation.operationId().getValue());
        assertThat(fixture.eventLog.findByNamespace(operation.namespaceId(), "merge_initiated", 1))
            .singleElement()
            .satisfies(event -> assertThat(event.eventData())
                .containsEntry("merge_operation_id", operation.operationId().getValue())
                .containsEntry("force", false));
    }

    @Test
    void triggerMerge_활성_작업이_있으면_ConflictException() {
        fixture.createNamespace("learner-1", "math");
        coordinator.triggerMerge("learner-1", MergeOperationType.MANUAL, null, false);

        assertThatThrownBy(() -> coordinator.triggerMerge("learner-1", MergeOperationType.NIGHTLY, null, false))
            .isInstanceOf(ConflictException.class);
        assertThat(fixture.workQueue.length(QueueNames.MERGE_QUEUE)).isEqualTo(1);
    }

    @Test
    void triggerMerge_force면_ACTIVE가_아니어도_허용함() {
        // given
        Namespace ns = fixture.createNamespace("learner-1", "math");
        fixture.namespaces.transition(ns.id(), EnumSet.of(NamespaceStatus.ACTIVE),
            n -> n.transitionTo(NamespaceStatus.CORRUPTED, fixture.clock.instant()));

        // when
        MergeOperation forced = coordinator.triggerMerge("learner-1", MergeOperationType.MANUAL, "fm-v1.1", true);

        // then
        assertThat(forced.fmVersion()).isEqualTo("fm-v1.1");
        assertThatThrownBy(() -> coordinator.triggerMerge("learner-1", MergeOperationType.MANUAL, null, false))
            .isInstanceOf(ConflictException.class)
            .hasMessageContaining("ACTIVE");
    }

    @Test
    void triggerMerge_삭제된_Namespace는_force여도_거부함() {
        fixture.createNamespace("learner-1", "math");
        fixture.services().namespaceRegistry().delete("learner-1", InMemoryContextFixture.GUARDIAN_KEY);

        assertThatThrownBy(() -> coordinator.triggerMerge("learner-1", MergeOperationType.MANUAL, null, true))
            .isInstanceOf(ConflictException.class);
    }

    @Test
    void triggerMerge_Namespace가_없으면_NamespaceNotFoundException() {
        assertThatThrownBy(() -> coordinator.triggerMerge("nobody", MergeOperationType.MANUAL, null, false))
            .isInstanceOf(NamespaceNotFoundException.class);
    }

    // ============================================================
    // executeMerge
    // ============================================================

    @Test
    void executeMerge_성공하면_버전이_1_증가하고_ACTIVE로_복귀함() {
        // given
        fixture.createNamespace("learner-1", "math", "science");
        MergeOperation operation = coordinator.triggerMerge("learner-1", MergeOperationType.MANUAL, null, false);
        fixture.clock.advance(Duration.ofMinutes(1));

        // when
        Outcome outcome = coordinator.executeMerge(operation.operationId());

        // then
        assertThat(outcome.isOk()).isTrue();
        Namespace merged = namespace();
        assertThat(merged.status()).isEqualTo(NamespaceStatus.ACTIVE);
        assertThat(merged.versionCount()).isEqualTo(1);
        assertThat(merged.currentCheckpointHash()).hasSize(64);
        assertThat(merged.lastMergeAt()).isEqualTo(fixture.clock.instant());

        MergeOperation completed = coordinator.getOperation(operation.operationId()).orElseThrow();
        assertThat(completed.status()).isEqualTo(OperationStatus.COMPLETED);
        assertThat(completed.progressPercent()).isEqualTo(100);
        assertThat(completed.targetCheckpointHash()).isEqualTo(merged.currentCheckpointHash());
        assertThat(completed.mergeStats())
            .containsEntry("adapters_merged", 20)
            .containsKeys("start_time", "end_time", "checkpoint_size_bytes");
        assertThat(fixture.checkpointStore.get(StorageKeys.integrityMarker(merged.currentCheckpointHash())))
            .isPresent();
    }

    @Test
    void executeMerge_종료된_작업은_재실행하지_않음() {
        fixture.createNamespace("learner-1", "math");
        MergeOperation operation = coordinator.triggerMerge("learner-1", MergeOperationType.MANUAL, null, false);
        coordinator.executeMerge(operation.operationId());

        Outcome again = coordinator.executeMerge(operation.operationId());

        assertThat(again.isOk()).isTrue();
        assertThat(namespace().versionCount()).isEqualTo(1);
        assertThat(fixture.adapterMerger.invocations()).isEqualTo(1);
    }

    @Test
    void executeMerge_일시_오류는_backoff_후_재시도함() {
        // given
        fixture.createNamespace("learner-1", "math");
        MergeOperation operation = coordinator.triggerMerge("learner-1", MergeOperationType.MANUAL, null, false);
        fixture.adapterMerger.failNextWith(new TransientException("storage timeout"));

        // when
        Outcome outcome = coordinator.executeMerge(operation.operationId());

        // then
        assertThat(outcome.isOk()).isTrue();
        assertThat(fixture.sleeps).containsExactly(1000L);
        assertThat(fixture.adapterMerger.invocations()).isEqualTo(2);
        assertThat(coordinator.getOperation(operation.operationId()).orElseThrow().attemptCount()).isEqualTo(2);
    }

    @Test
    void executeMerge_재시도_한도를_넘으면_FAILED_및_ACTIVE_복귀() {
        // given
        fixture.createNamespace("learner-1", "math");
        MergeOperation operation = coordinator.triggerMerge("learner-1", MergeOperationType.MANUAL, null, false);
        for (int i = 0; i < 3; i++) {
            fixture.adapterMerger.failNextWith(new TransientException("storage timeout"));
        }

        // when
        Outcome outcome = coordinator.executeMerge(operation.operationId());

        // then
        assertThat(outcome).isInstanceOf(Fail.class);
        assertThat(((Fail) outcome).errorCode()).isEqualTo("MERGE_FAILED");
        assertThat(fixture.sleeps).containsExactly(1000L, 2000L);
        assertThat(namespace().status()).isEqualTo(NamespaceStatus.ACTIVE);
        assertThat(namespace().versionCount()).isZero();
        assertThat(coordinator.getOperation(operation.operationId()).orElseThrow().status())
            .isEqualTo(OperationStatus.FAILED);
    }

    @Test
    void executeMerge_실패한_작업은_마지막으로_도달한_stage와_진행률을_유지함() {
        // given
        fixture.createNamespace("learner-1", "math");
        MergeOperation operation = coordinator.triggerMerge("learner-1", MergeOperationType.MANUAL, null, false);
        fixture.adapterMerger.failNextWith(new IllegalStateException("adapter shape mismatch"));

        // when
        Outcome outcome = coordinator.executeMerge(operation.operationId());

        // then
        assertThat(((Fail) outcome).errorCode()).isEqualTo("MERGE_FAILED");
        MergeOperation failed = coordinator.getOperation(operation.operationId()).orElseThrow();
        assertThat(failed.status()).isEqualTo(OperationStatus.FAILED);
        assertThat(failed.stage()).isEqualTo(MergeStage.LOADING_ADAPTERS.displayName());
        assertThat(failed.progressPercent()).isEqualTo(40);
        assertThat(failed.errorMessage()).contains("adapter shape mismatch");
    }

    @Test
    void executeMerge_재시도_한도_초과_후에도_stage와_시도_횟수를_유지함() {
        // given
        fixture.createNamespace("learner-1", "math");
        MergeOperation operation = coordinator.triggerMerge("learner-1", MergeOperationType.MANUAL, null, false);
        for (int i = 0; i < 3; i++) {
            fixture.adapterMerger.failNextWith(new TransientException("storage timeout"));
        }

        // when
        coordinator.executeMerge(operation.operationId());

        // then
        MergeOperation failed = coordinator.getOperation(operation.operationId()).orElseThrow();
        assertThat(failed.status()).isEqualTo(OperationStatus.FAILED);
        assertThat(failed.stage()).isEqualTo("Loading namespace adapters");
        assertThat(failed.progressPercent()).isEqualTo(40);
        assertThat(failed.attemptCount()).isEqualTo(3);
    }

    @Test
    void executeMerge_치명적_오류는_Namespace를_CORRUPTED로_전이함() {
        // given
        fixture.createNamespace("learner-1", "math");
        MergeOperation operation = coordinator.triggerMerge("learner-1", MergeOperationType.MANUAL, null, false);
        fixture.adapterMerger.failNextWith(new FatalException("adapter weights unreadable"));

        // when
        Outcome outcome = coordinator.executeMerge(operation.operationId());

        // then
        assertThat(((Fail) outcome).errorCode()).isEqualTo("CHECKPOINT_CORRUPTED");
        assertThat(namespace().status()).isEqualTo(NamespaceStatus.CORRUPTED);
        List<EventLogEntry> failures = fixture.eventLog.findByNamespace(namespace().id(), "merge_failed", 10);
        assertThat(failures).singleElement()
            .satisfies(event -> assertThat(event.eventData()).containsEntry("corruption_detected", true));
    }

    @Test
    void executeMerge_병합_불가_상태면_INVALID_STATE() {
        // given
        Namespace ns = fixture.createNamespace("learner-1", "math");
        MergeOperation operation = coordinator.triggerMerge("learner-1", MergeOperationType.MANUAL, null, false);
        fixture.namespaces.transition(ns.id(), EnumSet.of(NamespaceStatus.ACTIVE),
            n -> n.transitionTo(NamespaceStatus.CORRUPTED, fixture.clock.instant()));

        // when
        Outcome outcome = coordinator.executeMerge(operation.operationId());

        // then
        assertThat(((Fail) outcome).errorCode()).isEqualTo("INVALID_STATE");
        assertThat(coordinator.getOperation(operation.operationId()).orElseThrow().status())
            .isEqualTo(OperationStatus.FAILED);
        assertThat(namespace().status()).isEqualTo(NamespaceStatus.CORRUPTED);
    }

    @Test
    void executeMerge_없는_작업은_OPERATION_NOT_FOUND() {
        Outcome outcome = coordinator.executeMerge(OperationId.of("missing"));

        assertThat(((Fail) outcome).errorCode()).isEqualTo("OPERATION_NOT_FOUND");
    }

    @Test
    void executeMerge_연속_병합은_버전을_단조_증가시킴() {
        fixture.createNamespace("learner-1", "math");

        for (int i = 1; i <= 3; i++) {
            fixture.clock.advance(Duration.ofSeconds(1));
            MergeOperation operation = coordinator.triggerMerge("learner-1", MergeOperationType.NIGHTLY, null, false);
            coordinator.executeMerge(operation.operationId());
            assertThat(namespace().versionCount()).isEqualTo(i);
        }
    }

    // ============================================================
    // cancel / list
    // ============================================================

    @Test
    void cancel_PENDING_작업을_취소하고_실행은_CANCELLED를_반환함() {
        // given
        fixture.createNamespace("learner-1", "math");
        MergeOperation operation = coordinator.triggerMerge("learner-1", MergeOperationType.MANUAL, null, false);

        // when
        MergeOperation cancelled = coordinator.cancel(operation.operationId());
        Outcome outcome = coordinator.executeMerge(operation.operationId());

        // then
        assertThat(cancelled.status()).isEqualTo(OperationStatus.CANCELLED);
        assertThat(((Fail) outcome).errorCode()).isEqualTo("CANCELLED");
        assertThat(namespace().versionCount()).isZero();
        assertThat(namespace().status()).isEqualTo(NamespaceStatus.ACTIVE);
    }

    @Test
    void cancel_PENDING이_아니면_ConflictException() {
        fixture.createNamespace("learner-1", "math");
        MergeOperation operation = coordinator.triggerMerge("learner-1", MergeOperationType.MANUAL, null, false);
        coordinator.executeMerge(operation.operationId());

        assertThatThrownBy(() -> coordinator.cancel(operation.operationId()))
            .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> coordinator.cancel(OperationId.of("missing")))
            .isInstanceOf(OperationNotFoundException.class);
    }

    @Test
    void listOperations_최신순으로_반환함() {
        fixture.createNamespace("learner-1", "math");
        MergeOperation first = coordinator.triggerMerge("learner-1", MergeOperationType.MANUAL, null, false);
        coordinator.executeMerge(first.operationId());
        fixture.clock.advance(Duration.ofMinutes(5));
        MergeOperation second = coordinator.triggerMerge("learner-1", MergeOperationType.NIGHTLY, null, false);

        assertThat(coordinator.listOperations("learner-1", 10))
            .extracting(MergeOperation::operationId)
            .containsExactly(second.operationId(), first.operationId());
    }
}
