package com.ryuqq.privatefm.adapter.inmemory.repository;

import com.ryuqq.privatefm.core.model.AdapterResetRequest;
import com.ryuqq.privatefm.core.model.LearnerId;
import com.ryuqq.privatefm.core.model.MergeOperation;
import com.ryuqq.privatefm.core.model.MergeOperationType;
import com.ryuqq.privatefm.core.model.NamespaceId;
import com.ryuqq.privatefm.core.statemachine.OperationStatus;
import com.ryuqq.privatefm.core.statemachine.ResetStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 병합 작업 / 어댑터 리셋 저장소의 배타성 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryOperationRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T02:00:00Z");
    private static final NamespaceId NS = NamespaceId.of("ns-1");
    private static final LearnerId LEARNER = LearnerId.of("learner-1");

    private MergeOperation pending(Instant at) {
        return MergeOperation.pending(NS, LEARNER, MergeOperationType.MANUAL, null, "fm-v1.0", at);
    }

    // ============================================================
    // Merge Operations
    // ============================================================

    @Test
    void insertIfNoActive_동시_트리거는_하나만_승인함() throws InterruptedException {
        // given
        InMemoryMergeOperationRepository repository = new InMemoryMergeOperationRepository();
        int threads = 12;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();

        // when
        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    if (repository.insertIfNoActive(pending(NOW))) {
                        admitted.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        // then
        assertThat(admitted.get()).isEqualTo(1);
        assertThat(repository.findActive(NS)).hasSize(1);
    }

    @Test
    void insertIfNoActive_이전_작업이_종료되면_다시_허용함() {
        // given
        InMemoryMergeOperationRepository repository = new InMemoryMergeOperationRepository();
        MergeOperation first = pending(NOW);
        repository.insertIfNoActive(first);
        repository.transition(first.operationId(), EnumSet.of(OperationStatus.PENDING), op -> op.cancel(NOW));

        // when / then
        assertThat(repository.insertIfNoActive(pending(NOW.plusSeconds(1)))).isTrue();
    }

    @Test
    void findByNamespace_최신순_limit() {
        InMemoryMergeOperationRepository repository = new InMemoryMergeOperationRepository();
        MergeOperation older = pending(NOW);
        MergeOperation newer = pending(NOW.plusSeconds(60));
        repository.insert(older);
        repository.insert(newer);

        List<MergeOperation> result = repository.findByNamespace(NS, 1);

        assertThat(result).extracting(MergeOperation::operationId).containsExactly(newer.operationId());
    }

    @Test
    void deleteTerminalBefore_완료시각_기준으로_종료된_작업만_삭제함() {
        // given
        InMemoryMergeOperationRepository repository = new InMemoryMergeOperationRepository();
        MergeOperation done = pending(NOW);
        MergeOperation open = pending(NOW);
        repository.insert(done);
        repository.insert(open);
        repository.transition(done.operationId(), EnumSet.of(OperationStatus.PENDING),
            op -> op.start(NOW).fail("boom", NOW));

        // when
        int deleted = repository.deleteTerminalBefore(NOW.plusSeconds(1));

        // then
        assertThat(deleted).isEqualTo(1);
        assertThat(repository.find(done.operationId())).isEmpty();
        assertThat(repository.find(open.operationId())).isPresent();
    }

    // ============================================================
    // Adapter Reset Requests
    // ============================================================

    @Test
    void reset_같은_과목의_진행중_요청은_하나만_허용함() {
        // given
        InMemoryAdapterResetRepository repository = new InMemoryAdapterResetRepository();
        AdapterResetRequest first = AdapterResetRequest.create(LEARNER, NS, "math", "guardian-1", "guardian",
            null, true, NOW);

        // when
        boolean firstAdmitted = repository.insertIfNoActive(first);
        boolean sameSubject = repository.insertIfNoActive(AdapterResetRequest.create(LEARNER, NS, "math",
            "guardian-1", "guardian", null, true, NOW));
        boolean otherSubject = repository.insertIfNoActive(AdapterResetRequest.create(LEARNER, NS, "science",
            "guardian-1", "guardian", null, true, NOW));

        // then
        assertThat(firstAdmitted).isTrue();
        assertThat(sameSubject).isFalse();
        assertThat(otherSubject).isTrue();
    }

    @Test
    void reset_승인요청_ID로_조회함() {
        InMemoryAdapterResetRepository repository = new InMemoryAdapterResetRepository();
        AdapterResetRequest request = AdapterResetRequest.create(LEARNER, NS, "math", "teacher-1", "teacher",
            "drift", false, NOW);
        repository.insertIfNoActive(request);
        repository.transition(request.requestId(), EnumSet.of(ResetStatus.PENDING_APPROVAL),
            r -> r.withApprovalRequestId("approval-1"));

        assertThat(repository.findByApprovalId("approval-1"))
            .map(AdapterResetRequest::requestId)
            .contains(request.requestId());
        assertThat(repository.findByApprovalId("approval-unknown")).isEmpty();
        assertThat(repository.findByApprovalId(null)).isEmpty();
    }
}
