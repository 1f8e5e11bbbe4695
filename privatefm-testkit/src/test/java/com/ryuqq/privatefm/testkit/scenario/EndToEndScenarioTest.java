package com.ryuqq.privatefm.testkit.scenario;

import com.ryuqq.privatefm.adapter.runner.HealthCheckConfig;
import com.ryuqq.privatefm.adapter.runner.HealthCheckSweep;
import com.ryuqq.privatefm.adapter.runner.SweepReport;
import com.ryuqq.privatefm.application.checkpoint.StorageKeys;
import com.ryuqq.privatefm.application.fallback.FallbackDecision;
import com.ryuqq.privatefm.application.orchestrator.NamespaceOrchestrator;
import com.ryuqq.privatefm.application.reset.ApprovalCallbackResult;
import com.ryuqq.privatefm.core.model.AdapterResetRequest;
import com.ryuqq.privatefm.core.model.ApprovalDecision;
import com.ryuqq.privatefm.core.model.FallbackOperation;
import com.ryuqq.privatefm.core.model.FallbackReason;
import com.ryuqq.privatefm.core.model.MergeOperation;
import com.ryuqq.privatefm.core.model.MergeOperationType;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.model.NamespaceHealth;
import com.ryuqq.privatefm.core.spi.QueueNames;
import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;
import com.ryuqq.privatefm.core.statemachine.OperationStatus;
import com.ryuqq.privatefm.core.statemachine.ResetStatus;
import com.ryuqq.privatefm.testkit.OrchestratorFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 전체 스택 시나리오 테스트 (In-Memory 어댑터 + 큐 워커).
 *
 * <ul>
 *   <li>A: Namespace 생성 후 수동 Merge 완료</li>
 *   <li>B: 무결성 저하 감지 후 Fallback으로 버전 초기화</li>
 *   <li>C: 권한 없는 teacher의 Reset 요청 거절</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class EndToEndScenarioTest {

    private static final String LEARNER = "L1";

    private OrchestratorFixture fixture;
    private NamespaceOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        fixture = new OrchestratorFixture();
        orchestrator = fixture.orchestrator();
    }

    private Namespace scenarioA() {
        orchestrator.createNamespace(LEARNER, List.of("math"), "fm-v1.0", null, null);
        MergeOperation operation = orchestrator.triggerMerge(LEARNER, MergeOperationType.MANUAL, null, false);
        fixture.drain(QueueNames.MERGE_QUEUE);
        assertEquals(OperationStatus.COMPLETED,
            orchestrator.getMergeOperation(operation.operationId()).orElseThrow().status());
        return fixture.namespace(LEARNER);
    }

    // ============================================================
    // Scenario A
    // ============================================================

    @Test
    void scenarioA_CreateAndManualMerge_VersionOneWithCheckpoint() {
        // Given
        Namespace created = orchestrator.createNamespace(LEARNER, List.of("math"), "fm-v1.0", null, null);
        assertEquals(NamespaceStatus.ACTIVE, created.status());
        assertEquals(0, created.versionCount());
        assertNull(created.currentCheckpointHash());

        // When
        MergeOperation pending = orchestrator.triggerMerge(LEARNER, MergeOperationType.MANUAL, null, false);
        assertEquals(OperationStatus.PENDING, pending.status());
        int processed = fixture.drain(QueueNames.MERGE_QUEUE);

        // Then: PENDING -> RUNNING -> COMPLETED
        MergeOperation completed = orchestrator.getMergeOperation(pending.operationId()).orElseThrow();
        assertEquals(1, processed);
        assertEquals(OperationStatus.COMPLETED, completed.status());
        assertNotNull(completed.startedAt(), "Operation should have passed through RUNNING");
        assertEquals(1, completed.attemptCount());
        assertEquals(100, completed.progressPercent());

        Namespace merged = fixture.namespace(LEARNER);
        assertEquals(NamespaceStatus.ACTIVE, merged.status());
        assertEquals(1, merged.versionCount());
        assertNotNull(merged.currentCheckpointHash());
        assertEquals(merged.currentCheckpointHash(), completed.targetCheckpointHash());
        assertTrue(orchestrator.getHealth(LEARNER).healthy());
    }

    // ============================================================
    // Scenario B
    // ============================================================

    @Test
    void scenarioB_IntegrityScoreBelowHalf_FallbackResetsVersion() {
        // Given: merged twice so the reset is observable
        scenarioA();
        orchestrator.triggerMerge(LEARNER, MergeOperationType.MANUAL, null, false);
        fixture.drain(QueueNames.MERGE_QUEUE);
        assertEquals(2, fixture.namespace(LEARNER).versionCount());

        NamespaceHealth evaluated = orchestrator.getHealth(LEARNER);
        NamespaceHealth degraded = new NamespaceHealth(evaluated.namespaceId(), evaluated.learnerId(),
            evaluated.status(), false, evaluated.lastMergeAgoHours(), evaluated.versionLag(), 0.3,
            List.of(FallbackDecision.CORRUPTION_DETECTED_ISSUE), List.of());

        // When
        FallbackDecision decision = fixture.services().fallbackDecision();
        assertTrue(decision.shouldFallback(degraded));
        FallbackReason reason = decision.reason(degraded);
        FallbackOperation fallback = orchestrator.initiateFallback(LEARNER, reason, null);
        assertEquals(NamespaceStatus.FALLBACK, fixture.namespace(LEARNER).status());
        fixture.drainAll();

        // Then
        assertEquals(FallbackReason.CORRUPTION_DETECTED, reason);
        Namespace recovered = fixture.namespace(LEARNER);
        assertEquals(NamespaceStatus.ACTIVE, recovered.status());
        assertEquals(1, recovered.versionCount());
        assertEquals(OperationStatus.COMPLETED,
            fixture.services().fallbackManager().getOperation(fallback.operationId()).orElseThrow().status());
    }

    @Test
    void scenarioB_MissingIntegrityMarker_HealthSweepTriggersFallback() {
        // Given
        Namespace merged = scenarioA();
        fixture.checkpointStore.delete(StorageKeys.integrityMarker(merged.currentCheckpointHash()));
        fixture.advance(Duration.ofMinutes(5));
        HealthCheckSweep sweep = new HealthCheckSweep(fixture.services(), new HealthCheckConfig(),
            fixture.jobStatsRecorder());

        // When
        SweepReport report = sweep.run();
        fixture.drainAll();

        // Then
        assertEquals(1, report.counter("fallbacks_initiated"));
        Namespace recovered = fixture.namespace(LEARNER);
        assertEquals(NamespaceStatus.ACTIVE, recovered.status());
        assertEquals(1, recovered.versionCount());
        assertNotEquals(merged.currentCheckpointHash(), recovered.currentCheckpointHash());
        assertEquals(FallbackReason.CORRUPTION_DETECTED,
            fixture.services().fallbackManager().listOperations(LEARNER).get(0).reason());
        assertTrue(orchestrator.getHealth(LEARNER).healthy());
    }

    // ============================================================
    // Scenario C
    // ============================================================

    @Test
    void scenarioC_TeacherWithoutGrantRejected_NamespaceUnaffected() {
        // Given
        Namespace before = scenarioA();

        // When
        AdapterResetRequest request = orchestrator.requestReset(LEARNER, "math", "drift", "teacher-1", "teacher");
        assertEquals(ResetStatus.PENDING_APPROVAL, request.status());

        ApprovalCallbackResult result = orchestrator.handleApprovalDecision(new ApprovalDecision(
            request.approvalRequestId(), ApprovalDecision.Decision.REJECTED, "guardian-1", "not needed"));
        int processed = fixture.drainAll();

        // Then
        assertEquals(ApprovalCallbackResult.PROCESSED, result);
        assertEquals(ResetStatus.REJECTED, orchestrator.getResetStatus(request.requestId()).status());
        assertEquals(0, processed);
        assertEquals(before, fixture.namespace(LEARNER));
    }
}
