package com.ryuqq.privatefm.application.metrics;

import com.ryuqq.privatefm.application.merge.MergeCoordinator;
import com.ryuqq.privatefm.application.support.InMemoryContextFixture;
import com.ryuqq.privatefm.core.exception.TransientException;
import com.ryuqq.privatefm.core.model.FallbackOperation;
import com.ryuqq.privatefm.core.model.FallbackReason;
import com.ryuqq.privatefm.core.model.MergeOperation;
import com.ryuqq.privatefm.core.model.MergeOperationType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OrchestratorMetrics 테스트.
 *
 * <p>SimpleMeterRegistry에 기록된 값을 직접 조회해 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OrchestratorMetricsTest {

    private InMemoryContextFixture fixture;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        fixture = new InMemoryContextFixture();
        registry = fixture.meterRegistry;
    }

    private double counter(String name, String tagKey, String tagValue) {
        Counter counter = registry.find(name).tag(tagKey, tagValue).counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Test
    void 생성자_registry가_null이면_IllegalArgumentException() {
        assertThatThrownBy(() -> new OrchestratorMetrics(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void namespace_gauge는_저장소의_상태별_수를_반영함() {
        // given
        fixture.createNamespace("learner-1", "math");
        fixture.createNamespace("learner-2", "science");

        // when
        double total = registry.get(OrchestratorMetrics.NAMESPACES_TOTAL).gauge().value();
        double active = registry.get(OrchestratorMetrics.NAMESPACES).tag("status", "active").gauge().value();
        double corrupted = registry.get(OrchestratorMetrics.NAMESPACES).tag("status", "corrupted").gauge().value();

        // then
        assertThat(total).isEqualTo(2.0);
        assertThat(active).isEqualTo(2.0);
        assertThat(corrupted).isZero();
    }

    @Test
    void merge_완료와_실패를_status별로_집계하고_소요시간을_기록함() {
        // given
        fixture.createNamespace("learner-1", "math");
        fixture.createNamespace("learner-2", "math");
        MergeCoordinator coordinator = fixture.services().mergeCoordinator();
        MergeOperation succeeds = coordinator.triggerMerge("learner-1", MergeOperationType.MANUAL, null, false);
        MergeOperation fails = coordinator.triggerMerge("learner-2", MergeOperationType.MANUAL, null, false);

        // when
        coordinator.executeMerge(succeeds.operationId());
        for (int i = 0; i < 3; i++) {
            fixture.adapterMerger.failNextWith(new TransientException("storage timeout"));
        }
        coordinator.executeMerge(fails.operationId());

        // then
        assertThat(counter(OrchestratorMetrics.MERGE_OPERATIONS, "status", "completed")).isEqualTo(1.0);
        assertThat(counter(OrchestratorMetrics.MERGE_OPERATIONS, "status", "failed")).isEqualTo(1.0);
        assertThat(registry.get(OrchestratorMetrics.OPERATION_DURATION)
            .tag("operation", "merge").tag("status", "completed").timer().count()).isEqualTo(1L);
    }

    @Test
    void fallback_완료를_집계함() {
        // given
        fixture.createNamespace("learner-1", "math");
        FallbackOperation operation = fixture.services().fallbackManager()
            .initiateFallback("learner-1", FallbackReason.MANUAL_REQUEST, null);

        // when
        fixture.services().fallbackManager().executeFallback(operation.operationId());

        // then
        assertThat(counter(OrchestratorMetrics.FALLBACK_OPERATIONS, "status", "completed")).isEqualTo(1.0);
        assertThat(registry.get(OrchestratorMetrics.OPERATION_DURATION)
            .tag("operation", "fallback").tag("status", "completed").timer().count()).isEqualTo(1L);
    }

    @Test
    void 음수_소요시간은_0으로_기록함() {
        // given
        OrchestratorMetrics metrics = new OrchestratorMetrics(new SimpleMeterRegistry());

        // when
        metrics.recordReset("COMPLETED", Duration.ofMillis(-5));

        // then
        assertThat(metrics.registry().get(OrchestratorMetrics.OPERATION_DURATION)
            .tag("operation", "adapter_reset").timer().totalTime(TimeUnit.MILLISECONDS))
            .isZero();
        assertThat(metrics.registry().get(OrchestratorMetrics.RESET_OPERATIONS)
            .tag("status", "completed").counter().count()).isEqualTo(1.0);
    }
}
