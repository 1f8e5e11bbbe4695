package com.ryuqq.privatefm.adapter.runner;

import com.ryuqq.privatefm.adapter.inmemory.store.InMemoryCheckpointStore;
import com.ryuqq.privatefm.adapter.inmemory.time.MutableClock;
import com.ryuqq.privatefm.application.checkpoint.StorageKeys;
import com.ryuqq.privatefm.core.spi.CheckpointStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;

/**
 * JobStatsRecorder 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class JobStatsRecorderTest {

    private static final Instant NOW = Instant.parse("2026-03-01T23:30:00Z");

    @Mock
    private CheckpointStore failingStore;

    private MutableClock clock;
    private InMemoryCheckpointStore store;
    private JobStatsRecorder recorder;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new InMemoryCheckpointStore(clock);
        recorder = new JobStatsRecorder(store, clock, Duration.ofDays(7));
    }

    private SweepReport report(SweepStatus status) {
        return new SweepReport("cleanup", status, Map.of("checkpoints_cleaned", 3L),
            NOW, NOW.plus(Duration.ofMinutes(3)), null);
    }

    @Test
    void record_UTC_날짜별_키에_7일간_저장함() {
        // when
        boolean recorded = recorder.record(report(SweepStatus.COMPLETED));

        // then
        String key = StorageKeys.jobStats("cleanup", LocalDate.of(2026, 3, 1));
        assertThat(recorded).isTrue();
        assertThat(key).isEqualTo("job_stats:cleanup:20260301");
        assertThat(store.expiresAt(key)).contains(NOW.plus(Duration.ofDays(7)));
        assertThat(recorder.find("cleanup", LocalDate.of(2026, 3, 1)).orElseThrow())
            .containsEntry("checkpoints_cleaned", 3)
            .containsEntry("status", "completed")
            .containsEntry("duration_minutes", 3.0);
    }

    @Test
    void record_같은_날_재실행은_덮어씀() {
        recorder.record(report(SweepStatus.COMPLETED));
        recorder.record(new SweepReport("cleanup", SweepStatus.FAILED, Map.of(), NOW, NOW, "store down"));

        assertThat(recorder.find("cleanup", recorder.today()).orElseThrow())
            .containsEntry("status", "failed")
            .containsEntry("fatal_error", "store down")
            .doesNotContainKey("checkpoints_cleaned");
    }

    @Test
    void record_DISABLED는_기록하지_않음() {
        assertThat(recorder.record(SweepReport.disabled("cleanup", NOW))).isFalse();
        assertThat(store.size()).isZero();
    }

    @Test
    void record_저장소_실패는_false를_반환하고_전파하지_않음() {
        // given
        doThrow(new IllegalStateException("store down")).when(failingStore).put(anyString(), any(), any());
        JobStatsRecorder failing = new JobStatsRecorder(failingStore, clock, Duration.ofDays(7));

        // when / then
        assertThat(failing.record(report(SweepStatus.COMPLETED))).isFalse();
    }

    @Test
    void 생성자_보존기간이_양수가_아니면_IllegalArgumentException() {
        assertThatThrownBy(() -> new JobStatsRecorder(store, clock, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
