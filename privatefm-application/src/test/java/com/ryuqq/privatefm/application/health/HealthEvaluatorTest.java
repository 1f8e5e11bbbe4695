package com.ryuqq.privatefm.application.health;

import com.ryuqq.privatefm.application.checkpoint.CheckpointManager;
import com.ryuqq.privatefm.application.support.InMemoryContextFixture;
import com.ryuqq.privatefm.core.model.LearnerId;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.model.NamespaceHealth;
import com.ryuqq.privatefm.core.model.NamespaceId;
import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * HealthEvaluator 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class HealthEvaluatorTest {

    @Mock
    private CheckpointManager checkpointManager;

    private InMemoryContextFixture fixture;
    private HealthEvaluator evaluator;

    @BeforeEach
    void setUp() {
        fixture = new InMemoryContextFixture();
        evaluator = new HealthEvaluator(fixture.context(), checkpointManager);
    }

    private Namespace namespace(NamespaceStatus status, String baseVersion, String hash, Instant lastMergeAt) {
        Instant created = InMemoryContextFixture.START;
        return new Namespace(NamespaceId.of("ns-1"), LearnerId.of("learner-1"), "uid-1", status, Set.of("math"),
            baseVersion, hash, hash == null ? 0 : 1, created, created, lastMergeAt, null, null, null);
    }

    // ============================================================
    // versionLag
    // ============================================================

    @Test
    void versionLag_하이픈v_뒤_숫자합의_차이() {
        assertThat(HealthEvaluator.versionLag("fm-v1.0", "fm-v1.4")).isEqualTo(4);
        assertThat(HealthEvaluator.versionLag("fm-v2.3.1", "fm-v3.0.0")).isEqualTo(-3);
    }

    @Test
    void versionLag_형식이_맞지_않으면_0() {
        assertThat(HealthEvaluator.versionLag("latest", "fm-v1.4")).isZero();
        assertThat(HealthEvaluator.versionLag("fm-v1.x", "fm-v1.4")).isZero();
        assertThat(HealthEvaluator.versionLag(null, "fm-v1.4")).isZero();
    }

    // ============================================================
    // evaluate
    // ============================================================

    @Test
    void evaluate_체크포인트가_없는_새_Namespace는_건강함() {
        // when
        NamespaceHealth health = evaluator.evaluate(namespace(NamespaceStatus.ACTIVE, "fm-v1.0", null, null));

        // then
        assertThat(health.healthy()).isTrue();
        assertThat(health.integrityScore()).isEqualTo(1.0);
        assertThat(health.lastMergeAgoHours()).isNull();
        assertThat(health.issues()).isEmpty();
        verifyNoInteractions(checkpointManager);
    }

    @Test
    void evaluate_무결성_마커가_없으면_점수_0과_즉시_fallback_권고() {
        // given
        when(checkpointManager.verifyIntegrity("hash-1")).thenReturn(false);

        // when
        NamespaceHealth health = evaluator.evaluate(namespace(NamespaceStatus.ACTIVE, "fm-v1.0", "hash-1",
            InMemoryContextFixture.START));

        // then
        assertThat(health.healthy()).isFalse();
        assertThat(health.integrityScore()).isZero();
        assertThat(health.issues()).containsExactly(HealthEvaluator.INTEGRITY_FAILED_ISSUE);
        assertThat(health.recommendations()).containsExactly(HealthEvaluator.RECOMMEND_IMMEDIATE_FALLBACK);
    }

    @Test
    void evaluate_버전_지연이_한도를_넘으면_fallback_권고() {
        // given
        fixture.modelRegistry.setLatestVersion("fm-v1.4");

        // when
        NamespaceHealth health = evaluator.evaluate(namespace(NamespaceStatus.ACTIVE, "fm-v1.0", null, null));

        // then
        assertThat(health.versionLag()).isEqualTo(4);
        assertThat(health.healthy()).isFalse();
        assertThat(health.issues()).containsExactly("Version lag of 4 exceeds maximum of 3");
        assertThat(health.recommendations()).containsExactly(HealthEvaluator.RECOMMEND_FALLBACK);
    }

    @Test
    void evaluate_마지막_Merge가_48시간을_넘으면_Merge_권고() {
        // given
        when(checkpointManager.verifyIntegrity("hash-1")).thenReturn(true);
        Instant lastMerge = InMemoryContextFixture.START;
        fixture.clock.advance(Duration.ofHours(49).plusMinutes(30));

        // when
        NamespaceHealth health = evaluator.evaluate(namespace(NamespaceStatus.ACTIVE, "fm-v1.0", "hash-1", lastMerge));

        // then
        assertThat(health.lastMergeAgoHours()).isEqualTo(49.0);
        assertThat(health.issues()).containsExactly("No merge in 49 hours");
        assertThat(health.recommendations()).containsExactly(HealthEvaluator.RECOMMEND_MERGE);
    }

    @Test
    void evaluate_정확히_48시간이면_지연으로_보지_않음() {
        when(checkpointManager.verifyIntegrity("hash-1")).thenReturn(true);
        fixture.clock.advance(Duration.ofHours(48));

        NamespaceHealth health = evaluator.evaluate(namespace(NamespaceStatus.ACTIVE, "fm-v1.0", "hash-1",
            InMemoryContextFixture.START));

        assertThat(health.healthy()).isTrue();
    }

    @Test
    void evaluate_ACTIVE가_아니면_문제가_없어도_건강하지_않음() {
        NamespaceHealth health = evaluator.evaluate(namespace(NamespaceStatus.MERGING, "fm-v1.0", null, null));

        assertThat(health.issues()).isEmpty();
        assertThat(health.healthy()).isFalse();
        assertThat(health.status()).isEqualTo(NamespaceStatus.MERGING);
    }
}
