package com.ryuqq.privatefm.application.checkpoint;

import com.ryuqq.privatefm.application.support.InMemoryContextFixture;
import com.ryuqq.privatefm.application.support.Jsons;
import com.ryuqq.privatefm.core.exception.FatalException;
import com.ryuqq.privatefm.core.model.CheckpointInfo;
import com.ryuqq.privatefm.core.model.Namespace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CheckpointManager 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CheckpointManagerTest {

    private InMemoryContextFixture fixture;
    private CheckpointManager manager;

    @BeforeEach
    void setUp() {
        fixture = new InMemoryContextFixture();
        manager = fixture.services().checkpointManager();
    }

    // ============================================================
    // hash / store / verify
    // ============================================================

    @Test
    void generateHash_같은_입력과_같은_초면_같은_해시() {
        Namespace namespace = fixture.createNamespace("learner-1", "math");

        String first = manager.generateHash(namespace.id(), "fm-v1.0", 1);
        String second = manager.generateHash(namespace.id(), "fm-v1.0", 1);
        fixture.clock.advance(Duration.ofSeconds(1));
        String later = manager.generateHash(namespace.id(), "fm-v1.0", 1);

        assertThat(first).hasSize(64).isEqualTo(second).isNotEqualTo(later);
        assertThat(manager.generateHash(namespace.id(), "fm-v1.0", 2)).isNotEqualTo(first);
    }

    @Test
    void store_메타데이터와_무결성_마커를_저장함() {
        // given
        Namespace namespace = fixture.createNamespace("learner-1", "math");
        String hash = manager.generateHash(namespace.id(), "fm-v1.0", 1);

        // when
        CheckpointInfo info = manager.store(namespace.id(), hash, "fm-v1.0", 1);

        // then
        assertThat(info.integrityVerified()).isTrue();
        assertThat(manager.verifyIntegrity(hash)).isTrue();
        assertThat(new String(fixture.checkpointStore.get(StorageKeys.integrityMarker(hash)).orElseThrow(),
            StandardCharsets.UTF_8)).isEqualTo(StorageKeys.INTEGRITY_VERIFIED);
        assertThat(manager.find(hash)).hasValueSatisfying(found -> {
            assertThat(found.version()).isEqualTo(1);
            assertThat(found.fmVersion()).isEqualTo("fm-v1.0");
            assertThat(found.sizeBytes()).isEqualTo(CheckpointManager.SIMULATED_CHECKPOINT_SIZE_BYTES);
        });
    }

    @Test
    void store_보존_기간이_지나면_무결성_검증_실패() {
        Namespace namespace = fixture.createNamespace("learner-1", "math");
        String hash = manager.generateHash(namespace.id(), "fm-v1.0", 1);
        manager.store(namespace.id(), hash, "fm-v1.0", 1);

        fixture.clock.advance(Duration.ofDays(30));

        assertThat(manager.verifyIntegrity(hash)).isFalse();
        assertThat(manager.find(hash)).isEmpty();
    }

    // ============================================================
    // subject adapters
    // ============================================================

    @Test
    void cloneBaseModel_Adapter와_학습_메타데이터를_초기화함() {
        // given
        Namespace namespace = fixture.createNamespace("learner-1", "math");

        // when
        manager.cloneBaseModel(namespace, "math", "fm-v1.0");

        // then
        assertThat(fixture.checkpointStore.get(StorageKeys.adapter(namespace.nsUid(), "math"))).isPresent();
        Map<String, Object> metadata = Jsons.toMap(
            fixture.checkpointStore.get(StorageKeys.trainingMetadata(namespace.nsUid(), "math")).orElseThrow());
        assertThat(metadata)
            .containsEntry("subject", "math")
            .containsEntry("learner_id", "learner-1")
            .containsEntry("training_steps", 0)
            .containsEntry("base_fm_version", "fm-v1.0");
    }

    @Test
    void cloneBaseModel_기반_모델이_없으면_FatalException() {
        Namespace namespace = fixture.createNamespace("learner-1", "math");
        fixture.modelRegistry.removeBaseModel("fm-v9.9", "math");

        assertThatThrownBy(() -> manager.cloneBaseModel(namespace, "math", "fm-v9.9"))
            .isInstanceOf(FatalException.class)
            .hasMessageContaining("Base model not found");
    }

    @Test
    void deleteSubjectAdapter_Adapter와_과목_체크포인트만_삭제함() {
        // given
        Namespace namespace = fixture.createNamespace("learner-1", "math", "science");
        manager.cloneBaseModel(namespace, "math", "fm-v1.0");
        manager.cloneBaseModel(namespace, "science", "fm-v1.0");
        String mathCheckpoint = StorageKeys.subjectCheckpointPrefix(namespace.nsUid(), "math") + "step-1";
        fixture.checkpointStore.put(mathCheckpoint, new byte[] {1});

        // when
        int deleted = manager.deleteSubjectAdapter(namespace, "math");

        // then
        assertThat(deleted).isEqualTo(2);
        assertThat(fixture.checkpointStore.get(StorageKeys.adapter(namespace.nsUid(), "math"))).isEmpty();
        assertThat(fixture.checkpointStore.get(StorageKeys.adapter(namespace.nsUid(), "science"))).isPresent();
        assertThat(fixture.checkpointStore.get(mathCheckpoint)).isEmpty();
    }

    @Test
    void deleteNamespaceCheckpoints_메타데이터의_namespace_id로_소유_체크포인트만_삭제함() {
        // given
        Namespace own = fixture.createNamespace("learner-1", "math");
        Namespace other = fixture.createNamespace("learner-2", "math");
        String first = manager.generateHash(own.id(), "fm-v1.0", 1);
        String second = manager.generateHash(own.id(), "fm-v1.0", 2);
        String foreign = manager.generateHash(other.id(), "fm-v1.0", 1);
        manager.store(own.id(), first, "fm-v1.0", 1);
        manager.store(own.id(), second, "fm-v1.0", 2);
        manager.store(other.id(), foreign, "fm-v1.0", 1);
        fixture.checkpointStore.put("checkpoint:legacy", "not-json".getBytes(StandardCharsets.UTF_8));

        // when
        int deleted = manager.deleteNamespaceCheckpoints(own.id());

        // then
        assertThat(deleted).isEqualTo(4);
        assertThat(manager.find(first)).isEmpty();
        assertThat(manager.verifyIntegrity(second)).isFalse();
        assertThat(manager.verifyIntegrity(foreign)).isTrue();
        assertThat(fixture.checkpointStore.get("checkpoint:legacy")).isPresent();
    }
}
