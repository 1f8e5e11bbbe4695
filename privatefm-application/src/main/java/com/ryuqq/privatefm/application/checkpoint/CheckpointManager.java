package com.ryuqq.privatefm.application.checkpoint;

import com.ryuqq.privatefm.application.context.OrchestratorContext;
import com.ryuqq.privatefm.application.support.Hashing;
import com.ryuqq.privatefm.application.support.Jsons;
import com.ryuqq.privatefm.core.exception.FatalException;
import com.ryuqq.privatefm.core.model.CheckpointInfo;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.model.NamespaceId;
import com.ryuqq.privatefm.core.spi.CheckpointStore;
import com.ryuqq.privatefm.core.spi.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 체크포인트 해시 생성, 저장, 무결성 검증과 과목 Adapter 파일 관리.
 *
 * <p>체크포인트 해시는 {@code namespaceId:fmVersion:version:epochSeconds}의 SHA-256이며
 * 내용 digest가 아니라 식별자입니다. 무결성 검증은 마커 키의 존재 여부로 판단합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CheckpointManager {

    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);

    public static final long SIMULATED_CHECKPOINT_SIZE_BYTES = 50L * 1024 * 1024;

    private final CheckpointStore store;
    private final ModelRegistry modelRegistry;
    private final Clock clock;
    private final Duration retention;

    public CheckpointManager(OrchestratorContext context) {
        this.store = context.checkpointStore();
        this.modelRegistry = context.modelRegistry();
        this.clock = context.clock();
        this.retention = context.config().checkpointRetention();
    }

    /**
     * 체크포인트 해시 생성.
     *
     * @param namespaceId Namespace ID
     * @param fmVersion FM 버전
     * @param version Namespace 버전
     * @return 64자 hex 해시
     */
    public String generateHash(NamespaceId namespaceId, String fmVersion, int version) {
        long epochSeconds = clock.instant().getEpochSecond();
        return Hashing.sha256Hex(namespaceId.getValue() + ":" + fmVersion + ":" + version + ":" + epochSeconds);
    }

    /**
     * 체크포인트 메타데이터와 무결성 마커 저장 (보존 기간 만료 설정).
     *
     * @return 저장된 체크포인트 정보
     */
    public CheckpointInfo store(NamespaceId namespaceId, String hash, String fmVersion, int version) {
        Instant now = clock.instant();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("namespace_id", namespaceId.getValue());
        metadata.put("hash", hash);
        metadata.put("fm_version", fmVersion);
        metadata.put("version", version);
        metadata.put("created_at", now.toString());
        metadata.put("size_bytes", SIMULATED_CHECKPOINT_SIZE_BYTES);

        store.put(StorageKeys.checkpoint(hash), Jsons.toBytes(metadata), retention);
        store.put(StorageKeys.integrityMarker(hash),
            StorageKeys.INTEGRITY_VERIFIED.getBytes(StandardCharsets.UTF_8), retention);

        log.debug("Checkpoint stored: namespace={}, hash={}, version={}", namespaceId.getValue(), hash, version);
        return new CheckpointInfo(hash, namespaceId, fmVersion, version, SIMULATED_CHECKPOINT_SIZE_BYTES, now, true);
    }

    /**
     * 무결성 마커 존재 여부.
     */
    public boolean verifyIntegrity(String hash) {
        return store.get(StorageKeys.integrityMarker(hash)).isPresent();
    }

    /**
     * 저장된 체크포인트 정보 조회.
     */
    public Optional<CheckpointInfo> find(String hash) {
        return store.get(StorageKeys.checkpoint(hash)).map(bytes -> {
            Map<String, Object> metadata = Jsons.toMap(bytes);
            return new CheckpointInfo(
                hash,
                NamespaceId.of(String.valueOf(metadata.get("namespace_id"))),
                String.valueOf(metadata.get("fm_version")),
                ((Number) metadata.getOrDefault("version", 0)).intValue(),
                ((Number) metadata.getOrDefault("size_bytes", 0L)).longValue(),
                Instant.parse(String.valueOf(metadata.get("created_at"))),
                verifyIntegrity(hash)
            );
        });
    }

    /**
     * 과목 Adapter와 중간 체크포인트 삭제.
     *
     * @return 삭제된 키 수
     */
    public int deleteSubjectAdapter(Namespace namespace, String subject) {
        int deleted = store.delete(StorageKeys.adapter(namespace.nsUid(), subject)) ? 1 : 0;
        List<String> checkpointKeys = store.listKeys(StorageKeys.subjectCheckpointPrefix(namespace.nsUid(), subject));
        for (String key : checkpointKeys) {
            if (store.delete(key)) {
                deleted++;
            }
        }
        log.info("Subject adapter deleted: nsUid={}, subject={}, keysDeleted={}", namespace.nsUid(), subject, deleted);
        return deleted;
    }

    /**
     * 기반 모델을 과목 Adapter 위치로 복제하고 학습 메타데이터를 초기화.
     *
     * @param namespace 대상 Namespace
     * @param subject 과목
     * @param fmVersion 복제할 FM 버전
     * @throws FatalException 기반 모델이 없는 경우
     */
    public void cloneBaseModel(Namespace namespace, String subject, String fmVersion) {
        byte[] baseModel = modelRegistry.getBaseModel(fmVersion, subject)
            .orElseThrow(() -> new FatalException(
                "Base model not found for subject " + subject + " (version " + fmVersion + ")"));

        store.put(StorageKeys.adapter(namespace.nsUid(), subject), baseModel);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("created_at", clock.instant().toString());
        metadata.put("base_fm_version", fmVersion);
        metadata.put("subject", subject);
        metadata.put("learner_id", namespace.learnerId().getValue());
        metadata.put("training_steps", 0);
        metadata.put("last_checkpoint", null);
        store.put(StorageKeys.trainingMetadata(namespace.nsUid(), subject), Jsons.toBytes(metadata));

        log.info("Base model cloned: nsUid={}, subject={}, fmVersion={}", namespace.nsUid(), subject, fmVersion);
    }

    /**
     * Namespace 소유 체크포인트 정리.
     *
     * <p>체크포인트 키는 해시로만 구성되므로 메타데이터의 {@code namespace_id}로 소유자를 판별하고
     * 메타데이터 키와 무결성 마커를 함께 삭제합니다.</p>
     *
     * @return 삭제된 키 수
     */
    public int deleteNamespaceCheckpoints(NamespaceId namespaceId) {
        int deleted = 0;
        for (String key : store.listKeys(StorageKeys.CHECKPOINT_PREFIX)) {
            String hash = StorageKeys.hashOf(key);
            if (hash == null || !ownedBy(key, namespaceId)) {
                continue;
            }
            if (store.delete(key)) {
                deleted++;
            }
            if (store.delete(StorageKeys.integrityMarker(hash))) {
                deleted++;
            }
        }
        log.debug("Namespace checkpoints deleted: namespace={}, keysDeleted={}", namespaceId.getValue(), deleted);
        return deleted;
    }

    private boolean ownedBy(String key, NamespaceId namespaceId) {
        Optional<byte[]> value = store.get(key);
        if (value.isEmpty()) {
            return false;
        }
        try {
            return namespaceId.getValue().equals(String.valueOf(Jsons.toMap(value.get()).get("namespace_id")));
        } catch (IllegalStateException e) {
            log.warn("Skipping unreadable checkpoint metadata: key={}, error={}", key, e.getMessage());
            return false;
        }
    }
}
