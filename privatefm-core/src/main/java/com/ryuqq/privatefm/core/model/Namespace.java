package com.ryuqq.privatefm.core.model;

import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;
import com.ryuqq.privatefm.core.statemachine.NamespaceTransitions;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 학습자별 격리된 모델 Namespace.
 *
 * <p>학습자당 정확히 하나 존재하며, 과목(subject)별 개인화 Adapter를 보유합니다.
 * 삭제는 soft delete(DELETED 상태)로만 이루어집니다.</p>
 *
 * <p><strong>불변 조건:</strong></p>
 * <ul>
 *   <li>versionCount는 Merge 완료 시에만 증가하며, Fallback 완료 시 1로 초기화됩니다.</li>
 *   <li>subjects는 최대 {@value #MAX_SUBJECTS}개입니다.</li>
 *   <li>상태 변경은 {@link NamespaceTransitions}로 검증됩니다.</li>
 * </ul>
 *
 * @param id Namespace ID
 * @param learnerId 학습자 ID
 * @param nsUid 파생된 불투명 식별자 (저장소 키 접두사)
 * @param status 현재 상태
 * @param subjects 과목 코드 집합 (불변)
 * @param baseFmVersion 기반 Foundation Model 버전
 * @param currentCheckpointHash 현재 체크포인트 해시 (Merge 전에는 null)
 * @param versionCount Merge 횟수 카운터
 * @param createdAt 생성 시각
 * @param updatedAt 최종 수정 시각
 * @param lastMergeAt 마지막 Merge 완료 시각 (null 가능)
 * @param lastFallbackAt 마지막 Fallback 시작 시각 (null 가능)
 * @param isolationConfig 격리 설정 (불변)
 * @param mergeConfig Merge 설정 (불변)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Namespace(
    NamespaceId id,
    LearnerId learnerId,
    String nsUid,
    NamespaceStatus status,
    Set<String> subjects,
    String baseFmVersion,
    String currentCheckpointHash,
    int versionCount,
    Instant createdAt,
    Instant updatedAt,
    Instant lastMergeAt,
    Instant lastFallbackAt,
    Map<String, Object> isolationConfig,
    Map<String, Object> mergeConfig
) {

    public static final int MAX_SUBJECTS = 50;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 없거나 subject 수가 초과된 경우
     */
    public Namespace {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (learnerId == null) {
            throw new IllegalArgumentException("learnerId cannot be null");
        }
        if (nsUid == null || nsUid.isBlank()) {
            throw new IllegalArgumentException("nsUid cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (baseFmVersion == null || baseFmVersion.isBlank()) {
            throw new IllegalArgumentException("baseFmVersion cannot be null or blank");
        }
        if (versionCount < 0) {
            throw new IllegalArgumentException("versionCount must be non-negative (current: " + versionCount + ")");
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("createdAt and updatedAt cannot be null");
        }
        subjects = subjects == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(subjects));
        if (subjects.size() > MAX_SUBJECTS) {
            throw new IllegalArgumentException(
                "subjects cannot exceed " + MAX_SUBJECTS + " (current: " + subjects.size() + ")"
            );
        }
        isolationConfig = isolationConfig == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(isolationConfig));
        mergeConfig = mergeConfig == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(mergeConfig));
    }

    /**
     * 새 Namespace 생성 (INITIALIZING 상태).
     */
    public static Namespace initializing(
        NamespaceId id,
        LearnerId learnerId,
        String nsUid,
        Set<String> subjects,
        String baseFmVersion,
        Map<String, Object> isolationConfig,
        Map<String, Object> mergeConfig,
        Instant now
    ) {
        return new Namespace(id, learnerId, nsUid, NamespaceStatus.INITIALIZING, subjects, baseFmVersion,
            null, 0, now, now, null, null, isolationConfig, mergeConfig);
    }

    /**
     * 상태 전이 (검증 후 새 인스턴스 반환).
     *
     * @param next 다음 상태
     * @param now 변경 시각
     * @return 전이된 Namespace
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public Namespace transitionTo(NamespaceStatus next, Instant now) {
        NamespaceTransitions.validate(status, next);
        return new Namespace(id, learnerId, nsUid, next, subjects, baseFmVersion, currentCheckpointHash,
            versionCount, createdAt, now, lastMergeAt, lastFallbackAt, isolationConfig, mergeConfig);
    }

    /**
     * Merge 완료 반영: 새 체크포인트, versionCount 증가, ACTIVE 복귀.
     *
     * @param checkpointHash 새 체크포인트 해시
     * @param now 완료 시각
     * @return 갱신된 Namespace
     */
    public Namespace mergeCompleted(String checkpointHash, Instant now) {
        NamespaceTransitions.validate(status, NamespaceStatus.ACTIVE);
        return new Namespace(id, learnerId, nsUid, NamespaceStatus.ACTIVE, subjects, baseFmVersion, checkpointHash,
            versionCount + 1, createdAt, now, now, lastFallbackAt, isolationConfig, mergeConfig);
    }

    /**
     * Fallback 시작 반영.
     */
    public Namespace fallbackStarted(Instant now) {
        NamespaceTransitions.validate(status, NamespaceStatus.FALLBACK);
        return new Namespace(id, learnerId, nsUid, NamespaceStatus.FALLBACK, subjects, baseFmVersion,
            currentCheckpointHash, versionCount, createdAt, now, lastMergeAt, now, isolationConfig, mergeConfig);
    }

    /**
     * Fallback 완료 반영: 대상 버전으로 재기반, versionCount=1, ACTIVE 복귀.
     */
    public Namespace fallbackCompleted(String targetFmVersion, String checkpointHash, Instant now) {
        NamespaceTransitions.validate(status, NamespaceStatus.ACTIVE);
        return new Namespace(id, learnerId, nsUid, NamespaceStatus.ACTIVE, subjects, targetFmVersion,
            checkpointHash, 1, createdAt, now, lastMergeAt, lastFallbackAt, isolationConfig, mergeConfig);
    }

    /**
     * subject가 이 Namespace에 속하는지 확인.
     */
    public boolean hasSubject(String subject) {
        return subject != null && subjects.contains(subject);
    }
}
