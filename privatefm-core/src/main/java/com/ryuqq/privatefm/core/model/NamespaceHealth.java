package com.ryuqq.privatefm.core.model;

import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;

import java.util.List;

/**
 * Namespace 건강 상태 보고서.
 *
 * @param namespaceId Namespace ID
 * @param learnerId 학습자 ID
 * @param status 평가 시점 상태
 * @param healthy 문제 없음 여부
 * @param lastMergeAgoHours 마지막 Merge 이후 경과 시간 (Merge 이력이 없으면 null)
 * @param versionLag 최신 FM 버전 대비 지연
 * @param integrityScore 체크포인트 무결성 점수 (0.0 ~ 1.0)
 * @param issues 발견된 문제 목록
 * @param recommendations 권장 조치 목록
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record NamespaceHealth(
    NamespaceId namespaceId,
    LearnerId learnerId,
    NamespaceStatus status,
    boolean healthy,
    Double lastMergeAgoHours,
    int versionLag,
    double integrityScore,
    List<String> issues,
    List<String> recommendations
) {

    public NamespaceHealth {
        if (namespaceId == null || learnerId == null || status == null) {
            throw new IllegalArgumentException("namespaceId, learnerId and status cannot be null");
        }
        if (integrityScore < 0.0 || integrityScore > 1.0) {
            throw new IllegalArgumentException("integrityScore must be 0.0..1.0 (current: " + integrityScore + ")");
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
