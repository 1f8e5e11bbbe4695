package com.ryuqq.privatefm.core.model;

import java.time.Instant;

/**
 * 체크포인트 메타데이터.
 *
 * @param hash 체크포인트 해시 (식별자)
 * @param namespaceId Namespace ID
 * @param fmVersion Foundation Model 버전
 * @param version Namespace versionCount
 * @param sizeBytes 체크포인트 크기
 * @param createdAt 생성 시각
 * @param integrityVerified 무결성 마커 존재 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CheckpointInfo(
    String hash,
    NamespaceId namespaceId,
    String fmVersion,
    int version,
    long sizeBytes,
    Instant createdAt,
    boolean integrityVerified
) {

    public CheckpointInfo {
        if (hash == null || hash.isBlank()) {
            throw new IllegalArgumentException("hash cannot be null or blank");
        }
        if (namespaceId == null) {
            throw new IllegalArgumentException("namespaceId cannot be null");
        }
    }
}
