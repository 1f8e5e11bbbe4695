package com.ryuqq.privatefm.core.model;

import java.time.Instant;

/**
 * Namespace에 할당된 격리 리소스.
 *
 * @param namespaceId Namespace ID
 * @param nsUid 파생 식별자
 * @param memoryLimitMb 메모리 한도 (MB)
 * @param cpuLimitCores CPU 한도 (코어)
 * @param storageLimitGb 저장소 한도 (GB)
 * @param networkIsolation 네트워크 격리 여부
 * @param encryptionEnabled 암호화 여부
 * @param allocatedAt 할당 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ResourceQuota(
    NamespaceId namespaceId,
    String nsUid,
    int memoryLimitMb,
    double cpuLimitCores,
    double storageLimitGb,
    boolean networkIsolation,
    boolean encryptionEnabled,
    Instant allocatedAt
) {

    public ResourceQuota {
        if (namespaceId == null) {
            throw new IllegalArgumentException("namespaceId cannot be null");
        }
        if (nsUid == null || nsUid.isBlank()) {
            throw new IllegalArgumentException("nsUid cannot be null or blank");
        }
        if (memoryLimitMb <= 0 || cpuLimitCores <= 0 || storageLimitGb <= 0) {
            throw new IllegalArgumentException("resource limits must be positive");
        }
    }
}
