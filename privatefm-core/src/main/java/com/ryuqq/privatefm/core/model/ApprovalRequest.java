package com.ryuqq.privatefm.core.model;

import java.util.Map;

/**
 * 외부 승인 서비스로 보내는 승인 요청.
 *
 * @param type 요청 유형 (예: ADAPTER_RESET)
 * @param learnerId 학습자 ID
 * @param requestedBy 요청자
 * @param requesterRole 요청자 역할
 * @param reason 요청 사유
 * @param details 부가 정보 (불변)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ApprovalRequest(
    String type,
    LearnerId learnerId,
    String requestedBy,
    String requesterRole,
    String reason,
    Map<String, Object> details
) {

    public static final String TYPE_ADAPTER_RESET = "ADAPTER_RESET";

    public ApprovalRequest {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (learnerId == null) {
            throw new IllegalArgumentException("learnerId cannot be null");
        }
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
