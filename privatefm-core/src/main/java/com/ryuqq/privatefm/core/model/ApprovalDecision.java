package com.ryuqq.privatefm.core.model;

/**
 * 승인 서비스 콜백으로 전달되는 결정.
 *
 * @param approvalRequestId 승인 요청 ID
 * @param decision 승인/거절
 * @param decidedBy 결정자
 * @param reason 결정 사유 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ApprovalDecision(
    String approvalRequestId,
    Decision decision,
    String decidedBy,
    String reason
) {

    /**
     * 결정 종류.
     */
    public enum Decision {
        APPROVED,
        REJECTED
    }

    public ApprovalDecision {
        if (approvalRequestId == null || approvalRequestId.isBlank()) {
            throw new IllegalArgumentException("approvalRequestId cannot be null or blank");
        }
        if (decision == null) {
            throw new IllegalArgumentException("decision cannot be null");
        }
        if (decidedBy == null || decidedBy.isBlank()) {
            throw new IllegalArgumentException("decidedBy cannot be null or blank");
        }
    }
}
