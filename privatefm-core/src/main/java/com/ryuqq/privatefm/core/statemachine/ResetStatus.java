package com.ryuqq.privatefm.core.statemachine;

/**
 * Adapter Reset 요청의 생명주기 상태.
 *
 * <pre>
 * PENDING_APPROVAL ──► REJECTED
 *    │
 *    ▼ (승인 콜백 또는 자동 승인)
 * APPROVED
 *    │
 *    ▼
 * EXECUTING ──► COMPLETED | FAILED
 * </pre>
 *
 * <p>(learner, subject) 쌍마다 종료되지 않은 요청은 최대 하나입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ResetStatus {

    PENDING_APPROVAL,

    APPROVED,

    REJECTED,

    EXECUTING,

    COMPLETED,

    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return REJECTED, COMPLETED, FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == REJECTED || this == COMPLETED || this == FAILED;
    }
}
