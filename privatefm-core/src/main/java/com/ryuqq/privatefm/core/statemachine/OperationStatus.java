package com.ryuqq.privatefm.core.statemachine;

/**
 * 비동기 작업(Merge, Fallback)의 생명주기 상태.
 *
 * <pre>
 * PENDING
 *    │
 *    ├─► CANCELLED (실행 전 취소)
 *    ▼
 * RUNNING
 *    │
 *    ├─► COMPLETED (성공)
 *    │
 *    └─► FAILED (실패)
 * </pre>
 *
 * <p>PENDING 또는 RUNNING 상태의 작업을 "활성" 작업이라 부르며,
 * Namespace당 활성 Merge 작업은 최대 하나입니다 (force 제외).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum OperationStatus {

    PENDING,

    RUNNING,

    COMPLETED,

    FAILED,

    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * 활성 상태인지 확인.
     *
     * @return PENDING 또는 RUNNING인 경우 true
     */
    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }
}
