package com.ryuqq.privatefm.adapter.runner;

/**
 * 주기 작업 실행 결과 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SweepStatus {

    COMPLETED,

    /**
     * 설정으로 비활성화되어 실행하지 않음.
     */
    DISABLED,

    /**
     * 배치 사이에서 취소되거나 인터럽트됨.
     */
    CANCELLED,

    /**
     * 항목 단위가 아닌 작업 전체가 실패함.
     */
    FAILED
}
