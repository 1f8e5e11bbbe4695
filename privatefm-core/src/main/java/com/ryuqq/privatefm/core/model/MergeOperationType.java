package com.ryuqq.privatefm.core.model;

/**
 * Merge 작업 유형.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum MergeOperationType {

    /**
     * 야간 스케줄러가 생성한 정기 Merge.
     */
    NIGHTLY,

    /**
     * 관리 API를 통한 수동 Merge.
     */
    MANUAL,

    /**
     * Fallback 복구 과정의 Merge.
     */
    FALLBACK
}
