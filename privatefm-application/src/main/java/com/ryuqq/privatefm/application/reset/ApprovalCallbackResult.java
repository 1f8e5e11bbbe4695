package com.ryuqq.privatefm.application.reset;

/**
 * 승인 콜백 처리 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ApprovalCallbackResult {

    /** 요청 상태에 반영됨 */
    PROCESSED,

    /** 알 수 없는 승인 ID이거나 이미 결정된 요청 */
    IGNORED
}
