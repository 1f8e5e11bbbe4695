package com.ryuqq.privatefm.core.model;

/**
 * Fallback 복구 사유.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FallbackReason {

    CORRUPTION_DETECTED,

    VERSION_LAG,

    MANUAL_REQUEST,

    INTEGRITY_FAILURE;

    /**
     * 이벤트 데이터/로그에 기록하는 소문자 표현.
     *
     * @return 예: "version_lag"
     */
    public String code() {
        return name().toLowerCase();
    }
}
