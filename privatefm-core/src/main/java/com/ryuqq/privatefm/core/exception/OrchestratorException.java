package com.ryuqq.privatefm.core.exception;

/**
 * Orchestrator 예외 계층의 최상위 타입.
 *
 * <p>모든 하위 예외는 unchecked이며, 관리 API 계층이 HTTP 상태 코드 등으로
 * 변환할 수 있도록 {@link #getErrorCode()}를 제공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OrchestratorException extends RuntimeException {

    private final String errorCode;

    /**
     * 생성자.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     */
    public OrchestratorException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param cause 원인 예외
     */
    public OrchestratorException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드
     */
    public String getErrorCode() {
        return errorCode;
    }
}
