package com.ryuqq.privatefm.core.exception;

/**
 * 재시도 가능한 일시적 오류.
 *
 * <p>Merge Coordinator는 이 예외를 backoff와 함께 최대 시도 횟수까지 재시도합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TransientException extends OrchestratorException {

    public TransientException(String message) {
        super("TRANSIENT_ERROR", message);
    }

    public TransientException(String message, Throwable cause) {
        super("TRANSIENT_ERROR", message, cause);
    }
}
