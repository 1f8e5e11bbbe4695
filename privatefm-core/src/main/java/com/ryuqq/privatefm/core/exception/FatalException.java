package com.ryuqq.privatefm.core.exception;

/**
 * 복구 불가능한 오류 (예: 체크포인트 손상).
 *
 * <p>Merge 중 발생하면 Namespace를 CORRUPTED로 승격시킵니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FatalException extends OrchestratorException {

    public FatalException(String message) {
        super("FATAL_ERROR", message);
    }

    public FatalException(String message, Throwable cause) {
        super("FATAL_ERROR", message, cause);
    }
}
