package com.ryuqq.privatefm.core.exception;

/**
 * 입력값 검증 실패.
 *
 * <p>빈 learnerId, 과도한 subject 수, Namespace에 속하지 않은 subject 등.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ValidationException extends OrchestratorException {

    public ValidationException(String message) {
        super("VALIDATION_FAILED", message);
    }
}
