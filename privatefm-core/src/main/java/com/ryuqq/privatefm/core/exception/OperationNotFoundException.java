package com.ryuqq.privatefm.core.exception;

/**
 * 작업 ID 또는 Reset 요청 ID에 해당하는 레코드가 없음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OperationNotFoundException extends OrchestratorException {

    public OperationNotFoundException(String message) {
        super("OPERATION_NOT_FOUND", message);
    }
}
