package com.ryuqq.privatefm.core.exception;

/**
 * Guardian 인가 실패.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class UnauthorizedException extends OrchestratorException {

    public UnauthorizedException(String message) {
        super("UNAUTHORIZED", message);
    }
}
