package com.ryuqq.privatefm.core.exception;

/**
 * 현재 상태와 충돌하는 요청.
 *
 * <p>이미 존재하는 Namespace 생성, 활성 Merge 중복, ACTIVE가 아닌 Namespace에 대한
 * Merge 요청, 진행 중인 Adapter Reset 중복 요청 등에 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConflictException extends OrchestratorException {

    public ConflictException(String message) {
        super("CONFLICT", message);
    }
}
