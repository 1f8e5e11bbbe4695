package com.ryuqq.privatefm.core.exception;

/**
 * 학습자 또는 ID에 해당하는 Namespace가 없음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class NamespaceNotFoundException extends OrchestratorException {

    public NamespaceNotFoundException(String message) {
        super("NAMESPACE_NOT_FOUND", message);
    }

    /**
     * 학습자 ID 기준 메시지로 생성.
     *
     * @param learnerId 학습자 ID
     * @return 예외 인스턴스
     */
    public static NamespaceNotFoundException forLearner(String learnerId) {
        return new NamespaceNotFoundException("Namespace not found for learner: " + learnerId);
    }
}
