package com.ryuqq.privatefm.application.support;

import com.ryuqq.privatefm.core.exception.NamespaceNotFoundException;
import com.ryuqq.privatefm.core.exception.ValidationException;
import com.ryuqq.privatefm.core.model.LearnerId;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.spi.NamespaceRepository;

import java.util.Optional;

/**
 * 학습자 ID 문자열로 Namespace 조회.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NamespaceLookup {

    private NamespaceLookup() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @throws ValidationException 학습자 ID가 비어 있는 경우
     */
    public static LearnerId parseLearnerId(String learnerId) {
        try {
            return LearnerId.of(learnerId);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
    }

    public static Optional<Namespace> find(NamespaceRepository namespaces, String learnerId) {
        return namespaces.findByLearner(parseLearnerId(learnerId));
    }

    /**
     * @throws NamespaceNotFoundException Namespace가 없는 경우
     */
    public static Namespace require(NamespaceRepository namespaces, String learnerId) {
        return find(namespaces, learnerId).orElseThrow(() -> NamespaceNotFoundException.forLearner(learnerId));
    }
}
