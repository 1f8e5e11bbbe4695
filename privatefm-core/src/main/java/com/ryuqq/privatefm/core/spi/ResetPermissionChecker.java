package com.ryuqq.privatefm.core.spi;

import com.ryuqq.privatefm.core.model.LearnerId;

/**
 * Checks whether a teacher may reset a learner's adapter without guardian approval.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResetPermissionChecker {

    /**
     * @param teacherId the requesting teacher
     * @param learnerId the learner
     * @return true if the teacher is granted direct reset permission
     * @throws RuntimeException if the check cannot be performed; callers treat this as "approval required"
     */
    boolean canResetWithoutApproval(String teacherId, LearnerId learnerId);
}
