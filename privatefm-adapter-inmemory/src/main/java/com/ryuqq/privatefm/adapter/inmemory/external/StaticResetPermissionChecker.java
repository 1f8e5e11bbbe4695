package com.ryuqq.privatefm.adapter.inmemory.external;

import com.ryuqq.privatefm.core.model.LearnerId;
import com.ryuqq.privatefm.core.spi.ResetPermissionChecker;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ResetPermissionChecker} backed by an explicit grant table.
 *
 * <p>No grants by default, so teachers need approval.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StaticResetPermissionChecker implements ResetPermissionChecker {

    private final Set<String> grants = ConcurrentHashMap.newKeySet();
    private volatile boolean failing;

    @Override
    public boolean canResetWithoutApproval(String teacherId, LearnerId learnerId) {
        if (failing) {
            throw new IllegalStateException("Permission service unavailable");
        }
        return grants.contains(key(teacherId, learnerId));
    }

    public void grant(String teacherId, LearnerId learnerId) {
        grants.add(key(teacherId, learnerId));
    }

    public void revoke(String teacherId, LearnerId learnerId) {
        grants.remove(key(teacherId, learnerId));
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    private static String key(String teacherId, LearnerId learnerId) {
        return teacherId + "|" + learnerId.getValue();
    }
}
