package com.ryuqq.privatefm.application.reset;

import com.ryuqq.privatefm.core.model.LearnerId;
import com.ryuqq.privatefm.core.spi.ResetPermissionChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Adapter Reset 승인 필요 여부 결정.
 *
 * <ul>
 *   <li>guardian: 자동 승인</li>
 *   <li>teacher: 권한이 부여된 경우만 자동 승인 (권한 확인 실패 시 승인 필요)</li>
 *   <li>그 외 역할: 승인 필요</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ResetApprovalPolicy {

    private static final Logger log = LoggerFactory.getLogger(ResetApprovalPolicy.class);

    public static final String ROLE_GUARDIAN = "guardian";
    public static final String ROLE_TEACHER = "teacher";

    private final ResetPermissionChecker permissionChecker;

    public ResetApprovalPolicy(ResetPermissionChecker permissionChecker) {
        if (permissionChecker == null) {
            throw new IllegalArgumentException("permissionChecker cannot be null");
        }
        this.permissionChecker = permissionChecker;
    }

    public boolean requiresApproval(String requesterRole, String requestedBy, LearnerId learnerId) {
        String role = requesterRole == null ? "" : requesterRole.toLowerCase(Locale.ROOT);
        if (ROLE_GUARDIAN.equals(role)) {
            return false;
        }
        if (ROLE_TEACHER.equals(role)) {
            try {
                return !permissionChecker.canResetWithoutApproval(requestedBy, learnerId);
            } catch (RuntimeException e) {
                log.warn("Reset permission check failed, approval required: teacher={}, learner={}, error={}",
                    requestedBy, learnerId.getValue(), e.getMessage());
                return true;
            }
        }
        return true;
    }
}
