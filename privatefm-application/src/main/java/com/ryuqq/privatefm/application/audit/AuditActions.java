package com.ryuqq.privatefm.application.audit;

/**
 * 감사 기록 액션과 리소스 유형.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AuditActions {

    public static final String RESOURCE_ADAPTER_RESET = "adapter_reset";

    public static final String ADAPTER_RESET_REQUESTED = "ADAPTER_RESET_REQUESTED";
    public static final String ADAPTER_RESET_APPROVED = "ADAPTER_RESET_APPROVED";
    public static final String ADAPTER_RESET_REJECTED = "ADAPTER_RESET_REJECTED";
    public static final String ADAPTER_RESET_COMPLETED = "ADAPTER_RESET_COMPLETED";

    private AuditActions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
