package com.ryuqq.privatefm.core.model;

/**
 * Orchestrator가 기록하는 생명주기 이벤트 유형.
 *
 * <p>학습 이벤트(PROBLEM_SOLVED 등)는 외부에서 유입되며 여기에 정의하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NamespaceEventTypes {

    public static final String NAMESPACE_CREATED = "namespace_created";
    public static final String NAMESPACE_DELETED = "namespace_deleted";
    public static final String MERGE_INITIATED = "merge_initiated";
    public static final String MERGE_COMPLETED = "merge_completed";
    public static final String MERGE_FAILED = "merge_failed";
    public static final String MERGE_CANCELLED = "merge_cancelled";
    public static final String FALLBACK_INITIATED = "fallback_initiated";
    public static final String FALLBACK_COMPLETED = "fallback_completed";
    public static final String FALLBACK_FAILED = "fallback_failed";
    public static final String ADAPTER_RESET_COMPLETED = "adapter_reset_completed";

    private NamespaceEventTypes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
