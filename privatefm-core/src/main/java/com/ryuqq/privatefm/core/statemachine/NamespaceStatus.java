package com.ryuqq.privatefm.core.statemachine;

/**
 * Namespace의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * INITIALIZING
 *    │
 *    ▼ (리소스 할당 완료)
 * ACTIVE ◄──────────────┐
 *    │                  │
 *    ├─► MERGING ───────┤ (Merge 완료/실패)
 *    │                  │
 *    ├─► FALLBACK ──────┘ (Fallback 완료)
 *    │
 *    ├─► CORRUPTED (ACTIVE, MERGING, FALLBACK 에서)
 *    │
 *    └─► DELETED (Guardian 인가 필요, 종료 상태)
 * </pre>
 *
 * <p>CORRUPTED는 자동 복구되지 않는 오류 상태이며, 수동 Fallback 또는
 * Adapter Reset으로만 ACTIVE로 돌아갈 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum NamespaceStatus {

    /**
     * 생성 중 (리소스 할당 전).
     */
    INITIALIZING,

    /**
     * 정상 동작 중.
     */
    ACTIVE,

    /**
     * Merge 실행 중.
     */
    MERGING,

    /**
     * Fallback 복구 진행 중.
     */
    FALLBACK,

    /**
     * 손상됨 (관리자 개입 필요).
     */
    CORRUPTED,

    /**
     * 삭제됨 (soft delete, 감사 보존).
     */
    DELETED;

    /**
     * 종료 상태인지 확인.
     *
     * @return DELETED인 경우 true
     */
    public boolean isTerminal() {
        return this == DELETED;
    }

    /**
     * 진행 중인 변경 작업(Merge/Fallback)이 있는 상태인지 확인.
     *
     * @return MERGING 또는 FALLBACK인 경우 true
     */
    public boolean isTransitional() {
        return this == MERGING || this == FALLBACK;
    }
}
