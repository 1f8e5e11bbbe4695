package com.ryuqq.privatefm.core.statemachine;

import java.util.EnumSet;
import java.util.Set;

/**
 * Namespace 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>INITIALIZING → ACTIVE</li>
 *   <li>ACTIVE → MERGING, FALLBACK, CORRUPTED, DELETED</li>
 *   <li>MERGING → ACTIVE, FALLBACK, CORRUPTED</li>
 *   <li>FALLBACK → ACTIVE, CORRUPTED</li>
 *   <li>CORRUPTED → ACTIVE (Adapter Reset), FALLBACK (수동 복구)</li>
 * </ul>
 *
 * <p>DELETED에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NamespaceTransitions {

    private NamespaceTransitions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 주어진 상태에서 전이 가능한 상태 집합.
     *
     * @param from 현재 상태
     * @return 전이 가능한 상태 (불변 아님, 호출자 소유)
     * @throws IllegalArgumentException from이 null인 경우
     */
    public static Set<NamespaceStatus> allowedFrom(NamespaceStatus from) {
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        switch (from) {
            case INITIALIZING:
                return EnumSet.of(NamespaceStatus.ACTIVE);
            case ACTIVE:
                return EnumSet.of(NamespaceStatus.MERGING, NamespaceStatus.FALLBACK,
                    NamespaceStatus.CORRUPTED, NamespaceStatus.DELETED);
            case MERGING:
                return EnumSet.of(NamespaceStatus.ACTIVE, NamespaceStatus.FALLBACK, NamespaceStatus.CORRUPTED);
            case FALLBACK:
                return EnumSet.of(NamespaceStatus.ACTIVE, NamespaceStatus.CORRUPTED);
            case CORRUPTED:
                return EnumSet.of(NamespaceStatus.ACTIVE, NamespaceStatus.FALLBACK);
            default:
                return EnumSet.noneOf(NamespaceStatus.class);
        }
    }

    /**
     * 상태 전이가 허용되는지 확인.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     */
    public static boolean isAllowed(NamespaceStatus from, NamespaceStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return allowedFrom(from).contains(to);
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(NamespaceStatus from, NamespaceStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid namespace transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static NamespaceStatus transition(NamespaceStatus current, NamespaceStatus next) {
        validate(current, next);
        return next;
    }
}
