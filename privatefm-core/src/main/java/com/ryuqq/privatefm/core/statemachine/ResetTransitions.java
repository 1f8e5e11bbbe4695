package com.ryuqq.privatefm.core.statemachine;

/**
 * Adapter Reset 상태 전이 검증.
 *
 * <ul>
 *   <li>PENDING_APPROVAL → APPROVED, REJECTED, FAILED (승인 요청 생성 실패)</li>
 *   <li>APPROVED → EXECUTING, FAILED</li>
 *   <li>EXECUTING → EXECUTING (재전달), COMPLETED, FAILED</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResetTransitions {

    private ResetTransitions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ResetStatus from, ResetStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid;
        switch (from) {
            case PENDING_APPROVAL:
                valid = to == ResetStatus.APPROVED || to == ResetStatus.REJECTED
                    || to == ResetStatus.FAILED;
                break;
            case APPROVED:
                valid = to == ResetStatus.EXECUTING || to == ResetStatus.FAILED;
                break;
            case EXECUTING:
                valid = to == ResetStatus.EXECUTING || to == ResetStatus.COMPLETED
                    || to == ResetStatus.FAILED;
                break;
            default:
                valid = false;
        }

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid reset transition: %s → %s", from, to)
            );
        }
    }
}
