package com.ryuqq.privatefm.core.statemachine;

/**
 * 작업 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING, CANCELLED, FAILED</li>
 *   <li>RUNNING → RUNNING (재전달 후 재개), COMPLETED, FAILED</li>
 * </ul>
 *
 * <p>PENDING → FAILED는 실행 전 검증 실패(예: Namespace 상태 불일치)를 위해 허용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OperationTransitions {

    private OperationTransitions() {
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
    public static void validate(OperationStatus from, OperationStatus to) {
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
            case PENDING:
                valid = to == OperationStatus.RUNNING || to == OperationStatus.CANCELLED
                    || to == OperationStatus.FAILED;
                break;
            case RUNNING:
                valid = to == OperationStatus.RUNNING || to == OperationStatus.COMPLETED
                    || to == OperationStatus.FAILED;
                break;
            default:
                valid = false;
        }

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid operation transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static OperationStatus transition(OperationStatus current, OperationStatus next) {
        validate(current, next);
        return next;
    }
}
