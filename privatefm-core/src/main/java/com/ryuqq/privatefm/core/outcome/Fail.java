package com.ryuqq.privatefm.core.outcome;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p><strong>오류 코드 예시:</strong></p>
 * <ul>
 *   <li>MERGE_FAILED: Merge 단계 실패 (재시도 소진 포함)</li>
 *   <li>CHECKPOINT_CORRUPTED: 체크포인트 손상 (Namespace → CORRUPTED)</li>
 *   <li>FALLBACK_FAILED: Fallback 복구 실패</li>
 *   <li>RESET_FAILED: Adapter Reset 실패</li>
 *   <li>INVALID_STATE: 실행 시점 Namespace 상태 불일치</li>
 * </ul>
 *
 * @param errorCode 오류 코드
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail(
    String errorCode,
    String message,
    String cause
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * Fail 생성 (cause 포함).
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param cause 원인
     * @return Fail 인스턴스
     */
    public static Fail of(String errorCode, String message, String cause) {
        return new Fail(errorCode, message, cause);
    }

    /**
     * cause 없이 Fail 생성.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @return Fail 인스턴스
     */
    public static Fail of(String errorCode, String message) {
        return new Fail(errorCode, message, null);
    }
}
