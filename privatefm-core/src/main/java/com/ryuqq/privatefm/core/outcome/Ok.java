package com.ryuqq.privatefm.core.outcome;

import com.ryuqq.privatefm.core.model.OperationId;

/**
 * 성공 결과.
 *
 * @param operationId 작업 ID (Merge/Fallback 작업 ID 또는 Reset 요청 ID)
 * @param message 성공 메시지 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok(
    OperationId operationId,
    String message
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException operationId가 null인 경우
     */
    public Ok {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
    }

    /**
     * 메시지 없이 성공 결과 생성.
     *
     * @param operationId 작업 ID
     * @return Ok 인스턴스
     */
    public static Ok of(OperationId operationId) {
        return new Ok(operationId, null);
    }
}
