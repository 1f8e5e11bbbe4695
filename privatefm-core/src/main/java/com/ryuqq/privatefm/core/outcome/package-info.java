/**
 * 비동기 작업 실행 결과 타입.
 *
 * <p>Merge, Fallback, Adapter Reset 실행은 모두 {@link com.ryuqq.privatefm.core.outcome.Outcome}을
 * 반환하며, 결과는 각 작업 레코드에 영속화됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.privatefm.core.outcome;
