/**
 * 재시도 간격 계산과 대기 추상화.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.privatefm.core.retry;
