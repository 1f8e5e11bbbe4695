/**
 * Namespace, 작업, Adapter Reset 상태 머신.
 *
 * <p>모든 상태 전이는 {@code *Transitions.validate(from, to)}로 검증되며,
 * 저장소는 compare-and-set 방식으로 전이를 적용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.privatefm.core.statemachine;
