/**
 * Namespace 도메인 모델.
 *
 * <p>식별자 값 객체({@link com.ryuqq.privatefm.core.model.LearnerId},
 * {@link com.ryuqq.privatefm.core.model.NamespaceId},
 * {@link com.ryuqq.privatefm.core.model.OperationId})와 불변 레코드로 구성됩니다.
 * 상태 변경 메서드는 항상 새 인스턴스를 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.privatefm.core.model;
