package com.ryuqq.privatefm.application.event;

import com.ryuqq.privatefm.core.model.EventLogEntry;
import com.ryuqq.privatefm.core.model.Namespace;

/**
 * 학습 이벤트를 과목 Adapter에 적용하는 불투명 단계.
 *
 * <p>Fallback과 Adapter Reset의 이벤트 재생에서 호출됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface LearningUpdateApplier {

    /**
     * 이벤트 하나를 적용.
     *
     * @param namespace 대상 Namespace
     * @param subject 적용할 과목
     * @param event 재생할 이벤트
     * @return 적용되었으면 true, 인식하지 못하는 이벤트 유형이면 false
     */
    boolean apply(Namespace namespace, String subject, EventLogEntry event);
}
