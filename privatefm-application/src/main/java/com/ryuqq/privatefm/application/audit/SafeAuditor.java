package com.ryuqq.privatefm.application.audit;

import com.ryuqq.privatefm.core.spi.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 실패를 삼키는 AuditSink 래퍼.
 *
 * <p>감사 기록 실패는 WARN으로 남기고 호출자에게 전파하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SafeAuditor {

    private static final Logger log = LoggerFactory.getLogger(SafeAuditor.class);

    private final AuditSink sink;

    public SafeAuditor(AuditSink sink) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.sink = sink;
    }

    /**
     * 감사 기록.
     *
     * @return 기록 성공 여부
     */
    public boolean record(String action, String resourceType, String resourceId, String actor, Map<String, Object> details) {
        try {
            sink.record(action, resourceType, resourceId, actor, details == null ? Map.of() : details);
            return true;
        } catch (RuntimeException e) {
            log.warn("Audit record failed: action={}, resource={}/{}", action, resourceType, resourceId, e);
            return false;
        }
    }
}
