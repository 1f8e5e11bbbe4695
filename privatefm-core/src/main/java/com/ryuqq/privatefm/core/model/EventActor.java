package com.ryuqq.privatefm.core.model;

/**
 * 이벤트 발생 주체.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum EventActor {
    SYSTEM,
    GUARDIAN,
    API
}
