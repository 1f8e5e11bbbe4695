package com.ryuqq.privatefm.adapter.runner;

import java.time.Duration;

/**
 * 주기적으로 실행되는 유지보수 작업.
 *
 * <p>구현체는 항목 단위 오류를 카운터로 집계하고, 작업 전체 실패는
 * {@link SweepStatus#FAILED} 보고서로 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Sweep {

    /**
     * Job 통계 키에 쓰이는 작업 이름.
     */
    String jobName();

    /**
     * 실행 주기.
     */
    Duration interval();

    boolean enabled();

    /**
     * 1회 실행.
     *
     * @return 실행 결과
     */
    SweepReport run();
}
