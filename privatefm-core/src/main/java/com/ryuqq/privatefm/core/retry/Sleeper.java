package com.ryuqq.privatefm.core.retry;

/**
 * 대기 추상화.
 *
 * <p>재시도 backoff, 배치 간 지연을 테스트에서 실제로 기다리지 않도록
 * 주입 가능하게 분리합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Thread.sleep 기반 기본 구현.
     */
    Sleeper SYSTEM = Thread::sleep;

    /**
     * 지정한 시간만큼 대기.
     *
     * @param millis 대기 시간 (밀리초)
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    void sleep(long millis) throws InterruptedException;
}
