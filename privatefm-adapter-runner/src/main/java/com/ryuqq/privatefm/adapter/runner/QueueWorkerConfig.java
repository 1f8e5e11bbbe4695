package com.ryuqq.privatefm.adapter.runner;

/**
 * QueueWorkerRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>popTimeoutMs: 큐에서 한 항목을 기다리는 최대 시간 (기본 5000ms)</li>
 *   <li>idleDelayMs: 큐가 비었을 때 다음 pump까지 쉬는 시간 (기본 1000ms)</li>
 *   <li>workersPerQueue: 큐마다 실행할 워커 수 (기본 1)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param popTimeoutMs 큐 대기 시간 (밀리초, 양수여야 함)
 * @param idleDelayMs 유휴 대기 시간 (밀리초, 0 이상이어야 함)
 * @param workersPerQueue 큐당 워커 수 (1 이상이어야 함)
 */
public record QueueWorkerConfig(
    long popTimeoutMs,
    long idleDelayMs,
    int workersPerQueue
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: popTimeoutMs=5000ms, idleDelayMs=1000ms, workersPerQueue=1</p>
     */
    public QueueWorkerConfig() {
        this(5000, 1000, 1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public QueueWorkerConfig {
        if (popTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "popTimeoutMs must be positive (current: " + popTimeoutMs + ")"
            );
        }
        if (idleDelayMs < 0) {
            throw new IllegalArgumentException(
                "idleDelayMs must be non-negative (current: " + idleDelayMs + ")"
            );
        }
        if (workersPerQueue <= 0) {
            throw new IllegalArgumentException(
                "workersPerQueue must be positive (current: " + workersPerQueue + ")"
            );
        }
    }

    public QueueWorkerConfig withPopTimeoutMs(long popTimeoutMs) {
        return new QueueWorkerConfig(popTimeoutMs, idleDelayMs, workersPerQueue);
    }

    public QueueWorkerConfig withIdleDelayMs(long idleDelayMs) {
        return new QueueWorkerConfig(popTimeoutMs, idleDelayMs, workersPerQueue);
    }

    public QueueWorkerConfig withWorkersPerQueue(int workersPerQueue) {
        return new QueueWorkerConfig(popTimeoutMs, idleDelayMs, workersPerQueue);
    }
}
