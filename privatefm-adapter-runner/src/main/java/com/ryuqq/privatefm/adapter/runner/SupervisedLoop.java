package com.ryuqq.privatefm.adapter.runner;

import com.ryuqq.privatefm.application.metrics.OrchestratorMetrics;
import com.ryuqq.privatefm.core.retry.BackoffCalculator;
import com.ryuqq.privatefm.core.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 예기치 않은 실패 후 backoff를 두고 다시 시작하는 백그라운드 루프.
 *
 * <p><strong>동작:</strong></p>
 * <pre>
 * while (!stopped):
 *   worked = body.runOnce()
 *     ├─ 정상 → 연속 실패 수 초기화, worked가 false면 idleDelayMs 대기
 *     ├─ RuntimeException → 재시작 수 증가, backoff(연속 실패 수) 대기 후 계속
 *     └─ InterruptedException → 종료
 * </pre>
 *
 * <p>실행/재시작 횟수는 {@code privatefm.loop.iterations}, {@code privatefm.loop.restarts} (loop: 이름)로 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SupervisedLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SupervisedLoop.class);

    /**
     * 루프 본문 1회.
     */
    @FunctionalInterface
    public interface Body {

        /**
         * @return 처리한 작업이 있으면 true, 유휴 대기가 필요하면 false
         * @throws InterruptedException 대기 중 인터럽트된 경우
         */
        boolean runOnce() throws InterruptedException;
    }

    private final String name;
    private final Body body;
    private final long idleDelayMs;
    private final BackoffCalculator restartBackoff;
    private final Sleeper sleeper;
    private final OrchestratorMetrics metrics;

    private volatile boolean stopped;
    private volatile Thread runner;

    public SupervisedLoop(
        String name,
        Body body,
        long idleDelayMs,
        BackoffCalculator restartBackoff,
        Sleeper sleeper,
        OrchestratorMetrics metrics
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (body == null || restartBackoff == null || sleeper == null || metrics == null) {
            throw new IllegalArgumentException("body, restartBackoff, sleeper and metrics cannot be null");
        }
        if (idleDelayMs < 0) {
            throw new IllegalArgumentException("idleDelayMs must be non-negative (current: " + idleDelayMs + ")");
        }
        this.name = name;
        this.body = body;
        this.idleDelayMs = idleDelayMs;
        this.restartBackoff = restartBackoff;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    @Override
    public void run() {
        runner = Thread.currentThread();
        log.info("Loop started: {}", name);
        int consecutiveFailures = 0;
        try {
            while (!stopped && !Thread.currentThread().isInterrupted()) {
                try {
                    boolean worked = body.runOnce();
                    metrics.recordLoopIteration(name);
                    consecutiveFailures = 0;
                    if (!worked && idleDelayMs > 0 && !stopped) {
                        sleeper.sleep(idleDelayMs);
                    }
                } catch (RuntimeException e) {
                    consecutiveFailures++;
                    metrics.recordLoopRestart(name);
                    long delay = restartBackoff.calculate(consecutiveFailures);
                    log.error("Loop {} failed (consecutive: {}), restarting in {}ms",
                        name, consecutiveFailures, delay, e);
                    sleeper.sleep(delay);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            runner = null;
            log.info("Loop stopped: {}", name);
        }
    }

    /**
     * 루프 종료 요청. 대기 중이면 인터럽트합니다.
     */
    public void stop() {
        stopped = true;
        Thread current = runner;
        if (current != null) {
            current.interrupt();
        }
    }

    public String name() {
        return name;
    }

    public boolean isStopped() {
        return stopped;
    }
}
