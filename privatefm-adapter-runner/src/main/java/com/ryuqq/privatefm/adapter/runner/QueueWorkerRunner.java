package com.ryuqq.privatefm.adapter.runner;

import com.ryuqq.privatefm.application.context.OrchestratorServices;
import com.ryuqq.privatefm.application.metrics.OrchestratorMetrics;
import com.ryuqq.privatefm.application.runtime.Runtime;
import com.ryuqq.privatefm.core.model.OperationId;
import com.ryuqq.privatefm.core.outcome.Fail;
import com.ryuqq.privatefm.core.outcome.Outcome;
import com.ryuqq.privatefm.core.spi.QueueNames;
import com.ryuqq.privatefm.core.spi.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Queue Worker Runner 구현체.
 *
 * <p>작업 큐에서 ID 하나를 꺼내 큐에 묶인 coordinator로 실행합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * blockingPop(queue, popTimeout)
 *   ├─ 비어있음 → false 반환 (호출자가 idle 대기)
 *   └─ ID 수신
 *        ↓
 *      handler.apply(operationId) → Outcome
 *        ├─ Ok   → INFO 로그, result=succeeded
 *        ├─ Fail → WARN 로그, result=failed
 *        └─ 예외 → ERROR 로그, result=failed (재게시하지 않음)
 *        ↓
 *      true 반환
 * </pre>
 *
 * <p>재시도는 coordinator 내부에서 이루어지므로 runner는 실패한 항목을 다시 큐에 넣지 않습니다.
 * 처리 결과는 {@code privatefm.queue.items} (queue, result) 카운터로 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class QueueWorkerRunner implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(QueueWorkerRunner.class);

    static final String SUCCEEDED = "succeeded";
    static final String FAILED = "failed";

    private final WorkQueue workQueue;
    private final String queue;
    private final Function<OperationId, Outcome> handler;
    private final Duration popTimeout;
    private final OrchestratorMetrics metrics;

    /**
     * 생성자.
     *
     * @param workQueue 작업 큐
     * @param queue 큐 이름
     * @param handler 작업 실행 함수
     * @param config 설정
     * @param metrics 처리 결과 지표
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public QueueWorkerRunner(
        WorkQueue workQueue,
        String queue,
        Function<OperationId, Outcome> handler,
        QueueWorkerConfig config,
        OrchestratorMetrics metrics
    ) {
        if (workQueue == null) {
            throw new IllegalArgumentException("workQueue cannot be null");
        }
        if (queue == null || queue.isBlank()) {
            throw new IllegalArgumentException("queue cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (config == null || metrics == null) {
            throw new IllegalArgumentException("config and metrics cannot be null");
        }
        this.workQueue = workQueue;
        this.queue = queue;
        this.handler = handler;
        this.popTimeout = Duration.ofMillis(config.popTimeoutMs());
        this.metrics = metrics;
    }

    /**
     * 큐 이름에 맞는 coordinator로 runner 생성.
     *
     * @param services 서비스 묶음
     * @param queue {@link QueueNames}의 큐 이름
     * @param config 설정
     * @throws IllegalArgumentException 알 수 없는 큐인 경우
     */
    public static QueueWorkerRunner forQueue(OrchestratorServices services, String queue, QueueWorkerConfig config) {
        WorkQueue workQueue = services.context().workQueue();
        OrchestratorMetrics metrics = services.context().metrics();
        switch (queue) {
            case QueueNames.MERGE_QUEUE:
                return new QueueWorkerRunner(workQueue, queue, services.mergeCoordinator()::executeMerge, config, metrics);
            case QueueNames.FALLBACK_QUEUE:
                return new QueueWorkerRunner(workQueue, queue, services.fallbackManager()::executeFallback, config, metrics);
            case QueueNames.ADAPTER_RESET_QUEUE:
                return new QueueWorkerRunner(workQueue, queue, services.adapterResetExecutor()::executeReset, config, metrics);
            default:
                throw new IllegalArgumentException("Unknown queue: " + queue);
        }
    }

    @Override
    public boolean pump() throws InterruptedException {
        Optional<String> item = workQueue.blockingPop(queue, popTimeout);
        if (item.isEmpty()) {
            return false;
        }
        process(item.get());
        return true;
    }

    private void process(String item) {
        OperationId operationId;
        try {
            operationId = OperationId.of(item);
        } catch (IllegalArgumentException e) {
            metrics.recordQueueItem(queue, FAILED);
            log.warn("Discarding malformed queue item: queue={}, item='{}'", queue, item);
            return;
        }

        try {
            Outcome outcome = handler.apply(operationId);
            if (outcome instanceof Fail) {
                Fail fail = (Fail) outcome;
                metrics.recordQueueItem(queue, FAILED);
                log.warn("Queued operation failed: queue={}, id={}, code={}, message={}",
                    queue, operationId.getValue(), fail.errorCode(), fail.message());
            } else {
                metrics.recordQueueItem(queue, SUCCEEDED);
                log.info("Queued operation processed: queue={}, id={}", queue, operationId.getValue());
            }
        } catch (RuntimeException e) {
            metrics.recordQueueItem(queue, FAILED);
            log.error("Queued operation threw: queue={}, id={}", queue, operationId.getValue(), e);
        }
    }

    public String queue() {
        return queue;
    }
}
