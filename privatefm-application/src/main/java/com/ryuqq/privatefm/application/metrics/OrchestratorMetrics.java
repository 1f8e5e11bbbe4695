package com.ryuqq.privatefm.application.metrics;

import com.ryuqq.privatefm.core.spi.NamespaceRepository;
import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer 기반 Orchestrator 지표.
 *
 * <p><strong>기록 지표:</strong></p>
 * <ul>
 *   <li>{@code privatefm.namespaces.total}: Gauge, 전체 Namespace 수</li>
 *   <li>{@code privatefm.namespaces}: Gauge (tag: status)</li>
 *   <li>{@code privatefm.merge.operations}: Counter (tag: status)</li>
 *   <li>{@code privatefm.fallback.operations}: Counter (tag: status)</li>
 *   <li>{@code privatefm.adapter_reset.operations}: Counter (tag: status)</li>
 *   <li>{@code privatefm.operation.duration}: Timer (tags: operation, status)</li>
 *   <li>{@code privatefm.health.checks}: Counter (tag: result)</li>
 *   <li>{@code privatefm.queue.items}: Counter (tags: queue, result)</li>
 *   <li>{@code privatefm.loop.iterations}, {@code privatefm.loop.restarts}: Counter (tag: loop)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OrchestratorMetrics {

    public static final String NAMESPACES_TOTAL = "privatefm.namespaces.total";
    public static final String NAMESPACES = "privatefm.namespaces";
    public static final String MERGE_OPERATIONS = "privatefm.merge.operations";
    public static final String FALLBACK_OPERATIONS = "privatefm.fallback.operations";
    public static final String RESET_OPERATIONS = "privatefm.adapter_reset.operations";
    public static final String OPERATION_DURATION = "privatefm.operation.duration";
    public static final String HEALTH_CHECKS = "privatefm.health.checks";
    public static final String QUEUE_ITEMS = "privatefm.queue.items";
    public static final String LOOP_ITERATIONS = "privatefm.loop.iterations";
    public static final String LOOP_RESTARTS = "privatefm.loop.restarts";

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();

    public OrchestratorMetrics(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Namespace 수 Gauge 등록. 값은 조회 시점에 저장소에서 계산합니다.
     */
    public void bindNamespaceGauges(NamespaceRepository namespaces) {
        Gauge.builder(NAMESPACES_TOTAL, namespaces,
                repo -> repo.findByStatuses(EnumSet.allOf(NamespaceStatus.class)).size())
            .description("Total number of learner namespaces")
            .register(registry);
        for (NamespaceStatus status : NamespaceStatus.values()) {
            Gauge.builder(NAMESPACES, namespaces, repo -> repo.findByStatuses(EnumSet.of(status)).size())
                .description("Namespaces by status")
                .tag("status", tagValue(status.name()))
                .register(registry);
        }
    }

    public void recordMerge(String status, Duration duration) {
        recordOperation(MERGE_OPERATIONS, "merge", status, duration);
    }

    public void recordFallback(String status, Duration duration) {
        recordOperation(FALLBACK_OPERATIONS, "fallback", status, duration);
    }

    public void recordReset(String status, Duration duration) {
        recordOperation(RESET_OPERATIONS, "adapter_reset", status, duration);
    }

    private void recordOperation(String counterName, String operation, String status, Duration duration) {
        String tag = tagValue(status);
        counter(counterName, "status", tag).increment();
        String key = operation + ":" + tag;
        timerCache.computeIfAbsent(key, k ->
                Timer.builder(OPERATION_DURATION)
                    .description("Duration of queued operations")
                    .tag("operation", operation)
                    .tag("status", tag)
                    .register(registry))
            .record(duration.isNegative() ? Duration.ZERO : duration);
    }

    /**
     * @param result healthy, unhealthy 또는 error
     */
    public void recordHealthCheck(String result) {
        counter(HEALTH_CHECKS, "result", tagValue(result)).increment();
    }

    /**
     * @param result succeeded 또는 failed
     */
    public void recordQueueItem(String queue, String result) {
        String key = QUEUE_ITEMS + ":" + queue + ":" + result;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder(QUEUE_ITEMS)
                    .description("Queue items processed by workers")
                    .tag("queue", queue)
                    .tag("result", result)
                    .register(registry))
            .increment();
    }

    public void recordLoopIteration(String loop) {
        counter(LOOP_ITERATIONS, "loop", loop).increment();
    }

    public void recordLoopRestart(String loop) {
        counter(LOOP_RESTARTS, "loop", loop).increment();
    }

    private Counter counter(String name, String tagKey, String tagValue) {
        String key = name + ":" + tagValue;
        return counterCache.computeIfAbsent(key, k ->
            Counter.builder(name).tag(tagKey, tagValue).register(registry));
    }

    private static String tagValue(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
