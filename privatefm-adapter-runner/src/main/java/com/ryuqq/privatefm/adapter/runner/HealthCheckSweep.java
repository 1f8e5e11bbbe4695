package com.ryuqq.privatefm.adapter.runner;

import com.ryuqq.privatefm.application.context.OrchestratorServices;
import com.ryuqq.privatefm.application.fallback.FallbackDecision;
import com.ryuqq.privatefm.application.fallback.FallbackManager;
import com.ryuqq.privatefm.application.health.HealthEvaluator;
import com.ryuqq.privatefm.application.metrics.OrchestratorMetrics;
import com.ryuqq.privatefm.core.model.FallbackOperation;
import com.ryuqq.privatefm.core.model.FallbackReason;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.model.NamespaceHealth;
import com.ryuqq.privatefm.core.spi.NamespaceRepository;
import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ACTIVE/MERGING Namespace 건강 검사 후 필요한 경우 Fallback 시작.
 *
 * <p>검사 결과는 {@code privatefm.health.checks} (result: healthy, unhealthy, error)로 집계됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class HealthCheckSweep implements Sweep {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckSweep.class);

    public static final String JOB_NAME = "health_check";

    private final NamespaceRepository namespaces;
    private final HealthEvaluator healthEvaluator;
    private final FallbackDecision fallbackDecision;
    private final FallbackManager fallbackManager;
    private final HealthCheckConfig config;
    private final JobStatsRecorder recorder;
    private final OrchestratorMetrics metrics;
    private final Clock clock;

    public HealthCheckSweep(OrchestratorServices services, HealthCheckConfig config, JobStatsRecorder recorder) {
        if (services == null || config == null || recorder == null) {
            throw new IllegalArgumentException("services, config and recorder cannot be null");
        }
        this.namespaces = services.context().namespaces();
        this.healthEvaluator = services.healthEvaluator();
        this.fallbackDecision = services.fallbackDecision();
        this.fallbackManager = services.fallbackManager();
        this.config = config;
        this.recorder = recorder;
        this.metrics = services.context().metrics();
        this.clock = services.context().clock();
    }

    @Override
    public String jobName() {
        return JOB_NAME;
    }

    @Override
    public Duration interval() {
        return config.interval();
    }

    @Override
    public boolean enabled() {
        return config.enabled();
    }

    @Override
    public SweepReport run() {
        Instant startedAt = clock.instant();
        if (!config.enabled()) {
            log.info("Health check job disabled");
            return SweepReport.disabled(JOB_NAME, startedAt);
        }

        log.info("Starting health check job");
        Map<String, Long> counters = new LinkedHashMap<>();
        counters.put("namespaces_checked", 0L);
        counters.put("healthy_namespaces", 0L);
        counters.put("unhealthy_namespaces", 0L);
        counters.put("fallbacks_initiated", 0L);
        counters.put("errors", 0L);

        SweepStatus status = SweepStatus.COMPLETED;
        String fatalError = null;
        try {
            List<Namespace> targets = namespaces.findByStatuses(EnumSet.of(NamespaceStatus.ACTIVE, NamespaceStatus.MERGING));
            for (Namespace namespace : targets) {
                checkNamespace(namespace, counters);
            }
        } catch (RuntimeException e) {
            log.error("Health check job failed", e);
            status = SweepStatus.FAILED;
            fatalError = String.valueOf(e.getMessage());
        }

        SweepReport report = new SweepReport(JOB_NAME, status, counters, startedAt, clock.instant(), fatalError);
        log.info("Health check job finished: status={}, stats={}", status, counters);
        recorder.record(report);
        return report;
    }

    private void checkNamespace(Namespace namespace, Map<String, Long> counters) {
        String learnerId = namespace.learnerId().getValue();
        try {
            counters.merge("namespaces_checked", 1L, Long::sum);
            NamespaceHealth health = healthEvaluator.evaluate(namespace);
            if (health.healthy()) {
                counters.merge("healthy_namespaces", 1L, Long::sum);
                metrics.recordHealthCheck("healthy");
                return;
            }
            counters.merge("unhealthy_namespaces", 1L, Long::sum);
            metrics.recordHealthCheck("unhealthy");
            if (!fallbackDecision.shouldFallback(health)) {
                return;
            }

            FallbackReason reason = fallbackDecision.reason(health);
            FallbackOperation operation = fallbackManager.initiateFallback(learnerId, reason, null);
            counters.merge("fallbacks_initiated", 1L, Long::sum);
            log.warn("Fallback initiated for unhealthy namespace: learner={}, reason={}, operation={}",
                learnerId, reason, operation.operationId().getValue());
        } catch (RuntimeException e) {
            counters.merge("errors", 1L, Long::sum);
            metrics.recordHealthCheck("error");
            log.error("Error checking namespace health: learner={}", learnerId, e);
        }
    }
}
