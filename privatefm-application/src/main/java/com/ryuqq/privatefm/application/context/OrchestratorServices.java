package com.ryuqq.privatefm.application.context;

import com.ryuqq.privatefm.application.checkpoint.CheckpointManager;
import com.ryuqq.privatefm.application.event.EventLogService;
import com.ryuqq.privatefm.application.event.LearningUpdateApplier;
import com.ryuqq.privatefm.application.event.TrainingMetadataApplier;
import com.ryuqq.privatefm.application.fallback.FallbackDecision;
import com.ryuqq.privatefm.application.fallback.FallbackManager;
import com.ryuqq.privatefm.application.health.HealthEvaluator;
import com.ryuqq.privatefm.application.merge.MergeCoordinator;
import com.ryuqq.privatefm.application.namespace.NamespaceRegistry;
import com.ryuqq.privatefm.application.reset.AdapterResetExecutor;
import com.ryuqq.privatefm.application.stats.StatisticsService;

/**
 * {@link OrchestratorContext}로부터 조립된 서비스 묶음.
 *
 * <p>모든 서비스는 같은 context를 공유하며, 관리 API와 runner 모듈이 함께 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OrchestratorServices {

    private final OrchestratorContext context;
    private final EventLogService eventLogService;
    private final CheckpointManager checkpointManager;
    private final NamespaceRegistry namespaceRegistry;
    private final MergeCoordinator mergeCoordinator;
    private final HealthEvaluator healthEvaluator;
    private final FallbackDecision fallbackDecision;
    private final FallbackManager fallbackManager;
    private final AdapterResetExecutor adapterResetExecutor;
    private final StatisticsService statisticsService;

    /**
     * 기본 {@link TrainingMetadataApplier}로 조립.
     */
    public OrchestratorServices(OrchestratorContext context) {
        this(context, new TrainingMetadataApplier(context.checkpointStore(), context.clock()));
    }

    public OrchestratorServices(OrchestratorContext context, LearningUpdateApplier applier) {
        if (context == null || applier == null) {
            throw new IllegalArgumentException("context and applier cannot be null");
        }
        this.context = context;
        this.eventLogService = new EventLogService(context);
        this.checkpointManager = new CheckpointManager(context);
        this.namespaceRegistry = new NamespaceRegistry(context, eventLogService, checkpointManager);
        this.mergeCoordinator = new MergeCoordinator(context, eventLogService, checkpointManager);
        this.healthEvaluator = new HealthEvaluator(context, checkpointManager);
        this.fallbackDecision = new FallbackDecision(context.config().strictMaxVersionLag());
        this.fallbackManager = new FallbackManager(context, eventLogService, checkpointManager, applier);
        this.adapterResetExecutor = new AdapterResetExecutor(context, eventLogService, checkpointManager, applier);
        this.statisticsService = new StatisticsService(context);
    }

    public OrchestratorContext context() {
        return context;
    }

    public EventLogService eventLogService() {
        return eventLogService;
    }

    public CheckpointManager checkpointManager() {
        return checkpointManager;
    }

    public NamespaceRegistry namespaceRegistry() {
        return namespaceRegistry;
    }

    public MergeCoordinator mergeCoordinator() {
        return mergeCoordinator;
    }

    public HealthEvaluator healthEvaluator() {
        return healthEvaluator;
    }

    public FallbackDecision fallbackDecision() {
        return fallbackDecision;
    }

    public FallbackManager fallbackManager() {
        return fallbackManager;
    }

    public AdapterResetExecutor adapterResetExecutor() {
        return adapterResetExecutor;
    }

    public StatisticsService statisticsService() {
        return statisticsService;
    }
}
