package com.ryuqq.privatefm.application.context;

import com.ryuqq.privatefm.application.metrics.OrchestratorMetrics;
import com.ryuqq.privatefm.core.retry.BackoffCalculator;
import com.ryuqq.privatefm.core.retry.Sleeper;
import com.ryuqq.privatefm.core.spi.AdapterMerger;
import com.ryuqq.privatefm.core.spi.AdapterResetRepository;
import com.ryuqq.privatefm.core.spi.ApprovalService;
import com.ryuqq.privatefm.core.spi.AuditSink;
import com.ryuqq.privatefm.core.spi.CheckpointStore;
import com.ryuqq.privatefm.core.spi.EventLogRepository;
import com.ryuqq.privatefm.core.spi.FallbackOperationRepository;
import com.ryuqq.privatefm.core.spi.MergeOperationRepository;
import com.ryuqq.privatefm.core.spi.ModelRegistry;
import com.ryuqq.privatefm.core.spi.NamespaceRepository;
import com.ryuqq.privatefm.core.spi.ResetPermissionChecker;
import com.ryuqq.privatefm.core.spi.ResourceTracker;
import com.ryuqq.privatefm.core.spi.WorkQueue;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;

/**
 * 모든 협력 객체를 묶는 명시적 실행 컨텍스트.
 *
 * <p>전역 상태 없이 각 서비스가 생성 시점에 컨텍스트를 주입받습니다.
 * 테스트는 Clock/Sleeper를 교체하여 시간을 제어합니다.
 * MeterRegistry를 지정하지 않으면 {@link SimpleMeterRegistry}를 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OrchestratorContext context = OrchestratorContext.builder()
 *     .namespaces(namespaceRepository)
 *     .mergeOperations(mergeOperationRepository)
 *     ...
 *     .config(OrchestratorConfig.fromEnvironment(System.getenv()))
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OrchestratorContext {

    private final NamespaceRepository namespaces;
    private final MergeOperationRepository mergeOperations;
    private final FallbackOperationRepository fallbackOperations;
    private final EventLogRepository eventLog;
    private final AdapterResetRepository resetRequests;
    private final CheckpointStore checkpointStore;
    private final WorkQueue workQueue;
    private final ModelRegistry modelRegistry;
    private final ApprovalService approvalService;
    private final AuditSink auditSink;
    private final ResetPermissionChecker permissionChecker;
    private final ResourceTracker resourceTracker;
    private final AdapterMerger adapterMerger;
    private final OrchestratorConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final BackoffCalculator backoffCalculator;
    private final OrchestratorMetrics metrics;

    private OrchestratorContext(Builder builder) {
        this.namespaces = require(builder.namespaces, "namespaces");
        this.mergeOperations = require(builder.mergeOperations, "mergeOperations");
        this.fallbackOperations = require(builder.fallbackOperations, "fallbackOperations");
        this.eventLog = require(builder.eventLog, "eventLog");
        this.resetRequests = require(builder.resetRequests, "resetRequests");
        this.checkpointStore = require(builder.checkpointStore, "checkpointStore");
        this.workQueue = require(builder.workQueue, "workQueue");
        this.modelRegistry = require(builder.modelRegistry, "modelRegistry");
        this.approvalService = require(builder.approvalService, "approvalService");
        this.auditSink = require(builder.auditSink, "auditSink");
        this.permissionChecker = require(builder.permissionChecker, "permissionChecker");
        this.resourceTracker = require(builder.resourceTracker, "resourceTracker");
        this.adapterMerger = require(builder.adapterMerger, "adapterMerger");
        this.config = builder.config != null ? builder.config : new OrchestratorConfig();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
        this.backoffCalculator = builder.backoffCalculator != null
            ? builder.backoffCalculator
            : new BackoffCalculator(config.backoffBaseMs(), config.backoffMaxMs(), 0.1);
        this.metrics = new OrchestratorMetrics(
            builder.meterRegistry != null ? builder.meterRegistry : new SimpleMeterRegistry());
        this.metrics.bindNamespaceGauges(namespaces);
    }

    private static <T> T require(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    public NamespaceRepository namespaces() {
        return namespaces;
    }

    public MergeOperationRepository mergeOperations() {
        return mergeOperations;
    }

    public FallbackOperationRepository fallbackOperations() {
        return fallbackOperations;
    }

    public EventLogRepository eventLog() {
        return eventLog;
    }

    public AdapterResetRepository resetRequests() {
        return resetRequests;
    }

    public CheckpointStore checkpointStore() {
        return checkpointStore;
    }

    public WorkQueue workQueue() {
        return workQueue;
    }

    public ModelRegistry modelRegistry() {
        return modelRegistry;
    }

    public ApprovalService approvalService() {
        return approvalService;
    }

    public AuditSink auditSink() {
        return auditSink;
    }

    public ResetPermissionChecker permissionChecker() {
        return permissionChecker;
    }

    public ResourceTracker resourceTracker() {
        return resourceTracker;
    }

    public AdapterMerger adapterMerger() {
        return adapterMerger;
    }

    public OrchestratorConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Sleeper sleeper() {
        return sleeper;
    }

    public BackoffCalculator backoffCalculator() {
        return backoffCalculator;
    }

    public OrchestratorMetrics metrics() {
        return metrics;
    }

    /**
     * OrchestratorContext 빌더.
     */
    public static final class Builder {

        private NamespaceRepository namespaces;
        private MergeOperationRepository mergeOperations;
        private FallbackOperationRepository fallbackOperations;
        private EventLogRepository eventLog;
        private AdapterResetRepository resetRequests;
        private CheckpointStore checkpointStore;
        private WorkQueue workQueue;
        private ModelRegistry modelRegistry;
        private ApprovalService approvalService;
        private AuditSink auditSink;
        private ResetPermissionChecker permissionChecker;
        private ResourceTracker resourceTracker;
        private AdapterMerger adapterMerger;
        private OrchestratorConfig config;
        private Clock clock;
        private Sleeper sleeper;
        private BackoffCalculator backoffCalculator;
        private MeterRegistry meterRegistry;

        private Builder() {
        }

        public Builder namespaces(NamespaceRepository namespaces) {
            this.namespaces = namespaces;
            return this;
        }

        public Builder mergeOperations(MergeOperationRepository mergeOperations) {
            this.mergeOperations = mergeOperations;
            return this;
        }

        public Builder fallbackOperations(FallbackOperationRepository fallbackOperations) {
            this.fallbackOperations = fallbackOperations;
            return this;
        }

        public Builder eventLog(EventLogRepository eventLog) {
            this.eventLog = eventLog;
            return this;
        }

        public Builder resetRequests(AdapterResetRepository resetRequests) {
            this.resetRequests = resetRequests;
            return this;
        }

        public Builder checkpointStore(CheckpointStore checkpointStore) {
            this.checkpointStore = checkpointStore;
            return this;
        }

        public Builder workQueue(WorkQueue workQueue) {
            this.workQueue = workQueue;
            return this;
        }

        public Builder modelRegistry(ModelRegistry modelRegistry) {
            this.modelRegistry = modelRegistry;
            return this;
        }

        public Builder approvalService(ApprovalService approvalService) {
            this.approvalService = approvalService;
            return this;
        }

        public Builder auditSink(AuditSink auditSink) {
            this.auditSink = auditSink;
            return this;
        }

        public Builder permissionChecker(ResetPermissionChecker permissionChecker) {
            this.permissionChecker = permissionChecker;
            return this;
        }

        public Builder resourceTracker(ResourceTracker resourceTracker) {
            this.resourceTracker = resourceTracker;
            return this;
        }

        public Builder adapterMerger(AdapterMerger adapterMerger) {
            this.adapterMerger = adapterMerger;
            return this;
        }

        public Builder config(OrchestratorConfig config) {
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder backoffCalculator(BackoffCalculator backoffCalculator) {
            this.backoffCalculator = backoffCalculator;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        /**
         * @return 컨텍스트
         * @throws IllegalArgumentException 필수 협력 객체가 빠진 경우
         */
        public OrchestratorContext build() {
            return new OrchestratorContext(this);
        }
    }
}
