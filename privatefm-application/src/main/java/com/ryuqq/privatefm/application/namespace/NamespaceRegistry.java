package com.ryuqq.privatefm.application.namespace;

import com.ryuqq.privatefm.application.checkpoint.CheckpointManager;
import com.ryuqq.privatefm.application.checkpoint.StorageKeys;
import com.ryuqq.privatefm.application.context.OrchestratorConfig;
import com.ryuqq.privatefm.application.context.OrchestratorContext;
import com.ryuqq.privatefm.application.event.EventLogService;
import com.ryuqq.privatefm.application.support.Hashing;
import com.ryuqq.privatefm.application.support.Jsons;
import com.ryuqq.privatefm.application.support.NamespaceLookup;
import com.ryuqq.privatefm.core.exception.ConflictException;
import com.ryuqq.privatefm.core.exception.NamespaceNotFoundException;
import com.ryuqq.privatefm.core.exception.UnauthorizedException;
import com.ryuqq.privatefm.core.exception.ValidationException;
import com.ryuqq.privatefm.core.model.EventActor;
import com.ryuqq.privatefm.core.model.LearnerId;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.model.NamespaceEventTypes;
import com.ryuqq.privatefm.core.model.NamespaceId;
import com.ryuqq.privatefm.core.model.ResourceQuota;
import com.ryuqq.privatefm.core.spi.CheckpointStore;
import com.ryuqq.privatefm.core.spi.NamespaceRepository;
import com.ryuqq.privatefm.core.spi.ResourceTracker;
import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Namespace 생명주기 관리 (생성, 조회, 목록, 삭제).
 *
 * <p><strong>생성 흐름:</strong></p>
 * <pre>
 * 1. 입력 검증 (learnerId, version, subject 수)
 * 2. INITIALIZING 레코드 저장 (학습자당 하나, 중복 시 ConflictException)
 * 3. 리소스 할당 (실패 시 레코드 제거 + 할당 해제 후 예외 전파)
 * 4. namespace_created 이벤트 기록
 * 5. INITIALIZING → ACTIVE
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class NamespaceRegistry {

    private static final Logger log = LoggerFactory.getLogger(NamespaceRegistry.class);

    private static final Duration RESOURCE_RECORD_TTL = Duration.ofDays(7);

    private final NamespaceRepository namespaces;
    private final ResourceTracker resourceTracker;
    private final CheckpointStore store;
    private final EventLogService eventLogService;
    private final CheckpointManager checkpointManager;
    private final OrchestratorConfig config;
    private final Clock clock;

    public NamespaceRegistry(OrchestratorContext context, EventLogService eventLogService, CheckpointManager checkpointManager) {
        if (eventLogService == null || checkpointManager == null) {
            throw new IllegalArgumentException("eventLogService and checkpointManager cannot be null");
        }
        this.namespaces = context.namespaces();
        this.resourceTracker = context.resourceTracker();
        this.store = context.checkpointStore();
        this.eventLogService = eventLogService;
        this.checkpointManager = checkpointManager;
        this.config = context.config();
        this.clock = context.clock();
    }

    /**
     * Namespace 생성.
     *
     * @param learnerId 학습자 ID
     * @param subjects 과목 코드 (최대 50개)
     * @param baseFmVersion 기반 FM 버전
     * @param isolationConfig 격리 설정 (기본값 위에 덮어씀, null 가능)
     * @param mergeConfig Merge 설정 (기본값 위에 덮어씀, null 가능)
     * @return ACTIVE 상태의 Namespace
     * @throws ValidationException 입력이 유효하지 않은 경우
     * @throws ConflictException 학습자의 Namespace가 이미 있는 경우
     */
    public Namespace create(
        String learnerId,
        Collection<String> subjects,
        String baseFmVersion,
        Map<String, Object> isolationConfig,
        Map<String, Object> mergeConfig
    ) {
        LearnerId learner = NamespaceLookup.parseLearnerId(learnerId);
        if (baseFmVersion == null || baseFmVersion.isBlank()) {
            throw new ValidationException("baseFmVersion cannot be blank");
        }
        Set<String> subjectSet = subjects == null ? new LinkedHashSet<>() : new LinkedHashSet<>(subjects);
        if (subjectSet.size() > Namespace.MAX_SUBJECTS) {
            throw new ValidationException(
                "subjects cannot exceed " + Namespace.MAX_SUBJECTS + " (current: " + subjectSet.size() + ")");
        }
        for (String subject : subjectSet) {
            if (subject == null || subject.isBlank()) {
                throw new ValidationException("subject codes cannot be blank");
            }
        }

        log.info("Creating namespace: learner={}, subjects={}", learnerId, subjectSet);

        Instant now = clock.instant();
        Map<String, Object> isolation = mergedWithDefaults(defaultIsolationConfig(), isolationConfig);
        Map<String, Object> merge = mergedWithDefaults(defaultMergeConfig(), mergeConfig);
        Namespace namespace = Namespace.initializing(NamespaceId.generate(), learner,
            generateNsUid(learner, subjectSet, now), subjectSet, baseFmVersion, isolation, merge, now);

        if (!namespaces.insert(namespace)) {
            throw new ConflictException("Namespace already exists for learner: " + learnerId);
        }

        try {
            allocateResources(namespace, now);
        } catch (RuntimeException e) {
            log.error("Resource allocation failed, rolling back namespace: learner={}", learnerId, e);
            resourceTracker.release(namespace.id());
            store.delete(StorageKeys.resources(namespace.nsUid()));
            namespaces.remove(namespace.id());
            throw e;
        }

        Map<String, Object> eventData = new LinkedHashMap<>();
        eventData.put("ns_uid", namespace.nsUid());
        eventData.put("subjects", new ArrayList<>(subjectSet));
        eventData.put("base_fm_version", baseFmVersion);
        eventData.put("isolation_config", isolation);
        eventLogService.logEvent(namespace, NamespaceEventTypes.NAMESPACE_CREATED, eventData);

        Namespace active = namespaces.transition(namespace.id(), EnumSet.of(NamespaceStatus.INITIALIZING),
                ns -> ns.transitionTo(NamespaceStatus.ACTIVE, clock.instant()))
            .orElseThrow(() -> new ConflictException("Namespace changed during creation: " + learnerId));

        log.info("Namespace created: id={}, nsUid={}", active.id().getValue(), active.nsUid());
        return active;
    }

    /**
     * 학습자의 Namespace 조회 (부수 효과 없음).
     */
    public Optional<Namespace> get(String learnerId) {
        return NamespaceLookup.find(namespaces, learnerId);
    }

    /**
     * 학습자의 Namespace 조회.
     *
     * @throws NamespaceNotFoundException 없는 경우
     */
    public Namespace require(String learnerId) {
        return get(learnerId).orElseThrow(() -> NamespaceNotFoundException.forLearner(learnerId));
    }

    /**
     * Namespace 목록 (생성 순).
     *
     * @param statusFilter 상태 필터 (null이면 전체)
     * @param offset 시작 위치 (0 이상)
     * @param limit 최대 개수 (1 이상)
     */
    public List<Namespace> list(NamespaceStatus statusFilter, int offset, int limit) {
        if (offset < 0 || limit < 1) {
            throw new ValidationException("offset must be >= 0 and limit >= 1 (offset: " + offset + ", limit: " + limit + ")");
        }
        Set<NamespaceStatus> filter = statusFilter == null
            ? EnumSet.noneOf(NamespaceStatus.class)
            : EnumSet.of(statusFilter);
        List<Namespace> all = namespaces.findByStatuses(filter);
        if (offset >= all.size()) {
            return List.of();
        }
        return List.copyOf(all.subList(offset, Math.min(all.size(), offset + limit)));
    }

    /**
     * Namespace soft delete (Guardian 인가 필요).
     *
     * @param learnerId 학습자 ID
     * @param authToken Guardian 키
     * @return DELETED 상태의 Namespace
     * @throws UnauthorizedException 키가 설정되지 않았거나 일치하지 않는 경우
     * @throws NamespaceNotFoundException Namespace가 없는 경우
     * @throws ConflictException ACTIVE가 아닌 경우
     */
    public Namespace delete(String learnerId, String authToken) {
        String guardianKey = config.guardianApiKey();
        if (guardianKey == null || !guardianKey.equals(authToken)) {
            log.warn("Unauthorized namespace deletion attempt: learner={}", learnerId);
            throw new UnauthorizedException("Guardian authorization required to delete namespace");
        }

        Namespace namespace = require(learnerId);
        Namespace deleted = namespaces.transition(namespace.id(), EnumSet.of(NamespaceStatus.ACTIVE),
                ns -> ns.transitionTo(NamespaceStatus.DELETED, clock.instant()))
            .orElseThrow(() -> new ConflictException(
                "Namespace must be ACTIVE to delete (learner: " + learnerId + ")"));

        eventLogService.logEvent(deleted.id(), deleted.learnerId(), NamespaceEventTypes.NAMESPACE_DELETED,
            Map.of("guardian_authorized", true), null, null, null, EventActor.GUARDIAN);

        resourceTracker.release(deleted.id());
        store.delete(StorageKeys.resources(deleted.nsUid()));
        int checkpoints = checkpointManager.deleteNamespaceCheckpoints(deleted.id());

        log.info("Namespace deleted: id={}, checkpointKeysRemoved={}", deleted.id().getValue(), checkpoints);
        return deleted;
    }

    /**
     * nsUid = SHA-256(learnerId:sorted(subjects):epochSeconds)의 앞 16자.
     */
    static String generateNsUid(LearnerId learnerId, Set<String> subjects, Instant now) {
        List<String> sorted = new ArrayList<>(subjects);
        sorted.sort(null);
        String content = learnerId.getValue() + ":" + String.join(":", sorted) + ":" + now.getEpochSecond();
        return Hashing.sha256Hex(content).substring(0, 16);
    }

    private void allocateResources(Namespace namespace, Instant now) {
        Map<String, Object> isolation = namespace.isolationConfig();
        ResourceQuota quota;
        try {
            quota = new ResourceQuota(
                namespace.id(),
                namespace.nsUid(),
                number(isolation, "memory_limit_mb").intValue(),
                number(isolation, "cpu_limit_cores").doubleValue(),
                number(isolation, "storage_limit_gb").doubleValue(),
                Boolean.TRUE.equals(isolation.get("network_isolation")),
                Boolean.TRUE.equals(isolation.get("encryption_enabled")),
                now
            );
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid isolation config: " + e.getMessage());
        }
        resourceTracker.allocate(quota);

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("cpu_quota", quota.cpuLimitCores());
        record.put("memory_limit", quota.memoryLimitMb());
        record.put("storage_quota", quota.storageLimitGb());
        record.put("network_isolated", quota.networkIsolation());
        record.put("created_at", now.toString());
        store.put(StorageKeys.resources(namespace.nsUid()), Jsons.toBytes(record), RESOURCE_RECORD_TTL);
    }

    private static Number number(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (!(value instanceof Number)) {
            throw new ValidationException("isolation config '" + key + "' must be a number (current: " + value + ")");
        }
        return (Number) value;
    }

    private Map<String, Object> defaultIsolationConfig() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("memory_limit_mb", 2048);
        defaults.put("cpu_limit_cores", 2.0);
        defaults.put("storage_limit_gb", config.maxNamespaceSizeGb());
        defaults.put("network_isolation", true);
        defaults.put("encryption_enabled", true);
        return defaults;
    }

    private static Map<String, Object> defaultMergeConfig() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("merge_strategy", "incremental");
        defaults.put("batch_size", 1000);
        defaults.put("learning_rate", 0.0001);
        defaults.put("adapter_rank", 8);
        defaults.put("validation_steps", 100);
        return defaults;
    }

    private static Map<String, Object> mergedWithDefaults(Map<String, Object> defaults, Map<String, Object> overrides) {
        if (overrides != null) {
            defaults.putAll(overrides);
        }
        return defaults;
    }

}
