package com.ryuqq.privatefm.application.health;

import com.ryuqq.privatefm.application.checkpoint.CheckpointManager;
import com.ryuqq.privatefm.application.context.OrchestratorConfig;
import com.ryuqq.privatefm.application.context.OrchestratorContext;
import com.ryuqq.privatefm.application.support.NamespaceLookup;
import com.ryuqq.privatefm.core.exception.NamespaceNotFoundException;
import com.ryuqq.privatefm.core.model.Namespace;
import com.ryuqq.privatefm.core.model.NamespaceHealth;
import com.ryuqq.privatefm.core.spi.ModelRegistry;
import com.ryuqq.privatefm.core.spi.NamespaceRepository;
import com.ryuqq.privatefm.core.statemachine.NamespaceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Namespace 건강 상태 평가.
 *
 * <p><strong>평가 항목:</strong></p>
 * <ul>
 *   <li>버전 지연: 최신 FM 버전 대비 {@code maxVersionLag} 초과</li>
 *   <li>Merge 지연: 마지막 Merge 이후 {@code staleMergeThreshold} 초과</li>
 *   <li>무결성: 현재 체크포인트의 무결성 마커 부재</li>
 * </ul>
 *
 * <p>healthy는 문제가 없고, 상태가 ACTIVE이며, 버전 지연이 허용치 이내일 때만 true입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class HealthEvaluator {

    private static final Logger log = LoggerFactory.getLogger(HealthEvaluator.class);

    public static final String INTEGRITY_FAILED_ISSUE = "Checkpoint integrity verification failed";
    public static final String RECOMMEND_FALLBACK = "Consider triggering fallback recovery";
    public static final String RECOMMEND_MERGE = "Schedule a merge operation";
    public static final String RECOMMEND_IMMEDIATE_FALLBACK = "Immediate fallback recovery required";

    private final NamespaceRepository namespaces;
    private final ModelRegistry modelRegistry;
    private final CheckpointManager checkpointManager;
    private final Clock clock;
    private final int maxVersionLag;
    private final Duration staleMergeThreshold;

    public HealthEvaluator(OrchestratorContext context, CheckpointManager checkpointManager) {
        if (checkpointManager == null) {
            throw new IllegalArgumentException("checkpointManager cannot be null");
        }
        OrchestratorConfig config = context.config();
        this.namespaces = context.namespaces();
        this.modelRegistry = context.modelRegistry();
        this.checkpointManager = checkpointManager;
        this.clock = context.clock();
        this.maxVersionLag = config.maxVersionLag();
        this.staleMergeThreshold = config.staleMergeThreshold();
    }

    /**
     * 학습자 Namespace 건강 상태 평가.
     *
     * @throws NamespaceNotFoundException Namespace가 없는 경우
     */
    public NamespaceHealth checkHealth(String learnerId) {
        return evaluate(NamespaceLookup.require(namespaces, learnerId));
    }

    /**
     * 이미 조회한 Namespace 평가.
     */
    public NamespaceHealth evaluate(Namespace namespace) {
        List<String> issues = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        int versionLag = versionLag(namespace.baseFmVersion(), modelRegistry.latestVersion());
        if (versionLag > maxVersionLag) {
            issues.add("Version lag of " + versionLag + " exceeds maximum of " + maxVersionLag);
            recommendations.add(RECOMMEND_FALLBACK);
        }

        Double lastMergeAgoHours = null;
        if (namespace.lastMergeAt() != null) {
            long hours = Duration.between(namespace.lastMergeAt(), clock.instant()).toHours();
            lastMergeAgoHours = (double) hours;
            if (hours > staleMergeThreshold.toHours()) {
                issues.add("No merge in " + hours + " hours");
                recommendations.add(RECOMMEND_MERGE);
            }
        }

        double integrityScore = 1.0;
        if (namespace.currentCheckpointHash() != null
            && !checkpointManager.verifyIntegrity(namespace.currentCheckpointHash())) {
            integrityScore = 0.0;
            issues.add(INTEGRITY_FAILED_ISSUE);
            recommendations.add(RECOMMEND_IMMEDIATE_FALLBACK);
        }

        boolean healthy = issues.isEmpty()
            && namespace.status() == NamespaceStatus.ACTIVE
            && versionLag <= maxVersionLag;

        if (!healthy) {
            log.info("Namespace unhealthy: learner={}, status={}, issues={}",
                namespace.learnerId().getValue(), namespace.status(), issues);
        }
        return new NamespaceHealth(namespace.id(), namespace.learnerId(), namespace.status(), healthy,
            lastMergeAgoHours, versionLag, integrityScore, issues, recommendations);
    }

    /**
     * 버전 지연 계산.
     *
     * <p>{@code fm-vX.Y.Z} 형식에서 {@code -v} 뒤 숫자들의 합 차이입니다.
     * 형식이 맞지 않으면 0을 반환합니다.</p>
     *
     * @param current 현재 버전
     * @param latest 최신 버전
     * @return 지연 값
     */
    public static int versionLag(String current, String latest) {
        try {
            return sumParts(latest) - sumParts(current);
        } catch (IllegalArgumentException e) {
            return 0;
        }
    }

    private static int sumParts(String version) {
        if (version == null) {
            throw new IllegalArgumentException("version is null");
        }
        int marker = version.indexOf("-v");
        if (marker < 0) {
            throw new IllegalArgumentException("Unsupported version format: " + version);
        }
        int sum = 0;
        for (String part : version.substring(marker + 2).split("\\.", -1)) {
            sum += Integer.parseInt(part);
        }
        return sum;
    }
}
