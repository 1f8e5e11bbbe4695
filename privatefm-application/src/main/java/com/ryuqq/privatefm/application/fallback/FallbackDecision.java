package com.ryuqq.privatefm.application.fallback;

import com.ryuqq.privatefm.application.health.HealthEvaluator;
import com.ryuqq.privatefm.core.model.FallbackReason;
import com.ryuqq.privatefm.core.model.NamespaceHealth;

import java.util.Locale;

/**
 * 건강 보고서로부터 Fallback 필요 여부와 사유를 결정.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FallbackDecision {

    public static final double INTEGRITY_THRESHOLD = 0.8;
    public static final double CORRUPTION_THRESHOLD = 0.5;
    public static final String CORRUPTION_DETECTED_ISSUE = "corruption_detected";

    private final int strictMaxVersionLag;

    public FallbackDecision(int strictMaxVersionLag) {
        if (strictMaxVersionLag < 0) {
            throw new IllegalArgumentException("strictMaxVersionLag must be non-negative");
        }
        this.strictMaxVersionLag = strictMaxVersionLag;
    }

    public boolean shouldFallback(NamespaceHealth health) {
        if (health.integrityScore() < INTEGRITY_THRESHOLD) {
            return true;
        }
        if (health.versionLag() > strictMaxVersionLag) {
            return true;
        }
        return health.issues().stream().anyMatch(issue ->
            issue.contains(HealthEvaluator.INTEGRITY_FAILED_ISSUE) || issue.contains(CORRUPTION_DETECTED_ISSUE));
    }

    public FallbackReason reason(NamespaceHealth health) {
        if (health.integrityScore() < CORRUPTION_THRESHOLD) {
            return FallbackReason.CORRUPTION_DETECTED;
        }
        if (health.versionLag() > strictMaxVersionLag) {
            return FallbackReason.VERSION_LAG;
        }
        boolean mentionsIntegrity = health.issues().stream()
            .anyMatch(issue -> issue.toLowerCase(Locale.ROOT).contains("integrity"));
        if (mentionsIntegrity) {
            return FallbackReason.INTEGRITY_FAILURE;
        }
        return FallbackReason.CORRUPTION_DETECTED;
    }
}
