package com.ryuqq.privatefm.application.merge;

/**
 * Merge 실행 단계와 단계 완료 시 진행률.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum MergeStage {

    LOADING_FOUNDATION_MODEL("Loading foundation model", 20),
    LOADING_ADAPTERS("Loading namespace adapters", 40),
    PERFORMING_MERGE("Performing merge", 70),
    GENERATING_CHECKPOINT("Generating checkpoint", 90),
    FINALIZING("Finalizing", 100);

    private final String displayName;
    private final int progressPercent;

    MergeStage(String displayName, int progressPercent) {
        this.displayName = displayName;
        this.progressPercent = progressPercent;
    }

    public String displayName() {
        return displayName;
    }

    public int progressPercent() {
        return progressPercent;
    }
}
