package com.ryuqq.privatefm.application.reset;

/**
 * Adapter Reset 실행 단계와 단계 시작 시 진행률.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ResetStage {

    DELETING_ADAPTER("Deleting existing adapter", 20),
    RECLONING_BASE_MODEL("Re-cloning base foundation model", 40),
    RETRIEVING_EVENTS("Retrieving event log", 60),
    REPLAYING_EVENTS("Replaying learner events", 60),
    FINALIZING("Finalizing", 95);

    /** 재생 단계가 끝날 때의 진행률 */
    public static final int REPLAY_END_PERCENT = 95;

    private final String displayName;
    private final int progressPercent;

    ResetStage(String displayName, int progressPercent) {
        this.displayName = displayName;
        this.progressPercent = progressPercent;
    }

    public String displayName() {
        return displayName;
    }

    public int progressPercent() {
        return progressPercent;
    }

    /**
     * 재생 중 진행률 (60 → 95).
     *
     * @param replayed 재생한 이벤트 수
     * @param total 전체 이벤트 수
     */
    public static int replayPercent(long replayed, long total) {
        if (total <= 0) {
            return REPLAY_END_PERCENT;
        }
        int span = REPLAY_END_PERCENT - REPLAYING_EVENTS.progressPercent;
        return REPLAYING_EVENTS.progressPercent + (int) (span * replayed / total);
    }
}
