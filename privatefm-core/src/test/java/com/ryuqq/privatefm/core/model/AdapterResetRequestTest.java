package com.ryuqq.privatefm.core.model;

import com.ryuqq.privatefm.core.statemachine.ResetStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AdapterResetRequest 상태 메서드 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class AdapterResetRequestTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private AdapterResetRequest create(boolean autoApproved) {
        return AdapterResetRequest.create(LearnerId.of("l-1"), NamespaceId.of("ns-1"), "math",
            "guardian-1", "guardian", "restart", autoApproved, NOW);
    }

    @Test
    void create_자동승인이면_APPROVED로_시작() {
        AdapterResetRequest request = create(true);

        assertThat(request.status()).isEqualTo(ResetStatus.APPROVED);
        assertThat(request.approvedBy()).isEqualTo("guardian-1");
        assertThat(request.approvedAt()).isEqualTo(NOW);
    }

    @Test
    void create_승인필요면_PENDING_APPROVAL로_시작() {
        AdapterResetRequest request = create(false);

        assertThat(request.status()).isEqualTo(ResetStatus.PENDING_APPROVAL);
        assertThat(request.approvedAt()).isNull();
    }

    @Test
    void reject_거절정보를_기록함() {
        AdapterResetRequest rejected = create(false).reject("parent-1", "not now", NOW);

        assertThat(rejected.status()).isEqualTo(ResetStatus.REJECTED);
        assertThat(rejected.rejectedBy()).isEqualTo("parent-1");
        assertThat(rejected.rejectionReason()).isEqualTo("not now");
    }

    @Test
    void startExecuting_승인전에는_불가() {
        assertThatThrownBy(() -> create(false).startExecuting(NOW))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void fail_부분_재생_수를_유지함() {
        AdapterResetRequest failed = create(true).startExecuting(NOW)
            .withEventsReplayed(3, 70)
            .fail("replay error", NOW);

        assertThat(failed.status()).isEqualTo(ResetStatus.FAILED);
        assertThat(failed.eventsReplayed()).isEqualTo(3);
        assertThat(failed.progressPercent()).isEqualTo(70);
    }
}
