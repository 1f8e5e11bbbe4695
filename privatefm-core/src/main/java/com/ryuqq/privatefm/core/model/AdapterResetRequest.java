package com.ryuqq.privatefm.core.model;

import com.ryuqq.privatefm.core.statemachine.ResetStatus;
import com.ryuqq.privatefm.core.statemachine.ResetTransitions;

import java.time.Instant;

/**
 * 과목별 Adapter 초기화 요청.
 *
 * <p>(learner, subject) 쌍마다 종료되지 않은 요청은 최대 하나입니다.
 * 재생 도중 실패해도 이미 적용된 이벤트는 되돌리지 않으며,
 * {@link #eventsReplayed()}로 관찰할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AdapterResetRequest(
    OperationId requestId,
    LearnerId learnerId,
    NamespaceId namespaceId,
    String subject,
    ResetStatus status,
    String requestedBy,
    String requesterRole,
    String reason,
    String approvalRequestId,
    int progressPercent,
    String currentStage,
    long eventsReplayed,
    String errorMessage,
    Instant createdAt,
    Instant approvedAt,
    String approvedBy,
    Instant rejectedAt,
    String rejectedBy,
    String rejectionReason,
    Instant startedAt,
    Instant completedAt
) {

    public AdapterResetRequest {
        if (requestId == null || learnerId == null || namespaceId == null) {
            throw new IllegalArgumentException("requestId, learnerId and namespaceId cannot be null");
        }
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (requestedBy == null || requestedBy.isBlank()) {
            throw new IllegalArgumentException("requestedBy cannot be null or blank");
        }
        if (progressPercent < 0 || progressPercent > 100) {
            throw new IllegalArgumentException("progressPercent must be 0..100 (current: " + progressPercent + ")");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }

    /**
     * 새 요청 생성.
     *
     * @param autoApproved true면 APPROVED, false면 PENDING_APPROVAL로 시작
     */
    public static AdapterResetRequest create(
        LearnerId learnerId,
        NamespaceId namespaceId,
        String subject,
        String requestedBy,
        String requesterRole,
        String reason,
        boolean autoApproved,
        Instant now
    ) {
        ResetStatus initial = autoApproved ? ResetStatus.APPROVED : ResetStatus.PENDING_APPROVAL;
        return new AdapterResetRequest(OperationId.generate(), learnerId, namespaceId, subject, initial,
            requestedBy, requesterRole, reason, null, 0, null, 0, null, now,
            autoApproved ? now : null, autoApproved ? requestedBy : null,
            null, null, null, null, null);
    }

    public AdapterResetRequest withApprovalRequestId(String approvalId) {
        return new AdapterResetRequest(requestId, learnerId, namespaceId, subject, status, requestedBy,
            requesterRole, reason, approvalId, progressPercent, currentStage, eventsReplayed, errorMessage,
            createdAt, approvedAt, approvedBy, rejectedAt, rejectedBy, rejectionReason, startedAt, completedAt);
    }

    public AdapterResetRequest approve(String decidedBy, Instant now) {
        ResetTransitions.validate(status, ResetStatus.APPROVED);
        return new AdapterResetRequest(requestId, learnerId, namespaceId, subject, ResetStatus.APPROVED,
            requestedBy, requesterRole, reason, approvalRequestId, progressPercent, currentStage, eventsReplayed,
            errorMessage, createdAt, now, decidedBy, rejectedAt, rejectedBy, rejectionReason, startedAt,
            completedAt);
    }

    public AdapterResetRequest reject(String decidedBy, String rejection, Instant now) {
        ResetTransitions.validate(status, ResetStatus.REJECTED);
        return new AdapterResetRequest(requestId, learnerId, namespaceId, subject, ResetStatus.REJECTED,
            requestedBy, requesterRole, reason, approvalRequestId, progressPercent, currentStage, eventsReplayed,
            errorMessage, createdAt, approvedAt, approvedBy, now, decidedBy, rejection, startedAt, now);
    }

    public AdapterResetRequest startExecuting(Instant now) {
        ResetTransitions.validate(status, ResetStatus.EXECUTING);
        return new AdapterResetRequest(requestId, learnerId, namespaceId, subject, ResetStatus.EXECUTING,
            requestedBy, requesterRole, reason, approvalRequestId, progressPercent, currentStage, eventsReplayed,
            errorMessage, createdAt, approvedAt, approvedBy, rejectedAt, rejectedBy, rejectionReason,
            startedAt == null ? now : startedAt, completedAt);
    }

    public AdapterResetRequest progress(int percent, String stage) {
        return new AdapterResetRequest(requestId, learnerId, namespaceId, subject, status, requestedBy,
            requesterRole, reason, approvalRequestId, percent, stage, eventsReplayed, errorMessage,
            createdAt, approvedAt, approvedBy, rejectedAt, rejectedBy, rejectionReason, startedAt, completedAt);
    }

    public AdapterResetRequest withEventsReplayed(long replayed, int percent) {
        return new AdapterResetRequest(requestId, learnerId, namespaceId, subject, status, requestedBy,
            requesterRole, reason, approvalRequestId, percent, currentStage, replayed, errorMessage,
            createdAt, approvedAt, approvedBy, rejectedAt, rejectedBy, rejectionReason, startedAt, completedAt);
    }

    public AdapterResetRequest complete(Instant now) {
        ResetTransitions.validate(status, ResetStatus.COMPLETED);
        return new AdapterResetRequest(requestId, learnerId, namespaceId, subject, ResetStatus.COMPLETED,
            requestedBy, requesterRole, reason, approvalRequestId, 100, "Completed", eventsReplayed, null,
            createdAt, approvedAt, approvedBy, rejectedAt, rejectedBy, rejectionReason, startedAt, now);
    }

    public AdapterResetRequest fail(String message, Instant now) {
        ResetTransitions.validate(status, ResetStatus.FAILED);
        return new AdapterResetRequest(requestId, learnerId, namespaceId, subject, ResetStatus.FAILED,
            requestedBy, requesterRole, reason, approvalRequestId, progressPercent, currentStage, eventsReplayed,
            message, createdAt, approvedAt, approvedBy, rejectedAt, rejectedBy, rejectionReason, startedAt, now);
    }
}
