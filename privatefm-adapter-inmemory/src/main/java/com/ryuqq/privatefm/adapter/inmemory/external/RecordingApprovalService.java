package com.ryuqq.privatefm.adapter.inmemory.external;

import com.ryuqq.privatefm.core.model.ApprovalRequest;
import com.ryuqq.privatefm.core.spi.ApprovalService;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ApprovalService} that records requests and returns generated approval ids.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingApprovalService implements ApprovalService {

    private final List<Submitted> submitted = new CopyOnWriteArrayList<>();
    private volatile boolean unavailable;

    @Override
    public String createApprovalRequest(ApprovalRequest request) {
        if (unavailable) {
            throw new IllegalStateException("Approval service unavailable");
        }
        String approvalId = UUID.randomUUID().toString();
        submitted.add(new Submitted(approvalId, request));
        return approvalId;
    }

    public List<Submitted> submitted() {
        return List.copyOf(submitted);
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    /**
     * A recorded approval request.
     */
    public record Submitted(String approvalId, ApprovalRequest request) {
    }
}
