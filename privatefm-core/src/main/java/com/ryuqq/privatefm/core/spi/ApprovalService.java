package com.ryuqq.privatefm.core.spi;

import com.ryuqq.privatefm.core.model.ApprovalRequest;

/**
 * External approval workflow SPI.
 *
 * <p>Decisions are delivered back asynchronously through the adapter reset
 * approval callback; this interface only creates the request.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ApprovalService {

    /**
     * Creates an approval request.
     *
     * @param request the request
     * @return the approval request id used to correlate the later decision
     */
    String createApprovalRequest(ApprovalRequest request);
}
