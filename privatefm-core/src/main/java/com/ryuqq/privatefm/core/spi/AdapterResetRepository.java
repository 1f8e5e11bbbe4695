package com.ryuqq.privatefm.core.spi;

import com.ryuqq.privatefm.core.model.AdapterResetRequest;
import com.ryuqq.privatefm.core.model.OperationId;
import com.ryuqq.privatefm.core.statemachine.ResetStatus;

import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Adapter reset request persistence SPI.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AdapterResetRepository {

    /**
     * Inserts the request only if no non-terminal request exists for the same
     * (learner, subject) pair. The check and the insert are atomic.
     *
     * @param request the new request
     * @return true if inserted
     */
    boolean insertIfNoActive(AdapterResetRequest request);

    void save(AdapterResetRequest request);

    /**
     * Atomically applies {@code change} if the stored status is one of {@code expected}.
     *
     * @return the stored result, or empty if absent or the status did not match
     */
    Optional<AdapterResetRequest> transition(OperationId requestId, Set<ResetStatus> expected, UnaryOperator<AdapterResetRequest> change);

    Optional<AdapterResetRequest> find(OperationId requestId);

    Optional<AdapterResetRequest> findByApprovalId(String approvalRequestId);
}
