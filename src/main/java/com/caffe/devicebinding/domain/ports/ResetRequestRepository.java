package com.caffe.devicebinding.domain.ports;

import com.caffe.devicebinding.domain.binding.ResetRequest;
import com.caffe.devicebinding.domain.binding.ResetRequestStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ResetRequestRepository {

    /**
     * Inserts a new pending request.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException if the account already has a pending request
     */
    ResetRequest insertPending(ResetRequest request);

    Optional<ResetRequest> findById(UUID requestId);
    Optional<ResetRequest> findPendingByAccountId(UUID accountId);
    List<ResetRequest> findByStatus(ResetRequestStatus status);
    List<ResetRequest> findByAccountId(UUID accountId);

    /** Writes the terminal status of a pending request. */
    ResetRequest updateResolution(ResetRequest resolved);
}
