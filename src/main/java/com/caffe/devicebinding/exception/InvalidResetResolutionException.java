package com.caffe.devicebinding.exception;

import com.caffe.devicebinding.domain.binding.ResetRequestStatus;

import java.util.UUID;

/**
 * Thrown when an administrator tries to approve or deny a request that is no longer pending.
 */
public class InvalidResetResolutionException extends RuntimeException {

    private final UUID requestId;
    private final ResetRequestStatus currentStatus;

    public InvalidResetResolutionException(UUID requestId, ResetRequestStatus currentStatus) {
        super("Reset request " + requestId + " is already " + currentStatus);
        this.requestId = requestId;
        this.currentStatus = currentStatus;
    }

    public UUID getRequestId() { return requestId; }
    public ResetRequestStatus getCurrentStatus() { return currentStatus; }
}
