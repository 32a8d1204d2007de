package com.caffe.devicebinding.domain.binding;

/**
 * Lifecycle of a device reset request
 */
public enum ResetRequestStatus {
    /**
     * Waiting for an administrator; at most one per account
     */
    PENDING,

    /**
     * Approved; the binding was replaced or cleared
     */
    APPROVED,

    /**
     * Denied; the account stays mismatched
     */
    DENIED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
