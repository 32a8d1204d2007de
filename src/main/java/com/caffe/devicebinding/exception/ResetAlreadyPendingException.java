package com.caffe.devicebinding.exception;

import java.util.UUID;

/**
 * Thrown when a reset request is submitted while another one for the same account
 * is still pending.
 */
public class ResetAlreadyPendingException extends RuntimeException {

    private final UUID accountId;

    public ResetAlreadyPendingException(UUID accountId) {
        super("A device reset request is already in progress for this account");
        this.accountId = accountId;
    }

    public ResetAlreadyPendingException(UUID accountId, Throwable cause) {
        super("A device reset request is already in progress for this account", cause);
        this.accountId = accountId;
    }

    public UUID getAccountId() { return accountId; }
}
