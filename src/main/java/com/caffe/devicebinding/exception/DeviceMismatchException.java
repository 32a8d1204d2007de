package com.caffe.devicebinding.exception;

import java.util.UUID;

/**
 * Thrown when the fingerprint presented at login does not verify against the
 * account's binding. Recoverable through a device reset request; mapped to
 * {@code DEVICE_MISMATCH} by {@link GlobalExceptionHandler}.
 */
public class DeviceMismatchException extends RuntimeException {

    private final UUID accountId;
    private final String observerId;
    private final boolean resetPending;

    public DeviceMismatchException(UUID accountId, String observerId, boolean resetPending) {
        super("This account is bound to another device");
        this.accountId = accountId;
        this.observerId = observerId;
        this.resetPending = resetPending;
    }

    public UUID getAccountId() { return accountId; }
    public String getObserverId() { return observerId; }
    public boolean isResetPending() { return resetPending; }
}
