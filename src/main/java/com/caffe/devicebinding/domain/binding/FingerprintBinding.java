package com.caffe.devicebinding.domain.binding;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * The one digest currently bound to an account.
 */
public class FingerprintBinding {

    private final UUID accountId;
    private final String boundDigest;
    private final OffsetDateTime boundAt;

    public FingerprintBinding(UUID accountId, String boundDigest, OffsetDateTime boundAt) {
        this.accountId = accountId;
        this.boundDigest = boundDigest;
        this.boundAt = boundAt;
    }

    public UUID getAccountId() { return accountId; }
    public String getBoundDigest() { return boundDigest; }
    public OffsetDateTime getBoundAt() { return boundAt; }
}
