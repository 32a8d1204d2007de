package com.caffe.devicebinding.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "device_bindings")
public class FingerprintBindingEntity {

    @Id
    @Column(name = "account_id")
    private UUID accountId;

    @Column(name = "bound_digest", nullable = false, length = 128)
    private String boundDigest;

    @Column(name = "bound_at", nullable = false)
    private OffsetDateTime boundAt;

    @Version
    @Column(nullable = false)
    private Long version;

    public FingerprintBindingEntity() {}

    public FingerprintBindingEntity(UUID accountId, String boundDigest, OffsetDateTime boundAt) {
        this.accountId = accountId;
        this.boundDigest = boundDigest;
        this.boundAt = boundAt;
    }

    public UUID getAccountId() { return accountId; }
    public void setAccountId(UUID accountId) { this.accountId = accountId; }

    public String getBoundDigest() { return boundDigest; }
    public void setBoundDigest(String boundDigest) { this.boundDigest = boundDigest; }

    public OffsetDateTime getBoundAt() { return boundAt; }
    public void setBoundAt(OffsetDateTime boundAt) { this.boundAt = boundAt; }

    public Long getVersion() { return version; }
}
