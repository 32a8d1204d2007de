package com.caffe.devicebinding.domain.binding;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A user's appeal to replace the device bound to their account. Kept forever as
 * part of the audit trail.
 */
public class ResetRequest {

    private final UUID id;
    private final UUID accountId;
    private final OffsetDateTime requestedAt;
    private final String contactEmail;
    private final String candidateDigest;
    private final ResetRequestStatus status;
    private final OffsetDateTime resolvedAt;
    private final String resolvedBy;
    private final String resolutionNote;
    /** Row version the request was read at; null until stored. */
    private final Long version;

    public ResetRequest(UUID id, UUID accountId, OffsetDateTime requestedAt, String contactEmail,
                        String candidateDigest, ResetRequestStatus status, OffsetDateTime resolvedAt,
                        String resolvedBy, String resolutionNote) {
        this(id, accountId, requestedAt, contactEmail, candidateDigest, status, resolvedAt, resolvedBy,
                resolutionNote, null);
    }

    public ResetRequest(UUID id, UUID accountId, OffsetDateTime requestedAt, String contactEmail,
                        String candidateDigest, ResetRequestStatus status, OffsetDateTime resolvedAt,
                        String resolvedBy, String resolutionNote, Long version) {
        this.id = id;
        this.accountId = accountId;
        this.requestedAt = requestedAt;
        this.contactEmail = contactEmail;
        this.candidateDigest = candidateDigest;
        this.status = status;
        this.resolvedAt = resolvedAt;
        this.resolvedBy = resolvedBy;
        this.resolutionNote = resolutionNote;
        this.version = version;
    }

    public static ResetRequest pending(UUID accountId, String contactEmail, String candidateDigest) {
        return new ResetRequest(UUID.randomUUID(), accountId, OffsetDateTime.now(), contactEmail,
                candidateDigest, ResetRequestStatus.PENDING, null, null, null);
    }

    public ResetRequest resolve(ResetRequestStatus outcome, String actor, String note) {
        return new ResetRequest(id, accountId, requestedAt, contactEmail, candidateDigest,
                outcome, OffsetDateTime.now(), actor, note, version);
    }

    public UUID getId() { return id; }
    public UUID getAccountId() { return accountId; }
    public OffsetDateTime getRequestedAt() { return requestedAt; }
    public String getContactEmail() { return contactEmail; }
    public String getCandidateDigest() { return candidateDigest; }
    public ResetRequestStatus getStatus() { return status; }
    public OffsetDateTime getResolvedAt() { return resolvedAt; }
    public String getResolvedBy() { return resolvedBy; }
    public String getResolutionNote() { return resolutionNote; }
    public Long getVersion() { return version; }

    public boolean isPending() {
        return status == ResetRequestStatus.PENDING;
    }

    public boolean hasCandidate() {
        return candidateDigest != null && !candidateDigest.isEmpty();
    }
}
