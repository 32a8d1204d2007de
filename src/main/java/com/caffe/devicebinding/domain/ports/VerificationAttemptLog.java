package com.caffe.devicebinding.domain.ports;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only record of login verifications.
 */
public interface VerificationAttemptLog {

    enum Outcome { BOUND_FIRST_DEVICE, VERIFIED, MISMATCHED }

    void record(UUID accountId, String candidateDigest, Outcome outcome, double similarity,
                String ipAddress, String userAgent);

    /** Candidate digest of the latest mismatched attempt after {@code since}. */
    Optional<String> latestMismatchedCandidate(UUID accountId, OffsetDateTime since);
}
