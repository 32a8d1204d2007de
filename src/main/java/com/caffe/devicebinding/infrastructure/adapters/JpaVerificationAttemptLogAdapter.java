package com.caffe.devicebinding.infrastructure.adapters;

import com.caffe.devicebinding.domain.ports.VerificationAttemptLog;
import com.caffe.devicebinding.infrastructure.jpa.SpringVerificationAttemptRepository;
import com.caffe.devicebinding.infrastructure.jpa.VerificationAttemptEntity;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaVerificationAttemptLogAdapter implements VerificationAttemptLog {

    private static final int USER_AGENT_MAX = 512;

    private final SpringVerificationAttemptRepository attempts;

    public JpaVerificationAttemptLogAdapter(SpringVerificationAttemptRepository attempts) {
        this.attempts = attempts;
    }

    @Override
    public void record(UUID accountId, String candidateDigest, Outcome outcome, double similarity,
                       String ipAddress, String userAgent) {
        VerificationAttemptEntity e = new VerificationAttemptEntity();
        e.setAccountId(accountId);
        e.setCandidateDigest(candidateDigest);
        e.setOutcome(outcome.name());
        e.setSimilarity(similarity);
        e.setIpAddress(ipAddress);
        e.setUserAgent(userAgent != null && userAgent.length() > USER_AGENT_MAX
                ? userAgent.substring(0, USER_AGENT_MAX) : userAgent);
        attempts.save(e);
    }

    @Override
    public Optional<String> latestMismatchedCandidate(UUID accountId, OffsetDateTime since) {
        return attempts.findFirstByAccountIdAndOutcomeAndAttemptedAtAfterOrderByAttemptedAtDesc(
                        accountId, Outcome.MISMATCHED.name(), since)
                .map(VerificationAttemptEntity::getCandidateDigest);
    }
}
