package com.caffe.devicebinding.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SpringVerificationAttemptRepository extends JpaRepository<VerificationAttemptEntity, UUID> {

    Optional<VerificationAttemptEntity> findFirstByAccountIdAndOutcomeAndAttemptedAtAfterOrderByAttemptedAtDesc(
            UUID accountId, String outcome, OffsetDateTime since);

    List<VerificationAttemptEntity> findByAccountIdOrderByAttemptedAtDesc(UUID accountId);
}
