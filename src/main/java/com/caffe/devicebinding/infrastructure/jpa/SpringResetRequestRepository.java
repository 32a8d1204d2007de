package com.caffe.devicebinding.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SpringResetRequestRepository extends JpaRepository<ResetRequestEntity, UUID> {

    Optional<ResetRequestEntity> findByPendingAccountId(UUID accountId);

    List<ResetRequestEntity> findByStatusOrderByRequestedAtAsc(String status);

    List<ResetRequestEntity> findByAccountIdOrderByRequestedAtDesc(UUID accountId);

    long countByAccountIdAndStatus(UUID accountId, String status);
}
