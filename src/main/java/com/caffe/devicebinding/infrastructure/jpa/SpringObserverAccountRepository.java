package com.caffe.devicebinding.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface SpringObserverAccountRepository extends JpaRepository<ObserverAccountEntity, UUID> {
    Optional<ObserverAccountEntity> findByUsername(String username);
    boolean existsByUsername(String username);
}
