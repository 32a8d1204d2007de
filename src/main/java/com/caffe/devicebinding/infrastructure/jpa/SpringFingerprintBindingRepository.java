package com.caffe.devicebinding.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface SpringFingerprintBindingRepository extends JpaRepository<FingerprintBindingEntity, UUID> {
}
