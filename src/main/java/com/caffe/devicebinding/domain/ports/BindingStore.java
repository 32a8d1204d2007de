package com.caffe.devicebinding.domain.ports;

import com.caffe.devicebinding.domain.binding.FingerprintBinding;

import java.util.Optional;
import java.util.UUID;

public interface BindingStore {
    Optional<FingerprintBinding> findByAccountId(UUID accountId);

    /**
     * Creates the first binding of an account.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException if one already exists
     */
    FingerprintBinding create(UUID accountId, String digest);

    /** Replaces the bound digest, creating the binding if the account has none. */
    FingerprintBinding replace(UUID accountId, String digest);

    void clear(UUID accountId);
}
