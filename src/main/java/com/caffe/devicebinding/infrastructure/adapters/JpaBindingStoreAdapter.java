package com.caffe.devicebinding.infrastructure.adapters;

import com.caffe.devicebinding.domain.binding.FingerprintBinding;
import com.caffe.devicebinding.domain.ports.BindingStore;
import com.caffe.devicebinding.infrastructure.jpa.FingerprintBindingEntity;
import com.caffe.devicebinding.infrastructure.jpa.SpringFingerprintBindingRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaBindingStoreAdapter implements BindingStore {
    private final SpringFingerprintBindingRepository bindings;

    public JpaBindingStoreAdapter(SpringFingerprintBindingRepository bindings) {
        this.bindings = bindings;
    }

    @Override
    public Optional<FingerprintBinding> findByAccountId(UUID accountId) {
        return bindings.findById(accountId).map(this::toDomain);
    }

    // own transaction, so a lost first-login race leaves the caller's session usable
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FingerprintBinding create(UUID accountId, String digest) {
        FingerprintBindingEntity e = new FingerprintBindingEntity(accountId, digest, OffsetDateTime.now());
        return toDomain(bindings.saveAndFlush(e));
    }

    @Override
    @Transactional
    public FingerprintBinding replace(UUID accountId, String digest) {
        FingerprintBindingEntity e = bindings.findById(accountId)
                .orElseGet(() -> new FingerprintBindingEntity(accountId, digest, OffsetDateTime.now()));
        e.setBoundDigest(digest);
        e.setBoundAt(OffsetDateTime.now());
        return toDomain(bindings.saveAndFlush(e));
    }

    @Override
    @Transactional
    public void clear(UUID accountId) {
        bindings.findById(accountId).ifPresent(bindings::delete);
    }

    private FingerprintBinding toDomain(FingerprintBindingEntity e) {
        return new FingerprintBinding(e.getAccountId(), e.getBoundDigest(), e.getBoundAt());
    }
}
