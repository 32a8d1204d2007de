package com.caffe.devicebinding.infrastructure.adapters;

import com.caffe.devicebinding.domain.binding.ResetRequest;
import com.caffe.devicebinding.domain.binding.ResetRequestStatus;
import com.caffe.devicebinding.domain.ports.ResetRequestRepository;
import com.caffe.devicebinding.exception.ResetRequestNotFoundException;
import com.caffe.devicebinding.infrastructure.jpa.ResetRequestEntity;
import com.caffe.devicebinding.infrastructure.jpa.SpringResetRequestRepository;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaResetRequestRepositoryAdapter implements ResetRequestRepository {
    private final SpringResetRequestRepository requests;

    public JpaResetRequestRepositoryAdapter(SpringResetRequestRepository requests) {
        this.requests = requests;
    }

    @Override
    public ResetRequest insertPending(ResetRequest r) {
        ResetRequestEntity e = new ResetRequestEntity();
        e.setId(r.getId());
        e.setAccountId(r.getAccountId());
        e.setPendingAccountId(r.getAccountId());
        e.setRequestedAt(r.getRequestedAt());
        e.setContactEmail(r.getContactEmail());
        e.setCandidateDigest(r.getCandidateDigest());
        e.setStatus(ResetRequestStatus.PENDING.name());
        // flush now so a second pending row fails here, inside the caller's transaction
        return toDomain(requests.saveAndFlush(e));
    }

    @Override
    public Optional<ResetRequest> findById(UUID requestId) {
        return requests.findById(requestId).map(this::toDomain);
    }

    @Override
    public Optional<ResetRequest> findPendingByAccountId(UUID accountId) {
        return requests.findByPendingAccountId(accountId).map(this::toDomain);
    }

    @Override
    public List<ResetRequest> findByStatus(ResetRequestStatus status) {
        return requests.findByStatusOrderByRequestedAtAsc(status.name()).stream().map(this::toDomain).toList();
    }

    @Override
    public List<ResetRequest> findByAccountId(UUID accountId) {
        return requests.findByAccountIdOrderByRequestedAtDesc(accountId).stream().map(this::toDomain).toList();
    }

    @Override
    @Transactional
    public ResetRequest updateResolution(ResetRequest resolved) {
        ResetRequestEntity e = requests.findById(resolved.getId())
                .orElseThrow(() -> new ResetRequestNotFoundException(resolved.getId()));
        // resolved from a stale read; a resolution committed in between wins
        if (resolved.getVersion() != null && !resolved.getVersion().equals(e.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(ResetRequestEntity.class, resolved.getId());
        }
        e.setStatus(resolved.getStatus().name());
        e.setPendingAccountId(resolved.isPending() ? resolved.getAccountId() : null);
        e.setResolvedAt(resolved.getResolvedAt());
        e.setResolvedBy(resolved.getResolvedBy());
        e.setResolutionNote(resolved.getResolutionNote());
        return toDomain(requests.saveAndFlush(e));
    }

    private ResetRequest toDomain(ResetRequestEntity e) {
        return new ResetRequest(e.getId(), e.getAccountId(), e.getRequestedAt(), e.getContactEmail(),
                e.getCandidateDigest(), ResetRequestStatus.valueOf(e.getStatus()), e.getResolvedAt(),
                e.getResolvedBy(), e.getResolutionNote(), e.getVersion());
    }
}
