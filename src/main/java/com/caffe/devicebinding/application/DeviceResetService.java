package com.caffe.devicebinding.application;

import com.caffe.devicebinding.domain.account.ObserverAccount;
import com.caffe.devicebinding.domain.binding.DeviceBindingEvent;
import com.caffe.devicebinding.domain.binding.DeviceBindingState;
import com.caffe.devicebinding.domain.binding.DeviceBindingStateMachine;
import com.caffe.devicebinding.domain.binding.ResetRequest;
import com.caffe.devicebinding.domain.binding.ResetRequestStatus;
import com.caffe.devicebinding.domain.ports.AccountDirectory;
import com.caffe.devicebinding.domain.ports.AuditTrailPort;
import com.caffe.devicebinding.domain.ports.BindingStore;
import com.caffe.devicebinding.domain.ports.NotifierPort;
import com.caffe.devicebinding.domain.ports.ResetRequestRepository;
import com.caffe.devicebinding.exception.AccountNotFoundException;
import com.caffe.devicebinding.exception.InvalidResetResolutionException;
import com.caffe.devicebinding.exception.ResetAlreadyPendingException;
import com.caffe.devicebinding.exception.ResetRequestNotFoundException;
import com.caffe.devicebinding.infrastructure.adapters.AuditTrailAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

@Service
public class DeviceResetService {

    private static final Logger log = LoggerFactory.getLogger(DeviceResetService.class);

    private final AccountDirectory accounts;
    private final BindingStore bindings;
    private final ResetRequestRepository resetRequests;
    private final NotifierPort notifier;
    private final AuditTrailPort auditTrail;
    private final DeviceBindingStateMachine stateMachine;
    private final BindingStateResolver stateResolver;

    public DeviceResetService(AccountDirectory accounts, BindingStore bindings, ResetRequestRepository resetRequests,
                              NotifierPort notifier, AuditTrailPort auditTrail,
                              DeviceBindingStateMachine stateMachine, BindingStateResolver stateResolver) {
        this.accounts = accounts;
        this.bindings = bindings;
        this.resetRequests = resetRequests;
        this.notifier = notifier;
        this.auditTrail = auditTrail;
        this.stateMachine = stateMachine;
        this.stateResolver = stateResolver;
    }

    /**
     * Files a pending reset request for an account whose last login was refused as a
     * device mismatch.
     *
     * @param contactEmail where the outcome is sent; the account's email when blank
     * @throws AccountNotFoundException if the username is unknown
     * @throws ResetAlreadyPendingException if the account already has a pending request
     * @throws com.caffe.devicebinding.exception.IllegalBindingTransitionException if there is no recent mismatch
     */
    @Transactional
    public ResetRequest requestReset(String username, String contactEmail) {
        log.info("Device reset requested for user: {}", username);

        ObserverAccount account = accounts.findByUsername(username)
                .orElseThrow(() -> new AccountNotFoundException("Account not found: " + username));

        DeviceBindingState state = stateResolver.currentState(account.getId());
        stateMachine.transition(account.getId(), state, DeviceBindingEvent.RESET_REQUESTED);

        String candidate = bindings.findByAccountId(account.getId())
                .flatMap(binding -> stateResolver.latestMismatchedCandidate(account.getId(), binding))
                .orElse(null);
        String recipient = contactEmail == null || contactEmail.isBlank() ? account.getEmail() : contactEmail.trim();

        ResetRequest saved;
        try {
            saved = resetRequests.insertPending(ResetRequest.pending(account.getId(), recipient, candidate));
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent device reset request for user: {}", username);
            throw new ResetAlreadyPendingException(account.getId(), e);
        }
        log.info("Device reset request {} created for user: {}", saved.getId(), username);

        Map<String, Object> payload = new HashMap<>();
        payload.put("requestId", saved.getId().toString());
        payload.put("hasCandidate", saved.hasCandidate());
        auditTrail.record(account.getId(), AuditTrailAdapter.RESET_REQUESTED, payload);

        notifyBestEffort(saved, n -> n.sendDeviceResetRequested(account, saved));
        return saved;
    }

    /**
     * Approves a pending request. The captured candidate digest becomes the new binding;
     * without a candidate the binding is cleared and the next login binds afresh.
     */
    @Transactional
    public ResetRequest approve(UUID requestId, String note) {
        ResetRequest request = loadPending(requestId);
        String actor = currentActor();
        log.info("Approving device reset {} for account {} by {}", requestId, request.getAccountId(), actor);

        DeviceBindingState state = stateResolver.currentState(request.getAccountId());
        stateMachine.transition(request.getAccountId(), state, DeviceBindingEvent.RESET_APPROVED);

        ResetRequest resolved = resetRequests.updateResolution(request.resolve(ResetRequestStatus.APPROVED, actor, note));

        if (resolved.hasCandidate()) {
            bindings.replace(resolved.getAccountId(), resolved.getCandidateDigest());
            auditTrail.record(resolved.getAccountId(), AuditTrailAdapter.BINDING_REPLACED,
                    Map.of("requestId", requestId.toString()));
            log.info("Binding of account {} replaced with reset candidate", resolved.getAccountId());
        } else {
            bindings.clear(resolved.getAccountId());
            auditTrail.record(resolved.getAccountId(), AuditTrailAdapter.BINDING_CLEARED,
                    Map.of("requestId", requestId.toString()));
            log.info("Binding of account {} cleared, next login will bind", resolved.getAccountId());
        }

        auditTrail.record(resolved.getAccountId(), AuditTrailAdapter.RESET_APPROVED, resolutionPayload(resolved));
        notifyResolved(resolved);
        return resolved;
    }

    /** Denies a pending request. The binding is left untouched. */
    @Transactional
    public ResetRequest deny(UUID requestId, String note) {
        ResetRequest request = loadPending(requestId);
        String actor = currentActor();
        log.info("Denying device reset {} for account {} by {}", requestId, request.getAccountId(), actor);

        DeviceBindingState state = stateResolver.currentState(request.getAccountId());
        stateMachine.transition(request.getAccountId(), state, DeviceBindingEvent.RESET_DENIED);

        ResetRequest resolved = resetRequests.updateResolution(request.resolve(ResetRequestStatus.DENIED, actor, note));

        auditTrail.record(resolved.getAccountId(), AuditTrailAdapter.RESET_DENIED, resolutionPayload(resolved));
        notifyResolved(resolved);
        return resolved;
    }

    @Transactional(readOnly = true)
    public ResetRequest get(UUID requestId) {
        return resetRequests.findById(requestId)
                .orElseThrow(() -> new ResetRequestNotFoundException(requestId));
    }

    @Transactional(readOnly = true)
    public List<ResetRequest> listByStatus(ResetRequestStatus status) {
        return resetRequests.findByStatus(status);
    }

    @Transactional(readOnly = true)
    public List<ResetRequest> historyForAccount(UUID accountId) {
        if (accounts.findById(accountId).isEmpty()) {
            throw new AccountNotFoundException("Account not found: " + accountId);
        }
        return resetRequests.findByAccountId(accountId);
    }

    private ResetRequest loadPending(UUID requestId) {
        ResetRequest request = get(requestId);
        if (!request.isPending()) {
            log.warn("Reset request {} is already {}", requestId, request.getStatus());
            throw new InvalidResetResolutionException(requestId, request.getStatus());
        }
        return request;
    }

    private void notifyResolved(ResetRequest resolved) {
        accounts.findById(resolved.getAccountId()).ifPresentOrElse(
                account -> notifyBestEffort(resolved, n -> n.sendDeviceResetResolved(account, resolved)),
                () -> log.warn("Account {} vanished before reset {} could be notified",
                        resolved.getAccountId(), resolved.getId()));
    }

    private void notifyBestEffort(ResetRequest request, Consumer<NotifierPort> send) {
        try {
            send.accept(notifier);
        } catch (Exception e) {
            log.error("ResetNotificationFailure for reset request {}: {}", request.getId(), e.getMessage(), e);
        }
    }

    private static Map<String, Object> resolutionPayload(ResetRequest resolved) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("requestId", resolved.getId().toString());
        payload.put("resolvedBy", resolved.getResolvedBy());
        if (resolved.getResolutionNote() != null) {
            payload.put("note", resolved.getResolutionNote());
        }
        return payload;
    }

    private static String currentActor() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        return auth != null ? auth.getName() : "system";
    }
}
