package com.caffe.devicebinding.application;

import com.caffe.devicebinding.domain.DeviceFingerprintVerifier;
import com.caffe.devicebinding.domain.account.ObserverAccount;
import com.caffe.devicebinding.domain.binding.BindingSideEffect;
import com.caffe.devicebinding.domain.binding.BindingTransition;
import com.caffe.devicebinding.domain.binding.DeviceBindingEvent;
import com.caffe.devicebinding.domain.binding.DeviceBindingState;
import com.caffe.devicebinding.domain.binding.DeviceBindingStateMachine;
import com.caffe.devicebinding.domain.binding.FingerprintBinding;
import com.caffe.devicebinding.domain.fingerprint.FallbackDigests;
import com.caffe.devicebinding.domain.ports.AccountDirectory;
import com.caffe.devicebinding.domain.ports.AuditTrailPort;
import com.caffe.devicebinding.domain.ports.BindingStore;
import com.caffe.devicebinding.domain.ports.VerificationAttemptLog;
import com.caffe.devicebinding.domain.ports.VerificationAttemptLog.Outcome;
import com.caffe.devicebinding.exception.DeviceMismatchException;
import com.caffe.devicebinding.exception.InvalidCredentialsException;
import com.caffe.devicebinding.infrastructure.adapters.AuditTrailAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Optional;

/**
 * Credential login extended with device verification. The first successful login of
 * an unbound account binds the presented fingerprint; later logins must verify
 * against it.
 */
@Service
public class DeviceLoginService {

    private static final Logger log = LoggerFactory.getLogger(DeviceLoginService.class);

    private final AccountDirectory accounts;
    private final BindingStore bindings;
    private final VerificationAttemptLog attempts;
    private final AuditTrailPort auditTrail;
    private final DeviceFingerprintVerifier verifier;
    private final DeviceBindingStateMachine stateMachine;
    private final BindingStateResolver stateResolver;

    public DeviceLoginService(AccountDirectory accounts, BindingStore bindings, VerificationAttemptLog attempts,
                              AuditTrailPort auditTrail, DeviceFingerprintVerifier verifier,
                              DeviceBindingStateMachine stateMachine, BindingStateResolver stateResolver) {
        this.accounts = accounts;
        this.bindings = bindings;
        this.attempts = attempts;
        this.auditTrail = auditTrail;
        this.verifier = verifier;
        this.stateMachine = stateMachine;
        this.stateResolver = stateResolver;
    }

    /**
     * @return the authenticated account, on a verified (or freshly bound) device
     * @throws InvalidCredentialsException if username or password is wrong
     * @throws DeviceMismatchException if the fingerprint does not verify against the binding
     */
    @Transactional(noRollbackFor = DeviceMismatchException.class)
    public LoginResult login(String username, String password, String candidateDigest,
                             String ipAddress, String userAgent) {
        log.info("Login attempt for user: {}", username);

        ObserverAccount account = accounts.authenticate(username, password)
                .orElseThrow(() -> {
                    log.warn("Invalid credentials for user: {}", username);
                    return new InvalidCredentialsException("Username or password is incorrect");
                });

        DeviceBindingState state = stateResolver.currentState(account.getId());
        if (state == DeviceBindingState.UNBOUND) {
            Optional<FingerprintBinding> created = bindFirstDevice(account, candidateDigest, ipAddress, userAgent);
            if (created.isPresent()) {
                return new LoginResult(account, stateMachine.transition(account.getId(), state, DeviceBindingEvent.FIRST_LOGIN),
                        created.get(), true);
            }
            // lost the race to a concurrent first login, verify against the winner's binding
            state = DeviceBindingState.BOUND;
        }

        FingerprintBinding binding = bindings.findByAccountId(account.getId())
                .orElseThrow(() -> new IllegalStateException("Binding vanished for account " + account.getId()));

        boolean verified = verifier.verify(candidateDigest, binding.getBoundDigest());
        double similarity = DeviceFingerprintVerifier.similarity(candidateDigest, binding.getBoundDigest());
        BindingTransition transition = stateMachine.transition(account.getId(), state,
                verified ? DeviceBindingEvent.LOGIN_VERIFIED : DeviceBindingEvent.LOGIN_MISMATCHED);

        attempts.record(account.getId(), candidateDigest, verified ? Outcome.VERIFIED : Outcome.MISMATCHED,
                similarity, ipAddress, userAgent);

        if (transition.sideEffect() == BindingSideEffect.SURFACE_MISMATCH) {
            log.warn("Device mismatch for user: {} (similarity {}, state {} -> {})",
                    account.getUsername(), String.format("%.3f", similarity), transition.from(), transition.to());
            auditTrail.record(account.getId(), AuditTrailAdapter.DEVICE_MISMATCH, Map.of(
                    "similarity", similarity,
                    "lowConfidenceCandidate", FallbackDigests.isFallback(candidateDigest),
                    "ipAddress", ipAddress != null ? ipAddress : "unknown"));
            throw new DeviceMismatchException(account.getId(), account.getObserverId(),
                    transition.to() == DeviceBindingState.RESET_REQUESTED);
        }

        log.info("Device verified for user: {} (similarity {})", account.getUsername(), String.format("%.3f", similarity));
        return new LoginResult(account, transition, binding, false);
    }

    private Optional<FingerprintBinding> bindFirstDevice(ObserverAccount account, String candidateDigest,
                                                         String ipAddress, String userAgent) {
        if (FallbackDigests.isFallback(candidateDigest)) {
            log.warn("Binding low-confidence fallback fingerprint for user: {}", account.getUsername());
        }
        FingerprintBinding created;
        try {
            created = bindings.create(account.getId(), candidateDigest);
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent first login for user: {}, binding already created", account.getUsername());
            return Optional.empty();
        }
        attempts.record(account.getId(), candidateDigest, Outcome.BOUND_FIRST_DEVICE, 1.0, ipAddress, userAgent);
        auditTrail.record(account.getId(), AuditTrailAdapter.BINDING_CREATED, Map.of(
                "lowConfidence", FallbackDigests.isFallback(candidateDigest)));
        log.info("Bound first device for user: {}", account.getUsername());
        return Optional.of(created);
    }

    public record LoginResult(ObserverAccount account, BindingTransition transition,
                              FingerprintBinding binding, boolean newlyBound) {}
}
