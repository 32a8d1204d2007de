package com.caffe.devicebinding.application;

import com.caffe.devicebinding.config.AppProperties;
import com.caffe.devicebinding.domain.binding.DeviceBindingState;
import com.caffe.devicebinding.domain.binding.FingerprintBinding;
import com.caffe.devicebinding.domain.ports.BindingStore;
import com.caffe.devicebinding.domain.ports.ResetRequestRepository;
import com.caffe.devicebinding.domain.ports.VerificationAttemptLog;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Derives an account's persisted {@link DeviceBindingState} from its binding, its
 * pending reset request and its recent verification attempts.
 */
@Component
public class BindingStateResolver {

    private final BindingStore bindings;
    private final ResetRequestRepository resetRequests;
    private final VerificationAttemptLog attempts;
    private final AppProperties props;

    public BindingStateResolver(BindingStore bindings, ResetRequestRepository resetRequests,
                                VerificationAttemptLog attempts, AppProperties props) {
        this.bindings = bindings;
        this.resetRequests = resetRequests;
        this.attempts = attempts;
        this.props = props;
    }

    public DeviceBindingState currentState(UUID accountId) {
        if (resetRequests.findPendingByAccountId(accountId).isPresent()) {
            return DeviceBindingState.RESET_REQUESTED;
        }
        Optional<FingerprintBinding> binding = bindings.findByAccountId(accountId);
        if (binding.isEmpty()) {
            return DeviceBindingState.UNBOUND;
        }
        return latestMismatchedCandidate(accountId, binding.get()).isPresent()
                ? DeviceBindingState.MISMATCHED
                : DeviceBindingState.BOUND;
    }

    /** Candidate of the latest mismatch that is newer than both the window start and the binding. */
    public Optional<String> latestMismatchedCandidate(UUID accountId, FingerprintBinding binding) {
        OffsetDateTime windowStart = OffsetDateTime.now()
                .minusMinutes(props.getDeviceBinding().getMismatchWindowMinutes());
        OffsetDateTime since = binding.getBoundAt() != null && binding.getBoundAt().isAfter(windowStart)
                ? binding.getBoundAt()
                : windowStart;
        return attempts.latestMismatchedCandidate(accountId, since);
    }
}
