package com.caffe.devicebinding.application;

import com.caffe.devicebinding.application.DeviceLoginService.LoginResult;
import com.caffe.devicebinding.domain.DeviceFingerprintVerifier;
import com.caffe.devicebinding.domain.account.ObserverAccount;
import com.caffe.devicebinding.domain.binding.DeviceBindingState;
import com.caffe.devicebinding.domain.binding.DeviceBindingStateMachine;
import com.caffe.devicebinding.domain.binding.FingerprintBinding;
import com.caffe.devicebinding.domain.ports.AccountDirectory;
import com.caffe.devicebinding.domain.ports.AuditTrailPort;
import com.caffe.devicebinding.domain.ports.BindingStore;
import com.caffe.devicebinding.domain.ports.VerificationAttemptLog;
import com.caffe.devicebinding.domain.ports.VerificationAttemptLog.Outcome;
import com.caffe.devicebinding.exception.DeviceMismatchException;
import com.caffe.devicebinding.exception.InvalidCredentialsException;
import com.caffe.devicebinding.infrastructure.adapters.AuditTrailAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeviceLoginServiceTest {

    private static final String BOUND = "3f9a0c5e6b1d27a48e5f0c9d1b2a3e4f5061728394a5b6c7d8e9f00112233445";

    @Mock private AccountDirectory accounts;
    @Mock private BindingStore bindings;
    @Mock private VerificationAttemptLog attempts;
    @Mock private AuditTrailPort auditTrail;
    @Mock private BindingStateResolver stateResolver;

    private DeviceLoginService service;
    private ObserverAccount account;

    @BeforeEach
    void setUp() {
        service = new DeviceLoginService(accounts, bindings, attempts, auditTrail,
                new DeviceFingerprintVerifier(), new DeviceBindingStateMachine(), stateResolver);
        account = new ObserverAccount(UUID.randomUUID(), "observer.jane", "jane@example.org", "OBS-1042", Set.of("OBSERVER"));
    }

    @Test
    void wrongPasswordIsRejectedBeforeAnyDeviceCheck() {
        when(accounts.authenticate("observer.jane", "wrong")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.login("observer.jane", "wrong", BOUND, "10.0.0.1", "ua"))
                .isInstanceOf(InvalidCredentialsException.class);
        verifyNoInteractions(bindings, attempts, stateResolver);
    }

    @Test
    void firstLoginBindsThePresentedFingerprint() {
        givenAuthenticated();
        when(stateResolver.currentState(account.getId())).thenReturn(DeviceBindingState.UNBOUND);
        when(bindings.create(account.getId(), BOUND))
                .thenReturn(new FingerprintBinding(account.getId(), BOUND, OffsetDateTime.now()));

        LoginResult result = service.login("observer.jane", "pw", BOUND, "10.0.0.1", "ua");

        assertThat(result.newlyBound()).isTrue();
        assertThat(result.transition().to()).isEqualTo(DeviceBindingState.VERIFIED);
        verify(attempts).record(account.getId(), BOUND, Outcome.BOUND_FIRST_DEVICE, 1.0, "10.0.0.1", "ua");
        verify(auditTrail).record(eq(account.getId()), eq(AuditTrailAdapter.BINDING_CREATED), anyMap());
    }

    @Test
    void identicalFingerprintVerifies() {
        givenBoundTo(BOUND);

        LoginResult result = service.login("observer.jane", "pw", BOUND, "10.0.0.1", "ua");

        assertThat(result.newlyBound()).isFalse();
        assertThat(result.transition().to()).isEqualTo(DeviceBindingState.VERIFIED);
        verify(attempts).record(account.getId(), BOUND, Outcome.VERIFIED, 1.0, "10.0.0.1", "ua");
        verify(bindings, never()).create(any(), any());
    }

    @Test
    void nearIdenticalFingerprintVerifies() {
        givenBoundTo(BOUND);
        String candidate = "4" + BOUND.substring(1);

        LoginResult result = service.login("observer.jane", "pw", candidate, null, null);

        assertThat(result.transition().to()).isEqualTo(DeviceBindingState.VERIFIED);
    }

    @Test
    void differentDeviceIsRefusedAndRecorded() {
        givenBoundTo(BOUND);
        String candidate = "0123456789" + BOUND.substring(10);

        assertThatThrownBy(() -> service.login("observer.jane", "pw", candidate, "10.0.0.9", "ua"))
                .isInstanceOf(DeviceMismatchException.class)
                .satisfies(e -> {
                    DeviceMismatchException mismatch = (DeviceMismatchException) e;
                    assertThat(mismatch.getObserverId()).isEqualTo("OBS-1042");
                    assertThat(mismatch.isResetPending()).isFalse();
                    assertThat(mismatch.getMessage()).doesNotContain(BOUND);
                });

        verify(attempts).record(eq(account.getId()), eq(candidate), eq(Outcome.MISMATCHED), anyDouble(),
                eq("10.0.0.9"), eq("ua"));
        verify(auditTrail).record(eq(account.getId()), eq(AuditTrailAdapter.DEVICE_MISMATCH), anyMap());
    }

    @Test
    void mismatchWhileResetPendingReportsThePendingRequest() {
        givenAuthenticated();
        when(stateResolver.currentState(account.getId())).thenReturn(DeviceBindingState.RESET_REQUESTED);
        when(bindings.findByAccountId(account.getId()))
                .thenReturn(Optional.of(new FingerprintBinding(account.getId(), BOUND, OffsetDateTime.now())));

        assertThatThrownBy(() -> service.login("observer.jane", "pw", "fallback-abcdefghijklm", null, null))
                .isInstanceOf(DeviceMismatchException.class)
                .extracting(e -> ((DeviceMismatchException) e).isResetPending())
                .isEqualTo(true);
    }

    @Test
    void concurrentFirstLoginVerifiesAgainstTheWinner() {
        givenAuthenticated();
        when(stateResolver.currentState(account.getId())).thenReturn(DeviceBindingState.UNBOUND);
        when(bindings.create(account.getId(), BOUND)).thenThrow(new DataIntegrityViolationException("duplicate key"));
        when(bindings.findByAccountId(account.getId()))
                .thenReturn(Optional.of(new FingerprintBinding(account.getId(), BOUND, OffsetDateTime.now())));

        LoginResult result = service.login("observer.jane", "pw", BOUND, null, null);

        assertThat(result.newlyBound()).isFalse();
        assertThat(result.transition().to()).isEqualTo(DeviceBindingState.VERIFIED);
        verify(attempts, never()).record(any(), any(), eq(Outcome.BOUND_FIRST_DEVICE), anyDouble(), any(), any());
    }

    private void givenAuthenticated() {
        when(accounts.authenticate("observer.jane", "pw")).thenReturn(Optional.of(account));
    }

    private void givenBoundTo(String digest) {
        givenAuthenticated();
        when(stateResolver.currentState(account.getId())).thenReturn(DeviceBindingState.BOUND);
        when(bindings.findByAccountId(account.getId()))
                .thenReturn(Optional.of(new FingerprintBinding(account.getId(), digest, OffsetDateTime.now().minusDays(3))));
    }
}
