package com.caffe.devicebinding.application;

import com.caffe.devicebinding.domain.account.ObserverAccount;
import com.caffe.devicebinding.domain.binding.DeviceBindingState;
import com.caffe.devicebinding.domain.binding.DeviceBindingStateMachine;
import com.caffe.devicebinding.domain.binding.FingerprintBinding;
import com.caffe.devicebinding.domain.binding.ResetRequest;
import com.caffe.devicebinding.domain.binding.ResetRequestStatus;
import com.caffe.devicebinding.domain.ports.AccountDirectory;
import com.caffe.devicebinding.domain.ports.AuditTrailPort;
import com.caffe.devicebinding.domain.ports.BindingStore;
import com.caffe.devicebinding.domain.ports.NotifierPort;
import com.caffe.devicebinding.domain.ports.ResetRequestRepository;
import com.caffe.devicebinding.exception.AccountNotFoundException;
import com.caffe.devicebinding.exception.IllegalBindingTransitionException;
import com.caffe.devicebinding.exception.InvalidResetResolutionException;
import com.caffe.devicebinding.exception.ResetAlreadyPendingException;
import com.caffe.devicebinding.exception.ResetNotificationException;
import com.caffe.devicebinding.infrastructure.adapters.AuditTrailAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeviceResetServiceTest {

    private static final String BOUND = "3f9a0c5e6b1d27a48e5f0c9d1b2a3e4f5061728394a5b6c7d8e9f00112233445";
    private static final String CANDIDATE = "9b8a7c6d5e4f30211203f4e5d6c7b8a99a8b7c6d5e4f30211203f4e5d6c7b8a9";

    @Mock private AccountDirectory accounts;
    @Mock private BindingStore bindings;
    @Mock private ResetRequestRepository resetRequests;
    @Mock private NotifierPort notifier;
    @Mock private AuditTrailPort auditTrail;
    @Mock private BindingStateResolver stateResolver;

    private DeviceResetService service;
    private ObserverAccount account;
    private FingerprintBinding binding;

    @BeforeEach
    void setUp() {
        service = new DeviceResetService(accounts, bindings, resetRequests, notifier, auditTrail,
                new DeviceBindingStateMachine(), stateResolver);
        account = new ObserverAccount(UUID.randomUUID(), "observer.jane", "jane@example.org", "OBS-1042", Set.of("OBSERVER"));
        binding = new FingerprintBinding(account.getId(), BOUND, OffsetDateTime.now().minusDays(2));
    }

    @AfterEach
    void clearSecurityContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void resetRequestAfterMismatchIsPersistedWithCandidate() {
        givenMismatched();
        when(resetRequests.insertPending(any())).thenAnswer(inv -> inv.getArgument(0));

        ResetRequest created = service.requestReset("observer.jane", null);

        assertThat(created.getStatus()).isEqualTo(ResetRequestStatus.PENDING);
        assertThat(created.getCandidateDigest()).isEqualTo(CANDIDATE);
        assertThat(created.getContactEmail()).isEqualTo("jane@example.org");
        verify(auditTrail).record(eq(account.getId()), eq(AuditTrailAdapter.RESET_REQUESTED), anyMap());
        verify(notifier).sendDeviceResetRequested(account, created);
    }

    @Test
    void explicitContactEmailIsUsed() {
        givenMismatched();
        when(resetRequests.insertPending(any())).thenAnswer(inv -> inv.getArgument(0));

        ResetRequest created = service.requestReset("observer.jane", " jane.alt@example.org ");

        assertThat(created.getContactEmail()).isEqualTo("jane.alt@example.org");
    }

    @Test
    void secondRequestWhilePendingIsRefusedWithoutWriting() {
        when(accounts.findByUsername("observer.jane")).thenReturn(Optional.of(account));
        when(stateResolver.currentState(account.getId())).thenReturn(DeviceBindingState.RESET_REQUESTED);

        assertThatThrownBy(() -> service.requestReset("observer.jane", null))
                .isInstanceOf(ResetAlreadyPendingException.class);
        verify(resetRequests, never()).insertPending(any());
        verifyNoInteractions(notifier);
    }

    @Test
    void racingInsertIsReportedAsAlreadyPending() {
        givenMismatched();
        when(resetRequests.insertPending(any())).thenThrow(new DataIntegrityViolationException("uk_pending_account"));

        assertThatThrownBy(() -> service.requestReset("observer.jane", null))
                .isInstanceOf(ResetAlreadyPendingException.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
        verifyNoInteractions(notifier);
    }

    @Test
    void resetWithoutRecentMismatchIsRefused() {
        when(accounts.findByUsername("observer.jane")).thenReturn(Optional.of(account));
        when(stateResolver.currentState(account.getId())).thenReturn(DeviceBindingState.BOUND);

        assertThatThrownBy(() -> service.requestReset("observer.jane", null))
                .isInstanceOf(IllegalBindingTransitionException.class);
        verify(resetRequests, never()).insertPending(any());
    }

    @Test
    void unknownAccountIsReported() {
        when(accounts.findByUsername("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.requestReset("ghost", null)).isInstanceOf(AccountNotFoundException.class);
    }

    @Test
    void notificationFailureDoesNotFailTheRequest() {
        givenMismatched();
        when(resetRequests.insertPending(any())).thenAnswer(inv -> inv.getArgument(0));
        doThrow(new ResetNotificationException("smtp down")).when(notifier).sendDeviceResetRequested(any(), any());

        ResetRequest created = service.requestReset("observer.jane", null);

        assertThat(created.isPending()).isTrue();
        verify(resetRequests).insertPending(any());
    }

    @Test
    void approvalReplacesTheBindingWithTheCandidate() {
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken("admin", null, List.of()));
        ResetRequest pending = givenPending(CANDIDATE);

        ResetRequest resolved = service.approve(pending.getId(), "called the observer");

        assertThat(resolved.getStatus()).isEqualTo(ResetRequestStatus.APPROVED);
        assertThat(resolved.getResolvedBy()).isEqualTo("admin");
        assertThat(resolved.getResolutionNote()).isEqualTo("called the observer");
        assertThat(resolved.getResolvedAt()).isNotNull();
        verify(bindings).replace(account.getId(), CANDIDATE);
        verify(bindings, never()).clear(any());
        verify(auditTrail).record(eq(account.getId()), eq(AuditTrailAdapter.BINDING_REPLACED), anyMap());
        verify(auditTrail).record(eq(account.getId()), eq(AuditTrailAdapter.RESET_APPROVED), anyMap());
        verify(notifier).sendDeviceResetResolved(account, resolved);
    }

    @Test
    void approvalWithoutCandidateClearsTheBinding() {
        ResetRequest pending = givenPending(null);

        ResetRequest resolved = service.approve(pending.getId(), null);

        assertThat(resolved.getResolvedBy()).isEqualTo("system");
        verify(bindings).clear(account.getId());
        verify(bindings, never()).replace(any(), any());
    }

    @Test
    void denialLeavesTheBindingAlone() {
        ResetRequest pending = givenPending(CANDIDATE);

        ResetRequest resolved = service.deny(pending.getId(), "not the observer");

        assertThat(resolved.getStatus()).isEqualTo(ResetRequestStatus.DENIED);
        verify(bindings, never()).replace(any(), any());
        verify(bindings, never()).clear(any());
        verify(auditTrail).record(eq(account.getId()), eq(AuditTrailAdapter.RESET_DENIED), anyMap());
    }

    @Test
    void resolvingATerminalRequestIsRefused() {
        ResetRequest approved = ResetRequest.pending(account.getId(), "jane@example.org", CANDIDATE)
                .resolve(ResetRequestStatus.APPROVED, "admin", null);
        when(resetRequests.findById(approved.getId())).thenReturn(Optional.of(approved));

        assertThatThrownBy(() -> service.deny(approved.getId(), null))
                .isInstanceOf(InvalidResetResolutionException.class);
        assertThatThrownBy(() -> service.approve(approved.getId(), null))
                .isInstanceOf(InvalidResetResolutionException.class);
        verify(resetRequests, never()).updateResolution(any());
        verifyNoInteractions(bindings, notifier);
    }

    @Test
    void resolutionNotificationFailureIsSwallowedAfterLogging() {
        ResetRequest pending = givenPending(CANDIDATE);
        doThrow(new ResetNotificationException("no channel")).when(notifier).sendDeviceResetResolved(any(), any());

        ResetRequest resolved = service.deny(pending.getId(), null);

        ArgumentCaptor<ResetRequest> written = ArgumentCaptor.forClass(ResetRequest.class);
        verify(resetRequests).updateResolution(written.capture());
        assertThat(written.getValue().getStatus()).isEqualTo(ResetRequestStatus.DENIED);
        assertThat(resolved.getStatus()).isEqualTo(ResetRequestStatus.DENIED);
    }

    private void givenMismatched() {
        when(accounts.findByUsername("observer.jane")).thenReturn(Optional.of(account));
        when(stateResolver.currentState(account.getId())).thenReturn(DeviceBindingState.MISMATCHED);
        when(bindings.findByAccountId(account.getId())).thenReturn(Optional.of(binding));
        when(stateResolver.latestMismatchedCandidate(account.getId(), binding)).thenReturn(Optional.of(CANDIDATE));
    }

    private ResetRequest givenPending(String candidate) {
        ResetRequest pending = ResetRequest.pending(account.getId(), "jane@example.org", candidate);
        when(resetRequests.findById(pending.getId())).thenReturn(Optional.of(pending));
        when(stateResolver.currentState(account.getId())).thenReturn(DeviceBindingState.RESET_REQUESTED);
        when(resetRequests.updateResolution(any())).thenAnswer(inv -> inv.getArgument(0));
        when(accounts.findById(account.getId())).thenReturn(Optional.of(account));
        return pending;
    }
}
