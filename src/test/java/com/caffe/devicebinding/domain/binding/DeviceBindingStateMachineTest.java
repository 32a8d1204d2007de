package com.caffe.devicebinding.domain.binding;

import com.caffe.devicebinding.exception.IllegalBindingTransitionException;
import com.caffe.devicebinding.exception.ResetAlreadyPendingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeviceBindingStateMachineTest {

    private final DeviceBindingStateMachine machine = new DeviceBindingStateMachine();
    private final UUID accountId = UUID.randomUUID();

    @Test
    void firstLoginBindsAndVerifies() {
        BindingTransition t = machine.transition(accountId, DeviceBindingState.UNBOUND, DeviceBindingEvent.FIRST_LOGIN);

        assertThat(t.to()).isEqualTo(DeviceBindingState.VERIFIED);
        assertThat(t.sideEffect()).isEqualTo(BindingSideEffect.CREATE_BINDING);
    }

    @Test
    void mismatchIsSurfacedFromBoundAndMismatched() {
        assertThat(machine.transition(accountId, DeviceBindingState.BOUND, DeviceBindingEvent.LOGIN_MISMATCHED))
                .isEqualTo(new BindingTransition(DeviceBindingState.BOUND, DeviceBindingEvent.LOGIN_MISMATCHED,
                        DeviceBindingState.MISMATCHED, BindingSideEffect.SURFACE_MISMATCH));
        assertThat(machine.transition(accountId, DeviceBindingState.MISMATCHED, DeviceBindingEvent.LOGIN_MISMATCHED).to())
                .isEqualTo(DeviceBindingState.MISMATCHED);
    }

    @Test
    void resetRequestIsOnlyAcceptedAfterAMismatch() {
        BindingTransition t = machine.transition(accountId, DeviceBindingState.MISMATCHED, DeviceBindingEvent.RESET_REQUESTED);

        assertThat(t.to()).isEqualTo(DeviceBindingState.RESET_REQUESTED);
        assertThat(t.sideEffect()).isEqualTo(BindingSideEffect.PERSIST_RESET_REQUEST);

        assertThatThrownBy(() -> machine.transition(accountId, DeviceBindingState.BOUND, DeviceBindingEvent.RESET_REQUESTED))
                .isInstanceOf(IllegalBindingTransitionException.class);
        assertThatThrownBy(() -> machine.transition(accountId, DeviceBindingState.UNBOUND, DeviceBindingEvent.RESET_REQUESTED))
                .isInstanceOf(IllegalBindingTransitionException.class);
    }

    @Test
    void secondResetRequestWhilePendingIsRefused() {
        assertThatThrownBy(() -> machine.transition(accountId, DeviceBindingState.RESET_REQUESTED, DeviceBindingEvent.RESET_REQUESTED))
                .isInstanceOf(ResetAlreadyPendingException.class)
                .extracting(e -> ((ResetAlreadyPendingException) e).getAccountId())
                .isEqualTo(accountId);
    }

    @Test
    void approvalRebindsAndDenialReturnsToMismatched() {
        BindingTransition approved = machine.transition(accountId, DeviceBindingState.RESET_REQUESTED, DeviceBindingEvent.RESET_APPROVED);
        BindingTransition denied = machine.transition(accountId, DeviceBindingState.RESET_REQUESTED, DeviceBindingEvent.RESET_DENIED);

        assertThat(approved.to()).isEqualTo(DeviceBindingState.BOUND);
        assertThat(approved.sideEffect()).isEqualTo(BindingSideEffect.REPLACE_BINDING);
        assertThat(denied.to()).isEqualTo(DeviceBindingState.MISMATCHED);
        assertThat(denied.sideEffect()).isEqualTo(BindingSideEffect.MARK_DENIED);
    }

    @Test
    void onlyAnApprovedResetLeadsBackToBound() {
        assertThat(machine.transitions())
                .filteredOn(t -> t.to() == DeviceBindingState.BOUND)
                .extracting(BindingTransition::event)
                .containsExactly(DeviceBindingEvent.RESET_APPROVED);
    }

    @Test
    void mismatchWhileResetPendingKeepsTheRequest() {
        BindingTransition t = machine.transition(accountId, DeviceBindingState.RESET_REQUESTED, DeviceBindingEvent.LOGIN_MISMATCHED);

        assertThat(t.to()).isEqualTo(DeviceBindingState.RESET_REQUESTED);
        assertThat(t.sideEffect()).isEqualTo(BindingSideEffect.SURFACE_MISMATCH);
    }

    @ParameterizedTest
    @EnumSource(value = DeviceBindingEvent.class, names = {"RESET_APPROVED", "RESET_DENIED"})
    void resolutionsNeedAPendingRequest(DeviceBindingEvent event) {
        for (DeviceBindingState state : new DeviceBindingState[]{
                DeviceBindingState.UNBOUND, DeviceBindingState.BOUND, DeviceBindingState.MISMATCHED}) {
            assertThat(machine.accepts(state, event)).as("%s on %s", event, state).isFalse();
        }
    }

    @Test
    void verifiedIsTerminal() {
        for (DeviceBindingEvent event : DeviceBindingEvent.values()) {
            assertThat(machine.accepts(DeviceBindingState.VERIFIED, event)).isFalse();
        }
    }
}
