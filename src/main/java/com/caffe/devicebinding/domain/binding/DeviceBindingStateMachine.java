package com.caffe.devicebinding.domain.binding;

import com.caffe.devicebinding.exception.IllegalBindingTransitionException;
import com.caffe.devicebinding.exception.ResetAlreadyPendingException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.caffe.devicebinding.domain.binding.BindingSideEffect.*;
import static com.caffe.devicebinding.domain.binding.DeviceBindingEvent.*;
import static com.caffe.devicebinding.domain.binding.DeviceBindingState.*;

/**
 * Transition function of the device binding workflow. Only an approved reset re-enters
 * {@link DeviceBindingState#BOUND}, and a second reset request while one is pending is
 * refused here rather than at each call site.
 */
public class DeviceBindingStateMachine {

    private final Map<DeviceBindingState, Map<DeviceBindingEvent, BindingTransition>> table =
            new EnumMap<>(DeviceBindingState.class);

    public DeviceBindingStateMachine() {
        allow(UNBOUND, FIRST_LOGIN, VERIFIED, CREATE_BINDING);

        allow(BOUND, LOGIN_VERIFIED, VERIFIED, NONE);
        allow(BOUND, LOGIN_MISMATCHED, MISMATCHED, SURFACE_MISMATCH);

        allow(MISMATCHED, LOGIN_VERIFIED, VERIFIED, NONE);
        allow(MISMATCHED, LOGIN_MISMATCHED, MISMATCHED, SURFACE_MISMATCH);
        allow(MISMATCHED, DeviceBindingEvent.RESET_REQUESTED, DeviceBindingState.RESET_REQUESTED, PERSIST_RESET_REQUEST);

        allow(DeviceBindingState.RESET_REQUESTED, LOGIN_VERIFIED, VERIFIED, NONE);
        allow(DeviceBindingState.RESET_REQUESTED, LOGIN_MISMATCHED, DeviceBindingState.RESET_REQUESTED, SURFACE_MISMATCH);
        allow(DeviceBindingState.RESET_REQUESTED, RESET_APPROVED, BOUND, REPLACE_BINDING);
        allow(DeviceBindingState.RESET_REQUESTED, RESET_DENIED, MISMATCHED, MARK_DENIED);
    }

    /**
     * @param accountId only used to describe a refused duplicate reset request
     * @throws ResetAlreadyPendingException if a reset is requested while one is pending
     * @throws IllegalBindingTransitionException for any other event the state does not accept
     */
    public BindingTransition transition(UUID accountId, DeviceBindingState state, DeviceBindingEvent event) {
        if (state == DeviceBindingState.RESET_REQUESTED && event == DeviceBindingEvent.RESET_REQUESTED) {
            throw new ResetAlreadyPendingException(accountId);
        }
        BindingTransition transition = table.getOrDefault(state, Map.of()).get(event);
        if (transition == null) {
            throw new IllegalBindingTransitionException(state, event);
        }
        return transition;
    }

    public boolean accepts(DeviceBindingState state, DeviceBindingEvent event) {
        return table.getOrDefault(state, Map.of()).containsKey(event);
    }

    public List<BindingTransition> transitions() {
        return Collections.unmodifiableList(table.values().stream()
                .flatMap(byEvent -> byEvent.values().stream())
                .collect(Collectors.toList()));
    }

    private void allow(DeviceBindingState from, DeviceBindingEvent event, DeviceBindingState to, BindingSideEffect effect) {
        table.computeIfAbsent(from, s -> new EnumMap<>(DeviceBindingEvent.class))
                .put(event, new BindingTransition(from, event, to, effect));
    }
}
