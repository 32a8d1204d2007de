package com.caffe.devicebinding.exception;

import com.caffe.devicebinding.domain.binding.DeviceBindingEvent;
import com.caffe.devicebinding.domain.binding.DeviceBindingState;

/**
 * Thrown when an event is not allowed in the account's current binding state,
 * e.g. a reset request from an account whose device verified.
 */
public class IllegalBindingTransitionException extends RuntimeException {

    private final DeviceBindingState state;
    private final DeviceBindingEvent event;

    public IllegalBindingTransitionException(DeviceBindingState state, DeviceBindingEvent event) {
        super("Event " + event + " is not allowed in state " + state);
        this.state = state;
        this.event = event;
    }

    public DeviceBindingState getState() { return state; }
    public DeviceBindingEvent getEvent() { return event; }
}
