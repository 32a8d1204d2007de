package com.caffe.devicebinding.domain.binding;

public record BindingTransition(DeviceBindingState from,
                                DeviceBindingEvent event,
                                DeviceBindingState to,
                                BindingSideEffect sideEffect) {}
