package com.caffe.devicebinding.domain.binding;

public enum DeviceBindingEvent {
    FIRST_LOGIN,
    LOGIN_VERIFIED,
    LOGIN_MISMATCHED,
    RESET_REQUESTED,
    RESET_APPROVED,
    RESET_DENIED
}
