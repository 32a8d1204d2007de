package com.caffe.devicebinding.exception;

/**
 * Raised by a notifier that could not deliver a reset notification. Callers log it;
 * it never undoes the reset request it was about.
 */
public class ResetNotificationException extends RuntimeException {

    public ResetNotificationException(String message) {
        super(message);
    }

    public ResetNotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
