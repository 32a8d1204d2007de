package com.caffe.devicebinding.exception;

/**
 * Thrown when username or password is wrong. Mapped to 401 {@code INVALID_CREDENTIALS}.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException(String message) {
        super(message);
    }
}
