package com.caffe.devicebinding.exception;

import java.util.UUID;

public class ResetRequestNotFoundException extends RuntimeException {

    public ResetRequestNotFoundException(UUID requestId) {
        super("Reset request not found: " + requestId);
    }
}
