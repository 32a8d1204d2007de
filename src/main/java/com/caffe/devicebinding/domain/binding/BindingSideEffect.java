package com.caffe.devicebinding.domain.binding;

/**
 * What the caller must carry out after a transition
 */
public enum BindingSideEffect {
    NONE,
    CREATE_BINDING,
    SURFACE_MISMATCH,
    PERSIST_RESET_REQUEST,
    REPLACE_BINDING,
    MARK_DENIED
}
