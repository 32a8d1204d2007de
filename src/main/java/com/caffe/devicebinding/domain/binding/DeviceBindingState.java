package com.caffe.devicebinding.domain.binding;

/**
 * Where an account stands with respect to its device binding
 */
public enum DeviceBindingState {
    /**
     * No digest bound yet; the next successful login binds one
     */
    UNBOUND,

    /**
     * A digest is bound and nothing is outstanding
     */
    BOUND,

    /**
     * The current login verified; terminal for that login
     */
    VERIFIED,

    /**
     * A login presented a fingerprint that did not verify
     */
    MISMATCHED,

    /**
     * A reset request is pending administrative decision
     */
    RESET_REQUESTED
}
