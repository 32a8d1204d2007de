package com.caffe.devicebinding.domain.fingerprint;

/**
 * Why a device fingerprint could not be produced. Any of these degrades to a
 * fallback digest on the client; none of them blocks login.
 */
public enum GenerationError {
    /**
     * The signal source failed as a whole
     */
    SIGNALS_UNAVAILABLE,

    /**
     * The hashing primitive is missing or failed
     */
    HASH_UNAVAILABLE,

    /**
     * Collection and hashing did not finish within the allowed time
     */
    TIMED_OUT
}
