package com.caffe.devicebinding.domain.fingerprint;

import java.util.Objects;

/**
 * Outcome of fingerprint generation: either a digest or the reason none was produced.
 * Callers branch on {@link #isSuccess()} instead of catching exceptions.
 */
public final class FingerprintResult {

    private final String digest;
    private final GenerationError error;
    private final Throwable cause;

    private FingerprintResult(String digest, GenerationError error, Throwable cause) {
        this.digest = digest;
        this.error = error;
        this.cause = cause;
    }

    public static FingerprintResult success(String digest) {
        return new FingerprintResult(Objects.requireNonNull(digest, "digest"), null, null);
    }

    public static FingerprintResult failure(GenerationError error, Throwable cause) {
        return new FingerprintResult(null, Objects.requireNonNull(error, "error"), cause);
    }

    public boolean isSuccess() { return digest != null; }
    public String getDigest() { return digest; }
    public GenerationError getError() { return error; }
    public Throwable getCause() { return cause; }

    /** The digest, or a freshly generated fallback digest when generation failed. */
    public String digestOrFallback() {
        return isSuccess() ? digest : FallbackDigests.generate();
    }

    @Override
    public String toString() {
        return isSuccess() ? "FingerprintResult{digest=" + digest + "}" : "FingerprintResult{error=" + error + "}";
    }
}
