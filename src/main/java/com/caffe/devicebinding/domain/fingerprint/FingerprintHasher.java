package com.caffe.devicebinding.domain.fingerprint;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Reduces a {@link SignalSet} to a lowercase hex digest of its canonical form.
 */
public class FingerprintHasher {

    public static final String DEFAULT_ALGORITHM = "SHA-256";

    /** Shapes a client may present: a 256 to 512 bit hex digest, or a fallback identifier. */
    public static final String DIGEST_PATTERN = "[0-9a-f]{64,128}|" + FallbackDigests.PREFIX + "[0-9a-z]{13}";

    private final String algorithm;

    public FingerprintHasher() {
        this(DEFAULT_ALGORITHM);
    }

    public FingerprintHasher(String algorithm) {
        this.algorithm = algorithm;
    }

    public FingerprintResult hash(SignalSet signals) {
        if (signals == null) {
            return FingerprintResult.failure(GenerationError.SIGNALS_UNAVAILABLE, null);
        }
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            byte[] hashBytes = digest.digest(signals.canonicalForm().getBytes(StandardCharsets.UTF_8));
            return FingerprintResult.success(HexFormat.of().formatHex(hashBytes));
        } catch (NoSuchAlgorithmException e) {
            return FingerprintResult.failure(GenerationError.HASH_UNAVAILABLE, e);
        }
    }

    public String getAlgorithm() {
        return algorithm;
    }
}
