package com.caffe.devicebinding.domain;

/**
 * Decides whether a fingerprint presented at login matches the one bound to the
 * account. Exact equality passes; otherwise the positional similarity over the shorter
 * digest must reach the threshold. Total over all inputs, never throws.
 */
public class DeviceFingerprintVerifier {

    public static final double DEFAULT_THRESHOLD = 0.95;

    private final double threshold;

    public DeviceFingerprintVerifier() {
        this(DEFAULT_THRESHOLD);
    }

    public DeviceFingerprintVerifier(double threshold) {
        if (Double.isNaN(threshold) || threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Similarity threshold must be in (0, 1], got " + threshold);
        }
        this.threshold = threshold;
    }

    public boolean verify(String candidate, String bound) {
        if (candidate == null || candidate.isEmpty() || bound == null || bound.isEmpty()) {
            return false;
        }
        if (candidate.equals(bound)) {
            return true;
        }
        return similarity(candidate, bound) >= threshold;
    }

    /**
     * Share of index positions, over the shorter string, holding the same character.
     * 0.0 when either side is null or empty.
     */
    public static double similarity(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int shorter = Math.min(a.length(), b.length());
        int matches = 0;
        for (int i = 0; i < shorter; i++) {
            if (a.charAt(i) == b.charAt(i)) {
                matches++;
            }
        }
        return (double) matches / shorter;
    }

    public double getThreshold() {
        return threshold;
    }
}
