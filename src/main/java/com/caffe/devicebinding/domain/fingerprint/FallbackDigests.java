package com.caffe.devicebinding.domain.fingerprint;

import java.security.SecureRandom;

/**
 * Low-confidence stand-ins for a real fingerprint digest. The prefix lets the server
 * recognise them; they are random, so they will not verify against a real binding.
 */
public final class FallbackDigests {

    public static final String PREFIX = "fallback-";

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 13;
    private static final SecureRandom RANDOM = new SecureRandom();

    private FallbackDigests() {}

    public static String generate() {
        StringBuilder sb = new StringBuilder(PREFIX.length() + SUFFIX_LENGTH).append(PREFIX);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    public static boolean isFallback(String digest) {
        return digest != null && digest.startsWith(PREFIX);
    }
}
