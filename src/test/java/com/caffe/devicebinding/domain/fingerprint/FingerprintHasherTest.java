package com.caffe.devicebinding.domain.fingerprint;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FingerprintHasherTest {

    private final FingerprintHasher hasher = new FingerprintHasher();

    private static SignalSet desktop() {
        return new SignalSet("1920x1080", "24", "Africa/Lagos", "en-NG", "Linux amd64", "8", "12",
                "data:image/png;base64,iVBORw0KGgo=", "Mozilla/5.0 (X11; Linux x86_64)");
    }

    @Test
    void sameSignalsGiveSameDigest() {
        FingerprintResult first = hasher.hash(desktop());
        FingerprintResult second = hasher.hash(desktop());

        assertThat(first.isSuccess()).isTrue();
        assertThat(first.getDigest()).isEqualTo(second.getDigest());
    }

    @Test
    void digestIsLowercaseSha256Hex() {
        String digest = hasher.hash(desktop()).getDigest();

        assertThat(digest).hasSize(64).matches("[0-9a-f]{64}");
        assertThat(hasher.getAlgorithm()).isEqualTo("SHA-256");
    }

    @Test
    void anyChangedSignalChangesTheDigest() {
        SignalSet otherTimezone = new SignalSet("1920x1080", "24", "Europe/Berlin", "en-NG", "Linux amd64", "8", "12",
                "data:image/png;base64,iVBORw0KGgo=", "Mozilla/5.0 (X11; Linux x86_64)");

        assertThat(hasher.hash(otherTimezone).getDigest()).isNotEqualTo(hasher.hash(desktop()).getDigest());
    }

    @Test
    void fieldOrderMatters() {
        SignalSet a = new SignalSet("8", "24", null, null, null, "1920x1080", null, null, null);
        SignalSet b = new SignalSet("1920x1080", "24", null, null, null, "8", null, null, null);

        assertThat(hasher.hash(a).getDigest()).isNotEqualTo(hasher.hash(b).getDigest());
    }

    @Test
    void knownCanonicalFormHashesToKnownDigest() {
        // SHA-256 of nine "unknown" fields joined by '|'
        SignalSet empty = SignalSet.unavailable();

        assertThat(empty.canonicalForm())
                .isEqualTo("unknown|unknown|unknown|unknown|unknown|unknown|unknown|unknown|unknown");
        assertThat(hasher.hash(empty).getDigest())
                .isEqualTo("f272d7f34ebc6f0870066f8fa66c3b1491681da7f48b83e39fb68b4ee12d4c99");
    }

    @Test
    void nullSignalsAreReportedNotThrown() {
        FingerprintResult result = hasher.hash(null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo(GenerationError.SIGNALS_UNAVAILABLE);
        assertThat(FallbackDigests.isFallback(result.digestOrFallback())).isTrue();
    }

    @Test
    void unknownAlgorithmIsReportedAsHashUnavailable() {
        FingerprintResult result = new FingerprintHasher("NOT-A-DIGEST").hash(desktop());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo(GenerationError.HASH_UNAVAILABLE);
        assertThat(result.getCause()).isNotNull();
        assertThat(result.digestOrFallback()).startsWith(FallbackDigests.PREFIX);
    }
}
