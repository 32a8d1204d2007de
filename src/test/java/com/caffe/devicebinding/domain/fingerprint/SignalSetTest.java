package com.caffe.devicebinding.domain.fingerprint;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SignalSetTest {

    @Test
    void missingSignalsBecomeTheUnknownSentinel() {
        SignalSet signals = new SignalSet(null, "", "   ", "en-US", null, "4", null, null, null);

        assertThat(signals.orderedValues()).hasSize(SignalSet.FIELD_COUNT);
        assertThat(signals.getDisplayGeometry()).isEqualTo(SignalSet.UNKNOWN);
        assertThat(signals.getColorDepth()).isEqualTo(SignalSet.UNKNOWN);
        assertThat(signals.getTimeZone()).isEqualTo(SignalSet.UNKNOWN);
        assertThat(signals.getLanguage()).isEqualTo("en-US");
        assertThat(signals.unknownCount()).isEqualTo(7);
    }

    @Test
    void delimiterInsideAFieldIsReplaced() {
        SignalSet signals = new SignalSet("1x1", "24", "UTC", "en", "Weird|Platform", "2", "3", "r", "ua|agent");

        assertThat(signals.getPlatform()).isEqualTo("Weird/Platform");
        assertThat(signals.canonicalForm().split("\\|")).hasSize(SignalSet.FIELD_COUNT);
    }

    @Test
    void userAgentIsTruncatedToItsPrefix() {
        String longAgent = "A".repeat(250);

        SignalSet signals = new SignalSet(null, null, null, null, null, null, null, null, longAgent);

        assertThat(signals.getUserAgentPrefix()).hasSize(SignalSet.USER_AGENT_PREFIX_LENGTH);
    }

    @Test
    void equalSignalsAreEqual() {
        SignalSet a = new SignalSet("1x1", "24", "UTC", "en", "p", "2", "3", "r", "ua");
        SignalSet b = new SignalSet("1x1", "24", "UTC", "en", "p", "2", "3", "r", "ua");

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    }
}
