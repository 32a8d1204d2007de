package com.caffe.devicebinding.domain.fingerprint;

import java.util.List;
import java.util.Objects;

/**
 * The environment signals a client observed at one moment, normalised so that every
 * field is present. Unavailable signals carry the {@link #UNKNOWN} sentinel instead of
 * being omitted, which keeps the field count and concatenation order stable.
 *
 * <p>Concatenation order (see {@link #orderedValues()}):
 * <ol>
 *   <li>display geometry ({@code WIDTHxHEIGHT})</li>
 *   <li>colour depth</li>
 *   <li>timezone identifier</li>
 *   <li>language tag</li>
 *   <li>platform</li>
 *   <li>logical processor count</li>
 *   <li>enumerable capability count</li>
 *   <li>raster digest</li>
 *   <li>user agent prefix (at most {@value #USER_AGENT_PREFIX_LENGTH} characters)</li>
 * </ol>
 */
public class SignalSet {

    public static final String UNKNOWN = "unknown";
    public static final char DELIMITER = '|';
    public static final int USER_AGENT_PREFIX_LENGTH = 100;
    public static final int FIELD_COUNT = 9;

    private final String displayGeometry;
    private final String colorDepth;
    private final String timeZone;
    private final String language;
    private final String platform;
    private final String processorCount;
    private final String capabilityCount;
    private final String rasterDigest;
    private final String userAgentPrefix;

    public SignalSet(String displayGeometry, String colorDepth, String timeZone, String language,
                     String platform, String processorCount, String capabilityCount,
                     String rasterDigest, String userAgent) {
        this.displayGeometry = normalize(displayGeometry);
        this.colorDepth = normalize(colorDepth);
        this.timeZone = normalize(timeZone);
        this.language = normalize(language);
        this.platform = normalize(platform);
        this.processorCount = normalize(processorCount);
        this.capabilityCount = normalize(capabilityCount);
        this.rasterDigest = normalize(rasterDigest);
        this.userAgentPrefix = normalize(truncate(userAgent));
    }

    /** A signal set in which nothing could be observed. */
    public static SignalSet unavailable() {
        return new SignalSet(null, null, null, null, null, null, null, null, null);
    }

    public String getDisplayGeometry() { return displayGeometry; }
    public String getColorDepth() { return colorDepth; }
    public String getTimeZone() { return timeZone; }
    public String getLanguage() { return language; }
    public String getPlatform() { return platform; }
    public String getProcessorCount() { return processorCount; }
    public String getCapabilityCount() { return capabilityCount; }
    public String getRasterDigest() { return rasterDigest; }
    public String getUserAgentPrefix() { return userAgentPrefix; }

    public List<String> orderedValues() {
        return List.of(displayGeometry, colorDepth, timeZone, language, platform,
                processorCount, capabilityCount, rasterDigest, userAgentPrefix);
    }

    /** The delimiter-joined form that gets hashed. */
    public String canonicalForm() {
        return String.join(String.valueOf(DELIMITER), orderedValues());
    }

    public long unknownCount() {
        return orderedValues().stream().filter(UNKNOWN::equals).count();
    }

    private static String truncate(String userAgent) {
        if (userAgent == null || userAgent.length() <= USER_AGENT_PREFIX_LENGTH) {
            return userAgent;
        }
        return userAgent.substring(0, USER_AGENT_PREFIX_LENGTH);
    }

    private static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        return value.replace(DELIMITER, '/');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SignalSet other)) return false;
        return orderedValues().equals(other.orderedValues());
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderedValues());
    }

    @Override
    public String toString() {
        // raster digest is long and not useful in logs
        return "SignalSet{geometry=" + displayGeometry + ", depth=" + colorDepth + ", tz=" + timeZone
                + ", lang=" + language + ", platform=" + platform + ", cpus=" + processorCount
                + ", capabilities=" + capabilityCount + ", unknown=" + unknownCount() + "}";
    }
}
