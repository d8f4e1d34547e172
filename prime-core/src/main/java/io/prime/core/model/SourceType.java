package io.prime.core.model;

import java.util.Locale;

/// Provenance category of a measurement.
///
/// Declaration order is the trust priority order, highest first: a lab result outranks
/// a device reading, which outranks a questionnaire answer. The numeric reliability of
/// each source lives in {@link io.prime.core.registry.SourceQualityTable}, not here.
public enum SourceType {
    LAB("lab"),
    TEST("test"),
    DEVICE("device"),
    MEASURED_SELF_REPORT("measured_self_report"),
    IMAGE_ESTIMATE("image_estimate"),
    SELF_REPORT_PROXY("self_report_proxy"),
    PRIOR("prior");

    private final String key;

    SourceType(String key) {
        this.key = key;
    }

    /// Returns the lowercase wire key, e.g. `"measured_self_report"`.
    ///
    /// @return wire key, never null
    public String key() {
        return key;
    }

    /// Returns true if this source is more trustworthy than `other` by priority order.
    ///
    /// @param other source to compare against, not null
    /// @return true if this source ranks strictly higher
    public boolean outranks(SourceType other) {
        return ordinal() < other.ordinal();
    }

    /// Resolves a source type from its wire key, case-insensitively.
    ///
    /// @param key wire key, not null
    /// @return matching source type, never null
    /// @throws IllegalArgumentException if no source type uses this key
    public static SourceType fromKey(String key) {
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (SourceType type : values()) {
            if (type.key.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + key);
    }
}
