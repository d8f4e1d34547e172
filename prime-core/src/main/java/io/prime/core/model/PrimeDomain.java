package io.prime.core.model;

import java.util.Locale;

/// The five fixed health categories that partition the scoring model.
///
/// Each domain carries a lowercase wire key (used in persisted scorecards and evidence
/// files) and a display label.
public enum PrimeDomain {
    HEART("heart", "Heart"),
    FRAME("frame", "Frame"),
    METABOLISM("metabolism", "Metabolism"),
    RECOVERY("recovery", "Recovery"),
    MIND("mind", "Mind");

    private final String key;
    private final String label;

    PrimeDomain(String key, String label) {
        this.key = key;
        this.label = label;
    }

    /// Returns the lowercase wire key, e.g. `"metabolism"`.
    ///
    /// @return wire key, never null
    public String key() {
        return key;
    }

    /// Returns the display label, e.g. `"Metabolism"`.
    ///
    /// @return label, never null
    public String label() {
        return label;
    }

    /// Resolves a domain from its wire key, case-insensitively.
    ///
    /// @param key wire key, not null
    /// @return matching domain, never null
    /// @throws IllegalArgumentException if no domain uses this key
    public static PrimeDomain fromKey(String key) {
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (PrimeDomain domain : values()) {
            if (domain.key.equals(normalized)) {
                return domain;
            }
        }
        throw new IllegalArgumentException("Unknown domain: " + key);
    }
}
