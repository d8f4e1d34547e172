package io.prime.core.scoring;

import io.prime.core.evidence.EvidenceValue;
import io.prime.core.model.PrimeDomain;
import java.util.Locale;

/// Safety flags raised by individual readings, independent of scores and confidence.
///
/// Each flag watches one driver and is checked against the reading selected for scoring,
/// so out-of-range and unestimable values never raise a flag.
public enum RiskFlag {
    /// Systolic pressure at or above 180 mmHg.
    BP_CRISIS("bp_crisis", PrimeDomain.HEART, "bp", "Blood pressure in crisis range") {
        @Override
        public boolean raisedBy(EvidenceValue value) {
            return value instanceof EvidenceValue.Numeric numeric
                    && numeric.value() >= CRISIS_SYSTOLIC;
        }
    },
    SEVERE_PAIN("severe_pain", PrimeDomain.FRAME, "pain_limitation", "Severe pain limitation reported") {
        @Override
        public boolean raisedBy(EvidenceValue value) {
            return isCategory(value, "severe");
        }
    },
    DIABETES("diabetes", PrimeDomain.METABOLISM, "metabolic_risk", "Diabetes reported") {
        @Override
        public boolean raisedBy(EvidenceValue value) {
            return isCategory(value, "diabetes");
        }
    };

    private static final double CRISIS_SYSTOLIC = 180;

    private final String key;
    private final PrimeDomain domain;
    private final String driverKey;
    private final String description;

    RiskFlag(String key, PrimeDomain domain, String driverKey, String description) {
        this.key = key;
        this.domain = domain;
        this.driverKey = driverKey;
        this.description = description;
    }

    /// Returns the wire key, e.g. `"bp_crisis"`.
    public String key() {
        return key;
    }

    public PrimeDomain domain() {
        return domain;
    }

    /// Returns the key of the driver whose reading is checked.
    public String driverKey() {
        return driverKey;
    }

    public String description() {
        return description;
    }

    /// Checks a reading of this flag's driver.
    ///
    /// @param value the selected reading, not null
    /// @return true when the reading raises the flag
    public abstract boolean raisedBy(EvidenceValue value);

    /// Resolves a flag from its wire key, case-insensitively.
    ///
    /// @param key wire key, not null
    /// @return matching flag, never null
    /// @throws IllegalArgumentException if no flag has this key
    public static RiskFlag fromKey(String key) {
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (RiskFlag flag : values()) {
            if (flag.key.equals(normalized)) {
                return flag;
            }
        }
        throw new IllegalArgumentException("Unknown risk flag: " + key);
    }

    private static boolean isCategory(EvidenceValue value, String category) {
        return value instanceof EvidenceValue.Categorical categorical
                && categorical.value().trim().equalsIgnoreCase(category);
    }
}
