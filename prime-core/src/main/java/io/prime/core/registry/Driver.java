package io.prime.core.registry;

import java.util.Objects;

/// Immutable definition of one measurable factor within a domain.
///
/// A driver carries its relative weight within the domain, the half-life used for the
/// freshness factor, the window a stability check would need, and the function that turns
/// a raw value into a 0-100 sub-score.
///
/// The dominance cap bounds the driver's share of the domain score once weights are
/// renormalized over the drivers present. The default of 1.0 leaves the share unbounded.
///
/// ### Validation Rules
/// - Weight must be between 0 and 1
/// - Dominance cap must be in (0, 1]
/// - Freshness half-life must be positive
/// - Stability window cannot be negative
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see DomainDefinition for the weight-sum invariant
/// @see ScoringFunction for the value mapping
public final class Driver {

    private final String key;
    private final String displayName;
    private final double weight;
    private final double dominanceCap;
    private final double freshnessHalfLifeDays;
    private final int stabilityWindowDays;
    private final ValueRange validRange;
    private final ScoringFunction scoring;
    private final String unit;
    private final String missingCopy;

    private Driver(Builder builder) {
        this.key = Objects.requireNonNull(builder.key, "Driver key required");
        this.displayName = builder.displayName != null ? builder.displayName : builder.key;
        this.weight = builder.weight;
        this.dominanceCap = builder.dominanceCap;
        this.freshnessHalfLifeDays = builder.freshnessHalfLifeDays;
        this.stabilityWindowDays = builder.stabilityWindowDays;
        this.validRange = builder.validRange;
        this.scoring = Objects.requireNonNull(builder.scoring, "Scoring function required");
        this.unit = builder.unit;
        this.missingCopy = builder.missingCopy;

        validate();
    }

    private void validate() {
        if (key.isBlank()) {
            throw new IllegalArgumentException("Driver key cannot be blank");
        }
        if (weight < 0 || weight > 1) {
            throw new IllegalArgumentException("Weight must be between 0 and 1: " + key);
        }
        if (!(dominanceCap > 0) || dominanceCap > 1) {
            throw new IllegalArgumentException("Dominance cap must be in (0, 1]: " + key);
        }
        if (!(freshnessHalfLifeDays > 0)) {
            throw new IllegalArgumentException("Freshness half-life must be positive: " + key);
        }
        if (stabilityWindowDays < 0) {
            throw new IllegalArgumentException("Stability window cannot be negative: " + key);
        }
    }

    public String getKey() {
        return key;
    }

    /// Returns the label used in explanation lines.
    ///
    /// @return display name (defaults to the key), never null
    public String getDisplayName() {
        return displayName;
    }

    public double getWeight() {
        return weight;
    }

    /// Returns the largest share of the domain score this driver may carry.
    ///
    /// @return cap in (0, 1], 1.0 when unbounded
    public double getDominanceCap() {
        return dominanceCap;
    }

    public double getFreshnessHalfLifeDays() {
        return freshnessHalfLifeDays;
    }

    public int getStabilityWindowDays() {
        return stabilityWindowDays;
    }

    /// Returns the physiologically valid range for numeric values.
    ///
    /// @return valid range, or null when the driver takes no range check
    public ValueRange getValidRange() {
        return validRange;
    }

    public ScoringFunction getScoring() {
        return scoring;
    }

    /// Returns the display unit for numeric values.
    ///
    /// @return unit label, may be null
    public String getUnit() {
        return unit;
    }

    /// Returns the hint shown to the user when this driver has no evidence.
    ///
    /// @return missing-driver copy, may be null
    public String getMissingCopy() {
        return missingCopy;
    }

    @Override
    public String toString() {
        return "Driver{" + key + ", weight=" + weight + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable Driver instances.
    ///
    /// Required fields: `key`, `scoring`
    public static final class Builder {
        private String key;
        private String displayName;
        private double weight;
        private double dominanceCap = 1.0;
        private double freshnessHalfLifeDays = 30;
        private int stabilityWindowDays;
        private ValueRange validRange;
        private ScoringFunction scoring;
        private String unit;
        private String missingCopy;

        private Builder() {}

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder dominanceCap(double dominanceCap) {
            this.dominanceCap = dominanceCap;
            return this;
        }

        /// Sets the freshness half-life.
        ///
        /// @param freshnessHalfLifeDays days after which freshness halves (default 30)
        /// @return this builder for chaining
        public Builder freshnessHalfLifeDays(double freshnessHalfLifeDays) {
            this.freshnessHalfLifeDays = freshnessHalfLifeDays;
            return this;
        }

        public Builder stabilityWindowDays(int stabilityWindowDays) {
            this.stabilityWindowDays = stabilityWindowDays;
            return this;
        }

        public Builder validRange(ValueRange validRange) {
            this.validRange = validRange;
            return this;
        }

        public Builder validRange(double min, double max) {
            this.validRange = new ValueRange(min, max);
            return this;
        }

        public Builder scoring(ScoringFunction scoring) {
            this.scoring = scoring;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder missingCopy(String missingCopy) {
            this.missingCopy = missingCopy;
            return this;
        }

        /// Builds the immutable driver.
        ///
        /// @return new Driver instance, never null
        /// @throws NullPointerException if key or scoring is null
        /// @throws IllegalArgumentException if weight, cap, half-life or window is invalid
        public Driver build() {
            return new Driver(this);
        }
    }
}
