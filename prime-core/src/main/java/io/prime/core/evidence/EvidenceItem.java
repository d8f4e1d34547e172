package io.prime.core.evidence;

import io.prime.core.model.PrimeDomain;
import io.prime.core.model.SourceType;
import java.time.Instant;
import java.util.Objects;

/// One measurement supplied for one driver.
///
/// `measuredAt` may be null, meaning the age is unknown; calculators treat such items as
/// maximally stale.
///
/// @implNote Immutable and thread-safe after construction.
public final class EvidenceItem {

    private final PrimeDomain domain;
    private final String driverKey;
    private final EvidenceValue value;
    private final SourceType sourceType;
    private final Instant measuredAt;
    private final String unit;

    private EvidenceItem(Builder builder) {
        this.domain = Objects.requireNonNull(builder.domain, "Domain required");
        this.driverKey = Objects.requireNonNull(builder.driverKey, "Driver key required");
        this.value = Objects.requireNonNull(builder.value, "Value required");
        this.sourceType = Objects.requireNonNull(builder.sourceType, "Source type required");
        this.measuredAt = builder.measuredAt;
        this.unit = builder.unit;
    }

    public PrimeDomain getDomain() {
        return domain;
    }

    public String getDriverKey() {
        return driverKey;
    }

    public EvidenceValue getValue() {
        return value;
    }

    public SourceType getSourceType() {
        return sourceType;
    }

    /// Returns when the measurement was taken.
    ///
    /// @return measurement time, may be null when unknown
    public Instant getMeasuredAt() {
        return measuredAt;
    }

    /// Returns the unit of measurement.
    ///
    /// @return unit label, may be null for categorical values
    public String getUnit() {
        return unit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvidenceItem other)) {
            return false;
        }
        return domain == other.domain
                && driverKey.equals(other.driverKey)
                && value.equals(other.value)
                && sourceType == other.sourceType
                && Objects.equals(measuredAt, other.measuredAt)
                && Objects.equals(unit, other.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(domain, driverKey, value, sourceType, measuredAt, unit);
    }

    @Override
    public String toString() {
        return "EvidenceItem{"
                + domain.key()
                + "/"
                + driverKey
                + "="
                + value.display()
                + " via "
                + sourceType.key()
                + " at "
                + measuredAt
                + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link EvidenceItem}.
    ///
    /// Required fields: `domain`, `driverKey`, `value`, `sourceType`.
    public static final class Builder {
        private PrimeDomain domain;
        private String driverKey;
        private EvidenceValue value;
        private SourceType sourceType;
        private Instant measuredAt;
        private String unit;

        private Builder() {}

        public Builder domain(PrimeDomain domain) {
            this.domain = domain;
            return this;
        }

        public Builder driverKey(String driverKey) {
            this.driverKey = driverKey;
            return this;
        }

        public Builder value(EvidenceValue value) {
            this.value = value;
            return this;
        }

        /// Shortcut for a numeric value.
        public Builder value(double value) {
            this.value = EvidenceValue.numeric(value);
            return this;
        }

        /// Shortcut for a categorical value.
        public Builder value(String value) {
            this.value = EvidenceValue.categorical(value);
            return this;
        }

        public Builder sourceType(SourceType sourceType) {
            this.sourceType = sourceType;
            return this;
        }

        public Builder measuredAt(Instant measuredAt) {
            this.measuredAt = measuredAt;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        /// Builds the immutable item.
        ///
        /// @return new item, never null
        /// @throws NullPointerException if a required field is missing
        public EvidenceItem build() {
            return new EvidenceItem(this);
        }
    }
}
