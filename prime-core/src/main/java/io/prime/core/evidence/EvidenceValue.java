package io.prime.core.evidence;

import java.math.BigDecimal;
import java.util.Objects;

/// Value carried by an evidence item.
///
/// Three cases:
/// - {@link Numeric} - a measured quantity (bpm, %, mg/dL, hours)
/// - {@link Categorical} - a bucketed answer or label (`"7-8h"`, `"mild"`, `"true"`)
/// - {@link Unestimable} - an extraction attempt that explicitly could not produce a value,
///   e.g. image-based body-fat analysis that returned "unable to estimate"
///
/// `Unestimable` is a distinct case rather than a magic number so calculators can tell
/// "someone tried" apart from "nothing there".
public sealed interface EvidenceValue
        permits EvidenceValue.Numeric, EvidenceValue.Categorical, EvidenceValue.Unestimable {

    /// Creates a numeric value.
    ///
    /// @param value finite measurement
    /// @return numeric value, never null
    static EvidenceValue numeric(double value) {
        return new Numeric(value);
    }

    /// Creates a categorical value.
    ///
    /// @param value category label, not null
    /// @return categorical value, never null
    static EvidenceValue categorical(String value) {
        return new Categorical(value);
    }

    /// Returns the unestimable marker.
    ///
    /// @return the singleton unestimable value
    static EvidenceValue unestimable() {
        return Unestimable.INSTANCE;
    }

    /// Returns true unless this is the unestimable marker.
    default boolean isEstimable() {
        return !(this instanceof Unestimable);
    }

    /// Human-readable form used in explanation lines.
    String display();

    record Numeric(double value) implements EvidenceValue {
        public Numeric {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Numeric evidence must be finite: " + value);
            }
        }

        @Override
        public String display() {
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }
    }

    record Categorical(String value) implements EvidenceValue {
        public Categorical {
            Objects.requireNonNull(value, "Categorical value required");
        }

        @Override
        public String display() {
            return value;
        }
    }

    enum Unestimable implements EvidenceValue {
        INSTANCE;

        @Override
        public String display() {
            return "unable to estimate";
        }
    }
}
