package io.prime.core.registry;

import io.prime.core.evidence.EvidenceItem;
import java.util.Collection;
import java.util.Objects;

/// Declarative post-processing step applied to a domain's raw confidence blend.
///
/// Rules are attached to a {@link DomainDefinition} and evaluated in declaration order
/// after the raw blend. Each rule checks its condition independently.
///
/// ### Variants
/// - {@link Cap} - limits confidence unless matching evidence is present
/// - {@link Floor} - raises confidence when matching evidence is present
public sealed interface ConfidenceRule permits ConfidenceRule.Cap, ConfidenceRule.Floor {

    double limit();

    EvidenceCondition condition();

    String reason();

    /// Returns whether the rule is active for the given usable evidence.
    ///
    /// @param evidence usable evidence of the domain's active drivers, not null
    /// @return true if the rule should be applied
    boolean triggers(Collection<EvidenceItem> evidence);

    /// Applies the rule to a confidence value on the 0-100 scale.
    double apply(double confidence);

    /// Explanation line for a rule that changed the value, e.g.
    /// `"Capped at 40%: no lab biomarker present"`.
    String describe();

    private static void checkLimit(double limit) {
        if (limit < 0 || limit > 100) {
            throw new IllegalArgumentException("Rule limit must be between 0 and 100: " + limit);
        }
    }

    private static String percent(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    record Cap(double limit, EvidenceCondition condition, String reason) implements ConfidenceRule {
        public Cap {
            checkLimit(limit);
            Objects.requireNonNull(condition, "Condition required");
            Objects.requireNonNull(reason, "Reason required");
        }

        @Override
        public boolean triggers(Collection<EvidenceItem> evidence) {
            return !condition.matchesAny(evidence);
        }

        @Override
        public double apply(double confidence) {
            return Math.min(confidence, limit);
        }

        @Override
        public String describe() {
            return "Capped at " + percent(limit) + "%: " + reason;
        }
    }

    record Floor(double limit, EvidenceCondition condition, String reason)
            implements ConfidenceRule {
        public Floor {
            checkLimit(limit);
            Objects.requireNonNull(condition, "Condition required");
            Objects.requireNonNull(reason, "Reason required");
        }

        @Override
        public boolean triggers(Collection<EvidenceItem> evidence) {
            return condition.matchesAny(evidence);
        }

        @Override
        public double apply(double confidence) {
            return Math.max(confidence, limit);
        }

        @Override
        public String describe() {
            return "Raised to " + percent(limit) + "%: " + reason;
        }
    }
}
