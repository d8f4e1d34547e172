package io.prime.core.scoring;

import java.time.Instant;

/// Computes the stability factor of a domain's confidence.
///
/// Stability measures how consistent repeated readings of the same driver are across the
/// driver's stability window. Implementations return a value in [0,1].
///
/// @see NoHistoryStabilityCalculator for the implementation used without measurement history
@FunctionalInterface
public interface StabilityCalculator {

    /// Computes stability for a resolved domain.
    ///
    /// @param evidence resolved domain evidence, not null
    /// @param now evaluation time, not null
    /// @return stability in [0,1]
    double compute(ResolvedDomainEvidence evidence, Instant now);

    /// Explanation line for a computed stability value.
    default String explain(double stability) {
        return "Stability: " + Math.round(stability * 100) + "%";
    }
}
