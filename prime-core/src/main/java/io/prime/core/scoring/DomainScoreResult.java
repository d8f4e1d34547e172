package io.prime.core.scoring;

import java.util.List;

/// Outcome of a domain score computation.
///
/// @param score full-precision score in [0,100], null when no driver has usable evidence
/// @param contributions scored drivers in declaration order
/// @param explanation calculation notes
public record DomainScoreResult(
        Double score, List<DriverContribution> contributions, List<String> explanation) {

    public DomainScoreResult {
        contributions = List.copyOf(contributions);
        explanation = List.copyOf(explanation);
    }

    public boolean isScored() {
        return score != null;
    }
}
