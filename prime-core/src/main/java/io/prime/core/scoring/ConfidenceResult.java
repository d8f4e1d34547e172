package io.prime.core.scoring;

import java.util.List;

/// Outcome of a domain confidence computation.
///
/// The four factors are in [0,1]; `raw` is the unclamped blend before rules and
/// `confidence` the final value in [0,100].
public record ConfidenceResult(
        double confidence,
        double raw,
        double coverage,
        double quality,
        double freshness,
        double stability,
        List<String> explanation) {

    public ConfidenceResult {
        explanation = List.copyOf(explanation);
    }

    public ConfidenceLevel level() {
        return ConfidenceLevel.of(confidence);
    }
}
