package io.prime.core.scoring;

import io.prime.core.model.PrimeDomain;
import java.util.List;

/// Combines domain results into the Prime Score.
///
/// The Prime Score is the unweighted mean of the scored domains, produced only when at
/// least `requiredScoredDomains` domains have a score. The default requires all five, so a
/// single unscored domain nulls the Prime Score. Prime confidence is the mean of all
/// domain confidences and is always produced.
public final class PrimeScoreAggregator {

    public static final int ALL_DOMAINS = PrimeDomain.values().length;

    private final int requiredScoredDomains;

    public PrimeScoreAggregator() {
        this(ALL_DOMAINS);
    }

    /// Creates an aggregator with a partial-coverage policy.
    ///
    /// @param requiredScoredDomains domains that must be scored, 1 to 5
    /// @throws IllegalArgumentException if out of range
    public PrimeScoreAggregator(int requiredScoredDomains) {
        if (requiredScoredDomains < 1 || requiredScoredDomains > ALL_DOMAINS) {
            throw new IllegalArgumentException(
                    "Required scored domains must be between 1 and " + ALL_DOMAINS);
        }
        this.requiredScoredDomains = requiredScoredDomains;
    }

    public int getRequiredScoredDomains() {
        return requiredScoredDomains;
    }

    /// Aggregates domain results.
    ///
    /// @param results one result per domain, not null
    /// @return aggregate, never null
    public PrimeAggregate aggregate(List<DomainResult> results) {
        if (results.isEmpty()) {
            return new PrimeAggregate(null, 0, 0);
        }
        double scoreSum = 0;
        int scored = 0;
        double confidenceSum = 0;
        for (DomainResult result : results) {
            confidenceSum += result.getConfidence();
            if (result.getScore() != null) {
                scoreSum += result.getScore();
                scored++;
            }
        }
        double confidence = Math.max(0.0, Math.min(100.0, confidenceSum / results.size()));
        Double score = scored >= requiredScoredDomains ? scoreSum / scored : null;
        return new PrimeAggregate(score, confidence, scored);
    }
}
