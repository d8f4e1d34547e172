package io.prime.core.scorecard;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/// Decides whether an existing scorecard can be returned instead of recomputing.
///
/// Reuse requires all three:
/// - the same scoring revision
/// - an age in `[0, maxAge)`; a scorecard generated after `now` is never reused
/// - a freshest-evidence timestamp equal to the new evidence set's (both unknown counts as equal)
public final class ReusePolicy {

    public static final Duration DEFAULT_MAX_AGE = Duration.ofMinutes(10);

    private final Duration maxAge;

    public ReusePolicy() {
        this(DEFAULT_MAX_AGE);
    }

    public ReusePolicy(Duration maxAge) {
        Objects.requireNonNull(maxAge, "Max age required");
        if (maxAge.isNegative()) {
            throw new IllegalArgumentException("Max age cannot be negative");
        }
        this.maxAge = maxAge;
    }

    public Duration getMaxAge() {
        return maxAge;
    }

    /// Checks whether `existing` may be reused.
    ///
    /// @param existing latest scorecard of the subject, may be null
    /// @param freshestNewEvidence freshest measurement time of the new evidence, may be null
    /// @param now current time, not null
    /// @param scoringRevision revision currently deployed, not null
    /// @return true when the existing scorecard is still valid
    public boolean shouldReuse(
            Scorecard existing, Instant freshestNewEvidence, Instant now, String scoringRevision) {
        if (existing == null) {
            return false;
        }
        if (!existing.getScoringRevision().equals(scoringRevision)) {
            return false;
        }
        Duration age = Duration.between(existing.getGeneratedAt(), now);
        if (age.isNegative() || age.compareTo(maxAge) >= 0) {
            return false;
        }
        return Objects.equals(
                existing.getEvidenceSummary().freshestMeasuredAt(), freshestNewEvidence);
    }
}
