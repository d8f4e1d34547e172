package io.prime.core.scorecard;

import io.prime.core.evidence.EvidenceSet;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Logger;

/// Idempotent generation: reuses the latest scorecard when nothing changed, computes a new
/// one otherwise.
///
/// Holds no state; the caller supplies the latest scorecard and persists the result.
public final class ScorecardGenerator {

    private static final Logger logger = Logger.getLogger(ScorecardGenerator.class.getName());

    private final ScorecardEngine engine;
    private final ReusePolicy reusePolicy;

    public ScorecardGenerator(ScorecardEngine engine, ReusePolicy reusePolicy) {
        this.engine = Objects.requireNonNull(engine, "Engine required");
        this.reusePolicy = Objects.requireNonNull(reusePolicy, "Reuse policy required");
    }

    public ScorecardEngine getEngine() {
        return engine;
    }

    /// Returns the existing scorecard when reusable, otherwise a freshly computed one.
    ///
    /// @param existingLatest latest scorecard of the subject, may be null
    /// @param evidence freshly loaded evidence, not null
    /// @param now current time, not null
    /// @param scoringRevision revision currently deployed, not null
    /// @return scorecard and whether it was reused, never null
    public GenerationResult generateOrReuse(
            Scorecard existingLatest, EvidenceSet evidence, Instant now, String scoringRevision) {
        if (reusePolicy.shouldReuse(
                existingLatest, evidence.freshestMeasuredAt(), now, scoringRevision)) {
            logger.info(
                    "Reusing scorecard generated at "
                            + existingLatest.getGeneratedAt()
                            + " for subject "
                            + evidence.getSubjectId());
            return new GenerationResult(existingLatest, true);
        }
        Scorecard scorecard = engine.computeScorecard(evidence, now, scoringRevision);
        return new GenerationResult(scorecard, false);
    }
}
