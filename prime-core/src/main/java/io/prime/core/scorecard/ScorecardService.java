package io.prime.core.scorecard;

import io.prime.core.evidence.EvidenceSet;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Caller-side orchestration of scorecard generation for one subject.
///
/// Loads the subject's latest scorecard, runs the reuse guard, and persists a newly
/// computed scorecard before moving the latest pointer to it. Reused scorecards are not
/// stored again.
///
/// @implNote Concurrent requests for the same subject may both compute and store a
/// scorecard; the repository decides which pointer update wins.
public final class ScorecardService {

    private static final Logger logger = Logger.getLogger(ScorecardService.class.getName());

    private final ScorecardGenerator generator;
    private final ScorecardRepository repository;
    private final String scoringRevision;

    public ScorecardService(
            ScorecardGenerator generator, ScorecardRepository repository, String scoringRevision) {
        this.generator = Objects.requireNonNull(generator, "Generator required");
        this.repository = Objects.requireNonNull(repository, "Repository required");
        this.scoringRevision = Objects.requireNonNull(scoringRevision, "Scoring revision required");
    }

    public String getScoringRevision() {
        return scoringRevision;
    }

    /// Generates or reuses the subject's scorecard.
    ///
    /// @param subjectId subject identifier, not null
    /// @param evidence freshly loaded evidence of the subject, not null
    /// @param now current time, not null
    /// @return scorecard and whether it was reused, never null
    public GenerationResult generate(String subjectId, EvidenceSet evidence, Instant now) {
        Objects.requireNonNull(subjectId, "Subject ID required");
        Scorecard latest = repository.findLatest(subjectId).orElse(null);
        GenerationResult result = generator.generateOrReuse(latest, evidence, now, scoringRevision);
        if (result.cached()) {
            return result;
        }

        String id = repository.save(subjectId, result.scorecard());
        try {
            repository.setLatest(subjectId, id);
        } catch (ScorecardNotFoundException e) {
            throw new IllegalStateException("Stored scorecard disappeared: " + id, e);
        }
        logger.info("Stored scorecard " + id + " as latest for subject " + subjectId);
        return result;
    }

    /// Returns the subject's latest scorecard.
    public Optional<Scorecard> latest(String subjectId) {
        return repository.findLatest(subjectId);
    }
}
