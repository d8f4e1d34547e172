package io.prime.core.scorecard;

import java.util.Optional;

/// Storage for scorecards and the latest-scorecard pointer per subject. Pure interface -
/// implementations can use any storage.
public interface ScorecardRepository {

    /// Find the scorecard the subject's latest pointer refers to.
    Optional<Scorecard> findLatest(String subjectId);

    /// Find scorecard by id.
    Scorecard findById(String scorecardId) throws ScorecardNotFoundException;

    /// Append a scorecard to the subject's history. Does not move the latest pointer.
    ///
    /// @return id of the stored scorecard
    String save(String subjectId, Scorecard scorecard);

    /// Point the subject's latest pointer at a stored scorecard.
    void setLatest(String subjectId, String scorecardId) throws ScorecardNotFoundException;
}
