package io.prime.core.scorecard;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory scorecard repository (default implementation). Thread-safe, no external
/// dependencies.
public final class InMemoryScorecardRepository implements ScorecardRepository {

    private final Map<String, Scorecard> scorecards = new ConcurrentHashMap<>();
    private final Map<String, String> latest = new ConcurrentHashMap<>();

    @Override
    public Optional<Scorecard> findLatest(String subjectId) {
        String id = latest.get(subjectId);
        return id == null ? Optional.empty() : Optional.ofNullable(scorecards.get(id));
    }

    @Override
    public Scorecard findById(String scorecardId) throws ScorecardNotFoundException {
        Scorecard scorecard = scorecards.get(scorecardId);
        if (scorecard == null) {
            throw new ScorecardNotFoundException("Scorecard not found: " + scorecardId);
        }
        return scorecard;
    }

    @Override
    public String save(String subjectId, Scorecard scorecard) {
        if (scorecard == null) {
            throw new IllegalArgumentException("Scorecard cannot be null");
        }
        String id = UUID.randomUUID().toString();
        scorecards.put(id, scorecard);
        return id;
    }

    @Override
    public void setLatest(String subjectId, String scorecardId) throws ScorecardNotFoundException {
        if (!scorecards.containsKey(scorecardId)) {
            throw new ScorecardNotFoundException("Scorecard not found: " + scorecardId);
        }
        latest.put(subjectId, scorecardId);
    }

    /// Number of stored scorecards across all subjects.
    public int size() {
        return scorecards.size();
    }

    /// Clear all scorecards (useful for testing).
    public void clear() {
        scorecards.clear();
        latest.clear();
    }
}
