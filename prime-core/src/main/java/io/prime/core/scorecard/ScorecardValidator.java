package io.prime.core.scorecard;

import io.prime.core.model.PrimeDomain;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Structural checks on an assembled scorecard.
///
/// Returns violations instead of throwing; the engine logs them.
public final class ScorecardValidator {

    /// Checks a scorecard.
    ///
    /// @param scorecard the scorecard to check, not null
    /// @return violation messages, empty when valid, never null
    public List<String> validate(Scorecard scorecard) {
        List<String> violations = new ArrayList<>();
        if (scorecard.getScoringRevision().isBlank()) {
            violations.add("Scoring revision is blank");
        }
        checkDomains("domain_scores", scorecard.getDomainScores(), violations);
        checkDomains("domain_confidence", scorecard.getDomainConfidence(), violations);
        checkDomains("how_calculated", scorecard.getHowCalculated(), violations);

        scorecard
                .getDomainScores()
                .forEach(
                        (domain, score) -> {
                            if (score != null && !inRange(score)) {
                                violations.add("Score out of range for " + domain.key() + ": " + score);
                            }
                        });
        scorecard
                .getDomainConfidence()
                .forEach(
                        (domain, confidence) -> {
                            if (confidence == null || !inRange(confidence)) {
                                violations.add(
                                        "Confidence out of range for " + domain.key() + ": " + confidence);
                            }
                        });
        if (scorecard.getPrimeScore() != null && !inRange(scorecard.getPrimeScore())) {
            violations.add("Prime score out of range: " + scorecard.getPrimeScore());
        }
        if (!inRange(scorecard.getPrimeConfidence())) {
            violations.add("Prime confidence out of range: " + scorecard.getPrimeConfidence());
        }
        return violations;
    }

    private static void checkDomains(String field, Map<PrimeDomain, ?> map, List<String> violations) {
        for (PrimeDomain domain : PrimeDomain.values()) {
            if (!map.containsKey(domain)) {
                violations.add(field + " is missing domain " + domain.key());
            }
        }
    }

    private static boolean inRange(int value) {
        return value >= 0 && value <= 100;
    }
}
