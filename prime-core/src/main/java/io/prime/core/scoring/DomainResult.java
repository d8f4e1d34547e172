package io.prime.core.scoring;

import io.prime.core.model.PrimeDomain;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Score, confidence and explanation of one domain.
///
/// Scores and confidences keep full precision here; {@link #getDisplayScore()} and
/// {@link #getDisplayConfidence()} give the whole-number values stored on a scorecard.
///
/// @implNote Immutable and thread-safe after construction.
public final class DomainResult {

    private final PrimeDomain domain;
    private final DomainScoreResult score;
    private final ConfidenceResult confidence;
    private final List<String> explanation;
    private final List<String> missingDrivers;
    private final String fastestUpgradeAction;
    private final Set<RiskFlag> riskFlags;

    public DomainResult(
            PrimeDomain domain,
            DomainScoreResult score,
            ConfidenceResult confidence,
            List<String> explanation,
            List<String> missingDrivers,
            String fastestUpgradeAction,
            Set<RiskFlag> riskFlags) {
        this.domain = Objects.requireNonNull(domain, "Domain required");
        this.score = Objects.requireNonNull(score, "Score result required");
        this.confidence = Objects.requireNonNull(confidence, "Confidence result required");
        this.explanation = List.copyOf(explanation);
        this.missingDrivers = List.copyOf(missingDrivers);
        this.fastestUpgradeAction = fastestUpgradeAction;
        this.riskFlags =
                riskFlags.isEmpty()
                        ? Set.of()
                        : Collections.unmodifiableSet(EnumSet.copyOf(riskFlags));
    }

    public PrimeDomain getDomain() {
        return domain;
    }

    /// Returns the full-precision score.
    ///
    /// @return score in [0,100], or null when the domain has no usable evidence
    public Double getScore() {
        return score.score();
    }

    public double getConfidence() {
        return confidence.confidence();
    }

    public Integer getDisplayScore() {
        return score.score() != null ? (int) Math.round(score.score()) : null;
    }

    public int getDisplayConfidence() {
        return (int) Math.round(confidence.confidence());
    }

    public ConfidenceLevel getConfidenceLevel() {
        return confidence.level();
    }

    public DomainScoreResult getScoreResult() {
        return score;
    }

    public ConfidenceResult getConfidenceResult() {
        return confidence;
    }

    /// Returns score lines followed by confidence lines.
    public List<String> getExplanation() {
        return explanation;
    }

    /// Returns keys of active drivers without usable evidence, in declaration order.
    public List<String> getMissingDrivers() {
        return missingDrivers;
    }

    /// Returns the suggested action for the highest-weight missing driver.
    ///
    /// @return action copy, or null when nothing is missing
    public String getFastestUpgradeAction() {
        return fastestUpgradeAction;
    }

    /// Returns the risk flags raised by this domain's readings.
    public Set<RiskFlag> getRiskFlags() {
        return riskFlags;
    }
}
