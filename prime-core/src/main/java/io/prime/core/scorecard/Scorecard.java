package io.prime.core.scorecard;

import io.prime.core.model.PrimeDomain;
import io.prime.core.scoring.RiskFlag;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Immutable output of one scorecard generation.
///
/// Scores and confidences are whole numbers on the 0-100 scale. A domain without usable
/// evidence maps to a null score; the Prime Score is null when too few domains are scored.
///
/// @implNote Immutable and thread-safe after construction. Maps are unmodifiable
/// {@link EnumMap} views so null scores are allowed.
///
/// @see ScorecardEngine for how scorecards are computed
/// @see ReusePolicy for when an existing scorecard is returned instead
public final class Scorecard {

    private final Instant generatedAt;
    private final String scoringRevision;
    private final Map<PrimeDomain, Integer> domainScores;
    private final Map<PrimeDomain, Integer> domainConfidence;
    private final Integer primeScore;
    private final int primeConfidence;
    private final Map<PrimeDomain, List<String>> howCalculated;
    private final EvidenceSummary evidenceSummary;
    private final List<ScorecardEvidence> evidence;
    private final Set<RiskFlag> riskFlags;

    private Scorecard(Builder builder) {
        this.generatedAt = Objects.requireNonNull(builder.generatedAt, "Generated-at required");
        this.scoringRevision =
                Objects.requireNonNull(builder.scoringRevision, "Scoring revision required");
        this.domainScores = Collections.unmodifiableMap(new EnumMap<>(builder.domainScores));
        this.domainConfidence = Collections.unmodifiableMap(new EnumMap<>(builder.domainConfidence));
        this.primeScore = builder.primeScore;
        this.primeConfidence = builder.primeConfidence;
        this.howCalculated = Collections.unmodifiableMap(new EnumMap<>(builder.howCalculated));
        this.evidenceSummary =
                Objects.requireNonNull(builder.evidenceSummary, "Evidence summary required");
        this.evidence = List.copyOf(builder.evidence);
        this.riskFlags = Collections.unmodifiableSet(EnumSet.copyOf(builder.riskFlags));
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    /// Returns the rule-set revision the scorecard was computed under.
    public String getScoringRevision() {
        return scoringRevision;
    }

    /// Returns domain scores; a domain without usable evidence maps to null.
    public Map<PrimeDomain, Integer> getDomainScores() {
        return domainScores;
    }

    public Map<PrimeDomain, Integer> getDomainConfidence() {
        return domainConfidence;
    }

    /// Returns the Prime Score.
    ///
    /// @return score 0-100, or null when too few domains are scored
    public Integer getPrimeScore() {
        return primeScore;
    }

    public int getPrimeConfidence() {
        return primeConfidence;
    }

    /// Returns the explanation trail per domain.
    public Map<PrimeDomain, List<String>> getHowCalculated() {
        return howCalculated;
    }

    public EvidenceSummary getEvidenceSummary() {
        return evidenceSummary;
    }

    /// Returns the readings that contributed to domain scores.
    public List<ScorecardEvidence> getEvidence() {
        return evidence;
    }

    /// Returns the risk flags raised across all domains, in declaration order.
    public Set<RiskFlag> getRiskFlags() {
        return riskFlags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Scorecard other)) {
            return false;
        }
        return primeConfidence == other.primeConfidence
                && generatedAt.equals(other.generatedAt)
                && scoringRevision.equals(other.scoringRevision)
                && domainScores.equals(other.domainScores)
                && domainConfidence.equals(other.domainConfidence)
                && Objects.equals(primeScore, other.primeScore)
                && howCalculated.equals(other.howCalculated)
                && evidenceSummary.equals(other.evidenceSummary)
                && evidence.equals(other.evidence)
                && riskFlags.equals(other.riskFlags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                generatedAt,
                scoringRevision,
                domainScores,
                domainConfidence,
                primeScore,
                primeConfidence,
                howCalculated,
                evidenceSummary,
                evidence,
                riskFlags);
    }

    @Override
    public String toString() {
        return "Scorecard{generatedAt="
                + generatedAt
                + ", revision="
                + scoringRevision
                + ", prime="
                + primeScore
                + ", confidence="
                + primeConfidence
                + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable Scorecard instances.
    ///
    /// Required fields: `generatedAt`, `scoringRevision`, `evidenceSummary`
    public static final class Builder {
        private Instant generatedAt;
        private String scoringRevision;
        private Map<PrimeDomain, Integer> domainScores = new EnumMap<>(PrimeDomain.class);
        private Map<PrimeDomain, Integer> domainConfidence = new EnumMap<>(PrimeDomain.class);
        private Integer primeScore;
        private int primeConfidence;
        private Map<PrimeDomain, List<String>> howCalculated = new EnumMap<>(PrimeDomain.class);
        private EvidenceSummary evidenceSummary;
        private List<ScorecardEvidence> evidence = List.of();
        private Set<RiskFlag> riskFlags = EnumSet.noneOf(RiskFlag.class);

        private Builder() {}

        public Builder generatedAt(Instant generatedAt) {
            this.generatedAt = generatedAt;
            return this;
        }

        public Builder scoringRevision(String scoringRevision) {
            this.scoringRevision = scoringRevision;
            return this;
        }

        public Builder domainScores(Map<PrimeDomain, Integer> domainScores) {
            this.domainScores = enumCopy(domainScores);
            return this;
        }

        public Builder domainScore(PrimeDomain domain, Integer score) {
            this.domainScores.put(domain, score);
            return this;
        }

        public Builder domainConfidence(Map<PrimeDomain, Integer> domainConfidence) {
            this.domainConfidence = enumCopy(domainConfidence);
            return this;
        }

        public Builder domainConfidence(PrimeDomain domain, int confidence) {
            this.domainConfidence.put(domain, confidence);
            return this;
        }

        public Builder primeScore(Integer primeScore) {
            this.primeScore = primeScore;
            return this;
        }

        public Builder primeConfidence(int primeConfidence) {
            this.primeConfidence = primeConfidence;
            return this;
        }

        public Builder howCalculated(Map<PrimeDomain, List<String>> howCalculated) {
            Map<PrimeDomain, List<String>> copy = new EnumMap<>(PrimeDomain.class);
            howCalculated.forEach((domain, lines) -> copy.put(domain, List.copyOf(lines)));
            this.howCalculated = copy;
            return this;
        }

        public Builder howCalculated(PrimeDomain domain, List<String> lines) {
            this.howCalculated.put(domain, List.copyOf(lines));
            return this;
        }

        public Builder evidenceSummary(EvidenceSummary evidenceSummary) {
            this.evidenceSummary = evidenceSummary;
            return this;
        }

        public Builder evidence(List<ScorecardEvidence> evidence) {
            this.evidence = List.copyOf(evidence);
            return this;
        }

        public Builder riskFlags(Collection<RiskFlag> riskFlags) {
            this.riskFlags = EnumSet.noneOf(RiskFlag.class);
            this.riskFlags.addAll(riskFlags);
            return this;
        }

        /// Builds the immutable scorecard.
        ///
        /// @return new Scorecard instance, never null
        /// @throws NullPointerException if a required field is null
        public Scorecard build() {
            return new Scorecard(this);
        }

        private static <V> Map<PrimeDomain, V> enumCopy(Map<PrimeDomain, V> source) {
            Map<PrimeDomain, V> copy = new EnumMap<>(PrimeDomain.class);
            copy.putAll(source);
            return copy;
        }
    }
}
