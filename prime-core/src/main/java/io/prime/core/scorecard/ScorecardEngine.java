package io.prime.core.scorecard;

import io.prime.core.evidence.EvidenceSet;
import io.prime.core.model.PrimeDomain;
import io.prime.core.registry.DomainDefinition;
import io.prime.core.registry.Driver;
import io.prime.core.registry.DriverRegistry;
import io.prime.core.registry.SourceQualityTable;
import io.prime.core.scoring.ConfidenceCalculator;
import io.prime.core.scoring.ConfidenceResult;
import io.prime.core.scoring.DomainResult;
import io.prime.core.scoring.DomainScoreCalculator;
import io.prime.core.scoring.DomainScoreResult;
import io.prime.core.scoring.DriverContribution;
import io.prime.core.scoring.DriverEvidence;
import io.prime.core.scoring.EvidenceResolver;
import io.prime.core.scoring.PrimeAggregate;
import io.prime.core.scoring.PrimeScoreAggregator;
import io.prime.core.scoring.ResolvedDomainEvidence;
import io.prime.core.scoring.RiskFlag;
import io.prime.core.scoring.StabilityCalculator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Computes scorecards from evidence.
///
/// Each domain is resolved once and handed to both the confidence and the domain score
/// calculator. Domain results are aggregated into the Prime Score and packaged with the
/// explanation trail and an evidence summary.
///
/// ### Contracts
/// - **Postcondition**: every scorecard covers all five domains
/// - **Invariant**: output depends only on the evidence, `now`, the revision and the
///   configured rule set
///
/// @implNote Stateless and thread-safe. Only {@link io.prime.core.exception.ConfigurationException}
/// can escape, and only from construction of the rule set, never from computation.
///
/// @see ScorecardGenerator for the reuse guard around this engine
public final class ScorecardEngine {

    private static final Logger logger = Logger.getLogger(ScorecardEngine.class.getName());

    private final DriverRegistry registry;
    private final EvidenceResolver resolver;
    private final ConfidenceCalculator confidenceCalculator;
    private final DomainScoreCalculator scoreCalculator;
    private final PrimeScoreAggregator aggregator;
    private final ScorecardValidator validator = new ScorecardValidator();

    /// Creates an engine over a rule set.
    ///
    /// @param registry driver registry, not null
    /// @param qualityTable source quality multipliers, not null
    /// @param stabilityCalculator stability factor, not null
    /// @param aggregator prime aggregation policy, not null
    public ScorecardEngine(
            DriverRegistry registry,
            SourceQualityTable qualityTable,
            StabilityCalculator stabilityCalculator,
            PrimeScoreAggregator aggregator) {
        this.registry = Objects.requireNonNull(registry, "Registry required");
        this.resolver = new EvidenceResolver(qualityTable);
        this.confidenceCalculator = new ConfidenceCalculator(qualityTable, stabilityCalculator);
        this.scoreCalculator = new DomainScoreCalculator(qualityTable);
        this.aggregator = Objects.requireNonNull(aggregator, "Aggregator required");
    }

    public DriverRegistry getRegistry() {
        return registry;
    }

    /// Computes score, confidence and explanation for one domain.
    ///
    /// @param domain the domain, not null
    /// @param evidence the subject's evidence, not null
    /// @param now evaluation time, not null
    /// @return domain result, never null
    public DomainResult computeDomain(PrimeDomain domain, EvidenceSet evidence, Instant now) {
        DomainDefinition definition = registry.getDomain(domain);
        ResolvedDomainEvidence resolved = resolver.resolve(definition, evidence.forDomain(domain));
        DomainScoreResult score = scoreCalculator.compute(resolved);
        ConfidenceResult confidence = confidenceCalculator.compute(resolved, now);

        List<Driver> missing = resolved.missingDrivers();
        List<String> explanation = new ArrayList<>(score.explanation());
        if (!missing.isEmpty()) {
            explanation.add(
                    "Missing: "
                            + String.join(", ", missing.stream().map(Driver::getDisplayName).toList()));
        }
        explanation.addAll(confidence.explanation());

        String upgrade =
                missing.stream()
                        .max(Comparator.comparingDouble(Driver::getWeight))
                        .map(
                                driver ->
                                        driver.getMissingCopy() != null
                                                ? driver.getMissingCopy()
                                                : "Add " + driver.getDisplayName())
                        .orElse(null);

        Set<RiskFlag> flags = riskFlags(domain, resolved);
        for (RiskFlag flag : flags) {
            explanation.add("Flag: " + flag.description());
        }

        return new DomainResult(
                domain,
                score,
                confidence,
                explanation,
                missing.stream().map(Driver::getKey).toList(),
                upgrade,
                flags);
    }

    private static Set<RiskFlag> riskFlags(PrimeDomain domain, ResolvedDomainEvidence resolved) {
        Set<RiskFlag> flags = EnumSet.noneOf(RiskFlag.class);
        for (RiskFlag flag : RiskFlag.values()) {
            if (flag.domain() != domain) {
                continue;
            }
            resolved.getDriver(flag.driverKey())
                    .map(DriverEvidence::getScoringItem)
                    .filter(item -> flag.raisedBy(item.getValue()))
                    .ifPresent(item -> flags.add(flag));
        }
        return flags;
    }

    /// Computes every domain result.
    ///
    /// @param evidence the subject's evidence, not null
    /// @param now evaluation time, not null
    /// @return one result per domain in domain order, never null
    public List<DomainResult> computeDomains(EvidenceSet evidence, Instant now) {
        List<DomainResult> results = new ArrayList<>();
        for (PrimeDomain domain : PrimeDomain.values()) {
            results.add(computeDomain(domain, evidence, now));
        }
        return results;
    }

    /// Computes a fresh scorecard.
    ///
    /// @param evidence the subject's evidence, not null
    /// @param now evaluation time, stored as `generatedAt`, not null
    /// @param scoringRevision revision tag stored verbatim, not null
    /// @return new scorecard, never null
    public Scorecard computeScorecard(EvidenceSet evidence, Instant now, String scoringRevision) {
        Objects.requireNonNull(evidence, "Evidence required");
        Objects.requireNonNull(now, "Now required");
        Objects.requireNonNull(scoringRevision, "Scoring revision required");

        List<DomainResult> results = computeDomains(evidence, now);
        PrimeAggregate aggregate = aggregator.aggregate(results);

        Scorecard.Builder builder =
                Scorecard.builder()
                        .generatedAt(now)
                        .scoringRevision(scoringRevision)
                        .primeScore(
                                aggregate.primeScore() != null
                                        ? (int) Math.round(aggregate.primeScore())
                                        : null)
                        .primeConfidence((int) Math.round(aggregate.primeConfidence()))
                        .evidenceSummary(EvidenceSummary.of(evidence));

        List<ScorecardEvidence> trail = new ArrayList<>();
        Set<RiskFlag> flags = EnumSet.noneOf(RiskFlag.class);
        for (DomainResult result : results) {
            flags.addAll(result.getRiskFlags());
            builder.domainScore(result.getDomain(), result.getDisplayScore())
                    .domainConfidence(result.getDomain(), result.getDisplayConfidence())
                    .howCalculated(result.getDomain(), result.getExplanation());
            for (DriverContribution contribution : result.getScoreResult().contributions()) {
                trail.add(
                        new ScorecardEvidence(
                                result.getDomain(),
                                contribution.driverKey(),
                                contribution.item().getSourceType(),
                                contribution.item().getMeasuredAt(),
                                contribution.item().getValue(),
                                contribution.item().getUnit(),
                                (int) Math.round(contribution.subscore())));
            }
        }
        Scorecard scorecard = builder.evidence(trail).riskFlags(flags).build();

        List<String> violations = validator.validate(scorecard);
        if (!violations.isEmpty()) {
            logger.warning("Scorecard failed validation: " + String.join("; ", violations));
        }
        logger.info(
                "Computed scorecard: prime="
                        + scorecard.getPrimeScore()
                        + ", confidence="
                        + scorecard.getPrimeConfidence()
                        + ", scored domains="
                        + aggregate.scoredDomains()
                        + ", revision="
                        + scoringRevision);
        return scorecard;
    }
}
