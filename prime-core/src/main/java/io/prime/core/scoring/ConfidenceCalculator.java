package io.prime.core.scoring;

import io.prime.core.evidence.EvidenceItem;
import io.prime.core.registry.ConfidenceRule;
import io.prime.core.registry.DomainDefinition;
import io.prime.core.registry.SourceQualityTable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/// Computes how much a domain score should be trusted.
///
/// ```
/// confidence = 100 x (0.35 x Coverage + 0.25 x Quality + 0.25 x Freshness + 0.15 x Stability)
/// ```
///
/// - **Coverage**: effective weight of drivers with usable evidence
/// - **Quality**: weight-averaged source multiplier of attempted drivers
/// - **Freshness**: weight-averaged `0.5 ^ (age_days / half_life_days)` of attempted drivers;
///   unknown measurement time gives 0, future timestamps count as age 0
/// - **Stability**: delegated to a {@link StabilityCalculator}
///
/// The blend is clamped to [0,100], then the domain's {@link ConfidenceRule}s run in order.
/// A rule is noted in the explanation only when it changes the value.
///
/// @implNote Stateless and thread-safe.
public final class ConfidenceCalculator {

    private static final Logger logger = Logger.getLogger(ConfidenceCalculator.class.getName());

    public static final double COVERAGE_WEIGHT = 0.35;
    public static final double QUALITY_WEIGHT = 0.25;
    public static final double FRESHNESS_WEIGHT = 0.25;
    public static final double STABILITY_WEIGHT = 0.15;

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final SourceQualityTable qualityTable;
    private final StabilityCalculator stabilityCalculator;

    public ConfidenceCalculator(
            SourceQualityTable qualityTable, StabilityCalculator stabilityCalculator) {
        this.qualityTable = Objects.requireNonNull(qualityTable, "Quality table required");
        this.stabilityCalculator =
                Objects.requireNonNull(stabilityCalculator, "Stability calculator required");
    }

    /// Resolves and computes confidence for one domain.
    ///
    /// @param definition domain rule set, not null
    /// @param evidence the domain's evidence items, not null
    /// @param now evaluation time, not null
    /// @return confidence result, never null
    public ConfidenceResult compute(
            DomainDefinition definition, List<EvidenceItem> evidence, Instant now) {
        return compute(new EvidenceResolver(qualityTable).resolve(definition, evidence), now);
    }

    /// Computes confidence for already resolved evidence.
    ///
    /// @param resolved resolved domain evidence, not null
    /// @param now evaluation time, not null
    /// @return confidence result, never null
    public ConfidenceResult compute(ResolvedDomainEvidence resolved, Instant now) {
        List<DriverEvidence> attempted = resolved.activeDrivers();
        if (attempted.isEmpty()) {
            return new ConfidenceResult(
                    0, 0, 0, 0, 0, 0, List.of("No evidence available: confidence 0%"));
        }

        double coveredWeight = 0;
        double attemptedWeight = 0;
        double weightedQuality = 0;
        double weightedFreshness = 0;
        for (DriverEvidence driver : attempted) {
            double weight = resolved.weightOf(driver.getDriverKey());
            if (driver.hasUsableEvidence()) {
                coveredWeight += weight;
            }
            attemptedWeight += weight;
            weightedQuality += weight * qualityTable.multiplier(driver.getQualityItem().getSourceType());
            weightedFreshness +=
                    weight
                            * freshness(
                                    driver.getFreshestItem().getMeasuredAt(),
                                    driver.getDriver().getFreshnessHalfLifeDays(),
                                    now);
        }
        double coverage = clampUnit(coveredWeight);
        double quality = attemptedWeight > 0 ? clampUnit(weightedQuality / attemptedWeight) : 0;
        double freshness = attemptedWeight > 0 ? clampUnit(weightedFreshness / attemptedWeight) : 0;
        double stability = clampUnit(stabilityCalculator.compute(resolved, now));

        double raw =
                100.0
                        * (COVERAGE_WEIGHT * coverage
                                + QUALITY_WEIGHT * quality
                                + FRESHNESS_WEIGHT * freshness
                                + STABILITY_WEIGHT * stability);

        List<String> explanation = new ArrayList<>();
        explanation.add("Coverage: " + percent(coverage) + " of driver weight has data");
        explanation.add("Quality: " + percent(quality) + " source reliability");
        explanation.add("Freshness: " + percent(freshness));
        explanation.add(stabilityCalculator.explain(stability));
        explanation.add(String.format(Locale.ROOT, "Blended confidence: %.1f%%", raw));

        double confidence = clamp(raw);
        List<EvidenceItem> usable = resolved.usableEvidence();
        for (ConfidenceRule rule : resolved.getDefinition().getConfidenceRules()) {
            if (!rule.triggers(usable)) {
                continue;
            }
            double adjusted = clamp(rule.apply(confidence));
            if (adjusted != confidence) {
                explanation.add(rule.describe());
                confidence = adjusted;
            }
        }

        double result = confidence;
        logger.fine(
                () ->
                        String.format(
                                Locale.ROOT,
                                "Confidence %s: coverage=%.3f quality=%.3f freshness=%.3f raw=%.2f final=%.2f",
                                resolved.getDefinition().getDomain().key(),
                                coverage,
                                quality,
                                freshness,
                                raw,
                                result));
        return new ConfidenceResult(result, raw, coverage, quality, freshness, stability, explanation);
    }

    /// Exponential decay by age: 1.0 when fresh, 0.5 after one half-life.
    ///
    /// @param measuredAt measurement time, null means unknown age
    /// @param halfLifeDays half-life in days, positive
    /// @param now evaluation time, not null
    /// @return freshness in [0,1]
    static double freshness(Instant measuredAt, double halfLifeDays, Instant now) {
        if (measuredAt == null) {
            return 0.0;
        }
        double ageDays = Duration.between(measuredAt, now).toMillis() / MILLIS_PER_DAY;
        if (ageDays <= 0) {
            return 1.0;
        }
        return Math.pow(0.5, ageDays / halfLifeDays);
    }

    private static double clampUnit(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }

    private static String percent(double fraction) {
        return Math.round(fraction * 100) + "%";
    }
}
