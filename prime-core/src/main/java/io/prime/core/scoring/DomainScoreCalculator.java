package io.prime.core.scoring;

import io.prime.core.evidence.EvidenceItem;
import io.prime.core.registry.DomainDefinition;
import io.prime.core.registry.SourceQualityTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Converts a domain's usable evidence into a 0-100 score.
///
/// Each active driver with usable evidence contributes its scoring item's sub-score. The
/// domain score is the weighted mean of those sub-scores, renormalized over the drivers
/// present, so missing drivers do not pull it toward zero. A driver's renormalized share
/// never exceeds its dominance cap while the other present drivers can absorb the excess.
/// No usable evidence gives a null score.
///
/// @implNote Stateless and thread-safe.
public final class DomainScoreCalculator {

    private static final double SHARE_TOLERANCE = 1e-9;

    private final SourceQualityTable qualityTable;

    public DomainScoreCalculator(SourceQualityTable qualityTable) {
        this.qualityTable = Objects.requireNonNull(qualityTable, "Quality table required");
    }

    /// Resolves and scores one domain.
    ///
    /// @param definition domain rule set, not null
    /// @param evidence the domain's evidence items, not null
    /// @return score result, never null
    public DomainScoreResult compute(DomainDefinition definition, List<EvidenceItem> evidence) {
        return compute(new EvidenceResolver(qualityTable).resolve(definition, evidence));
    }

    /// Scores already resolved evidence.
    ///
    /// @param resolved resolved domain evidence, not null
    /// @return score result, never null
    public DomainScoreResult compute(ResolvedDomainEvidence resolved) {
        List<String> explanation = new ArrayList<>(resolved.getNotes());
        List<DriverEvidence> present = new ArrayList<>();
        double presentWeight = 0;
        for (DriverEvidence driver : resolved.activeDrivers()) {
            if (driver.hasUsableEvidence()) {
                present.add(driver);
                presentWeight += resolved.weightOf(driver.getDriverKey());
            }
        }

        if (present.isEmpty() || presentWeight <= 0) {
            explanation.add("No usable evidence: score unavailable");
            return new DomainScoreResult(null, List.of(), explanation);
        }

        double[] shares = new double[present.size()];
        double[] caps = new double[present.size()];
        for (int i = 0; i < shares.length; i++) {
            DriverEvidence driver = present.get(i);
            shares[i] = resolved.weightOf(driver.getDriverKey()) / presentWeight;
            caps[i] = driver.getDriver().getDominanceCap();
        }
        double[] capped = capShares(shares, caps);

        List<DriverContribution> contributions = new ArrayList<>();
        double score = 0;
        for (int i = 0; i < capped.length; i++) {
            DriverEvidence driver = present.get(i);
            double subscore = driver.getSubscore().orElseThrow();
            EvidenceItem item = driver.getScoringItem();
            contributions.add(new DriverContribution(driver.getDriverKey(), item, subscore, capped[i]));
            score += capped[i] * subscore;
            explanation.add(
                    driver.getDriver().getDisplayName()
                            + " "
                            + EvidenceResolver.formatValue(item, driver.getDriver())
                            + " ("
                            + item.getSourceType().key()
                            + ") -> "
                            + Math.round(subscore));
            if (capped[i] < shares[i] - SHARE_TOLERANCE) {
                explanation.add(
                        driver.getDriver().getDisplayName()
                                + " share capped at "
                                + Math.round(caps[i] * 100)
                                + "%");
            }
        }

        score = Math.max(0.0, Math.min(100.0, score));
        int activeCount = resolved.getEffectiveWeights().size();
        explanation.add(
                "Score: "
                        + Math.round(score)
                        + " (weighted over "
                        + contributions.size()
                        + " of "
                        + activeCount
                        + " drivers)");
        return new DomainScoreResult(score, contributions, explanation);
    }

    /// Applies dominance caps to renormalized shares.
    ///
    /// Shares above their cap are pinned to it and the excess is spread over the uncapped
    /// drivers in proportion to their shares, repeating until no share exceeds its cap.
    /// When the caps of the weighted drivers together cannot cover the whole score, the
    /// result is proportional to those caps.
    ///
    /// @param shares shares summing to 1
    /// @param caps per-driver caps in (0, 1]
    /// @return capped shares summing to 1
    static double[] capShares(double[] shares, double[] caps) {
        int n = shares.length;
        double[] result = new double[n];
        boolean[] pinned = new boolean[n];
        boolean changed = true;
        while (changed) {
            changed = false;
            double pinnedTotal = 0;
            double freeTotal = 0;
            for (int i = 0; i < n; i++) {
                if (pinned[i]) {
                    pinnedTotal += caps[i];
                } else {
                    freeTotal += shares[i];
                }
            }
            if (freeTotal <= 0) {
                return proportionalToCaps(shares, caps);
            }
            double remaining = 1 - pinnedTotal;
            for (int i = 0; i < n; i++) {
                if (pinned[i]) {
                    result[i] = caps[i];
                    continue;
                }
                result[i] = shares[i] / freeTotal * remaining;
                if (result[i] > caps[i] + SHARE_TOLERANCE) {
                    pinned[i] = true;
                    changed = true;
                }
            }
        }
        return result;
    }

    // Zero-weight drivers stay at zero.
    private static double[] proportionalToCaps(double[] shares, double[] caps) {
        double total = 0;
        for (int i = 0; i < caps.length; i++) {
            if (shares[i] > 0) {
                total += caps[i];
            }
        }
        double[] result = new double[caps.length];
        for (int i = 0; i < caps.length; i++) {
            result[i] = shares[i] > 0 ? caps[i] / total : 0.0;
        }
        return result;
    }
}
