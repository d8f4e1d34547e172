package io.prime.core.scoring;

import io.prime.core.evidence.EvidenceItem;
import io.prime.core.registry.Driver;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/// Resolved evidence for a single driver.
///
/// Three items are picked from the driver's evidence, each for its own purpose:
/// - the scoring item, most recent usable reading (ties: higher quality)
/// - the quality item, highest-quality attempt, unestimable ones included
/// - the freshest item, most recent attempt
///
/// A driver is *attempted* when it has usable or unestimable evidence; it has *usable*
/// evidence when at least one value passed the range check and could be scored.
public final class DriverEvidence {

    private final Driver driver;
    private final List<EvidenceItem> usableItems;
    private final EvidenceItem scoringItem;
    private final double subscore;
    private final EvidenceItem qualityItem;
    private final EvidenceItem freshestItem;

    DriverEvidence(
            Driver driver,
            List<EvidenceItem> usableItems,
            EvidenceItem scoringItem,
            double subscore,
            EvidenceItem qualityItem,
            EvidenceItem freshestItem) {
        this.driver = Objects.requireNonNull(driver, "Driver required");
        this.usableItems = List.copyOf(usableItems);
        this.scoringItem = scoringItem;
        this.subscore = subscore;
        this.qualityItem = qualityItem;
        this.freshestItem = freshestItem;
    }

    public Driver getDriver() {
        return driver;
    }

    public String getDriverKey() {
        return driver.getKey();
    }

    /// Returns every usable reading of this driver.
    public List<EvidenceItem> getUsableItems() {
        return usableItems;
    }

    public boolean hasUsableEvidence() {
        return scoringItem != null;
    }

    public boolean isAttempted() {
        return qualityItem != null;
    }

    /// Returns the reading used for the domain score.
    ///
    /// @return scoring item, or null when nothing usable exists
    public EvidenceItem getScoringItem() {
        return scoringItem;
    }

    public OptionalDouble getSubscore() {
        return scoringItem != null ? OptionalDouble.of(subscore) : OptionalDouble.empty();
    }

    /// Returns the attempt whose source type drives the quality factor.
    ///
    /// @return quality item, or null when the driver was never attempted
    public EvidenceItem getQualityItem() {
        return qualityItem;
    }

    /// Returns the most recent attempt, used for the freshness factor.
    ///
    /// @return freshest item, or null when the driver was never attempted
    public EvidenceItem getFreshestItem() {
        return freshestItem;
    }
}
