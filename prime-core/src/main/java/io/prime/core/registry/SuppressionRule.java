package io.prime.core.registry;

import java.util.Objects;
import java.util.Set;

/// Excludes a driver from every calculation when any trigger driver has usable evidence.
///
/// The suppressed driver's weight is redistributed proportionally across the remaining
/// drivers of the domain.
public record SuppressionRule(String suppressedDriver, Set<String> triggerDrivers, String reason) {

    public SuppressionRule {
        Objects.requireNonNull(suppressedDriver, "Suppressed driver required");
        if (triggerDrivers == null || triggerDrivers.isEmpty()) {
            throw new IllegalArgumentException("Suppression needs at least one trigger driver");
        }
        if (triggerDrivers.contains(suppressedDriver)) {
            throw new IllegalArgumentException("Driver cannot suppress itself: " + suppressedDriver);
        }
        triggerDrivers = Set.copyOf(triggerDrivers);
        reason = reason != null ? reason : "superseded by more specific evidence";
    }

    public boolean firesFor(Set<String> driversWithEvidence) {
        return triggerDrivers.stream().anyMatch(driversWithEvidence::contains);
    }
}
