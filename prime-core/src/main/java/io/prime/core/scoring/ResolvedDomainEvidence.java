package io.prime.core.scoring;

import io.prime.core.evidence.EvidenceItem;
import io.prime.core.registry.DomainDefinition;
import io.prime.core.registry.Driver;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Evidence of one domain after validation, selection and suppression.
///
/// Shared by the confidence and domain score calculators so both see the same driver set
/// and the same effective weights.
public final class ResolvedDomainEvidence {

    private final DomainDefinition definition;
    private final Map<String, DriverEvidence> drivers;
    private final Set<String> suppressed;
    private final Map<String, Double> effectiveWeights;
    private final List<String> notes;

    ResolvedDomainEvidence(
            DomainDefinition definition,
            Map<String, DriverEvidence> drivers,
            Set<String> suppressed,
            List<String> notes) {
        this.definition = definition;
        this.drivers = Collections.unmodifiableMap(drivers);
        this.suppressed = Set.copyOf(suppressed);
        this.effectiveWeights = Collections.unmodifiableMap(definition.effectiveWeights(suppressed));
        this.notes = List.copyOf(notes);
    }

    public DomainDefinition getDefinition() {
        return definition;
    }

    /// Returns the suppressed driver keys.
    public Set<String> getSuppressed() {
        return suppressed;
    }

    /// Returns effective weights of the non-suppressed drivers, summing to 1.0.
    public Map<String, Double> getEffectiveWeights() {
        return effectiveWeights;
    }

    /// Returns resolution notes: exclusions, unknown drivers, conflicts and suppressions.
    public List<String> getNotes() {
        return notes;
    }

    /// Returns the resolved evidence of a driver, suppressed drivers included.
    ///
    /// @param driverKey driver key, not null
    /// @return resolved evidence, empty when the driver had no valid evidence at all
    public Optional<DriverEvidence> getDriver(String driverKey) {
        return Optional.ofNullable(drivers.get(driverKey));
    }

    /// Returns attempted, non-suppressed drivers in declaration order.
    public List<DriverEvidence> activeDrivers() {
        List<DriverEvidence> active = new ArrayList<>();
        for (Driver driver : definition.getDrivers()) {
            DriverEvidence evidence = drivers.get(driver.getKey());
            if (evidence != null && evidence.isAttempted() && !suppressed.contains(driver.getKey())) {
                active.add(evidence);
            }
        }
        return active;
    }

    /// Returns every usable reading of the non-suppressed drivers.
    public List<EvidenceItem> usableEvidence() {
        List<EvidenceItem> items = new ArrayList<>();
        for (DriverEvidence evidence : activeDrivers()) {
            items.addAll(evidence.getUsableItems());
        }
        return items;
    }

    /// Returns non-suppressed drivers without usable evidence, in declaration order.
    public List<Driver> missingDrivers() {
        List<Driver> missing = new ArrayList<>();
        for (Driver driver : definition.getDrivers()) {
            if (suppressed.contains(driver.getKey())) {
                continue;
            }
            DriverEvidence evidence = drivers.get(driver.getKey());
            if (evidence == null || !evidence.hasUsableEvidence()) {
                missing.add(driver);
            }
        }
        return missing;
    }

    public double weightOf(String driverKey) {
        return effectiveWeights.getOrDefault(driverKey, 0.0);
    }
}
