package io.prime.core.scoring;

import io.prime.core.evidence.EvidenceItem;
import io.prime.core.evidence.EvidenceValue;
import io.prime.core.registry.DomainDefinition;
import io.prime.core.registry.Driver;
import io.prime.core.registry.SourceQualityTable;
import io.prime.core.registry.SuppressionRule;
import io.prime.core.registry.ValueRange;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;

/// Validates a domain's evidence and picks the readings each calculator uses.
///
/// Per item, in order:
/// 1. unknown driver keys are ignored and noted
/// 2. unestimable values mark the driver as attempted but never score
/// 3. numeric values outside the driver's valid range are excluded and noted
/// 4. values the driver's scoring function does not accept are excluded and noted
///
/// Suppression rules run afterwards, over drivers that kept usable evidence.
/// Evidence problems never throw.
public final class EvidenceResolver {

    /// Relative difference above which two readings of one driver are reported as conflicting.
    public static final double CONFLICT_THRESHOLD = 0.10;

    private final SourceQualityTable qualityTable;
    private final Comparator<EvidenceItem> byRecency;
    private final Comparator<EvidenceItem> byQuality;

    public EvidenceResolver(SourceQualityTable qualityTable) {
        this.qualityTable = Objects.requireNonNull(qualityTable, "Quality table required");
        Comparator<EvidenceItem> measuredAt =
                Comparator.comparing(
                        EvidenceItem::getMeasuredAt, Comparator.nullsFirst(Comparator.naturalOrder()));
        Comparator<EvidenceItem> quality =
                Comparator.comparingDouble(item -> qualityTable.multiplier(item.getSourceType()));
        Comparator<EvidenceItem> value = Comparator.comparing(item -> item.getValue().display());
        this.byRecency = measuredAt.thenComparing(quality).thenComparing(value);
        this.byQuality = quality.thenComparing(measuredAt).thenComparing(value);
    }

    /// Resolves the evidence of one domain.
    ///
    /// Items belonging to other domains are skipped.
    ///
    /// @param definition domain rule set, not null
    /// @param evidence evidence items, not null
    /// @return resolved evidence, never null
    public ResolvedDomainEvidence resolve(DomainDefinition definition, List<EvidenceItem> evidence) {
        List<String> notes = new ArrayList<>();
        Map<String, List<EvidenceItem>> byDriver = new LinkedHashMap<>();
        Set<String> unknown = new TreeSet<>();

        for (EvidenceItem item : evidence) {
            if (item.getDomain() != definition.getDomain()) {
                continue;
            }
            if (definition.getDriver(item.getDriverKey()).isEmpty()) {
                unknown.add(item.getDriverKey());
                continue;
            }
            byDriver.computeIfAbsent(item.getDriverKey(), k -> new ArrayList<>()).add(item);
        }
        unknown.forEach(key -> notes.add("Ignored evidence for unknown driver '" + key + "'"));

        Map<String, DriverEvidence> resolved = new LinkedHashMap<>();
        Set<String> withUsable = new HashSet<>();
        for (Driver driver : definition.getDrivers()) {
            List<EvidenceItem> items = byDriver.get(driver.getKey());
            if (items == null) {
                continue;
            }
            DriverEvidence driverEvidence = resolveDriver(driver, items, notes);
            resolved.put(driver.getKey(), driverEvidence);
            if (driverEvidence.hasUsableEvidence()) {
                withUsable.add(driver.getKey());
            }
        }

        Set<String> suppressed = new HashSet<>();
        for (SuppressionRule rule : definition.getSuppressionRules()) {
            if (rule.firesFor(withUsable)) {
                suppressed.add(rule.suppressedDriver());
                String name =
                        definition
                                .getDriver(rule.suppressedDriver())
                                .map(Driver::getDisplayName)
                                .orElse(rule.suppressedDriver());
                notes.add(name + " suppressed: " + rule.reason());
            }
        }

        return new ResolvedDomainEvidence(definition, resolved, suppressed, notes);
    }

    private DriverEvidence resolveDriver(Driver driver, List<EvidenceItem> items, List<String> notes) {
        List<EvidenceItem> attempted = new ArrayList<>();
        List<EvidenceItem> usable = new ArrayList<>();
        Map<EvidenceItem, Double> subscores = new LinkedHashMap<>();

        for (EvidenceItem item : items) {
            EvidenceValue value = item.getValue();
            if (!value.isEstimable()) {
                attempted.add(item);
                notes.add(
                        driver.getDisplayName()
                                + ": unable to estimate ("
                                + item.getSourceType().key()
                                + "), counted as missing");
                continue;
            }
            ValueRange range = driver.getValidRange();
            if (range != null
                    && value instanceof EvidenceValue.Numeric numeric
                    && !range.contains(numeric.value())) {
                notes.add(
                        driver.getDisplayName()
                                + " "
                                + formatValue(item, driver)
                                + " is outside the valid range "
                                + range
                                + ", excluded");
                continue;
            }
            OptionalDouble subscore = driver.getScoring().score(value);
            if (subscore.isEmpty()) {
                notes.add(
                        driver.getDisplayName()
                                + " value '"
                                + value.display()
                                + "' could not be scored, excluded");
                continue;
            }
            attempted.add(item);
            usable.add(item);
            subscores.put(item, subscore.getAsDouble());
        }

        if (attempted.isEmpty()) {
            return new DriverEvidence(driver, List.of(), null, Double.NaN, null, null);
        }

        EvidenceItem qualityItem = attempted.stream().max(byQuality).orElseThrow();
        EvidenceItem freshestItem = attempted.stream().max(byRecency).orElseThrow();
        if (usable.isEmpty()) {
            return new DriverEvidence(driver, List.of(), null, Double.NaN, qualityItem, freshestItem);
        }

        EvidenceItem scoringItem = usable.stream().max(byRecency).orElseThrow();
        noteConflict(driver, scoringItem, usable, notes);
        return new DriverEvidence(
                driver, usable, scoringItem, subscores.get(scoringItem), qualityItem, freshestItem);
    }

    private void noteConflict(
            Driver driver, EvidenceItem selected, List<EvidenceItem> usable, List<String> notes) {
        if (!(selected.getValue() instanceof EvidenceValue.Numeric chosen)) {
            return;
        }
        EvidenceItem worst = null;
        double worstDiff = 0;
        for (EvidenceItem other : usable) {
            if (other == selected || !(other.getValue() instanceof EvidenceValue.Numeric numeric)) {
                continue;
            }
            double diff = relativeDifference(chosen.value(), numeric.value());
            if (diff > CONFLICT_THRESHOLD && diff > worstDiff) {
                worst = other;
                worstDiff = diff;
            }
        }
        if (worst != null) {
            notes.add(
                    driver.getDisplayName()
                            + ": conflicting readings ("
                            + formatValue(selected, driver)
                            + " vs "
                            + formatValue(worst, driver)
                            + "), using the most recent");
        }
    }

    static double relativeDifference(double reference, double other) {
        if (reference == 0) {
            return other == 0 ? 0 : Double.POSITIVE_INFINITY;
        }
        return Math.abs(other - reference) / Math.abs(reference);
    }

    /// Formats a value with its unit, falling back to the driver's unit.
    static String formatValue(EvidenceItem item, Driver driver) {
        String unit = item.getUnit() != null ? item.getUnit() : driver.getUnit();
        String display = item.getValue().display();
        if (unit == null || !(item.getValue() instanceof EvidenceValue.Numeric)) {
            return display;
        }
        return "%".equals(unit) ? display + unit : display + " " + unit;
    }
}
