package io.prime.core.registry;

import io.prime.core.evidence.EvidenceItem;
import io.prime.core.model.SourceType;
import java.util.Collection;
import java.util.Set;

/// Predicate over evidence items used by confidence rules.
///
/// An item matches when its source type is one of `sourceTypes` and, if `driverKeys` is
/// non-empty, its driver key is one of them.
public record EvidenceCondition(Set<SourceType> sourceTypes, Set<String> driverKeys) {

    public EvidenceCondition {
        if (sourceTypes == null || sourceTypes.isEmpty()) {
            throw new IllegalArgumentException("Condition needs at least one source type");
        }
        sourceTypes = Set.copyOf(sourceTypes);
        driverKeys = driverKeys == null ? Set.of() : Set.copyOf(driverKeys);
    }

    /// Condition matching any driver with one of the given source types.
    public static EvidenceCondition sourceTypes(SourceType... types) {
        return new EvidenceCondition(Set.of(types), Set.of());
    }

    public EvidenceCondition forDrivers(String... keys) {
        return new EvidenceCondition(sourceTypes, Set.of(keys));
    }

    public boolean matches(EvidenceItem item) {
        return sourceTypes.contains(item.getSourceType())
                && (driverKeys.isEmpty() || driverKeys.contains(item.getDriverKey()));
    }

    public boolean matchesAny(Collection<EvidenceItem> items) {
        return items.stream().anyMatch(this::matches);
    }
}
