package io.prime.core.evidence;

import io.prime.core.model.PrimeDomain;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Snapshot of the measurements available for one subject at one point in time.
///
/// The collection is unordered; calculators never depend on item order. Assembled by an
/// external loader from device syncs, lab extraction and questionnaire answers.
///
/// @implNote Immutable and thread-safe after construction.
public final class EvidenceSet {

    private static final EvidenceSet EMPTY = new EvidenceSet(null, List.of());

    private final String subjectId;
    private final List<EvidenceItem> items;

    public EvidenceSet(String subjectId, List<EvidenceItem> items) {
        this.subjectId = subjectId;
        this.items = List.copyOf(Objects.requireNonNull(items, "Items required"));
    }

    /// Creates an evidence set without a subject identifier.
    public static EvidenceSet of(List<EvidenceItem> items) {
        return new EvidenceSet(null, items);
    }

    public static EvidenceSet empty() {
        return EMPTY;
    }

    /// Returns the subject this snapshot belongs to.
    ///
    /// @return subject identifier, may be null
    public String getSubjectId() {
        return subjectId;
    }

    /// Returns all items.
    ///
    /// @return unmodifiable list, never null
    public List<EvidenceItem> getItems() {
        return items;
    }

    /// Returns the items tagged with the given domain.
    ///
    /// @param domain domain filter, not null
    /// @return unmodifiable list, never null (may be empty)
    public List<EvidenceItem> forDomain(PrimeDomain domain) {
        return items.stream().filter(item -> item.getDomain() == domain).toList();
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /// Returns the most recent measurement time across all items.
    ///
    /// @return freshest timestamp, or null if no item has a known measurement time
    public Instant freshestMeasuredAt() {
        return freshest(items);
    }

    /// Returns the most recent measurement time within one domain.
    ///
    /// @param domain domain filter, not null
    /// @return freshest timestamp, or null if no item of this domain has one
    public Instant freshestMeasuredAt(PrimeDomain domain) {
        return freshest(forDomain(domain));
    }

    private static Instant freshest(List<EvidenceItem> candidates) {
        Instant freshest = null;
        for (EvidenceItem item : candidates) {
            Instant measuredAt = item.getMeasuredAt();
            if (measuredAt != null && (freshest == null || measuredAt.isAfter(freshest))) {
                freshest = measuredAt;
            }
        }
        return freshest;
    }
}
