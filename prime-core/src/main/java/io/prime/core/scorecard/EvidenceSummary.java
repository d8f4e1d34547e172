package io.prime.core.scorecard;

import io.prime.core.evidence.EvidenceSet;
import io.prime.core.model.PrimeDomain;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/// Counts and timestamps of the evidence a scorecard was computed from.
///
/// `freshestMeasuredAt` is what the reuse guard compares against a newly loaded evidence
/// set.
///
/// @param totalMetrics number of evidence items
/// @param domainsWithData domains with at least one evidence item
/// @param freshestMeasuredAt latest measurement time overall, null when none is known
/// @param freshestByDomain latest measurement time per domain, domains without one omitted
public record EvidenceSummary(
        int totalMetrics,
        int domainsWithData,
        Instant freshestMeasuredAt,
        Map<PrimeDomain, Instant> freshestByDomain) {

    public EvidenceSummary {
        Map<PrimeDomain, Instant> copy = new EnumMap<>(PrimeDomain.class);
        if (freshestByDomain != null) {
            copy.putAll(freshestByDomain);
        }
        freshestByDomain = Collections.unmodifiableMap(copy);
    }

    /// Summarizes an evidence set.
    ///
    /// @param evidence the evidence set, not null
    /// @return summary, never null
    public static EvidenceSummary of(EvidenceSet evidence) {
        Map<PrimeDomain, Instant> byDomain = new EnumMap<>(PrimeDomain.class);
        int withData = 0;
        for (PrimeDomain domain : PrimeDomain.values()) {
            if (!evidence.forDomain(domain).isEmpty()) {
                withData++;
            }
            Instant freshest = evidence.freshestMeasuredAt(domain);
            if (freshest != null) {
                byDomain.put(domain, freshest);
            }
        }
        return new EvidenceSummary(evidence.size(), withData, evidence.freshestMeasuredAt(), byDomain);
    }
}
