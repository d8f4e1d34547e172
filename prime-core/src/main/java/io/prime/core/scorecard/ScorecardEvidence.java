package io.prime.core.scorecard;

import io.prime.core.evidence.EvidenceValue;
import io.prime.core.model.PrimeDomain;
import io.prime.core.model.SourceType;
import java.time.Instant;
import java.util.Objects;

/// A reading that contributed to a domain score, as recorded on the scorecard.
///
/// @param measuredAt measurement time, may be null
/// @param unit unit label, may be null
/// @param subscore rounded 0-100 sub-score of the reading
public record ScorecardEvidence(
        PrimeDomain domain,
        String driverKey,
        SourceType sourceType,
        Instant measuredAt,
        EvidenceValue value,
        String unit,
        int subscore) {

    public ScorecardEvidence {
        Objects.requireNonNull(domain, "Domain required");
        Objects.requireNonNull(driverKey, "Driver key required");
        Objects.requireNonNull(sourceType, "Source type required");
        Objects.requireNonNull(value, "Value required");
    }
}
