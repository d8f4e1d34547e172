package io.prime.core.scoring;

import io.prime.core.evidence.EvidenceItem;

/// One driver's share of a domain score.
///
/// @param driverKey the driver
/// @param item the reading that was scored
/// @param subscore 0-100 sub-score of the reading
/// @param weight share of the domain score after renormalization and dominance caps
public record DriverContribution(String driverKey, EvidenceItem item, double subscore, double weight) {}
