package io.prime.core.scoring;

import java.time.Instant;

/// Stability without historical snapshots: always 0.
///
/// An evidence set is a single point in time, so repeated readings across a stability
/// window cannot be observed. Replace this with a history-backed calculator once past
/// scorecards or raw series are available to the engine.
public final class NoHistoryStabilityCalculator implements StabilityCalculator {

    @Override
    public double compute(ResolvedDomainEvidence evidence, Instant now) {
        return 0.0;
    }

    @Override
    public String explain(double stability) {
        return "Stability: 0% (no measurement history yet)";
    }
}
