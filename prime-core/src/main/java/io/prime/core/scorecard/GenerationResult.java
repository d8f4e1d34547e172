package io.prime.core.scorecard;

import java.util.Objects;

/// Scorecard returned by a generation request.
///
/// @param scorecard the scorecard, never null
/// @param cached true when an existing scorecard was reused
public record GenerationResult(Scorecard scorecard, boolean cached) {

    public GenerationResult {
        Objects.requireNonNull(scorecard, "Scorecard required");
    }
}
