package io.prime.cli.store;

import java.io.Serial;

/// Thrown when the scorecard store holds data that cannot be read back.
///
/// Common causes:
/// - A scorecard file that is not a valid scorecard document
/// - A latest pointer whose content is not a usable scorecard id
public class ScorecardStoreException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4473921865019243718L;

    public ScorecardStoreException(String message) {
        super(message);
    }

    public ScorecardStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
