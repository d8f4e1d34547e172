package io.prime.core.exception;

import java.io.Serial;

/// Signals that the scoring rule set itself is broken.
///
/// Raised when driver weights within a domain do not sum to 1.0, when a domain or
/// source type is missing from its lookup table, or when a rule references a driver the
/// domain does not define. No meaningful scorecard can be produced from such a rule set,
/// so this is the only exception that escapes the engine.
public class ConfigurationException extends RuntimeException {
    @Serial private static final long serialVersionUID = 3106485712604398853L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
