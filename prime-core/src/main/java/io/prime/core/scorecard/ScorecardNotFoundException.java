package io.prime.core.scorecard;

import java.io.Serial;

public class ScorecardNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = 4127309855612940391L;

    public ScorecardNotFoundException(String message) {
        super(message);
    }
}
