package io.prime.core.scoring;

/// Display classification of a confidence value. Not used in any calculation.
public enum ConfidenceLevel {
    LOW("Low", "Estimated from quick checks."),
    MEDIUM("Medium", "Based on measurements you provided (and quick checks)."),
    HIGH("High", "Based on device, lab, or test data.");

    private final String label;
    private final String description;

    ConfidenceLevel(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }

    /// Classifies a confidence value: Low [0,40), Medium [40,70), High [70,100].
    public static ConfidenceLevel of(double confidence) {
        if (confidence >= 70) {
            return HIGH;
        }
        if (confidence >= 40) {
            return MEDIUM;
        }
        return LOW;
    }
}
