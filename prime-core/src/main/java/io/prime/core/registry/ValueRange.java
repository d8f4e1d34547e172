package io.prime.core.registry;

/// Closed numeric interval used for physiologically valid driver values.
public record ValueRange(double min, double max) {

    public ValueRange {
        if (min > max) {
            throw new IllegalArgumentException("Min must be less than or equal to max");
        }
    }

    public boolean contains(double value) {
        return (min <= value) && (value <= max);
    }

    @Override
    public String toString() {
        return trim(min) + "-" + trim(max);
    }

    private static String trim(double v) {
        return v == Math.rint(v) ? String.valueOf((long) v) : String.valueOf(v);
    }
}
