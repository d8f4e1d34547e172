package io.prime.core.registry;

import io.prime.core.evidence.EvidenceValue;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/// Maps a raw driver value to a 0-100 sub-score.
///
/// Each variant accepts a specific kind of value. When the value is of the wrong kind
/// (a categorical answer for a numeric ladder) or falls outside every band or category,
/// {@link #score(EvidenceValue)} returns empty and the item is treated as unscorable.
///
/// ### Variants
/// - {@link Ladder} - ordered numeric bands, min inclusive, max exclusive
/// - {@link PiecewiseLinear} - linear interpolation between points, clamped at the ends
/// - {@link CategoryMap} - categorical answer to fixed score
/// - {@link Passthrough} - numeric value already on the 0-100 scale
/// - {@link FirstMatch} - first candidate that accepts the value
public sealed interface ScoringFunction
        permits ScoringFunction.Ladder,
                ScoringFunction.PiecewiseLinear,
                ScoringFunction.CategoryMap,
                ScoringFunction.Passthrough,
                ScoringFunction.FirstMatch {

    /// Scores a value.
    ///
    /// @param value raw driver value, not null
    /// @return sub-score in [0,100], or empty if this function does not accept the value
    OptionalDouble score(EvidenceValue value);

    /// Short description for registry listings, e.g. `"ladder(5 bands)"`.
    String describe();

    private static void checkScore(double score) {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Score must be between 0 and 100: " + score);
        }
    }

    /// One ladder band. Null bounds are open.
    record Band(Double min, Double max, double score) {
        public Band {
            checkScore(score);
            if (min != null && max != null && min >= max) {
                throw new IllegalArgumentException("Band min must be below max");
            }
        }

        boolean contains(double value) {
            return (min == null || value >= min) && (max == null || value < max);
        }
    }

    record Ladder(List<Band> bands) implements ScoringFunction {
        public Ladder {
            if (bands == null || bands.isEmpty()) {
                throw new IllegalArgumentException("Ladder needs at least one band");
            }
            bands = List.copyOf(bands);
        }

        @Override
        public OptionalDouble score(EvidenceValue value) {
            if (!(value instanceof EvidenceValue.Numeric numeric)) {
                return OptionalDouble.empty();
            }
            for (Band band : bands) {
                if (band.contains(numeric.value())) {
                    return OptionalDouble.of(band.score());
                }
            }
            return OptionalDouble.empty();
        }

        @Override
        public String describe() {
            return "ladder(" + bands.size() + " bands)";
        }
    }

    /// Interpolation anchor: value `x` maps to `score`.
    record Point(double x, double score) {
        public Point {
            checkScore(score);
        }
    }

    record PiecewiseLinear(List<Point> points) implements ScoringFunction {
        public PiecewiseLinear {
            if (points == null || points.size() < 2) {
                throw new IllegalArgumentException("Piecewise mapping needs at least two points");
            }
            points = points.stream().sorted(Comparator.comparingDouble(Point::x)).toList();
            for (int i = 1; i < points.size(); i++) {
                if (points.get(i).x() == points.get(i - 1).x()) {
                    throw new IllegalArgumentException("Duplicate point x=" + points.get(i).x());
                }
            }
        }

        @Override
        public OptionalDouble score(EvidenceValue value) {
            if (!(value instanceof EvidenceValue.Numeric numeric)) {
                return OptionalDouble.empty();
            }
            double x = numeric.value();
            Point first = points.get(0);
            Point last = points.get(points.size() - 1);
            if (x <= first.x()) {
                return OptionalDouble.of(first.score());
            }
            if (x >= last.x()) {
                return OptionalDouble.of(last.score());
            }
            for (int i = 1; i < points.size(); i++) {
                Point right = points.get(i);
                if (x <= right.x()) {
                    Point left = points.get(i - 1);
                    double t = (x - left.x()) / (right.x() - left.x());
                    return OptionalDouble.of(left.score() + t * (right.score() - left.score()));
                }
            }
            return OptionalDouble.of(last.score());
        }

        @Override
        public String describe() {
            return "piecewise(" + points.size() + " points)";
        }
    }

    /// Category labels are matched after trimming and lower-casing.
    record CategoryMap(Map<String, Double> scores) implements ScoringFunction {
        public CategoryMap {
            if (scores == null || scores.isEmpty()) {
                throw new IllegalArgumentException("Category map needs at least one entry");
            }
            Map<String, Double> normalized = new LinkedHashMap<>();
            scores.forEach(
                    (label, score) -> {
                        checkScore(score);
                        normalized.put(normalize(label), score);
                    });
            scores = Map.copyOf(normalized);
        }

        @Override
        public OptionalDouble score(EvidenceValue value) {
            if (!(value instanceof EvidenceValue.Categorical categorical)) {
                return OptionalDouble.empty();
            }
            Double score = scores.get(normalize(categorical.value()));
            return score != null ? OptionalDouble.of(score) : OptionalDouble.empty();
        }

        @Override
        public String describe() {
            return "categories(" + scores.size() + ")";
        }

        private static String normalize(String label) {
            return label.trim().toLowerCase(Locale.ROOT);
        }
    }

    record Passthrough() implements ScoringFunction {
        @Override
        public OptionalDouble score(EvidenceValue value) {
            if (value instanceof EvidenceValue.Numeric numeric
                    && numeric.value() >= 0
                    && numeric.value() <= 100) {
                return OptionalDouble.of(numeric.value());
            }
            return OptionalDouble.empty();
        }

        @Override
        public String describe() {
            return "passthrough";
        }
    }

    record FirstMatch(List<ScoringFunction> candidates) implements ScoringFunction {
        public FirstMatch {
            if (candidates == null || candidates.isEmpty()) {
                throw new IllegalArgumentException("First-match needs at least one candidate");
            }
            candidates = List.copyOf(candidates);
        }

        @Override
        public OptionalDouble score(EvidenceValue value) {
            for (ScoringFunction candidate : candidates) {
                OptionalDouble score = candidate.score(value);
                if (score.isPresent()) {
                    return score;
                }
            }
            return OptionalDouble.empty();
        }

        @Override
        public String describe() {
            return String.join(
                    " | ", candidates.stream().map(ScoringFunction::describe).toList());
        }
    }
}
