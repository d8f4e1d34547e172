package io.prime.core.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.prime.core.evidence.EvidenceValue;
import io.prime.core.registry.ScoringFunction.Band;
import io.prime.core.registry.ScoringFunction.CategoryMap;
import io.prime.core.registry.ScoringFunction.FirstMatch;
import io.prime.core.registry.ScoringFunction.Ladder;
import io.prime.core.registry.ScoringFunction.Passthrough;
import io.prime.core.registry.ScoringFunction.PiecewiseLinear;
import io.prime.core.registry.ScoringFunction.Point;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ScoringFunction")
class ScoringFunctionTest {

    @Nested
    @DisplayName("Ladder")
    class LadderTest {

        private final Ladder bloodPressure =
                new Ladder(
                        List.of(
                                new Band(null, 120.0, 100),
                                new Band(120.0, 130.0, 75),
                                new Band(130.0, 140.0, 50),
                                new Band(140.0, 160.0, 25),
                                new Band(160.0, null, 0)));

        @Test
        @DisplayName("treats min as inclusive and max as exclusive")
        void shouldUseInclusiveMinAndExclusiveMax() {
            assertThat(bloodPressure.score(EvidenceValue.numeric(119.9)).getAsDouble()).isEqualTo(100);
            assertThat(bloodPressure.score(EvidenceValue.numeric(120)).getAsDouble()).isEqualTo(75);
            assertThat(bloodPressure.score(EvidenceValue.numeric(159)).getAsDouble()).isEqualTo(25);
            assertThat(bloodPressure.score(EvidenceValue.numeric(160)).getAsDouble()).isEqualTo(0);
        }

        @Test
        @DisplayName("does not accept categorical values")
        void shouldRejectCategoricalValue() {
            assertThat(bloodPressure.score(EvidenceValue.categorical("high"))).isEmpty();
        }

        @Test
        @DisplayName("returns empty when no band matches")
        void shouldReturnEmptyOutsideBands() {
            Ladder partial = new Ladder(List.of(new Band(10.0, 20.0, 50)));

            assertThat(partial.score(EvidenceValue.numeric(25))).isEmpty();
        }

        @Test
        @DisplayName("rejects band scores outside 0-100")
        void shouldRejectInvalidBandScore() {
            assertThatThrownBy(() -> new Band(null, 10.0, 120))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("between 0 and 100");
        }
    }

    @Nested
    @DisplayName("PiecewiseLinear")
    class PiecewiseLinearTest {

        private final PiecewiseLinear restingHeartRate =
                new PiecewiseLinear(
                        List.of(
                                new Point(90, 0),
                                new Point(50, 100),
                                new Point(70, 50),
                                new Point(60, 75),
                                new Point(80, 25)));

        @Test
        @DisplayName("interpolates between points regardless of declaration order")
        void shouldInterpolate() {
            assertThat(restingHeartRate.score(EvidenceValue.numeric(58)).getAsDouble())
                    .isCloseTo(80.0, within(1e-9));
            assertThat(restingHeartRate.score(EvidenceValue.numeric(55)).getAsDouble())
                    .isCloseTo(87.5, within(1e-9));
        }

        @Test
        @DisplayName("clamps outside the first and last point")
        void shouldClampAtEnds() {
            assertThat(restingHeartRate.score(EvidenceValue.numeric(40)).getAsDouble()).isEqualTo(100);
            assertThat(restingHeartRate.score(EvidenceValue.numeric(120)).getAsDouble()).isEqualTo(0);
        }

        @Test
        @DisplayName("requires at least two distinct points")
        void shouldRejectDegenerateMappings() {
            assertThatThrownBy(() -> new PiecewiseLinear(List.of(new Point(1, 10))))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(
                            () -> new PiecewiseLinear(List.of(new Point(1, 10), new Point(1, 20))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Duplicate");
        }
    }

    @Nested
    @DisplayName("CategoryMap")
    class CategoryMapTest {

        private final CategoryMap pain =
                new CategoryMap(Map.of("none", 100.0, "Mild", 75.0, "severe", 15.0));

        @Test
        @DisplayName("matches labels after trimming and lower-casing")
        void shouldNormalizeLabels() {
            assertThat(pain.score(EvidenceValue.categorical(" MILD ")).getAsDouble()).isEqualTo(75);
            assertThat(pain.score(EvidenceValue.categorical("none")).getAsDouble()).isEqualTo(100);
        }

        @Test
        @DisplayName("returns empty for unmapped categories and numbers")
        void shouldReturnEmptyForUnknownValues() {
            assertThat(pain.score(EvidenceValue.categorical("unbearable"))).isEmpty();
            assertThat(pain.score(EvidenceValue.numeric(3))).isEmpty();
        }
    }

    @Test
    @DisplayName("passthrough accepts only values on the 0-100 scale")
    void shouldPassThroughScaledValues() {
        Passthrough passthrough = new Passthrough();

        assertThat(passthrough.score(EvidenceValue.numeric(72)).getAsDouble()).isEqualTo(72);
        assertThat(passthrough.score(EvidenceValue.numeric(130))).isEmpty();
        assertThat(passthrough.score(EvidenceValue.categorical("72"))).isEmpty();
    }

    @Test
    @DisplayName("first-match uses the first candidate that accepts the value")
    void shouldUseFirstAcceptingCandidate() {
        FirstMatch sleep =
                new FirstMatch(
                        List.of(
                                new Ladder(List.of(new Band(7.0, 9.0, 100), new Band(null, 7.0, 60))),
                                new CategoryMap(Map.of("7-8h", 100.0, "<6h", 45.0))));

        assertThat(sleep.score(EvidenceValue.numeric(7.5)).getAsDouble()).isEqualTo(100);
        assertThat(sleep.score(EvidenceValue.categorical("<6h")).getAsDouble()).isEqualTo(45);
        assertThat(sleep.score(EvidenceValue.categorical("10h"))).isEmpty();
        assertThat(sleep.describe()).isEqualTo("ladder(2 bands) | categories(2)");
    }

    @Test
    @DisplayName("no function scores an unestimable value")
    void shouldNeverScoreUnestimable() {
        assertThat(new Passthrough().score(EvidenceValue.unestimable())).isEmpty();
        assertThat(new CategoryMap(Map.of("a", 1.0)).score(EvidenceValue.unestimable())).isEmpty();
    }
}
