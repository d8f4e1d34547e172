package io.prime.core.scoring;

import static io.prime.core.EvidenceFixtures.NOW;
import static io.prime.core.EvidenceFixtures.daysAgo;
import static io.prime.core.EvidenceFixtures.item;
import static io.prime.core.EvidenceFixtures.unestimable;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.prime.core.evidence.EvidenceItem;
import io.prime.core.model.PrimeDomain;
import io.prime.core.model.SourceType;
import io.prime.core.registry.DefaultDriverRegistry;
import io.prime.core.registry.DriverRegistry;
import io.prime.core.registry.SourceQualityTable;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConfidenceCalculator")
class ConfidenceCalculatorTest {

    private final DriverRegistry registry = DefaultDriverRegistry.create();
    private ConfidenceCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator =
                new ConfidenceCalculator(SourceQualityTable.defaults(), new NoHistoryStabilityCalculator());
    }

    private ConfidenceResult compute(PrimeDomain domain, EvidenceItem... items) {
        return calculator.compute(registry.getDomain(domain), List.of(items), NOW);
    }

    @Test
    @DisplayName("no evidence yields confidence 0")
    void shouldReturnZeroWithoutEvidence() {
        for (PrimeDomain domain : PrimeDomain.values()) {
            ConfidenceResult result = compute(domain);

            assertThat(result.confidence()).as(domain.key()).isZero();
            assertThat(result.coverage()).isZero();
            assertThat(result.level()).isEqualTo(ConfidenceLevel.LOW);
        }
    }

    @Test
    @DisplayName("blends coverage, quality and freshness with fixed weights")
    void shouldBlendFactors() {
        ConfidenceResult result =
                compute(
                        PrimeDomain.METABOLISM,
                        item(PrimeDomain.METABOLISM, "hba1c", 5.4, SourceType.LAB, NOW),
                        item(PrimeDomain.METABOLISM, "metabolic_risk", "no_risk", SourceType.SELF_REPORT_PROXY, NOW));

        assertThat(result.coverage()).isCloseTo(0.6, within(1e-9));
        assertThat(result.quality()).isCloseTo(0.7, within(1e-9));
        assertThat(result.freshness()).isCloseTo(1.0, within(1e-9));
        assertThat(result.stability()).isZero();
        assertThat(result.confidence()).isCloseTo(63.5, within(1e-9));
        assertThat(result.level()).isEqualTo(ConfidenceLevel.MEDIUM);
    }

    @Test
    @DisplayName("coverage reaches 1.0 when every driver has evidence")
    void shouldReachFullCoverage() {
        ConfidenceResult result =
                compute(
                        PrimeDomain.MIND,
                        item(PrimeDomain.MIND, "focus_test", 80, SourceType.TEST, NOW),
                        item(PrimeDomain.MIND, "focus_stability", "mostly_stable", SourceType.SELF_REPORT_PROXY, NOW),
                        item(PrimeDomain.MIND, "brain_fog", "rarely", SourceType.SELF_REPORT_PROXY, NOW));

        assertThat(result.coverage()).isCloseTo(1.0, within(1e-9));
        assertThat(result.explanation()).contains("Coverage: 100% of driver weight has data");
    }

    @Nested
    @DisplayName("freshness")
    class Freshness {

        @Test
        @DisplayName("halves after one half-life")
        void shouldHalveAfterHalfLife() {
            ConfidenceResult result =
                    compute(
                            PrimeDomain.METABOLISM,
                            item(PrimeDomain.METABOLISM, "hba1c", 5.4, SourceType.LAB, daysAgo(180)));

            assertThat(result.freshness()).isCloseTo(0.5, within(1e-9));
            assertThat(result.confidence()).isCloseTo(48.0, within(1e-9));
        }

        @Test
        @DisplayName("is 0 for unknown measurement time and 1 for future timestamps")
        void shouldHandleUnknownAndFutureTimes() {
            assertThat(ConfidenceCalculator.freshness(null, 30, NOW)).isZero();
            assertThat(ConfidenceCalculator.freshness(NOW.plus(Duration.ofDays(2)), 30, NOW)).isEqualTo(1.0);
            assertThat(ConfidenceCalculator.freshness(NOW, 30, NOW)).isEqualTo(1.0);
            assertThat(ConfidenceCalculator.freshness(daysAgo(60), 30, NOW)).isCloseTo(0.25, within(1e-12));
        }
    }

    @Nested
    @DisplayName("domain rules")
    class DomainRules {

        @Test
        @DisplayName("caps metabolism at 40 without a lab biomarker")
        void shouldCapMetabolismWithoutLab() {
            ConfidenceResult result =
                    compute(
                            PrimeDomain.METABOLISM,
                            item(PrimeDomain.METABOLISM, "metabolic_risk", "prediabetes", SourceType.SELF_REPORT_PROXY, NOW));

            assertThat(result.raw()).isCloseTo(45.5, within(1e-9));
            assertThat(result.confidence()).isEqualTo(40.0);
            assertThat(result.explanation()).endsWith("Capped at 40%: no lab biomarker present");
        }

        @Test
        @DisplayName("caps mind at 35 without a test")
        void shouldCapMindWithoutTest() {
            ConfidenceResult result =
                    compute(
                            PrimeDomain.MIND,
                            item(PrimeDomain.MIND, "focus_stability", "mostly_stable", SourceType.SELF_REPORT_PROXY, NOW),
                            item(PrimeDomain.MIND, "brain_fog", "rarely", SourceType.SELF_REPORT_PROXY, NOW));

            assertThat(result.raw()).isCloseTo(56.0, within(1e-9));
            assertThat(result.confidence()).isEqualTo(35.0);
        }

        @Test
        @DisplayName("keeps image-only frame evidence below High")
        void shouldCapFrameWithoutMeasurements() {
            ConfidenceResult result =
                    compute(
                            PrimeDomain.FRAME,
                            item(PrimeDomain.FRAME, "body_fat_pct", 18, SourceType.IMAGE_ESTIMATE, NOW),
                            item(PrimeDomain.FRAME, "waist_to_height", 0.48, SourceType.IMAGE_ESTIMATE, NOW),
                            item(PrimeDomain.FRAME, "pushups", "16-30", SourceType.SELF_REPORT_PROXY, NOW),
                            item(PrimeDomain.FRAME, "pain_limitation", "none", SourceType.SELF_REPORT_PROXY, NOW));

            assertThat(result.raw()).isGreaterThan(69);
            assertThat(result.confidence()).isEqualTo(69.0);
            assertThat(result.level()).isEqualTo(ConfidenceLevel.MEDIUM);
        }

        @Test
        @DisplayName("raises recovery to 70 with device sleep data")
        void shouldFloorRecoveryWithDeviceSleep() {
            ConfidenceResult result =
                    compute(
                            PrimeDomain.RECOVERY,
                            item(PrimeDomain.RECOVERY, "sleep_duration", 7.5, SourceType.DEVICE, NOW));

            assertThat(result.raw()).isCloseTo(60.75, within(1e-9));
            assertThat(result.confidence()).isEqualTo(70.0);
            assertThat(result.explanation()).endsWith("Raised to 70%: device sleep data present");
        }

        @Test
        @DisplayName("recovery floor never lowers a higher blend")
        void shouldNotLowerRecoveryAboveFloor() {
            ConfidenceResult result =
                    compute(
                            PrimeDomain.RECOVERY,
                            item(PrimeDomain.RECOVERY, "sleep_duration", 7.5, SourceType.DEVICE, NOW),
                            item(PrimeDomain.RECOVERY, "hrv", 65, SourceType.DEVICE, NOW),
                            item(PrimeDomain.RECOVERY, "sleep_regularity", "true", SourceType.SELF_REPORT_PROXY, NOW));

            assertThat(result.confidence()).isCloseTo(72.985, within(0.001));
            assertThat(result.explanation()).noneMatch(line -> line.startsWith("Raised"));
        }

        @Test
        @DisplayName("self-reported sleep does not trigger the recovery floor")
        void shouldNotFloorWithoutDeviceSleep() {
            ConfidenceResult result =
                    compute(
                            PrimeDomain.RECOVERY,
                            item(PrimeDomain.RECOVERY, "sleep_duration", "7-8h", SourceType.SELF_REPORT_PROXY, NOW));

            assertThat(result.confidence()).isCloseTo(100 * (0.35 * 0.45 + 0.25 * 0.4 + 0.25), within(1e-9));
        }
    }

    @Test
    @DisplayName("stays within 0-100 even when stability overshoots")
    void shouldClampToBounds() {
        ConfidenceCalculator overshooting =
                new ConfidenceCalculator(SourceQualityTable.defaults(), (evidence, now) -> 7.0);

        ConfidenceResult result =
                overshooting.compute(
                        registry.getDomain(PrimeDomain.HEART),
                        List.of(
                                item(PrimeDomain.HEART, "bp", 118, SourceType.LAB, NOW),
                                item(PrimeDomain.HEART, "rhr", 55, SourceType.LAB, NOW),
                                item(PrimeDomain.HEART, "cardio_fitness", 45, SourceType.LAB, NOW)),
                        NOW);

        assertThat(result.stability()).isEqualTo(1.0);
        assertThat(result.confidence()).isLessThanOrEqualTo(100.0).isCloseTo(100.0, within(1e-9));
    }

    @Test
    @DisplayName("unestimable evidence gives low non-zero confidence")
    void shouldCountUnestimableForQualityAndFreshness() {
        ConfidenceResult result =
                compute(
                        PrimeDomain.FRAME,
                        unestimable(PrimeDomain.FRAME, "body_fat_pct", SourceType.IMAGE_ESTIMATE, NOW));

        assertThat(result.coverage()).isZero();
        assertThat(result.quality()).isCloseTo(0.55, within(1e-9));
        assertThat(result.confidence()).isCloseTo(38.75, within(1e-9));
    }

    @Test
    @DisplayName("BMI alongside body fat does not change confidence")
    void shouldIgnoreSuppressedBmi() {
        EvidenceItem bodyFat = item(PrimeDomain.FRAME, "body_fat_pct", 20, SourceType.DEVICE, daysAgo(3));
        EvidenceItem pushups = item(PrimeDomain.FRAME, "pushups", "16-30", SourceType.SELF_REPORT_PROXY, daysAgo(1));
        EvidenceItem bmi = item(PrimeDomain.FRAME, "bmi", 27, SourceType.MEASURED_SELF_REPORT, NOW);

        ConfidenceResult with = compute(PrimeDomain.FRAME, bodyFat, pushups, bmi);
        ConfidenceResult without = compute(PrimeDomain.FRAME, bodyFat, pushups);

        assertThat(with).isEqualTo(without);
    }

    @Test
    @DisplayName("documents the missing history in the stability line")
    void shouldExplainStability() {
        ConfidenceResult result =
                compute(PrimeDomain.HEART, item(PrimeDomain.HEART, "rhr", 60, SourceType.DEVICE, NOW));

        assertThat(result.explanation()).contains("Stability: 0% (no measurement history yet)");
        assertThat(new NoHistoryStabilityCalculator().compute(null, NOW)).isZero();
    }
}
