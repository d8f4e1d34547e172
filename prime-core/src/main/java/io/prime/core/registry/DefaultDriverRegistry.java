package io.prime.core.registry;

import io.prime.core.model.PrimeDomain;
import io.prime.core.model.SourceType;
import io.prime.core.registry.ScoringFunction.Band;
import io.prime.core.registry.ScoringFunction.CategoryMap;
import io.prime.core.registry.ScoringFunction.FirstMatch;
import io.prime.core.registry.ScoringFunction.Ladder;
import io.prime.core.registry.ScoringFunction.Passthrough;
import io.prime.core.registry.ScoringFunction.PiecewiseLinear;
import io.prime.core.registry.ScoringFunction.Point;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Built-in rule set, version `v1`.
///
/// Heart, frame, metabolism, recovery and mind drivers with their weights, half-lives,
/// valid ranges and mappings, plus the BMI suppression rule and the per-domain confidence
/// caps and floor.
public final class DefaultDriverRegistry {

    public static final String VERSION = "v1";

    /// Primary sleep driver; device data for it floors recovery confidence.
    public static final String PRIMARY_SLEEP_DRIVER = "sleep_duration";

    private DefaultDriverRegistry() {}

    /// Builds the built-in registry.
    ///
    /// @return validated registry, never null
    public static DriverRegistry create() {
        return new DriverRegistry(VERSION, List.of(heart(), frame(), metabolism(), recovery(), mind()));
    }

    private static DomainDefinition heart() {
        return DomainDefinition.builder()
                .domain(PrimeDomain.HEART)
                .drivers(
                        List.of(
                                Driver.builder()
                                        .key("bp")
                                        .displayName("Blood pressure")
                                        .weight(0.35)
                                        .freshnessHalfLifeDays(90)
                                        .stabilityWindowDays(28)
                                        .validRange(60, 260)
                                        .unit("mmHg")
                                        .scoring(
                                                ladder(
                                                        below(120, 100),
                                                        between(120, 130, 75),
                                                        between(130, 140, 50),
                                                        between(140, 160, 25),
                                                        from(160, 0)))
                                        .missingCopy("Log a blood pressure reading")
                                        .build(),
                                Driver.builder()
                                        .key("rhr")
                                        .displayName("Resting heart rate")
                                        .weight(0.30)
                                        .freshnessHalfLifeDays(30)
                                        .stabilityWindowDays(14)
                                        .validRange(25, 220)
                                        .unit("bpm")
                                        .scoring(
                                                new PiecewiseLinear(
                                                        List.of(
                                                                new Point(50, 100),
                                                                new Point(60, 75),
                                                                new Point(70, 50),
                                                                new Point(80, 25),
                                                                new Point(90, 0))))
                                        .missingCopy("Connect a wearable to track resting heart rate")
                                        .build(),
                                Driver.builder()
                                        .key("cardio_fitness")
                                        .displayName("Cardio fitness")
                                        .weight(0.35)
                                        .freshnessHalfLifeDays(180)
                                        .stabilityWindowDays(28)
                                        .validRange(5, 95)
                                        .unit("ml/kg/min")
                                        .scoring(
                                                new FirstMatch(
                                                        List.of(
                                                                ladder(
                                                                        below(20, 0),
                                                                        between(20, 30, 25),
                                                                        between(30, 40, 50),
                                                                        between(40, 50, 75),
                                                                        from(50, 100)),
                                                                categories(
                                                                        "below_avg", 25,
                                                                        "slightly_below", 40,
                                                                        "average", 55,
                                                                        "slightly_above", 75,
                                                                        "above_avg", 90))))
                                        .missingCopy("Take the 3-minute step test")
                                        .build()))
                .build();
    }

    private static DomainDefinition frame() {
        return DomainDefinition.builder()
                .domain(PrimeDomain.FRAME)
                .drivers(
                        List.of(
                                Driver.builder()
                                        .key("body_fat_pct")
                                        .displayName("Body fat")
                                        .weight(0.30)
                                        .freshnessHalfLifeDays(90)
                                        .stabilityWindowDays(28)
                                        .validRange(2, 70)
                                        .unit("%")
                                        .scoring(
                                                ladder(
                                                        below(14, 100),
                                                        between(14, 18, 75),
                                                        between(18, 25, 50),
                                                        between(25, 31, 25),
                                                        from(31, 0)))
                                        .missingCopy("Upload a body composition scan or photo")
                                        .build(),
                                Driver.builder()
                                        .key("waist_to_height")
                                        .displayName("Waist-to-height ratio")
                                        .weight(0.25)
                                        .freshnessHalfLifeDays(90)
                                        .stabilityWindowDays(28)
                                        .validRange(0.25, 1.2)
                                        .scoring(
                                                ladder(
                                                        below(0.40, 85),
                                                        between(0.40, 0.50, 100),
                                                        between(0.50, 0.55, 70),
                                                        between(0.55, 0.60, 45),
                                                        from(0.60, 20)))
                                        .missingCopy("Measure your waist with a tape measure")
                                        .build(),
                                Driver.builder()
                                        .key("bmi")
                                        .displayName("BMI")
                                        .weight(0.15)
                                        .freshnessHalfLifeDays(90)
                                        .stabilityWindowDays(28)
                                        .validRange(10, 80)
                                        .unit("kg/m2")
                                        .scoring(
                                                ladder(
                                                        below(18.5, 60),
                                                        between(18.5, 25, 100),
                                                        between(25, 30, 70),
                                                        between(30, 35, 40),
                                                        from(35, 20)))
                                        .missingCopy("Add your height and weight")
                                        .build(),
                                Driver.builder()
                                        .key("pushups")
                                        .displayName("Push-ups")
                                        .weight(0.20)
                                        .freshnessHalfLifeDays(90)
                                        .stabilityWindowDays(28)
                                        .scoring(
                                                categories(
                                                        "0-5", 25,
                                                        "6-15", 50,
                                                        "16-30", 75,
                                                        "31+", 95,
                                                        "not_possible", 10))
                                        .missingCopy("Do a one-minute push-up test")
                                        .build(),
                                Driver.builder()
                                        .key("pain_limitation")
                                        .displayName("Pain limitation")
                                        .weight(0.10)
                                        .freshnessHalfLifeDays(60)
                                        .stabilityWindowDays(28)
                                        .scoring(
                                                categories(
                                                        "none", 100,
                                                        "mild", 75,
                                                        "moderate", 45,
                                                        "severe", 15))
                                        .missingCopy("Tell us about any pain that limits movement")
                                        .build()))
                .suppressionRules(
                        List.of(
                                new SuppressionRule(
                                        "bmi",
                                        Set.of("body_fat_pct", "waist_to_height"),
                                        "body fat or waist-to-height data available")))
                .confidenceRules(
                        List.of(
                                new ConfidenceRule.Cap(
                                        69,
                                        EvidenceCondition.sourceTypes(
                                                SourceType.DEVICE, SourceType.MEASURED_SELF_REPORT),
                                        "photo estimates alone cannot reach High")))
                .build();
    }

    private static DomainDefinition metabolism() {
        return DomainDefinition.builder()
                .domain(PrimeDomain.METABOLISM)
                .drivers(
                        List.of(
                                Driver.builder()
                                        .key("hba1c")
                                        .displayName("HbA1c")
                                        .weight(0.30)
                                        .freshnessHalfLifeDays(180)
                                        .stabilityWindowDays(90)
                                        .validRange(3, 20)
                                        .unit("%")
                                        .scoring(
                                                ladder(
                                                        below(5.7, 100),
                                                        between(5.7, 6.5, 60),
                                                        between(6.5, 8, 30),
                                                        from(8, 10)))
                                        .missingCopy("Upload a recent lab report with HbA1c")
                                        .build(),
                                Driver.builder()
                                        .key("apob")
                                        .displayName("ApoB")
                                        .weight(0.25)
                                        .freshnessHalfLifeDays(365)
                                        .stabilityWindowDays(90)
                                        .validRange(10, 400)
                                        .unit("mg/dL")
                                        .scoring(
                                                ladder(
                                                        below(80, 100),
                                                        between(80, 100, 80),
                                                        between(100, 130, 55),
                                                        between(130, 160, 30),
                                                        from(160, 10)))
                                        .missingCopy("Ask for an ApoB test at your next blood draw")
                                        .build(),
                                Driver.builder()
                                        .key("hscrp")
                                        .displayName("hs-CRP")
                                        .weight(0.15)
                                        .freshnessHalfLifeDays(180)
                                        .stabilityWindowDays(90)
                                        .validRange(0, 200)
                                        .unit("mg/L")
                                        .scoring(ladder(below(1, 100), between(1, 3, 65), from(3, 30)))
                                        .missingCopy("Add hs-CRP from a lab report")
                                        .build(),
                                Driver.builder()
                                        .key("metabolic_risk")
                                        .displayName("Metabolic risk history")
                                        .weight(0.30)
                                        .freshnessHalfLifeDays(365)
                                        .stabilityWindowDays(0)
                                        .scoring(
                                                categories(
                                                        "no_risk", 85,
                                                        "family_history_only", 70,
                                                        "prediabetes", 50,
                                                        "one_condition", 45,
                                                        "multiple_conditions", 30,
                                                        "diabetes", 20))
                                        .missingCopy("Answer the metabolic health questions")
                                        .build()))
                .confidenceRules(
                        List.of(
                                new ConfidenceRule.Cap(
                                        40,
                                        EvidenceCondition.sourceTypes(SourceType.LAB)
                                                .forDrivers("hba1c", "apob", "hscrp"),
                                        "no lab biomarker present")))
                .build();
    }

    private static DomainDefinition recovery() {
        return DomainDefinition.builder()
                .domain(PrimeDomain.RECOVERY)
                .drivers(
                        List.of(
                                Driver.builder()
                                        .key(PRIMARY_SLEEP_DRIVER)
                                        .displayName("Sleep duration")
                                        .weight(0.45)
                                        .freshnessHalfLifeDays(14)
                                        .stabilityWindowDays(14)
                                        .validRange(0, 24)
                                        .unit("h")
                                        .scoring(
                                                new FirstMatch(
                                                        List.of(
                                                                ladder(
                                                                        below(4, 0),
                                                                        between(4, 5, 25),
                                                                        between(5, 6, 50),
                                                                        between(6, 7, 75),
                                                                        between(7, 9, 100),
                                                                        between(9, 10, 75),
                                                                        between(10, 11, 50),
                                                                        between(11, 12, 25),
                                                                        from(12, 0)),
                                                                categories(
                                                                        "<6h", 45,
                                                                        "6-7h", 70,
                                                                        "7-8h", 100,
                                                                        "8h+", 90))))
                                        .missingCopy("Sync sleep from your watch or phone")
                                        .build(),
                                Driver.builder()
                                        .key("hrv")
                                        .displayName("HRV")
                                        .weight(0.25)
                                        .freshnessHalfLifeDays(14)
                                        .stabilityWindowDays(14)
                                        .validRange(5, 300)
                                        .unit("ms")
                                        .scoring(
                                                ladder(
                                                        below(20, 0),
                                                        between(20, 40, 25),
                                                        between(40, 70, 50),
                                                        between(70, 100, 75),
                                                        from(100, 100)))
                                        .missingCopy("Connect a wearable that measures HRV")
                                        .build(),
                                Driver.builder()
                                        .key("sleep_regularity")
                                        .displayName("Sleep regularity")
                                        .weight(0.15)
                                        .freshnessHalfLifeDays(30)
                                        .stabilityWindowDays(14)
                                        .scoring(categories("true", 90, "false", 45))
                                        .missingCopy("Tell us whether you keep a regular bedtime")
                                        .build(),
                                Driver.builder()
                                        .key("insomnia")
                                        .displayName("Insomnia nights per week")
                                        .weight(0.15)
                                        .freshnessHalfLifeDays(30)
                                        .stabilityWindowDays(14)
                                        .scoring(
                                                categories(
                                                        "<1", 100,
                                                        "1-2", 70,
                                                        "3-4", 40,
                                                        "5+", 15))
                                        .missingCopy("Tell us how often you struggle to sleep")
                                        .build()))
                .confidenceRules(
                        List.of(
                                new ConfidenceRule.Floor(
                                        70,
                                        EvidenceCondition.sourceTypes(SourceType.DEVICE)
                                                .forDrivers(PRIMARY_SLEEP_DRIVER),
                                        "device sleep data present")))
                .build();
    }

    private static DomainDefinition mind() {
        return DomainDefinition.builder()
                .domain(PrimeDomain.MIND)
                .drivers(
                        List.of(
                                Driver.builder()
                                        .key("focus_test")
                                        .displayName("Focus test")
                                        .weight(0.40)
                                        .freshnessHalfLifeDays(60)
                                        .stabilityWindowDays(28)
                                        .validRange(0, 100)
                                        .scoring(new Passthrough())
                                        .missingCopy("Take the 60-second focus check")
                                        .build(),
                                Driver.builder()
                                        .key("focus_stability")
                                        .displayName("Focus stability")
                                        .weight(0.35)
                                        .freshnessHalfLifeDays(30)
                                        .stabilityWindowDays(28)
                                        .scoring(
                                                categories(
                                                        "very_stable", 90,
                                                        "mostly_stable", 75,
                                                        "somewhat_unstable", 45,
                                                        "very_unstable", 20))
                                        .missingCopy("Tell us how steady your focus feels")
                                        .build(),
                                Driver.builder()
                                        .key("brain_fog")
                                        .displayName("Brain fog")
                                        .weight(0.25)
                                        .freshnessHalfLifeDays(30)
                                        .stabilityWindowDays(28)
                                        .scoring(categories("rarely", 90, "sometimes", 60, "often", 25))
                                        .missingCopy("Tell us how often you feel foggy")
                                        .build()))
                .confidenceRules(
                        List.of(
                                new ConfidenceRule.Cap(
                                        35,
                                        EvidenceCondition.sourceTypes(SourceType.TEST),
                                        "no focus test taken")))
                .build();
    }

    private static Ladder ladder(Band... bands) {
        return new Ladder(List.of(bands));
    }

    private static Band below(double max, double score) {
        return new Band(null, max, score);
    }

    private static Band between(double min, double max, double score) {
        return new Band(min, max, score);
    }

    private static Band from(double min, double score) {
        return new Band(min, null, score);
    }

    private static CategoryMap categories(Object... labelsAndScores) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (int i = 0; i < labelsAndScores.length; i += 2) {
            scores.put((String) labelsAndScores[i], ((Number) labelsAndScores[i + 1]).doubleValue());
        }
        return new CategoryMap(scores);
    }
}
