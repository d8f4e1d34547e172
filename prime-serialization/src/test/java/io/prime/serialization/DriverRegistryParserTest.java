package io.prime.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.prime.core.evidence.EvidenceItem;
import io.prime.core.evidence.EvidenceSet;
import io.prime.core.evidence.EvidenceValue;
import io.prime.core.exception.ConfigurationException;
import io.prime.core.model.PrimeDomain;
import io.prime.core.model.SourceType;
import io.prime.core.registry.ConfidenceRule;
import io.prime.core.registry.DefaultDriverRegistry;
import io.prime.core.registry.DomainDefinition;
import io.prime.core.registry.Driver;
import io.prime.core.registry.DriverRegistry;
import io.prime.core.registry.ScoringFunction;
import io.prime.core.registry.SourceQualityTable;
import io.prime.core.registry.ValueRange;
import io.prime.core.scorecard.ScorecardEngine;
import io.prime.core.scoring.NoHistoryStabilityCalculator;
import io.prime.core.scoring.PrimeScoreAggregator;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DriverRegistryParserTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void parse_minimalRegistry() throws IOException {
        DriverRegistry registry = DriverRegistryParser.parse(resource("/registry/minimal-registry.json"));

        assertThat(registry.getVersion()).isEqualTo("test-1");
        DomainDefinition heart = registry.getDomain(PrimeDomain.HEART);
        assertThat(heart.getDrivers()).extracting(Driver::getKey).containsExactly("rhr", "bp_bucket");

        Driver rhr = heart.getDriver("rhr").orElseThrow();
        assertThat(rhr.getDisplayName()).isEqualTo("Resting heart rate");
        assertThat(rhr.getWeight()).isEqualTo(0.6);
        assertThat(rhr.getFreshnessHalfLifeDays()).isEqualTo(14.0);
        assertThat(rhr.getValidRange()).isEqualTo(new ValueRange(25, 220));
        assertThat(rhr.getMissingCopy()).isEqualTo("Sync a wearable");
        assertThat(rhr.getScoring().score(EvidenceValue.numeric(70))).hasValue(50.0);

        Driver bucket = heart.getDriver("bp_bucket").orElseThrow();
        assertThat(bucket.getDisplayName()).isEqualTo("bp_bucket");
        assertThat(bucket.getFreshnessHalfLifeDays()).isEqualTo(30.0);
        assertThat(bucket.getScoring()).isInstanceOf(ScoringFunction.FirstMatch.class);
        assertThat(bucket.getScoring().score(EvidenceValue.numeric(130))).hasValue(50.0);
        assertThat(bucket.getScoring().score(EvidenceValue.categorical("normal"))).hasValue(100.0);
        assertThat(bucket.getScoring().score(EvidenceValue.categorical("unknown")))
                .isEqualTo(OptionalDouble.empty());

        assertThat(heart.getConfidenceRules()).singleElement()
                .isInstanceOf(ConfidenceRule.Cap.class)
                .satisfies(rule -> assertThat(rule.limit()).isEqualTo(60.0));
        assertThat(registry.getDomain(PrimeDomain.RECOVERY).getConfidenceRules()).singleElement()
                .satisfies(rule -> assertThat(rule.condition().driverKeys()).containsExactly("sleep"));
        assertThat(registry.getDomain(PrimeDomain.FRAME).getSuppressionRules()).singleElement()
                .satisfies(rule -> assertThat(rule.reason()).isEqualTo("superseded by more specific evidence"));
    }

    @Test
    void roundTrip_defaultRegistryScoresIdentically() {
        DriverRegistry original = DefaultDriverRegistry.create();

        DriverRegistry restored = DriverRegistryParser.parse(DriverRegistryParser.toJson(original));

        assertThat(restored.getVersion()).isEqualTo(original.getVersion());
        for (PrimeDomain domain : PrimeDomain.values()) {
            assertThat(restored.getDomain(domain).getDrivers())
                    .extracting(Driver::getKey, Driver::getWeight)
                    .containsExactlyElementsOf(
                            original.getDomain(domain).getDrivers().stream()
                                    .map(d -> tuple(d.getKey(), d.getWeight()))
                                    .toList());
            assertThat(restored.getDomain(domain).getConfidenceRules())
                    .isEqualTo(original.getDomain(domain).getConfidenceRules());
            assertThat(restored.getDomain(domain).getSuppressionRules())
                    .isEqualTo(original.getDomain(domain).getSuppressionRules());
        }

        EvidenceSet evidence = sampleEvidence();
        assertThat(engine(restored).computeScorecard(evidence, NOW, "r"))
                .isEqualTo(engine(original).computeScorecard(evidence, NOW, "r"));
    }

    @Test
    void parse_fromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("rules.json");
        Files.writeString(file, resource("/registry/minimal-registry.json"));

        assertThat(DriverRegistryParser.parse(file).getVersion()).isEqualTo("test-1");
    }

    @Test
    void parse_missingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> DriverRegistryParser.parse(dir.resolve("absent.json")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Cannot read driver registry");
    }

    @Test
    void parse_rejectsWeightsNotSummingToOne() throws IOException {
        String json = resource("/registry/minimal-registry.json").replace("\"weight\": 0.4", "\"weight\": 0.3");

        assertThatThrownBy(() -> DriverRegistryParser.parse(json))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("sum to");
    }

    @Test
    void parse_rejectsMissingDomain() throws IOException {
        String json = resource("/registry/minimal-registry.json").replace("\"domain\": \"mind\"", "\"domain\": \"heart\"");

        assertThatThrownBy(() -> DriverRegistryParser.parse(json))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Domain defined twice: heart");
    }

    @Test
    void parse_rejectsUnknownScoringType() throws IOException {
        String json = resource("/registry/minimal-registry.json").replace("\"piecewise\"", "\"sigmoid\"");

        assertThatThrownBy(() -> DriverRegistryParser.parse(json))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Unknown scoring function type: sigmoid");
    }

    @Test
    void parse_rejectsInvalidDriverWeight() throws IOException {
        String json = resource("/registry/minimal-registry.json").replace("\"weight\": 0.6", "\"weight\": 1.6");

        assertThatThrownBy(() -> DriverRegistryParser.parse(json))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Weight must be between 0 and 1");
    }

    @Test
    void parse_dominanceCap() throws IOException {
        String json = resource("/registry/minimal-registry.json")
                .replace("\"weight\": 0.6,", "\"weight\": 0.6, \"dominance_cap\": 0.5,");

        DomainDefinition heart = DriverRegistryParser.parse(json).getDomain(PrimeDomain.HEART);

        assertThat(heart.getDriver("rhr").orElseThrow().getDominanceCap()).isEqualTo(0.5);
        assertThat(heart.getDriver("bp_bucket").orElseThrow().getDominanceCap()).isEqualTo(1.0);
    }

    @Test
    void roundTrip_dominanceCap() throws IOException {
        String json = resource("/registry/minimal-registry.json")
                .replace("\"weight\": 0.6,", "\"weight\": 0.6, \"dominance_cap\": 0.5,");

        String written = DriverRegistryParser.toJson(DriverRegistryParser.parse(json));

        assertThat(DriverRegistryParser.parse(written).getDomain(PrimeDomain.HEART).getDriver("rhr")
                .orElseThrow().getDominanceCap()).isEqualTo(0.5);
    }

    @Test
    void parse_rejectsInvalidDominanceCap() throws IOException {
        String json = resource("/registry/minimal-registry.json")
                .replace("\"weight\": 0.6,", "\"weight\": 0.6, \"dominance_cap\": 1.5,");

        assertThatThrownBy(() -> DriverRegistryParser.parse(json))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Dominance cap must be in (0, 1]: rhr");
    }

    @Test
    void parse_rejectsSelfSuppression() throws IOException {
        String json = resource("/registry/minimal-registry.json")
                .replace("\"trigger_drivers\": [ \"body_fat_pct\" ]", "\"trigger_drivers\": [ \"bmi\" ]");

        assertThatThrownBy(() -> DriverRegistryParser.parse(json))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid suppression of bmi: Driver cannot suppress itself");
    }

    @Test
    void parse_rejectsMalformedJson() {
        assertThatThrownBy(() -> DriverRegistryParser.parse("{\"version\": "))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageStartingWith("Invalid driver registry");
    }

    private static ScorecardEngine engine(DriverRegistry registry) {
        return new ScorecardEngine(
                registry,
                SourceQualityTable.defaults(),
                new NoHistoryStabilityCalculator(),
                new PrimeScoreAggregator());
    }

    private static EvidenceSet sampleEvidence() {
        return EvidenceSet.of(
                List.of(
                        item(PrimeDomain.HEART, "rhr", EvidenceValue.numeric(62), SourceType.DEVICE),
                        item(PrimeDomain.FRAME, "bmi", EvidenceValue.numeric(24), SourceType.SELF_REPORT_PROXY),
                        item(PrimeDomain.FRAME, "waist_to_height", EvidenceValue.numeric(0.48), SourceType.MEASURED_SELF_REPORT),
                        item(PrimeDomain.METABOLISM, "hba1c", EvidenceValue.numeric(5.6), SourceType.LAB),
                        item(PrimeDomain.RECOVERY, "sleep_duration", EvidenceValue.categorical("7-8h"), SourceType.SELF_REPORT_PROXY),
                        item(PrimeDomain.MIND, "brain_fog", EvidenceValue.categorical("rarely"), SourceType.SELF_REPORT_PROXY)));
    }

    private static EvidenceItem item(
            PrimeDomain domain, String key, EvidenceValue value, SourceType source) {
        return EvidenceItem.builder()
                .domain(domain)
                .driverKey(key)
                .value(value)
                .sourceType(source)
                .measuredAt(NOW.minusSeconds(86_400))
                .build();
    }

    private static String resource(String name) throws IOException {
        try (InputStream in = DriverRegistryParserTest.class.getResourceAsStream(name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
