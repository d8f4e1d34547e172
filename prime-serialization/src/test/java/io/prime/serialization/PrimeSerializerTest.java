package io.prime.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.prime.core.PrimeFactory;
import io.prime.core.evidence.EvidenceItem;
import io.prime.core.evidence.EvidenceSet;
import io.prime.core.evidence.EvidenceValue;
import io.prime.core.model.PrimeDomain;
import io.prime.core.model.SourceType;
import io.prime.core.scorecard.Scorecard;
import io.prime.core.scoring.RiskFlag;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PrimeSerializerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void roundTrip_scorecard() {
        Scorecard original = computeScorecard(sampleEvidence());

        Scorecard restored = PrimeSerializer.scorecardFromJson(PrimeSerializer.toJson(original));

        assertThat(restored).isEqualTo(original);
        assertThat(restored.getEvidence()).hasSize(original.getEvidence().size());
        assertThat(restored.getEvidenceSummary().freshestByDomain())
                .containsOnlyKeys(PrimeDomain.HEART, PrimeDomain.FRAME);
    }

    @Test
    void scorecardJson_writesUnscoredDomainsAsNull() throws Exception {
        Scorecard scorecard = computeScorecard(sampleEvidence());

        JsonNode json = PrimeSerializer.createMapper().readTree(PrimeSerializer.toJson(scorecard));

        assertThat(json.get("scoring_revision").asText()).isEqualTo("rev-1");
        assertThat(json.get("generated_at").asText()).isEqualTo("2026-03-01T12:00:00Z");
        assertThat(json.get("domain_scores").get("heart").isInt()).isTrue();
        assertThat(json.get("domain_scores").get("mind").isNull()).isTrue();
        assertThat(json.get("prime_score").isNull()).isTrue();
        assertThat(json.get("how_calculated").get("mind").isArray()).isTrue();
        assertThat(json.get("evidence_summary").get("total_metrics").asInt()).isEqualTo(3);
        assertThat(json.get("evidence_summary").get("freshest_by_domain").has("mind")).isFalse();
        assertThat(json.get("evidence").get(0).get("subscore").isInt()).isTrue();
    }

    @Test
    void evidenceFromJson_readsAllValueKinds() throws IOException {
        EvidenceSet evidence = PrimeSerializer.evidenceFromJson(resource("/evidence/subject-evidence.json"));

        assertThat(evidence.getSubjectId()).isEqualTo("subject-42");
        assertThat(evidence.getItems()).hasSize(6);

        EvidenceItem rhr = evidence.getItems().get(0);
        assertThat(rhr.getDomain()).isEqualTo(PrimeDomain.HEART);
        assertThat(rhr.getValue()).isEqualTo(EvidenceValue.numeric(58));
        assertThat(rhr.getUnit()).isEqualTo("bpm");
        assertThat(rhr.getSourceType()).isEqualTo(SourceType.DEVICE);
        assertThat(rhr.getMeasuredAt()).isEqualTo(Instant.parse("2026-02-28T07:00:00Z"));

        assertThat(evidence.getItems().get(2).getValue()).isEqualTo(EvidenceValue.unestimable());
        assertThat(evidence.getItems().get(3).getValue()).isEqualTo(EvidenceValue.categorical("16-30"));
        assertThat(evidence.getItems().get(3).getMeasuredAt()).isNull();
        assertThat(evidence.getItems().get(4).getDomain()).isEqualTo(PrimeDomain.MIND);
        assertThat(evidence.getItems().get(4).getSourceType()).isEqualTo(SourceType.SELF_REPORT_PROXY);
        assertThat(evidence.getItems().get(5).getValue()).isEqualTo(EvidenceValue.categorical("false"));
    }

    @Test
    void evidenceFromJson_acceptsBareArray() {
        String json =
                "[{\"domain\":\"recovery\",\"driver_key\":\"sleep_duration\",\"value\":7.5,"
                        + "\"source_type\":\"device\",\"measured_at\":\"2026-03-01T06:00:00Z\"}]";

        EvidenceSet evidence = PrimeSerializer.evidenceFromJson(json);

        assertThat(evidence.getSubjectId()).isNull();
        assertThat(evidence.getItems()).singleElement()
                .satisfies(item -> assertThat(item.getValue()).isEqualTo(EvidenceValue.numeric(7.5)));
    }

    @Test
    void roundTrip_evidenceSet() {
        EvidenceSet original = sampleEvidence();

        String json = PrimeSerializer.toJson(original);
        EvidenceSet restored = PrimeSerializer.evidenceFromJson(json);

        assertThat(json).contains("\"unable_to_estimate\"").doesNotContain("\"empty\"");
        assertThat(restored.getSubjectId()).isEqualTo("subject-1");
        assertThat(restored.getItems()).containsExactlyElementsOf(original.getItems());
    }

    @Test
    void evidenceFromJson_rejectsUnknownDomain() {
        String json =
                "[{\"domain\":\"liver\",\"driver_key\":\"alt\",\"value\":20,\"source_type\":\"lab\"}]";

        assertThatThrownBy(() -> PrimeSerializer.evidenceFromJson(json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown domain");
    }

    @Test
    void evidenceFromJson_rejectsMissingSourceType() {
        String json = "{\"items\":[{\"domain\":\"heart\",\"driver_key\":\"rhr\",\"value\":60}]}";

        assertThatThrownBy(() -> PrimeSerializer.evidenceFromJson(json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("source_type");
    }

    @Test
    void evidenceFromJson_rejectsScalarDocument() {
        assertThatThrownBy(() -> PrimeSerializer.evidenceFromJson("42"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Failed to deserialize evidence");
    }

    @Test
    void scorecardFromJson_rejectsMissingRevision() {
        String json =
                "{\"generated_at\":\"2026-03-01T12:00:00Z\",\"evidence_summary\":{\"total_metrics\":0}}";

        assertThatThrownBy(() -> PrimeSerializer.scorecardFromJson(json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Failed to deserialize scorecard");
    }

    @Test
    void evidenceFromJson_rejectsNullItem() {
        assertThatThrownBy(() -> PrimeSerializer.evidenceFromJson("[null]"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("every item must be an object");
    }

    @Test
    void evidenceFromJson_rejectsObjectWithoutItems() {
        assertThatThrownBy(() -> PrimeSerializer.evidenceFromJson("{\"subject_id\":\"s\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("items array");
    }

    @Test
    void scorecardFromJson_rejectsMissingGeneratedAt() {
        String json = "{\"scoring_revision\":\"v1\",\"evidence_summary\":{\"total_metrics\":0}}";

        assertThatThrownBy(() -> PrimeSerializer.scorecardFromJson(json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("generated_at");
    }

    @Test
    void roundTrip_scorecardRiskFlags() throws Exception {
        EvidenceSet evidence =
                EvidenceSet.of(
                        List.of(
                                EvidenceItem.builder()
                                        .domain(PrimeDomain.HEART)
                                        .driverKey("bp")
                                        .value(190)
                                        .sourceType(SourceType.DEVICE)
                                        .measuredAt(NOW)
                                        .build(),
                                EvidenceItem.builder()
                                        .domain(PrimeDomain.METABOLISM)
                                        .driverKey("metabolic_risk")
                                        .value("diabetes")
                                        .sourceType(SourceType.SELF_REPORT_PROXY)
                                        .measuredAt(NOW)
                                        .build()));
        Scorecard original = computeScorecard(evidence);

        String json = PrimeSerializer.toJson(original);
        Scorecard restored = PrimeSerializer.scorecardFromJson(json);

        List<String> flagKeys = new ArrayList<>();
        PrimeSerializer.createMapper().readTree(json).get("risk_flags").forEach(flag -> flagKeys.add(flag.asText()));
        assertThat(flagKeys).containsExactly("bp_crisis", "diabetes");
        assertThat(restored.getRiskFlags()).containsExactly(RiskFlag.BP_CRISIS, RiskFlag.DIABETES);
    }

    @Test
    void scorecardFromJson_rejectsUnknownRiskFlag() {
        String json =
                PrimeSerializer.toJson(computeScorecard(sampleEvidence()))
                        .replace("\"risk_flags\" : [ ]", "\"risk_flags\" : [ \"gout\" ]");

        assertThatThrownBy(() -> PrimeSerializer.scorecardFromJson(json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown risk flag: gout");
    }

    private static EvidenceSet sampleEvidence() {
        return new EvidenceSet(
                "subject-1",
                List.of(
                        EvidenceItem.builder()
                                .domain(PrimeDomain.HEART)
                                .driverKey("rhr")
                                .value(58)
                                .unit("bpm")
                                .sourceType(SourceType.DEVICE)
                                .measuredAt(Instant.parse("2026-02-28T07:00:00Z"))
                                .build(),
                        EvidenceItem.builder()
                                .domain(PrimeDomain.HEART)
                                .driverKey("bp")
                                .value(118)
                                .unit("mmHg")
                                .sourceType(SourceType.MEASURED_SELF_REPORT)
                                .measuredAt(Instant.parse("2026-02-25T07:00:00Z"))
                                .build(),
                        EvidenceItem.builder()
                                .domain(PrimeDomain.FRAME)
                                .driverKey("body_fat_pct")
                                .value(EvidenceValue.unestimable())
                                .sourceType(SourceType.IMAGE_ESTIMATE)
                                .measuredAt(Instant.parse("2026-02-20T07:00:00Z"))
                                .build()));
    }

    private static Scorecard computeScorecard(EvidenceSet evidence) {
        return PrimeFactory.createEnvironment().getEngine().computeScorecard(evidence, NOW, "rev-1");
    }

    private static String resource(String name) throws IOException {
        try (InputStream in = PrimeSerializerTest.class.getResourceAsStream(name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
