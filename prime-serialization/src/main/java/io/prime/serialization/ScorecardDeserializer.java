package io.prime.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.prime.core.model.PrimeDomain;
import io.prime.core.scorecard.EvidenceSummary;
import io.prime.core.scorecard.Scorecard;
import io.prime.core.scorecard.ScorecardEvidence;
import io.prime.core.scoring.RiskFlag;
import java.io.IOException;
import java.io.Serial;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/// Deserializes a `Scorecard` document written by {@link ScorecardSerializer}.
///
/// Unknown domain keys inside the domain maps and unknown risk flags are rejected; unknown
/// top-level fields are ignored. A document without `risk_flags` reads as raising none.
class ScorecardDeserializer extends StdDeserializer<Scorecard> {

    @Serial private static final long serialVersionUID = -3580664419937042187L;

    ScorecardDeserializer() {
        super(Scorecard.class);
    }

    @Override
    public Scorecard deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        Scorecard.Builder builder =
                Scorecard.builder()
                        .generatedAt(
                                JsonFields.instant(
                                        p,
                                        "generated_at",
                                        JsonFields.requiredText(p, root, "generated_at")))
                        .scoringRevision(JsonFields.requiredText(p, root, "scoring_revision"))
                        .primeConfidence(root.path("prime_confidence").asInt(0));

        JsonNode prime = root.get("prime_score");
        if (prime != null && !prime.isNull()) {
            builder.primeScore(prime.asInt());
        }

        for (Map.Entry<PrimeDomain, JsonNode> entry : domainEntries(p, root, "domain_scores")) {
            JsonNode value = entry.getValue();
            builder.domainScore(entry.getKey(), value.isNull() ? null : value.asInt());
        }
        for (Map.Entry<PrimeDomain, JsonNode> entry : domainEntries(p, root, "domain_confidence")) {
            if (!entry.getValue().isNull()) {
                builder.domainConfidence(entry.getKey(), entry.getValue().asInt());
            }
        }
        for (Map.Entry<PrimeDomain, JsonNode> entry : domainEntries(p, root, "how_calculated")) {
            List<String> lines = new ArrayList<>();
            for (JsonNode line : entry.getValue()) {
                lines.add(line.asText());
            }
            builder.howCalculated(entry.getKey(), lines);
        }

        builder.evidenceSummary(readSummary(p, JsonFields.required(p, root, "evidence_summary")));

        List<ScorecardEvidence> evidence = new ArrayList<>();
        JsonNode items = root.get("evidence");
        if (items != null) {
            for (JsonNode item : items) {
                evidence.add(
                        new ScorecardEvidence(
                                JsonFields.domain(p, JsonFields.requiredText(p, item, "domain")),
                                JsonFields.requiredText(p, item, "driver_key"),
                                JsonFields.sourceType(
                                        p, JsonFields.requiredText(p, item, "source_type")),
                                JsonFields.optionalInstant(p, item, "measured_at"),
                                EvidenceValueDeserializer.fromNode(p, item.get("value")),
                                JsonFields.optionalText(item, "unit"),
                                item.path("subscore").asInt()));
            }
        }
        builder.evidence(evidence);

        List<RiskFlag> flags = new ArrayList<>();
        for (String key : JsonFields.textList(root, "risk_flags")) {
            flags.add(JsonFields.riskFlag(p, key));
        }
        builder.riskFlags(flags);

        return builder.build();
    }

    private static EvidenceSummary readSummary(JsonParser p, JsonNode node)
            throws JsonMappingException {
        Map<PrimeDomain, Instant> byDomain = new EnumMap<>(PrimeDomain.class);
        for (Map.Entry<PrimeDomain, JsonNode> entry : domainEntries(p, node, "freshest_by_domain")) {
            if (!entry.getValue().isNull()) {
                byDomain.put(
                        entry.getKey(),
                        JsonFields.instant(p, "freshest_by_domain", entry.getValue().asText()));
            }
        }
        return new EvidenceSummary(
                node.path("total_metrics").asInt(),
                node.path("domains_with_data").asInt(),
                JsonFields.optionalInstant(p, node, "freshest_measured_at"),
                byDomain);
    }

    private static List<Map.Entry<PrimeDomain, JsonNode>> domainEntries(
            JsonParser p, JsonNode parent, String field) throws JsonMappingException {
        List<Map.Entry<PrimeDomain, JsonNode>> entries = new ArrayList<>();
        JsonNode object = parent.get(field);
        if (object == null || object.isNull()) {
            return entries;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            entries.add(Map.entry(JsonFields.domain(p, entry.getKey()), entry.getValue()));
        }
        return entries;
    }
}
