package io.prime.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.prime.core.model.PrimeDomain;
import io.prime.core.scorecard.EvidenceSummary;
import io.prime.core.scorecard.Scorecard;
import io.prime.core.scorecard.ScorecardEvidence;
import io.prime.core.scoring.RiskFlag;
import java.io.IOException;
import java.io.Serial;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/// Serializes a `Scorecard` into its persisted JSON document.
///
/// Domain maps always carry all five domain keys in declaration order; an unscored domain
/// is written as `null` rather than omitted.
///
/// ```
/// {
///   "generated_at": "...", "scoring_revision": "v1",
///   "domain_scores": {"heart": 91, "frame": null, ...},
///   "domain_confidence": {"heart": 64, ...},
///   "prime_score": null, "prime_confidence": 41,
///   "how_calculated": {"heart": ["..."], ...},
///   "evidence_summary": {"total_metrics": 4, "domains_with_data": 2,
///                        "freshest_measured_at": "...", "freshest_by_domain": {...}},
///   "risk_flags": ["bp_crisis"],
///   "evidence": [{"domain": "heart", "driver_key": "rhr", ..., "subscore": 80}]
/// }
/// ```
///
/// @see ScorecardDeserializer for the inverse operation
class ScorecardSerializer extends StdSerializer<Scorecard> {

    @Serial private static final long serialVersionUID = 7361150227849114063L;

    ScorecardSerializer() {
        super(Scorecard.class);
    }

    @Override
    public void serialize(Scorecard scorecard, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("generated_at", scorecard.getGeneratedAt().toString());
        gen.writeStringField("scoring_revision", scorecard.getScoringRevision());

        gen.writeObjectFieldStart("domain_scores");
        for (PrimeDomain domain : PrimeDomain.values()) {
            writeNullableInt(gen, domain.key(), scorecard.getDomainScores().get(domain));
        }
        gen.writeEndObject();

        gen.writeObjectFieldStart("domain_confidence");
        for (PrimeDomain domain : PrimeDomain.values()) {
            writeNullableInt(gen, domain.key(), scorecard.getDomainConfidence().get(domain));
        }
        gen.writeEndObject();

        writeNullableInt(gen, "prime_score", scorecard.getPrimeScore());
        gen.writeNumberField("prime_confidence", scorecard.getPrimeConfidence());

        gen.writeObjectFieldStart("how_calculated");
        for (PrimeDomain domain : PrimeDomain.values()) {
            gen.writeArrayFieldStart(domain.key());
            for (String line : scorecard.getHowCalculated().getOrDefault(domain, List.of())) {
                gen.writeString(line);
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();

        writeSummary(gen, scorecard.getEvidenceSummary());

        gen.writeArrayFieldStart("risk_flags");
        for (RiskFlag flag : scorecard.getRiskFlags()) {
            gen.writeString(flag.key());
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("evidence");
        for (ScorecardEvidence evidence : scorecard.getEvidence()) {
            gen.writeStartObject();
            gen.writeStringField("domain", evidence.domain().key());
            gen.writeStringField("driver_key", evidence.driverKey());
            gen.writeStringField("source_type", evidence.sourceType().key());
            writeNullableInstant(gen, "measured_at", evidence.measuredAt());
            provider.defaultSerializeField("value", evidence.value(), gen);
            if (evidence.unit() != null) {
                gen.writeStringField("unit", evidence.unit());
            }
            gen.writeNumberField("subscore", evidence.subscore());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }

    private static void writeSummary(JsonGenerator gen, EvidenceSummary summary)
            throws IOException {
        gen.writeObjectFieldStart("evidence_summary");
        gen.writeNumberField("total_metrics", summary.totalMetrics());
        gen.writeNumberField("domains_with_data", summary.domainsWithData());
        writeNullableInstant(gen, "freshest_measured_at", summary.freshestMeasuredAt());
        gen.writeObjectFieldStart("freshest_by_domain");
        for (Map.Entry<PrimeDomain, Instant> entry : summary.freshestByDomain().entrySet()) {
            gen.writeStringField(entry.getKey().key(), entry.getValue().toString());
        }
        gen.writeEndObject();
        gen.writeEndObject();
    }

    private static void writeNullableInt(JsonGenerator gen, String field, Integer value)
            throws IOException {
        if (value != null) {
            gen.writeNumberField(field, value);
        } else {
            gen.writeNullField(field);
        }
    }

    private static void writeNullableInstant(JsonGenerator gen, String field, Instant value)
            throws IOException {
        if (value != null) {
            gen.writeStringField(field, value.toString());
        } else {
            gen.writeNullField(field);
        }
    }
}
