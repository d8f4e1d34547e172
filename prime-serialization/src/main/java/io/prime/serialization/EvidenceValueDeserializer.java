package io.prime.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.prime.core.evidence.EvidenceValue;
import java.io.IOException;
import java.io.Serial;

/// Reads an `EvidenceValue` from a number, string, boolean or unestimable marker object.
///
/// Booleans become categorical `"true"`/`"false"`, matching how questionnaire answers are
/// stored. Non-finite numbers are rejected.
class EvidenceValueDeserializer extends StdDeserializer<EvidenceValue> {

    @Serial private static final long serialVersionUID = -4478016405325110937L;

    static final String UNESTIMABLE_FIELD = "unable_to_estimate";

    EvidenceValueDeserializer() {
        super(EvidenceValue.class);
    }

    @Override
    public EvidenceValue deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return fromNode(p, mapper.readTree(p));
    }

    static EvidenceValue fromNode(JsonParser p, JsonNode node) throws JsonMappingException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw JsonMappingException.from(p, "Evidence value required");
        }
        if (node.isNumber()) {
            double value = node.doubleValue();
            if (!Double.isFinite(value)) {
                throw JsonMappingException.from(p, "Numeric evidence must be finite: " + value);
            }
            return EvidenceValue.numeric(value);
        }
        if (node.isTextual()) {
            return EvidenceValue.categorical(node.asText());
        }
        if (node.isBoolean()) {
            return EvidenceValue.categorical(String.valueOf(node.booleanValue()));
        }
        if (node.isObject() && node.path(UNESTIMABLE_FIELD).asBoolean(false)) {
            return EvidenceValue.unestimable();
        }
        throw JsonMappingException.from(p, "Unsupported evidence value: " + node);
    }
}
