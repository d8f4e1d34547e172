package io.prime.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.prime.core.model.SourceType;
import io.prime.core.registry.ConfidenceRule;
import io.prime.core.registry.EvidenceCondition;
import java.io.IOException;
import java.io.Serial;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

/// Deserializes `ConfidenceRule` variants based on the `type` discriminator field.
///
/// `reason` is required: it is the text shown when the rule changes a confidence value.
class ConfidenceRuleDeserializer extends StdDeserializer<ConfidenceRule> {

    @Serial private static final long serialVersionUID = -7751902734516218890L;

    ConfidenceRuleDeserializer() {
        super(ConfidenceRule.class);
    }

    @Override
    public ConfidenceRule deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String type = JsonFields.requiredText(p, root, "type");
        double limit = JsonFields.requiredNumber(p, root, "limit");
        String reason = JsonFields.requiredText(p, root, "reason");
        try {
            switch (type) {
                case "cap":
                    return new ConfidenceRule.Cap(
                            limit, condition(p, JsonFields.required(p, root, "unless_present")), reason);
                case "floor":
                    return new ConfidenceRule.Floor(
                            limit, condition(p, JsonFields.required(p, root, "when_present")), reason);
                default:
                    throw JsonMappingException.from(p, "Unknown confidence rule type: " + type);
            }
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(
                    p, "Invalid " + type + " rule: " + e.getMessage(), e);
        }
    }

    private static EvidenceCondition condition(JsonParser p, JsonNode node)
            throws JsonMappingException {
        Set<SourceType> sourceTypes = EnumSet.noneOf(SourceType.class);
        for (String key : JsonFields.textList(node, "source_types")) {
            sourceTypes.add(JsonFields.sourceType(p, key));
        }
        return new EvidenceCondition(
                sourceTypes, new HashSet<>(JsonFields.textList(node, "driver_keys")));
    }
}
