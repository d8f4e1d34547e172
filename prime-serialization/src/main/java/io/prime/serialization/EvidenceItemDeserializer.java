package io.prime.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.prime.core.evidence.EvidenceItem;
import java.io.IOException;
import java.io.Serial;

/// Deserializes an `EvidenceItem` from the shape written by {@link EvidenceItemSerializer}.
///
/// `domain`, `driver_key`, `value` and `source_type` are required. Domain and source type
/// keys are matched case-insensitively.
class EvidenceItemDeserializer extends StdDeserializer<EvidenceItem> {

    @Serial private static final long serialVersionUID = -2911760035938532017L;

    EvidenceItemDeserializer() {
        super(EvidenceItem.class);
    }

    @Override
    public EvidenceItem deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (!root.isObject()) {
            throw JsonMappingException.from(p, "Evidence item must be an object");
        }

        return EvidenceItem.builder()
                .domain(JsonFields.domain(p, JsonFields.requiredText(p, root, "domain")))
                .driverKey(JsonFields.requiredText(p, root, "driver_key"))
                .value(EvidenceValueDeserializer.fromNode(p, root.get("value")))
                .unit(JsonFields.optionalText(root, "unit"))
                .sourceType(JsonFields.sourceType(p, JsonFields.requiredText(p, root, "source_type")))
                .measuredAt(JsonFields.optionalInstant(p, root, "measured_at"))
                .build();
    }
}
