package io.prime.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.prime.core.model.SourceType;
import io.prime.core.registry.ConfidenceRule;
import io.prime.core.registry.EvidenceCondition;
import java.io.IOException;
import java.io.Serial;
import java.util.TreeSet;

/// Serializes `ConfidenceRule` variants with a `"type"` discriminator field.
///
/// - **`Cap`**: `{"type":"cap","limit":40,"unless_present":{...},"reason":"..."}`
/// - **`Floor`**: `{"type":"floor","limit":70,"when_present":{...},"reason":"..."}`
///
/// Conditions are written as `{"source_types":["lab"],"driver_keys":["hba1c"]}` with both
/// lists sorted so output is stable.
///
/// @see ConfidenceRuleDeserializer for the inverse operation
class ConfidenceRuleSerializer extends StdSerializer<ConfidenceRule> {

    @Serial private static final long serialVersionUID = 4485326208147003369L;

    ConfidenceRuleSerializer() {
        super(ConfidenceRule.class);
    }

    @Override
    public void serialize(ConfidenceRule rule, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        boolean cap = rule instanceof ConfidenceRule.Cap;
        gen.writeStringField("type", cap ? "cap" : "floor");
        gen.writeNumberField("limit", rule.limit());
        writeCondition(gen, cap ? "unless_present" : "when_present", rule.condition());
        gen.writeStringField("reason", rule.reason());
        gen.writeEndObject();
    }

    private static void writeCondition(JsonGenerator gen, String field, EvidenceCondition condition)
            throws IOException {
        gen.writeObjectFieldStart(field);
        gen.writeArrayFieldStart("source_types");
        for (SourceType type : SourceType.values()) {
            if (condition.sourceTypes().contains(type)) {
                gen.writeString(type.key());
            }
        }
        gen.writeEndArray();
        gen.writeArrayFieldStart("driver_keys");
        for (String key : new TreeSet<>(condition.driverKeys())) {
            gen.writeString(key);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
