package io.prime.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.prime.core.evidence.EvidenceItem;
import java.io.IOException;
import java.io.Serial;

/// Serializes an `EvidenceItem` with snake_case field names.
///
/// Emitted shape:
/// `{"domain":"heart","driver_key":"rhr","value":58,"unit":"bpm","source_type":"device",
/// "measured_at":"2026-03-01T08:00:00Z"}`. `unit` and `measured_at` are omitted when null.
///
/// @see EvidenceItemDeserializer for the inverse operation
class EvidenceItemSerializer extends StdSerializer<EvidenceItem> {

    @Serial private static final long serialVersionUID = 6034177541916329852L;

    EvidenceItemSerializer() {
        super(EvidenceItem.class);
    }

    @Override
    public void serialize(EvidenceItem item, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("domain", item.getDomain().key());
        gen.writeStringField("driver_key", item.getDriverKey());
        provider.defaultSerializeField("value", item.getValue(), gen);
        if (item.getUnit() != null) {
            gen.writeStringField("unit", item.getUnit());
        }
        gen.writeStringField("source_type", item.getSourceType().key());
        if (item.getMeasuredAt() != null) {
            gen.writeStringField("measured_at", item.getMeasuredAt().toString());
        }
        gen.writeEndObject();
    }
}
