package io.prime.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.prime.core.evidence.EvidenceValue;
import java.io.IOException;
import java.io.Serial;

/// Writes an `EvidenceValue` in its natural JSON form.
///
/// - `Numeric` as a JSON number
/// - `Categorical` as a JSON string
/// - `Unestimable` as `{"unable_to_estimate":true}`
///
/// @see EvidenceValueDeserializer for the inverse operation
class EvidenceValueSerializer extends StdSerializer<EvidenceValue> {

    @Serial private static final long serialVersionUID = 2318406570261905581L;

    EvidenceValueSerializer() {
        super(EvidenceValue.class);
    }

    @Override
    public void serialize(EvidenceValue value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (value instanceof EvidenceValue.Numeric numeric) {
            gen.writeNumber(numeric.value());
        } else if (value instanceof EvidenceValue.Categorical categorical) {
            gen.writeString(categorical.value());
        } else {
            gen.writeStartObject();
            gen.writeBooleanField(EvidenceValueDeserializer.UNESTIMABLE_FIELD, true);
            gen.writeEndObject();
        }
    }
}
