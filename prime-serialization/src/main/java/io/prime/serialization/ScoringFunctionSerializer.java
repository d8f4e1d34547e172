package io.prime.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.prime.core.registry.ScoringFunction;
import io.prime.core.registry.ScoringFunction.Band;
import io.prime.core.registry.ScoringFunction.CategoryMap;
import io.prime.core.registry.ScoringFunction.FirstMatch;
import io.prime.core.registry.ScoringFunction.Ladder;
import io.prime.core.registry.ScoringFunction.PiecewiseLinear;
import io.prime.core.registry.ScoringFunction.Point;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes the `ScoringFunction` sealed hierarchy with a `"type"` discriminator field.
///
/// Emitted JSON shape per subtype:
/// - **`Ladder`**: `{"type":"ladder","bands":[{"min":4,"max":5,"score":25},...]}`, open
///   bounds written as `null`
/// - **`PiecewiseLinear`**: `{"type":"piecewise","points":[{"x":50,"score":100},...]}`
/// - **`CategoryMap`**: `{"type":"categories","scores":{"never":100,...}}`
/// - **`Passthrough`**: `{"type":"passthrough"}`
/// - **`FirstMatch`**: `{"type":"first_match","candidates":[...]}`
///
/// @see ScoringFunctionDeserializer for the inverse operation
class ScoringFunctionSerializer extends StdSerializer<ScoringFunction> {

    @Serial private static final long serialVersionUID = -6214781030453337095L;

    ScoringFunctionSerializer() {
        super(ScoringFunction.class);
    }

    @Override
    public void serialize(ScoringFunction function, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();

        if (function instanceof Ladder ladder) {
            gen.writeStringField("type", "ladder");
            gen.writeArrayFieldStart("bands");
            for (Band band : ladder.bands()) {
                gen.writeStartObject();
                writeBound(gen, "min", band.min());
                writeBound(gen, "max", band.max());
                gen.writeNumberField("score", band.score());
                gen.writeEndObject();
            }
            gen.writeEndArray();
        } else if (function instanceof PiecewiseLinear piecewise) {
            gen.writeStringField("type", "piecewise");
            gen.writeArrayFieldStart("points");
            for (Point point : piecewise.points()) {
                gen.writeStartObject();
                gen.writeNumberField("x", point.x());
                gen.writeNumberField("score", point.score());
                gen.writeEndObject();
            }
            gen.writeEndArray();
        } else if (function instanceof CategoryMap categories) {
            gen.writeStringField("type", "categories");
            gen.writeObjectFieldStart("scores");
            for (Map.Entry<String, Double> entry : categories.scores().entrySet()) {
                gen.writeNumberField(entry.getKey(), entry.getValue());
            }
            gen.writeEndObject();
        } else if (function instanceof FirstMatch firstMatch) {
            gen.writeStringField("type", "first_match");
            gen.writeArrayFieldStart("candidates");
            for (ScoringFunction candidate : firstMatch.candidates()) {
                serialize(candidate, gen, provider);
            }
            gen.writeEndArray();
        } else {
            gen.writeStringField("type", "passthrough");
        }

        gen.writeEndObject();
    }

    private static void writeBound(JsonGenerator gen, String field, Double bound)
            throws IOException {
        if (bound != null) {
            gen.writeNumberField(field, bound);
        } else {
            gen.writeNullField(field);
        }
    }
}
