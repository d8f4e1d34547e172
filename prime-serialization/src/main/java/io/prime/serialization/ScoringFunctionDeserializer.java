package io.prime.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.prime.core.registry.ScoringFunction;
import io.prime.core.registry.ScoringFunction.Band;
import io.prime.core.registry.ScoringFunction.CategoryMap;
import io.prime.core.registry.ScoringFunction.FirstMatch;
import io.prime.core.registry.ScoringFunction.Ladder;
import io.prime.core.registry.ScoringFunction.Passthrough;
import io.prime.core.registry.ScoringFunction.PiecewiseLinear;
import io.prime.core.registry.ScoringFunction.Point;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Deserializes `ScoringFunction` variants based on the `type` discriminator field.
///
/// Bands, points and candidates are extracted manually from the `JsonNode` tree. Constraint
/// violations reported by the variant constructors (score outside 0-100, fewer than two
/// points) are rethrown as `JsonMappingException`.
///
/// @see ScoringFunctionSerializer for the inverse operation
class ScoringFunctionDeserializer extends StdDeserializer<ScoringFunction> {

    @Serial private static final long serialVersionUID = 1180482541127362395L;

    ScoringFunctionDeserializer() {
        super(ScoringFunction.class);
    }

    @Override
    public ScoringFunction deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return fromNode(p, mapper.readTree(p));
    }

    private static ScoringFunction fromNode(JsonParser p, JsonNode root)
            throws JsonMappingException {
        String type = JsonFields.requiredText(p, root, "type");
        try {
            switch (type) {
                case "ladder":
                    List<Band> bands = new ArrayList<>();
                    for (JsonNode band : JsonFields.required(p, root, "bands")) {
                        bands.add(
                                new Band(
                                        JsonFields.optionalNumber(band, "min"),
                                        JsonFields.optionalNumber(band, "max"),
                                        JsonFields.requiredNumber(p, band, "score")));
                    }
                    return new Ladder(bands);
                case "piecewise":
                    List<Point> points = new ArrayList<>();
                    for (JsonNode point : JsonFields.required(p, root, "points")) {
                        points.add(
                                new Point(
                                        JsonFields.requiredNumber(p, point, "x"),
                                        JsonFields.requiredNumber(p, point, "score")));
                    }
                    return new PiecewiseLinear(points);
                case "categories":
                    Map<String, Double> scores = new LinkedHashMap<>();
                    Iterator<Map.Entry<String, JsonNode>> fields =
                            JsonFields.required(p, root, "scores").fields();
                    while (fields.hasNext()) {
                        Map.Entry<String, JsonNode> entry = fields.next();
                        scores.put(entry.getKey(), entry.getValue().doubleValue());
                    }
                    return new CategoryMap(scores);
                case "passthrough":
                    return new Passthrough();
                case "first_match":
                    List<ScoringFunction> candidates = new ArrayList<>();
                    for (JsonNode candidate : JsonFields.required(p, root, "candidates")) {
                        candidates.add(fromNode(p, candidate));
                    }
                    return new FirstMatch(candidates);
                default:
                    throw JsonMappingException.from(p, "Unknown scoring function type: " + type);
            }
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(
                    p, "Invalid " + type + " scoring function: " + e.getMessage(), e);
        }
    }
}
