package io.prime.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.prime.core.model.PrimeDomain;
import io.prime.core.model.SourceType;
import io.prime.core.scoring.RiskFlag;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/// Tree-reading helpers shared by the hand-written deserializers.
///
/// Every lookup failure surfaces as a `JsonMappingException` carrying the parser location,
/// so callers see one exception type regardless of which field was wrong.
final class JsonFields {

    private JsonFields() {}

    static JsonNode required(JsonParser p, JsonNode node, String field) throws JsonMappingException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw JsonMappingException.from(p, "Missing required field '" + field + "'");
        }
        return value;
    }

    static String requiredText(JsonParser p, JsonNode node, String field)
            throws JsonMappingException {
        JsonNode value = required(p, node, field);
        if (!value.isTextual()) {
            throw JsonMappingException.from(p, "Field '" + field + "' must be a string");
        }
        return value.asText();
    }

    static double requiredNumber(JsonParser p, JsonNode node, String field)
            throws JsonMappingException {
        JsonNode value = required(p, node, field);
        if (!value.isNumber()) {
            throw JsonMappingException.from(p, "Field '" + field + "' must be a number");
        }
        return value.doubleValue();
    }

    /// Returns the text of an optional field, null when absent or null.
    static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /// Returns the number of an optional field, null when absent or null.
    static Double optionalNumber(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.doubleValue();
    }

    static Instant optionalInstant(JsonParser p, JsonNode node, String field)
            throws JsonMappingException {
        String text = optionalText(node, field);
        return text == null ? null : instant(p, field, text);
    }

    static Instant instant(JsonParser p, String field, String text) throws JsonMappingException {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw JsonMappingException.from(
                    p, "Field '" + field + "' is not an ISO-8601 instant: " + text, e);
        }
    }

    static List<String> textList(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        JsonNode array = node.get(field);
        if (array != null) {
            for (JsonNode element : array) {
                values.add(element.asText());
            }
        }
        return values;
    }

    static PrimeDomain domain(JsonParser p, String key) throws JsonMappingException {
        try {
            return PrimeDomain.fromKey(key);
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }

    static SourceType sourceType(JsonParser p, String key) throws JsonMappingException {
        try {
            return SourceType.fromKey(key);
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }

    static RiskFlag riskFlag(JsonParser p, String key) throws JsonMappingException {
        try {
            return RiskFlag.fromKey(key);
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }
}
