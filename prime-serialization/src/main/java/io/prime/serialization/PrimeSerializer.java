package io.prime.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.prime.core.evidence.EvidenceItem;
import io.prime.core.evidence.EvidenceSet;
import io.prime.core.scorecard.Scorecard;
import java.io.IOException;
import java.util.List;

/// Utility class for converting scorecards and evidence sets to and from JSON.
///
/// ### Usage
/// {@snippet :
/// String json = PrimeSerializer.toJson(scorecard);
/// Scorecard restored = PrimeSerializer.scorecardFromJson(json);
///
/// EvidenceSet evidence = PrimeSerializer.evidenceFromJson(Files.readString(path));
/// }
///
/// @implNote Thread-safe. A mapper is created per call via `createMapper()`; cache one for
/// high-throughput use.
///
/// @see PrimeJacksonModule for the registered type handlers
public final class PrimeSerializer {

    private PrimeSerializer() {}

    /// Serializes a scorecard to pretty-printed JSON.
    ///
    /// @param scorecard the scorecard to serialize, not null
    /// @return JSON document, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Scorecard scorecard) {
        try {
            return createMapper().writeValueAsString(scorecard);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize scorecard: " + e.getMessage(), e);
        }
    }

    /// Serializes an evidence set to pretty-printed JSON.
    ///
    /// @param evidence the evidence set to serialize, not null
    /// @return JSON document, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(EvidenceSet evidence) {
        try {
            return createMapper().writeValueAsString(evidence);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize evidence: " + e.getMessage(), e);
        }
    }

    /// Deserializes a scorecard document.
    ///
    /// @param json JSON string, not null
    /// @return deserialized scorecard, never null
    /// @throws IllegalArgumentException if the document is malformed
    public static Scorecard scorecardFromJson(String json) {
        try {
            return createMapper().readValue(json, Scorecard.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize scorecard: " + e.getMessage(), e);
        }
    }

    /// Deserializes evidence.
    ///
    /// Accepts either an evidence set object (`{"subject_id":...,"items":[...]}`) or a bare
    /// array of evidence items.
    ///
    /// @param json JSON string, not null
    /// @return deserialized evidence, never null
    /// @throws IllegalArgumentException if the document or one of its items is malformed
    public static EvidenceSet evidenceFromJson(String json) {
        ObjectMapper mapper = createMapper();
        try {
            JsonNode root = mapper.readTree(json);
            JsonNode items = root != null && root.isObject() ? root.get("items") : root;
            if (items == null || !items.isArray()) {
                throw new IllegalArgumentException(
                        "Failed to deserialize evidence: expected an object with an items array or an array of items");
            }
            for (JsonNode item : items) {
                if (!item.isObject()) {
                    throw new IllegalArgumentException(
                            "Failed to deserialize evidence: every item must be an object");
                }
            }
            if (root.isArray()) {
                return EvidenceSet.of(
                        mapper.readerFor(new TypeReference<List<EvidenceItem>>() {}).readValue(root));
            }
            return mapper.treeToValue(root, EvidenceSet.class);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize evidence: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for scorecard serialization.
    ///
    /// Registers:
    /// - `PrimeJacksonModule` for the scorecard type hierarchy
    /// - `JavaTimeModule` for `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new PrimeJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
