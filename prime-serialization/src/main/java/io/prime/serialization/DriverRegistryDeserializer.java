package io.prime.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.prime.core.registry.ConfidenceRule;
import io.prime.core.registry.DomainDefinition;
import io.prime.core.registry.Driver;
import io.prime.core.registry.DriverRegistry;
import io.prime.core.registry.SuppressionRule;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/// Deserializes a rule-set document into a validated `DriverRegistry`.
///
/// Structural problems in the JSON surface as `JsonMappingException`. Semantic problems
/// (weights not summing to 1, unknown rule references, missing domains) are raised by the
/// core model as `ConfigurationException` and propagate unchanged.
class DriverRegistryDeserializer extends StdDeserializer<DriverRegistry> {

    @Serial private static final long serialVersionUID = 3967461802554170328L;

    DriverRegistryDeserializer() {
        super(DriverRegistry.class);
    }

    @Override
    public DriverRegistry deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String version = JsonFields.requiredText(p, root, "version");
        List<DomainDefinition> definitions = new ArrayList<>();
        for (JsonNode domainNode : JsonFields.required(p, root, "domains")) {
            List<Driver> drivers = new ArrayList<>();
            for (JsonNode driverNode : JsonFields.required(p, domainNode, "drivers")) {
                drivers.add(mapper.treeToValue(driverNode, Driver.class));
            }

            List<SuppressionRule> suppressionRules = new ArrayList<>();
            JsonNode suppressions = domainNode.get("suppression_rules");
            if (suppressions != null) {
                for (JsonNode rule : suppressions) {
                    suppressionRules.add(suppressionRule(p, rule));
                }
            }

            List<ConfidenceRule> confidenceRules = new ArrayList<>();
            JsonNode rules = domainNode.get("confidence_rules");
            if (rules != null) {
                for (JsonNode rule : rules) {
                    confidenceRules.add(mapper.treeToValue(rule, ConfidenceRule.class));
                }
            }

            definitions.add(
                    DomainDefinition.builder()
                            .domain(
                                    JsonFields.domain(
                                            p, JsonFields.requiredText(p, domainNode, "domain")))
                            .drivers(drivers)
                            .suppressionRules(suppressionRules)
                            .confidenceRules(confidenceRules)
                            .build());
        }
        return new DriverRegistry(version, definitions);
    }

    private static SuppressionRule suppressionRule(JsonParser p, JsonNode rule)
            throws JsonMappingException {
        String suppressed = JsonFields.requiredText(p, rule, "suppressed_driver");
        try {
            return new SuppressionRule(
                    suppressed,
                    new HashSet<>(JsonFields.textList(rule, "trigger_drivers")),
                    JsonFields.optionalText(rule, "reason"));
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(
                    p, "Invalid suppression of " + suppressed + ": " + e.getMessage(), e);
        }
    }
}
