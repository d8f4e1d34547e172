package io.prime.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.prime.core.registry.ConfidenceRule;
import io.prime.core.registry.DomainDefinition;
import io.prime.core.registry.Driver;
import io.prime.core.registry.DriverRegistry;
import io.prime.core.registry.SuppressionRule;
import java.io.IOException;
import java.io.Serial;
import java.util.TreeSet;

/// Serializes a `DriverRegistry` as a rule-set document.
///
/// Domains are written in declaration order. Drivers go through the `Driver` mixin,
/// scoring functions and confidence rules through their discriminated serializers.
///
/// @see DriverRegistryDeserializer for the inverse operation
class DriverRegistrySerializer extends StdSerializer<DriverRegistry> {

    @Serial private static final long serialVersionUID = -1527702196835710942L;

    DriverRegistrySerializer() {
        super(DriverRegistry.class);
    }

    @Override
    public void serialize(DriverRegistry registry, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("version", registry.getVersion());
        gen.writeArrayFieldStart("domains");
        for (DomainDefinition definition : registry.getDomains().values()) {
            gen.writeStartObject();
            gen.writeStringField("domain", definition.getDomain().key());

            gen.writeArrayFieldStart("drivers");
            for (Driver driver : definition.getDrivers()) {
                provider.defaultSerializeValue(driver, gen);
            }
            gen.writeEndArray();

            gen.writeArrayFieldStart("suppression_rules");
            for (SuppressionRule rule : definition.getSuppressionRules()) {
                gen.writeStartObject();
                gen.writeStringField("suppressed_driver", rule.suppressedDriver());
                gen.writeArrayFieldStart("trigger_drivers");
                for (String trigger : new TreeSet<>(rule.triggerDrivers())) {
                    gen.writeString(trigger);
                }
                gen.writeEndArray();
                gen.writeStringField("reason", rule.reason());
                gen.writeEndObject();
            }
            gen.writeEndArray();

            gen.writeArrayFieldStart("confidence_rules");
            for (ConfidenceRule rule : definition.getConfidenceRules()) {
                provider.defaultSerializeValue(rule, gen);
            }
            gen.writeEndArray();

            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
