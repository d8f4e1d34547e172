package io.prime.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.prime.core.evidence.EvidenceItem;
import io.prime.core.evidence.EvidenceSet;
import io.prime.core.evidence.EvidenceValue;
import io.prime.core.registry.ConfidenceRule;
import io.prime.core.registry.Driver;
import io.prime.core.registry.DriverRegistry;
import io.prime.core.registry.ScoringFunction;
import io.prime.core.scorecard.Scorecard;
import io.prime.serialization.mixin.DriverBuilderMixin;
import io.prime.serialization.mixin.DriverMixin;
import io.prime.serialization.mixin.EvidenceSetMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all scorecard serialization configuration in one
/// place.
///
/// Covers two registration strategies:
///
/// **Custom serializer/deserializer pairs** (sealed hierarchies and documents whose wire
/// shape differs from the object model):
/// - `EvidenceValue` - number, string or `{"unable_to_estimate":true}`
/// - `EvidenceItem` - snake_case fields, lowercase domain and source keys
/// - `Scorecard` - the persisted scorecard document
/// - `ScoringFunction` - discriminator: `"type"`
/// - `ConfidenceRule` - discriminator: `"type"`
/// - `DriverRegistry` - the rule-set document
///
/// **Mixins** (immutable domain objects bound through builders or constructors):
/// - `Driver` + `Driver.Builder`
/// - `EvidenceSet` (constructor creator)
///
/// @see PrimeSerializer for the convenience factory API
/// @see DriverRegistryParser for loading rule sets
public class PrimeJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5519067434781526021L;

    public PrimeJacksonModule() {
        super("PrimeJacksonModule");

        addSerializer(EvidenceValue.class, new EvidenceValueSerializer());
        addDeserializer(EvidenceValue.class, new EvidenceValueDeserializer());

        addSerializer(EvidenceItem.class, new EvidenceItemSerializer());
        addDeserializer(EvidenceItem.class, new EvidenceItemDeserializer());

        addSerializer(Scorecard.class, new ScorecardSerializer());
        addDeserializer(Scorecard.class, new ScorecardDeserializer());

        addSerializer(ScoringFunction.class, new ScoringFunctionSerializer());
        addDeserializer(ScoringFunction.class, new ScoringFunctionDeserializer());

        addSerializer(ConfidenceRule.class, new ConfidenceRuleSerializer());
        addDeserializer(ConfidenceRule.class, new ConfidenceRuleDeserializer());

        addSerializer(DriverRegistry.class, new DriverRegistrySerializer());
        addDeserializer(DriverRegistry.class, new DriverRegistryDeserializer());
    }

    /// Applies mixin annotations to builder- and constructor-bound domain types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Driver.class, DriverMixin.class);
        context.setMixInAnnotations(Driver.Builder.class, DriverBuilderMixin.class);

        context.setMixInAnnotations(EvidenceSet.class, EvidenceSetMixin.class);
    }
}
