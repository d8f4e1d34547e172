package io.prime.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.prime.core.registry.Driver;
import io.prime.core.registry.ScoringFunction;
import io.prime.core.registry.ValueRange;

/// Jackson mixin that binds `Driver` to its builder and snake_case field names.
///
/// Applied to `Driver.class` via `PrimeJacksonModule.setupModule()`. Getter annotations
/// control the serialized names; {@link DriverBuilderMixin} maps the same names back onto
/// the builder.
///
/// @see DriverBuilderMixin
/// @see io.prime.serialization.PrimeJacksonModule
@JsonDeserialize(builder = Driver.Builder.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
    "key",
    "display_name",
    "weight",
    "dominance_cap",
    "freshness_half_life_days",
    "stability_window_days",
    "valid_range",
    "unit",
    "missing_copy",
    "scoring"
})
public abstract class DriverMixin {

    @JsonProperty("key")
    abstract String getKey();

    @JsonProperty("display_name")
    abstract String getDisplayName();

    @JsonProperty("weight")
    abstract double getWeight();

    @JsonProperty("dominance_cap")
    abstract double getDominanceCap();

    @JsonProperty("freshness_half_life_days")
    abstract double getFreshnessHalfLifeDays();

    @JsonProperty("stability_window_days")
    abstract int getStabilityWindowDays();

    @JsonProperty("valid_range")
    abstract ValueRange getValidRange();

    @JsonProperty("scoring")
    abstract ScoringFunction getScoring();

    @JsonProperty("unit")
    abstract String getUnit();

    @JsonProperty("missing_copy")
    abstract String getMissingCopy();
}
