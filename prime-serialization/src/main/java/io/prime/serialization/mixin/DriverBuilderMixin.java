package io.prime.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import io.prime.core.registry.Driver;
import io.prime.core.registry.ValueRange;

/// Jackson mixin for `Driver.Builder` that configures POJO builder deserialization.
///
/// `withPrefix = ""` maps JSON fields onto the builder's fluent setters; the multi-word
/// setters are renamed to their snake_case field names.
///
/// @see DriverMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class DriverBuilderMixin {

    @JsonProperty("display_name")
    abstract Driver.Builder displayName(String displayName);

    @JsonProperty("dominance_cap")
    abstract Driver.Builder dominanceCap(double dominanceCap);

    @JsonProperty("freshness_half_life_days")
    abstract Driver.Builder freshnessHalfLifeDays(double freshnessHalfLifeDays);

    @JsonProperty("stability_window_days")
    abstract Driver.Builder stabilityWindowDays(int stabilityWindowDays);

    @JsonProperty("valid_range")
    abstract Driver.Builder validRange(ValueRange validRange);

    @JsonProperty("missing_copy")
    abstract Driver.Builder missingCopy(String missingCopy);
}
