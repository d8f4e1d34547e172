package io.prime.core.registry;

import io.prime.core.exception.ConfigurationException;
import io.prime.core.model.SourceType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/// Reliability multiplier in [0,1] for every evidence source type.
///
/// Every {@link SourceType} must have an entry; a table with a gap or an out-of-range
/// multiplier is rejected at construction.
public final class SourceQualityTable {

    private final Map<SourceType, Double> multipliers;

    public SourceQualityTable(Map<SourceType, Double> multipliers) {
        Map<SourceType, Double> copy = new EnumMap<>(SourceType.class);
        for (SourceType type : SourceType.values()) {
            Double multiplier = multipliers.get(type);
            if (multiplier == null) {
                throw new ConfigurationException(
                        "Missing quality multiplier for source type: " + type.key());
            }
            if (multiplier < 0 || multiplier > 1) {
                throw new ConfigurationException(
                        "Quality multiplier for " + type.key() + " must be within [0,1]: " + multiplier);
            }
            copy.put(type, multiplier);
        }
        this.multipliers = Collections.unmodifiableMap(copy);
    }

    /// Returns the standard table: lab 1.0, test 0.9, device 0.8, measured self-report 0.7,
    /// image estimate 0.55, self-report proxy 0.4, prior 0.2.
    public static SourceQualityTable defaults() {
        Map<SourceType, Double> m = new EnumMap<>(SourceType.class);
        m.put(SourceType.LAB, 1.0);
        m.put(SourceType.TEST, 0.9);
        m.put(SourceType.DEVICE, 0.8);
        m.put(SourceType.MEASURED_SELF_REPORT, 0.7);
        m.put(SourceType.IMAGE_ESTIMATE, 0.55);
        m.put(SourceType.SELF_REPORT_PROXY, 0.4);
        m.put(SourceType.PRIOR, 0.2);
        return new SourceQualityTable(m);
    }

    public double multiplier(SourceType type) {
        return multipliers.get(type);
    }

    public Map<SourceType, Double> asMap() {
        return multipliers;
    }
}
