package io.prime.core.registry;

import io.prime.core.exception.ConfigurationException;
import io.prime.core.model.PrimeDomain;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable rule set for one domain: its drivers, suppression rules and confidence rules.
///
/// ### Validation Rules
/// - At least one driver, with unique keys
/// - Driver weights sum to 1.0 within {@link #WEIGHT_TOLERANCE}
/// - Suppression rules reference drivers of this domain
///
/// Violations raise {@link ConfigurationException}. Weights are never renormalized to
/// repair a broken definition.
///
/// @implNote Immutable and thread-safe after construction.
public final class DomainDefinition {

    public static final double WEIGHT_TOLERANCE = 1e-9;

    private final PrimeDomain domain;
    private final List<Driver> drivers;
    private final Map<String, Driver> driversByKey;
    private final List<SuppressionRule> suppressionRules;
    private final List<ConfidenceRule> confidenceRules;

    private DomainDefinition(Builder builder) {
        this.domain = Objects.requireNonNull(builder.domain, "Domain required");
        this.drivers = builder.drivers;
        this.suppressionRules = builder.suppressionRules;
        this.confidenceRules = builder.confidenceRules;

        Map<String, Driver> byKey = new LinkedHashMap<>();
        for (Driver driver : drivers) {
            if (byKey.put(driver.getKey(), driver) != null) {
                throw new ConfigurationException(
                        "Duplicate driver '" + driver.getKey() + "' in domain " + domain.key());
            }
        }
        this.driversByKey = byKey;

        validate();
    }

    private void validate() {
        if (drivers.isEmpty()) {
            throw new ConfigurationException("Domain " + domain.key() + " has no drivers");
        }
        double sum = drivers.stream().mapToDouble(Driver::getWeight).sum();
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new ConfigurationException(
                    "Driver weights for domain " + domain.key() + " sum to " + sum + ", not 1.0");
        }
        for (SuppressionRule rule : suppressionRules) {
            requireDriver(rule.suppressedDriver(), "suppression rule");
            rule.triggerDrivers().forEach(key -> requireDriver(key, "suppression trigger"));
        }
        for (ConfidenceRule rule : confidenceRules) {
            rule.condition().driverKeys().forEach(key -> requireDriver(key, "confidence rule"));
        }
    }

    private void requireDriver(String key, String context) {
        if (!driversByKey.containsKey(key)) {
            throw new ConfigurationException(
                    "Unknown driver '"
                            + key
                            + "' referenced by "
                            + context
                            + " in domain "
                            + domain.key());
        }
    }

    public PrimeDomain getDomain() {
        return domain;
    }

    /// Returns the drivers in declaration order.
    ///
    /// @return unmodifiable list of drivers, never null or empty
    public List<Driver> getDrivers() {
        return drivers;
    }

    public Optional<Driver> getDriver(String key) {
        return Optional.ofNullable(driversByKey.get(key));
    }

    public List<SuppressionRule> getSuppressionRules() {
        return suppressionRules;
    }

    /// Returns the confidence rules in evaluation order.
    ///
    /// @return unmodifiable list of rules, never null
    public List<ConfidenceRule> getConfidenceRules() {
        return confidenceRules;
    }

    /// Computes the weight each active driver carries once suppressed drivers are removed.
    ///
    /// The weights of the remaining drivers are scaled proportionally so they still sum to
    /// 1.0. Suppressed drivers are absent from the result.
    ///
    /// @param suppressed keys of suppressed drivers, not null
    /// @return driver key to effective weight, in declaration order, never null
    public Map<String, Double> effectiveWeights(Set<String> suppressed) {
        double remaining =
                drivers.stream()
                        .filter(d -> !suppressed.contains(d.getKey()))
                        .mapToDouble(Driver::getWeight)
                        .sum();
        Map<String, Double> weights = new LinkedHashMap<>();
        for (Driver driver : drivers) {
            if (!suppressed.contains(driver.getKey())) {
                weights.put(driver.getKey(), remaining > 0 ? driver.getWeight() / remaining : 0.0);
            }
        }
        return weights;
    }

    /// Returns the keys of drivers suppressed by the rules for the given evidence.
    ///
    /// @param driversWithEvidence keys of drivers that have usable evidence, not null
    /// @return suppressed driver keys, never null
    public Set<String> suppressedDrivers(Set<String> driversWithEvidence) {
        Set<String> suppressed = new HashSet<>();
        for (SuppressionRule rule : suppressionRules) {
            if (rule.firesFor(driversWithEvidence)) {
                suppressed.add(rule.suppressedDriver());
            }
        }
        return suppressed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable DomainDefinition instances.
    ///
    /// Required fields: `domain`, `drivers` (non-empty, weights summing to 1.0)
    public static final class Builder {
        private PrimeDomain domain;
        private List<Driver> drivers = List.of();
        private List<SuppressionRule> suppressionRules = List.of();
        private List<ConfidenceRule> confidenceRules = List.of();

        private Builder() {}

        public Builder domain(PrimeDomain domain) {
            this.domain = domain;
            return this;
        }

        public Builder drivers(List<Driver> drivers) {
            this.drivers = List.copyOf(drivers);
            return this;
        }

        public Builder suppressionRules(List<SuppressionRule> suppressionRules) {
            this.suppressionRules = List.copyOf(suppressionRules);
            return this;
        }

        public Builder confidenceRules(List<ConfidenceRule> confidenceRules) {
            this.confidenceRules = List.copyOf(confidenceRules);
            return this;
        }

        /// Builds the immutable domain definition.
        ///
        /// @return new DomainDefinition instance, never null
        /// @throws ConfigurationException if weights or rule references are invalid
        public DomainDefinition build() {
            return new DomainDefinition(this);
        }
    }
}
