package io.prime.core.registry;

import io.prime.core.exception.ConfigurationException;
import io.prime.core.model.PrimeDomain;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/// Versioned set of domain definitions covering all five domains.
///
/// Construction fails with {@link ConfigurationException} when a domain is missing or
/// defined twice, so a registry that exists is always complete.
///
/// @see DefaultDriverRegistry for the built-in rule set
public final class DriverRegistry {

    private final String version;
    private final Map<PrimeDomain, DomainDefinition> domains;

    public DriverRegistry(String version, Collection<DomainDefinition> definitions) {
        this.version = Objects.requireNonNull(version, "Registry version required");
        Map<PrimeDomain, DomainDefinition> byDomain = new EnumMap<>(PrimeDomain.class);
        for (DomainDefinition definition : definitions) {
            if (byDomain.put(definition.getDomain(), definition) != null) {
                throw new ConfigurationException(
                        "Domain defined twice: " + definition.getDomain().key());
            }
        }
        for (PrimeDomain domain : PrimeDomain.values()) {
            if (!byDomain.containsKey(domain)) {
                throw new ConfigurationException("Registry is missing domain: " + domain.key());
            }
        }
        this.domains = Collections.unmodifiableMap(byDomain);
    }

    /// Returns the rule-set version tag, e.g. `"v1"`.
    public String getVersion() {
        return version;
    }

    /// Returns the definition of a domain.
    ///
    /// @param domain the domain, not null
    /// @return domain definition, never null
    public DomainDefinition getDomain(PrimeDomain domain) {
        return domains.get(domain);
    }

    /// Returns all definitions keyed by domain, in domain order.
    public Map<PrimeDomain, DomainDefinition> getDomains() {
        return domains;
    }
}
