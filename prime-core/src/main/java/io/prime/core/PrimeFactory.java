package io.prime.core;

import io.prime.core.exception.ConfigurationException;
import io.prime.core.registry.DefaultDriverRegistry;
import io.prime.core.registry.DriverRegistry;
import io.prime.core.registry.SourceQualityTable;
import io.prime.core.scorecard.InMemoryScorecardRepository;
import io.prime.core.scorecard.ReusePolicy;
import io.prime.core.scorecard.ScorecardEngine;
import io.prime.core.scorecard.ScorecardGenerator;
import io.prime.core.scorecard.ScorecardRepository;
import io.prime.core.scorecard.ScorecardService;
import io.prime.core.scoring.NoHistoryStabilityCalculator;
import io.prime.core.scoring.PrimeScoreAggregator;
import java.util.logging.Logger;

/// Creates wired scorecard environments.
///
/// Defaults: the built-in {@link DefaultDriverRegistry}, {@link SourceQualityTable#defaults()},
/// {@link NoHistoryStabilityCalculator} and an {@link InMemoryScorecardRepository}.
///
/// @see PrimeConfig for the tunable options
public final class PrimeFactory {

    private static final Logger logger = Logger.getLogger(PrimeFactory.class.getName());

    private PrimeFactory() {
        // Utility class - prevent instantiation
    }

    public static PrimeEnvironment createEnvironment() {
        return createEnvironment(new PrimeConfig());
    }

    public static PrimeEnvironment createEnvironment(PrimeConfig config) {
        return createEnvironment(
                config,
                DefaultDriverRegistry.create(),
                SourceQualityTable.defaults(),
                new InMemoryScorecardRepository());
    }

    /// Creates an environment from explicit components.
    ///
    /// @param config configuration, not null
    /// @param registry driver registry, not null
    /// @param qualityTable source quality multipliers, not null
    /// @param repository scorecard storage, not null
    /// @return wired environment, never null
    /// @throws ConfigurationException if the configuration values are invalid
    public static PrimeEnvironment createEnvironment(
            PrimeConfig config,
            DriverRegistry registry,
            SourceQualityTable qualityTable,
            ScorecardRepository repository) {
        ScorecardEngine engine = createEngine(config, registry, qualityTable);
        ReusePolicy reusePolicy;
        try {
            reusePolicy = new ReusePolicy(config.getRegenerationWindow());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException("Invalid regeneration window", e);
        }
        ScorecardGenerator generator = new ScorecardGenerator(engine, reusePolicy);
        ScorecardService service =
                new ScorecardService(generator, repository, config.getScoringRevision());

        logger.fine(
                () ->
                        "Created scorecard environment: registry="
                                + registry.getVersion()
                                + ", revision="
                                + config.getScoringRevision());
        return new PrimeEnvironment(registry, engine, generator, repository, service);
    }

    /// Creates an engine for a rule set.
    ///
    /// @throws ConfigurationException if `requiredScoredDomains` is not between 1 and 5
    public static ScorecardEngine createEngine(
            PrimeConfig config, DriverRegistry registry, SourceQualityTable qualityTable) {
        PrimeScoreAggregator aggregator;
        try {
            aggregator = new PrimeScoreAggregator(config.getRequiredScoredDomains());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        return new ScorecardEngine(
                registry, qualityTable, new NoHistoryStabilityCalculator(), aggregator);
    }
}
