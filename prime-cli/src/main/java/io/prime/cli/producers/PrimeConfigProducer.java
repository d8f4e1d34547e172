package io.prime.cli.producers;

import io.prime.core.PrimeConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Properties;
import java.util.logging.Logger;
import org.eclipse.microprofile.config.Config;

/// CDI producer for the scorecard configuration.
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `prime.scoring.revision` | String | `dev` | Revision tag stored on scorecards |
/// | `prime.reuse.max-age-seconds` | long | `600` | Reuse window of the latest scorecard |
/// | `prime.aggregation.required-domains` | int | `5` | Scored domains needed for a Prime Score |
///
/// Environment variables follow the MicroProfile mapping, e.g. `PRIME_SCORING_REVISION`.
///
/// @see PrimeConfig#fromProperties(Properties)
@ApplicationScoped
public class PrimeConfigProducer {

    private static final Logger logger = Logger.getLogger(PrimeConfigProducer.class.getName());

    private static final List<String> KEYS =
            List.of(
                    PrimeConfig.SCORING_REVISION_KEY,
                    PrimeConfig.MAX_AGE_KEY,
                    PrimeConfig.REQUIRED_DOMAINS_KEY);

    @Inject Config config;

    /// Produces the configuration for CDI injection.
    ///
    /// @return configuration built from `prime.*` properties, never null
    /// @throws io.prime.core.exception.ConfigurationException if a numeric value is invalid
    @Produces
    @ApplicationScoped
    public PrimeConfig primeConfig() {
        Properties properties = new Properties();
        for (String key : KEYS) {
            config.getOptionalValue(key, String.class)
                    .ifPresent(value -> properties.setProperty(key, value));
        }
        PrimeConfig primeConfig = PrimeConfig.fromProperties(properties);
        logger.info(
                "Scoring revision "
                        + primeConfig.getScoringRevision()
                        + ", reuse window "
                        + primeConfig.getRegenerationWindow().toSeconds()
                        + "s");
        return primeConfig;
    }
}
