package io.prime.core;

import io.prime.core.exception.ConfigurationException;
import java.time.Duration;
import java.util.Properties;

/// Configuration options for the scorecard environment.
///
/// Controls the scoring revision tag, the reuse window and the prime aggregation policy.
/// Use the {@link Builder} for fluent configuration or construct directly with setters.
///
/// ### Default Values
/// - `scoringRevision`: `"dev"`
/// - `regenerationWindow`: 10 minutes
/// - `requiredScoredDomains`: `5` (all domains must be scored for a Prime Score)
///
/// @implNote **Not thread-safe**. Configure before passing to {@link PrimeFactory}.
///
/// @see PrimeFactory#createEnvironment(PrimeConfig)
public class PrimeConfig {

    public static final String SCORING_REVISION_KEY = "prime.scoring.revision";
    public static final String MAX_AGE_KEY = "prime.reuse.max-age-seconds";
    public static final String REQUIRED_DOMAINS_KEY = "prime.aggregation.required-domains";

    private String scoringRevision = "dev";
    private Duration regenerationWindow = Duration.ofMinutes(10);
    private int requiredScoredDomains = 5;

    /// Creates a configuration with default values.
    public PrimeConfig() {}

    /// Returns the revision tag stored on scorecards and compared by the reuse guard.
    ///
    /// @return revision tag, never null
    public String getScoringRevision() {
        return scoringRevision;
    }

    public void setScoringRevision(String scoringRevision) {
        this.scoringRevision = scoringRevision;
    }

    /// Returns the age below which an unchanged scorecard is reused.
    public Duration getRegenerationWindow() {
        return regenerationWindow;
    }

    public void setRegenerationWindow(Duration regenerationWindow) {
        this.regenerationWindow = regenerationWindow;
    }

    /// Returns how many domains must be scored to produce a Prime Score.
    ///
    /// @return 1 to 5
    public int getRequiredScoredDomains() {
        return requiredScoredDomains;
    }

    public void setRequiredScoredDomains(int requiredScoredDomains) {
        this.requiredScoredDomains = requiredScoredDomains;
    }

    /// Reads configuration from properties, keeping defaults for absent keys.
    ///
    /// Recognized keys: `prime.scoring.revision`, `prime.reuse.max-age-seconds`,
    /// `prime.aggregation.required-domains`.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws ConfigurationException if a numeric value cannot be parsed
    public static PrimeConfig fromProperties(Properties properties) {
        PrimeConfig config = new PrimeConfig();
        String revision = properties.getProperty(SCORING_REVISION_KEY);
        if (revision != null && !revision.isBlank()) {
            config.setScoringRevision(revision.trim());
        }
        String maxAge = properties.getProperty(MAX_AGE_KEY);
        if (maxAge != null) {
            config.setRegenerationWindow(Duration.ofSeconds(parseLong(MAX_AGE_KEY, maxAge)));
        }
        String required = properties.getProperty(REQUIRED_DOMAINS_KEY);
        if (required != null) {
            config.setRequiredScoredDomains(parseInt(REQUIRED_DOMAINS_KEY, required));
        }
        return config;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid value for " + key + ": " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link PrimeConfig}.
    public static class Builder {
        private final PrimeConfig config = new PrimeConfig();

        public Builder scoringRevision(String scoringRevision) {
            config.scoringRevision = scoringRevision;
            return this;
        }

        public Builder regenerationWindow(Duration regenerationWindow) {
            config.regenerationWindow = regenerationWindow;
            return this;
        }

        public Builder requiredScoredDomains(int requiredScoredDomains) {
            config.requiredScoredDomains = requiredScoredDomains;
            return this;
        }

        public PrimeConfig build() {
            return config;
        }
    }
}
