package io.prime.cli.commands;

import io.prime.cli.store.ScorecardStoreException;
import io.prime.core.PrimeConfig;
import io.prime.core.PrimeEnvironment;
import io.prime.core.PrimeFactory;
import io.prime.core.exception.ConfigurationException;
import io.prime.core.registry.DefaultDriverRegistry;
import io.prime.core.registry.DriverRegistry;
import io.prime.core.registry.SourceQualityTable;
import io.prime.core.scorecard.InMemoryScorecardRepository;
import io.prime.core.scorecard.ScorecardRepository;
import io.prime.serialization.DriverRegistryParser;
import jakarta.inject.Inject;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.concurrent.Callable;
import picocli.CommandLine.Option;

/// Base class for all Prime CLI commands.
///
/// Owns the options shared by every command (rule-set file, scoring revision, clock
/// override) and maps failures to exit codes:
///
/// | Code | Meaning |
/// |------|---------|
/// | `0` | success |
/// | `1` | invalid input (unreadable or malformed evidence, bad `--now` or subject id, unreadable store) |
/// | `2` | configuration error (invalid rule set or settings) |
///
/// ### Revision Resolution
/// 1. CLI option `--revision`
/// 2. Config property `prime.scoring.revision` (env `PRIME_SCORING_REVISION`)
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
abstract class PrimeCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_INPUT = 1;
    static final int EXIT_CONFIGURATION = 2;

    @Option(
            names = {"-r", "--registry"},
            description = "Driver registry JSON file (defaults to the built-in rule set)")
    protected Path registryPath;

    @Option(
            names = "--revision",
            description = "Scoring revision tag stored on scorecards")
    protected String revision;

    @Option(
            names = "--now",
            description = "Evaluation time as an ISO-8601 instant (defaults to the current time)")
    protected String now;

    @Inject PrimeConfig config;

    @Override
    public final Integer call() {
        try {
            return execute();
        } catch (ConfigurationException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_CONFIGURATION;
        } catch (InvalidInputException | UncheckedIOException | ScorecardStoreException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }
    }

    /// Runs the command.
    ///
    /// @return process exit code
    /// @throws InvalidInputException if user-supplied input cannot be used
    protected abstract int execute() throws InvalidInputException;

    /// Returns the configuration with the `--revision` override applied.
    protected PrimeConfig effectiveConfig() {
        PrimeConfig base = config != null ? config : new PrimeConfig();
        return PrimeConfig.builder()
                .scoringRevision(revision != null && !revision.isBlank() ? revision : base.getScoringRevision())
                .regenerationWindow(base.getRegenerationWindow())
                .requiredScoredDomains(base.getRequiredScoredDomains())
                .build();
    }

    /// Loads the rule set from `--registry`, or the built-in one.
    ///
    /// @throws ConfigurationException if the file is unreadable or the rule set is invalid
    protected DriverRegistry loadRegistry() {
        return registryPath != null
                ? DriverRegistryParser.parse(registryPath)
                : DefaultDriverRegistry.create();
    }

    /// Creates an environment over the given store.
    protected PrimeEnvironment createEnvironment(ScorecardRepository repository) {
        return PrimeFactory.createEnvironment(
                effectiveConfig(), loadRegistry(), SourceQualityTable.defaults(), repository);
    }

    protected PrimeEnvironment createEnvironment() {
        return createEnvironment(new InMemoryScorecardRepository());
    }

    /// Resolves the evaluation time.
    ///
    /// @throws InvalidInputException if `--now` is not an ISO-8601 instant
    protected Instant resolveNow() throws InvalidInputException {
        if (now == null || now.isBlank()) {
            return Instant.now();
        }
        try {
            return Instant.parse(now.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidInputException("Invalid --now value: " + now, e);
        }
    }
}
