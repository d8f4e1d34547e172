package io.prime.cli.commands;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

/// Main entry point for the Prime Scorecard CLI.
///
/// Registers the subcommands:
/// - `score` - Compute a scorecard from an evidence file and print it
/// - `generate` - Compute or reuse a subject's scorecard against a file store
/// - `registry` - Validate and print the driver rule set
///
/// @see ScoreCommand
/// @see GenerateCommand
/// @see RegistryCommand
@TopCommand
@Command(
        name = "prime",
        mixinStandardHelpOptions = true,
        description = "Prime Scorecard engine",
        subcommands = {ScoreCommand.class, GenerateCommand.class, RegistryCommand.class})
public class PrimeCLI {}
