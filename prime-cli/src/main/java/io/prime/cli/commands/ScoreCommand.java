package io.prime.cli.commands;

import io.prime.core.evidence.EvidenceSet;
import io.prime.core.scorecard.Scorecard;
import io.prime.serialization.PrimeSerializer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine;

/// Computes a scorecard from an evidence file without touching any store.
///
/// ### Usage
/// ```bash
/// prime score <evidence.json> [--now <instant>] [--revision <rev>] [--registry <file>] [-o <file>]
/// ```
///
/// The scorecard JSON goes to stdout unless `-o` names an output file.
@CommandLine.Command(name = "score", description = "Compute a scorecard from an evidence file")
class ScoreCommand extends PrimeCommand {

    @CommandLine.Parameters(index = "0", description = "Evidence JSON file")
    private Path evidenceFile;

    @CommandLine.Option(
            names = {"-o", "--output"},
            description = "Write the scorecard to this file instead of stdout")
    private Path outputFile;

    @Override
    protected int execute() throws InvalidInputException {
        EvidenceSet evidence = EvidenceFiles.read(evidenceFile);
        Scorecard scorecard =
                createEnvironment()
                        .getEngine()
                        .computeScorecard(
                                evidence, resolveNow(), effectiveConfig().getScoringRevision());
        String json = PrimeSerializer.toJson(scorecard);

        if (outputFile == null) {
            System.out.println(json);
            return EXIT_OK;
        }
        try {
            Files.writeString(outputFile, json);
        } catch (IOException e) {
            throw new InvalidInputException("Cannot write " + outputFile + ": " + e.getMessage(), e);
        }
        System.out.println("Scorecard written to " + outputFile);
        return EXIT_OK;
    }
}
