package io.prime.cli.commands;

import io.prime.cli.store.FileScorecardRepository;
import io.prime.core.PrimeEnvironment;
import io.prime.core.evidence.EvidenceSet;
import io.prime.core.model.PrimeDomain;
import io.prime.core.scorecard.GenerationResult;
import io.prime.core.scorecard.Scorecard;
import io.prime.core.scoring.RiskFlag;
import io.prime.serialization.PrimeSerializer;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.util.Locale;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import picocli.CommandLine;

/// Generates a subject's scorecard against a file store, reusing the latest one when
/// nothing changed.
///
/// ### Usage
/// ```bash
/// prime generate <subject> <evidence.json> [-d <store-dir>] [--now <instant>] [--json]
/// ```
///
/// ### Store Directory Resolution
/// 1. CLI option `-d` / `--store-dir`
/// 2. Config property `prime.store.dir`
@CommandLine.Command(
        name = "generate",
        description = "Compute or reuse a subject's scorecard against a file store")
class GenerateCommand extends PrimeCommand {

    @CommandLine.Parameters(index = "0", description = "Subject identifier")
    private String subjectId;

    @CommandLine.Parameters(index = "1", description = "Evidence JSON file")
    private Path evidenceFile;

    @CommandLine.Option(
            names = {"-d", "--store-dir"},
            description = "Directory holding stored scorecards")
    private Path storeDir;

    @CommandLine.Option(names = "--json", description = "Print the scorecard document")
    private boolean json;

    @Inject
    @ConfigProperty(name = "prime.store.dir", defaultValue = ".prime")
    String defaultStoreDir;

    @Override
    protected int execute() throws InvalidInputException {
        if (!FileScorecardRepository.isUsableId(subjectId)) {
            throw new InvalidInputException("Invalid subject id: '" + subjectId + "'");
        }
        EvidenceSet evidence = EvidenceFiles.read(evidenceFile);
        FileScorecardRepository repository = new FileScorecardRepository(resolveStoreDir());
        PrimeEnvironment environment = createEnvironment(repository);

        GenerationResult result = environment.getService().generate(subjectId, evidence, resolveNow());
        Scorecard scorecard = result.scorecard();

        if (result.cached()) {
            System.out.println(
                    "Reused scorecard for " + subjectId + " generated at " + scorecard.getGeneratedAt());
        } else {
            System.out.println("Stored new scorecard for " + subjectId);
        }

        if (json) {
            System.out.println(PrimeSerializer.toJson(scorecard));
        } else {
            printSummary(scorecard);
        }
        return EXIT_OK;
    }

    private Path resolveStoreDir() {
        if (storeDir != null) {
            return storeDir;
        }
        return Path.of(defaultStoreDir != null && !defaultStoreDir.isBlank() ? defaultStoreDir : ".prime");
    }

    private static void printSummary(Scorecard scorecard) {
        for (PrimeDomain domain : PrimeDomain.values()) {
            Integer score = scorecard.getDomainScores().get(domain);
            System.out.printf(
                    Locale.ROOT,
                    "  %-11s %5s  confidence %d%%%n",
                    domain.label(),
                    score != null ? score.toString() : "-",
                    scorecard.getDomainConfidence().get(domain));
        }
        String prime = scorecard.getPrimeScore() != null ? scorecard.getPrimeScore().toString() : "not available";
        System.out.println(
                "  Prime Score: " + prime + " (confidence " + scorecard.getPrimeConfidence() + "%)");
        for (RiskFlag flag : scorecard.getRiskFlags()) {
            System.out.println("  Flag: " + flag.description());
        }
    }
}
