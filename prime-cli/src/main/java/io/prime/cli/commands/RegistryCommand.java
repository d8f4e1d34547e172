package io.prime.cli.commands;

import io.prime.core.registry.DomainDefinition;
import io.prime.core.registry.Driver;
import io.prime.core.registry.DriverRegistry;
import io.prime.core.registry.SuppressionRule;
import io.prime.serialization.DriverRegistryParser;
import java.util.Locale;
import picocli.CommandLine;

/// Validates the driver rule set and prints it.
///
/// ### Usage
/// ```bash
/// prime registry [--registry <file>] [--json]
/// ```
///
/// Loading runs the full registry validation, so a zero exit code means the rule set is
/// usable.
@CommandLine.Command(name = "registry", description = "Validate and print the driver rule set")
class RegistryCommand extends PrimeCommand {

    @CommandLine.Option(names = "--json", description = "Print the rule set as JSON")
    private boolean json;

    @Override
    protected int execute() {
        DriverRegistry registry = loadRegistry();
        if (json) {
            System.out.println(DriverRegistryParser.toJson(registry));
            return EXIT_OK;
        }

        System.out.println("Driver registry " + registry.getVersion());
        for (DomainDefinition definition : registry.getDomains().values()) {
            System.out.println();
            System.out.println(definition.getDomain().label());
            System.out.printf(
                    Locale.ROOT, "  %-20s %7s %10s  %s%n", "DRIVER", "WEIGHT", "HALF-LIFE", "SCORING");
            for (Driver driver : definition.getDrivers()) {
                System.out.printf(
                        Locale.ROOT,
                        "  %-20s %7.2f %9.0fd  %s%n",
                        driver.getKey(),
                        driver.getWeight(),
                        driver.getFreshnessHalfLifeDays(),
                        driver.getScoring().describe());
            }
            for (SuppressionRule rule : definition.getSuppressionRules()) {
                System.out.println(
                        "  suppress "
                                + rule.suppressedDriver()
                                + " when "
                                + String.join(" or ", rule.triggerDrivers().stream().sorted().toList())
                                + " present");
            }
            definition.getConfidenceRules()
                    .forEach(rule -> System.out.println("  " + rule.describe()));
        }
        return EXIT_OK;
    }
}
