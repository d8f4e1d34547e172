package io.prime.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import io.prime.core.registry.DefaultDriverRegistry;
import io.prime.serialization.DriverRegistryParser;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RegistryCommandTest extends BasePrimeCommandTest {

    @TempDir Path tempDir;

    @Test
    void shouldPrintBuiltInRuleSet() {
        int exitCode = new RegistryCommand().call();

        assertThat(exitCode).isZero();
        assertThat(outContent.toString())
                .contains("Driver registry " + DefaultDriverRegistry.VERSION)
                .contains("Recovery")
                .contains("sleep_duration")
                .contains("suppress bmi when body_fat_pct or waist_to_height present")
                .contains("Capped at 40%: no lab biomarker present");
    }

    @Test
    void shouldPrintJsonThatParsesBack() throws Exception {
        RegistryCommand command = new RegistryCommand();
        setOption(command, "json", true);

        assertThat(command.call()).isZero();
        assertThat(DriverRegistryParser.parse(outContent.toString()).getVersion())
                .isEqualTo(DefaultDriverRegistry.VERSION);
    }

    @Test
    void shouldLoadRegistryFile() throws Exception {
        Path file = Files.writeString(
                tempDir.resolve("rules.json"),
                DriverRegistryParser.toJson(DefaultDriverRegistry.create()).replace("\"v1\"", "\"custom-7\""));
        RegistryCommand command = new RegistryCommand();
        command.registryPath = file;

        assertThat(command.call()).isZero();
        assertThat(outContent.toString()).contains("Driver registry custom-7");
    }

    @Test
    void shouldReportInvalidRegistry() throws Exception {
        Path file = Files.writeString(tempDir.resolve("rules.json"), "not json");
        RegistryCommand command = new RegistryCommand();
        command.registryPath = file;

        assertThat(command.call()).isEqualTo(PrimeCommand.EXIT_CONFIGURATION);
        assertThat(errContent.toString()).startsWith("Error: Invalid driver registry");
    }
}
