package io.prime.cli.commands;

import io.prime.core.evidence.EvidenceSet;
import io.prime.serialization.PrimeSerializer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/// Reads evidence files for the commands.
final class EvidenceFiles {

    private EvidenceFiles() {}

    /// Reads and parses an evidence file.
    ///
    /// @param path evidence JSON file, not null
    /// @return parsed evidence, never null
    /// @throws InvalidInputException if the file cannot be read or parsed
    static EvidenceSet read(Path path) throws InvalidInputException {
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new InvalidInputException("Cannot read evidence file " + path, e);
        }
        try {
            return PrimeSerializer.evidenceFromJson(json);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Invalid evidence file " + path + ": " + e.getMessage(), e);
        }
    }
}
