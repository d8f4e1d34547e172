package io.prime.cli.store;

import io.prime.core.scorecard.Scorecard;
import io.prime.core.scorecard.ScorecardNotFoundException;
import io.prime.core.scorecard.ScorecardRepository;
import io.prime.serialization.PrimeSerializer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;

/// File-backed scorecard store used by the CLI.
///
/// Layout under the root directory:
/// - `scorecards/<id>.json` - one scorecard document per id
/// - `latest/<subject>` - id of the subject's latest scorecard
///
/// Subject identifiers are URL-encoded to form file names. I/O failures surface as
/// `UncheckedIOException`; unreadable store content as {@link ScorecardStoreException}.
public class FileScorecardRepository implements ScorecardRepository {

    private static final Logger logger = Logger.getLogger(FileScorecardRepository.class.getName());

    private final Path scorecardsDir;
    private final Path latestDir;

    public FileScorecardRepository(Path root) {
        this.scorecardsDir = root.resolve("scorecards");
        this.latestDir = root.resolve("latest");
    }

    @Override
    public Optional<Scorecard> findLatest(String subjectId) {
        Path pointer = latestDir.resolve(fileName(subjectId));
        if (!Files.exists(pointer)) {
            return Optional.empty();
        }
        try {
            String scorecardId = Files.readString(pointer).trim();
            if (!isUsableId(scorecardId)) {
                throw new ScorecardStoreException(
                        "Corrupt latest pointer " + pointer + ": '" + scorecardId + "'");
            }
            return Optional.of(findById(scorecardId));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read latest pointer " + pointer, e);
        } catch (ScorecardNotFoundException e) {
            logger.warning("Latest pointer of " + subjectId + " is dangling: " + e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Scorecard findById(String scorecardId) throws ScorecardNotFoundException {
        Path file = scorecardsDir.resolve(fileName(scorecardId) + ".json");
        try {
            return PrimeSerializer.scorecardFromJson(Files.readString(file));
        } catch (IllegalArgumentException e) {
            throw new ScorecardStoreException("Corrupt scorecard file " + file + ": " + e.getMessage(), e);
        } catch (NoSuchFileException e) {
            throw new ScorecardNotFoundException("Scorecard not found: " + scorecardId);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read scorecard " + file, e);
        }
    }

    @Override
    public String save(String subjectId, Scorecard scorecard) {
        String id = UUID.randomUUID().toString();
        Path file = scorecardsDir.resolve(id + ".json");
        try {
            Files.createDirectories(scorecardsDir);
            Files.writeString(file, PrimeSerializer.toJson(scorecard));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write scorecard " + file, e);
        }
        logger.fine(() -> "Saved scorecard " + id + " for subject " + subjectId);
        return id;
    }

    @Override
    public void setLatest(String subjectId, String scorecardId) throws ScorecardNotFoundException {
        if (!Files.exists(scorecardsDir.resolve(fileName(scorecardId) + ".json"))) {
            throw new ScorecardNotFoundException("Scorecard not found: " + scorecardId);
        }
        Path pointer = latestDir.resolve(fileName(subjectId));
        try {
            Files.createDirectories(latestDir);
            Files.writeString(pointer, scorecardId);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write latest pointer " + pointer, e);
        }
    }

    /// Checks whether an identifier can name a file in the store.
    ///
    /// @param id subject or scorecard id, may be null
    /// @return false for null, empty, `.` and `..`
    public static boolean isUsableId(String id) {
        if (id == null) {
            return false;
        }
        String encoded = URLEncoder.encode(id, StandardCharsets.UTF_8);
        return !(encoded.isEmpty() || encoded.equals(".") || encoded.equals(".."));
    }

    private static String fileName(String id) {
        if (!isUsableId(id)) {
            throw new IllegalArgumentException("Unusable identifier: '" + id + "'");
        }
        return URLEncoder.encode(id, StandardCharsets.UTF_8);
    }
}
