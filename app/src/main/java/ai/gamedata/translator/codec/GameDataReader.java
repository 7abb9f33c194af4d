package ai.gamedata.translator.codec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates a game's data directory and parses the whitelisted data files in it.
 */
public class GameDataReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(GameDataReader.class);
    private static final List<String> DATA_DIRECTORY_CANDIDATES = List.of("data", "Data", "www/data");

    public Path locateDataDirectory(Path gameDirectory) {
        if (gameDirectory == null) {
            throw new IllegalArgumentException("gameDirectory must be provided");
        }
        for (String candidate : DATA_DIRECTORY_CANDIDATES) {
            Path dataDirectory = gameDirectory.resolve(candidate);
            if (Files.isDirectory(dataDirectory)) {
                return dataDirectory;
            }
        }
        throw new IllegalStateException("No data directory (data/, Data/ or www/data/) under " + gameDirectory);
    }

    public DocumentSet read(Path dataDirectory) {
        List<Path> files;
        try (Stream<Path> listing = Files.list(dataDirectory)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(path -> ExtractionWhitelist.isGameDataFile(path.getFileName().toString()))
                    .sorted(Comparator.comparingInt((Path path) -> ExtractionWhitelist.fileRank(path.getFileName().toString()))
                            .thenComparing(path -> path.getFileName().toString()))
                    .toList();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list data directory " + dataDirectory, ex);
        }
        List<GameDocument> documents = new ArrayList<>();
        for (Path file : files) {
            documents.add(readDocument(file));
        }
        LOGGER.info("Read {} data file(s) from {}", documents.size(), dataDirectory);
        return new DocumentSet(documents);
    }

    private GameDocument readDocument(Path file) {
        try {
            byte[] raw = Files.readAllBytes(file);
            return new GameDocument(file.getFileName().toString(), GameDataJson.parse(raw), raw);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to parse data file " + file, ex);
        }
    }
}
