package ai.gamedata.translator.backup;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a pristine copy of the game's data directory next to it ({@code data_original}). The copy is
 * made once and never modified afterwards.
 */
public class BackupManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(BackupManager.class);
    private static final String BACKUP_SUFFIX = "_original";
    private static final String PARTIAL_SUFFIX = ".partial";

    private final Path dataDirectory;

    public BackupManager(Path dataDirectory) {
        this.dataDirectory = Objects.requireNonNull(dataDirectory, "dataDirectory").toAbsolutePath().normalize();
    }

    public Path dataDirectory() {
        return dataDirectory;
    }

    public Path backupDirectory() {
        return dataDirectory.resolveSibling(dataDirectory.getFileName() + BACKUP_SUFFIX);
    }

    public boolean hasSnapshot() {
        return Files.isDirectory(backupDirectory());
    }

    /**
     * Directory holding the original documents: the snapshot once it exists, the live directory before.
     */
    public Path originalsDirectory() {
        return hasSnapshot() ? backupDirectory() : dataDirectory;
    }

    /**
     * Creates the snapshot unless it already exists. The copy is staged in a sibling directory and moved
     * into place, so an interrupted copy never passes for a snapshot.
     *
     * @return {@code true} when a new snapshot was created
     */
    public boolean ensureSnapshot() {
        Path backup = backupDirectory();
        if (Files.isDirectory(backup)) {
            return false;
        }
        Path staging = backup.resolveSibling(backup.getFileName() + PARTIAL_SUFFIX);
        try {
            deleteRecursively(staging);
            copyRecursively(dataDirectory, staging);
            Files.move(staging, backup, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to snapshot " + dataDirectory + " into " + backup, ex);
        }
        LOGGER.info("Created backup of original data at {}", backup);
        return true;
    }

    /**
     * Copies the snapshot back over the live data directory.
     */
    public void restoreOriginals() {
        if (!hasSnapshot()) {
            throw new IllegalStateException("No backup exists at " + backupDirectory());
        }
        try {
            copyRecursively(backupDirectory(), dataDirectory);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to restore originals into " + dataDirectory, ex);
        }
        LOGGER.info("Restored original data from {}", backupDirectory());
    }

    private static void copyRecursively(Path source, Path target) throws IOException {
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(source)) {
            entries = walk.toList();
        }
        for (Path entry : entries) {
            Path destination = target.resolve(source.relativize(entry).toString());
            if (Files.isDirectory(entry)) {
                Files.createDirectories(destination);
            } else {
                Files.copy(entry, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            }
        }
    }

    private static void deleteRecursively(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(directory)) {
            entries = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path entry : entries) {
            Files.delete(entry);
        }
    }
}
