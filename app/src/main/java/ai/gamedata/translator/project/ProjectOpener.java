package ai.gamedata.translator.project;

import ai.gamedata.translator.backup.BackupManager;
import ai.gamedata.translator.codec.ActorScanner;
import ai.gamedata.translator.codec.DocumentSet;
import ai.gamedata.translator.codec.GameDataCodec;
import ai.gamedata.translator.codec.GameDataReader;
import ai.gamedata.translator.consistency.Glossary;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens a game directory: extracts units from the original data and carries over a saved state if one exists.
 */
public class ProjectOpener {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectOpener.class);

    private final GameDataReader reader;
    private final GameDataCodec codec;
    private final ActorScanner actorScanner;
    private final ProjectStore store;

    public ProjectOpener(GameDataReader reader, GameDataCodec codec, ActorScanner actorScanner, ProjectStore store) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.actorScanner = Objects.requireNonNull(actorScanner, "actorScanner");
        this.store = Objects.requireNonNull(store, "store");
    }

    public ProjectState open(Path gameDirectory, Path statePath, Map<String, String> generalTerms) {
        Path dataDirectory = reader.locateDataDirectory(gameDirectory);
        Path originals = new BackupManager(dataDirectory).originalsDirectory();
        DocumentSet documents = reader.read(originals);
        ProjectState project = new ProjectState(gameDirectory, codec.extract(documents),
                new Glossary(generalTerms, Map.of()), actorScanner.scan(documents));
        if (statePath != null && Files.isRegularFile(statePath)) {
            int merged = project.mergeFrom(store.load(statePath));
            LOGGER.info("Restored {} unit(s) from {}", merged, statePath);
        }
        LOGGER.info("Project {}: {} unit(s) in {} file(s), {} translated",
                gameDirectory, project.units().size(), project.files().size(), project.translatedCount());
        return project;
    }
}
