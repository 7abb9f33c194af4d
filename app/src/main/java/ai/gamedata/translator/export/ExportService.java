package ai.gamedata.translator.export;

import ai.gamedata.translator.backup.BackupManager;
import ai.gamedata.translator.codec.DocumentSet;
import ai.gamedata.translator.codec.GameDataCodec;
import ai.gamedata.translator.codec.GameDataReader;
import ai.gamedata.translator.codec.GameDocument;
import ai.gamedata.translator.codec.WriteResult;
import ai.gamedata.translator.project.ProjectState;
import ai.gamedata.translator.writer.DocumentWriter;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds every data file from the backup snapshot plus the project's translations and writes them to
 * the live data directory. Exporting the same state twice produces identical files.
 */
public class ExportService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExportService.class);

    private final GameDataReader reader;
    private final GameDataCodec codec;
    private final DocumentWriter writer;

    public ExportService(GameDataReader reader, GameDataCodec codec, DocumentWriter writer) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    public ExportReport export(ProjectState project, Path dataDirectory) {
        BackupManager backup = new BackupManager(dataDirectory);
        boolean created = backup.ensureSnapshot();
        DocumentSet original = reader.read(backup.backupDirectory());
        WriteResult result = codec.write(original, project.units());
        for (GameDocument document : result.documents().documents()) {
            writer.write(backup.dataDirectory(), document);
        }
        LOGGER.info("Exported {} document(s) to {} ({} unit(s) applied, {} file(s) translated)",
                result.documents().size(), backup.dataDirectory(), result.report().appliedUnits(),
                result.report().touchedFiles().size());
        return new ExportReport(backup.dataDirectory(), result.documents().size(), created, result.report());
    }
}
