package ai.gamedata.translator.export;

import ai.gamedata.translator.codec.WriteReport;
import java.nio.file.Path;

public record ExportReport(Path dataDirectory, int documentsWritten, boolean backupCreated, WriteReport writeReport) {
}
