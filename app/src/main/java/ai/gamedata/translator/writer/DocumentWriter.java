package ai.gamedata.translator.writer;

import ai.gamedata.translator.codec.GameDocument;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes reconstructed game documents into the live data directory.
 */
public class DocumentWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentWriter.class);

    public void write(Path dataDirectory, GameDocument document) {
        if (dataDirectory == null || document == null) {
            throw new IllegalArgumentException("dataDirectory and document must be provided");
        }
        Path target = dataDirectory.resolve(document.fileId());
        try {
            AtomicFiles.write(target, document.content());
            LOGGER.debug("Wrote {}", target);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write game document: " + target, ex);
        }
    }
}
