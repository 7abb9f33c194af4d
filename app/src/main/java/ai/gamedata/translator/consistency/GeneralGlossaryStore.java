package ai.gamedata.translator.consistency;

import ai.gamedata.translator.writer.AtomicFiles;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads and saves the cross-project glossary layer as a flat JSON object.
 */
public final class GeneralGlossaryStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeneralGlossaryStore.class);
    private static final TypeReference<Map<String, String>> TERMS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public GeneralGlossaryStore() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    GeneralGlossaryStore(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public Map<String, String> load(Path path) {
        if (!Files.exists(path)) {
            LOGGER.info("General glossary {} not found; starting empty", path);
            return Map.of();
        }
        try {
            Map<String, String> terms = objectMapper.readValue(path.toFile(), TERMS);
            LOGGER.info("Loaded {} general glossary terms from {}", terms.size(), path);
            return new TreeMap<>(terms);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read general glossary " + path, ex);
        }
    }

    public void save(Glossary glossary, Path path) {
        try {
            byte[] payload = objectMapper.writeValueAsBytes(glossary.layer(GlossaryLayer.GENERAL));
            AtomicFiles.write(path, payload);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write general glossary " + path, ex);
        }
    }
}
