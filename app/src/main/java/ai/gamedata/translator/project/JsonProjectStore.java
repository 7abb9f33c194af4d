package ai.gamedata.translator.project;

import ai.gamedata.translator.consistency.ActorRecord;
import ai.gamedata.translator.consistency.ActorRegistry;
import ai.gamedata.translator.consistency.Gender;
import ai.gamedata.translator.consistency.Glossary;
import ai.gamedata.translator.consistency.GlossaryLayer;
import ai.gamedata.translator.writer.AtomicFiles;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores project state as a single JSON document. Only the project glossary layer is persisted here;
 * the general layer lives in its own file.
 */
public class JsonProjectStore implements ProjectStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonProjectStore.class);
    static final int FORMAT_VERSION = 1;

    private final ObjectMapper objectMapper;

    public JsonProjectStore() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    JsonProjectStore(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public ProjectState load(Path path) {
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException ex) {
            throw new ProjectStoreException("Failed to read project state " + path, ex);
        }
        if (root == null || !root.isObject()) {
            throw new ProjectStoreException("Project state " + path + " is not a JSON object");
        }
        int version = root.path("version").asInt(-1);
        if (version != FORMAT_VERSION) {
            throw new ProjectStoreException("Unsupported project state version " + version + " in " + path);
        }
        try {
            List<TranslatableUnit> units = new ArrayList<>();
            for (JsonNode node : root.path("units")) {
                units.add(readUnit(node));
            }
            Map<String, String> projectTerms = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> terms = root.path("glossary").fields();
            while (terms.hasNext()) {
                Map.Entry<String, JsonNode> term = terms.next();
                projectTerms.put(term.getKey(), term.getValue().asText());
            }
            ActorRegistry actors = new ActorRegistry();
            for (JsonNode node : root.path("actors")) {
                actors.register(new ActorRecord(node.path("id").asInt(), node.path("name").asText(""),
                        node.path("nickname").asText(""), node.path("profile").asText(""),
                        Gender.from(node.path("gender").asText("")), node.path("genderOverridden").asBoolean(false)));
            }
            ProjectState state = new ProjectState(Paths.get(root.path("gameDirectory").asText(".")), units,
                    new Glossary(Map.of(), projectTerms), actors);
            LOGGER.info("Loaded project state {} ({} unit(s), {} translated)", path, units.size(), state.translatedCount());
            return state;
        } catch (IllegalArgumentException ex) {
            throw new ProjectStoreException("Corrupt project state " + path + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public void save(ProjectState state, Path path) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("version", FORMAT_VERSION);
        root.put("gameDirectory", state.gameDirectory().toString());
        ArrayNode units = root.putArray("units");
        for (TranslatableUnit unit : state.units()) {
            units.add(writeUnit(unit.snapshot()));
        }
        ObjectNode glossary = root.putObject("glossary");
        state.glossary().layer(GlossaryLayer.PROJECT).forEach(glossary::put);
        ArrayNode actors = root.putArray("actors");
        for (ActorRecord actor : state.actors().actors()) {
            ObjectNode node = actors.addObject();
            node.put("id", actor.id());
            node.put("name", actor.name());
            node.put("nickname", actor.nickname());
            node.put("profile", actor.profile());
            node.put("gender", actor.gender().name().toLowerCase(Locale.ROOT));
            node.put("genderOverridden", actor.genderOverridden());
        }
        try {
            AtomicFiles.write(path, objectMapper.writeValueAsBytes(root));
        } catch (IOException ex) {
            throw new ProjectStoreException("Failed to save project state " + path, ex);
        }
        LOGGER.debug("Saved project state to {}", path);
    }

    private ObjectNode writeUnit(TranslatableUnit unit) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("file", unit.id().fileId());
        node.put("path", unit.id().fieldPath());
        node.put("category", unit.category().name());
        node.put("order", unit.orderingKey());
        node.put("segments", unit.segmentCount());
        unit.speaker().ifPresent(speaker -> node.put("speaker", speaker));
        node.put("source", unit.sourceText());
        node.put("translation", unit.translation());
        node.put("status", unit.status().name());
        unit.lastError().ifPresent(error -> node.put("error", error));
        if (unit.wrapped()) {
            node.put("wrapped", true);
        }
        return node;
    }

    private static TranslatableUnit readUnit(JsonNode node) {
        String error = node.hasNonNull("error") ? node.get("error").asText() : null;
        String speaker = node.hasNonNull("speaker") ? node.get("speaker").asText() : null;
        return new TranslatableUnit(
                new UnitId(node.path("file").asText(), node.path("path").asText()),
                node.path("source").asText(""),
                ContentCategory.valueOf(node.path("category").asText()),
                node.path("order").asInt(),
                speaker,
                node.path("segments").asInt(1),
                UnitStatus.from(node.path("status").asText("")),
                node.path("translation").asText(""),
                error,
                node.path("wrapped").asBoolean(false));
    }
}
