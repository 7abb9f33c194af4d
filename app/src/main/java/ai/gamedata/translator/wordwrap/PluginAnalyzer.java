package ai.gamedata.translator.wordwrap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives message window geometry from a game's enabled message plugins and its System.json.
 */
public class PluginAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginAnalyzer.class);

    static final int DEFAULT_MESSAGE_WIDTH = 816;
    static final int DEFAULT_FONT_SIZE = 28;
    static final String WORD_WRAP_TAG = "<WordWrap>";

    private static final int WINDOW_PADDING = 48;
    private static final double GLYPH_WIDTH_RATIO = 0.55;
    private static final int MIN_CHARS_PER_LINE = 20;
    private static final Pattern PLUGIN_ARRAY = Pattern.compile("\\[.*\\]", Pattern.DOTALL);
    private static final List<String> PLUGIN_FILE_CANDIDATES = List.of("js/plugins.js", "www/js/plugins.js");
    private static final Set<String> TRUTHY = Set.of("true", "1", "yes");

    private static final Map<String, MessagePlugin> MESSAGE_PLUGINS = knownPlugins();

    private final ObjectMapper mapper;

    public PluginAnalyzer() {
        this(new ObjectMapper());
    }

    PluginAnalyzer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param gameDirectory root of the game, where {@code js/} or {@code www/js/} lives
     * @param dataDirectory the game's data directory, or {@code null} when System.json should not be consulted
     */
    public PluginAnalysis analyze(Path gameDirectory, Path dataDirectory) {
        Optional<Path> pluginsFile = PLUGIN_FILE_CANDIDATES.stream()
                .map(gameDirectory::resolve)
                .filter(Files::isRegularFile)
                .findFirst();
        if (pluginsFile.isEmpty()) {
            LOGGER.debug("No plugins.js under {}; using default window geometry", gameDirectory);
            return PluginAnalysis.defaults();
        }
        List<JsonNode> plugins = loadPlugins(pluginsFile.get());
        if (plugins.isEmpty()) {
            return PluginAnalysis.defaults();
        }

        int messageWidth = DEFAULT_MESSAGE_WIDTH;
        int maxLines = WordWrapSettings.DEFAULT_MAX_LINES;
        boolean wrapTag = false;
        List<String> detected = new ArrayList<>();
        for (JsonNode plugin : plugins) {
            if (!plugin.path("status").asBoolean(false)) {
                continue;
            }
            String name = plugin.path("name").asText("");
            JsonNode parameters = plugin.path("parameters");
            for (Map.Entry<String, MessagePlugin> known : MESSAGE_PLUGINS.entrySet()) {
                if (!name.toLowerCase(Locale.ROOT).contains(known.getKey().toLowerCase(Locale.ROOT))) {
                    continue;
                }
                MessagePlugin settings = known.getValue();
                detected.add(name);
                OptionalInt width = intParameter(parameters, settings.widthParameter());
                if (width.isPresent()) {
                    messageWidth = width.getAsInt();
                }
                OptionalInt rows = intParameter(parameters, settings.rowsParameter());
                if (rows.isPresent() && rows.getAsInt() > 0) {
                    maxLines = rows.getAsInt();
                }
                if (settings.wordWrapParameter() != null
                        && TRUTHY.contains(parameters.path(settings.wordWrapParameter()).asText("").toLowerCase(Locale.ROOT))) {
                    wrapTag = true;
                }
                String lowered = name.toLowerCase(Locale.ROOT);
                if (lowered.contains("yep") || lowered.contains("visumz")) {
                    wrapTag = true;
                }
            }
        }
        int fontSize = dataDirectory == null ? DEFAULT_FONT_SIZE : readFontSize(dataDirectory);
        int charsPerLine = Math.max(MIN_CHARS_PER_LINE,
                (int) ((messageWidth - WINDOW_PADDING) / (fontSize * GLYPH_WIDTH_RATIO)));
        return new PluginAnalysis(messageWidth, fontSize,
                new WordWrapSettings(charsPerLine, maxLines, wrapTag ? Optional.of(WORD_WRAP_TAG) : Optional.empty()),
                List.copyOf(detected));
    }

    private List<JsonNode> loadPlugins(Path pluginsFile) {
        try {
            Matcher matcher = PLUGIN_ARRAY.matcher(Files.readString(pluginsFile));
            if (!matcher.find()) {
                LOGGER.warn("No plugin list found in {}", pluginsFile);
                return List.of();
            }
            List<JsonNode> plugins = new ArrayList<>();
            mapper.readTree(matcher.group()).forEach(plugins::add);
            return plugins;
        } catch (IOException ex) {
            LOGGER.warn("Could not read {}; using default window geometry: {}", pluginsFile, ex.getMessage());
            return List.of();
        }
    }

    private int readFontSize(Path dataDirectory) {
        Path system = dataDirectory.resolve("System.json");
        if (!Files.isRegularFile(system)) {
            return DEFAULT_FONT_SIZE;
        }
        try {
            int fontSize = mapper.readTree(system.toFile()).path("advanced").path("fontSize").asInt(0);
            return fontSize > 0 ? fontSize : DEFAULT_FONT_SIZE;
        } catch (IOException ex) {
            LOGGER.warn("Could not read font size from {}: {}", system, ex.getMessage());
            return DEFAULT_FONT_SIZE;
        }
    }

    private static OptionalInt intParameter(JsonNode parameters, String key) {
        if (key == null || !parameters.has(key)) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(parameters.get(key).asText().trim()));
        } catch (NumberFormatException ex) {
            LOGGER.debug("Ignoring non-numeric plugin parameter {}", key);
            return OptionalInt.empty();
        }
    }

    private static Map<String, MessagePlugin> knownPlugins() {
        Map<String, MessagePlugin> plugins = new LinkedHashMap<>();
        plugins.put("YEP_MessageCore", new MessagePlugin("Default Width", "Message Rows", "Word Wrapping"));
        plugins.put("MessageWindowPopup", MessagePlugin.NONE);
        plugins.put("Galv_MessageStyles", MessagePlugin.NONE);
        plugins.put("SRD_MessageBacklog", MessagePlugin.NONE);
        plugins.put("CGMZ_MessageSystem", new MessagePlugin("Window Width", null, null));
        plugins.put("VisuMZ_MessageCore", new MessagePlugin("General:MessageWindow:MessageWidth",
                "General:MessageWindow:MessageRows", "Word Wrap:EnableWordWrap"));
        return Collections.unmodifiableMap(plugins);
    }

    private record MessagePlugin(String widthParameter, String rowsParameter, String wordWrapParameter) {
        static final MessagePlugin NONE = new MessagePlugin(null, null, null);
    }
}
