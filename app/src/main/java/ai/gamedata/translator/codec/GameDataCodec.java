package ai.gamedata.translator.codec;

import ai.gamedata.translator.codec.ExtractionWhitelist.FieldRule;
import ai.gamedata.translator.consistency.ActorRegistry;
import ai.gamedata.translator.project.ContentCategory;
import ai.gamedata.translator.project.TranslatableUnit;
import ai.gamedata.translator.project.UnitId;
import ai.gamedata.translator.project.UnitStatus;
import ai.gamedata.translator.writer.FitResult;
import ai.gamedata.translator.writer.SegmentFitter;
import ai.gamedata.translator.writer.SegmentOverflowPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts translatable units from game documents and writes translations back into a copy of the
 * original documents without changing anything else.
 */
public class GameDataCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(GameDataCodec.class);
    private static final Pattern LEADING_NAMEBOX = Pattern.compile("^\\\\[Nn]<([^>]+)>");
    private static final Pattern ACTOR_CODE = Pattern.compile("^\\\\[Nn]\\[(\\d+)\\]");
    private static final String FIRST_PARAMETER_SUFFIX = "/parameters/0";

    private final SegmentFitter segmentFitter;

    public GameDataCodec() {
        this(new SegmentFitter(SegmentOverflowPolicy.MERGE_INTO_LAST));
    }

    public GameDataCodec(SegmentFitter segmentFitter) {
        this.segmentFitter = Objects.requireNonNull(segmentFitter, "segmentFitter");
    }

    public List<TranslatableUnit> extract(DocumentSet documents) {
        Extraction extraction = new Extraction();
        for (GameDocument document : documents.documents()) {
            int before = extraction.units.size();
            extractDocument(document, extraction);
            LOGGER.debug("Extracted {} unit(s) from {}", extraction.units.size() - before, document.fileId());
        }
        LOGGER.info("Extracted {} unit(s) from {} document(s)", extraction.units.size(), documents.size());
        return List.copyOf(extraction.units);
    }

    /**
     * Applies every unit that carries a translation onto deep copies of {@code original}. Documents
     * without applicable units are passed through untouched.
     *
     * @throws StructuralMismatchException when any unit no longer resolves; nothing is returned then
     */
    public WriteResult write(DocumentSet original, Collection<TranslatableUnit> units) {
        Map<String, List<TranslatableUnit>> applicable = new LinkedHashMap<>();
        for (TranslatableUnit unit : units) {
            TranslatableUnit snapshot = unit.snapshot();
            if (snapshot.status().carriesTranslation()) {
                applicable.computeIfAbsent(snapshot.id().fileId(), key -> new ArrayList<>()).add(snapshot);
            }
        }
        List<String> mismatches = new ArrayList<>();
        for (String fileId : applicable.keySet()) {
            if (original.document(fileId).isEmpty()) {
                mismatches.add(fileId + ": document not present in the original data");
            }
        }

        ReportBuilder report = new ReportBuilder();
        List<GameDocument> output = new ArrayList<>();
        for (GameDocument document : original.documents()) {
            List<TranslatableUnit> pending = applicable.get(document.fileId());
            if (pending == null) {
                output.add(document);
                continue;
            }
            JsonNode copy = document.root().deepCopy();
            DocumentPatch patch = new DocumentPatch(document.fileId(), copy, mismatches, report);
            pending.forEach(patch::apply);
            patch.applyInsertions();
            report.touchedFiles.add(document.fileId());
            output.add(GameDocument.modified(document.fileId(), copy));
        }
        if (!mismatches.isEmpty()) {
            throw new StructuralMismatchException(mismatches);
        }
        if (!report.lossyMerges.isEmpty()) {
            LOGGER.warn("{} unit(s) had more lines than their text commands; excess lines were merged into the last line: {}",
                    report.lossyMerges.size(), report.lossyMerges);
        }
        return new WriteResult(new DocumentSet(output), report.build());
    }

    private void extractDocument(GameDocument document, Extraction out) {
        String fileId = document.fileId();
        JsonNode root = document.root();
        List<FieldRule> fields = ExtractionWhitelist.databaseFields(fileId);
        if (!fields.isEmpty() && root.isArray()) {
            for (int i = 0; i < root.size(); i++) {
                JsonNode record = root.get(i);
                if (record == null || !record.isObject()) {
                    continue;
                }
                String base = FieldPath.child("", i);
                for (FieldRule rule : fields) {
                    out.addIfSource(fileId, FieldPath.child(base, rule.field()), record.get(rule.field()), rule.category(), null);
                }
                if (ExtractionWhitelist.TROOPS_FILE.equals(fileId)) {
                    extractPages(fileId, base, record, out);
                }
            }
        }
        if (ExtractionWhitelist.SYSTEM_FILE.equals(fileId)) {
            extractSystem(fileId, root, out);
        } else if (ExtractionWhitelist.COMMON_EVENTS_FILE.equals(fileId) && root.isArray()) {
            for (int i = 0; i < root.size(); i++) {
                JsonNode event = root.get(i);
                if (event != null && event.isObject() && event.path("list").isArray()) {
                    extractCommands(fileId, FieldPath.child(FieldPath.child("", i), "list"), event.get("list"), out);
                }
            }
        } else if (ExtractionWhitelist.isMapFile(fileId) && root.isObject()) {
            out.addIfSource(fileId, "/displayName", root.get("displayName"), ContentCategory.MAP_NAME, null);
            JsonNode events = root.path("events");
            for (int i = 0; i < events.size(); i++) {
                JsonNode event = events.get(i);
                if (event != null && event.isObject()) {
                    extractPages(fileId, FieldPath.child("/events", i), event, out);
                }
            }
        }
    }

    private void extractPages(String fileId, String ownerPointer, JsonNode owner, Extraction out) {
        JsonNode pages = owner.path("pages");
        for (int j = 0; j < pages.size(); j++) {
            JsonNode list = pages.get(j).path("list");
            if (list.isArray()) {
                extractCommands(fileId, FieldPath.child(FieldPath.child(ownerPointer + "/pages", j), "list"), list, out);
            }
        }
    }

    private void extractSystem(String fileId, JsonNode root, Extraction out) {
        if (!root.isObject()) {
            return;
        }
        out.addIfSource(fileId, "/gameTitle", root.get("gameTitle"), ContentCategory.GAME_TITLE, null);
        JsonNode terms = root.path("terms");
        for (String list : ExtractionWhitelist.SYSTEM_TERM_LISTS) {
            extractStrings(fileId, FieldPath.child("/terms", list), terms.get(list), ContentCategory.SYSTEM_TERM, null, out);
        }
        JsonNode messages = terms.path("messages");
        if (messages.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = messages.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                out.addIfSource(fileId, FieldPath.child("/terms/messages", field.getKey()), field.getValue(),
                        ContentCategory.SYSTEM_TERM, null);
            }
        } else {
            extractStrings(fileId, "/terms/messages", messages, ContentCategory.SYSTEM_TERM, null, out);
        }
        for (String list : ExtractionWhitelist.SYSTEM_TYPE_LISTS) {
            extractStrings(fileId, FieldPath.child("", list), root.get(list), ContentCategory.SYSTEM_TERM, null, out);
        }
    }

    private void extractStrings(String fileId, String pointer, JsonNode list, ContentCategory category,
                                String speaker, Extraction out) {
        if (list == null || !list.isArray()) {
            return;
        }
        for (int i = 0; i < list.size(); i++) {
            out.addIfSource(fileId, FieldPath.child(pointer, i), list.get(i), category, speaker);
        }
    }

    private void extractCommands(String fileId, String listPointer, JsonNode list, Extraction out) {
        MessageHeader header = MessageHeader.NONE;
        int index = 0;
        while (index < list.size()) {
            JsonNode command = list.get(index);
            int code = command.path("code").asInt(-1);
            CommandRule rule = ExtractionWhitelist.commandRule(code);
            if (rule == null) {
                index++;
                continue;
            }
            JsonNode parameters = command.path("parameters");
            String parametersPointer = FieldPath.child(listPointer, index) + "/parameters";
            switch (rule.shape()) {
                case LINE_BLOCK -> {
                    int end = index;
                    List<String> lines = new ArrayList<>();
                    while (end < list.size() && list.get(end).path("code").asInt(-1) == code) {
                        lines.add(list.get(end).path("parameters").path(0).asText(""));
                        end++;
                    }
                    String text = String.join("\n", lines);
                    String speaker = rule.category() == ContentCategory.DIALOGUE ? header.speakerFor(text) : null;
                    out.addBlock(fileId, parametersPointer + "/0", text, rule.category(), speaker, lines.size());
                    index = end;
                    continue;
                }
                case STRING -> {
                    if (code == ExtractionWhitelist.CODE_SHOW_TEXT) {
                        header = MessageHeader.from(parameters);
                    }
                    out.addIfSource(fileId, FieldPath.child(parametersPointer, rule.parameterIndex()),
                            parameters.get(rule.parameterIndex()), rule.category(), null);
                }
                case STRING_LIST -> extractStrings(fileId, FieldPath.child(parametersPointer, rule.parameterIndex()),
                        parameters.get(rule.parameterIndex()), rule.category(), header.name(), out);
                case PLUGIN_ARGUMENTS -> extractPluginArguments(fileId, parametersPointer, parameters, rule, out);
            }
            index++;
        }
    }

    private void extractPluginArguments(String fileId, String parametersPointer, JsonNode parameters,
                                        CommandRule rule, Extraction out) {
        List<String> keys = ExtractionWhitelist.pluginKeys(parameters.path(0).asText(""));
        JsonNode arguments = parameters.get(rule.parameterIndex());
        if (keys.isEmpty() || arguments == null) {
            return;
        }
        String argumentsPointer = FieldPath.child(parametersPointer, rule.parameterIndex());
        if (arguments.isObject()) {
            for (String key : keys) {
                out.addIfSource(fileId, FieldPath.child(argumentsPointer, key), arguments.get(key), rule.category(), null);
            }
        } else if (arguments.isTextual()) {
            JsonNode embedded = parseEmbedded(arguments.asText());
            if (embedded == null || !embedded.isObject()) {
                return;
            }
            for (String key : keys) {
                out.addIfSource(fileId, FieldPath.embedded(argumentsPointer, key), embedded.get(key), rule.category(), null);
            }
        }
    }

    private static JsonNode parseEmbedded(String text) {
        try {
            return GameDataJson.parse(text);
        } catch (JsonProcessingException ex) {
            LOGGER.debug("Plugin arguments are not JSON: {}", ex.getOriginalMessage());
            return null;
        }
    }

    /**
     * Speaker context established by the last Show Text (101) header.
     */
    private record MessageHeader(String name, String face) {

        static final MessageHeader NONE = new MessageHeader(null, null);

        static MessageHeader from(JsonNode parameters) {
            return new MessageHeader(nonBlank(parameters.path(4).asText("")), nonBlank(parameters.path(0).asText("")));
        }

        String speakerFor(String text) {
            if (name != null) {
                return name;
            }
            Matcher namebox = LEADING_NAMEBOX.matcher(text);
            if (namebox.find()) {
                Matcher actor = ACTOR_CODE.matcher(namebox.group(1));
                return actor.find() ? ActorRegistry.actorReference(Integer.parseInt(actor.group(1))) : namebox.group(1);
            }
            Matcher actor = ACTOR_CODE.matcher(text);
            if (actor.find()) {
                return ActorRegistry.actorReference(Integer.parseInt(actor.group(1)));
            }
            return face;
        }

        private static String nonBlank(String value) {
            return value == null || value.isBlank() ? null : value;
        }
    }

    private static final class Extraction {

        private final List<TranslatableUnit> units = new ArrayList<>();
        private int nextOrder;

        void addIfSource(String fileId, String pointer, JsonNode node, ContentCategory category, String speaker) {
            if (node == null || !node.isTextual() || !SourceScript.containsSource(node.asText())) {
                return;
            }
            units.add(new TranslatableUnit(new UnitId(fileId, pointer), node.asText(), category, nextOrder++, speaker, 1));
        }

        void addBlock(String fileId, String pointer, String text, ContentCategory category, String speaker, int segments) {
            UnitStatus status = SourceScript.containsSource(text) ? UnitStatus.UNTRANSLATED : UnitStatus.SKIPPED;
            units.add(new TranslatableUnit(new UnitId(fileId, pointer), text, category, nextOrder++, speaker, segments,
                    status, "", null));
        }
    }

    private static final class ReportBuilder {

        private int applied;
        private int insertedCommands;
        private final List<UnitId> refitted = new ArrayList<>();
        private final List<UnitId> lossyMerges = new ArrayList<>();
        private final Set<String> touchedFiles = new LinkedHashSet<>();

        WriteReport build() {
            return new WriteReport(applied, refitted, lossyMerges, insertedCommands, touchedFiles);
        }
    }

    /**
     * Mutations against one copied document. Text replacements happen immediately; command insertions are
     * collected and applied last, per list in descending position, so earlier resolutions stay valid.
     */
    private final class DocumentPatch {

        private final String fileId;
        private final JsonNode root;
        private final List<String> mismatches;
        private final ReportBuilder report;
        private final Map<ArrayNode, List<Insertion>> insertions = new IdentityHashMap<>();

        DocumentPatch(String fileId, JsonNode root, List<String> mismatches, ReportBuilder report) {
            this.fileId = fileId;
            this.root = root;
            this.mismatches = mismatches;
            this.report = report;
        }

        void apply(TranslatableUnit unit) {
            FieldPath path = FieldPath.parse(unit.id().fieldPath());
            boolean applied;
            if (unit.category() == ContentCategory.DIALOGUE || unit.category() == ContentCategory.SCROLL_TEXT) {
                applied = applyBlock(unit, path);
            } else if (path.hasEmbeddedKey()) {
                applied = applyEmbedded(unit, path);
            } else {
                applied = replaceText(path.pointer(), unit, unit.sourceText(), unit.translation());
            }
            if (applied) {
                report.applied++;
            }
        }

        private boolean applyBlock(TranslatableUnit unit, FieldPath path) {
            String pointer = path.pointer();
            if (!pointer.endsWith(FIRST_PARAMETER_SUFFIX)) {
                return mismatch(unit, "not a text command parameter");
            }
            FieldPath command = FieldPath.parse(pointer.substring(0, pointer.length() - FIRST_PARAMETER_SUFFIX.length()));
            JsonNode listNode = root.at(command.parentPointer());
            int start = parseIndex(command.lastSegment());
            if (!listNode.isArray() || start < 0) {
                return mismatch(unit, "command list not found");
            }
            ArrayNode list = (ArrayNode) listNode;
            int code = unit.category() == ContentCategory.DIALOGUE
                    ? ExtractionWhitelist.CODE_TEXT_LINE : ExtractionWhitelist.CODE_SCROLL_LINE;
            int count = unit.segmentCount();
            if (start + count > list.size() || codeAt(list, start - 1) == code || codeAt(list, start + count) == code) {
                return mismatch(unit, "expected a run of " + count + " command(s) with code " + code);
            }
            List<String> lines = new ArrayList<>();
            for (int k = 0; k < count; k++) {
                JsonNode line = list.get(start + k);
                if (codeAt(list, start + k) != code || !line.path("parameters").path(0).isTextual()) {
                    return mismatch(unit, "expected a run of " + count + " command(s) with code " + code);
                }
                lines.add(line.path("parameters").path(0).asText());
            }
            if (!String.join("\n", lines).equals(unit.sourceText())) {
                return mismatch(unit, "source text differs from the original data");
            }

            FitResult fit = unit.wrapped()
                    ? segmentFitter.fit(unit.translation(), count, SegmentOverflowPolicy.INSERT_COMMANDS)
                    : segmentFitter.fit(unit.translation(), count);
            for (int k = 0; k < count; k++) {
                ((ArrayNode) list.get(start + k).get("parameters")).set(0, list.textNode(fit.lines().get(k)));
            }
            if (fit.extraLines() > 0) {
                JsonNode first = list.get(start);
                List<JsonNode> extra = new ArrayList<>();
                for (String line : fit.lines().subList(count, fit.lines().size())) {
                    ObjectNode inserted = list.objectNode();
                    inserted.put("code", code);
                    JsonNode indent = first.get("indent");
                    inserted.set("indent", indent == null ? list.numberNode(0) : indent.deepCopy());
                    inserted.set("parameters", list.arrayNode().add(line));
                    extra.add(inserted);
                }
                insertions.computeIfAbsent(list, key -> new ArrayList<>()).add(new Insertion(start + count, extra));
                report.insertedCommands += extra.size();
            }
            if (fit.refitted()) {
                report.refitted.add(unit.id());
            }
            if (fit.merged()) {
                report.lossyMerges.add(unit.id());
            }
            return true;
        }

        private boolean applyEmbedded(TranslatableUnit unit, FieldPath path) {
            JsonNode holder = root.at(path.jsonPointer());
            if (!holder.isTextual()) {
                return mismatch(unit, "plugin arguments not found");
            }
            JsonNode embedded = parseEmbedded(holder.asText());
            if (embedded == null || !embedded.isObject()) {
                return mismatch(unit, "plugin arguments are not a JSON object");
            }
            JsonNode current = embedded.get(path.embeddedKey());
            if (current == null || !current.isTextual() || !current.asText().equals(unit.sourceText())) {
                return mismatch(unit, "plugin argument '" + path.embeddedKey() + "' differs from the original data");
            }
            ((ObjectNode) embedded).put(path.embeddedKey(), unit.translation());
            return replaceText(path.pointer(), unit, holder.asText(), GameDataJson.toText(embedded));
        }

        private boolean replaceText(String pointer, TranslatableUnit unit, String expected, String replacement) {
            FieldPath path = FieldPath.parse(pointer);
            JsonNode parent = root.at(path.parentPointer());
            String segment = path.lastSegment();
            if (parent.isObject()) {
                JsonNode current = parent.get(segment);
                if (current == null || !current.isTextual() || !current.asText().equals(expected)) {
                    return mismatch(unit, "text field differs from the original data");
                }
                ((ObjectNode) parent).put(segment, replacement);
                return true;
            }
            if (parent.isArray()) {
                int index = parseIndex(segment);
                JsonNode current = index >= 0 ? parent.get(index) : null;
                if (current == null || !current.isTextual() || !current.asText().equals(expected)) {
                    return mismatch(unit, "text element differs from the original data");
                }
                ((ArrayNode) parent).set(index, TextNode.valueOf(replacement));
                return true;
            }
            return mismatch(unit, "parent node not found");
        }

        void applyInsertions() {
            insertions.forEach((list, pending) -> {
                pending.sort(Comparator.comparingInt(Insertion::position).reversed());
                for (Insertion insertion : pending) {
                    for (int k = 0; k < insertion.commands().size(); k++) {
                        list.insert(insertion.position() + k, insertion.commands().get(k));
                    }
                }
            });
        }

        private boolean mismatch(TranslatableUnit unit, String reason) {
            mismatches.add(fileId + unit.id().fieldPath() + ": " + reason);
            return false;
        }
    }

    private record Insertion(int position, List<JsonNode> commands) {
    }

    private static int codeAt(ArrayNode list, int index) {
        if (index < 0 || index >= list.size()) {
            return Integer.MIN_VALUE;
        }
        return list.get(index).path("code").asInt(Integer.MIN_VALUE);
    }

    private static int parseIndex(String segment) {
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }
}
