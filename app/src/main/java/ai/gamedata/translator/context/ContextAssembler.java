package ai.gamedata.translator.context;

import ai.gamedata.translator.consistency.ActorRecord;
import ai.gamedata.translator.consistency.ConsistencyStore;
import ai.gamedata.translator.consistency.GlossaryEntry;
import ai.gamedata.translator.placeholder.MaskedText;
import ai.gamedata.translator.placeholder.PlaceholderTransformer;
import ai.gamedata.translator.project.TranslatableUnit;
import ai.gamedata.translator.translate.PassMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the per-unit translation context. The result depends only on the unit, the store contents and
 * the history snapshot passed in.
 */
public class ContextAssembler {

    private static final Pattern ACTOR_CODE = Pattern.compile("\\\\[Nn]\\[(\\d+)\\]");

    private final ConsistencyStore store;
    private final PlaceholderTransformer transformer;
    private final int historyWindowSize;

    public ContextAssembler(ConsistencyStore store, PlaceholderTransformer transformer, int historyWindowSize) {
        this.store = Objects.requireNonNull(store, "store");
        this.transformer = Objects.requireNonNull(transformer, "transformer");
        if (historyWindowSize < 0) {
            throw new IllegalArgumentException("historyWindowSize must not be negative");
        }
        this.historyWindowSize = historyWindowSize;
    }

    public TranslationContext build(TranslatableUnit unit, PassMode mode, List<HistoryEntry> history) {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(mode, "mode");
        String text = mode == PassMode.POLISH ? unit.translation() : unit.sourceText();
        MaskedText masked = transformer.mask(text);
        Optional<ActorRecord> speakerActor = unit.speaker().flatMap(speaker -> store.actors().resolveSpeaker(speaker));
        Optional<String> speakerName = speakerActor.map(ActorRecord::name)
                .filter(name -> !name.isBlank())
                .or(unit::speaker);

        List<GlossaryEntry> glossary = List.of();
        List<String> genderHints = List.of();
        if (mode == PassMode.TRANSLATE) {
            glossary = store.glossary().entriesOccurringIn(unit.sourceText(), speakerName.orElse(null));
            genderHints = genderHints(unit.sourceText(), speakerActor);
        }
        return new TranslationContext(unit.id(), unit.category(), mode, masked, speakerName, glossary, genderHints,
                recent(history));
    }

    private List<String> genderHints(String source, Optional<ActorRecord> speakerActor) {
        Map<Integer, ActorRecord> referenced = new LinkedHashMap<>();
        speakerActor.ifPresent(actor -> referenced.put(actor.id(), actor));
        TreeSet<Integer> mentioned = new TreeSet<>();
        Matcher matcher = ACTOR_CODE.matcher(source);
        while (matcher.find()) {
            mentioned.add(Integer.parseInt(matcher.group(1)));
        }
        for (Integer id : mentioned) {
            store.actors().find(id).ifPresent(actor -> referenced.putIfAbsent(actor.id(), actor));
        }
        List<String> hints = new ArrayList<>();
        for (ActorRecord actor : referenced.values()) {
            hints.add(actor.describe());
        }
        return hints;
    }

    private List<HistoryEntry> recent(List<HistoryEntry> history) {
        if (history == null || history.isEmpty() || historyWindowSize == 0) {
            return List.of();
        }
        int from = Math.max(0, history.size() - historyWindowSize);
        return history.subList(from, history.size());
    }
}
