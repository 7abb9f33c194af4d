package ai.gamedata.translator.wordwrap;

import ai.gamedata.translator.placeholder.ControlCodeCatalogue;
import ai.gamedata.translator.project.ContentCategory;
import ai.gamedata.translator.project.TranslatableUnit;
import ai.gamedata.translator.project.UnitId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits translated text to the message window after translation.
 *
 * <p>When a wrap tag is configured, dialogue keeps the source line count and the tag is prepended so the
 * in-game plugin performs the visual wrapping. Everything else is re-wrapped by hand at word boundaries,
 * measuring only visible characters.
 */
public class WordWrapProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(WordWrapProcessor.class);
    private static final Pattern WORD_WRAP_TAG = Pattern.compile("<[Ww]ord[Ww]rap>");

    private final WordWrapSettings settings;
    private final ControlCodeCatalogue catalogue;

    public WordWrapProcessor(WordWrapSettings settings) {
        this(settings, ControlCodeCatalogue.defaultCatalogue());
    }

    public WordWrapProcessor(WordWrapSettings settings, ControlCodeCatalogue catalogue) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.catalogue = Objects.requireNonNull(catalogue, "catalogue");
    }

    /**
     * Wraps every translated or reviewed unit in place. Name-like categories are single labels and are left alone.
     */
    public WordWrapReport applyAll(Collection<TranslatableUnit> units) {
        int modified = 0;
        int expanded = 0;
        int extraLines = 0;
        List<UnitId> overflow = new ArrayList<>();
        for (TranslatableUnit unit : units) {
            if (!unit.status().carriesTranslation() || unit.category().isName()) {
                continue;
            }
            String translation = unit.translation();
            if (translation.isBlank()) {
                continue;
            }
            boolean tagged = usesTag(unit.category()) && settings.wrapTag().isPresent();
            String processed = process(unit.sourceText(), translation, usesTag(unit.category()));
            if (!processed.equals(translation)) {
                modified++;
            }
            if (tagged) {
                unit.replaceTranslation(processed);
            } else {
                unit.applyWrap(processed);
            }
            int sourceLines = lineCount(unit.sourceText());
            int lines = lineCount(processed);
            if (lines > sourceLines) {
                expanded++;
                extraLines += lines - sourceLines;
            }
            if (exceedsMessageBox(processed)) {
                overflow.add(unit.id());
            }
        }
        if (!overflow.isEmpty()) {
            LOGGER.warn("{} unit(s) exceed {} lines and will paginate in game", overflow.size(), settings.maxLines());
        }
        LOGGER.info("Word wrap changed {} unit(s); {} need {} extra line(s)", modified, expanded, extraLines);
        return new WordWrapReport(modified, expanded, extraLines, overflow);
    }

    public String process(String original, String translation, boolean useTag) {
        if (translation == null || translation.isBlank()) {
            return translation;
        }
        int sourceLines = lineCount(original);
        if (useTag && settings.wrapTag().isPresent()) {
            return applyTag(translation, sourceLines, settings.wrapTag().get());
        }
        return rewrap(translation, sourceLines);
    }

    private boolean usesTag(ContentCategory category) {
        return category == ContentCategory.DIALOGUE || category == ContentCategory.SCROLL_TEXT;
    }

    private String applyTag(String text, int sourceLines, String tag) {
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\n", -1)));
        if (lines.size() > sourceLines) {
            List<String> keep = new ArrayList<>(lines.subList(0, sourceLines - 1));
            String merged = lines.subList(sourceLines - 1, lines.size()).stream()
                    .map(String::strip)
                    .filter(segment -> !segment.isEmpty())
                    .collect(Collectors.joining(" "));
            keep.add(merged);
            lines = keep;
        }
        while (lines.size() < sourceLines) {
            lines.add("");
        }
        if (!lines.get(0).startsWith(tag)) {
            lines.set(0, tag + lines.get(0));
        }
        return String.join("\n", lines);
    }

    private String rewrap(String text, int sourceLines) {
        String untagged = WORD_WRAP_TAG.matcher(text).replaceAll("");
        String joined = Arrays.stream(untagged.split("\n"))
                .map(String::strip)
                .filter(segment -> !segment.isEmpty())
                .collect(Collectors.joining(" "));
        List<String> wrapped = joined.isEmpty() ? new ArrayList<>() : wrapToLines(joined);
        while (wrapped.size() < sourceLines) {
            wrapped.add("");
        }
        return String.join("\n", wrapped);
    }

    List<String> wrapToLines(String text) {
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : text.split(" ")) {
            if (word.isEmpty()) {
                continue;
            }
            String candidate = current.length() == 0 ? word : current + " " + word;
            if (visibleLength(candidate) <= settings.charsPerLine() || current.length() == 0) {
                current.setLength(0);
                current.append(candidate);
            } else {
                lines.add(current.toString());
                current.setLength(0);
                current.append(word);
            }
        }
        if (current.length() > 0) {
            lines.add(current.toString());
        }
        return lines;
    }

    boolean exceedsMessageBox(String text) {
        return lineCount(text) > settings.maxLines();
    }

    int visibleLength(String text) {
        return catalogue.strip(text).length();
    }

    private static int lineCount(String text) {
        return text.split("\n", -1).length;
    }
}
