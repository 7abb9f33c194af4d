package ai.gamedata.translator.context;

import ai.gamedata.translator.consistency.GlossaryEntry;
import ai.gamedata.translator.placeholder.MaskedText;
import ai.gamedata.translator.project.ContentCategory;
import ai.gamedata.translator.project.UnitId;
import ai.gamedata.translator.translate.PassMode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a translator needs for one unit.
 */
public record TranslationContext(UnitId unitId,
                                 ContentCategory category,
                                 PassMode mode,
                                 MaskedText source,
                                 Optional<String> speakerName,
                                 List<GlossaryEntry> glossary,
                                 List<String> genderHints,
                                 List<HistoryEntry> history) {

    public TranslationContext {
        Objects.requireNonNull(unitId, "unitId");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(source, "source");
        speakerName = speakerName == null ? Optional.empty() : speakerName;
        glossary = List.copyOf(glossary);
        genderHints = List.copyOf(genderHints);
        history = List.copyOf(history);
    }

    public String maskedSource() {
        return source.text();
    }
}
