package ai.gamedata.translator.translate;

import ai.gamedata.translator.consistency.GlossaryEntry;
import ai.gamedata.translator.context.HistoryEntry;
import ai.gamedata.translator.context.TranslationContext;
import ai.gamedata.translator.placeholder.PlaceholderTransformer;
import ai.gamedata.translator.project.ContentCategory;
import ai.gamedata.translator.project.UnitId;
import java.util.List;
import java.util.Optional;

final class TranslationRequests {

    private TranslationRequests() {
    }

    static TranslationRequest dialogue(String source) {
        return TranslationRequest.of(context(source, PassMode.TRANSLATE, Optional.empty(), List.of(), List.of(), List.of()));
    }

    static TranslationContext context(String source,
                                      PassMode mode,
                                      Optional<String> speaker,
                                      List<GlossaryEntry> glossary,
                                      List<String> genderHints,
                                      List<HistoryEntry> history) {
        return new TranslationContext(new UnitId("Map001.json", "/events/1/pages/0/list/1/parameters/0"),
                ContentCategory.DIALOGUE, mode, new PlaceholderTransformer().mask(source), speaker, glossary,
                genderHints, history);
    }
}
