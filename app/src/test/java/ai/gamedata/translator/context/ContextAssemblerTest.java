package ai.gamedata.translator.context;

import static org.assertj.core.api.Assertions.assertThat;

import ai.gamedata.translator.consistency.ActorRecord;
import ai.gamedata.translator.consistency.ActorRegistry;
import ai.gamedata.translator.consistency.ConsistencyStore;
import ai.gamedata.translator.consistency.Gender;
import ai.gamedata.translator.consistency.GlossaryEntry;
import ai.gamedata.translator.consistency.Glossary;
import ai.gamedata.translator.consistency.TranslationMemory;
import ai.gamedata.translator.placeholder.PlaceholderTransformer;
import ai.gamedata.translator.project.ContentCategory;
import ai.gamedata.translator.project.TranslatableUnit;
import ai.gamedata.translator.project.UnitId;
import ai.gamedata.translator.translate.PassMode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContextAssemblerTest {

    private ContextAssembler assembler;

    @BeforeEach
    void setUp() {
        ActorRegistry actors = new ActorRegistry(List.of(
                new ActorRecord(1, "ハロルド", "勇者", "村の少年。", Gender.MALE, false),
                new ActorRecord(2, "テレーゼ", "", "王女。", Gender.FEMALE, false),
                new ActorRecord(3, "マルコ", "", "", Gender.UNKNOWN, false)));
        Glossary glossary = new Glossary(Map.of("王女", "Princess"), Map.of("ハロルド", "Harold", "剣", "Sword"));
        assembler = new ContextAssembler(new ConsistencyStore(glossary, new TranslationMemory(), actors),
                new PlaceholderTransformer(), 2);
    }

    @Test
    void resolvesSpeakerGlossaryAndMentionedActors() {
        TranslatableUnit unit = dialogue("\\N[2]、王女はどこだ？", "actor:1");

        TranslationContext context = assembler.build(unit, PassMode.TRANSLATE, List.of());

        assertThat(context.maskedSource()).isEqualTo("⟦1⟧、王女はどこだ？");
        assertThat(context.speakerName()).contains("ハロルド");
        assertThat(context.glossary()).extracting(GlossaryEntry::sourceTerm).containsExactly("ハロルド", "王女");
        assertThat(context.genderHints()).containsExactly(
                "Actor 1: ハロルド [male - use he/him] aka \"勇者\" - 村の少年。",
                "Actor 2: テレーゼ [female - use she/her] - 王女。");
    }

    @Test
    void unknownSpeakerNameIsKeptAsWritten() {
        TranslationContext context = assembler.build(dialogue("いらっしゃい！", "商人"), PassMode.TRANSLATE, List.of());

        assertThat(context.speakerName()).contains("商人");
        assertThat(context.genderHints()).isEmpty();
    }

    @Test
    void historyIsTrimmedToTheWindow() {
        List<HistoryEntry> history = List.of(new HistoryEntry("一", "One"), new HistoryEntry("二", "Two"),
                new HistoryEntry("三", "Three"));

        TranslationContext context = assembler.build(dialogue("四", null), PassMode.TRANSLATE, history);

        assertThat(context.history()).extracting(HistoryEntry::translation).containsExactly("Two", "Three");
    }

    @Test
    void polishWorksOnTheExistingTranslationWithoutGlossary() {
        TranslatableUnit unit = dialogue("王女はどこだ？", "actor:1");
        unit.markTranslated("Where is the Princess?");

        TranslationContext context = assembler.build(unit, PassMode.POLISH, List.of());

        assertThat(context.maskedSource()).isEqualTo("Where is the Princess?");
        assertThat(context.glossary()).isEmpty();
        assertThat(context.genderHints()).isEmpty();
        assertThat(context.mode()).isEqualTo(PassMode.POLISH);
    }

    @Test
    void sameInputsBuildEqualContexts() {
        TranslatableUnit unit = dialogue("\\N[2]、王女はどこだ？", "actor:1");

        assertThat(assembler.build(unit, PassMode.TRANSLATE, List.of()))
                .isEqualTo(assembler.build(unit, PassMode.TRANSLATE, List.of()));
    }

    private static TranslatableUnit dialogue(String source, String speaker) {
        return new TranslatableUnit(new UnitId("Map001.json", "/events/1/pages/0/list/1/parameters/0"), source,
                ContentCategory.DIALOGUE, 1, speaker, 1);
    }
}
