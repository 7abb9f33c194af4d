package ai.gamedata.translator.wordwrap;

import static org.assertj.core.api.Assertions.assertThat;

import ai.gamedata.translator.project.ContentCategory;
import ai.gamedata.translator.project.TranslatableUnit;
import ai.gamedata.translator.project.UnitId;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class WordWrapProcessorTest {

    private final WordWrapProcessor processor = new WordWrapProcessor(new WordWrapSettings(20, 4, Optional.empty()));

    @Test
    void rewrapsAtWordBoundaries() {
        String wrapped = processor.process("一行", "The quick brown fox jumps over the lazy dog", false);

        assertThat(wrapped).isEqualTo("The quick brown fox\njumps over the lazy\ndog");
    }

    @Test
    void controlCodesDoNotCountTowardsLineLength() {
        String wrapped = processor.process("一\n二", "\\C[2]Harold\\C[0] found a rusty old sword", false);

        assertThat(wrapped).isEqualTo("\\C[2]Harold\\C[0] found a rusty\nold sword");
    }

    @Test
    void padsToTheSourceLineCount() {
        assertThat(processor.process("一\n二\n三", "Short.", false)).isEqualTo("Short.\n\n");
    }

    @Test
    void removesStaleWrapTagWhenRewrapping() {
        assertThat(processor.process("一", "<WordWrap>Hello there", false)).isEqualTo("Hello there");
    }

    @Test
    void tagModeKeepsSourceLinesAndPrependsTheTag() {
        WordWrapProcessor tagged = new WordWrapProcessor(WordWrapSettings.defaults().withWrapTag("<WordWrap>"));

        assertThat(tagged.process("一\n二", "A\nB\nC", true)).isEqualTo("<WordWrap>A\nB C");
        assertThat(tagged.process("一\n二", "<WordWrap>A", true)).isEqualTo("<WordWrap>A\n");
    }

    @Test
    void applyAllReportsChangesAndOverflow() {
        TranslatableUnit line = unit(1, ContentCategory.DIALOGUE, "The quick brown fox jumps over the lazy dog");
        TranslatableUnit name = unit(2, ContentCategory.ACTOR_NAME, "A very long actor name that stays on one line");
        TranslatableUnit story = unit(3, ContentCategory.SCROLL_TEXT,
                "one two three four five six seven eight nine ten eleven twelve thirteen fourteen fifteen");
        TranslatableUnit untouched = new TranslatableUnit(new UnitId("Map001.json", "/events/1/pages/0/list/4/parameters/0"),
                "一行", ContentCategory.DIALOGUE, 4, null, 1);

        WordWrapReport report = processor.applyAll(List.of(line, name, story, untouched));

        assertThat(report.modified()).isEqualTo(2);
        assertThat(report.expanded()).isEqualTo(2);
        assertThat(report.extraLines()).isEqualTo(6);
        assertThat(report.overflow()).containsExactly(story.id());
        assertThat(name.translation()).isEqualTo("A very long actor name that stays on one line");
        assertThat(untouched.translation()).isEmpty();
    }

    private static TranslatableUnit unit(int order, ContentCategory category, String translation) {
        TranslatableUnit unit = new TranslatableUnit(new UnitId("Map001.json", "/events/1/pages/0/list/" + order + "/parameters/0"),
                "一行", category, order, null, 1);
        unit.markTranslated(translation);
        return unit;
    }
}
