package ai.gamedata.translator.project;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.gamedata.translator.consistency.ActorRecord;
import ai.gamedata.translator.consistency.ActorRegistry;
import ai.gamedata.translator.consistency.Gender;
import ai.gamedata.translator.consistency.Glossary;
import ai.gamedata.translator.consistency.GlossaryLayer;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProjectStateTest {

    private static final Path GAME = Path.of("game");

    @Test
    void ordersUnitsByOrderingKey() {
        ProjectState project = project(
                unit("Map001.json", "/events/1/pages/0/list/1/parameters/0", "おはよう", 5),
                unit("Actors.json", "/1/name", "ハロルド", 1));

        assertThat(project.units()).extracting(unit -> unit.id().fileId())
                .containsExactly("Actors.json", "Map001.json");
        assertThat(project.files()).containsExactly("Actors.json", "Map001.json");
    }

    @Test
    void rejectsDuplicateIds() {
        assertThatThrownBy(() -> project(
                unit("Actors.json", "/1/name", "ハロルド", 1),
                unit("Actors.json", "/1/name", "ハロルド", 2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Actors.json/1/name");
    }

    @Test
    void mergeFromRestoresUnchangedUnitsOnly() {
        ProjectState previous = project(
                unit("Actors.json", "/1/name", "ハロルド", 1),
                unit("Actors.json", "/2/name", "テレーゼ", 2));
        previous.units().get(0).markTranslated("Harold");
        previous.units().get(1).markTranslated("Therese");
        previous.glossary().upsert(GlossaryLayer.PROJECT, "ハロルド", "Harold");

        ProjectState current = project(
                unit("Actors.json", "/1/name", "ハロルド", 1),
                unit("Actors.json", "/2/name", "テレサ", 2),
                unit("Actors.json", "/3/name", "マルコ", 3));

        int merged = current.mergeFrom(previous);

        assertThat(merged).isEqualTo(1);
        assertThat(current.units()).extracting(TranslatableUnit::status)
                .containsExactly(UnitStatus.TRANSLATED, UnitStatus.UNTRANSLATED, UnitStatus.UNTRANSLATED);
        assertThat(current.units().get(0).translation()).isEqualTo("Harold");
        assertThat(current.glossary().lookup("ハロルド")).contains("Harold");
    }

    @Test
    void mergeFromCarriesGenderOverrides() {
        ActorRegistry savedActors = new ActorRegistry(List.of(
                new ActorRecord(1, "ハロルド", "", "", Gender.FEMALE, true),
                new ActorRecord(2, "テレーゼ", "", "", Gender.MALE, false)));
        ProjectState previous = new ProjectState(GAME, List.of(), new Glossary(), savedActors);
        ActorRegistry scanned = new ActorRegistry(List.of(
                new ActorRecord(1, "ハロルド", "", "", Gender.MALE, false),
                new ActorRecord(2, "テレーゼ", "", "", Gender.FEMALE, false)));
        ProjectState current = new ProjectState(GAME, List.of(), new Glossary(), scanned);

        current.mergeFrom(previous);

        assertThat(current.actors().genderOf("actor:1")).isEqualTo(Gender.FEMALE);
        assertThat(current.actors().genderOf("actor:2")).isEqualTo(Gender.FEMALE);
    }

    @Test
    void statsForFileCountsEachStatus() {
        ProjectState project = project(
                unit("Items.json", "/1/name", "ポーション", 1),
                unit("Items.json", "/1/description", "HPを回復する。", 2),
                unit("Items.json", "/2/name", "エリクサー", 3),
                unit("Items.json", "/2/description", "全回復。", 4));
        project.units().get(0).markTranslated("Potion");
        project.units().get(1).markTranslated("Restores HP.");
        project.units().get(1).markReviewed();
        project.units().get(2).markFailed("timeout");

        FileStats stats = project.statsForFile("Items.json");

        assertThat(stats.total()).isEqualTo(4);
        assertThat(stats.translated()).isEqualTo(1);
        assertThat(stats.reviewed()).isEqualTo(1);
        assertThat(stats.failed()).isEqualTo(1);
        assertThat(stats.untranslated()).isEqualTo(1);
        assertThat(stats.completionRatio()).isEqualTo(0.5);
        assertThat(project.translatedCount()).isEqualTo(2);
    }

    @Test
    void snapshotIsDetachedFromLaterChanges() {
        ProjectState project = project(unit("Actors.json", "/1/name", "ハロルド", 1));

        ProjectState snapshot = project.snapshot();
        project.units().get(0).markTranslated("Harold");

        assertThat(snapshot.units().get(0).status()).isEqualTo(UnitStatus.UNTRANSLATED);
    }

    @Test
    void reviewRequiresATranslation() {
        TranslatableUnit unit = unit("Actors.json", "/1/name", "ハロルド", 1);

        assertThatThrownBy(unit::markReviewed).isInstanceOf(IllegalStateException.class);
    }

    private static ProjectState project(TranslatableUnit... units) {
        return new ProjectState(GAME, List.of(units), new Glossary(Map.of(), Map.of()), new ActorRegistry());
    }

    private static TranslatableUnit unit(String file, String path, String source, int order) {
        return new TranslatableUnit(new UnitId(file, path), source, ContentCategory.ACTOR_NAME, order, null, 1);
    }
}
