package ai.gamedata.translator.project;

import static org.assertj.core.api.Assertions.assertThat;

import ai.gamedata.translator.GameFixture;
import ai.gamedata.translator.codec.ActorScanner;
import ai.gamedata.translator.codec.GameDataCodec;
import ai.gamedata.translator.codec.GameDataReader;
import ai.gamedata.translator.consistency.Gender;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectOpenerTest {

    @TempDir
    Path tempDir;

    private Path game;
    private final JsonProjectStore store = new JsonProjectStore();
    private ProjectOpener opener;

    @BeforeEach
    void setUp() {
        game = GameFixture.copyTo(tempDir.resolve("game"));
        opener = new ProjectOpener(new GameDataReader(), new GameDataCodec(), new ActorScanner(), store);
    }

    @Test
    void opensFreshProjectFromGameData() {
        ProjectState project = opener.open(game, game.resolve("translation_project.json"), Map.of("村", "Village"));

        assertThat(project.units()).hasSize(GameFixture.UNIT_COUNT);
        assertThat(project.translatedCount()).isZero();
        assertThat(project.glossary().lookup("村")).contains("Village");
        assertThat(project.actors().genderOf("actor:1")).isEqualTo(Gender.MALE);
        assertThat(project.actors().genderOf("テレーゼ")).isEqualTo(Gender.FEMALE);
    }

    @Test
    void reopeningResumesSavedProgress() {
        Path statePath = game.resolve("translation_project.json");
        ProjectState first = opener.open(game, statePath, Map.of());
        UnitId greeting = new UnitId(GameFixture.MAP, GameFixture.GREETING_PATH);
        first.unit(greeting).orElseThrow().markTranslated("Good morning");
        store.save(first, statePath);

        ProjectState reopened = opener.open(game, statePath, Map.of());

        assertThat(reopened.unit(greeting).orElseThrow().translation()).isEqualTo("Good morning");
        assertThat(reopened.translatedCount()).isEqualTo(1);
    }
}
