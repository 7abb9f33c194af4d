package ai.gamedata.translator.export;

import static org.assertj.core.api.Assertions.assertThat;

import ai.gamedata.translator.GameFixture;
import ai.gamedata.translator.codec.GameDataCodec;
import ai.gamedata.translator.codec.GameDataReader;
import ai.gamedata.translator.consistency.ActorRegistry;
import ai.gamedata.translator.consistency.Glossary;
import ai.gamedata.translator.project.ProjectState;
import ai.gamedata.translator.project.TranslatableUnit;
import ai.gamedata.translator.project.UnitId;
import ai.gamedata.translator.wordwrap.WordWrapProcessor;
import ai.gamedata.translator.wordwrap.WordWrapSettings;
import ai.gamedata.translator.writer.DocumentWriter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExportServiceTest {

    @TempDir
    Path tempDir;

    private Path data;
    private ProjectState project;
    private ExportService exportService;

    @BeforeEach
    void setUp() {
        Path game = GameFixture.copyTo(tempDir);
        data = game.resolve("data");
        GameDataReader reader = new GameDataReader();
        GameDataCodec codec = new GameDataCodec();
        project = new ProjectState(game, codec.extract(reader.read(data)), new Glossary(), new ActorRegistry());
        exportService = new ExportService(reader, codec, new DocumentWriter());
    }

    @Test
    void firstExportCreatesBackupAndWritesTranslations() throws Exception {
        project.unit(new UnitId(GameFixture.MAP, GameFixture.GREETING_PATH)).orElseThrow().markTranslated("Good morning");

        ExportReport report = exportService.export(project, data);

        assertThat(report.backupCreated()).isTrue();
        assertThat(report.writeReport().appliedUnits()).isEqualTo(1);
        assertThat(report.writeReport().touchedFiles()).containsExactly(GameFixture.MAP);
        assertThat(Files.readString(data.resolve(GameFixture.MAP), StandardCharsets.UTF_8))
                .contains("Good morning")
                .doesNotContain("おはよう");
        assertThat(Files.readAllBytes(data.resolve("Items.json"))).isEqualTo(GameFixture.read("Items.json"));
        assertThat(Files.readAllBytes(tempDir.resolve("data_original").resolve(GameFixture.MAP)))
                .isEqualTo(GameFixture.read(GameFixture.MAP));
    }

    @Test
    void exportIsIdempotent() throws Exception {
        project.unit(new UnitId(GameFixture.MAP, GameFixture.GREETING_PATH)).orElseThrow().markTranslated("Good morning");
        exportService.export(project, data);
        byte[] first = Files.readAllBytes(data.resolve(GameFixture.MAP));

        ExportReport second = exportService.export(project, data);

        assertThat(second.backupCreated()).isFalse();
        assertThat(Files.readAllBytes(data.resolve(GameFixture.MAP))).isEqualTo(first);
    }

    @Test
    void untranslatedProjectExportsOriginalBytes() throws Exception {
        ExportReport report = exportService.export(project, data);

        assertThat(report.writeReport().appliedUnits()).isZero();
        for (String file : new String[] {"Actors.json", "Items.json", "System.json", "CommonEvents.json", GameFixture.MAP}) {
            assertThat(Files.readAllBytes(data.resolve(file))).as(file).isEqualTo(GameFixture.read(file));
        }
    }

    @Test
    void manuallyWrappedDialogueKeepsEachLineInItsOwnCommand() throws Exception {
        TranslatableUnit greeting = project.unit(new UnitId(GameFixture.MAP, GameFixture.GREETING_PATH)).orElseThrow();
        greeting.markTranslated("The weather is lovely today and the birds sing loudly over the hills.");
        new WordWrapProcessor(new WordWrapSettings(30, 4, Optional.empty())).applyAll(project.units());

        ExportReport report = exportService.export(project, data);

        assertThat(report.writeReport().lossyMerges()).isEmpty();
        assertThat(report.writeReport().insertedCommands()).isEqualTo(2);
        JsonNode list = new ObjectMapper().readTree(data.resolve(GameFixture.MAP).toFile()).at("/events/1/pages/0/list");
        assertThat(list.get(1).path("parameters").path(0).asText()).isEqualTo("The weather is lovely today");
        assertThat(list.get(2).path("parameters").path(0).asText()).isEqualTo("and the birds sing loudly over");
        assertThat(list.get(3).path("parameters").path(0).asText()).isEqualTo("the hills.");
        assertThat(list.get(2).path("code").asInt()).isEqualTo(401);
        assertThat(list.get(3).path("code").asInt()).isEqualTo(401);
        assertThat(list.get(4).path("code").asInt()).isEqualTo(101);
    }

    @Test
    void unwrappedOverflowStillMergesIntoTheLastLine() throws Exception {
        project.unit(new UnitId(GameFixture.MAP, GameFixture.GREETING_PATH)).orElseThrow()
                .markTranslated("Good\nmorning");

        ExportReport report = exportService.export(project, data);

        assertThat(report.writeReport().lossyMerges())
                .containsExactly(new UnitId(GameFixture.MAP, GameFixture.GREETING_PATH));
        JsonNode list = new ObjectMapper().readTree(data.resolve(GameFixture.MAP).toFile()).at("/events/1/pages/0/list");
        assertThat(list.get(1).path("parameters").path(0).asText()).isEqualTo("Good morning");
        assertThat(list.get(2).path("code").asInt()).isEqualTo(101);
    }
}
