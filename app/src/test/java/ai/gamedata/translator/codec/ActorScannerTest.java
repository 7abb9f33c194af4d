package ai.gamedata.translator.codec;

import static org.assertj.core.api.Assertions.assertThat;

import ai.gamedata.translator.GameFixture;
import ai.gamedata.translator.consistency.ActorRegistry;
import ai.gamedata.translator.consistency.Gender;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ActorScannerTest {

    @TempDir
    Path tempDir;

    @Test
    void registersActorsWithDetectedGender() {
        Path data = GameFixture.copyTo(tempDir).resolve("data");

        ActorRegistry registry = new ActorScanner().scan(new GameDataReader().read(data));

        assertThat(registry.actors()).hasSize(2);
        assertThat(registry.find(1).orElseThrow().name()).isEqualTo("ハロルド");
        assertThat(registry.genderOf("actor:1")).isEqualTo(Gender.MALE);
        assertThat(registry.genderOf("テレーゼ")).isEqualTo(Gender.FEMALE);
        assertThat(registry.genderOf("nobody")).isEqualTo(Gender.UNKNOWN);
    }
}
