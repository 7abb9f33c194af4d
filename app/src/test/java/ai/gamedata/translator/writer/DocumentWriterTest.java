package ai.gamedata.translator.writer;

import static org.assertj.core.api.Assertions.assertThat;

import ai.gamedata.translator.codec.GameDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesOriginalBytesForUnmodifiedDocuments() throws Exception {
        byte[] raw = "[null,{\"id\":1,\"name\":\"ポーション\"}]".getBytes(StandardCharsets.UTF_8);
        GameDocument document = new GameDocument("Items.json", new ObjectMapper().readTree(raw), raw);

        new DocumentWriter().write(tempDir.resolve("data"), document);

        assertThat(Files.readAllBytes(tempDir.resolve("data/Items.json"))).isEqualTo(raw);
    }

    @Test
    void replacesExistingFileWithoutLeavingTemporaries() throws Exception {
        Path data = Files.createDirectories(tempDir.resolve("data"));
        Files.writeString(data.resolve("System.json"), "{\"gameTitle\":\"勇者の旅\"}", StandardCharsets.UTF_8);
        ObjectNode root = new ObjectMapper().createObjectNode().put("gameTitle", "Hero's Journey");

        new DocumentWriter().write(data, GameDocument.modified("System.json", root));

        assertThat(Files.readString(data.resolve("System.json"), StandardCharsets.UTF_8)).contains("Hero's Journey");
        try (Stream<Path> files = Files.list(data)) {
            assertThat(files).extracting(path -> path.getFileName().toString()).containsExactly("System.json");
        }
    }
}
