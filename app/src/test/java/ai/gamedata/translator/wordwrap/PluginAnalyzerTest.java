package ai.gamedata.translator.wordwrap;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PluginAnalyzerTest {

    @TempDir
    Path game;

    private final PluginAnalyzer analyzer = new PluginAnalyzer();

    @Test
    void enabledYanflyMessageCoreSetsWidthRowsAndWrapTag() throws Exception {
        install("yep", game.resolve("js"));
        Path data = Files.createDirectories(game.resolve("data"));
        Files.writeString(data.resolve("System.json"), "{\"advanced\":{\"fontSize\":26}}", StandardCharsets.UTF_8);

        PluginAnalysis analysis = analyzer.analyze(game, data);

        assertThat(analysis.detectedPlugins()).containsExactly("YEP_MessageCore");
        assertThat(analysis.messageWidth()).isEqualTo(1008);
        assertThat(analysis.fontSize()).isEqualTo(26);
        assertThat(analysis.settings().charsPerLine()).isEqualTo(67);
        assertThat(analysis.settings().maxLines()).isEqualTo(3);
        assertThat(analysis.settings().wrapTag()).contains("<WordWrap>");
        assertThat(analysis.summary()).contains("YEP_MessageCore", "<WordWrap>");
    }

    @Test
    void pluginWithoutWrapSupportOnlyChangesTheWidth() throws Exception {
        install("cgmz", game.resolve("www").resolve("js"));

        PluginAnalysis analysis = analyzer.analyze(game, Files.createDirectories(game.resolve("www").resolve("data")));

        assertThat(analysis.detectedPlugins()).containsExactly("CGMZ_MessageSystem");
        assertThat(analysis.fontSize()).isEqualTo(28);
        assertThat(analysis.settings().charsPerLine()).isEqualTo(37);
        assertThat(analysis.settings().maxLines()).isEqualTo(4);
        assertThat(analysis.settings().wrapTag()).isEmpty();
    }

    @Test
    void gameWithoutPluginsKeepsDefaults() {
        assertThat(analyzer.analyze(game, null)).isEqualTo(PluginAnalysis.defaults());
        assertThat(PluginAnalysis.defaults().settings()).isEqualTo(WordWrapSettings.defaults());
    }

    @Test
    void unreadablePluginListFallsBackToDefaults() throws Exception {
        Path js = Files.createDirectories(game.resolve("js"));
        Files.writeString(js.resolve("plugins.js"), "var $plugins = [{\"name\": ];", StandardCharsets.UTF_8);

        assertThat(analyzer.analyze(game, null).settings()).isEqualTo(WordWrapSettings.defaults());
    }

    @Test
    void explicitOverridesWinOverDetectedValues() throws Exception {
        install("yep", game.resolve("js"));
        WordWrapSettings detected = analyzer.analyze(game, null).settings();

        WordWrapSettings settings = new WordWrapOverrides(Optional.of(40), Optional.empty())
                .applyTo(detected);

        assertThat(settings.charsPerLine()).isEqualTo(40);
        assertThat(settings.maxLines()).isEqualTo(3);
        assertThat(settings.wrapTag()).contains("<WordWrap>");
    }

    static void install(String fixture, Path jsDirectory) throws IOException {
        Files.createDirectories(jsDirectory);
        Files.copy(fixture(fixture), jsDirectory.resolve("plugins.js"));
    }

    private static Path fixture(String name) {
        URL url = PluginAnalyzerTest.class.getResource("/fixtures/plugins/" + name + "/plugins.js");
        if (url == null) {
            throw new IllegalStateException("Missing plugins fixture " + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
