package ai.gamedata.translator.wordwrap;

import java.util.List;

/**
 * Window geometry detected for a game.
 *
 * @param messageWidth    message window width in pixels
 * @param fontSize        message font size in pixels
 * @param settings        wrapping settings derived from the geometry
 * @param detectedPlugins enabled plugins that influence the message window
 */
public record PluginAnalysis(int messageWidth, int fontSize, WordWrapSettings settings, List<String> detectedPlugins) {

    public PluginAnalysis {
        detectedPlugins = detectedPlugins == null ? List.of() : List.copyOf(detectedPlugins);
    }

    public static PluginAnalysis defaults() {
        return new PluginAnalysis(PluginAnalyzer.DEFAULT_MESSAGE_WIDTH, PluginAnalyzer.DEFAULT_FONT_SIZE,
                WordWrapSettings.defaults(), List.of());
    }

    public String summary() {
        StringBuilder summary = new StringBuilder()
                .append("width ").append(messageWidth).append("px, font ").append(fontSize).append("px, ~")
                .append(settings.charsPerLine()).append(" chars per line, ")
                .append(settings.maxLines()).append(" lines per box");
        if (!detectedPlugins.isEmpty()) {
            summary.append(", plugins ").append(String.join(", ", detectedPlugins));
        }
        settings.wrapTag().ifPresent(tag -> summary.append(", wrap tag ").append(tag));
        return summary.toString();
    }
}
