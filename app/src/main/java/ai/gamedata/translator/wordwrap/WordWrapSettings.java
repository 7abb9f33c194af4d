package ai.gamedata.translator.wordwrap;

import java.util.Optional;

/**
 * Message window geometry used when re-wrapping translations.
 *
 * @param charsPerLine visible characters that fit on one line of the message window
 * @param maxLines     lines shown by one message box before the game paginates
 * @param wrapTag      tag understood by an installed word wrap plugin, if any
 */
public record WordWrapSettings(int charsPerLine, int maxLines, Optional<String> wrapTag) {

    public static final int DEFAULT_CHARS_PER_LINE = 55;
    public static final int DEFAULT_MAX_LINES = 4;

    public WordWrapSettings {
        if (charsPerLine < 10) {
            throw new IllegalArgumentException("charsPerLine must be at least 10");
        }
        if (maxLines < 1) {
            throw new IllegalArgumentException("maxLines must be at least 1");
        }
        wrapTag = wrapTag == null ? Optional.empty() : wrapTag.filter(tag -> !tag.isBlank());
    }

    public static WordWrapSettings defaults() {
        return new WordWrapSettings(DEFAULT_CHARS_PER_LINE, DEFAULT_MAX_LINES, Optional.empty());
    }

    public WordWrapSettings withWrapTag(String tag) {
        return new WordWrapSettings(charsPerLine, maxLines, Optional.ofNullable(tag));
    }
}
