package ai.gamedata.translator.wordwrap;

import java.util.Optional;

/**
 * Window geometry values the operator configured explicitly. They take precedence over detected settings.
 */
public record WordWrapOverrides(Optional<Integer> charsPerLine, Optional<String> wrapTag) {

    public WordWrapOverrides {
        charsPerLine = charsPerLine == null ? Optional.empty() : charsPerLine;
        wrapTag = wrapTag == null ? Optional.empty() : wrapTag.filter(tag -> !tag.isBlank());
        if (charsPerLine.isPresent() && charsPerLine.get() < 10) {
            throw new IllegalArgumentException("charsPerLine must be at least 10");
        }
    }

    public static WordWrapOverrides none() {
        return new WordWrapOverrides(Optional.empty(), Optional.empty());
    }

    public WordWrapSettings applyTo(WordWrapSettings detected) {
        return new WordWrapSettings(
                charsPerLine.orElse(detected.charsPerLine()),
                detected.maxLines(),
                wrapTag.isPresent() ? wrapTag : detected.wrapTag());
    }
}
