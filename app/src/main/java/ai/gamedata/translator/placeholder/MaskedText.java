package ai.gamedata.translator.placeholder;

import java.util.Objects;

public record MaskedText(String text, PlaceholderMap placeholders) {

    public MaskedText {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(placeholders, "placeholders");
    }
}
