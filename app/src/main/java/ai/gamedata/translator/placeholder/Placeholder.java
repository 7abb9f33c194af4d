package ai.gamedata.translator.placeholder;

import java.util.Objects;

/**
 * A masked control sequence. Spans also carry the closing sequence and get a second token.
 */
public record Placeholder(int index, String original, String closingOriginal) {

    static final char TOKEN_OPEN = '⟦';
    static final char TOKEN_CLOSE = '⟧';

    public Placeholder {
        if (index < 1) {
            throw new IllegalArgumentException("index must be positive");
        }
        Objects.requireNonNull(original, "original");
    }

    public static Placeholder single(int index, String original) {
        return new Placeholder(index, original, null);
    }

    public static Placeholder span(int index, String opening, String closing) {
        return new Placeholder(index, opening, Objects.requireNonNull(closing, "closing"));
    }

    public boolean isSpan() {
        return closingOriginal != null;
    }

    public String token() {
        return TOKEN_OPEN + Integer.toString(index) + TOKEN_CLOSE;
    }

    public String closingToken() {
        if (!isSpan()) {
            throw new IllegalStateException("Placeholder " + index + " is not a span");
        }
        return TOKEN_OPEN + "/" + index + TOKEN_CLOSE;
    }
}
