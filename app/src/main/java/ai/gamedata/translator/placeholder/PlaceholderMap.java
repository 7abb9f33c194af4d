package ai.gamedata.translator.placeholder;

import java.util.ArrayList;
import java.util.List;

public record PlaceholderMap(List<Placeholder> placeholders) {

    public static final PlaceholderMap EMPTY = new PlaceholderMap(List.of());

    public PlaceholderMap {
        placeholders = List.copyOf(placeholders);
    }

    public boolean isEmpty() {
        return placeholders.isEmpty();
    }

    public int size() {
        return placeholders.size();
    }

    /**
     * Every token the masked text contains, opening and closing alike.
     */
    public List<String> tokens() {
        List<String> tokens = new ArrayList<>();
        for (Placeholder placeholder : placeholders) {
            tokens.add(placeholder.token());
            if (placeholder.isSpan()) {
                tokens.add(placeholder.closingToken());
            }
        }
        return tokens;
    }

    /**
     * Original sequence a token stands for.
     */
    public String originalFor(String token) {
        for (Placeholder placeholder : placeholders) {
            if (placeholder.token().equals(token)) {
                return placeholder.original();
            }
            if (placeholder.isSpan() && placeholder.closingToken().equals(token)) {
                return placeholder.closingOriginal();
            }
        }
        throw new IllegalArgumentException("Unknown token " + token);
    }
}
