package ai.gamedata.translator.placeholder;

import java.util.List;
import java.util.Objects;

/**
 * Unmasked text plus the tokens the translation had dropped.
 */
public record UnmaskResult(String text, List<String> missingTokens) {

    public UnmaskResult {
        Objects.requireNonNull(text, "text");
        missingTokens = List.copyOf(missingTokens);
    }

    public boolean complete() {
        return missingTokens.isEmpty();
    }
}
