package ai.gamedata.translator.context;

import java.util.Objects;

/**
 * A recently translated pair, both sides in masked form.
 */
public record HistoryEntry(String source, String translation) {

    public HistoryEntry {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(translation, "translation");
    }
}
