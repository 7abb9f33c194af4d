package ai.gamedata.translator.batch;

import java.util.Locale;

public enum BatchOrdering {
    /** Document order of the units. */
    DOCUMENT,
    /** Female speakers, then male speakers, then other dialogue, then everything else. */
    ACTOR_GROUPED;

    public static BatchOrdering from(String raw) {
        if (raw == null || raw.isBlank()) {
            return DOCUMENT;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "document" -> DOCUMENT;
            case "actor", "actor_grouped", "actor-grouped" -> ACTOR_GROUPED;
            default -> throw new IllegalArgumentException("Unsupported batch ordering: " + raw);
        };
    }
}
