package ai.gamedata.translator.writer;

import java.util.Locale;

/**
 * What to do when a translation has more lines than the command run it replaces.
 */
public enum SegmentOverflowPolicy {
    /** Keep the command count and join the excess lines into the last segment. */
    MERGE_INTO_LAST,
    /** Insert additional text commands after the run. */
    INSERT_COMMANDS;

    public static SegmentOverflowPolicy from(String raw) {
        if (raw == null || raw.isBlank()) {
            return MERGE_INTO_LAST;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "merge", "merge_into_last", "merge-into-last" -> MERGE_INTO_LAST;
            case "insert", "insert_commands", "insert-commands" -> INSERT_COMMANDS;
            default -> throw new IllegalArgumentException("Unsupported segment overflow policy: " + raw);
        };
    }
}
