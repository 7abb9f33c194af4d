package ai.gamedata.translator.batch;

import ai.gamedata.translator.codec.ExtractionWhitelist;
import ai.gamedata.translator.project.TranslatableUnit;
import java.util.Locale;

/**
 * Which part of the game a batch works on. Database scope covers the database tables and System.json.
 */
public enum BatchScope {
    ALL,
    DATABASE,
    DIALOGUE;

    public boolean includes(TranslatableUnit unit) {
        return switch (this) {
            case ALL -> true;
            case DATABASE -> isDatabaseFile(unit.id().fileId());
            case DIALOGUE -> !isDatabaseFile(unit.id().fileId());
        };
    }

    /**
     * Name propagation into the glossary is wanted whenever database names are being translated.
     */
    public boolean autoGlossary() {
        return this != DIALOGUE;
    }

    private static boolean isDatabaseFile(String fileId) {
        return ExtractionWhitelist.SYSTEM_FILE.equals(fileId) || !ExtractionWhitelist.databaseFields(fileId).isEmpty();
    }

    public static BatchScope from(String raw) {
        if (raw == null || raw.isBlank()) {
            return ALL;
        }
        return BatchScope.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
