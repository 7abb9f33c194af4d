package ai.gamedata.translator.project;

import java.util.Locale;

/**
 * Persisted lifecycle state of a {@link TranslatableUnit}.
 */
public enum UnitStatus {
    UNTRANSLATED,
    TRANSLATED,
    REVIEWED,
    SKIPPED,
    FAILED;

    /**
     * Units in these states are left alone by a translate batch.
     */
    public boolean isSettled() {
        return this == TRANSLATED || this == REVIEWED || this == SKIPPED;
    }

    public boolean carriesTranslation() {
        return this == TRANSLATED || this == REVIEWED;
    }

    public static UnitStatus from(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNTRANSLATED;
        }
        return UnitStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
