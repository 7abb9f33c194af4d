package ai.gamedata.translator.translate;

import java.util.Locale;

/**
 * Where translations come from: the configured model, an echo of the source, or a tagged mock.
 */
public enum TranslationMode {
    PRODUCTION,
    DRY_RUN,
    MOCK;

    public static TranslationMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PRODUCTION;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "production", "prod" -> PRODUCTION;
            case "dry_run", "dryrun" -> DRY_RUN;
            case "mock" -> MOCK;
            default -> throw new IllegalArgumentException("Unsupported translation mode: " + raw);
        };
    }

    public boolean usesLanguageModel() {
        return this == PRODUCTION;
    }
}
