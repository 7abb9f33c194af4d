package ai.gamedata.translator.translate;

import java.util.Locale;

/**
 * Direction of a translation call: source to target, or refinement of an existing target text.
 */
public enum PassMode {
    TRANSLATE,
    POLISH;

    public static PassMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TRANSLATE;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "translate" -> TRANSLATE;
            case "polish" -> POLISH;
            default -> throw new IllegalArgumentException("Unsupported batch mode: " + raw);
        };
    }
}
