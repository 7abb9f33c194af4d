package ai.gamedata.translator.consistency;

import java.util.Locale;

public enum GlossaryLayer {
    GENERAL,
    PROJECT;

    public static GlossaryLayer from(String raw) {
        return GlossaryLayer.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
