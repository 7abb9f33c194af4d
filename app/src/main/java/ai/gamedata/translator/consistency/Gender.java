package ai.gamedata.translator.consistency;

import java.util.Locale;

public enum Gender {
    UNKNOWN(""),
    FEMALE("female - use she/her"),
    MALE("male - use he/him");

    private final String pronounHint;

    Gender(String pronounHint) {
        this.pronounHint = pronounHint;
    }

    public String pronounHint() {
        return pronounHint;
    }

    public static Gender from(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "female", "f" -> FEMALE;
            case "male", "m" -> MALE;
            case "unknown", "" -> UNKNOWN;
            default -> throw new IllegalArgumentException("Unknown gender: " + raw);
        };
    }
}
