package ai.gamedata.translator.config;

import java.util.Optional;

/**
 * Holds credentials for the hosted model provider.
 */
public record Secrets(Optional<String> geminiApiKey) {

    public Secrets {
        geminiApiKey = geminiApiKey == null ? Optional.empty() : geminiApiKey.filter(value -> !value.isBlank());
    }

    public static Secrets none() {
        return new Secrets(Optional.empty());
    }

    @Override
    public String toString() {
        return "Secrets{geminiApiKey=" + (geminiApiKey.isPresent() ? "***" : "<unset>") + "}";
    }
}
