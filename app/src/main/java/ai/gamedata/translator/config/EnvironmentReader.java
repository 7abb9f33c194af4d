package ai.gamedata.translator.config;

import java.util.Optional;

/**
 * Source of the {@code LLM_*}, {@code TRANSLATION_*} and related settings.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /** Returns the trimmed value, treating blank values as unset. */
    default Optional<String> nonBlank(String key) {
        return get(key)
                .filter(value -> !value.isBlank())
                .map(String::trim);
    }
}
