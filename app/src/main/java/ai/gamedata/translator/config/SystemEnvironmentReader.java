package ai.gamedata.translator.config;

import java.util.Map;
import java.util.Optional;

/**
 * Reads settings from the process environment as it was when the reader was created.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    private final Map<String, String> snapshot;

    public SystemEnvironmentReader() {
        this.snapshot = Map.copyOf(System.getenv());
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(snapshot.get(key));
    }
}
