package ai.gamedata.translator.consistency;

import java.util.Objects;

/**
 * Shared consistency state read by the context assembler and updated by workers.
 */
public record ConsistencyStore(Glossary glossary, TranslationMemory memory, ActorRegistry actors) {

    public ConsistencyStore {
        Objects.requireNonNull(glossary, "glossary");
        Objects.requireNonNull(memory, "memory");
        Objects.requireNonNull(actors, "actors");
    }
}
