package ai.gamedata.translator.consistency;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Actors of the game keyed by database id.
 */
public final class ActorRegistry {

    private static final String ACTOR_REFERENCE_PREFIX = "actor:";

    private final Map<Integer, ActorRecord> actors = new TreeMap<>();

    public ActorRegistry() {
    }

    public ActorRegistry(Collection<ActorRecord> records) {
        records.forEach(this::register);
    }

    public synchronized void register(ActorRecord record) {
        actors.put(record.id(), record);
    }

    public synchronized Optional<ActorRecord> find(int id) {
        return Optional.ofNullable(actors.get(id));
    }

    public synchronized Optional<ActorRecord> findByName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String trimmed = name.strip();
        return actors.values().stream()
                .filter(actor -> actor.name().equals(trimmed))
                .findFirst();
    }

    /**
     * Resolves a speaker reference, either {@code actor:<id>} or a display name.
     */
    public Optional<ActorRecord> resolveSpeaker(String speaker) {
        if (speaker == null) {
            return Optional.empty();
        }
        if (speaker.startsWith(ACTOR_REFERENCE_PREFIX)) {
            try {
                return find(Integer.parseInt(speaker.substring(ACTOR_REFERENCE_PREFIX.length())));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid actor reference: " + speaker, ex);
            }
        }
        return findByName(speaker);
    }

    public Gender genderOf(String speaker) {
        return resolveSpeaker(speaker).map(ActorRecord::gender).orElse(Gender.UNKNOWN);
    }

    public synchronized void overrideGender(int id, Gender gender) {
        ActorRecord current = actors.get(id);
        if (current == null) {
            throw new IllegalArgumentException("Unknown actor: " + id);
        }
        actors.put(id, current.withGender(gender, true));
    }

    public synchronized List<ActorRecord> actors() {
        return List.copyOf(actors.values());
    }

    public synchronized ActorRegistry copy() {
        return new ActorRegistry(actors.values());
    }

    public static String actorReference(int id) {
        return ACTOR_REFERENCE_PREFIX + id;
    }
}
