package ai.gamedata.translator.codec;

import ai.gamedata.translator.consistency.ActorRecord;
import ai.gamedata.translator.consistency.ActorRegistry;
import ai.gamedata.translator.consistency.Gender;
import ai.gamedata.translator.consistency.GenderDetector;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the actor registry from {@code Actors.json}, guessing genders from profile, nickname and note.
 */
public class ActorScanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ActorScanner.class);

    private final GenderDetector genderDetector;

    public ActorScanner() {
        this(new GenderDetector());
    }

    public ActorScanner(GenderDetector genderDetector) {
        this.genderDetector = Objects.requireNonNull(genderDetector, "genderDetector");
    }

    public ActorRegistry scan(DocumentSet documents) {
        ActorRegistry registry = new ActorRegistry();
        documents.document(ExtractionWhitelist.ACTORS_FILE).ifPresent(document -> {
            for (JsonNode actor : document.root()) {
                int id = actor.path("id").asInt(0);
                if (!actor.isObject() || id <= 0) {
                    continue;
                }
                String name = actor.path("name").asText("");
                String nickname = actor.path("nickname").asText("");
                String profile = actor.path("profile").asText("");
                Gender gender = genderDetector.detect(profile, nickname, actor.path("note").asText(""));
                registry.register(new ActorRecord(id, name, nickname, profile, gender, false));
            }
        });
        LOGGER.info("Registered {} actor(s)", registry.actors().size());
        return registry;
    }
}
