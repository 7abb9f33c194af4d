package ai.gamedata.translator.consistency;

import java.util.Objects;

public record ActorRecord(int id, String name, String nickname, String profile, Gender gender, boolean genderOverridden) {

    public ActorRecord {
        if (id <= 0) {
            throw new IllegalArgumentException("Actor id must be positive");
        }
        name = name == null ? "" : name;
        nickname = nickname == null ? "" : nickname;
        profile = profile == null ? "" : profile;
        Objects.requireNonNull(gender, "gender");
    }

    public ActorRecord withGender(Gender newGender, boolean overridden) {
        return new ActorRecord(id, name, nickname, profile, newGender, overridden);
    }

    /**
     * Context line such as {@code Actor 1: Harold [male - use he/him] aka "Hero" - profile}.
     */
    public String describe() {
        StringBuilder line = new StringBuilder("Actor ").append(id).append(": ").append(name);
        if (gender != Gender.UNKNOWN) {
            line.append(" [").append(gender.pronounHint()).append(']');
        }
        if (!nickname.isBlank()) {
            line.append(" aka \"").append(nickname).append('"');
        }
        if (!profile.isBlank()) {
            line.append(" - ").append(profile.replace('\n', ' ').strip());
        }
        return line.toString();
    }
}
