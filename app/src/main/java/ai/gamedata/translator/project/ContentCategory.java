package ai.gamedata.translator.project;

/**
 * Kind of game text a unit holds. Drives prompt hints, speaker grouping and auto-glossary eligibility.
 */
public enum ContentCategory {
    DIALOGUE("dialogue line", true, false),
    SCROLL_TEXT("scrolling story text", true, false),
    CHOICE("dialogue choice option", true, false),
    SPEAKER_NAME("speaker name shown in the message window", false, true),
    ACTOR_NAME("character name", false, true),
    ACTOR_NICKNAME("character title or nickname", false, true),
    ACTOR_PROFILE("character profile", false, false),
    DATABASE_NAME("item, skill, class or enemy name", false, true),
    DATABASE_DESCRIPTION("item or skill description", false, false),
    BATTLE_MESSAGE("battle log message", false, false),
    MAP_NAME("map display name", false, true),
    SYSTEM_TERM("menu or UI term", false, false),
    GAME_TITLE("game title", false, false),
    PLUGIN_TEXT("plugin display text", false, false);

    private final String label;
    private final boolean dialogue;
    private final boolean name;

    ContentCategory(String label, boolean dialogue, boolean name) {
        this.label = label;
        this.dialogue = dialogue;
        this.name = name;
    }

    public String label() {
        return label;
    }

    /**
     * Dialogue-like categories carry speaker context and are grouped by speaker gender.
     */
    public boolean isDialogue() {
        return dialogue;
    }

    /**
     * Name categories propagate their translation into the project glossary.
     */
    public boolean isName() {
        return name;
    }
}
