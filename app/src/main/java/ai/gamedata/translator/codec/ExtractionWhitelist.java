package ai.gamedata.translator.codec;

import ai.gamedata.translator.codec.CommandRule.Shape;
import ai.gamedata.translator.project.ContentCategory;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Static tables of which fields and command parameters carry display text. Anything not listed is
 * never touched.
 */
public final class ExtractionWhitelist {

    public static final String SYSTEM_FILE = "System.json";
    public static final String COMMON_EVENTS_FILE = "CommonEvents.json";
    public static final String TROOPS_FILE = "Troops.json";
    public static final String ACTORS_FILE = "Actors.json";

    public static final int CODE_SHOW_TEXT = 101;
    public static final int CODE_SHOW_CHOICES = 102;
    public static final int CODE_TEXT_LINE = 401;
    public static final int CODE_SCROLL_LINE = 405;
    public static final int CODE_PLUGIN_COMMAND_MZ = 357;

    private static final Pattern MAP_FILE = Pattern.compile("Map\\d{3,}\\.json");

    private static final Map<String, List<FieldRule>> DATABASE_FIELDS = new LinkedHashMap<>();
    private static final Map<Integer, CommandRule> COMMAND_RULES = new LinkedHashMap<>();
    private static final Map<String, List<String>> MZ_PLUGIN_KEYS = new LinkedHashMap<>();

    static final List<String> SYSTEM_TERM_LISTS = List.of("basic", "commands", "params");
    static final List<String> SYSTEM_TYPE_LISTS = List.of("elements", "skillTypes", "weaponTypes", "armorTypes", "equipTypes");

    static {
        DATABASE_FIELDS.put(ACTORS_FILE, List.of(
                new FieldRule("name", ContentCategory.ACTOR_NAME),
                new FieldRule("nickname", ContentCategory.ACTOR_NICKNAME),
                new FieldRule("profile", ContentCategory.ACTOR_PROFILE)));
        DATABASE_FIELDS.put("Classes.json", List.of(new FieldRule("name", ContentCategory.DATABASE_NAME)));
        DATABASE_FIELDS.put("Skills.json", List.of(
                new FieldRule("name", ContentCategory.DATABASE_NAME),
                new FieldRule("description", ContentCategory.DATABASE_DESCRIPTION),
                new FieldRule("message1", ContentCategory.BATTLE_MESSAGE),
                new FieldRule("message2", ContentCategory.BATTLE_MESSAGE)));
        for (String table : List.of("Items.json", "Weapons.json", "Armors.json")) {
            DATABASE_FIELDS.put(table, List.of(
                    new FieldRule("name", ContentCategory.DATABASE_NAME),
                    new FieldRule("description", ContentCategory.DATABASE_DESCRIPTION)));
        }
        DATABASE_FIELDS.put("States.json", List.of(
                new FieldRule("name", ContentCategory.DATABASE_NAME),
                new FieldRule("message1", ContentCategory.BATTLE_MESSAGE),
                new FieldRule("message2", ContentCategory.BATTLE_MESSAGE),
                new FieldRule("message3", ContentCategory.BATTLE_MESSAGE),
                new FieldRule("message4", ContentCategory.BATTLE_MESSAGE)));
        DATABASE_FIELDS.put("Enemies.json", List.of(new FieldRule("name", ContentCategory.DATABASE_NAME)));
        DATABASE_FIELDS.put(TROOPS_FILE, List.of(new FieldRule("name", ContentCategory.DATABASE_NAME)));

        register(new CommandRule(CODE_SHOW_TEXT, 4, ContentCategory.SPEAKER_NAME, Shape.STRING));
        register(new CommandRule(CODE_TEXT_LINE, 0, ContentCategory.DIALOGUE, Shape.LINE_BLOCK));
        register(new CommandRule(CODE_SCROLL_LINE, 0, ContentCategory.SCROLL_TEXT, Shape.LINE_BLOCK));
        register(new CommandRule(CODE_SHOW_CHOICES, 0, ContentCategory.CHOICE, Shape.STRING_LIST));
        register(new CommandRule(320, 1, ContentCategory.ACTOR_NAME, Shape.STRING));
        register(new CommandRule(324, 1, ContentCategory.ACTOR_NICKNAME, Shape.STRING));
        register(new CommandRule(325, 1, ContentCategory.ACTOR_PROFILE, Shape.STRING));
        register(new CommandRule(CODE_PLUGIN_COMMAND_MZ, 3, ContentCategory.PLUGIN_TEXT, Shape.PLUGIN_ARGUMENTS));

        MZ_PLUGIN_KEYS.put("LL_InfoPopupWIndow", List.of("messageText"));
        MZ_PLUGIN_KEYS.put("QuestSystem", List.of("DetailNote"));
        MZ_PLUGIN_KEYS.put("BalloonInBattle", List.of("text"));
        MZ_PLUGIN_KEYS.put("MNKR_CommonPopupCoreMZ", List.of("text"));
        MZ_PLUGIN_KEYS.put("DestinationWindow", List.of("destination"));
        MZ_PLUGIN_KEYS.put("_TMLogWindowMZ", List.of("text"));
        MZ_PLUGIN_KEYS.put("TorigoyaMZ_NotifyMessage", List.of("message"));
        MZ_PLUGIN_KEYS.put("TorigoyaMZ_NotifyMessage_CommandMessage", List.of("message"));
        MZ_PLUGIN_KEYS.put("SoR_GabWindow", List.of("arg1"));
        MZ_PLUGIN_KEYS.put("DarkPlasma_CharacterText", List.of("text"));
        MZ_PLUGIN_KEYS.put("DTextPicture", List.of("text"));
        MZ_PLUGIN_KEYS.put("TextPicture", List.of("text"));
        MZ_PLUGIN_KEYS.put("LogWindow", List.of("text"));
        MZ_PLUGIN_KEYS.put("BattleLogOutput", List.of("message"));
        MZ_PLUGIN_KEYS.put("NUUN_SaveScreen", List.of("AnyName"));
        MZ_PLUGIN_KEYS.put("build/ARPG_Core", List.of("Text", "SkillByName"));
    }

    private ExtractionWhitelist() {
    }

    public static List<FieldRule> databaseFields(String fileId) {
        return DATABASE_FIELDS.getOrDefault(fileId, List.of());
    }

    public static CommandRule commandRule(int code) {
        return COMMAND_RULES.get(code);
    }

    public static List<String> pluginKeys(String pluginName) {
        return MZ_PLUGIN_KEYS.getOrDefault(pluginName, List.of());
    }

    public static boolean isMapFile(String fileId) {
        return MAP_FILE.matcher(fileId).matches();
    }

    /**
     * Whether the file carries any whitelisted text.
     */
    public static boolean isGameDataFile(String fileId) {
        return DATABASE_FIELDS.containsKey(fileId) || SYSTEM_FILE.equals(fileId)
                || COMMON_EVENTS_FILE.equals(fileId) || isMapFile(fileId);
    }

    /**
     * Document order: database tables in table order, then System, CommonEvents and maps.
     */
    public static int fileRank(String fileId) {
        int index = 0;
        for (String table : DATABASE_FIELDS.keySet()) {
            if (table.equals(fileId)) {
                return index;
            }
            index++;
        }
        if (SYSTEM_FILE.equals(fileId)) {
            return index;
        }
        if (COMMON_EVENTS_FILE.equals(fileId)) {
            return index + 1;
        }
        return index + 2;
    }

    private static void register(CommandRule rule) {
        COMMAND_RULES.put(rule.code(), rule);
    }

    public record FieldRule(String field, ContentCategory category) {
    }
}
