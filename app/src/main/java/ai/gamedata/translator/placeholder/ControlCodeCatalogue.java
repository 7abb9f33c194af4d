package ai.gamedata.translator.placeholder;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises RPG Maker escape sequences, inline tags and format specifiers. Alternatives are tried in
 * order, so the namebox and color forms win over the generic parameterised form.
 */
public final class ControlCodeCatalogue {

    private static final Pattern CODES = Pattern.compile(
            "(?<namebox>\\\\[Nn]<(?=[^<>\\r\\n]*>))"
                    + "|(?<color>\\\\[Cc]\\[(?<colorArg>\\d+)\\])"
                    + "|(?<param>\\\\[A-Za-z]{1,16}\\[[^\\]\\r\\n]*\\])"
                    + "|(?<angle>\\\\[A-Za-z]{1,16}<[^<>\\r\\n]*>)"
                    + "|(?<symbol>\\\\[{}$.|!><^\\\\])"
                    + "|(?<bare>\\\\[A-Za-z]{1,3}(?![A-Za-z\\[<]))"
                    + "|(?<tag><[A-Za-z/][^<>\\r\\n]{0,40}>)"
                    + "|(?<format>%\\d+)");

    private static final ControlCodeCatalogue DEFAULT = new ControlCodeCatalogue();

    public static ControlCodeCatalogue defaultCatalogue() {
        return DEFAULT;
    }

    public List<CodeMatch> scan(String text) {
        List<CodeMatch> matches = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return matches;
        }
        Matcher matcher = CODES.matcher(text);
        while (matcher.find()) {
            matches.add(new CodeMatch(matcher.start(), matcher.end(), matcher.group(), kindOf(matcher), argumentOf(matcher)));
        }
        return matches;
    }

    /**
     * Text with every control sequence removed, used for visible-length measurements.
     */
    public String strip(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return CODES.matcher(text).replaceAll("");
    }

    private static CodeKind kindOf(Matcher matcher) {
        if (matcher.group("namebox") != null) {
            return CodeKind.NAMEBOX_OPEN;
        }
        if (matcher.group("color") != null) {
            return CodeKind.COLOR;
        }
        if (matcher.group("param") != null) {
            return CodeKind.PARAMETERIZED;
        }
        if (matcher.group("angle") != null) {
            return CodeKind.ANGLE_PARAMETERIZED;
        }
        if (matcher.group("symbol") != null) {
            return CodeKind.SYMBOL;
        }
        if (matcher.group("bare") != null) {
            return CodeKind.BARE_LETTER;
        }
        if (matcher.group("tag") != null) {
            return CodeKind.INLINE_TAG;
        }
        return CodeKind.FORMAT_SPECIFIER;
    }

    private static int argumentOf(Matcher matcher) {
        String argument = matcher.group("colorArg");
        if (argument == null) {
            return -1;
        }
        try {
            return Integer.parseInt(argument);
        } catch (NumberFormatException ex) {
            return Integer.MAX_VALUE;
        }
    }
}
