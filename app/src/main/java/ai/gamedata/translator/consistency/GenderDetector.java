package ai.gamedata.translator.consistency;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword heuristic that guesses an actor's gender from profile, nickname and note text.
 */
public final class GenderDetector {

    private static final Pattern FEMALE = Pattern.compile(
            "彼女|お姉|少女|王女|巫女|メイド|おかあ|女|姫|嬢|娘|母|姉|妹|妻"
                    + "|\\b(?:actress|female|girl|woman|princess|queen|lady|witch|priestess|maid)\\b");
    private static final Pattern MALE = Pattern.compile(
            "おとうさん|少年|勇者|騎士|王子|息子|男|父|兄|弟|夫|彼(?!女)"
                    + "|\\b(?:actor|male|boy|man|prince|king|knight|hero|lord)\\b");

    public Gender detect(String... texts) {
        StringBuilder combined = new StringBuilder();
        for (String text : texts) {
            if (text != null) {
                combined.append(text).append('\n');
            }
        }
        String haystack = combined.toString().toLowerCase(Locale.ROOT);
        int femaleScore = count(FEMALE, haystack);
        int maleScore = count(MALE, haystack);
        if (femaleScore > maleScore) {
            return Gender.FEMALE;
        }
        if (maleScore > femaleScore) {
            return Gender.MALE;
        }
        return Gender.UNKNOWN;
    }

    private static int count(Pattern pattern, String haystack) {
        Matcher matcher = pattern.matcher(haystack);
        int hits = 0;
        while (matcher.find()) {
            hits++;
        }
        return hits;
    }
}
