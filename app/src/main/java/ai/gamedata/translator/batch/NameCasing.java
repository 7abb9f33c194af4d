package ai.gamedata.translator.batch;

import java.util.Locale;
import java.util.Set;

/**
 * Title case for translated names: every word capitalized except articles, conjunctions and short
 * prepositions, which stay lowercase unless they open the name.
 */
final class NameCasing {

    private static final Set<String> SMALL_WORDS = Set.of(
            "a", "an", "the", "of", "in", "on", "at", "to", "for", "and",
            "or", "but", "nor", "by", "with", "from", "as", "is", "vs");

    private NameCasing() {
    }

    static String titleCase(String text) {
        String[] words = text.split(" ", -1);
        StringBuilder result = new StringBuilder(text.length());
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                result.append(' ');
            }
            String word = words[i];
            if (word.isEmpty()) {
                continue;
            }
            if (i == 0 || !SMALL_WORDS.contains(word.toLowerCase(Locale.ROOT))) {
                int first = word.codePointAt(0);
                result.appendCodePoint(Character.toUpperCase(first)).append(word, Character.charCount(first), word.length());
            } else {
                result.append(word.toLowerCase(Locale.ROOT));
            }
        }
        return result.toString();
    }
}
