package ai.gamedata.translator.codec;

import java.util.regex.Pattern;

/**
 * Detection of source-language (Japanese) script.
 */
public final class SourceScript {

    private static final Pattern SOURCE = Pattern.compile("[\\u3040-\\u309F\\u30A0-\\u30FF\\u4E00-\\u9FFF\\uFF00-\\uFFEF]");
    private static final Pattern RESIDUAL = Pattern.compile("[\\u3040-\\u309F\\u30A0-\\u30FF\\u4E00-\\u9FFF]");

    private SourceScript() {
    }

    /**
     * Whether the text is worth extracting: kana, kanji or full-width forms.
     */
    public static boolean containsSource(String text) {
        return text != null && SOURCE.matcher(text).find();
    }

    /**
     * Whether a translation still carries kana or kanji. Full-width punctuation is tolerated.
     */
    public static boolean containsResidualSource(String text) {
        return text != null && RESIDUAL.matcher(text).find();
    }
}
