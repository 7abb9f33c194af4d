package ai.gamedata.translator.placeholder;

/**
 * One control sequence found in a text, with its half-open character range.
 */
public record CodeMatch(int start, int end, String text, CodeKind kind, int argument) {

    public boolean covers(int position) {
        return position >= start && position < end;
    }
}
