package ai.gamedata.translator.placeholder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Puts dropped tokens back into a translated text. A missing token goes right after the closest
 * preceding token that survived, else right before the closest following one; with no survivors it
 * is prepended unless it sat in the last 15% of the source.
 */
public class PlaceholderRepair {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlaceholderRepair.class);
    private static final double APPEND_THRESHOLD = 0.85;

    public String reinsert(String translated, String maskedSource, List<String> tokens) {
        List<String> ordered = new ArrayList<>(tokens);
        ordered.sort(Comparator.comparingInt(maskedSource::indexOf));
        String working = translated;
        for (int i = 0; i < ordered.size(); i++) {
            String token = ordered.get(i);
            if (working.contains(token)) {
                continue;
            }
            working = insert(working, token, ordered, i, maskedSource);
            LOGGER.debug("Reinserted dropped placeholder {}", token);
        }
        return working;
    }

    private static String insert(String working, String token, List<String> ordered, int position, String maskedSource) {
        for (int j = position - 1; j >= 0; j--) {
            String previous = ordered.get(j);
            int at = working.indexOf(previous);
            if (at >= 0) {
                int insertAt = at + previous.length();
                return working.substring(0, insertAt) + token + working.substring(insertAt);
            }
        }
        for (int j = position + 1; j < ordered.size(); j++) {
            int at = working.indexOf(ordered.get(j));
            if (at >= 0) {
                return working.substring(0, at) + token + working.substring(at);
            }
        }
        int sourceLength = Math.max(1, maskedSource.length());
        double ratio = (double) Math.max(0, maskedSource.indexOf(token)) / sourceLength;
        return ratio > APPEND_THRESHOLD ? working + token : token + working;
    }
}
