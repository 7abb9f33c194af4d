package ai.gamedata.translator.wordwrap;

import ai.gamedata.translator.project.UnitId;
import java.util.List;

/**
 * Outcome of a word wrap pass over a project.
 *
 * @param modified   units whose translation text changed
 * @param expanded   units that now need more lines than the source had
 * @param extraLines total number of lines added beyond the source line counts
 * @param overflow   units whose text no longer fits in a single message box
 */
public record WordWrapReport(int modified, int expanded, int extraLines, List<UnitId> overflow) {

    public WordWrapReport {
        overflow = overflow == null ? List.of() : List.copyOf(overflow);
    }
}
